package com.smartfix.request.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.ClientHttpRequestFactories;
import org.springframework.boot.web.client.ClientHttpRequestFactorySettings;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.ClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Duration;

/**
 * HTTP clients for the user directory and chat service.
 */
@Configuration
public class GatewayClientConfig {

    @Bean
    public RestClient userDirectoryRestClient(
            RestClient.Builder builder,
            @Value("${smartfix.user-directory.base-url}") String baseUrl,
            @Value("${smartfix.gateway.timeout-ms:2000}") long timeoutMs) {
        return builder.clone()
                .baseUrl(baseUrl)
                .requestFactory(requestFactory(timeoutMs))
                .build();
    }

    @Bean
    public RestClient chatRestClient(
            RestClient.Builder builder,
            @Value("${smartfix.chat.base-url}") String baseUrl,
            @Value("${smartfix.gateway.timeout-ms:2000}") long timeoutMs) {
        return builder.clone()
                .baseUrl(baseUrl)
                .requestFactory(requestFactory(timeoutMs))
                .build();
    }

    private static ClientHttpRequestFactory requestFactory(long timeoutMs) {
        return ClientHttpRequestFactories.get(ClientHttpRequestFactorySettings.DEFAULTS
                .withConnectTimeout(Duration.ofMillis(timeoutMs))
                .withReadTimeout(Duration.ofMillis(timeoutMs)));
    }
}
