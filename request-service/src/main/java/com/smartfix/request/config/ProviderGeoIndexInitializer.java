package com.smartfix.request.config;

import com.smartfix.request.gateway.LocalProviderDirectory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Rebuilds the Redis provider geo index from the provider table on startup.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
@ConditionalOnProperty(name = "smartfix.matching.rebuild-geo-index-on-startup", havingValue = "true", matchIfMissing = true)
public class ProviderGeoIndexInitializer {

    private final LocalProviderDirectory providerDirectory;

    @Bean
    public ApplicationRunner rebuildProviderGeoIndex() {
        return args -> {
            int indexed = providerDirectory.rebuildGeoIndex();
            log.info("Provider geo index rebuilt with {} providers", indexed);
        };
    }
}
