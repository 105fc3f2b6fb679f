package com.smartfix.request.gateway;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;

import java.util.Optional;

/**
 * Resolves users against the user service. A 404 means the user does not exist;
 * any other failure propagates.
 */
@Slf4j
@Component
public class RestUserDirectory implements UserDirectory {

    private final RestClient restClient;

    public RestUserDirectory(@Qualifier("userDirectoryRestClient") RestClient restClient) {
        this.restClient = restClient;
    }

    @Override
    public Optional<UserSummary> findUser(String userId) {
        try {
            UserSummary user = restClient.get()
                    .uri("/api/v1/users/{id}", userId)
                    .retrieve()
                    .body(UserSummary.class);
            return Optional.ofNullable(user);
        } catch (HttpClientErrorException.NotFound e) {
            log.debug("User {} not found in user directory", userId);
            return Optional.empty();
        }
    }
}
