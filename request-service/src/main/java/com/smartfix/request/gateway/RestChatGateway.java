package com.smartfix.request.gateway;

import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@Slf4j
@Component
public class RestChatGateway implements ChatGateway {

    private final RestClient restClient;

    public RestChatGateway(@Qualifier("chatRestClient") RestClient restClient) {
        this.restClient = restClient;
    }

    /**
     * No retry: a failure surfaces to the caller of acceptProposal.
     */
    @Override
    @CircuitBreaker(name = "chat-gateway")
    public ChannelRef createChannel(UUID requestId, List<String> participantIds) {
        log.info("Creating chat channel for request {} participants={}", requestId, participantIds);
        ChannelRef ref = restClient.post()
                .uri("/api/v1/channels")
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("requestId", requestId.toString(), "participantIds", participantIds))
                .retrieve()
                .body(ChannelRef.class);
        if (ref == null || ref.getChannelId() == null) {
            throw new IllegalStateException("Chat service returned no channel for request " + requestId);
        }
        return ref;
    }
}
