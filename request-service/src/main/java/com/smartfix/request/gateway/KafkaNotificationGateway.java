package com.smartfix.request.gateway;

import com.smartfix.shared.events.ProvidersMatchedEvent;
import com.smartfix.shared.events.RequestStatusChangedEvent;
import com.smartfix.shared.util.KafkaTopics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Publishes to Kafka; delivery to devices is done by notification-service.
 * Sends are not awaited.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class KafkaNotificationGateway implements NotificationGateway {

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final Clock clock;

    @Override
    public void notify(List<String> providerIds, UUID requestId) {
        ProvidersMatchedEvent event = ProvidersMatchedEvent.builder()
                .requestId(requestId.toString())
                .providerIds(List.copyOf(providerIds))
                .matchedAt(Instant.now(clock))
                .build();
        kafkaTemplate.send(KafkaTopics.PROVIDERS_MATCHED, requestId.toString(), event);
        log.info("Notified {} matched providers for request {}", providerIds.size(), requestId);
    }

    @Override
    public void publishStatusChange(String topic, RequestStatusChangedEvent event) {
        kafkaTemplate.send(topic, event.getRequestId(), event);
    }
}
