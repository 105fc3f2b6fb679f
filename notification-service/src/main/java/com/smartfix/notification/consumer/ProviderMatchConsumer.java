package com.smartfix.notification.consumer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.smartfix.notification.service.NotificationDispatcher;
import com.smartfix.shared.events.ProvidersMatchedEvent;
import com.smartfix.shared.util.KafkaTopics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Component;

/**
 * Tells each auto-matched provider about a new job in their area.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProviderMatchConsumer {

    private final NotificationDispatcher dispatcher;
    private final ObjectMapper objectMapper;

    @KafkaListener(
            topics = KafkaTopics.PROVIDERS_MATCHED,
            groupId = "notification-service-matches",
            containerFactory = "kafkaListenerContainerFactory"
    )
    public void consumeMatches(@Payload String payload, Acknowledgment ack) {
        try {
            ProvidersMatchedEvent event = objectMapper.readValue(payload, ProvidersMatchedEvent.class);
            if (event.getProviderIds() != null) {
                for (String providerId : event.getProviderIds()) {
                    dispatcher.sendPush(providerId,
                            "New job nearby",
                            "A customer near you needs help. Request " + event.getRequestId() + " is open for proposals.");
                }
            }
            log.info("Match notifications sent for request={} providers={}",
                    event.getRequestId(), event.getProviderIds() != null ? event.getProviderIds().size() : 0);
            ack.acknowledge();
        } catch (Exception e) {
            log.error("Failed to process match notification: {}", e.getMessage(), e);
            ack.acknowledge(); // do not block the partition
        }
    }
}
