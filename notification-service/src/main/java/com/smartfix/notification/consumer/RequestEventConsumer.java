package com.smartfix.notification.consumer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.smartfix.notification.service.NotificationDispatcher;
import com.smartfix.shared.events.RequestStatusChangedEvent;
import com.smartfix.shared.util.KafkaTopics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class RequestEventConsumer {

    private final NotificationDispatcher dispatcher;
    private final ObjectMapper objectMapper;

    @KafkaListener(
            topics = {
                    KafkaTopics.REQUEST_CREATED,
                    KafkaTopics.PROPOSAL_SUBMITTED,
                    KafkaTopics.PROPOSAL_WITHDRAWN,
                    KafkaTopics.REQUEST_ACCEPTED,
                    KafkaTopics.REQUEST_IN_PROGRESS,
                    KafkaTopics.REQUEST_COMPLETED,
                    KafkaTopics.REQUEST_APPROVED,
                    KafkaTopics.REQUEST_CANCELLED
            },
            groupId = "notification-service-requests",
            containerFactory = "kafkaListenerContainerFactory"
    )
    public void consumeRequestEvents(
            @Payload String payload,
            @Header(KafkaHeaders.RECEIVED_TOPIC) String topic,
            Acknowledgment ack) {

        try {
            RequestStatusChangedEvent event = objectMapper.readValue(payload, RequestStatusChangedEvent.class);
            switch (topic) {
                case KafkaTopics.REQUEST_CREATED ->
                        dispatcher.sendPush(event.getRequesterId(), "Request posted",
                                "Your request is live. We'll let you know when providers respond.");
                case KafkaTopics.PROPOSAL_SUBMITTED ->
                        dispatcher.sendPush(event.getRequesterId(), "New proposal",
                                "A provider sent you a proposal. Review it in the app.");
                case KafkaTopics.PROPOSAL_WITHDRAWN ->
                        dispatcher.sendPush(event.getRequesterId(), "Proposal withdrawn",
                                "A provider withdrew their proposal on your request.");
                case KafkaTopics.REQUEST_ACCEPTED ->
                        dispatcher.sendPush(event.getProviderId(), "Proposal accepted",
                                "Your proposal was accepted. A chat with the customer is open.");
                case KafkaTopics.REQUEST_IN_PROGRESS ->
                        dispatcher.sendPush(event.getRequesterId(), "Work started",
                                "Your provider has started the job.");
                case KafkaTopics.REQUEST_COMPLETED -> {
                    dispatcher.sendPush(event.getRequesterId(), "Job completed",
                            "Your provider marked the job as done. Please review and approve.");
                    dispatcher.sendEmail(event.getRequesterId(), "Please approve your completed job",
                            "Request " + event.getRequestId() + " is complete and awaits your approval.");
                }
                case KafkaTopics.REQUEST_APPROVED ->
                        dispatcher.sendPush(event.getProviderId(), "Completion approved",
                                "The customer approved your work. Payment is on its way.");
                case KafkaTopics.REQUEST_CANCELLED -> {
                    String body = "Request " + event.getRequestId() + " was cancelled: " + event.getReason();
                    dispatcher.sendPush(event.getRequesterId(), "Request cancelled", body);
                    if (event.getProviderId() != null) {
                        dispatcher.sendPush(event.getProviderId(), "Request cancelled", body);
                    }
                }
                default -> log.debug("Unhandled topic: {}", topic);
            }
            ack.acknowledge();
        } catch (Exception e) {
            log.error("Failed to process notification for topic {}: {}", topic, e.getMessage(), e);
            ack.acknowledge();
        }
    }
}
