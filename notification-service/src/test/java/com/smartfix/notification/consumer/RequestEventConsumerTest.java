package com.smartfix.notification.consumer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.smartfix.notification.service.NotificationDispatcher;
import com.smartfix.shared.enums.RequestStatus;
import com.smartfix.shared.events.RequestStatusChangedEvent;
import com.smartfix.shared.util.KafkaTopics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.support.Acknowledgment;

import java.time.Instant;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class RequestEventConsumerTest {

    @Mock private NotificationDispatcher dispatcher;
    @Mock private Acknowledgment ack;

    private final ObjectMapper objectMapper = JsonMapper.builder().findAndAddModules().build();
    private RequestEventConsumer consumer;

    @BeforeEach
    void setUp() {
        consumer = new RequestEventConsumer(dispatcher, objectMapper);
    }

    @Test
    void acceptedNotifiesTheProvider() throws Exception {
        consumer.consumeRequestEvents(json(event(RequestStatus.ACCEPTED, "prv_1", null)), KafkaTopics.REQUEST_ACCEPTED, ack);

        verify(dispatcher).sendPush(eq("prv_1"), eq("Proposal accepted"), anyString());
        verify(ack).acknowledge();
    }

    @Test
    void cancellationReachesBothParties() throws Exception {
        consumer.consumeRequestEvents(json(event(RequestStatus.CANCELLED, "prv_1", "Parts unavailable")),
                KafkaTopics.REQUEST_CANCELLED, ack);

        verify(dispatcher).sendPush(eq("usr_requester"), eq("Request cancelled"), contains("Parts unavailable"));
        verify(dispatcher).sendPush(eq("prv_1"), eq("Request cancelled"), contains("Parts unavailable"));
        verify(ack).acknowledge();
    }

    @Test
    void cancellationOfUnassignedRequestSkipsProvider() throws Exception {
        consumer.consumeRequestEvents(json(event(RequestStatus.CANCELLED, null, "No reason provided")),
                KafkaTopics.REQUEST_CANCELLED, ack);

        verify(dispatcher).sendPush(eq("usr_requester"), eq("Request cancelled"), anyString());
        verify(dispatcher, never()).sendPush(isNull(), anyString(), anyString());
    }

    @Test
    void completionAlsoSendsEmail() throws Exception {
        consumer.consumeRequestEvents(json(event(RequestStatus.COMPLETED, "prv_1", null)),
                KafkaTopics.REQUEST_COMPLETED, ack);

        verify(dispatcher).sendPush(eq("usr_requester"), eq("Job completed"), anyString());
        verify(dispatcher).sendEmail(eq("usr_requester"), anyString(), contains("req-1"));
    }

    @Test
    void unreadablePayloadIsAcknowledgedAndSkipped() {
        consumer.consumeRequestEvents("{not json", KafkaTopics.REQUEST_ACCEPTED, ack);

        verifyNoInteractions(dispatcher);
        verify(ack).acknowledge();
    }

    private static RequestStatusChangedEvent event(RequestStatus status, String providerId, String reason) {
        return RequestStatusChangedEvent.builder()
                .requestId("req-1")
                .requesterId("usr_requester")
                .providerId(providerId)
                .status(status)
                .reason(reason)
                .changedAt(Instant.parse("2026-03-02T12:00:00Z"))
                .build();
    }

    private String json(RequestStatusChangedEvent event) throws Exception {
        return objectMapper.writeValueAsString(event);
    }
}
