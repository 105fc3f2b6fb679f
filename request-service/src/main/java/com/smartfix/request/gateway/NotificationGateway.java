package com.smartfix.request.gateway;

import com.smartfix.shared.events.RequestStatusChangedEvent;

import java.util.List;
import java.util.UUID;

/**
 * Fire-and-forget outbound notifications.
 */
public interface NotificationGateway {

    void notify(List<String> providerIds, UUID requestId);

    void publishStatusChange(String topic, RequestStatusChangedEvent event);
}
