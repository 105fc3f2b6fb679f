package com.smartfix.request.gateway;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.UUID;

/**
 * Opens the requester/provider conversation once a proposal is accepted. The chat
 * service returns the existing channel when one is already open for the request.
 */
public interface ChatGateway {

    ChannelRef createChannel(UUID requestId, List<String> participantIds);

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    class ChannelRef {
        private String channelId;
    }
}
