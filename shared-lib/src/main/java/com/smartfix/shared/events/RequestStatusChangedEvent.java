package com.smartfix.shared.events;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.smartfix.shared.enums.RequestStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RequestStatusChangedEvent {

    private String requestId;
    private String requesterId;
    private String providerId;
    private String proposalId;
    private RequestStatus status;
    private String reason;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant changedAt;
}
