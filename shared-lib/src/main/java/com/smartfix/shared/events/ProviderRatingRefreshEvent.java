package com.smartfix.shared.events;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProviderRatingRefreshEvent {

    private String providerId;
    private String requestId;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant requestedAt;
}
