package com.smartfix.shared.events;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProvidersMatchedEvent {

    private String requestId;
    private List<String> providerIds;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant matchedAt;
}
