package com.smartfix.request.model;

import lombok.Builder;
import lombok.Value;

/**
 * A pending request as seen from a provider's recommendation feed.
 */
@Value
@Builder
public class ScoredRequest {

    RequestResponse request;
    int priorityScore;
    double distanceKm;
}
