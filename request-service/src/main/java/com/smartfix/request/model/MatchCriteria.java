package com.smartfix.request.model;

import com.smartfix.shared.enums.RequestPriority;
import com.smartfix.shared.geo.GeoPoint;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Set;

/**
 * Search parameters for {@code findMatchingProviders}.
 */
@Value
@Builder
public class MatchCriteria {

    GeoPoint location;
    Set<String> services;
    BigDecimal maxBudget;
    Instant scheduledDate;
    double radiusKm;
    RequestPriority priority;
}
