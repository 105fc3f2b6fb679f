package com.smartfix.request.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Estimated cost of a job for one provider. Only the breakdown entries that the
 * chosen pricing mode uses are set.
 */
@Value
@Builder
public class CostEstimate {

    BigDecimal estimatedCost;
    Breakdown breakdown;

    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Breakdown {
        BigDecimal fixedPrice;
        BigDecimal hourlyRate;
        Double duration;
        BigDecimal subtotal;
        BigDecimal travelCost;
    }
}
