package com.smartfix.request.service;

import com.smartfix.request.Fixtures;
import com.smartfix.request.entity.ServiceProvider;
import com.smartfix.request.entity.ServiceRequest;
import com.smartfix.request.model.CostEstimate;
import com.smartfix.shared.util.GeoMath;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;
import java.util.UUID;

import static com.smartfix.request.Fixtures.ORIGIN_LAT;
import static com.smartfix.request.Fixtures.ORIGIN_LNG;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for PricingEstimator.
 *
 * Formula: cost = round2(fixedPrice | hourlyRate * duration | 0) + max(0, distKm - 10) * 2
 */
class PricingEstimatorTest {

    private PricingEstimator estimator;
    private ServiceRequest request;

    @BeforeEach
    void setUp() {
        estimator = new PricingEstimator();
        request = Fixtures.pendingRequest(UUID.randomUUID());
    }

    @Test
    @DisplayName("Hourly rate 45 x 2h at the request location = 90.00 with hourly breakdown")
    void hourlyPricing() {
        ServiceProvider provider = Fixtures.provider("prv_1", ORIGIN_LNG, ORIGIN_LAT, 20, "45");

        CostEstimate estimate = estimator.estimate(provider, request);

        assertThat(estimate.getEstimatedCost()).isEqualByComparingTo("90.00");
        assertThat(estimate.getBreakdown().getHourlyRate()).isEqualByComparingTo("45");
        assertThat(estimate.getBreakdown().getDuration()).isEqualTo(2.0);
        assertThat(estimate.getBreakdown().getSubtotal()).isEqualByComparingTo("90");
        assertThat(estimate.getBreakdown().getFixedPrice()).isNull();
        assertThat(estimate.getBreakdown().getTravelCost()).isNull();
    }

    @Test
    @DisplayName("Fixed price wins over hourly rate when both are configured")
    void fixedPriceTakesPrecedence() {
        ServiceProvider provider = Fixtures.provider("prv_1", ORIGIN_LNG, ORIGIN_LAT, 20, "45");
        provider.setFixedPrices(Map.of("plumbing", new BigDecimal("120")));

        CostEstimate estimate = estimator.estimate(provider, request);

        assertThat(estimate.getEstimatedCost()).isEqualByComparingTo("120.00");
        assertThat(estimate.getBreakdown().getFixedPrice()).isEqualByComparingTo("120");
        assertThat(estimate.getBreakdown().getHourlyRate()).isNull();
    }

    @Test
    @DisplayName("Fixed price lookup ignores case of the service name")
    void fixedPriceCaseInsensitive() {
        ServiceProvider provider = Fixtures.provider("prv_1", ORIGIN_LNG, ORIGIN_LAT, 20, null);
        provider.setFixedPrices(Map.of("Plumbing", new BigDecimal("80")));

        assertThat(estimator.estimate(provider, request).getEstimatedCost()).isEqualByComparingTo("80.00");
    }

    @Test
    @DisplayName("No pricing configured gives 0 with an empty breakdown")
    void noPricing() {
        ServiceProvider provider = Fixtures.provider("prv_1", ORIGIN_LNG, ORIGIN_LAT, 20, null);

        CostEstimate estimate = estimator.estimate(provider, request);

        assertThat(estimate.getEstimatedCost()).isEqualByComparingTo("0.00");
        assertThat(estimate.getBreakdown().getFixedPrice()).isNull();
        assertThat(estimate.getBreakdown().getHourlyRate()).isNull();
        assertThat(estimate.getBreakdown().getSubtotal()).isNull();
    }

    @Test
    @DisplayName("Missing duration defaults to one hour")
    void defaultDurationOneHour() {
        ServiceProvider provider = Fixtures.provider("prv_1", ORIGIN_LNG, ORIGIN_LAT, 20, "45");
        request.setEstimatedDurationHours(0);

        CostEstimate estimate = estimator.estimate(provider, request);

        assertThat(estimate.getEstimatedCost()).isEqualByComparingTo("45.00");
        assertThat(estimate.getBreakdown().getDuration()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Travel surcharge: (distance - 10) * 2 added on top of the base price")
    void travelSurchargeAdded() {
        ServiceProvider provider = Fixtures.provider("prv_1", Fixtures.lngEastOfOrigin(15), ORIGIN_LAT, 30, "45");
        double distance = GeoMath.distanceKm(provider.getServiceArea().toPoint(), request.getLocation().toPoint());
        BigDecimal expectedTravel = BigDecimal.valueOf((distance - 10) * 2).setScale(2, RoundingMode.HALF_UP);

        CostEstimate estimate = estimator.estimate(provider, request);

        assertThat(distance).isGreaterThan(14.9).isLessThan(15.1);
        assertThat(estimate.getBreakdown().getTravelCost()).isEqualByComparingTo(expectedTravel);
        assertThat(estimate.getEstimatedCost()).isCloseTo(new BigDecimal("90").add(expectedTravel),
                within(new BigDecimal("0.01")));
    }

    @Test
    @DisplayName("Surcharge is 0 at exactly 10 km and positive just beyond")
    void travelSurchargeThreshold() {
        assertThat(estimator.travelSurcharge(10.0)).isEqualByComparingTo("0");
        assertThat(estimator.travelSurcharge(9.5)).isEqualByComparingTo("0");
        assertThat(estimator.travelSurcharge(10.0001)).isPositive();
        assertThat(estimator.travelSurcharge(10.0001).doubleValue()).isCloseTo(0.0002, within(1e-9));
        assertThat(estimator.travelSurcharge(25.0)).isEqualByComparingTo("30");
    }

    @Test
    @DisplayName("Estimate is deterministic for the same inputs")
    void deterministic() {
        ServiceProvider provider = Fixtures.provider("prv_1", Fixtures.lngEastOfOrigin(12), ORIGIN_LAT, 30, "37.5");

        CostEstimate first = estimator.estimate(provider, request);
        CostEstimate second = estimator.estimate(provider, request);

        assertThat(first).isEqualTo(second);
        assertThat(first.getEstimatedCost().scale()).isEqualTo(2);
    }
}
