package com.smartfix.request.service;

import com.smartfix.request.entity.ServiceProvider;
import com.smartfix.request.entity.ServiceRequest;
import com.smartfix.request.model.CostEstimate;
import com.smartfix.shared.util.GeoMath;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;

/**
 * Cost estimate for a provider doing a request.
 *
 * Formula:
 *   base   = fixedPrice(serviceType)  if the provider has one
 *          | hourlyRate * duration    if the provider has an hourly rate
 *          | 0
 *   travel = (distanceKm - 10) * 2    when the provider's centre is more than 10km away
 *   cost   = round2(base + travel)
 */
@Slf4j
@Service
public class PricingEstimator {

    static final double FREE_TRAVEL_KM = 10.0;
    private static final BigDecimal TRAVEL_RATE_PER_KM = new BigDecimal("2");
    private static final double DEFAULT_DURATION_HOURS = 1.0;

    public CostEstimate estimate(ServiceProvider provider, ServiceRequest request) {
        CostEstimate.Breakdown.BreakdownBuilder breakdown = CostEstimate.Breakdown.builder();
        BigDecimal base = BigDecimal.ZERO;

        Optional<BigDecimal> fixedPrice = provider.fixedPriceFor(request.getServiceType());
        if (fixedPrice.isPresent()) {
            base = fixedPrice.get();
            breakdown.fixedPrice(base);
        } else if (provider.getHourlyRate() != null) {
            double duration = durationOrDefault(request.getEstimatedDurationHours());
            base = provider.getHourlyRate().multiply(BigDecimal.valueOf(duration));
            breakdown.hourlyRate(provider.getHourlyRate())
                    .duration(duration)
                    .subtotal(base);
        }

        double distanceKm = GeoMath.distanceKm(provider.getServiceArea().toPoint(), request.getLocation().toPoint());
        BigDecimal travel = travelSurcharge(distanceKm);
        if (travel.signum() > 0) {
            breakdown.travelCost(travel.setScale(2, RoundingMode.HALF_UP));
        }

        BigDecimal total = base.add(travel).setScale(2, RoundingMode.HALF_UP);
        log.debug("Estimate: provider={} request={} base={} travel={} ({}km) -> {}",
                provider.getId(), request.getId(), base, travel, distanceKm, total);

        return CostEstimate.builder()
                .estimatedCost(total)
                .breakdown(breakdown.build())
                .build();
    }

    /**
     * Zero up to and including {@value #FREE_TRAVEL_KM} km.
     */
    BigDecimal travelSurcharge(double distanceKm) {
        if (distanceKm <= FREE_TRAVEL_KM) {
            return BigDecimal.ZERO;
        }
        return BigDecimal.valueOf(distanceKm - FREE_TRAVEL_KM).multiply(TRAVEL_RATE_PER_KM);
    }

    static double durationOrDefault(double hours) {
        return hours > 0 ? hours : DEFAULT_DURATION_HOURS;
    }
}
