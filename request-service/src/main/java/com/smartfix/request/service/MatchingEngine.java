package com.smartfix.request.service;

import com.smartfix.request.entity.ServiceArea;
import com.smartfix.request.entity.ServiceProvider;
import com.smartfix.request.entity.ServiceRequest;
import com.smartfix.request.exception.NotFoundException;
import com.smartfix.request.exception.ValidationException;
import com.smartfix.request.gateway.ProviderDirectory;
import com.smartfix.request.metrics.RequestMetrics;
import com.smartfix.request.model.CostEstimate;
import com.smartfix.request.model.MatchCriteria;
import com.smartfix.request.model.RequestResponse;
import com.smartfix.request.model.ScoredRequest;
import com.smartfix.request.repository.ServiceRequestRepository;
import com.smartfix.shared.geo.BoundingBox;
import com.smartfix.shared.geo.GeoPoint;
import com.smartfix.shared.util.GeoMath;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Provider search for a request, and the inverse request feed for a provider.
 *
 * Provider search pipeline:
 *  1. Directory candidates: verified, available, offering one of the services,
 *     centre within the search radius (Redis GEO), best-rated first
 *  2. Request location inside the provider's own service circle
 *  3. hourlyRate * duration within the budget maximum (providers without an hourly rate pass)
 *  4. Available on the weekday of the scheduled date
 * Survivors keep the order of step 1.
 *
 * Weekdays are taken in the zone of the injected clock.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MatchingEngine {

    static final double AUTO_MATCH_RADIUS_KM = 25.0;
    static final int DEFAULT_RECOMMENDATION_LIMIT = 10;

    private final ProviderDirectory providerDirectory;
    private final ServiceRequestRepository requestRepository;
    private final PriorityScorer priorityScorer;
    private final PricingEstimator pricingEstimator;
    private final RequestMetrics metrics;
    private final Clock clock;

    public List<ServiceProvider> findMatchingProviders(ServiceRequest request, MatchCriteria criteria) {
        Timer.Sample sample = Timer.start();
        try {
            List<ServiceProvider> candidates = providerDirectory.findCandidates(
                    criteria.getServices(), criteria.getLocation(), criteria.getRadiusKm());

            GeoPoint requestPoint = request.getLocation().toPoint();
            List<ServiceProvider> matched = candidates.stream()
                    .filter(p -> servesLocation(p, requestPoint))
                    .filter(p -> withinBudget(p, request, criteria.getMaxBudget()))
                    .filter(p -> availableOn(p, criteria))
                    .toList();

            log.debug("Matching request {}: {} candidates -> {} matched",
                    request.getId(), candidates.size(), matched.size());
            metrics.recordMatched(matched.size());
            return matched;
        } finally {
            sample.stop(metrics.getMatchingTimer());
        }
    }

    @Transactional(readOnly = true)
    public List<ServiceProvider> autoMatchServiceRequest(UUID requestId) {
        ServiceRequest request = getRequestOrThrow(requestId);

        MatchCriteria criteria = MatchCriteria.builder()
                .location(request.getLocation().toPoint())
                .services(Set.of(request.getServiceType()))
                .maxBudget(request.getBudget().getMaxAmount())
                .scheduledDate(request.getScheduledDate())
                .radiusKm(AUTO_MATCH_RADIUS_KM)
                .priority(request.getPriority())
                .build();

        return findMatchingProviders(request, criteria);
    }

    @Transactional(readOnly = true)
    public List<ScoredRequest> getRecommendationsForProvider(String providerId, Integer limit) {
        ServiceProvider provider = providerDirectory.findById(providerId)
                .orElseThrow(() -> new NotFoundException(NotFoundException.PROVIDER_NOT_FOUND,
                        "Provider " + providerId + " not found"));

        int max = limit != null ? limit : DEFAULT_RECOMMENDATION_LIMIT;
        if (max < 1) {
            throw new ValidationException(ValidationException.VALIDATION_ERROR, "limit must be at least 1");
        }

        ServiceArea area = provider.getServiceArea();
        if (area == null || provider.getServices().isEmpty()) {
            return List.of();
        }

        GeoPoint center = area.toPoint();
        BoundingBox box = GeoMath.boundingBox(center, area.getRadiusKm());
        List<ServiceRequest> open = requestRepository.findOpenRequestsForProvider(
                new ArrayList<>(provider.getServices()),
                box.getMinLatitude(), box.getMaxLatitude(),
                box.getMinLongitude(), box.getMaxLongitude(),
                providerId);

        List<ScoredRequest> scored = new ArrayList<>();
        for (ServiceRequest r : open) {
            double distance = GeoMath.distanceKm(center, r.getLocation().toPoint());
            if (distance <= area.getRadiusKm()) {
                scored.add(ScoredRequest.builder()
                        .request(RequestResponse.from(r))
                        .priorityScore(priorityScorer.score(r))
                        .distanceKm(distance)
                        .build());
            }
        }

        // List.sort is stable: equal scores keep the repository order
        scored.sort(Comparator.comparingInt(ScoredRequest::getPriorityScore).reversed());

        log.debug("Recommendations for provider {}: {} open in box, {} in radius, returning {}",
                providerId, open.size(), scored.size(), Math.min(max, scored.size()));
        return scored.size() > max ? List.copyOf(scored.subList(0, max)) : scored;
    }

    @Transactional(readOnly = true)
    public CostEstimate estimateCost(UUID requestId, String providerId) {
        ServiceRequest request = getRequestOrThrow(requestId);
        ServiceProvider provider = providerDirectory.findById(providerId)
                .orElseThrow(() -> new NotFoundException(NotFoundException.PROVIDER_NOT_FOUND,
                        "Provider " + providerId + " not found"));
        return pricingEstimator.estimate(provider, request);
    }

    // ── Filters ───────────────────────────────────────────────────────────────

    boolean servesLocation(ServiceProvider provider, GeoPoint requestPoint) {
        ServiceArea area = provider.getServiceArea();
        return area != null && GeoMath.distanceKm(requestPoint, area.toPoint()) <= area.getRadiusKm();
    }

    boolean withinBudget(ServiceProvider provider, ServiceRequest request, BigDecimal maxBudget) {
        if (provider.getHourlyRate() == null || maxBudget == null) {
            return true;
        }
        double duration = PricingEstimator.durationOrDefault(request.getEstimatedDurationHours());
        BigDecimal cost = provider.getHourlyRate().multiply(BigDecimal.valueOf(duration));
        return cost.compareTo(maxBudget) <= 0;
    }

    boolean availableOn(ServiceProvider provider, MatchCriteria criteria) {
        if (criteria.getScheduledDate() == null) {
            return true;
        }
        DayOfWeek day = criteria.getScheduledDate().atZone(clock.getZone()).getDayOfWeek();
        return provider.isAvailableOn(day);
    }

    private ServiceRequest getRequestOrThrow(UUID requestId) {
        return requestRepository.findById(requestId)
                .orElseThrow(() -> new NotFoundException(NotFoundException.REQUEST_NOT_FOUND,
                        "Request " + requestId + " not found"));
    }
}
