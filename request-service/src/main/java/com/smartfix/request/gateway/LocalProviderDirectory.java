package com.smartfix.request.gateway;

import com.smartfix.request.entity.ServiceProvider;
import com.smartfix.request.repository.ServiceProviderRepository;
import com.smartfix.shared.events.ProviderRatingRefreshEvent;
import com.smartfix.shared.geo.GeoPoint;
import com.smartfix.shared.util.KafkaTopics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Provider directory backed by the {@code service_providers} table and the Redis geo index.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LocalProviderDirectory implements ProviderDirectory {

    static final Comparator<ServiceProvider> BEST_FIRST =
            Comparator.comparingDouble(ServiceProvider::getRating).reversed()
                    .thenComparing(Comparator.comparingInt(ServiceProvider::getCompletedJobs).reversed());

    private final ServiceProviderRepository providerRepository;
    private final ProviderGeoIndex geoIndex;
    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public Optional<ServiceProvider> findById(String providerId) {
        return providerRepository.findById(providerId);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ServiceProvider> findByUserId(String userId) {
        return providerRepository.findByUserId(userId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<ServiceProvider> findCandidates(Collection<String> services, GeoPoint center, double radiusKm) {
        List<String> nearby = geoIndex.within(center, radiusKm);
        if (nearby.isEmpty() || services.isEmpty()) {
            return List.of();
        }
        return providerRepository.findEligible(nearby, services).stream()
                .sorted(BEST_FIRST)
                .toList();
    }

    @Override
    @Transactional
    public void incrementCompletedJobs(String providerId) {
        int updated = providerRepository.incrementCompletedJobs(providerId);
        if (updated == 0) {
            log.warn("completedJobs not incremented, provider {} not found", providerId);
        }
    }

    @Override
    public void requestRatingRefresh(String providerId, UUID requestId) {
        ProviderRatingRefreshEvent event = ProviderRatingRefreshEvent.builder()
                .providerId(providerId)
                .requestId(requestId.toString())
                .requestedAt(Instant.now(clock))
                .build();
        kafkaTemplate.send(KafkaTopics.PROVIDER_RATING_REFRESH, providerId, event);
        log.debug("Rating refresh requested for provider {}", providerId);
    }

    /**
     * Re-adds every active provider to the geo index.
     */
    @Transactional(readOnly = true)
    public int rebuildGeoIndex() {
        List<ServiceProvider> providers = providerRepository.findAllActive();
        providers.forEach(geoIndex::index);
        return providers.size();
    }

    /**
     * Picks up providers registered, verified or moved since the last pass. Profiles are
     * written outside this service, so the geo set is refreshed from the table.
     */
    @Scheduled(initialDelayString = "${smartfix.matching.geo-index-refresh-ms:60000}",
            fixedDelayString = "${smartfix.matching.geo-index-refresh-ms:60000}")
    @Transactional(readOnly = true)
    public void refreshGeoIndex() {
        int indexed = rebuildGeoIndex();
        log.debug("Geo index refreshed with {} providers", indexed);
    }
}
