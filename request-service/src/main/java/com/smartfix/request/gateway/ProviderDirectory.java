package com.smartfix.request.gateway;

import com.smartfix.request.entity.ServiceProvider;
import com.smartfix.shared.geo.GeoPoint;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Read access to provider profiles plus the two writes the request lifecycle needs.
 */
public interface ProviderDirectory {

    Optional<ServiceProvider> findById(String providerId);

    Optional<ServiceProvider> findByUserId(String userId);

    /**
     * Verified, available providers offering at least one of {@code services} whose
     * service-area centre lies within {@code radiusKm} of {@code center}. Ordered by
     * rating descending, then completed jobs descending.
     */
    List<ServiceProvider> findCandidates(Collection<String> services, GeoPoint center, double radiusKm);

    void incrementCompletedJobs(String providerId);

    void requestRatingRefresh(String providerId, UUID requestId);
}
