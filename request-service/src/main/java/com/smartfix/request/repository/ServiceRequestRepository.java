package com.smartfix.request.repository;

import com.smartfix.request.entity.ServiceRequest;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface ServiceRequestRepository extends JpaRepository<ServiceRequest, UUID> {

    /**
     * Compare-and-swap on status: assigns the provider only while the request is still
     * PENDING. Returns the number of rows updated (0 or 1).
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ServiceRequest r SET r.status = com.smartfix.shared.enums.RequestStatus.ACCEPTED, "
            + "r.providerId = :providerId, r.payment.amount = :amount, r.updatedAt = :now, "
            + "r.version = r.version + 1 "
            + "WHERE r.id = :id AND r.status = com.smartfix.shared.enums.RequestStatus.PENDING")
    int acceptIfPending(UUID id, String providerId, BigDecimal amount, Instant now);

    /**
     * Pending requests of the given service types inside a lat/lng box that this provider
     * has never bid on. The box is a prefilter; callers apply the exact radius test.
     */
    @Query("SELECT r FROM ServiceRequest r "
            + "WHERE r.status = com.smartfix.shared.enums.RequestStatus.PENDING "
            + "AND r.serviceType IN :serviceTypes "
            + "AND r.location.latitude BETWEEN :minLat AND :maxLat "
            + "AND r.location.longitude BETWEEN :minLng AND :maxLng "
            + "AND NOT EXISTS (SELECT p.id FROM Proposal p "
            + "                WHERE p.serviceRequest = r AND p.providerId = :providerId) "
            + "ORDER BY r.createdAt DESC")
    List<ServiceRequest> findOpenRequestsForProvider(Collection<String> serviceTypes,
                                                     double minLat, double maxLat,
                                                     double minLng, double maxLng,
                                                     String providerId);

}
