package com.smartfix.request.entity;

import com.smartfix.shared.enums.ProposalStatus;
import com.smartfix.shared.enums.RequestPriority;
import com.smartfix.shared.enums.RequestStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * A customer's posted job. This aggregate is the unit of atomicity: proposals are
 * only created and mutated through it.
 */
@Entity
@Table(name = "service_requests",
        indexes = {
                @Index(name = "idx_request_requester", columnList = "requester_id"),
                @Index(name = "idx_request_provider", columnList = "provider_id"),
                @Index(name = "idx_request_status_type", columnList = "status, service_type"),
                @Index(name = "idx_request_location", columnList = "latitude, longitude")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = "id")
public class ServiceRequest {

    @Id
    private UUID id;

    /**
     * Optimistic lock version. The accept path bumps it explicitly in its
     * conditional UPDATE; every other transition goes through a versioned save.
     */
    @Version
    @Column(nullable = false)
    private Long version;

    @Column(name = "requester_id", nullable = false)
    private String requesterId;

    @Column(name = "provider_id")
    private String providerId;

    @Column(nullable = false)
    private String category;

    @Column(name = "service_type", nullable = false)
    private String serviceType;

    @Column(nullable = false, length = 200)
    private String title;

    @Column(nullable = false, length = 2000)
    private String description;

    @ElementCollection
    @CollectionTable(name = "request_requirements", joinColumns = @JoinColumn(name = "request_id"))
    @Column(name = "requirement")
    @Builder.Default
    private List<String> requirements = new ArrayList<>();

    @ElementCollection
    @CollectionTable(name = "request_images", joinColumns = @JoinColumn(name = "request_id"))
    @Column(name = "image_url")
    @Builder.Default
    private List<String> images = new ArrayList<>();

    @Column(name = "scheduled_date", nullable = false)
    private Instant scheduledDate;

    @Column(name = "estimated_duration_hours", nullable = false)
    private double estimatedDurationHours;

    @Embedded
    private GeoLocation location;

    @Embedded
    private Budget budget;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private RequestPriority priority;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private RequestStatus status;

    @OneToMany(mappedBy = "serviceRequest", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("submittedAt ASC")
    @Builder.Default
    @ToString.Exclude
    private List<Proposal> proposals = new ArrayList<>();

    @Embedded
    private CompletionRecord completion;

    @ElementCollection
    @CollectionTable(name = "request_completion_images", joinColumns = @JoinColumn(name = "request_id"))
    @Column(name = "image_url")
    @Builder.Default
    private List<String> completionImages = new ArrayList<>();

    @Embedded
    private PaymentRecord payment;

    @Embedded
    private CancellationRecord cancellation;

    @Column(name = "chat_channel_id")
    private String chatChannelId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public Optional<Proposal> findProposal(UUID proposalId) {
        return proposals.stream().filter(p -> p.getId().equals(proposalId)).findFirst();
    }

    public boolean hasProposalFrom(String providerId) {
        return proposals.stream().anyMatch(p -> p.getProviderId().equals(providerId));
    }

    public void addProposal(Proposal proposal) {
        proposal.setServiceRequest(this);
        proposals.add(proposal);
    }

    /**
     * Marks every still-pending proposal other than {@code keep} as rejected.
     */
    public void rejectPendingProposals(UUID keep, Instant now) {
        for (Proposal p : proposals) {
            if (p.getStatus() == ProposalStatus.PENDING && !p.getId().equals(keep)) {
                p.setStatus(ProposalStatus.REJECTED);
                p.setRespondedAt(now);
            }
        }
    }

    /**
     * Bumps {@code updatedAt}, never moving it backwards.
     */
    public void touch(Instant now) {
        if (updatedAt == null || now.isAfter(updatedAt)) {
            updatedAt = now;
        }
    }
}
