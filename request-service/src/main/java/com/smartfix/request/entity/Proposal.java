package com.smartfix.request.entity;

import com.smartfix.shared.enums.ProposalStatus;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A provider's bid. Has no identity outside its parent request.
 */
@Entity
@Table(name = "proposals",
        indexes = {
                @Index(name = "idx_proposal_request", columnList = "request_id"),
                @Index(name = "idx_proposal_provider", columnList = "provider_id")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = "id")
public class Proposal {

    @Id
    private UUID id;

    @Version
    private Long version;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "request_id", nullable = false)
    @ToString.Exclude
    private ServiceRequest serviceRequest;

    @Column(name = "provider_id", nullable = false)
    private String providerId;

    @Column(name = "price", precision = 12, scale = 2, nullable = false)
    private BigDecimal price;

    @Column(name = "message", length = 1000)
    private String message;

    @Column(name = "estimated_duration_hours")
    private Double estimatedDurationHours;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ProposalStatus status;

    @Column(name = "submitted_at", nullable = false)
    private Instant submittedAt;

    @Column(name = "responded_at")
    private Instant respondedAt;
}
