package com.smartfix.request.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.smartfix.request.entity.Budget;
import com.smartfix.request.entity.CancellationRecord;
import com.smartfix.request.entity.CompletionRecord;
import com.smartfix.request.entity.GeoLocation;
import com.smartfix.request.entity.PaymentRecord;
import com.smartfix.request.entity.Proposal;
import com.smartfix.request.entity.ServiceRequest;
import com.smartfix.shared.enums.PaymentStatus;
import com.smartfix.shared.enums.ProposalStatus;
import com.smartfix.shared.enums.RequestPriority;
import com.smartfix.shared.enums.RequestStatus;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Detached snapshot of a request. Built inside the transaction that loaded the entity.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RequestResponse {

    private UUID requestId;
    private String requesterId;
    private String providerId;
    private String category;
    private String serviceType;
    private String title;
    private String description;
    private List<String> requirements;
    private List<String> images;
    private Instant scheduledDate;
    private double estimatedDurationHours;
    private double longitude;
    private double latitude;
    private String address;
    private BigDecimal budgetMin;
    private BigDecimal budgetMax;
    private String currency;
    private RequestPriority priority;
    private RequestStatus status;
    private List<ProposalView> proposals;
    private CompletionView completion;
    private PaymentView payment;
    private CancellationView cancellation;
    private String chatChannelId;
    private Instant createdAt;
    private Instant updatedAt;

    @Data
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ProposalView {
        private UUID proposalId;
        private String providerId;
        private BigDecimal price;
        private String message;
        private Double estimatedDurationHours;
        private ProposalStatus status;
        private Instant submittedAt;
        private Instant respondedAt;
    }

    @Data
    @Builder
    public static class CompletionView {
        private String notes;
        private List<String> images;
        private boolean customerApproval;
        private Instant completedAt;
    }

    @Data
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class PaymentView {
        private PaymentStatus status;
        private BigDecimal amount;
        private Instant paidAt;
    }

    @Data
    @Builder
    public static class CancellationView {
        private String cancelledBy;
        private String reason;
        private Instant cancelledAt;
    }

    public static RequestResponse from(ServiceRequest r) {
        GeoLocation location = r.getLocation();
        Budget budget = r.getBudget();
        return RequestResponse.builder()
                .requestId(r.getId())
                .requesterId(r.getRequesterId())
                .providerId(r.getProviderId())
                .category(r.getCategory())
                .serviceType(r.getServiceType())
                .title(r.getTitle())
                .description(r.getDescription())
                .requirements(List.copyOf(r.getRequirements()))
                .images(List.copyOf(r.getImages()))
                .scheduledDate(r.getScheduledDate())
                .estimatedDurationHours(r.getEstimatedDurationHours())
                .longitude(location.getLongitude())
                .latitude(location.getLatitude())
                .address(location.getAddress())
                .budgetMin(budget.getMinAmount())
                .budgetMax(budget.getMaxAmount())
                .currency(budget.getCurrency())
                .priority(r.getPriority())
                .status(r.getStatus())
                .proposals(r.getProposals().stream().map(RequestResponse::toView).toList())
                .completion(toView(r.getCompletion(), r.getCompletionImages()))
                .payment(toView(r.getPayment()))
                .cancellation(toView(r.getCancellation()))
                .chatChannelId(r.getChatChannelId())
                .createdAt(r.getCreatedAt())
                .updatedAt(r.getUpdatedAt())
                .build();
    }

    private static ProposalView toView(Proposal p) {
        return ProposalView.builder()
                .proposalId(p.getId())
                .providerId(p.getProviderId())
                .price(p.getPrice())
                .message(p.getMessage())
                .estimatedDurationHours(p.getEstimatedDurationHours())
                .status(p.getStatus())
                .submittedAt(p.getSubmittedAt())
                .respondedAt(p.getRespondedAt())
                .build();
    }

    private static CompletionView toView(CompletionRecord c, List<String> images) {
        if (c == null || c.getCompletedAt() == null) {
            return null;
        }
        return CompletionView.builder()
                .notes(c.getNotes())
                .images(List.copyOf(images))
                .customerApproval(c.isApproved())
                .completedAt(c.getCompletedAt())
                .build();
    }

    private static PaymentView toView(PaymentRecord p) {
        if (p == null) {
            return null;
        }
        return PaymentView.builder().status(p.getStatus()).amount(p.getAmount()).paidAt(p.getPaidAt()).build();
    }

    private static CancellationView toView(CancellationRecord c) {
        if (c == null || c.getCancelledAt() == null) {
            return null;
        }
        return CancellationView.builder()
                .cancelledBy(c.getCancelledBy())
                .reason(c.getReason())
                .cancelledAt(c.getCancelledAt())
                .build();
    }
}
