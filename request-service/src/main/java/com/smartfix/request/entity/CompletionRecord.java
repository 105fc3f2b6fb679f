package com.smartfix.request.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Populated when the assigned provider completes the job. Completion photos live
 * on {@link ServiceRequest#getCompletionImages()}.
 */
@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompletionRecord {

    @Column(name = "completion_notes", length = 1000)
    private String notes;

    @Column(name = "customer_approval")
    private Boolean customerApproval;

    @Column(name = "completed_at")
    private Instant completedAt;

    public boolean isApproved() {
        return Boolean.TRUE.equals(customerApproval);
    }
}
