package com.smartfix.request.model;

import com.smartfix.shared.enums.RequestPriority;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * The fields a requester may change on a pending request. Null means "leave as is".
 * Location, category and service type are fixed once posted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateRequestFields {

    private String title;
    private String description;
    private List<String> requirements;
    private List<String> images;
    private Instant scheduledDate;
    private Double estimatedDurationHours;
    private ServiceRequestDraft.BudgetInput budget;
    private RequestPriority priority;

    /**
     * Overlays the non-null fields on {@code current}.
     */
    public ServiceRequestDraft mergeInto(ServiceRequestDraft current) {
        ServiceRequestDraft.ServiceRequestDraftBuilder merged = current.toBuilder();
        if (title != null) merged.title(title);
        if (description != null) merged.description(description);
        if (requirements != null) merged.requirements(requirements);
        if (images != null) merged.images(images);
        if (scheduledDate != null) merged.scheduledDate(scheduledDate);
        if (estimatedDurationHours != null) merged.estimatedDurationHours(estimatedDurationHours);
        if (budget != null) merged.budget(budget);
        if (priority != null) merged.priority(priority);
        return merged.build();
    }
}
