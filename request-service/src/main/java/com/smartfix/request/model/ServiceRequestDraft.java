package com.smartfix.request.model;

import com.smartfix.shared.enums.RequestPriority;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Customer input for a new request. Also the shape an update is merged into before
 * it is re-validated.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ServiceRequestDraft {

    @NotBlank
    private String category;

    @NotBlank
    private String serviceType;

    @NotBlank
    @Size(min = 5, max = 200)
    private String title;

    @NotBlank
    @Size(min = 10, max = 2000)
    private String description;

    @Builder.Default
    private List<@NotBlank String> requirements = new ArrayList<>();

    @Builder.Default
    private List<@NotBlank String> images = new ArrayList<>();

    @NotNull
    private Instant scheduledDate;

    @NotNull
    @DecimalMin("0.5") @DecimalMax("24.0")
    private Double estimatedDurationHours;

    @NotNull
    @Valid
    private LocationInput location;

    @NotNull
    @Valid
    private BudgetInput budget;

    private RequestPriority priority;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class LocationInput {

        @NotNull
        @DecimalMin("-180.0") @DecimalMax("180.0")
        private Double longitude;

        @NotNull
        @DecimalMin("-90.0") @DecimalMax("90.0")
        private Double latitude;

        @Size(max = 500)
        private String address;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class BudgetInput {

        @NotNull
        @DecimalMin("0.0")
        private BigDecimal min;

        @NotNull
        @DecimalMin("0.0")
        private BigDecimal max;

        @Size(min = 3, max = 3)
        private String currency;
    }
}
