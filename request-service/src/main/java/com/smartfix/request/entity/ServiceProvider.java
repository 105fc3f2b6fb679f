package com.smartfix.request.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.Instant;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Provider profile as held by the provider directory. The request service reads it
 * and only ever changes {@code completedJobs}.
 */
@Entity
@Table(name = "service_providers",
        indexes = {
                @Index(name = "idx_provider_user", columnList = "user_id", unique = true)
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = "id")
public class ServiceProvider {

    @Id
    private String id;

    @Column(name = "user_id", nullable = false, unique = true)
    private String userId;

    @Column(name = "business_name", nullable = false)
    private String businessName;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "provider_services", joinColumns = @JoinColumn(name = "provider_id"))
    @Column(name = "service_name")
    @Builder.Default
    private Set<String> services = new HashSet<>();

    @Embedded
    private ServiceArea serviceArea;

    @Column(name = "hourly_rate", precision = 12, scale = 2)
    private BigDecimal hourlyRate;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "provider_fixed_prices", joinColumns = @JoinColumn(name = "provider_id"))
    @MapKeyColumn(name = "service_name")
    @Column(name = "price", precision = 12, scale = 2)
    @Builder.Default
    private Map<String, BigDecimal> fixedPrices = new HashMap<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "provider_availability", joinColumns = @JoinColumn(name = "provider_id"))
    @MapKeyEnumerated(EnumType.STRING)
    @MapKeyColumn(name = "day_of_week")
    @Builder.Default
    private Map<DayOfWeek, DailyAvailability> availability = new EnumMap<>(DayOfWeek.class);

    @Column(nullable = false)
    private boolean verified;

    @Column(nullable = false)
    private boolean available;

    @Column(nullable = false)
    private double rating;

    @Column(name = "rating_count", nullable = false)
    private int ratingCount;

    @Column(name = "completed_jobs", nullable = false)
    private int completedJobs;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    /**
     * Fixed price for a service type, matched case-insensitively.
     */
    public Optional<BigDecimal> fixedPriceFor(String serviceType) {
        if (serviceType == null || fixedPrices == null) {
            return Optional.empty();
        }
        String wanted = serviceType.toLowerCase(Locale.ROOT);
        return fixedPrices.entrySet().stream()
                .filter(e -> e.getKey() != null && e.getKey().toLowerCase(Locale.ROOT).equals(wanted))
                .map(Map.Entry::getValue)
                .findFirst();
    }

    public boolean isAvailableOn(DayOfWeek day) {
        DailyAvailability slot = availability == null ? null : availability.get(day);
        return slot != null && slot.isAvailable();
    }
}
