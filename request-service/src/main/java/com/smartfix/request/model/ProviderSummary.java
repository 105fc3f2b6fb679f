package com.smartfix.request.model;

import com.smartfix.request.entity.ServiceProvider;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Set;

@Value
@Builder
public class ProviderSummary {

    String id;
    String businessName;
    Set<String> services;
    BigDecimal hourlyRate;
    double rating;
    int ratingCount;
    int completedJobs;

    public static ProviderSummary from(ServiceProvider provider) {
        return ProviderSummary.builder()
                .id(provider.getId())
                .businessName(provider.getBusinessName())
                .services(Set.copyOf(provider.getServices()))
                .hourlyRate(provider.getHourlyRate())
                .rating(provider.getRating())
                .ratingCount(provider.getRatingCount())
                .completedJobs(provider.getCompletedJobs())
                .build();
    }
}
