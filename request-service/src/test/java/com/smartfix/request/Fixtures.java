package com.smartfix.request;

import com.smartfix.request.entity.Budget;
import com.smartfix.request.entity.DailyAvailability;
import com.smartfix.request.entity.GeoLocation;
import com.smartfix.request.entity.PaymentRecord;
import com.smartfix.request.entity.Proposal;
import com.smartfix.request.entity.ServiceArea;
import com.smartfix.request.entity.ServiceProvider;
import com.smartfix.request.entity.ServiceRequest;
import com.smartfix.request.model.ServiceRequestDraft;
import com.smartfix.shared.enums.ProposalStatus;
import com.smartfix.shared.enums.RequestPriority;
import com.smartfix.shared.enums.RequestStatus;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Shared test data. The fixed clock reads Monday 2026-03-02 12:00 UTC.
 */
public final class Fixtures {

    public static final Instant NOW = Instant.parse("2026-03-02T12:00:00Z");
    public static final String REQUESTER_ID = "usr_requester";
    public static final String SERVICE_TYPE = "plumbing";

    // Empire State Building
    public static final double ORIGIN_LNG = -73.9857;
    public static final double ORIGIN_LAT = 40.7484;

    private Fixtures() {}

    public static Clock clock() {
        return Clock.fixed(NOW, ZoneOffset.UTC);
    }

    /**
     * Longitude {@code km} east of the origin on the origin's latitude.
     */
    public static double lngEastOfOrigin(double km) {
        return ORIGIN_LNG + km / (111.195 * Math.cos(Math.toRadians(ORIGIN_LAT)));
    }

    public static ServiceRequest pendingRequest(UUID id) {
        return ServiceRequest.builder()
                .id(id)
                .version(0L)
                .requesterId(REQUESTER_ID)
                .category("home-repair")
                .serviceType(SERVICE_TYPE)
                .title("Fix leaking sink")
                .description("Kitchen sink drips constantly under the basin")
                .requirements(new ArrayList<>(List.of("bring replacement washers")))
                .images(new ArrayList<>())
                .scheduledDate(NOW.plus(Duration.ofDays(1)))
                .estimatedDurationHours(2.0)
                .location(GeoLocation.builder().longitude(ORIGIN_LNG).latitude(ORIGIN_LAT).address("350 5th Ave").build())
                .budget(Budget.builder().minAmount(new BigDecimal("100")).maxAmount(new BigDecimal("500")).currency("USD").build())
                .priority(RequestPriority.MEDIUM)
                .status(RequestStatus.PENDING)
                .payment(PaymentRecord.unpaid())
                .createdAt(NOW.minus(Duration.ofHours(1)))
                .updatedAt(NOW.minus(Duration.ofHours(1)))
                .build();
    }

    public static Proposal proposal(UUID id, String providerId, String price) {
        return Proposal.builder()
                .id(id)
                .version(0L)
                .providerId(providerId)
                .price(new BigDecimal(price))
                .message("Can do it tomorrow")
                .status(ProposalStatus.PENDING)
                .submittedAt(NOW.minus(Duration.ofMinutes(30)))
                .build();
    }

    public static ServiceProvider provider(String id, double lng, double lat, double radiusKm, String hourlyRate) {
        Map<DayOfWeek, DailyAvailability> availability = new EnumMap<>(DayOfWeek.class);
        for (DayOfWeek day : DayOfWeek.values()) {
            availability.put(day, new DailyAvailability(true, LocalTime.of(8, 0), LocalTime.of(18, 0)));
        }
        return ServiceProvider.builder()
                .id(id)
                .userId("usr_" + id)
                .businessName("Provider " + id)
                .services(Set.of(SERVICE_TYPE))
                .serviceArea(new ServiceArea(lng, lat, radiusKm))
                .hourlyRate(hourlyRate != null ? new BigDecimal(hourlyRate) : null)
                .fixedPrices(new HashMap<>())
                .availability(availability)
                .verified(true)
                .available(true)
                .rating(4.5)
                .ratingCount(10)
                .completedJobs(20)
                .build();
    }

    public static ServiceRequestDraft draft() {
        return ServiceRequestDraft.builder()
                .category("home-repair")
                .serviceType(SERVICE_TYPE)
                .title("Fix leaking sink")
                .description("Kitchen sink drips constantly under the basin")
                .requirements(new ArrayList<>(List.of("bring replacement washers")))
                .scheduledDate(NOW.plus(Duration.ofDays(2)))
                .estimatedDurationHours(2.0)
                .location(new ServiceRequestDraft.LocationInput(ORIGIN_LNG, ORIGIN_LAT, "350 5th Ave"))
                .budget(new ServiceRequestDraft.BudgetInput(new BigDecimal("100"), new BigDecimal("500"), null))
                .build();
    }
}
