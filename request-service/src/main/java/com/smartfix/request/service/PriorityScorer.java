package com.smartfix.request.service;

import com.smartfix.request.entity.ServiceRequest;
import com.smartfix.shared.enums.RequestPriority;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Ranks requests in a provider's feed. Score is in [0, 200]:
 *
 *   base(priority)                 urgent 100, high 75, medium 50, low 25
 *   + min(budget.max / 100, 50)
 *   + date band                    days <= 1: 30, <= 3: 20, <= 7: 10
 *
 * Days until the scheduled date are rounded up. The result is truncated to an int.
 */
@Service
@RequiredArgsConstructor
public class PriorityScorer {

    static final int MAX_SCORE = 200;
    private static final double MAX_BUDGET_POINTS = 50.0;
    private static final long DAY_MILLIS = Duration.ofDays(1).toMillis();

    private final Clock clock;

    public int score(ServiceRequest request) {
        RequestPriority priority = request.getPriority() != null ? request.getPriority() : RequestPriority.MEDIUM;
        double score = priority.getBaseScore();

        if (request.getBudget() != null && request.getBudget().getMaxAmount() != null) {
            score += budgetPoints(request.getBudget().getMaxAmount());
        }

        score += dateBandPoints(daysUntil(request.getScheduledDate()));

        return (int) Math.max(0, Math.min(MAX_SCORE, score));
    }

    long daysUntil(Instant scheduledDate) {
        long millis = Duration.between(Instant.now(clock), scheduledDate).toMillis();
        return Math.floorDiv(millis + DAY_MILLIS - 1, DAY_MILLIS);
    }

    private static double budgetPoints(BigDecimal maxBudget) {
        return Math.min(maxBudget.doubleValue() / 100.0, MAX_BUDGET_POINTS);
    }

    private static int dateBandPoints(long days) {
        if (days <= 1) return 30;
        if (days <= 3) return 20;
        if (days <= 7) return 10;
        return 0;
    }
}
