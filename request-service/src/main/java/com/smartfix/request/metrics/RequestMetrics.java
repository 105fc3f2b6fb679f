package com.smartfix.request.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Custom Micrometer metrics for the Request Service.
 *
 * Metrics exposed at /actuator/prometheus:
 *
 *   smartfix_requests_created_total
 *   smartfix_proposals_submitted_total
 *   smartfix_request_transitions_total{transition="accept|start|complete|..."}
 *   smartfix_acceptance_conflicts_total
 *   smartfix_matching_seconds{quantile="0.5|0.95|0.99"}
 */
@Component
public class RequestMetrics {

    private final MeterRegistry registry;
    private final Counter requestCreatedCounter;
    private final Counter proposalSubmittedCounter;
    private final Counter acceptanceConflictCounter;
    private final Counter matchedProvidersCounter;
    private final Timer   matchingTimer;

    public RequestMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.requestCreatedCounter = Counter.builder("smartfix.requests.created")
                .description("Service requests created")
                .register(registry);

        this.proposalSubmittedCounter = Counter.builder("smartfix.proposals.submitted")
                .description("Proposals submitted by providers")
                .register(registry);

        this.acceptanceConflictCounter = Counter.builder("smartfix.acceptance.conflicts")
                .description("Accept attempts that lost the conditional write")
                .register(registry);

        this.matchedProvidersCounter = Counter.builder("smartfix.matching.providers")
                .description("Providers returned by matching runs")
                .register(registry);

        this.matchingTimer = Timer.builder("smartfix.matching")
                .description("Provider matching latency")
                .publishPercentiles(0.5, 0.95, 0.99)
                .minimumExpectedValue(Duration.ofMillis(1))
                .maximumExpectedValue(Duration.ofSeconds(2))
                .register(registry);
    }

    public void recordRequestCreated()       { requestCreatedCounter.increment(); }
    public void recordProposalSubmitted()    { proposalSubmittedCounter.increment(); }
    public void recordAcceptanceConflict()   { acceptanceConflictCounter.increment(); }
    public void recordMatched(int providers) { matchedProvidersCounter.increment(providers); }
    public Timer getMatchingTimer()          { return matchingTimer; }

    public void recordTransition(String transition) {
        registry.counter("smartfix.request.transitions", "transition", transition).increment();
    }
}
