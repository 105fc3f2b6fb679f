package com.smartfix.request.service;

import com.smartfix.request.model.ProviderSummary;
import com.smartfix.shared.featureflag.FeatureFlagService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.util.List;

/**
 * Matches and notifies providers for a new request once it is committed.
 * Gated by the {@code auto_match_on_create} flag.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AutoMatchOnCreateListener {

    private final RequestLifecycleService lifecycleService;
    private final FeatureFlagService featureFlagService;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onRequestCreated(ServiceRequestCreated event) {
        if (!featureFlagService.isEnabled(FeatureFlagService.AUTO_MATCH_ON_CREATE, true)) {
            log.debug("Auto-match on create disabled, request {} left for recommendations", event.getRequestId());
            return;
        }
        try {
            List<ProviderSummary> matched = lifecycleService.autoMatchAndNotify(event.getRequestId());
            log.info("Auto-matched {} providers for request {}", matched.size(), event.getRequestId());
        } catch (RuntimeException e) {
            // the request is already committed and stays visible through recommendations
            log.error("Auto-match failed for request {}: {}", event.getRequestId(), e.getMessage(), e);
        }
    }
}
