package com.smartfix.request.service;

import com.smartfix.request.entity.Budget;
import com.smartfix.request.entity.CancellationRecord;
import com.smartfix.request.entity.CompletionRecord;
import com.smartfix.request.entity.GeoLocation;
import com.smartfix.request.entity.PaymentRecord;
import com.smartfix.request.entity.Proposal;
import com.smartfix.request.entity.ServiceProvider;
import com.smartfix.request.entity.ServiceRequest;
import com.smartfix.request.exception.AuthorizationException;
import com.smartfix.request.exception.NotFoundException;
import com.smartfix.request.exception.ValidationException;
import com.smartfix.request.gateway.ChatGateway;
import com.smartfix.request.gateway.NotificationGateway;
import com.smartfix.request.gateway.ProviderDirectory;
import com.smartfix.request.gateway.UserDirectory;
import com.smartfix.request.metrics.RequestMetrics;
import com.smartfix.request.model.CompletionReport;
import com.smartfix.request.model.ProposalSubmission;
import com.smartfix.request.model.ProviderSummary;
import com.smartfix.request.model.RequestResponse;
import com.smartfix.request.model.ServiceRequestDraft;
import com.smartfix.request.model.UpdateRequestFields;
import com.smartfix.request.repository.ServiceRequestRepository;
import com.smartfix.shared.enums.PaymentStatus;
import com.smartfix.shared.enums.ProposalStatus;
import com.smartfix.shared.enums.RequestPriority;
import com.smartfix.shared.enums.RequestStatus;
import com.smartfix.shared.events.RequestStatusChangedEvent;
import com.smartfix.shared.featureflag.FeatureFlagService;
import com.smartfix.shared.util.KafkaTopics;
import jakarta.persistence.OptimisticLockException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.IdGenerator;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Service request state machine.
 *
 * Lifecycle:
 *   PENDING ──accept──▶ ACCEPTED ──start──▶ IN_PROGRESS ──complete──▶ COMPLETED ──approve (payment flag)
 *      └────────────────────┴──────────────────┴──cancel──▶ CANCELLED
 *
 * Guards run in the order existence, lifecycle state, acting party, input, and all of
 * them run before the first write. Acceptance is a single conditional UPDATE keyed on
 * status = PENDING. The other transitions are versioned saves, so a concurrent writer
 * that got there first turns a stale save into a ValidationException.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RequestLifecycleService {

    static final String DEFAULT_CURRENCY = "USD";
    static final String DEFAULT_CANCEL_REASON = "No reason provided";
    private static final int MAX_CANCEL_REASON_LENGTH = 500;

    private final ServiceRequestRepository requestRepository;
    private final ProviderDirectory providerDirectory;
    private final UserDirectory userDirectory;
    private final ChatGateway chatGateway;
    private final NotificationGateway notificationGateway;
    private final MatchingEngine matchingEngine;
    private final FeatureFlagService featureFlagService;
    private final RequestMetrics metrics;
    private final Validator validator;
    private final Clock clock;
    private final IdGenerator idGenerator;
    private final ApplicationEventPublisher eventPublisher;

    @Transactional
    public RequestResponse createRequest(String requesterId, ServiceRequestDraft draft) {
        userDirectory.findUser(requesterId)
                .orElseThrow(() -> new NotFoundException(NotFoundException.USER_NOT_FOUND,
                        "User " + requesterId + " not found"));
        validateDraft(draft, true);

        Instant now = Instant.now(clock);
        ServiceRequest request = ServiceRequest.builder()
                .id(idGenerator.generateId())
                .requesterId(requesterId)
                .category(draft.getCategory())
                .serviceType(draft.getServiceType())
                .title(draft.getTitle())
                .description(draft.getDescription())
                .requirements(copyOrEmpty(draft.getRequirements()))
                .images(copyOrEmpty(draft.getImages()))
                .scheduledDate(draft.getScheduledDate())
                .estimatedDurationHours(draft.getEstimatedDurationHours())
                .location(GeoLocation.builder()
                        .longitude(draft.getLocation().getLongitude())
                        .latitude(draft.getLocation().getLatitude())
                        .address(draft.getLocation().getAddress())
                        .build())
                .budget(toBudget(draft.getBudget()))
                .priority(draft.getPriority() != null ? draft.getPriority() : RequestPriority.MEDIUM)
                .status(RequestStatus.PENDING)
                .payment(PaymentRecord.unpaid())
                .createdAt(now)
                .updatedAt(now)
                .build();

        request = requestRepository.save(request);
        metrics.recordRequestCreated();
        notificationGateway.publishStatusChange(KafkaTopics.REQUEST_CREATED, statusEvent(request, null, null, now));
        log.info("Request {} created by {} for service {}", request.getId(), requesterId, request.getServiceType());

        eventPublisher.publishEvent(new ServiceRequestCreated(request.getId()));

        return RequestResponse.from(request);
    }

    @Transactional(readOnly = true)
    public RequestResponse getRequest(UUID requestId) {
        return RequestResponse.from(getRequestOrThrow(requestId));
    }

    @Transactional
    public RequestResponse updateRequest(UUID requestId, String actingUserId, UpdateRequestFields fields) {
        ServiceRequest request = getRequestOrThrow(requestId);
        RequestTransition.UPDATE.checkFrom(requestId, request.getStatus());
        requireRequester(request, actingUserId);

        ServiceRequestDraft merged = fields.mergeInto(toDraft(request));
        validateDraft(merged, fields.getScheduledDate() != null);

        request.setTitle(merged.getTitle());
        request.setDescription(merged.getDescription());
        request.setRequirements(copyOrEmpty(merged.getRequirements()));
        request.setImages(copyOrEmpty(merged.getImages()));
        request.setScheduledDate(merged.getScheduledDate());
        request.setEstimatedDurationHours(merged.getEstimatedDurationHours());
        request.setBudget(toBudget(merged.getBudget()));
        request.setPriority(merged.getPriority() != null ? merged.getPriority() : request.getPriority());

        Instant now = Instant.now(clock);
        request.touch(now);
        request = persist(request, RequestTransition.UPDATE);

        publish(RequestTransition.UPDATE, request, null, null, now);
        log.info("Request {} updated by {}", requestId, actingUserId);
        return RequestResponse.from(request);
    }

    @Transactional
    public RequestResponse submitProposal(UUID requestId, String providerId, ProposalSubmission submission) {
        ServiceRequest request = getRequestOrThrow(requestId);
        RequestTransition.SUBMIT_PROPOSAL.checkFrom(requestId, request.getStatus());
        getProviderOrThrow(providerId);

        if (request.hasProposalFrom(providerId)) {
            throw new ValidationException(ValidationException.DUPLICATE_PROPOSAL,
                    "Provider " + providerId + " has already submitted a proposal for request " + requestId);
        }
        validateInput(submission);

        Instant now = Instant.now(clock);
        Proposal proposal = Proposal.builder()
                .id(idGenerator.generateId())
                .providerId(providerId)
                .price(submission.getPrice())
                .message(submission.getMessage())
                .estimatedDurationHours(submission.getEstimatedDurationHours())
                .status(ProposalStatus.PENDING)
                .submittedAt(now)
                .build();
        request.addProposal(proposal);
        request.touch(now);
        request = persist(request, RequestTransition.SUBMIT_PROPOSAL);

        metrics.recordProposalSubmitted();
        publish(RequestTransition.SUBMIT_PROPOSAL, request, proposal.getId(), null, now);
        log.info("Proposal {} submitted on request {} by provider {} price={}",
                proposal.getId(), requestId, providerId, submission.getPrice());
        return RequestResponse.from(request);
    }

    @Transactional
    public RequestResponse withdrawProposal(UUID requestId, UUID proposalId, String actingUserId) {
        ServiceRequest request = getRequestOrThrow(requestId);
        RequestTransition.WITHDRAW_PROPOSAL.checkFrom(requestId, request.getStatus());
        Proposal proposal = getProposalOrThrow(request, proposalId);

        ServiceProvider provider = getProviderOrThrow(proposal.getProviderId());
        if (!provider.getUserId().equals(actingUserId)) {
            throw new AuthorizationException(AuthorizationException.NOT_PROPOSAL_OWNER,
                    "Only the provider who submitted proposal " + proposalId + " can withdraw it");
        }
        requirePending(proposal);

        Instant now = Instant.now(clock);
        proposal.setStatus(ProposalStatus.WITHDRAWN);
        proposal.setRespondedAt(now);
        request.touch(now);
        request = persist(request, RequestTransition.WITHDRAW_PROPOSAL);

        publish(RequestTransition.WITHDRAW_PROPOSAL, request, proposalId, null, now);
        log.info("Proposal {} on request {} withdrawn", proposalId, requestId);
        return RequestResponse.from(request);
    }

    /**
     * The status flip and provider assignment happen in one conditional UPDATE. Of two
     * concurrent calls only one sees a row updated; the other gets REQUEST_UNAVAILABLE.
     * Sibling rejection and the chat channel follow in the same transaction, so a chat
     * failure rolls the acceptance back.
     */
    @Transactional
    public RequestResponse acceptProposal(UUID requestId, UUID proposalId, String actingUserId) {
        ServiceRequest request = getRequestOrThrow(requestId);
        RequestTransition.ACCEPT_PROPOSAL.checkFrom(requestId, request.getStatus());
        requireRequester(request, actingUserId);
        Proposal proposal = getProposalOrThrow(request, proposalId);
        requirePending(proposal);
        ServiceProvider provider = getProviderOrThrow(proposal.getProviderId());

        Instant now = Instant.now(clock);
        int updated = requestRepository.acceptIfPending(requestId, proposal.getProviderId(), proposal.getPrice(), now);
        if (updated == 0) {
            metrics.recordAcceptanceConflict();
            log.warn("Accept of proposal {} lost the race on request {}", proposalId, requestId);
            throw new ValidationException(ValidationException.REQUEST_UNAVAILABLE,
                    "Request " + requestId + " is no longer available");
        }

        ServiceRequest accepted = getRequestOrThrow(requestId);
        Proposal winner = getProposalOrThrow(accepted, proposalId);
        winner.setStatus(ProposalStatus.ACCEPTED);
        winner.setRespondedAt(now);
        accepted.rejectPendingProposals(proposalId, now);

        ChatGateway.ChannelRef channel = chatGateway.createChannel(requestId,
                List.of(accepted.getRequesterId(), provider.getUserId()));
        accepted.setChatChannelId(channel.getChannelId());
        accepted = persist(accepted, RequestTransition.ACCEPT_PROPOSAL);

        metrics.recordTransition(RequestTransition.ACCEPT_PROPOSAL.metricTag());
        publish(RequestTransition.ACCEPT_PROPOSAL, accepted, proposalId, null, now);
        log.info("Request {} accepted: proposal {} provider {} channel {}",
                requestId, proposalId, proposal.getProviderId(), channel.getChannelId());
        return RequestResponse.from(accepted);
    }

    @Transactional
    public RequestResponse startService(UUID requestId, String actingProviderUserId) {
        ServiceRequest request = getRequestOrThrow(requestId);
        RequestTransition.START.checkFrom(requestId, request.getStatus());
        requireAssignedProvider(request, actingProviderUserId);

        Instant now = Instant.now(clock);
        request.setStatus(RequestStatus.IN_PROGRESS);
        request.touch(now);
        request = persist(request, RequestTransition.START);

        metrics.recordTransition(RequestTransition.START.metricTag());
        publish(RequestTransition.START, request, null, null, now);
        log.info("Request {} started by provider {}", requestId, request.getProviderId());
        return RequestResponse.from(request);
    }

    @Transactional
    public RequestResponse completeService(UUID requestId, String actingProviderUserId, CompletionReport report) {
        ServiceRequest request = getRequestOrThrow(requestId);
        RequestTransition.COMPLETE.checkFrom(requestId, request.getStatus());
        requireAssignedProvider(request, actingProviderUserId);
        validateInput(report);

        Instant now = Instant.now(clock);
        request.setStatus(RequestStatus.COMPLETED);
        request.setCompletion(CompletionRecord.builder()
                .notes(report.getNotes())
                .customerApproval(false)
                .completedAt(now)
                .build());
        request.getCompletionImages().clear();
        if (report.getImages() != null) {
            request.getCompletionImages().addAll(report.getImages());
        }
        request.touch(now);
        request = persist(request, RequestTransition.COMPLETE);

        providerDirectory.incrementCompletedJobs(request.getProviderId());

        metrics.recordTransition(RequestTransition.COMPLETE.metricTag());
        publish(RequestTransition.COMPLETE, request, null, null, now);
        log.info("Request {} completed by provider {}", requestId, request.getProviderId());
        return RequestResponse.from(request);
    }

    @Transactional
    public RequestResponse approveCompletion(UUID requestId, String actingUserId) {
        ServiceRequest request = getRequestOrThrow(requestId);
        RequestTransition.APPROVE.checkFrom(requestId, request.getStatus());
        if (request.getCompletion() != null && request.getCompletion().isApproved()) {
            throw new ValidationException(ValidationException.INVALID_STATE,
                    "Completion of request " + requestId + " is already approved");
        }
        requireRequester(request, actingUserId);

        Instant now = Instant.now(clock);
        CompletionRecord completion = request.getCompletion() != null ? request.getCompletion() : new CompletionRecord();
        completion.setCustomerApproval(true);
        request.setCompletion(completion);
        PaymentRecord payment = request.getPayment() != null ? request.getPayment() : PaymentRecord.unpaid();
        payment.setStatus(PaymentStatus.PAID);
        payment.setPaidAt(now);
        request.setPayment(payment);
        request.touch(now);
        request = persist(request, RequestTransition.APPROVE);

        providerDirectory.requestRatingRefresh(request.getProviderId(), requestId);

        metrics.recordTransition(RequestTransition.APPROVE.metricTag());
        publish(RequestTransition.APPROVE, request, null, null, now);
        log.info("Completion of request {} approved by {}", requestId, actingUserId);
        return RequestResponse.from(request);
    }

    @Transactional
    public RequestResponse cancelRequest(UUID requestId, String actingUserId, String reason) {
        ServiceRequest request = getRequestOrThrow(requestId);
        RequestTransition.CANCEL.checkFrom(requestId, request.getStatus());
        if (!request.getRequesterId().equals(actingUserId) && !isAssignedProvider(request, actingUserId)) {
            throw new AuthorizationException(AuthorizationException.NOT_REQUEST_PARTY,
                    "Only the requester or the assigned provider can cancel request " + requestId);
        }
        if (reason != null && reason.length() > MAX_CANCEL_REASON_LENGTH) {
            throw ValidationException.invalid(List.of("reason: size must be between 0 and " + MAX_CANCEL_REASON_LENGTH));
        }

        Instant now = Instant.now(clock);
        String effectiveReason = reason == null || reason.isBlank() ? DEFAULT_CANCEL_REASON : reason;
        request.setStatus(RequestStatus.CANCELLED);
        request.setCancellation(CancellationRecord.builder()
                .cancelledBy(actingUserId)
                .reason(effectiveReason)
                .cancelledAt(now)
                .build());
        request.rejectPendingProposals(null, now);
        request.touch(now);
        request = persist(request, RequestTransition.CANCEL);

        metrics.recordTransition(RequestTransition.CANCEL.metricTag());
        publish(RequestTransition.CANCEL, request, null, effectiveReason, now);
        log.info("Request {} cancelled by {}: {}", requestId, actingUserId, effectiveReason);
        return RequestResponse.from(request);
    }

    /**
     * Runs auto-match for a stored request and hands the provider ids to the
     * notification gateway. Runs in its own transaction so it can be called after
     * the creating transaction has committed.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW, readOnly = true)
    public List<ProviderSummary> autoMatchAndNotify(UUID requestId) {
        List<ServiceProvider> providers = matchingEngine.autoMatchServiceRequest(requestId);
        if (!providers.isEmpty()
                && featureFlagService.isEnabled(FeatureFlagService.PROVIDER_NOTIFICATIONS, true)) {
            notificationGateway.notify(providers.stream().map(ServiceProvider::getId).toList(), requestId);
        }
        return providers.stream().map(ProviderSummary::from).toList();
    }

    // ── Guards ───────────────────────────────────────────────────────────────

    private ServiceRequest getRequestOrThrow(UUID requestId) {
        return requestRepository.findById(requestId)
                .orElseThrow(() -> new NotFoundException(NotFoundException.REQUEST_NOT_FOUND,
                        "Request " + requestId + " not found"));
    }

    private ServiceProvider getProviderOrThrow(String providerId) {
        return providerDirectory.findById(providerId)
                .orElseThrow(() -> new NotFoundException(NotFoundException.PROVIDER_NOT_FOUND,
                        "Provider " + providerId + " not found"));
    }

    private Proposal getProposalOrThrow(ServiceRequest request, UUID proposalId) {
        return request.findProposal(proposalId)
                .orElseThrow(() -> new ValidationException(ValidationException.INVALID_PROPOSAL,
                        "Proposal " + proposalId + " does not exist on request " + request.getId()));
    }

    private void requirePending(Proposal proposal) {
        if (proposal.getStatus() != ProposalStatus.PENDING) {
            throw new ValidationException(ValidationException.INVALID_PROPOSAL,
                    "Proposal " + proposal.getId() + " is " + proposal.getStatus());
        }
    }

    private void requireRequester(ServiceRequest request, String actingUserId) {
        if (!request.getRequesterId().equals(actingUserId)) {
            throw new AuthorizationException(AuthorizationException.NOT_REQUEST_OWNER,
                    "Only the requester can do this on request " + request.getId());
        }
    }

    private void requireAssignedProvider(ServiceRequest request, String actingProviderUserId) {
        if (!isAssignedProvider(request, actingProviderUserId)) {
            throw new AuthorizationException(AuthorizationException.NOT_ASSIGNED_PROVIDER,
                    "Only the assigned provider can do this on request " + request.getId());
        }
    }

    private boolean isAssignedProvider(ServiceRequest request, String actingUserId) {
        if (request.getProviderId() == null || actingUserId == null) {
            return false;
        }
        return providerDirectory.findByUserId(actingUserId)
                .map(p -> p.getId().equals(request.getProviderId()))
                .orElse(false);
    }

    /**
     * Bean constraints plus the cross-field budget rule. The future-date rule applies
     * only when {@code checkScheduledDate} is set, so a pending request whose date has
     * passed can still be edited without moving it.
     */
    private void validateDraft(ServiceRequestDraft draft, boolean checkScheduledDate) {
        List<String> violations = new ArrayList<>(describe(validator.validate(draft)));
        ServiceRequestDraft.BudgetInput budget = draft.getBudget();
        if (budget != null && budget.getMin() != null && budget.getMax() != null
                && budget.getMax().compareTo(budget.getMin()) < 0) {
            violations.add("budget.max: must be greater than or equal to budget.min");
        }
        if (checkScheduledDate && draft.getScheduledDate() != null
                && !draft.getScheduledDate().isAfter(Instant.now(clock))) {
            violations.add("scheduledDate: must be in the future");
        }
        if (!violations.isEmpty()) {
            throw ValidationException.invalid(violations);
        }
    }

    private <T> void validateInput(T input) {
        List<String> violations = describe(validator.validate(input));
        if (!violations.isEmpty()) {
            throw ValidationException.invalid(violations);
        }
    }

    private static <T> List<String> describe(Set<ConstraintViolation<T>> violations) {
        return violations.stream()
                .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                .sorted()
                .toList();
    }

    // ── Persistence & events ─────────────────────────────────────────────────

    private ServiceRequest persist(ServiceRequest request, RequestTransition transition) {
        try {
            return requestRepository.saveAndFlush(request);
        } catch (OptimisticLockException | ObjectOptimisticLockingFailureException e) {
            // another writer changed the request after our guards ran
            log.warn("Concurrent modification while trying to {} request {}", transition.verb(), request.getId());
            throw new ValidationException(ValidationException.REQUEST_UNAVAILABLE,
                    "Request " + request.getId() + " was modified concurrently, cannot " + transition.verb() + " it");
        }
    }

    private void publish(RequestTransition transition, ServiceRequest request, UUID proposalId,
                         String reason, Instant now) {
        notificationGateway.publishStatusChange(transition.topic(), statusEvent(request, proposalId, reason, now));
    }

    private static RequestStatusChangedEvent statusEvent(ServiceRequest request, UUID proposalId,
                                                         String reason, Instant now) {
        return RequestStatusChangedEvent.builder()
                .requestId(request.getId().toString())
                .requesterId(request.getRequesterId())
                .providerId(request.getProviderId())
                .proposalId(proposalId != null ? proposalId.toString() : null)
                .status(request.getStatus())
                .reason(reason)
                .changedAt(now)
                .build();
    }

    private static Budget toBudget(ServiceRequestDraft.BudgetInput input) {
        return Budget.builder()
                .minAmount(input.getMin())
                .maxAmount(input.getMax())
                .currency(input.getCurrency() != null ? input.getCurrency() : DEFAULT_CURRENCY)
                .build();
    }

    private static List<String> copyOrEmpty(List<String> values) {
        return values != null ? new ArrayList<>(values) : new ArrayList<>();
    }

    private static ServiceRequestDraft toDraft(ServiceRequest request) {
        return ServiceRequestDraft.builder()
                .category(request.getCategory())
                .serviceType(request.getServiceType())
                .title(request.getTitle())
                .description(request.getDescription())
                .requirements(new ArrayList<>(request.getRequirements()))
                .images(new ArrayList<>(request.getImages()))
                .scheduledDate(request.getScheduledDate())
                .estimatedDurationHours(request.getEstimatedDurationHours())
                .location(ServiceRequestDraft.LocationInput.builder()
                        .longitude(request.getLocation().getLongitude())
                        .latitude(request.getLocation().getLatitude())
                        .address(request.getLocation().getAddress())
                        .build())
                .budget(ServiceRequestDraft.BudgetInput.builder()
                        .min(request.getBudget().getMinAmount())
                        .max(request.getBudget().getMaxAmount())
                        .currency(request.getBudget().getCurrency())
                        .build())
                .priority(request.getPriority())
                .build();
    }
}
