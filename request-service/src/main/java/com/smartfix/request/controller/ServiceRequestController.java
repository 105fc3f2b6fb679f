package com.smartfix.request.controller;

import com.smartfix.request.model.CancellationInput;
import com.smartfix.request.model.CompletionReport;
import com.smartfix.request.model.CostEstimate;
import com.smartfix.request.model.ProposalSubmission;
import com.smartfix.request.model.ProviderSummary;
import com.smartfix.request.model.RequestResponse;
import com.smartfix.request.model.ServiceRequestDraft;
import com.smartfix.request.model.UpdateRequestFields;
import com.smartfix.request.service.MatchingEngine;
import com.smartfix.request.service.RequestLifecycleService;
import com.smartfix.shared.dto.ApiResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * Request lifecycle endpoints. The acting user arrives in {@code X-User-Id}, set by
 * the authenticating gateway in front of this service.
 */
@RestController
@RequestMapping("/api/v1/requests")
@RequiredArgsConstructor
public class ServiceRequestController {

    static final String USER_HEADER = "X-User-Id";

    private final RequestLifecycleService lifecycleService;
    private final MatchingEngine matchingEngine;

    @PostMapping
    public ResponseEntity<ApiResponse<RequestResponse>> createRequest(
            @RequestHeader(USER_HEADER) String userId,
            @RequestBody ServiceRequestDraft draft) {

        RequestResponse response = lifecycleService.createRequest(userId, draft);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok(response));
    }

    @GetMapping("/{requestId}")
    public ResponseEntity<ApiResponse<RequestResponse>> getRequest(@PathVariable("requestId") UUID requestId) {
        return ResponseEntity.ok(ApiResponse.ok(lifecycleService.getRequest(requestId)));
    }

    @PatchMapping("/{requestId}")
    public ResponseEntity<ApiResponse<RequestResponse>> updateRequest(
            @PathVariable("requestId") UUID requestId,
            @RequestHeader(USER_HEADER) String userId,
            @RequestBody UpdateRequestFields fields) {

        return ResponseEntity.ok(ApiResponse.ok(lifecycleService.updateRequest(requestId, userId, fields)));
    }

    @PostMapping("/{requestId}/proposals")
    public ResponseEntity<ApiResponse<RequestResponse>> submitProposal(
            @PathVariable("requestId") UUID requestId,
            @RequestParam("providerId") String providerId,
            @RequestBody ProposalSubmission submission) {

        RequestResponse response = lifecycleService.submitProposal(requestId, providerId, submission);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok(response));
    }

    @PostMapping("/{requestId}/proposals/{proposalId}/withdraw")
    public ResponseEntity<ApiResponse<RequestResponse>> withdrawProposal(
            @PathVariable("requestId") UUID requestId,
            @PathVariable("proposalId") UUID proposalId,
            @RequestHeader(USER_HEADER) String userId) {

        return ResponseEntity.ok(ApiResponse.ok(lifecycleService.withdrawProposal(requestId, proposalId, userId)));
    }

    @PostMapping("/{requestId}/proposals/{proposalId}/accept")
    public ResponseEntity<ApiResponse<RequestResponse>> acceptProposal(
            @PathVariable("requestId") UUID requestId,
            @PathVariable("proposalId") UUID proposalId,
            @RequestHeader(USER_HEADER) String userId) {

        return ResponseEntity.ok(ApiResponse.ok(lifecycleService.acceptProposal(requestId, proposalId, userId)));
    }

    @PostMapping("/{requestId}/start")
    public ResponseEntity<ApiResponse<RequestResponse>> startService(
            @PathVariable("requestId") UUID requestId,
            @RequestHeader(USER_HEADER) String userId) {

        return ResponseEntity.ok(ApiResponse.ok(lifecycleService.startService(requestId, userId)));
    }

    @PostMapping("/{requestId}/complete")
    public ResponseEntity<ApiResponse<RequestResponse>> completeService(
            @PathVariable("requestId") UUID requestId,
            @RequestHeader(USER_HEADER) String userId,
            @RequestBody CompletionReport report) {

        return ResponseEntity.ok(ApiResponse.ok(lifecycleService.completeService(requestId, userId, report)));
    }

    @PostMapping("/{requestId}/approve")
    public ResponseEntity<ApiResponse<RequestResponse>> approveCompletion(
            @PathVariable("requestId") UUID requestId,
            @RequestHeader(USER_HEADER) String userId) {

        return ResponseEntity.ok(ApiResponse.ok(lifecycleService.approveCompletion(requestId, userId)));
    }

    @PostMapping("/{requestId}/cancel")
    public ResponseEntity<ApiResponse<RequestResponse>> cancelRequest(
            @PathVariable("requestId") UUID requestId,
            @RequestHeader(USER_HEADER) String userId,
            @RequestBody(required = false) CancellationInput input) {

        String reason = input != null ? input.getReason() : null;
        return ResponseEntity.ok(ApiResponse.ok(lifecycleService.cancelRequest(requestId, userId, reason)));
    }

    @PostMapping("/{requestId}/match")
    public ResponseEntity<ApiResponse<List<ProviderSummary>>> autoMatch(@PathVariable("requestId") UUID requestId) {
        return ResponseEntity.ok(ApiResponse.ok(lifecycleService.autoMatchAndNotify(requestId)));
    }

    @GetMapping("/{requestId}/estimate")
    public ResponseEntity<ApiResponse<CostEstimate>> estimateCost(
            @PathVariable("requestId") UUID requestId,
            @RequestParam("providerId") String providerId) {

        return ResponseEntity.ok(ApiResponse.ok(matchingEngine.estimateCost(requestId, providerId)));
    }
}
