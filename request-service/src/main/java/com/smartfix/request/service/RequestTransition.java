package com.smartfix.request.service;

import com.smartfix.request.exception.ValidationException;
import com.smartfix.shared.enums.RequestStatus;
import com.smartfix.shared.util.KafkaTopics;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

import static com.smartfix.shared.enums.RequestStatus.ACCEPTED;
import static com.smartfix.shared.enums.RequestStatus.COMPLETED;
import static com.smartfix.shared.enums.RequestStatus.IN_PROGRESS;
import static com.smartfix.shared.enums.RequestStatus.PENDING;

/**
 * Every lifecycle operation and the request statuses it may start from.
 */
public enum RequestTransition {

    UPDATE(EnumSet.of(PENDING)),
    SUBMIT_PROPOSAL(EnumSet.of(PENDING)),
    WITHDRAW_PROPOSAL(EnumSet.of(PENDING)),
    ACCEPT_PROPOSAL(EnumSet.of(PENDING)),
    START(EnumSet.of(ACCEPTED)),
    COMPLETE(EnumSet.of(IN_PROGRESS)),
    APPROVE(EnumSet.of(COMPLETED)),
    CANCEL(EnumSet.of(PENDING, ACCEPTED, IN_PROGRESS));

    private final Set<RequestStatus> allowedFrom;

    RequestTransition(Set<RequestStatus> allowedFrom) {
        this.allowedFrom = allowedFrom;
    }

    public boolean isAllowedFrom(RequestStatus status) {
        return allowedFrom.contains(status);
    }

    public void checkFrom(UUID requestId, RequestStatus status) {
        if (!isAllowedFrom(status)) {
            throw new ValidationException(ValidationException.INVALID_STATE,
                    "Cannot " + verb() + " request " + requestId + " while it is " + status);
        }
    }

    public String topic() {
        return switch (this) {
            case UPDATE            -> KafkaTopics.REQUEST_UPDATED;
            case SUBMIT_PROPOSAL   -> KafkaTopics.PROPOSAL_SUBMITTED;
            case WITHDRAW_PROPOSAL -> KafkaTopics.PROPOSAL_WITHDRAWN;
            case ACCEPT_PROPOSAL   -> KafkaTopics.REQUEST_ACCEPTED;
            case START             -> KafkaTopics.REQUEST_IN_PROGRESS;
            case COMPLETE          -> KafkaTopics.REQUEST_COMPLETED;
            case APPROVE           -> KafkaTopics.REQUEST_APPROVED;
            case CANCEL            -> KafkaTopics.REQUEST_CANCELLED;
        };
    }

    public String verb() {
        return switch (this) {
            case UPDATE            -> "update";
            case SUBMIT_PROPOSAL   -> "submit a proposal on";
            case WITHDRAW_PROPOSAL -> "withdraw a proposal from";
            case ACCEPT_PROPOSAL   -> "accept a proposal on";
            case START             -> "start";
            case COMPLETE          -> "complete";
            case APPROVE           -> "approve";
            case CANCEL            -> "cancel";
        };
    }

    /**
     * Lower-case tag used on the transition metric.
     */
    public String metricTag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
