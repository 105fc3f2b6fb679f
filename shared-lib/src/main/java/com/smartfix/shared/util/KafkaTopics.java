package com.smartfix.shared.util;

/**
 * Central registry of all Kafka topic names.
 */
public final class KafkaTopics {

    private KafkaTopics() {}

    public static final String REQUEST_CREATED          = "request.created";
    public static final String REQUEST_UPDATED          = "request.updated";
    public static final String PROPOSAL_SUBMITTED       = "proposal.submitted";
    public static final String PROPOSAL_WITHDRAWN       = "proposal.withdrawn";
    public static final String REQUEST_ACCEPTED         = "request.accepted";
    public static final String REQUEST_IN_PROGRESS      = "request.in_progress";
    public static final String REQUEST_COMPLETED        = "request.completed";
    public static final String REQUEST_APPROVED         = "request.approved";
    public static final String REQUEST_CANCELLED        = "request.cancelled";
    public static final String PROVIDERS_MATCHED        = "providers.matched";
    public static final String PROVIDER_RATING_REFRESH  = "provider.rating.refresh";
}
