package com.smartfix.request.exception;

import java.util.List;

/**
 * Invalid input, or an operation attempted from a state that forbids it.
 */
public class ValidationException extends MarketplaceException {

    public static final String VALIDATION_ERROR    = "VALIDATION_ERROR";
    public static final String INVALID_STATE       = "INVALID_STATE";
    public static final String REQUEST_UNAVAILABLE = "REQUEST_UNAVAILABLE";
    public static final String DUPLICATE_PROPOSAL  = "DUPLICATE_PROPOSAL";
    public static final String INVALID_PROPOSAL    = "INVALID_PROPOSAL";

    public ValidationException(String code, String message) {
        super(code, message, List.of());
    }

    public ValidationException(String code, String message, List<String> details) {
        super(code, message, details);
    }

    public static ValidationException invalid(List<String> violations) {
        return new ValidationException(VALIDATION_ERROR, "Request validation failed", violations);
    }
}
