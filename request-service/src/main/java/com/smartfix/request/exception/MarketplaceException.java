package com.smartfix.request.exception;

import java.util.List;

/**
 * Root of the guard failures raised by the request lifecycle and matching engine.
 * The subclass decides the kind; {@code code} narrows it for clients.
 */
public abstract class MarketplaceException extends RuntimeException {

    private final String code;
    private final List<String> details;

    protected MarketplaceException(String code, String message, List<String> details) {
        super(message);
        this.code = code;
        this.details = details == null ? List.of() : List.copyOf(details);
    }

    public String getCode() {
        return code;
    }

    public List<String> getDetails() {
        return details;
    }
}
