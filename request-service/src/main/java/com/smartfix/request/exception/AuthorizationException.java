package com.smartfix.request.exception;

import java.util.List;

/**
 * The acting identity is not the party the operation requires.
 */
public class AuthorizationException extends MarketplaceException {

    public static final String NOT_REQUEST_OWNER     = "NOT_REQUEST_OWNER";
    public static final String NOT_ASSIGNED_PROVIDER = "NOT_ASSIGNED_PROVIDER";
    public static final String NOT_PROPOSAL_OWNER    = "NOT_PROPOSAL_OWNER";
    public static final String NOT_REQUEST_PARTY     = "NOT_REQUEST_PARTY";

    public AuthorizationException(String code, String message) {
        super(code, message, List.of());
    }
}
