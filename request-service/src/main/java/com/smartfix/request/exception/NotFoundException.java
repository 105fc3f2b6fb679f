package com.smartfix.request.exception;

import java.util.List;

public class NotFoundException extends MarketplaceException {

    public static final String REQUEST_NOT_FOUND  = "REQUEST_NOT_FOUND";
    public static final String PROVIDER_NOT_FOUND = "PROVIDER_NOT_FOUND";
    public static final String USER_NOT_FOUND     = "USER_NOT_FOUND";

    public NotFoundException(String code, String message) {
        super(code, message, List.of());
    }
}
