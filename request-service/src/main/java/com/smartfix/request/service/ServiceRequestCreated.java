package com.smartfix.request.service;

import lombok.Value;

import java.util.UUID;

/**
 * In-process event raised when a request is stored. Handled after commit.
 */
@Value
public class ServiceRequestCreated {
    UUID requestId;
}
