package com.smartfix.shared.enums;

public enum ProposalStatus {
    PENDING,
    ACCEPTED,
    REJECTED,
    WITHDRAWN
}
