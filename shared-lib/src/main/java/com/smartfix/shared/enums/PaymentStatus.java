package com.smartfix.shared.enums;

public enum PaymentStatus {
    UNPAID,
    PAID
}
