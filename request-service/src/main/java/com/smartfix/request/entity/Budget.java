package com.smartfix.request.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Budget {

    @Column(name = "budget_min", precision = 12, scale = 2, nullable = false)
    private BigDecimal minAmount;

    @Column(name = "budget_max", precision = 12, scale = 2, nullable = false)
    private BigDecimal maxAmount;

    @Column(name = "currency", length = 3)
    private String currency;
}
