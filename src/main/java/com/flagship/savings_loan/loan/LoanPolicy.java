package com.flagship.savings_loan.loan;

import lombok.Value;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Immutable loan terms applied by the engine.
 *
 * Built once from configuration and handed to the engine components, so tests can
 * run alternative rates side by side without touching shared state.
 */
@Value
public class LoanPolicy {

    public static final BigDecimal STANDARD_RATE = new BigDecimal("0.20");
    public static final int STANDARD_DUE_DAY = 5;

    /** Flat interest charged once at issuance. */
    BigDecimal interestRate;

    /** Rate compounded on the outstanding balance for each overdue period. */
    BigDecimal overdueInterestRate;

    int dueDayOfMonth;

    public LoanPolicy(BigDecimal interestRate, BigDecimal overdueInterestRate, int dueDayOfMonth) {
        this.interestRate = requireNonNegative(interestRate, "interestRate");
        this.overdueInterestRate = requireNonNegative(overdueInterestRate, "overdueInterestRate");
        this.dueDayOfMonth = dueDayOfMonth;
    }

    public static LoanPolicy standard() {
        return new LoanPolicy(STANDARD_RATE, STANDARD_RATE, STANDARD_DUE_DAY);
    }

    public DueDateCalculator dueDateCalculator() {
        return new DueDateCalculator(dueDayOfMonth);
    }

    private static BigDecimal requireNonNegative(BigDecimal rate, String name) {
        Objects.requireNonNull(rate, name);
        if (rate.signum() < 0) {
            throw new IllegalArgumentException(name + " must not be negative");
        }
        return rate;
    }
}
