package com.flagship.savings_loan.exception;

import java.util.UUID;

/**
 * Raised when a member or loan id does not resolve.
 */
public class NotFoundException extends BusinessRuleException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException member(UUID memberId) {
        return new NotFoundException("Member not found: " + memberId);
    }

    public static NotFoundException loan(UUID loanId) {
        return new NotFoundException("Loan not found: " + loanId);
    }
}
