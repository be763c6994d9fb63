package com.flagship.savings_loan.exception;

/**
 * Raised when an operation would violate a uniqueness rule, such as a second active loan for a member.
 */
public class ConflictException extends BusinessRuleException {

    public ConflictException(String message) {
        super(message);
    }
}
