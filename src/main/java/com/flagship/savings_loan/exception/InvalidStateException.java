package com.flagship.savings_loan.exception;

/**
 * Raised when an operation targets a loan that is no longer active.
 */
public class InvalidStateException extends BusinessRuleException {

    public InvalidStateException(String message) {
        super(message);
    }
}
