package com.flagship.savings_loan.exception;

/**
 * Raised for non-positive amounts, overpayment and malformed input.
 */
public class ValidationException extends BusinessRuleException {

    public ValidationException(String message) {
        super(message);
    }
}
