package com.flagship.savings_loan.exception;

/**
 * Base type for precondition violations raised by the ledger and interest engine.
 *
 * None of these are transient: retrying the same call with the same input fails the
 * same way. They are always raised before any state is changed.
 */
public abstract class BusinessRuleException extends RuntimeException {

    protected BusinessRuleException(String message) {
        super(message);
    }
}
