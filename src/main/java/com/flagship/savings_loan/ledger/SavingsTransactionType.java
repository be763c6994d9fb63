package com.flagship.savings_loan.ledger;

/**
 * Kind of savings payment. Savings only ever grow.
 */
public enum SavingsTransactionType {
    INITIAL_DEPOSIT,
    SUBSCRIPTION
}
