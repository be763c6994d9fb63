package com.flagship.savings_loan.ledger;

/**
 * Kind of entry in a loan's ledger.
 *
 * Charges raise the outstanding balance, repayments lower it. Replaying a loan's
 * entries from zero with these signs yields its current balance.
 */
public enum LoanTransactionType {

    /** Principal plus issuance interest, recorded once when the loan is created. */
    LOAN_ISSUED(1),

    /** A payment from the member. */
    REPAYMENT(-1),

    /** Interest compounded for one overdue period. */
    OVERDUE_INTEREST(1);

    private final int balanceSign;

    LoanTransactionType(int balanceSign) {
        this.balanceSign = balanceSign;
    }

    public boolean increasesBalance() {
        return balanceSign > 0;
    }
}
