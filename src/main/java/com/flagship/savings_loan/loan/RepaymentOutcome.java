package com.flagship.savings_loan.loan;

import com.flagship.savings_loan.ledger.LoanTransaction;
import com.flagship.savings_loan.money.Money;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of a repayment: the loan after interest and payment, the overdue charges
 * applied before the payment was taken, and the ledger entries to append in order.
 */
@Value
public class RepaymentOutcome {
    Loan loan;
    Money paymentAmount;
    OverdueAssessment overdue;
    LoanTransaction repaymentEntry;

    public List<OverdueCharge> getOverdueCharges() {
        return overdue.getCharges();
    }

    public boolean isLoanClosed() {
        return !loan.isActive();
    }

    /**
     * Overdue interest entries first, then the repayment.
     */
    public List<LoanTransaction> getLedgerEntries() {
        List<LoanTransaction> entries = new ArrayList<>(overdue.getLedgerEntries());
        entries.add(repaymentEntry);
        return Collections.unmodifiableList(entries);
    }
}
