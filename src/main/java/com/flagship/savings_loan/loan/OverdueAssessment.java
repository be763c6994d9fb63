package com.flagship.savings_loan.loan;

import com.flagship.savings_loan.ledger.LoanTransaction;
import com.flagship.savings_loan.money.Money;
import lombok.Value;

import java.util.List;

/**
 * Result of assessing a loan for overdue interest on a given date.
 *
 * {@code loan} is the state after all charges and the due date advance;
 * {@code ledgerEntries} holds one unsaved OVERDUE_INTEREST entry per charge, in period order.
 * Both are unchanged from the input when the loan was not overdue.
 */
@Value
public class OverdueAssessment {
    Loan loan;
    List<OverdueCharge> charges;
    List<LoanTransaction> ledgerEntries;

    static OverdueAssessment notOverdue(Loan loan) {
        return new OverdueAssessment(loan, List.of(), List.of());
    }

    public boolean isOverdue() {
        return !charges.isEmpty();
    }

    public Money getTotalCharged() {
        return charges.stream()
            .map(OverdueCharge::getChargeAmount)
            .reduce(Money.ZERO, Money::plus);
    }
}
