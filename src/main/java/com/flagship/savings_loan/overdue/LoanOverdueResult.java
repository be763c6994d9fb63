package com.flagship.savings_loan.overdue;

import com.flagship.savings_loan.loan.OverdueCharge;
import com.flagship.savings_loan.money.Money;
import lombok.Value;

import java.util.List;
import java.util.UUID;

/**
 * Outcome of sweeping one loan. {@code error} is set only when the loan failed.
 */
@Value
public class LoanOverdueResult {
    UUID loanId;
    List<OverdueCharge> charges;
    String error;

    static LoanOverdueResult charged(UUID loanId, List<OverdueCharge> charges) {
        return new LoanOverdueResult(loanId, List.copyOf(charges), null);
    }

    static LoanOverdueResult failed(UUID loanId, String error) {
        return new LoanOverdueResult(loanId, List.of(), error);
    }

    public boolean isFailed() {
        return error != null;
    }

    public boolean isCharged() {
        return !charges.isEmpty();
    }

    public Money getTotalCharged() {
        return charges.stream()
            .map(OverdueCharge::getChargeAmount)
            .reduce(Money.ZERO, Money::plus);
    }
}
