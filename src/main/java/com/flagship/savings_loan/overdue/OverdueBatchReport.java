package com.flagship.savings_loan.overdue;

import com.flagship.savings_loan.money.Money;
import lombok.Value;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;

/**
 * Summary of one overdue sweep across all active loans.
 */
@Value
public class OverdueBatchReport {
    LocalDate asOfDate;
    List<LoanOverdueResult> results;
    Duration duration;

    public int getLoansExamined() {
        return results.size();
    }

    public long getLoansCharged() {
        return results.stream().filter(LoanOverdueResult::isCharged).count();
    }

    public long getFailures() {
        return results.stream().filter(LoanOverdueResult::isFailed).count();
    }

    public Money getTotalInterestCharged() {
        return results.stream()
            .map(LoanOverdueResult::getTotalCharged)
            .reduce(Money.ZERO, Money::plus);
    }
}
