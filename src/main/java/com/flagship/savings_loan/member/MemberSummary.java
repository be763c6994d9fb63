package com.flagship.savings_loan.member;

import com.flagship.savings_loan.loan.Loan;
import lombok.Value;

import java.time.LocalDate;
import java.util.Optional;

/**
 * A member's savings position and active loan as of a date.
 */
@Value
public class MemberSummary {
    Member member;
    Loan activeLoan;
    LocalDate asOfDate;

    public Optional<Loan> getActiveLoan() {
        return Optional.ofNullable(activeLoan);
    }

    public boolean isOverdue() {
        return activeLoan != null && activeLoan.isOverdueOn(asOfDate);
    }

    public long getDaysOverdue() {
        return activeLoan != null ? activeLoan.daysOverdue(asOfDate) : 0;
    }
}
