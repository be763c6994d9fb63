package com.flagship.savings_loan.overdue;

import com.flagship.savings_loan.money.Money;
import lombok.Value;

import java.time.LocalDate;

/**
 * Scheme-wide figures as of a date.
 */
@Value
public class DashboardSummary {
    LocalDate asOfDate;
    long totalMembers;
    Money totalSavings;
    long activeLoans;
    Money outstandingLoanBalance;
    long overdueLoans;
}
