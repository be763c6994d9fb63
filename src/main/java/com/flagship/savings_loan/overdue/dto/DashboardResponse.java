package com.flagship.savings_loan.overdue.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.savings_loan.overdue.DashboardSummary;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
public class DashboardResponse {

    @JsonProperty("as_of")
    LocalDate asOf;

    @JsonProperty("total_members")
    long totalMembers;

    @JsonProperty("total_savings")
    BigDecimal totalSavings;

    @JsonProperty("active_loans")
    long activeLoans;

    @JsonProperty("outstanding_loan_balance")
    BigDecimal outstandingLoanBalance;

    @JsonProperty("overdue_loans")
    long overdueLoans;

    public static DashboardResponse from(DashboardSummary summary) {
        return new DashboardResponse(
            summary.getAsOfDate(),
            summary.getTotalMembers(),
            summary.getTotalSavings().getAmount(),
            summary.getActiveLoans(),
            summary.getOutstandingLoanBalance().getAmount(),
            summary.getOverdueLoans()
        );
    }
}
