package com.flagship.savings_loan.overdue.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.savings_loan.loan.dto.OverdueChargeResponse;
import com.flagship.savings_loan.overdue.LoanOverdueResult;
import com.flagship.savings_loan.overdue.OverdueBatchReport;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class OverdueBatchResponse {

    @JsonProperty("as_of")
    LocalDate asOf;

    @JsonProperty("loans_examined")
    int loansExamined;

    @JsonProperty("loans_charged")
    long loansCharged;

    @JsonProperty("failures")
    long failures;

    @JsonProperty("total_interest_charged")
    BigDecimal totalInterestCharged;

    @JsonProperty("results")
    List<LoanResult> results;

    public static OverdueBatchResponse from(OverdueBatchReport report) {
        return OverdueBatchResponse.builder()
            .asOf(report.getAsOfDate())
            .loansExamined(report.getLoansExamined())
            .loansCharged(report.getLoansCharged())
            .failures(report.getFailures())
            .totalInterestCharged(report.getTotalInterestCharged().getAmount())
            .results(report.getResults().stream()
                .filter(r -> r.isCharged() || r.isFailed())
                .map(LoanResult::from)
                .toList())
            .build();
    }

    @Value
    public static class LoanResult {

        @JsonProperty("loan_id")
        UUID loanId;

        @JsonProperty("charges")
        List<OverdueChargeResponse> charges;

        @JsonProperty("error")
        String error;

        static LoanResult from(LoanOverdueResult result) {
            return new LoanResult(result.getLoanId(), OverdueChargeResponse.fromAll(result.getCharges()), result.getError());
        }
    }
}
