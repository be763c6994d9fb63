package com.flagship.savings_loan.loan.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.savings_loan.loan.OverdueAssessment;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * What an overdue assessment would charge on {@code as_of}. Nothing is persisted.
 */
@Value
@Builder
public class OverduePreviewResponse {

    @JsonProperty("loan_id")
    UUID loanId;

    @JsonProperty("as_of")
    LocalDate asOf;

    @JsonProperty("is_overdue")
    boolean overdue;

    @JsonProperty("periods")
    int periods;

    @JsonProperty("charges")
    List<OverdueChargeResponse> charges;

    @JsonProperty("total_interest")
    BigDecimal totalInterest;

    @JsonProperty("projected_balance")
    BigDecimal projectedBalance;

    @JsonProperty("projected_next_due_date")
    LocalDate projectedNextDueDate;

    public static OverduePreviewResponse from(OverdueAssessment assessment, LocalDate asOf) {
        return OverduePreviewResponse.builder()
            .loanId(assessment.getLoan().getId())
            .asOf(asOf)
            .overdue(assessment.isOverdue())
            .periods(assessment.getCharges().size())
            .charges(OverdueChargeResponse.fromAll(assessment.getCharges()))
            .totalInterest(assessment.getTotalCharged().getAmount())
            .projectedBalance(assessment.getLoan().getCurrentBalance().getAmount())
            .projectedNextDueDate(assessment.getLoan().getNextDueDate())
            .build();
    }
}
