package com.flagship.savings_loan.loan.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.savings_loan.loan.Loan;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class LoanResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("member_id")
    UUID memberId;

    @JsonProperty("principal_amount")
    BigDecimal principalAmount;

    @JsonProperty("interest_rate")
    BigDecimal interestRate;

    @JsonProperty("interest_amount")
    BigDecimal interestAmount;

    @JsonProperty("total_amount")
    BigDecimal totalAmount;

    @JsonProperty("current_balance")
    BigDecimal currentBalance;

    @JsonProperty("issue_date")
    LocalDate issueDate;

    @JsonProperty("next_due_date")
    LocalDate nextDueDate;

    @JsonProperty("is_active")
    boolean active;

    public static LoanResponse from(Loan loan) {
        return LoanResponse.builder()
            .id(loan.getId())
            .memberId(loan.getMemberId())
            .principalAmount(loan.getPrincipal().getAmount())
            .interestRate(loan.getInterestRate())
            .interestAmount(loan.getInterestAmount().getAmount())
            .totalAmount(loan.getTotalAmount().getAmount())
            .currentBalance(loan.getCurrentBalance().getAmount())
            .issueDate(loan.getIssueDate())
            .nextDueDate(loan.getNextDueDate())
            .active(loan.isActive())
            .build();
    }
}
