package com.flagship.savings_loan.loan.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.savings_loan.loan.RepaymentOutcome;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Result of a repayment: the loan after the payment, plus any overdue interest
 * that was compounded before it was applied.
 */
@Value
@Builder
public class RepaymentResponse {

    @JsonProperty("loan")
    LoanResponse loan;

    @JsonProperty("payment_amount")
    BigDecimal paymentAmount;

    @JsonProperty("overdue_charges")
    List<OverdueChargeResponse> overdueCharges;

    @JsonProperty("total_overdue_interest")
    BigDecimal totalOverdueInterest;

    @JsonProperty("loan_closed")
    boolean loanClosed;

    public static RepaymentResponse from(RepaymentOutcome outcome) {
        return RepaymentResponse.builder()
            .loan(LoanResponse.from(outcome.getLoan()))
            .paymentAmount(outcome.getPaymentAmount().getAmount())
            .overdueCharges(OverdueChargeResponse.fromAll(outcome.getOverdueCharges()))
            .totalOverdueInterest(outcome.getOverdue().getTotalCharged().getAmount())
            .loanClosed(outcome.isLoanClosed())
            .build();
    }
}
