package com.flagship.savings_loan.member.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.savings_loan.loan.dto.LoanResponse;
import com.flagship.savings_loan.member.MemberSummary;
import com.flagship.savings_loan.money.Money;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Member with savings balance and active loan. {@code active_loan} is null when
 * the member has none.
 */
@Value
@Builder
public class MemberSummaryResponse {

    @JsonProperty("member")
    MemberResponse member;

    @JsonProperty("active_loan")
    LoanResponse activeLoan;

    @JsonProperty("as_of")
    LocalDate asOf;

    @JsonProperty("is_overdue")
    boolean overdue;

    @JsonProperty("days_overdue")
    long daysOverdue;

    @JsonProperty("monthly_subscription")
    BigDecimal monthlySubscription;

    public static MemberSummaryResponse from(MemberSummary summary, Money monthlySubscription) {
        return MemberSummaryResponse.builder()
            .member(MemberResponse.from(summary.getMember()))
            .activeLoan(summary.getActiveLoan().map(LoanResponse::from).orElse(null))
            .asOf(summary.getAsOfDate())
            .overdue(summary.isOverdue())
            .daysOverdue(summary.getDaysOverdue())
            .monthlySubscription(monthlySubscription.getAmount())
            .build();
    }
}
