package com.flagship.savings_loan.member.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.savings_loan.member.Member;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class MemberResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("member_number")
    String memberNumber;

    @JsonProperty("full_name")
    String fullName;

    @JsonProperty("date_joined")
    LocalDate dateJoined;

    @JsonProperty("savings_balance")
    BigDecimal savingsBalance;

    public static MemberResponse from(Member member) {
        return MemberResponse.builder()
            .id(member.getId())
            .memberNumber(member.getMemberNumber())
            .fullName(member.getFullName())
            .dateJoined(member.getDateJoined())
            .savingsBalance(member.getSavingsBalance().getAmount())
            .build();
    }
}
