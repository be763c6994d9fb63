package com.flagship.savings_loan.member;

import com.flagship.savings_loan.money.Money;
import lombok.Value;

import java.time.LocalDate;
import java.util.UUID;

/**
 * A registered member. The engine only needs the id and the savings balance;
 * the rest is carried for summaries.
 */
@Value
public class Member {
    UUID id;
    String memberNumber;
    String fullName;
    LocalDate dateJoined;
    Money savingsBalance;
}
