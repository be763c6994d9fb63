package com.flagship.savings_loan.member;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
public class MemberRegisteredEvent {
    UUID eventId;
    UUID memberId;
    String memberNumber;
    LocalDate dateJoined;
    BigDecimal initialDeposit;
    Instant occurredAt;

    public static final String EVENT_TYPE = "MemberRegistered";

    public String getEventType() {
        return EVENT_TYPE;
    }

    static MemberRegisteredEvent fromMember(Member member) {
        return new MemberRegisteredEvent(
            UUID.randomUUID(),
            member.getId(),
            member.getMemberNumber(),
            member.getDateJoined(),
            member.getSavingsBalance().getAmount(),
            Instant.now()
        );
    }
}
