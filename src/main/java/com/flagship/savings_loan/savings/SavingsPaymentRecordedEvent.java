package com.flagship.savings_loan.savings;

import com.flagship.savings_loan.ledger.SavingsTransaction;
import com.flagship.savings_loan.ledger.SavingsTransactionType;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
public class SavingsPaymentRecordedEvent {
    UUID eventId;
    UUID memberId;
    UUID transactionId;
    BigDecimal amount;
    SavingsTransactionType kind;
    BigDecimal newSavingsBalance;
    LocalDate transactionDate;
    Instant occurredAt;

    public static final String EVENT_TYPE = "SavingsPaymentRecorded";

    public String getEventType() {
        return EVENT_TYPE;
    }

    static SavingsPaymentRecordedEvent from(SavingsTransaction transaction, BigDecimal newBalance) {
        return new SavingsPaymentRecordedEvent(
            UUID.randomUUID(),
            transaction.getMemberId(),
            transaction.getId(),
            transaction.getAmount().getAmount(),
            transaction.getType(),
            newBalance,
            transaction.getTransactionDate(),
            Instant.now()
        );
    }
}
