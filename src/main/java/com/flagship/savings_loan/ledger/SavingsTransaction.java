package com.flagship.savings_loan.ledger;

import com.flagship.savings_loan.money.Money;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable entry in a member's savings ledger.
 */
@Value
public class SavingsTransaction {
    UUID id;
    UUID memberId;
    Money amount;
    SavingsTransactionType type;
    String description;
    LocalDate transactionDate;
    Instant recordedAt;
    Long sequenceNumber;

    public SavingsTransaction(UUID id, UUID memberId, Money amount, SavingsTransactionType type,
                              String description, LocalDate transactionDate,
                              Instant recordedAt, Long sequenceNumber) {
        this.id = Objects.requireNonNull(id, "id");
        this.memberId = Objects.requireNonNull(memberId, "memberId");
        this.amount = Objects.requireNonNull(amount, "amount");
        if (!amount.isPositive()) {
            throw new IllegalArgumentException("Savings amount must be positive: " + amount);
        }
        this.type = Objects.requireNonNull(type, "type");
        this.description = description;
        this.transactionDate = Objects.requireNonNull(transactionDate, "transactionDate");
        this.recordedAt = recordedAt;
        this.sequenceNumber = sequenceNumber;
    }

    public static SavingsTransaction create(UUID memberId, Money amount, SavingsTransactionType type,
                                            LocalDate transactionDate) {
        String description = type == SavingsTransactionType.INITIAL_DEPOSIT
            ? "Initial deposit of " + amount
            : "Subscription payment of " + amount;
        return new SavingsTransaction(UUID.randomUUID(), memberId, amount, type, description,
            transactionDate, null, null);
    }

    public SavingsTransaction recorded(Instant recordedAt, Long sequenceNumber) {
        return new SavingsTransaction(id, memberId, amount, type, description, transactionDate,
            recordedAt, sequenceNumber);
    }
}
