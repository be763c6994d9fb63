package com.flagship.savings_loan.ledger;

import com.flagship.savings_loan.money.Money;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable entry in a loan's ledger.
 *
 * The amount is always recorded as a non-negative magnitude; its effect on the
 * balance comes from the {@link LoanTransactionType}. {@code recordedAt} and
 * {@code sequenceNumber} are assigned by the database and are null until the entry
 * has been appended.
 */
@Value
public class LoanTransaction {
    UUID id;
    UUID loanId;
    Money amount;
    LoanTransactionType type;
    String description;
    LocalDate transactionDate;
    Instant recordedAt;
    Long sequenceNumber;

    public LoanTransaction(UUID id, UUID loanId, Money amount, LoanTransactionType type,
                           String description, LocalDate transactionDate,
                           Instant recordedAt, Long sequenceNumber) {
        this.id = Objects.requireNonNull(id, "id");
        this.loanId = Objects.requireNonNull(loanId, "loanId");
        this.amount = Objects.requireNonNull(amount, "amount");
        if (amount.isNegative()) {
            throw new IllegalArgumentException("Loan transaction amount must not be negative: " + amount);
        }
        this.type = Objects.requireNonNull(type, "type");
        this.description = description;
        this.transactionDate = Objects.requireNonNull(transactionDate, "transactionDate");
        this.recordedAt = recordedAt;
        this.sequenceNumber = sequenceNumber;
    }

    public static LoanTransaction loanIssued(UUID loanId, Money principal, Money interest,
                                             Money total, LocalDate issueDate) {
        return pending(loanId, total, LoanTransactionType.LOAN_ISSUED,
            String.format("Loan issued: principal %s, interest %s", principal, interest), issueDate);
    }

    public static LoanTransaction overdueInterest(UUID loanId, Money charge, int periodIndex, LocalDate asOfDate) {
        return pending(loanId, charge, LoanTransactionType.OVERDUE_INTEREST,
            String.format("Overdue interest (period %d): %s", periodIndex, charge), asOfDate);
    }

    public static LoanTransaction repayment(UUID loanId, Money amount, LocalDate asOfDate) {
        return pending(loanId, amount, LoanTransactionType.REPAYMENT,
            String.format("Loan repayment of %s", amount), asOfDate);
    }

    private static LoanTransaction pending(UUID loanId, Money amount, LoanTransactionType type,
                                           String description, LocalDate date) {
        return new LoanTransaction(UUID.randomUUID(), loanId, amount, type, description, date, null, null);
    }

    /**
     * The entry's effect on the outstanding balance.
     */
    public Money balanceEffect() {
        return type.increasesBalance() ? amount : amount.negate();
    }

    /**
     * Folds a loan's entries, oldest first, into the balance they imply.
     */
    public static Money replay(Collection<LoanTransaction> transactions) {
        Money balance = Money.ZERO;
        for (LoanTransaction transaction : transactions) {
            balance = balance.plus(transaction.balanceEffect());
        }
        return balance;
    }

    /**
     * Returns a copy carrying the values the database assigned on insert.
     */
    public LoanTransaction recorded(Instant recordedAt, Long sequenceNumber) {
        return new LoanTransaction(id, loanId, amount, type, description, transactionDate, recordedAt, sequenceNumber);
    }
}
