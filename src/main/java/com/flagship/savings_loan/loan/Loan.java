package com.flagship.savings_loan.loan;

import com.flagship.savings_loan.exception.InvalidStateException;
import com.flagship.savings_loan.exception.ValidationException;
import com.flagship.savings_loan.money.Money;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

/**
 * Loan aggregate.
 *
 * Every state change returns a new instance; nothing here touches a database or
 * the ledger. Invariants held by every instance:
 * - currentBalance is never negative
 * - currentBalance is zero exactly when the loan is inactive
 * - principal, interestAmount and totalAmount never change after issue
 */
@Value
public class Loan {
    UUID id;
    UUID memberId;
    Money principal;
    BigDecimal interestRate;
    Money interestAmount;
    Money totalAmount;
    Money currentBalance;
    LocalDate issueDate;
    LocalDate nextDueDate;
    boolean active;

    public Loan(UUID id, UUID memberId, Money principal, BigDecimal interestRate,
                Money interestAmount, Money totalAmount, Money currentBalance,
                LocalDate issueDate, LocalDate nextDueDate, boolean active) {
        if (currentBalance.isNegative()) {
            throw new IllegalStateException("Loan balance must not be negative: " + currentBalance);
        }
        if (currentBalance.isZero() == active) {
            throw new IllegalStateException(String.format(
                "Loan %s: balance %s is inconsistent with active=%s", id, currentBalance, active));
        }
        this.id = id;
        this.memberId = memberId;
        this.principal = principal;
        this.interestRate = interestRate;
        this.interestAmount = interestAmount;
        this.totalAmount = totalAmount;
        this.currentBalance = currentBalance;
        this.issueDate = issueDate;
        this.nextDueDate = nextDueDate;
        this.active = active;
    }

    /**
     * Issues a new loan. Interest is charged once, up front, at the policy rate.
     *
     * @throws ValidationException if the principal is not positive, or the total with
     *                             interest is larger than the ledger can hold
     */
    public static Loan issue(UUID id, UUID memberId, Money principal, LoanPolicy policy,
                             DueDateCalculator dueDates, LocalDate issueDate) {
        if (principal == null || !principal.isPositive()) {
            throw new ValidationException("Loan principal must be greater than zero");
        }
        Money interest = principal.times(policy.getInterestRate());
        Money total = principal.plus(interest);
        if (total.exceedsMax()) {
            throw new ValidationException(String.format(
                "Loan total %s (principal %s plus interest %s) exceeds the maximum supported amount %s",
                total, principal, interest, Money.MAX));
        }
        return new Loan(
            id,
            memberId,
            principal,
            policy.getInterestRate(),
            interest,
            total,
            total,
            issueDate,
            dueDates.nextDueDate(issueDate),
            true
        );
    }

    /**
     * Adds one period of overdue interest to the balance.
     *
     * @throws ValidationException if the new balance is larger than the ledger can hold
     */
    public Loan accrueOverdueInterest(Money charge) {
        requireActive();
        if (charge.isNegative()) {
            throw new IllegalArgumentException("Overdue charge must not be negative: " + charge);
        }
        Money balance = currentBalance.plus(charge);
        if (balance.exceedsMax()) {
            throw new ValidationException(String.format(
                "Overdue interest %s would take loan %s to %s, above the maximum supported amount %s",
                charge, id, balance, Money.MAX));
        }
        return withBalance(balance, true);
    }

    /**
     * Applies a payment. The loan closes when the payment settles the balance.
     *
     * @throws InvalidStateException if the loan is closed
     * @throws ValidationException   if the payment is not positive or exceeds the balance
     */
    public Loan applyRepayment(Money payment) {
        requireActive();
        if (payment == null || !payment.isPositive()) {
            throw new ValidationException("Payment amount must be greater than zero");
        }
        if (payment.isGreaterThan(currentBalance)) {
            throw new ValidationException(String.format(
                "Payment amount %s exceeds outstanding balance %s", payment, currentBalance));
        }
        Money remaining = currentBalance.minus(payment);
        return withBalance(remaining, !remaining.isZero());
    }

    public Loan rescheduleTo(LocalDate dueDate) {
        return new Loan(id, memberId, principal, interestRate, interestAmount, totalAmount,
            currentBalance, issueDate, dueDate, active);
    }

    /**
     * An active loan is overdue once the as-of date is past its due date.
     */
    public boolean isOverdueOn(LocalDate asOfDate) {
        return active && asOfDate.isAfter(nextDueDate);
    }

    public long daysOverdue(LocalDate asOfDate) {
        return isOverdueOn(asOfDate) ? ChronoUnit.DAYS.between(nextDueDate, asOfDate) : 0;
    }

    void requireActive() {
        if (!active) {
            throw new InvalidStateException("Loan is not active: " + id);
        }
    }

    private Loan withBalance(Money balance, boolean stillActive) {
        return new Loan(id, memberId, principal, interestRate, interestAmount, totalAmount,
            balance, issueDate, nextDueDate, stillActive);
    }
}
