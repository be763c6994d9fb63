package com.flagship.savings_loan.loan;

import com.flagship.savings_loan.exception.InvalidStateException;
import com.flagship.savings_loan.exception.ValidationException;
import com.flagship.savings_loan.ledger.LoanTransaction;
import com.flagship.savings_loan.money.Money;
import org.springframework.stereotype.Component;

import java.time.LocalDate;

/**
 * Applies a payment to a loan.
 *
 * Order of operations:
 * 1. Compound any overdue interest up to the payment date
 * 2. Reject payments above the post-interest balance
 * 3. Reduce the balance
 * 4. Close the loan if settled, otherwise move the due date relative to the payment date
 *
 * Nothing is returned until every step has succeeded, so a rejected payment leaves
 * no trace.
 */
@Component
public class RepaymentProcessor {

    private final OverdueInterestEngine overdueInterestEngine;
    private final DueDateCalculator dueDates;

    public RepaymentProcessor(OverdueInterestEngine overdueInterestEngine, DueDateCalculator dueDates) {
        this.overdueInterestEngine = overdueInterestEngine;
        this.dueDates = dueDates;
    }

    /**
     * @throws InvalidStateException if the loan is already closed
     * @throws ValidationException   if the amount is not positive or exceeds the balance after interest
     */
    public RepaymentOutcome repay(Loan loan, Money paymentAmount, LocalDate asOfDate) {
        if (!loan.isActive()) {
            throw new InvalidStateException("Loan is not active: " + loan.getId());
        }
        if (paymentAmount == null || !paymentAmount.isPositive()) {
            throw new ValidationException("Payment amount must be greater than zero");
        }

        OverdueAssessment overdue = overdueInterestEngine.assess(loan, asOfDate);

        Loan repaid = overdue.getLoan().applyRepayment(paymentAmount);
        if (repaid.isActive()) {
            repaid = repaid.rescheduleTo(dueDates.nextDueDate(asOfDate));
        }

        LoanTransaction entry = LoanTransaction.repayment(loan.getId(), paymentAmount, asOfDate);
        return new RepaymentOutcome(repaid, paymentAmount, overdue, entry);
    }
}
