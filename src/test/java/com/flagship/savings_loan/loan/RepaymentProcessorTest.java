package com.flagship.savings_loan.loan;

import com.flagship.savings_loan.exception.InvalidStateException;
import com.flagship.savings_loan.exception.ValidationException;
import com.flagship.savings_loan.ledger.LoanTransaction;
import com.flagship.savings_loan.ledger.LoanTransactionType;
import com.flagship.savings_loan.money.Money;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class RepaymentProcessorTest {

    private final LoanPolicy policy = LoanPolicy.standard();
    private final DueDateCalculator dueDates = policy.dueDateCalculator();
    private final OverdueInterestEngine engine = new OverdueInterestEngine(policy, dueDates);
    private final RepaymentProcessor processor = new RepaymentProcessor(engine, dueDates);

    private Loan issue(String principal, LocalDate issueDate) {
        return Loan.issue(UUID.randomUUID(), UUID.randomUUID(), Money.of(principal), policy, dueDates, issueDate);
    }

    @Test
    @DisplayName("Partial repayment on time reduces the balance and keeps the loan active")
    void testPartialRepayment() {
        Loan loan = issue("10000.00", LocalDate.of(2024, 3, 10));

        RepaymentOutcome outcome = processor.repay(loan, Money.of("3000.00"), LocalDate.of(2024, 4, 1));

        assertEquals(Money.of("9000.00"), outcome.getLoan().getCurrentBalance());
        assertTrue(outcome.getLoan().isActive());
        assertFalse(outcome.isLoanClosed());
        assertTrue(outcome.getOverdueCharges().isEmpty());
        assertEquals(LocalDate.of(2024, 4, 5), outcome.getLoan().getNextDueDate());

        LoanTransaction entry = outcome.getRepaymentEntry();
        assertEquals(LoanTransactionType.REPAYMENT, entry.getType());
        assertEquals(Money.of("3000.00"), entry.getAmount());
    }

    @Test
    @DisplayName("Paying on the due date itself is on time")
    void testPaymentOnDueDate() {
        Loan loan = issue("10000.00", LocalDate.of(2024, 3, 10));

        RepaymentOutcome outcome = processor.repay(loan, Money.of("3000.00"), LocalDate.of(2024, 4, 5));

        assertTrue(outcome.getOverdueCharges().isEmpty());
        assertEquals(Money.of("9000.00"), outcome.getLoan().getCurrentBalance());
        assertEquals(LocalDate.of(2024, 4, 5), outcome.getLoan().getNextDueDate());
    }

    @Test
    @DisplayName("Repaying the exact balance closes the loan")
    void testFullRepaymentCloses() {
        Loan loan = issue("10000.00", LocalDate.of(2024, 3, 10));

        RepaymentOutcome outcome = processor.repay(loan, Money.of("12000.00"), LocalDate.of(2024, 4, 1));

        assertFalse(outcome.getLoan().isActive());
        assertTrue(outcome.isLoanClosed());
        assertEquals(Money.ZERO, outcome.getLoan().getCurrentBalance());
        // The closed loan keeps its last due date
        assertEquals(LocalDate.of(2024, 4, 5), outcome.getLoan().getNextDueDate());
    }

    @Test
    @DisplayName("Overpayment is rejected and the loan is untouched")
    void testOverpaymentRejected() {
        Loan loan = issue("10000.00", LocalDate.of(2024, 3, 10));

        ValidationException e = assertThrows(ValidationException.class,
            () -> processor.repay(loan, Money.of("12000.01"), LocalDate.of(2024, 4, 1)));

        assertTrue(e.getMessage().contains("12000.00"));
        assertEquals(Money.of("12000.00"), loan.getCurrentBalance());
        assertTrue(loan.isActive());
    }

    @Test
    @DisplayName("Overpayment is judged against the balance after overdue interest")
    void testOverpaymentCheckedAfterInterest() {
        Loan loan = issue("10000.00", LocalDate.of(2024, 3, 10));
        LocalDate late = LocalDate.of(2024, 4, 6);

        // 12000.00 + 20% = 14400.00 owed on 6 April
        assertThrows(ValidationException.class, () -> processor.repay(loan, Money.of("14400.01"), late));

        RepaymentOutcome outcome = processor.repay(loan, Money.of("14400.00"), late);
        assertTrue(outcome.isLoanClosed());
        assertEquals(1, outcome.getOverdueCharges().size());
        assertEquals(Money.of("2400.00"), outcome.getOverdue().getTotalCharged());
    }

    @Test
    @DisplayName("A late partial payment compounds first, then reschedules from the payment date")
    void testLatePartialPayment() {
        Loan loan = issue("10000.00", LocalDate.of(2024, 3, 10));

        RepaymentOutcome outcome = processor.repay(loan, Money.of("4400.00"), LocalDate.of(2024, 5, 20));

        // Two missed due dates (5 April, 5 May): 12000 -> 14400 -> 17280
        assertEquals(2, outcome.getOverdueCharges().size());
        assertEquals(Money.of("12880.00"), outcome.getLoan().getCurrentBalance());
        assertEquals(LocalDate.of(2024, 6, 5), outcome.getLoan().getNextDueDate());

        List<LoanTransaction> entries = outcome.getLedgerEntries();
        assertEquals(3, entries.size());
        assertEquals(LoanTransactionType.OVERDUE_INTEREST, entries.get(0).getType());
        assertEquals(LoanTransactionType.OVERDUE_INTEREST, entries.get(1).getType());
        assertEquals(LoanTransactionType.REPAYMENT, entries.get(2).getType());
    }

    @Test
    @DisplayName("Closed loans and non-positive amounts are rejected")
    void testPreconditions() {
        Loan loan = issue("100.00", LocalDate.of(2024, 3, 10));
        Loan closed = processor.repay(loan, Money.of("120.00"), LocalDate.of(2024, 3, 20)).getLoan();

        assertThrows(InvalidStateException.class,
            () -> processor.repay(closed, Money.of("1.00"), LocalDate.of(2024, 3, 21)));
        assertThrows(ValidationException.class,
            () -> processor.repay(loan, Money.ZERO, LocalDate.of(2024, 3, 21)));
        assertThrows(ValidationException.class,
            () -> processor.repay(loan, null, LocalDate.of(2024, 3, 21)));
    }

    @Test
    @DisplayName("Replaying the ledger reproduces the balance after any sequence of operations")
    void testLedgerReplayReconstructsBalance() {
        LocalDate issueDate = LocalDate.of(2024, 1, 17);
        Loan loan = issue("7777.77", issueDate);
        List<LoanTransaction> ledger = new ArrayList<>();
        ledger.add(LoanTransaction.loanIssued(loan.getId(), loan.getPrincipal(), loan.getInterestAmount(),
            loan.getTotalAmount(), issueDate));
        assertEquals(loan.getCurrentBalance(), LoanTransaction.replay(ledger));

        OverdueAssessment overdue = engine.assess(loan, LocalDate.of(2024, 3, 9));
        loan = overdue.getLoan();
        ledger.addAll(overdue.getLedgerEntries());
        assertEquals(loan.getCurrentBalance(), LoanTransaction.replay(ledger));

        RepaymentOutcome first = processor.repay(loan, Money.of("1234.56"), LocalDate.of(2024, 4, 1));
        loan = first.getLoan();
        ledger.addAll(first.getLedgerEntries());
        assertEquals(loan.getCurrentBalance(), LoanTransaction.replay(ledger));

        RepaymentOutcome second = processor.repay(loan, Money.of("500.00"), LocalDate.of(2024, 7, 30));
        loan = second.getLoan();
        ledger.addAll(second.getLedgerEntries());
        assertEquals(loan.getCurrentBalance(), LoanTransaction.replay(ledger));

        Money payoff = engine.assess(loan, LocalDate.of(2024, 8, 2)).getLoan().getCurrentBalance();
        RepaymentOutcome last = processor.repay(loan, payoff, LocalDate.of(2024, 8, 2));
        ledger.addAll(last.getLedgerEntries());

        assertTrue(last.isLoanClosed());
        assertEquals(Money.ZERO, LoanTransaction.replay(ledger));
    }
}
