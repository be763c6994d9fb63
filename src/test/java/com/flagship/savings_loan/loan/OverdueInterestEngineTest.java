package com.flagship.savings_loan.loan;

import com.flagship.savings_loan.exception.InvalidStateException;
import com.flagship.savings_loan.exception.ValidationException;
import com.flagship.savings_loan.ledger.LoanTransaction;
import com.flagship.savings_loan.ledger.LoanTransactionType;
import com.flagship.savings_loan.money.Money;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.LocalDate;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class OverdueInterestEngineTest {

    private final LoanPolicy policy = LoanPolicy.standard();
    private final DueDateCalculator dueDates = policy.dueDateCalculator();
    private final OverdueInterestEngine engine = new OverdueInterestEngine(policy, dueDates);

    private static Loan loanWithBalance(String balance, LocalDate nextDueDate) {
        Money amount = Money.of(balance);
        return new Loan(UUID.randomUUID(), UUID.randomUUID(), amount, new BigDecimal("0.20"),
            Money.ZERO, amount, amount, nextDueDate.minusMonths(1), nextDueDate, true);
    }

    @Test
    @DisplayName("Two missed due dates compound 9000.00 to 12960.00")
    void testTwoPeriodsCompound() {
        Loan loan = loanWithBalance("9000.00", LocalDate.of(2024, 3, 5));

        OverdueAssessment assessment = engine.assess(loan, LocalDate.of(2024, 4, 6));

        assertTrue(assessment.isOverdue());
        assertEquals(2, assessment.getCharges().size());

        OverdueCharge first = assessment.getCharges().get(0);
        assertEquals(1, first.getPeriodIndex());
        assertEquals(Money.of("1800.00"), first.getChargeAmount());
        assertEquals(Money.of("10800.00"), first.getNewBalance());

        OverdueCharge second = assessment.getCharges().get(1);
        assertEquals(2, second.getPeriodIndex());
        assertEquals(Money.of("2160.00"), second.getChargeAmount());
        assertEquals(Money.of("12960.00"), second.getNewBalance());

        assertEquals(Money.of("12960.00"), assessment.getLoan().getCurrentBalance());
        assertEquals(Money.of("3960.00"), assessment.getTotalCharged());
        assertEquals(LocalDate.of(2024, 5, 5), assessment.getLoan().getNextDueDate());
    }

    @Test
    @DisplayName("Each charge produces one overdue ledger entry dated on the as-of date")
    void testLedgerEntries() {
        Loan loan = loanWithBalance("9000.00", LocalDate.of(2024, 3, 5));
        LocalDate asOf = LocalDate.of(2024, 4, 6);

        OverdueAssessment assessment = engine.assess(loan, asOf);

        assertEquals(2, assessment.getLedgerEntries().size());
        for (LoanTransaction entry : assessment.getLedgerEntries()) {
            assertEquals(LoanTransactionType.OVERDUE_INTEREST, entry.getType());
            assertEquals(loan.getId(), entry.getLoanId());
            assertEquals(asOf, entry.getTransactionDate());
        }
        assertEquals(Money.of("1800.00"), assessment.getLedgerEntries().get(0).getAmount());
        assertEquals(Money.of("2160.00"), assessment.getLedgerEntries().get(1).getAmount());
    }

    @Test
    @DisplayName("Assessing twice for the same date charges nothing the second time")
    void testRepeatAssessmentIsNoOp() {
        Loan loan = loanWithBalance("9000.00", LocalDate.of(2024, 3, 5));
        LocalDate asOf = LocalDate.of(2024, 4, 6);

        Loan afterFirst = engine.assess(loan, asOf).getLoan();
        OverdueAssessment second = engine.assess(afterFirst, asOf);

        assertFalse(second.isOverdue());
        assertTrue(second.getCharges().isEmpty());
        assertSame(afterFirst, second.getLoan());
        assertEquals(Money.ZERO, second.getTotalCharged());
    }

    @Test
    @DisplayName("Nothing is charged on or before the due date")
    void testNotOverdue() {
        Loan loan = loanWithBalance("9000.00", LocalDate.of(2024, 3, 5));

        assertFalse(engine.assess(loan, LocalDate.of(2024, 3, 5)).isOverdue());
        assertFalse(engine.assess(loan, LocalDate.of(2024, 2, 20)).isOverdue());
    }

    @Test
    @DisplayName("One day late costs one full period")
    void testOneDayLate() {
        Loan loan = loanWithBalance("1000.00", LocalDate.of(2024, 3, 5));

        OverdueAssessment assessment = engine.assess(loan, LocalDate.of(2024, 3, 6));

        assertEquals(1, assessment.getCharges().size());
        assertEquals(Money.of("1200.00"), assessment.getLoan().getCurrentBalance());
        assertEquals(LocalDate.of(2024, 4, 5), assessment.getLoan().getNextDueDate());
    }

    @Test
    @DisplayName("Balance after n periods equals B x 1.2^n and charges strictly increase")
    void testCompoundingMatchesClosedForm() {
        Loan loan = loanWithBalance("12345.67", LocalDate.of(2023, 1, 5));
        LocalDate asOf = LocalDate.of(2023, 12, 20);

        OverdueAssessment assessment = engine.assess(loan, asOf);
        int n = assessment.getCharges().size();
        assertEquals(12, n);

        BigDecimal expected = new BigDecimal("12345.67")
            .multiply(new BigDecimal("1.20").pow(n), MathContext.DECIMAL64);
        BigDecimal actual = assessment.getLoan().getCurrentBalance().getAmount();
        // Per-period rounding to cents drifts by at most half a cent per period, compounded
        assertTrue(actual.subtract(expected).abs().compareTo(new BigDecimal("0.25")) <= 0,
            "expected ~" + expected + " but was " + actual);

        for (int i = 1; i < n; i++) {
            Money previous = assessment.getCharges().get(i - 1).getChargeAmount();
            Money current = assessment.getCharges().get(i).getChargeAmount();
            assertTrue(current.isGreaterThan(previous), "charge " + (i + 1) + " should exceed charge " + i);
        }
    }

    @Test
    @DisplayName("Closed loans are never assessed")
    void testClosedLoan() {
        Loan loan = loanWithBalance("100.00", LocalDate.of(2024, 3, 5)).applyRepayment(Money.of("100.00"));

        OverdueAssessment assessment = engine.assess(loan, LocalDate.of(2024, 9, 1));

        assertFalse(assessment.isOverdue());
        assertThrows(InvalidStateException.class, loan::requireActive);
    }

    @Test
    @DisplayName("A configured overdue rate replaces the standard one")
    void testCustomRate() {
        LoanPolicy tenPercent = new LoanPolicy(new BigDecimal("0.20"), new BigDecimal("0.10"), 5);
        OverdueInterestEngine custom = new OverdueInterestEngine(tenPercent, tenPercent.dueDateCalculator());
        Loan loan = loanWithBalance("1000.00", LocalDate.of(2024, 3, 5));

        OverdueAssessment assessment = custom.assess(loan, LocalDate.of(2024, 4, 6));

        assertEquals(Money.of("1210.00"), assessment.getLoan().getCurrentBalance());
    }

    @Test
    @DisplayName("Compounding up to the largest storable balance succeeds")
    void testChargeUpToLargestStorableBalance() {
        Loan loan = loanWithBalance("83333333333333333.32", LocalDate.of(2024, 3, 5));

        OverdueAssessment assessment = engine.assess(loan, LocalDate.of(2024, 3, 6));

        assertEquals(Money.of("99999999999999999.98"), assessment.getLoan().getCurrentBalance());
    }

    @Test
    @DisplayName("Compounding past the largest storable balance is rejected")
    void testChargePastLargestStorableBalance() {
        Loan loan = loanWithBalance("83333333333333333.32", LocalDate.of(2024, 3, 5));

        ValidationException e = assertThrows(ValidationException.class,
            () -> engine.assess(loan, LocalDate.of(2024, 4, 6)));
        assertTrue(e.getMessage().contains("maximum supported amount"));
    }
}
