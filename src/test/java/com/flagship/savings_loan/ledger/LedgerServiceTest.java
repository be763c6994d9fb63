package com.flagship.savings_loan.ledger;

import com.flagship.savings_loan.loan.Loan;
import com.flagship.savings_loan.loan.LoanPersistenceService;
import com.flagship.savings_loan.loan.LoanPolicy;
import com.flagship.savings_loan.member.Member;
import com.flagship.savings_loan.member.MemberService;
import com.flagship.savings_loan.money.Money;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.IllegalTransactionStateException;
import org.springframework.transaction.support.TransactionTemplate;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tries to break the ledger tables directly.
 *
 * These tests attempt to:
 * - Append outside a transaction
 * - Reference a loan that does not exist
 * - Insert a second active loan for a member behind the service's back
 * - Write negative amounts
 *
 * The goal is to verify that the database enforces what the services assume.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class LedgerServiceTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("savings_loan_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("spring.kafka.admin.auto-create", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
        registry.add("overdue.sweep.enabled", () -> "false");
    }

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private LoanPersistenceService loanPersistenceService;

    @Autowired
    private MemberService memberService;

    @Autowired
    private TransactionTemplate transactionTemplate;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private Member member;
    private Loan loan;

    @BeforeEach
    void setUp() {
        String number = "L-" + UUID.randomUUID().toString().substring(0, 8);
        member = memberService.registerMember(number, "Ledger Test " + number, LocalDate.of(2024, 1, 2));

        LoanPolicy policy = LoanPolicy.standard();
        Loan issued = Loan.issue(UUID.randomUUID(), member.getId(), Money.of("1000.00"), policy,
            policy.dueDateCalculator(), LocalDate.of(2024, 3, 10));
        loan = transactionTemplate.execute(status -> loanPersistenceService.insert(issued));
    }

    // Helper methods for test output
    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printExpectedException(String exceptionType, String reason) {
        System.out.println("⚠ EXPECTED EXCEPTION: " + exceptionType);
        System.out.println("  Reason: " + reason);
    }

    @Test
    @DisplayName("Appended entries come back in insertion order with database-assigned sequence numbers")
    void testAppendAndRead() {
        printTestHeader("Append And Read");

        LoanTransaction issued = LoanTransaction.loanIssued(loan.getId(), loan.getPrincipal(),
            loan.getInterestAmount(), loan.getTotalAmount(), loan.getIssueDate());
        LoanTransaction repaid = LoanTransaction.repayment(loan.getId(), Money.of("200.00"), LocalDate.of(2024, 3, 20));

        LoanTransaction first = transactionTemplate.execute(status -> ledgerService.appendLoanTransaction(issued));
        LoanTransaction second = transactionTemplate.execute(status -> ledgerService.appendLoanTransaction(repaid));

        assertNotNull(first.getSequenceNumber());
        assertNotNull(first.getRecordedAt());
        assertTrue(first.getSequenceNumber() < second.getSequenceNumber());

        List<LoanTransaction> history = ledgerService.getLoanTransactions(loan.getId());
        assertEquals(2, history.size());
        assertEquals(issued.getId(), history.get(0).getId());
        assertEquals(LoanTransactionType.REPAYMENT, history.get(1).getType());
        assertEquals(Money.of("200.00"), history.get(1).getAmount());
        assertEquals(LocalDate.of(2024, 3, 20), history.get(1).getTransactionDate());

        assertEquals(Money.of("1000.00"), LoanTransaction.replay(history));
    }

    @Test
    @DisplayName("Appending outside a transaction is refused")
    void testAppendRequiresTransaction() {
        printTestHeader("Append Outside Transaction");

        LoanTransaction entry = LoanTransaction.repayment(loan.getId(), Money.of("1.00"), LocalDate.of(2024, 3, 20));

        assertThrows(IllegalTransactionStateException.class, () -> ledgerService.appendLoanTransaction(entry));
        printExpectedException("IllegalTransactionStateException", "ledger writes must join the caller's transaction");
        assertTrue(ledgerService.getLoanTransactions(loan.getId()).isEmpty());
    }

    @Test
    @DisplayName("Entries for an unknown loan violate the foreign key")
    void testUnknownLoanRejected() {
        printTestHeader("Unknown Loan");

        LoanTransaction orphan = LoanTransaction.repayment(UUID.randomUUID(), Money.of("1.00"), LocalDate.of(2024, 3, 20));

        assertThrows(DataIntegrityViolationException.class,
            () -> transactionTemplate.execute(status -> ledgerService.appendLoanTransaction(orphan)));
        printExpectedException("DataIntegrityViolationException", "loan_id references loans(id)");
    }

    @Test
    @DisplayName("The database refuses a second active loan for a member")
    void testSecondActiveLoanRejectedByIndex() {
        printTestHeader("Second Active Loan");

        assertThrows(DataIntegrityViolationException.class, () -> jdbcTemplate.update(
            "INSERT INTO loans (id, member_id, principal_amount, interest_rate, interest_amount, total_amount, " +
            "current_balance, issue_date, next_due_date, is_active, version, created_at, updated_at) " +
            "VALUES (?, ?, 100, 0.2, 20, 120, 120, DATE '2024-03-11', DATE '2024-04-05', TRUE, 0, now(), now())",
            UUID.randomUUID(), member.getId()));
        printExpectedException("DataIntegrityViolationException", "partial unique index on active loans");
    }

    @Test
    @DisplayName("Negative ledger amounts are refused by the table")
    void testNegativeAmountRejected() {
        printTestHeader("Negative Amount");

        assertThrows(DataIntegrityViolationException.class, () -> jdbcTemplate.update(
            "INSERT INTO loan_transactions (id, loan_id, amount, transaction_type, description, transaction_date) " +
            "VALUES (?, ?, -5.00, 'REPAYMENT', 'bad', DATE '2024-03-20')",
            UUID.randomUUID(), loan.getId()));
    }

    @Test
    @DisplayName("Savings ledger reconstructs the member's balance")
    void testSavingsLedger() {
        printTestHeader("Savings Ledger");

        List<SavingsTransaction> history = ledgerService.getSavingsTransactions(member.getId());
        assertEquals(1, history.size());
        assertEquals(SavingsTransactionType.INITIAL_DEPOSIT, history.get(0).getType());
        assertEquals(member.getSavingsBalance(),
            history.stream().map(SavingsTransaction::getAmount).reduce(Money.ZERO, Money::plus));
    }
}
