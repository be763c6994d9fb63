package com.flagship.savings_loan.loan;

import com.flagship.savings_loan.exception.ConflictException;
import com.flagship.savings_loan.exception.InvalidStateException;
import com.flagship.savings_loan.exception.NotFoundException;
import com.flagship.savings_loan.exception.ValidationException;
import com.flagship.savings_loan.ledger.LedgerService;
import com.flagship.savings_loan.ledger.LoanTransaction;
import com.flagship.savings_loan.loan.event.LoanIssuedEvent;
import com.flagship.savings_loan.loan.event.LoanRepaymentRecordedEvent;
import com.flagship.savings_loan.loan.event.OverdueInterestAppliedEvent;
import com.flagship.savings_loan.member.MemberRepository;
import com.flagship.savings_loan.money.Money;
import com.flagship.savings_loan.observability.CorrelationContext;
import com.flagship.savings_loan.observability.LedgerMetrics;
import com.flagship.savings_loan.outbox.AggregateType;
import com.flagship.savings_loan.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Runs loan operations against the database.
 *
 * Each mutating operation is one transaction that:
 * 1. Locks the aggregate row (member for issuance, loan otherwise)
 * 2. Computes the new state with the pure engine components
 * 3. Writes the loan row, its ledger entries and its outbox event
 *
 * Any failure rolls all three back, so the ledger and the cached balance never
 * disagree.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LoanService {

    private final LoanPersistenceService persistenceService;
    private final MemberRepository memberRepository;
    private final LedgerService ledgerService;
    private final OverdueInterestEngine overdueInterestEngine;
    private final RepaymentProcessor repaymentProcessor;
    private final LoanPolicy loanPolicy;
    private final DueDateCalculator dueDates;
    private final OutboxService outboxService;
    private final LedgerMetrics metrics;

    /**
     * Issues a loan to a member.
     *
     * @throws ValidationException if the principal is missing, not positive, finer than cents,
     *                             or too large for the ledger once interest is added
     * @throws NotFoundException   if the member does not exist
     * @throws ConflictException   if the member already has an active loan
     */
    @Transactional
    public Loan issueLoan(UUID memberId, BigDecimal principal, LocalDate asOfDate) {
        if (principal == null || principal.signum() <= 0) {
            throw new ValidationException("Loan principal must be greater than zero");
        }
        if (!Money.isWholeCents(principal)) {
            throw new ValidationException("Loan principal must have at most 2 decimal places: " + principal.toPlainString());
        }
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.MEMBER_ID_MDC_KEY, memberId.toString());

        try {
            // Member row lock serializes concurrent issuance for the same member
            memberRepository.findByIdForUpdate(memberId)
                .orElseThrow(() -> NotFoundException.member(memberId));

            if (persistenceService.hasActiveLoan(memberId)) {
                throw new ConflictException("Member already has an active loan: " + memberId);
            }

            Loan loan = Loan.issue(UUID.randomUUID(), memberId, Money.of(principal), loanPolicy, dueDates, asOfDate);
            Loan saved = persistenceService.insert(loan);
            MDC.put(CorrelationContext.LOAN_ID_MDC_KEY, saved.getId().toString());

            ledgerService.appendLoanTransaction(LoanTransaction.loanIssued(
                saved.getId(), saved.getPrincipal(), saved.getInterestAmount(), saved.getTotalAmount(), asOfDate));
            outboxService.saveEvent(AggregateType.LOAN, saved.getId(), LoanIssuedEvent.EVENT_TYPE,
                LoanIssuedEvent.fromLoan(saved));

            metrics.recordLoanIssued();
            metrics.recordLatency("issue", System.currentTimeMillis() - startTime);
            log.info("Loan issued: principal={}, interest={}, total={}, nextDueDate={}",
                saved.getPrincipal(), saved.getInterestAmount(), saved.getTotalAmount(), saved.getNextDueDate());
            return saved;

        } finally {
            MDC.remove(CorrelationContext.LOAN_ID_MDC_KEY);
            MDC.remove(CorrelationContext.MEMBER_ID_MDC_KEY);
        }
    }

    /**
     * Compounds overdue interest up to {@code asOfDate} and advances the due date.
     * Returns an empty list when the loan is closed or not overdue; nothing is written then.
     */
    @Transactional
    public List<OverdueCharge> applyOverdueInterest(UUID loanId, LocalDate asOfDate) {
        MDC.put(CorrelationContext.LOAN_ID_MDC_KEY, loanId.toString());
        try {
            Loan loan = persistenceService.lock(loanId);
            OverdueAssessment assessment = overdueInterestEngine.assess(loan, asOfDate);
            if (!assessment.isOverdue()) {
                return List.of();
            }
            recordOverdueInterest(assessment, asOfDate);
            persistenceService.update(assessment.getLoan());
            return assessment.getCharges();
        } finally {
            MDC.remove(CorrelationContext.LOAN_ID_MDC_KEY);
        }
    }

    /**
     * Applies a repayment, compounding any overdue interest first.
     *
     * @throws InvalidStateException if the loan is closed
     * @throws ValidationException   if the amount is not positive, finer than cents, or exceeds the
     *                               balance after interest
     * @throws NotFoundException     if the loan does not exist
     */
    @Transactional
    public RepaymentOutcome repayLoan(UUID loanId, BigDecimal amount, LocalDate asOfDate) {
        if (amount == null || amount.signum() <= 0) {
            throw new ValidationException("Payment amount must be greater than zero");
        }
        if (!Money.isWholeCents(amount)) {
            throw new ValidationException("Payment amount must have at most 2 decimal places: " + amount.toPlainString());
        }
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.LOAN_ID_MDC_KEY, loanId.toString());

        try {
            Loan loan = persistenceService.lock(loanId);
            RepaymentOutcome outcome;
            try {
                outcome = repaymentProcessor.repay(loan, Money.of(amount), asOfDate);
            } catch (ValidationException | InvalidStateException e) {
                metrics.recordRepayment("rejected");
                log.warn("Repayment rejected: amount={}, reason={}", amount, e.getMessage());
                throw e;
            }

            if (outcome.getOverdue().isOverdue()) {
                recordOverdueInterest(outcome.getOverdue(), asOfDate);
            }
            ledgerService.appendLoanTransaction(outcome.getRepaymentEntry());
            Loan updated = persistenceService.update(outcome.getLoan());

            outboxService.saveEvent(AggregateType.LOAN, loanId, LoanRepaymentRecordedEvent.EVENT_TYPE,
                LoanRepaymentRecordedEvent.fromOutcome(outcome, asOfDate));

            metrics.recordRepayment(outcome.isLoanClosed() ? "closed" : "partial");
            metrics.recordLatency("repay", System.currentTimeMillis() - startTime);
            if (outcome.isLoanClosed()) {
                metrics.recordLoanClosed();
                log.info("Loan fully repaid and closed: payment={}", amount);
            } else {
                log.info("Repayment recorded: payment={}, remainingBalance={}, nextDueDate={}",
                    amount, updated.getCurrentBalance(), updated.getNextDueDate());
            }
            return outcome;

        } finally {
            MDC.remove(CorrelationContext.LOAN_ID_MDC_KEY);
        }
    }

    /**
     * Shows what {@link #applyOverdueInterest} would charge on {@code asOfDate}
     * without writing anything.
     */
    @Transactional(readOnly = true)
    public OverdueAssessment previewOverdueInterest(UUID loanId, LocalDate asOfDate) {
        return overdueInterestEngine.assess(persistenceService.get(loanId), asOfDate);
    }

    /**
     * Replays the loan's ledger and compares it with the cached balance.
     */
    @Transactional(readOnly = true)
    public LedgerReconciliation reconcile(UUID loanId) {
        Loan loan = persistenceService.get(loanId);
        List<LoanTransaction> history = ledgerService.getLoanTransactions(loanId);
        LedgerReconciliation reconciliation = new LedgerReconciliation(
            loanId, loan.getCurrentBalance(), LoanTransaction.replay(history), history.size());
        if (!reconciliation.isBalanced()) {
            log.error("Loan ledger out of balance: loanId={}, cached={}, ledger={}",
                loanId, reconciliation.getCachedBalance(), reconciliation.getLedgerBalance());
        }
        return reconciliation;
    }

    @Transactional(readOnly = true)
    public Loan getLoan(UUID loanId) {
        return persistenceService.get(loanId);
    }

    @Transactional(readOnly = true)
    public List<Loan> getLoansForMember(UUID memberId) {
        if (!memberRepository.existsById(memberId)) {
            throw NotFoundException.member(memberId);
        }
        return persistenceService.findLoansForMember(memberId);
    }

    @Transactional(readOnly = true)
    public List<LoanTransaction> getTransactionHistory(UUID loanId) {
        persistenceService.get(loanId);
        return ledgerService.getLoanTransactions(loanId);
    }

    private void recordOverdueInterest(OverdueAssessment assessment, LocalDate asOfDate) {
        for (LoanTransaction entry : assessment.getLedgerEntries()) {
            ledgerService.appendLoanTransaction(entry);
        }
        outboxService.saveEvent(AggregateType.LOAN, assessment.getLoan().getId(),
            OverdueInterestAppliedEvent.EVENT_TYPE,
            OverdueInterestAppliedEvent.fromAssessment(assessment, asOfDate));

        metrics.recordOverdueInterest(assessment.getCharges().size(), assessment.getTotalCharged().getAmount());
        log.warn("Applied overdue interest: total={} over {} period(s), newBalance={}, nextDueDate={}",
            assessment.getTotalCharged(), assessment.getCharges().size(),
            assessment.getLoan().getCurrentBalance(), assessment.getLoan().getNextDueDate());
    }
}
