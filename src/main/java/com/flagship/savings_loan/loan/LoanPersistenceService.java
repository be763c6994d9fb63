package com.flagship.savings_loan.loan;

import com.flagship.savings_loan.exception.NotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Bridges the Loan aggregate and its JPA entity.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LoanPersistenceService {

    private final LoanRepository loanRepository;

    /**
     * Inserts a new loan and flushes, so ledger rows referencing it can be written
     * with JDBC in the same transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Loan insert(Loan loan) {
        LoanEntity saved = loanRepository.saveAndFlush(LoanEntity.fromDomain(loan));
        log.debug("Saved loan {}", saved.getId());
        return saved.toDomain();
    }

    /**
     * Loads a loan with a row lock held for the rest of the transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Loan lock(UUID loanId) {
        return loanRepository.findByIdForUpdate(loanId)
            .map(LoanEntity::toDomain)
            .orElseThrow(() -> NotFoundException.loan(loanId));
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public Loan update(Loan loan) {
        LoanEntity existing = loanRepository.findById(loan.getId())
            .orElseThrow(() -> NotFoundException.loan(loan.getId()));
        existing.updateFromDomain(loan);
        LoanEntity updated = loanRepository.saveAndFlush(existing);
        log.debug("Updated loan {}: balance={}, nextDueDate={}, active={}",
            updated.getId(), updated.getCurrentBalance(), updated.getNextDueDate(), updated.isActive());
        return updated.toDomain();
    }

    @Transactional(readOnly = true)
    public Loan get(UUID loanId) {
        return loanRepository.findById(loanId)
            .map(LoanEntity::toDomain)
            .orElseThrow(() -> NotFoundException.loan(loanId));
    }

    @Transactional(readOnly = true)
    public Optional<Loan> findActiveLoan(UUID memberId) {
        return loanRepository.findByMemberIdAndActiveTrue(memberId)
            .map(LoanEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public boolean hasActiveLoan(UUID memberId) {
        return loanRepository.existsByMemberIdAndActiveTrue(memberId);
    }

    @Transactional(readOnly = true)
    public List<Loan> findLoansForMember(UUID memberId) {
        return loanRepository.findByMemberIdOrderByIssueDateAscCreatedAtAsc(memberId)
            .stream()
            .map(LoanEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public List<UUID> findActiveLoanIds() {
        return loanRepository.findActiveLoanIds();
    }
}
