package com.flagship.savings_loan.loan;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface LoanRepository extends JpaRepository<LoanEntity, UUID> {

    /**
     * Loads a loan and holds a row lock until the surrounding transaction ends.
     * Serializes repayments and overdue sweeps on the same loan.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT l FROM LoanEntity l WHERE l.id = :id")
    Optional<LoanEntity> findByIdForUpdate(@Param("id") UUID id);

    Optional<LoanEntity> findByMemberIdAndActiveTrue(UUID memberId);

    boolean existsByMemberIdAndActiveTrue(UUID memberId);

    List<LoanEntity> findByMemberIdOrderByIssueDateAscCreatedAtAsc(UUID memberId);

    @Query("SELECT l.id FROM LoanEntity l WHERE l.active = true ORDER BY l.issueDate ASC, l.createdAt ASC")
    List<UUID> findActiveLoanIds();

    long countByActiveTrue();

    long countByActiveTrueAndNextDueDateBefore(LocalDate date);

    @Query("SELECT COALESCE(SUM(l.currentBalance), 0) FROM LoanEntity l WHERE l.active = true")
    BigDecimal sumOutstandingBalance();
}
