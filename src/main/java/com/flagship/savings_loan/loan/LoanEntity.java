package com.flagship.savings_loan.loan;

import com.flagship.savings_loan.money.Money;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * JPA Entity for Loan persistence.
 *
 * - No @Setter: balance, due date and status change only through updateFromDomain()
 * - Issue terms (principal, rate, interest, total, issue date) are updatable = false
 * - Timestamps are maintained by lifecycle hooks
 * - One active loan per member is also enforced by a partial unique index in the schema
 */
@Entity
@Table(
    name = "loans",
    indexes = {
        @Index(name = "idx_loans_member_id", columnList = "member_id"),
        @Index(name = "idx_loans_active_due", columnList = "is_active, next_due_date")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LoanEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "member_id", nullable = false, updatable = false)
    private UUID memberId;

    @Column(name = "principal_amount", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal principalAmount;

    @Column(name = "interest_rate", nullable = false, updatable = false, precision = 5, scale = 4)
    private BigDecimal interestRate;

    @Column(name = "interest_amount", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal interestAmount;

    @Column(name = "total_amount", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal totalAmount;

    @Column(name = "current_balance", nullable = false, precision = 19, scale = 2)
    private BigDecimal currentBalance;

    @Column(name = "issue_date", nullable = false, updatable = false)
    private LocalDate issueDate;

    @Column(name = "next_due_date", nullable = false)
    private LocalDate nextDueDate;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Version
    @Column(nullable = false)
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static LoanEntity fromDomain(Loan loan) {
        return new LoanEntity(
            loan.getId(),
            loan.getMemberId(),
            loan.getPrincipal().getAmount(),
            loan.getInterestRate(),
            loan.getInterestAmount().getAmount(),
            loan.getTotalAmount().getAmount(),
            loan.getCurrentBalance().getAmount(),
            loan.getIssueDate(),
            loan.getNextDueDate(),
            loan.isActive(),
            null, // version - null marks the entity as new
            null, // createdAt - set by @PrePersist
            null  // updatedAt - set by @PrePersist
        );
    }

    public Loan toDomain() {
        return new Loan(
            id,
            memberId,
            Money.of(principalAmount),
            interestRate,
            Money.of(interestAmount),
            Money.of(totalAmount),
            Money.of(currentBalance),
            issueDate,
            nextDueDate,
            active
        );
    }

    /**
     * Copies the mutable state of a loan: balance, due date and status.
     */
    void updateFromDomain(Loan loan) {
        if (!loan.getId().equals(this.id)) {
            throw new IllegalArgumentException(
                "Cannot update loan " + this.id + " from loan " + loan.getId());
        }
        this.currentBalance = loan.getCurrentBalance().getAmount();
        this.nextDueDate = loan.getNextDueDate();
        this.active = loan.isActive();
    }
}
