package com.flagship.savings_loan.member;

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
 * JPA Entity for members.
 *
 * The savings balance is a cached projection of the savings ledger and only grows,
 * through {@link #creditSavings(Money)}.
 */
@Entity
@Table(
    name = "members",
    indexes = @Index(name = "idx_members_member_number", columnList = "member_number", unique = true)
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class MemberEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "member_number", nullable = false, updatable = false, unique = true, length = 50)
    private String memberNumber;

    @Column(name = "full_name", nullable = false, length = 200)
    private String fullName;

    @Column(name = "date_joined", nullable = false, updatable = false)
    private LocalDate dateJoined;

    @Column(name = "savings_balance", nullable = false, precision = 19, scale = 2)
    private BigDecimal savingsBalance;

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

    /**
     * New member with an empty savings balance; the initial deposit is recorded
     * through the savings ledger like any other payment.
     */
    public static MemberEntity register(UUID id, String memberNumber, String fullName, LocalDate dateJoined) {
        return new MemberEntity(id, memberNumber, fullName, dateJoined,
            Money.ZERO.getAmount(), null, null, null);
    }

    public Member toDomain() {
        return new Member(id, memberNumber, fullName, dateJoined, Money.of(savingsBalance));
    }

    public void creditSavings(Money amount) {
        if (!amount.isPositive()) {
            throw new IllegalArgumentException("Savings credit must be positive: " + amount);
        }
        this.savingsBalance = Money.of(savingsBalance).plus(amount).getAmount();
    }
}
