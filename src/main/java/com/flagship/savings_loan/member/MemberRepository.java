package com.flagship.savings_loan.member;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface MemberRepository extends JpaRepository<MemberEntity, UUID> {

    /**
     * Loads a member and holds a row lock until the surrounding transaction ends.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT m FROM MemberEntity m WHERE m.id = :id")
    Optional<MemberEntity> findByIdForUpdate(@Param("id") UUID id);

    Optional<MemberEntity> findByMemberNumber(String memberNumber);

    boolean existsByMemberNumber(String memberNumber);

    @Query("SELECT COALESCE(SUM(m.savingsBalance), 0) FROM MemberEntity m")
    BigDecimal sumSavingsBalance();
}
