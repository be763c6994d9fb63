package com.flagship.savings_loan.member;

import com.flagship.savings_loan.exception.ConflictException;
import com.flagship.savings_loan.exception.NotFoundException;
import com.flagship.savings_loan.exception.ValidationException;
import com.flagship.savings_loan.ledger.SavingsTransactionType;
import com.flagship.savings_loan.loan.LoanPersistenceService;
import com.flagship.savings_loan.outbox.AggregateType;
import com.flagship.savings_loan.outbox.OutboxService;
import com.flagship.savings_loan.savings.SavingsPolicy;
import com.flagship.savings_loan.savings.SavingsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Member registry: registration, lookup and summaries.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MemberService {

    private final MemberRepository memberRepository;
    private final SavingsService savingsService;
    private final LoanPersistenceService loanPersistenceService;
    private final OutboxService outboxService;
    private final SavingsPolicy savingsPolicy;

    /**
     * Registers a member and records the scheme's initial deposit.
     *
     * @throws ValidationException if the member number or name is blank
     * @throws ConflictException   if the member number is already taken
     */
    @Transactional
    public Member registerMember(String memberNumber, String fullName, LocalDate asOfDate) {
        if (memberNumber == null || memberNumber.isBlank()) {
            throw new ValidationException("Member number is required");
        }
        if (fullName == null || fullName.isBlank()) {
            throw new ValidationException("Full name is required");
        }
        String number = memberNumber.trim();
        if (memberRepository.existsByMemberNumber(number)) {
            throw new ConflictException("Member number already exists: " + number);
        }

        MemberEntity saved = memberRepository.saveAndFlush(
            MemberEntity.register(UUID.randomUUID(), number, fullName.trim(), asOfDate));

        savingsService.recordSavingsPayment(saved.getId(), savingsPolicy.getInitialDeposit().getAmount(),
            SavingsTransactionType.INITIAL_DEPOSIT, asOfDate);

        Member member = getMember(saved.getId());
        outboxService.saveEvent(AggregateType.MEMBER, member.getId(), MemberRegisteredEvent.EVENT_TYPE,
            MemberRegisteredEvent.fromMember(member));

        log.info("Member registered: memberId={}, memberNumber={}, initialDeposit={}",
            member.getId(), number, savingsPolicy.getInitialDeposit());
        return member;
    }

    @Transactional(readOnly = true)
    public Member getMember(UUID memberId) {
        return memberRepository.findById(memberId)
            .map(MemberEntity::toDomain)
            .orElseThrow(() -> NotFoundException.member(memberId));
    }

    @Transactional(readOnly = true)
    public MemberSummary summarize(UUID memberId, LocalDate asOfDate) {
        Member member = getMember(memberId);
        return new MemberSummary(
            member,
            loanPersistenceService.findActiveLoan(memberId).orElse(null),
            asOfDate
        );
    }
}
