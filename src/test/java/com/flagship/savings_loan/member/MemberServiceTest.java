package com.flagship.savings_loan.member;

import com.flagship.savings_loan.exception.ConflictException;
import com.flagship.savings_loan.exception.NotFoundException;
import com.flagship.savings_loan.exception.ValidationException;
import com.flagship.savings_loan.ledger.SavingsTransactionType;
import com.flagship.savings_loan.loan.Loan;
import com.flagship.savings_loan.loan.LoanPersistenceService;
import com.flagship.savings_loan.loan.LoanPolicy;
import com.flagship.savings_loan.money.Money;
import com.flagship.savings_loan.outbox.AggregateType;
import com.flagship.savings_loan.outbox.OutboxService;
import com.flagship.savings_loan.savings.SavingsPolicy;
import com.flagship.savings_loan.savings.SavingsService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MemberServiceTest {

    @Mock
    private MemberRepository memberRepository;
    @Mock
    private SavingsService savingsService;
    @Mock
    private LoanPersistenceService loanPersistenceService;
    @Mock
    private OutboxService outboxService;

    private MemberService memberService;

    @BeforeEach
    void setUp() {
        memberService = new MemberService(memberRepository, savingsService, loanPersistenceService,
            outboxService, SavingsPolicy.standard());
    }

    @Test
    @DisplayName("Registration saves the member, records the initial deposit and emits MemberRegistered")
    void testRegisterMember() {
        AtomicReference<MemberEntity> saved = new AtomicReference<>();
        when(memberRepository.existsByMemberNumber("M-200")).thenReturn(false);
        when(memberRepository.saveAndFlush(any(MemberEntity.class))).thenAnswer(inv -> {
            saved.set(inv.getArgument(0));
            return inv.getArgument(0);
        });
        when(memberRepository.findById(any(UUID.class))).thenAnswer(inv -> Optional.ofNullable(saved.get()));

        Member member = memberService.registerMember(" M-200 ", " Nomsa Mamba ", LocalDate.of(2024, 1, 15));

        assertThat(member.getMemberNumber()).isEqualTo("M-200");
        assertThat(member.getFullName()).isEqualTo("Nomsa Mamba");
        assertThat(member.getDateJoined()).isEqualTo(LocalDate.of(2024, 1, 15));

        verify(savingsService).recordSavingsPayment(member.getId(), new BigDecimal("1000.00"),
            SavingsTransactionType.INITIAL_DEPOSIT, LocalDate.of(2024, 1, 15));
        verify(outboxService).saveEvent(eq(AggregateType.MEMBER), eq(member.getId()), eq(MemberRegisteredEvent.EVENT_TYPE),
            any(MemberRegisteredEvent.class));
    }

    @Test
    @DisplayName("A taken member number is a conflict")
    void testDuplicateMemberNumber() {
        when(memberRepository.existsByMemberNumber("M-200")).thenReturn(true);

        assertThatThrownBy(() -> memberService.registerMember("M-200", "Someone Else", LocalDate.of(2024, 1, 15)))
            .isInstanceOf(ConflictException.class);

        verify(memberRepository, never()).saveAndFlush(any());
        verifyNoInteractions(savingsService, outboxService);
    }

    @Test
    @DisplayName("Blank number or name is rejected")
    void testBlankFields() {
        assertThatThrownBy(() -> memberService.registerMember(" ", "Name", LocalDate.of(2024, 1, 15)))
            .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> memberService.registerMember("M-1", null, LocalDate.of(2024, 1, 15)))
            .isInstanceOf(ValidationException.class);
        verifyNoInteractions(memberRepository);
    }

    @Test
    @DisplayName("Summary flags an active loan past its due date")
    void testSummaryOverdue() {
        UUID memberId = UUID.randomUUID();
        MemberEntity entity = MemberEntity.register(memberId, "M-300", "Lindiwe Dube", LocalDate.of(2024, 1, 2));
        LoanPolicy policy = LoanPolicy.standard();
        Loan loan = Loan.issue(UUID.randomUUID(), memberId, Money.of("1000.00"), policy,
            policy.dueDateCalculator(), LocalDate.of(2024, 3, 10));
        when(memberRepository.findById(memberId)).thenReturn(Optional.of(entity));
        when(loanPersistenceService.findActiveLoan(memberId)).thenReturn(Optional.of(loan));

        MemberSummary summary = memberService.summarize(memberId, LocalDate.of(2024, 4, 15));

        assertThat(summary.getActiveLoan()).contains(loan);
        assertThat(summary.isOverdue()).isTrue();
        assertThat(summary.getDaysOverdue()).isEqualTo(10);
    }

    @Test
    @DisplayName("Summary without an active loan is never overdue")
    void testSummaryNoLoan() {
        UUID memberId = UUID.randomUUID();
        when(memberRepository.findById(memberId)).thenReturn(Optional.of(
            MemberEntity.register(memberId, "M-301", "Ayanda Zulu", LocalDate.of(2024, 1, 2))));
        when(loanPersistenceService.findActiveLoan(memberId)).thenReturn(Optional.empty());

        MemberSummary summary = memberService.summarize(memberId, LocalDate.of(2024, 4, 15));

        assertThat(summary.getActiveLoan()).isEmpty();
        assertThat(summary.isOverdue()).isFalse();
        assertThat(summary.getDaysOverdue()).isZero();
    }

    @Test
    @DisplayName("Unknown member fails with NotFound")
    void testUnknownMember() {
        UUID memberId = UUID.randomUUID();
        when(memberRepository.findById(memberId)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> memberService.getMember(memberId)).isInstanceOf(NotFoundException.class);
    }
}
