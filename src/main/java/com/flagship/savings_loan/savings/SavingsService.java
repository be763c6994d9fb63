package com.flagship.savings_loan.savings;

import com.flagship.savings_loan.exception.NotFoundException;
import com.flagship.savings_loan.exception.ValidationException;
import com.flagship.savings_loan.ledger.LedgerService;
import com.flagship.savings_loan.ledger.SavingsTransaction;
import com.flagship.savings_loan.ledger.SavingsTransactionType;
import com.flagship.savings_loan.member.MemberEntity;
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
 * Records savings payments.
 *
 * A payment credits the member's cached balance and appends one savings ledger
 * entry in the same transaction. Savings carry no interest and no due dates.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SavingsService {

    private final MemberRepository memberRepository;
    private final LedgerService ledgerService;
    private final OutboxService outboxService;
    private final LedgerMetrics metrics;

    /**
     * @throws ValidationException if the amount is missing, not positive, finer than cents,
     *                             or would take the balance past {@link Money#MAX}
     * @throws NotFoundException   if the member does not exist
     */
    @Transactional
    public SavingsTransaction recordSavingsPayment(UUID memberId, BigDecimal amount,
                                                   SavingsTransactionType kind, LocalDate asOfDate) {
        if (amount == null || amount.signum() <= 0) {
            throw new ValidationException("Savings amount must be greater than zero");
        }
        if (kind == null) {
            throw new ValidationException("Savings payment kind is required");
        }
        if (!Money.isWholeCents(amount)) {
            throw new ValidationException("Savings amount must have at most 2 decimal places: " + amount.toPlainString());
        }
        Money payment = Money.of(amount);

        MDC.put(CorrelationContext.MEMBER_ID_MDC_KEY, memberId.toString());
        try {
            MemberEntity member = memberRepository.findByIdForUpdate(memberId)
                .orElseThrow(() -> NotFoundException.member(memberId));

            Money newBalance = Money.of(member.getSavingsBalance()).plus(payment);
            if (newBalance.exceedsMax()) {
                throw new ValidationException(String.format(
                    "Savings payment %s would take the balance to %s, above the maximum supported amount %s",
                    payment, newBalance, Money.MAX));
            }
            member.creditSavings(payment);
            memberRepository.saveAndFlush(member);

            SavingsTransaction recorded = ledgerService.appendSavingsTransaction(
                SavingsTransaction.create(memberId, payment, kind, asOfDate));

            outboxService.saveEvent(AggregateType.MEMBER, memberId, SavingsPaymentRecordedEvent.EVENT_TYPE,
                SavingsPaymentRecordedEvent.from(recorded, member.getSavingsBalance()));
            metrics.recordSavingsPayment(kind.name());

            log.info("Savings payment recorded: kind={}, amount={}, newBalance={}",
                kind, payment, member.getSavingsBalance());
            return recorded;
        } finally {
            MDC.remove(CorrelationContext.MEMBER_ID_MDC_KEY);
        }
    }

    @Transactional(readOnly = true)
    public List<SavingsTransaction> getSavingsHistory(UUID memberId) {
        if (!memberRepository.existsById(memberId)) {
            throw NotFoundException.member(memberId);
        }
        return ledgerService.getSavingsTransactions(memberId);
    }
}
