package com.flagship.savings_loan.loan.event;

import com.flagship.savings_loan.loan.RepaymentOutcome;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Published for every accepted repayment. {@code closed} is true when the payment
 * settled the loan.
 */
@Value
public class LoanRepaymentRecordedEvent implements LoanEvent {
    UUID eventId;
    UUID loanId;
    UUID memberId;
    BigDecimal amount;
    BigDecimal remainingBalance;
    boolean closed;
    LocalDate paymentDate;
    LocalDate nextDueDate;
    Instant occurredAt;

    public static final String EVENT_TYPE = "LoanRepaymentRecorded";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static LoanRepaymentRecordedEvent fromOutcome(RepaymentOutcome outcome, LocalDate paymentDate) {
        var loan = outcome.getLoan();
        return new LoanRepaymentRecordedEvent(
            UUID.randomUUID(),
            loan.getId(),
            loan.getMemberId(),
            outcome.getPaymentAmount().getAmount(),
            loan.getCurrentBalance().getAmount(),
            outcome.isLoanClosed(),
            paymentDate,
            loan.getNextDueDate(),
            Instant.now()
        );
    }
}
