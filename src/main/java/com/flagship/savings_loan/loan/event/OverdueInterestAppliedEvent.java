package com.flagship.savings_loan.loan.event;

import com.flagship.savings_loan.loan.OverdueAssessment;
import com.flagship.savings_loan.loan.OverdueCharge;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Published whenever overdue interest is compounded onto a loan, whether by a
 * repayment, an explicit assessment or the batch sweep. Carries every period's charge.
 */
@Value
public class OverdueInterestAppliedEvent implements LoanEvent {
    UUID eventId;
    UUID loanId;
    UUID memberId;
    LocalDate asOfDate;
    int periodsCharged;
    List<Charge> charges;
    BigDecimal totalCharged;
    BigDecimal newBalance;
    LocalDate nextDueDate;
    Instant occurredAt;

    public static final String EVENT_TYPE = "OverdueInterestApplied";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Value
    public static class Charge {
        int periodIndex;
        BigDecimal chargeAmount;
        BigDecimal newBalance;

        static Charge from(OverdueCharge charge) {
            return new Charge(charge.getPeriodIndex(),
                charge.getChargeAmount().getAmount(),
                charge.getNewBalance().getAmount());
        }
    }

    public static OverdueInterestAppliedEvent fromAssessment(OverdueAssessment assessment, LocalDate asOfDate) {
        var loan = assessment.getLoan();
        return new OverdueInterestAppliedEvent(
            UUID.randomUUID(),
            loan.getId(),
            loan.getMemberId(),
            asOfDate,
            assessment.getCharges().size(),
            assessment.getCharges().stream().map(Charge::from).toList(),
            assessment.getTotalCharged().getAmount(),
            loan.getCurrentBalance().getAmount(),
            loan.getNextDueDate(),
            Instant.now()
        );
    }
}
