package com.flagship.savings_loan.loan.event;

import com.flagship.savings_loan.loan.Loan;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
public class LoanIssuedEvent implements LoanEvent {
    UUID eventId;
    UUID loanId;
    UUID memberId;
    BigDecimal principalAmount;
    BigDecimal interestAmount;
    BigDecimal totalAmount;
    LocalDate issueDate;
    LocalDate nextDueDate;
    Instant occurredAt;

    public static final String EVENT_TYPE = "LoanIssued";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static LoanIssuedEvent fromLoan(Loan loan) {
        return new LoanIssuedEvent(
            UUID.randomUUID(),
            loan.getId(),
            loan.getMemberId(),
            loan.getPrincipal().getAmount(),
            loan.getInterestAmount().getAmount(),
            loan.getTotalAmount().getAmount(),
            loan.getIssueDate(),
            loan.getNextDueDate(),
            Instant.now()
        );
    }
}
