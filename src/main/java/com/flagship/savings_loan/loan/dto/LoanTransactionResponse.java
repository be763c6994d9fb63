package com.flagship.savings_loan.loan.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.savings_loan.ledger.LoanTransaction;
import com.flagship.savings_loan.ledger.LoanTransactionType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class LoanTransactionResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("loan_id")
    UUID loanId;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("transaction_type")
    LoanTransactionType transactionType;

    @JsonProperty("description")
    String description;

    @JsonProperty("transaction_date")
    LocalDate transactionDate;

    @JsonProperty("recorded_at")
    Instant recordedAt;

    @JsonProperty("sequence_number")
    Long sequenceNumber;

    public static LoanTransactionResponse from(LoanTransaction tx) {
        return LoanTransactionResponse.builder()
            .id(tx.getId())
            .loanId(tx.getLoanId())
            .amount(tx.getAmount().getAmount())
            .transactionType(tx.getType())
            .description(tx.getDescription())
            .transactionDate(tx.getTransactionDate())
            .recordedAt(tx.getRecordedAt())
            .sequenceNumber(tx.getSequenceNumber())
            .build();
    }
}
