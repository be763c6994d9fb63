package com.flagship.savings_loan.savings.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.savings_loan.ledger.SavingsTransaction;
import com.flagship.savings_loan.ledger.SavingsTransactionType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class SavingsTransactionResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("member_id")
    UUID memberId;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("transaction_type")
    SavingsTransactionType transactionType;

    @JsonProperty("description")
    String description;

    @JsonProperty("transaction_date")
    LocalDate transactionDate;

    @JsonProperty("recorded_at")
    Instant recordedAt;

    @JsonProperty("sequence_number")
    Long sequenceNumber;

    public static SavingsTransactionResponse from(SavingsTransaction tx) {
        return SavingsTransactionResponse.builder()
            .id(tx.getId())
            .memberId(tx.getMemberId())
            .amount(tx.getAmount().getAmount())
            .transactionType(tx.getType())
            .description(tx.getDescription())
            .transactionDate(tx.getTransactionDate())
            .recordedAt(tx.getRecordedAt())
            .sequenceNumber(tx.getSequenceNumber())
            .build();
    }
}
