package com.flagship.savings_loan.savings.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.savings_loan.ledger.SavingsTransactionType;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Savings payment. {@code amount} defaults to the monthly subscription and
 * {@code kind} to {@code SUBSCRIPTION}.
 */
@Value
@Builder
@Jacksonized
public class SavingsPaymentRequest {

    @DecimalMin(value = "0.01", message = "Amount must be greater than 0")
    @Digits(integer = 17, fraction = 2, message = "Amount must have at most 17 integer digits and 2 decimal places")
    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("kind")
    SavingsTransactionType kind;

    @JsonProperty("as_of")
    LocalDate asOf;
}
