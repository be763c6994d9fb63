package com.flagship.savings_loan.loan.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Request to issue a loan. {@code as_of} defaults to today.
 */
@Value
@Builder
@Jacksonized
public class IssueLoanRequest {

    @NotNull(message = "Principal amount is required")
    @DecimalMin(value = "0.01", message = "Principal amount must be greater than 0")
    @Digits(integer = 17, fraction = 2, message = "Principal amount must have at most 17 integer digits and 2 decimal places")
    @JsonProperty("principal_amount")
    BigDecimal principalAmount;

    @JsonProperty("as_of")
    LocalDate asOf;
}
