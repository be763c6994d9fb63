package com.flagship.savings_loan.loan.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;

@Value
@Builder
@Jacksonized
public class ApplyOverdueRequest {

    @JsonProperty("as_of")
    LocalDate asOf;
}
