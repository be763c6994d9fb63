package com.flagship.savings_loan.member.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;

/**
 * Request to register a member. {@code as_of} is the joining date and defaults to today.
 */
@Value
@Builder
@Jacksonized
public class RegisterMemberRequest {

    @NotBlank(message = "Member number is required")
    @Size(max = 50, message = "Member number must be at most 50 characters")
    @JsonProperty("member_number")
    String memberNumber;

    @NotBlank(message = "Full name is required")
    @Size(max = 200, message = "Full name must be at most 200 characters")
    @JsonProperty("full_name")
    String fullName;

    @JsonProperty("as_of")
    LocalDate asOf;
}
