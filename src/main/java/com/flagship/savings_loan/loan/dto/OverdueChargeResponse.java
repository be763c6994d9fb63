package com.flagship.savings_loan.loan.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.savings_loan.loan.OverdueCharge;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

@Value
public class OverdueChargeResponse {

    @JsonProperty("period")
    int period;

    @JsonProperty("charge_amount")
    BigDecimal chargeAmount;

    @JsonProperty("new_balance")
    BigDecimal newBalance;

    public static OverdueChargeResponse from(OverdueCharge charge) {
        return new OverdueChargeResponse(
            charge.getPeriodIndex(),
            charge.getChargeAmount().getAmount(),
            charge.getNewBalance().getAmount()
        );
    }

    public static List<OverdueChargeResponse> fromAll(List<OverdueCharge> charges) {
        return charges.stream().map(OverdueChargeResponse::from).toList();
    }
}
