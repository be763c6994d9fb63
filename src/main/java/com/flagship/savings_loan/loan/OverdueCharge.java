package com.flagship.savings_loan.loan;

import com.flagship.savings_loan.money.Money;
import lombok.Value;

/**
 * Interest charged for one overdue period, with the balance it produced.
 */
@Value
public class OverdueCharge {
    int periodIndex;
    Money chargeAmount;
    Money newBalance;
}
