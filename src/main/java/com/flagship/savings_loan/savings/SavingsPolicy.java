package com.flagship.savings_loan.savings;

import com.flagship.savings_loan.money.Money;
import lombok.Value;

/**
 * Fixed savings amounts of the scheme.
 */
@Value
public class SavingsPolicy {
    Money initialDeposit;
    Money monthlySubscription;

    public static SavingsPolicy standard() {
        return new SavingsPolicy(Money.of("1000.00"), Money.of("500.00"));
    }
}
