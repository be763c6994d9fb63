package com.flagship.savings_loan.loan;

import com.flagship.savings_loan.money.Money;
import lombok.Value;

import java.util.UUID;

/**
 * Cached loan balance next to the balance its ledger replays to.
 */
@Value
public class LedgerReconciliation {
    UUID loanId;
    Money cachedBalance;
    Money ledgerBalance;
    int entryCount;

    public boolean isBalanced() {
        return cachedBalance.compareTo(ledgerBalance) == 0;
    }
}
