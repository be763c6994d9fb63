package com.flagship.savings_loan.loan.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.savings_loan.loan.LedgerReconciliation;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class ReconciliationResponse {

    @JsonProperty("loan_id")
    UUID loanId;

    @JsonProperty("cached_balance")
    BigDecimal cachedBalance;

    @JsonProperty("ledger_balance")
    BigDecimal ledgerBalance;

    @JsonProperty("entry_count")
    int entryCount;

    @JsonProperty("balanced")
    boolean balanced;

    public static ReconciliationResponse from(LedgerReconciliation reconciliation) {
        return new ReconciliationResponse(
            reconciliation.getLoanId(),
            reconciliation.getCachedBalance().getAmount(),
            reconciliation.getLedgerBalance().getAmount(),
            reconciliation.getEntryCount(),
            reconciliation.isBalanced()
        );
    }
}
