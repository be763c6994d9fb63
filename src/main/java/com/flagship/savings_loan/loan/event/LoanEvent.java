package com.flagship.savings_loan.loan.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Common shape of events about a loan.
 */
public interface LoanEvent {

    /**
     * Unique per event instance; consumers deduplicate on it.
     */
    UUID getEventId();

    UUID getLoanId();

    UUID getMemberId();

    Instant getOccurredAt();

    String getEventType();
}
