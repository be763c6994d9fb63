package com.flagship.savings_loan.outbox;

/**
 * Aggregates that emit outbox events. Each maps to its own Kafka topic.
 */
public enum AggregateType {
    /** Issuance, overdue interest and repayment events, keyed by loan id. */
    LOAN,
    /** Registration and savings events, keyed by member id. */
    MEMBER;

    /**
     * Lower-case form used as a metric tag.
     */
    public String tag() {
        return name().toLowerCase();
    }
}
