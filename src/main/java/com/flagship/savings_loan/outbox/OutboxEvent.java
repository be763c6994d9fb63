package com.flagship.savings_loan.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Domain event waiting in the outbox to be published to Kafka.
 *
 * Written in the same database transaction as the loan or savings change it
 * describes, published later by {@link OutboxPublisher}.
 */
@Value
public class OutboxEvent {
    UUID id;
    AggregateType aggregateType;
    UUID aggregateId;
    String eventType;
    String payload;
    Instant createdAt;
    Instant publishedAt;
    int retryCount;
    String lastError;
    Long sequenceNumber;

    static OutboxEvent pending(AggregateType aggregateType, UUID aggregateId,
                               String eventType, String payload) {
        return new OutboxEvent(UUID.randomUUID(), aggregateType, aggregateId, eventType, payload,
            Instant.now(), null, 0, null, null);
    }

    /**
     * Record key; every event of one loan or member lands on the same partition.
     */
    public String partitionKey() {
        return aggregateId.toString();
    }

    public boolean hasExhaustedRetries(int maxRetries) {
        return retryCount >= maxRetries;
    }
}
