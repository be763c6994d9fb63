package com.flagship.savings_loan.observability;

import com.flagship.savings_loan.outbox.AggregateType;
import com.flagship.savings_loan.outbox.OutboxEvent;
import com.flagship.savings_loan.outbox.OutboxEventRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Outbox gauges and publish counters, split by aggregate so a stalled loan
 * event stream is visible apart from member events.
 *
 * Gauges hold cached values; {@link LedgerMetrics#refreshGauges()} reloads them.
 */
@Component
public class OutboxMetrics {

    private final OutboxEventRepository outboxRepository;
    private final MeterRegistry registry;
    private final int maxRetries;

    private final Map<AggregateType, AtomicLong> pendingByAggregate = new EnumMap<>(AggregateType.class);
    private final AtomicLong oldestPendingAgeSeconds = new AtomicLong();
    private final AtomicLong stuckEvents = new AtomicLong();

    public OutboxMetrics(OutboxEventRepository outboxRepository,
                         MeterRegistry registry,
                         @Value("${outbox.publisher.max-retries:5}") int maxRetries) {
        this.outboxRepository = outboxRepository;
        this.registry = registry;
        this.maxRetries = maxRetries;

        for (AggregateType type : AggregateType.values()) {
            AtomicLong pending = new AtomicLong();
            pendingByAggregate.put(type, pending);
            Gauge.builder("outbox.backlog.size", pending, AtomicLong::get)
                .description("Unpublished events per aggregate")
                .tag("aggregate", type.tag())
                .register(registry);
        }

        Gauge.builder("outbox.backlog.age.seconds", oldestPendingAgeSeconds, AtomicLong::get)
            .description("Age of the oldest unpublished event in seconds")
            .register(registry);

        Gauge.builder("outbox.events.stuck", stuckEvents, AtomicLong::get)
            .description("Unpublished events that reached the retry limit")
            .register(registry);
    }

    @Transactional(readOnly = true)
    public void refresh() {
        pendingByAggregate.forEach((type, pending) ->
            pending.set(outboxRepository.countByAggregateTypeAndPublishedAtIsNull(type)));

        oldestPendingAgeSeconds.set(outboxRepository.findOldestUnpublishedCreatedAt()
            .map(oldest -> Math.max(0, Duration.between(oldest, Instant.now()).getSeconds()))
            .orElse(0L));

        stuckEvents.set(outboxRepository.countByPublishedAtIsNullAndRetryCountGreaterThanEqual(maxRetries));
    }

    public void recordPublished(OutboxEvent event) {
        count(event, "published");
    }

    public void recordPublishFailed(OutboxEvent event) {
        count(event, "failed");
    }

    public void recordDeadLettered(OutboxEvent event) {
        count(event, "dead_lettered");
    }

    private void count(OutboxEvent event, String outcome) {
        registry.counter("outbox.events",
            "aggregate", event.getAggregateType().tag(),
            "event_type", event.getEventType(),
            "outcome", outcome
        ).increment();
    }
}
