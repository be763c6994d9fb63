package com.flagship.savings_loan.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Writes loan and member events to the outbox inside the business transaction.
 *
 * If the loan or savings change commits, its event is stored with it; if it
 * rolls back, so does the event. Publishing is left to {@link OutboxPublisher}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService {

    private final OutboxEventRepository repository;
    private final ObjectMapper objectMapper;

    /**
     * Saves an event within the caller's transaction.
     *
     * @param aggregateId id of the loan or member
     * @param eventType   event name, e.g. "LoanIssued"
     * @param payload     event object, serialized to JSON
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent saveEvent(AggregateType aggregateType, UUID aggregateId,
                                 String eventType, Object payload) {
        OutboxEvent event = OutboxEvent.pending(aggregateType, aggregateId, eventType, toJson(payload));
        OutboxEventEntity saved = repository.save(OutboxEventEntity.pending(event));

        log.debug("Queued {} event {} for {} {}", eventType, saved.getId(), aggregateType.tag(), aggregateId);
        return saved.toDomain();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<OutboxEvent> findUnpublishedEvents(int limit) {
        return repository.findUnpublishedEventsForUpdate(limit)
            .stream()
            .map(OutboxEventEntity::toDomain)
            .toList();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markPublished(UUID eventId) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markPublished(Instant.now());
            log.debug("Marked event {} as published", eventId);
        });
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markFailed(UUID eventId, String errorMessage) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.recordFailure(errorMessage);
            log.warn("Publishing {} event {} failed (attempt {}): {}",
                entity.getEventType(), eventId, entity.getRetryCount(), errorMessage);
        });
    }

    /**
     * Events of one loan or member in the order they were written.
     */
    @Transactional(readOnly = true)
    public List<OutboxEvent> getEventsForAggregate(AggregateType aggregateType, UUID aggregateId) {
        return repository.findByAggregateTypeAndAggregateIdOrderBySequenceNumberAsc(aggregateType, aggregateId)
            .stream()
            .map(OutboxEventEntity::toDomain)
            .toList();
    }

    private String toJson(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize event payload", e);
        }
    }
}
