package com.flagship.savings_loan.outbox;

import com.flagship.savings_loan.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Polls the outbox and publishes events to Kafka.
 *
 * - Aggregate id is the record key, so all events of one loan land on one partition in order
 * - Sends are synchronous; an event is marked published only after the broker acknowledged it
 * - Failed sends increment the retry count; events past max retries stay in the table for manual handling
 */
@Component
@EnableScheduling
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${kafka.topic.loans:loan-events}")
    private String loansTopic;

    @Value("${kafka.topic.members:member-events}")
    private String membersTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        try {
            List<OutboxEvent> events = outboxService.findUnpublishedEvents(batchSize);
            if (events.isEmpty()) {
                return;
            }

            log.debug("Found {} unpublished events to process", events.size());
            for (OutboxEvent event : events) {
                publishEvent(event);
            }
        } catch (Exception e) {
            log.error("Error in outbox publisher polling loop", e);
        }
    }

    void publishEvent(OutboxEvent event) {
        if (event.hasExhaustedRetries(maxRetries)) {
            log.warn("Event {} has exceeded max retries ({}), leaving it for manual handling. eventType={}, {}={}",
                event.getId(), maxRetries, event.getEventType(), event.getAggregateType().tag(), event.getAggregateId());
            outboxMetrics.recordDeadLettered(event);
            return;
        }

        String topic = topicFor(event);
        try {
            SendResult<String, String> result =
                kafkaTemplate.send(topic, event.partitionKey(), event.getPayload()).get();

            log.debug("Published event: eventId={}, topic={}, partition={}, offset={}, eventType={}",
                event.getId(),
                result.getRecordMetadata().topic(),
                result.getRecordMetadata().partition(),
                result.getRecordMetadata().offset(),
                event.getEventType());

            outboxService.markPublished(event.getId());
            outboxMetrics.recordPublished(event);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outboxService.markFailed(event.getId(), "Interrupted while publishing");
            outboxMetrics.recordPublishFailed(event);
        } catch (Exception e) {
            log.error("Failed to publish event: eventId={}, eventType={}, error={}",
                event.getId(), event.getEventType(), e.getMessage());
            outboxService.markFailed(event.getId(), e.getMessage());
            outboxMetrics.recordPublishFailed(event);
        }
    }

    String topicFor(OutboxEvent event) {
        return switch (event.getAggregateType()) {
            case LOAN -> loansTopic;
            case MEMBER -> membersTopic;
        };
    }
}
