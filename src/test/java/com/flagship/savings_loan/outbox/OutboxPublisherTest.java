package com.flagship.savings_loan.outbox;

import com.flagship.savings_loan.observability.OutboxMetrics;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OutboxPublisherTest {

    @Mock
    private OutboxService outboxService;
    @Mock
    private KafkaTemplate<String, String> kafkaTemplate;
    @Mock
    private OutboxMetrics outboxMetrics;

    private OutboxPublisher publisher;

    @BeforeEach
    void setUp() {
        publisher = new OutboxPublisher(outboxService, kafkaTemplate, outboxMetrics);
        ReflectionTestUtils.setField(publisher, "loansTopic", "loan-events");
        ReflectionTestUtils.setField(publisher, "membersTopic", "member-events");
        ReflectionTestUtils.setField(publisher, "batchSize", 100);
        ReflectionTestUtils.setField(publisher, "maxRetries", 5);
    }

    private static OutboxEvent event(AggregateType aggregateType, String eventType, int retryCount) {
        return new OutboxEvent(UUID.randomUUID(), aggregateType, UUID.randomUUID(), eventType,
            "{\"x\":1}", Instant.now(), null, retryCount, null, 1L);
    }

    private static CompletableFuture<SendResult<String, String>> sent(String topic, OutboxEvent event) {
        ProducerRecord<String, String> record =
            new ProducerRecord<>(topic, event.getAggregateId().toString(), event.getPayload());
        RecordMetadata metadata = new RecordMetadata(new TopicPartition(topic, 0), 0L, 0, 0L, 0, 0);
        return CompletableFuture.completedFuture(new SendResult<>(record, metadata));
    }

    @Test
    @DisplayName("Loan events go to the loans topic keyed by loan id and are marked published")
    void testPublishLoanEvent() {
        OutboxEvent event = event(AggregateType.LOAN, "LoanIssued", 0);
        when(outboxService.findUnpublishedEvents(100)).thenReturn(List.of(event));
        when(kafkaTemplate.send("loan-events", event.getAggregateId().toString(), event.getPayload()))
            .thenReturn(sent("loan-events", event));

        publisher.publishPendingEvents();

        verify(outboxService).markPublished(event.getId());
        verify(outboxMetrics).recordPublished(event);
    }

    @Test
    @DisplayName("Member events go to the members topic")
    void testPublishMemberEvent() {
        OutboxEvent event = event(AggregateType.MEMBER, "SavingsPaymentRecorded", 0);
        when(kafkaTemplate.send("member-events", event.getAggregateId().toString(), event.getPayload()))
            .thenReturn(sent("member-events", event));

        publisher.publishEvent(event);

        verify(outboxService).markPublished(event.getId());
    }

    @Test
    @DisplayName("A failed send increments the retry count instead of marking the event published")
    void testPublishFailure() {
        OutboxEvent event = event(AggregateType.LOAN, "LoanRepaymentRecorded", 1);
        when(kafkaTemplate.send(anyString(), anyString(), anyString()))
            .thenReturn(CompletableFuture.failedFuture(new RuntimeException("broker down")));

        publisher.publishEvent(event);

        verify(outboxService).markFailed(eq(event.getId()), any());
        verify(outboxService, never()).markPublished(any());
        verify(outboxMetrics).recordPublishFailed(event);
    }

    @Test
    @DisplayName("Events past the retry limit are left for manual handling")
    void testMaxRetriesExceeded() {
        OutboxEvent event = event(AggregateType.LOAN, "OverdueInterestApplied", 5);

        publisher.publishEvent(event);

        verify(kafkaTemplate, never()).send(anyString(), anyString(), anyString());
        verify(outboxMetrics).recordDeadLettered(event);
    }
}
