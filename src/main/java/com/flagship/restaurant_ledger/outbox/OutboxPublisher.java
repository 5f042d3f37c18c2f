package com.flagship.restaurant_ledger.outbox;

import com.flagship.restaurant_ledger.observability.CorrelationContext;
import com.flagship.restaurant_ledger.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Relays outbox rows to the back-office Kafka topic.
 *
 * Records are keyed by aggregate id so every change to one invoice or
 * movement lands on the same partition in order. The originating request's
 * correlation id travels as a record header. A failed send bumps the row's
 * retry count; rows at {@code outbox.publisher.max-retries} are no longer
 * claimed and stay in the table as dead letters. A claimed batch is leased
 * for {@code outbox.publisher.claim-lease-seconds}, so publishers running on
 * several instances never send the same row twice while it is in flight.
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${kafka.topic.backoffice:backoffice-events}")
    private String backofficeTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Value("${outbox.publisher.send-timeout-ms:10000}")
    private long sendTimeoutMs;

    @Value("${outbox.publisher.claim-lease-seconds:300}")
    private long claimLeaseSeconds;

    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        List<OutboxEvent> batch;
        try {
            batch = outboxService.claimBatch(batchSize, maxRetries, Duration.ofSeconds(claimLeaseSeconds));
        } catch (RuntimeException e) {
            log.error("Could not claim outbox batch", e);
            return;
        }

        int relayed = 0;
        for (OutboxEvent event : batch) {
            if (relay(event)) {
                relayed++;
            }
        }
        if (!batch.isEmpty()) {
            log.info("Outbox relay: {}/{} events sent to {}", relayed, batch.size(), backofficeTopic);
        }
    }

    private boolean relay(OutboxEvent event) {
        String failure;
        try {
            RecordMetadata metadata = kafkaTemplate.send(toRecord(event))
                    .get(sendTimeoutMs, TimeUnit.MILLISECONDS)
                    .getRecordMetadata();
            outboxService.markPublished(event.getId());
            outboxMetrics.recordRelayed(event.getEventType());
            log.debug("Relayed {} {} to partition {} offset {}",
                    event.getEventType(), event.getId(), metadata.partition(), metadata.offset());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failure = "interrupted";
        } catch (ExecutionException e) {
            failure = e.getCause() != null ? e.getCause().getMessage() : e.getMessage();
        } catch (TimeoutException e) {
            failure = "no broker ack within " + sendTimeoutMs + "ms";
        } catch (RuntimeException e) {
            failure = e.getMessage();
        }

        outboxService.markFailed(event.getId(), failure);
        outboxMetrics.recordRelayFailed(event.getEventType());
        if (event.getRetryCount() + 1 >= maxRetries) {
            log.error("Event {} ({}) is now a dead letter after {} attempts: {}",
                    event.getId(), event.getEventType(), maxRetries, failure);
        } else {
            log.warn("Relay of event {} ({}) failed, attempt {}: {}",
                    event.getId(), event.getEventType(), event.getRetryCount() + 1, failure);
        }
        return false;
    }

    private ProducerRecord<String, String> toRecord(OutboxEvent event) {
        ProducerRecord<String, String> record =
                new ProducerRecord<>(backofficeTopic, event.getAggregateId(), event.getPayload());
        record.headers().add("event_type", event.getEventType().getBytes(StandardCharsets.UTF_8));
        if (event.getCorrelationId() != null) {
            record.headers().add(CorrelationContext.CORRELATION_ID_HEADER,
                    event.getCorrelationId().getBytes(StandardCharsets.UTF_8));
        }
        return record;
    }
}
