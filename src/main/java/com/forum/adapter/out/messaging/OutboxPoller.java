package com.forum.adapter.out.messaging;

import com.forum.application.port.out.MetricsPort;
import com.forum.application.port.out.OutboxRepository;
import com.forum.application.port.out.OutboxRepository.OutboxEntry;
import com.forum.infrastructure.config.AppProperties;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.header.Headers;
import org.apache.kafka.common.header.internals.RecordHeader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Relays discussion events (started, comment posted, removed) from the outbox table to Kafka.
 * Records are keyed by discussion id so that all events of one discussion land on the same partition in order.
 */
@Component
public class OutboxPoller {

    private static final Logger log = LoggerFactory.getLogger(OutboxPoller.class);

    static final String EVENT_TYPE_HEADER = "eventType";
    static final String EVENT_ID_HEADER = "eventId";
    static final String REQUEST_ID_HEADER = "requestId";

    private final OutboxRepository outboxRepository;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final AppProperties appProperties;
    private final MetricsPort metrics;

    public OutboxPoller(
            OutboxRepository outboxRepository,
            KafkaTemplate<String, String> kafkaTemplate,
            AppProperties appProperties,
            MetricsPort metrics) {
        this.outboxRepository = outboxRepository;
        this.kafkaTemplate = kafkaTemplate;
        this.appProperties = appProperties;
        this.metrics = metrics;
    }

    @Scheduled(fixedDelayString = "${app.outbox.poll-interval-ms:1000}")
    @Transactional
    public void pollAndPublish() {
        List<OutboxEntry> batch = outboxRepository.findUnprocessedWithLock(appProperties.getOutbox().getBatchSize());
        if (batch.isEmpty()) {
            return;
        }

        String topic = appProperties.getKafka().getTopic();
        List<CompletableFuture<SendResult<String, String>>> sends = batch.stream()
            .map(entry -> kafkaTemplate.send(toRecord(topic, entry)))
            .toList();
        awaitAcknowledged(sends, batch.size());

        List<UUID> processed = batch.stream().map(OutboxEntry::id).toList();
        outboxRepository.markAsProcessed(processed);
        metrics.incrementOutboxEventsPublished(batch.size());

        Map<String, Long> byType = batch.stream()
            .collect(Collectors.groupingBy(OutboxEntry::eventType, TreeMap::new, Collectors.counting()));
        log.info("Relayed {} discussion events to {}: {}", batch.size(), topic, byType);
    }

    /**
     * Blocks until the broker acknowledged every record of the batch. Any failure propagates, rolling back the
     * poll so the batch stays unprocessed and is relayed again.
     */
    private void awaitAcknowledged(List<CompletableFuture<SendResult<String, String>>> sends, int batchSize) {
        long timeoutMs = appProperties.getOutbox().getSendTimeoutMs();
        try {
            CompletableFuture.allOf(sends.toArray(new CompletableFuture<?>[0])).get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            log.error("Kafka rejected part of a batch of {} outbox events, leaving it for the next poll", batchSize, e.getCause());
            throw new IllegalStateException("Outbox relay failed", e.getCause());
        } catch (TimeoutException e) {
            log.error("Kafka did not acknowledge {} outbox events within {} ms", batchSize, timeoutMs);
            throw new IllegalStateException("Outbox relay timed out after " + timeoutMs + " ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while relaying outbox events", e);
        }
    }

    private static ProducerRecord<String, String> toRecord(String topic, OutboxEntry entry) {
        ProducerRecord<String, String> record = new ProducerRecord<>(topic, entry.aggregateId(), entry.payload());
        Headers headers = record.headers();
        headers.add(header(EVENT_TYPE_HEADER, entry.eventType()));
        headers.add(header(EVENT_ID_HEADER, entry.id().toString()));
        if (entry.requestId() != null) {
            headers.add(header(REQUEST_ID_HEADER, entry.requestId()));
        }
        log.debug("Relaying {} for discussion {}", entry.eventType(), entry.aggregateId());
        return record;
    }

    private static RecordHeader header(String name, String value) {
        return new RecordHeader(name, value.getBytes(StandardCharsets.UTF_8));
    }

    @Scheduled(cron = "${app.outbox.cleanup-cron:0 0 * * * *}")
    @Transactional
    public void cleanupOldEvents() {
        Duration retention = Duration.ofHours(appProperties.getOutbox().getRetentionHours());
        int deleted = outboxRepository.deleteProcessedOlderThan(Instant.now().minus(retention));
        if (deleted > 0) {
            log.info("Deleted {} relayed outbox events older than {}", deleted, retention);
        }
    }
}
