package com.forum.application.port.out;

import com.forum.domain.event.DomainEvent;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Transactional outbox. Events are saved in the same transaction as the state change they describe
 * and published to the broker later by the poller.
 */
public interface OutboxRepository {
    void save(DomainEvent event, String requestId);
    List<OutboxEntry> findUnprocessedWithLock(int limit);
    void markAsProcessed(List<UUID> ids);
    /**
     * @return the number of deleted rows
     */
    int deleteProcessedOlderThan(Instant threshold);
    long countUnprocessed();

    record OutboxEntry(
        UUID id,
        String eventType,
        String aggregateId,
        String payload,
        String requestId
    ) {}
}
