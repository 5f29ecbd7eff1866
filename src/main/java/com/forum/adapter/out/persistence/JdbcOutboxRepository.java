package com.forum.adapter.out.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.forum.application.port.out.OutboxRepository;
import com.forum.domain.event.DomainEvent;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Outbox rows keyed by event id. {@code aggregate_id} holds the discussion id and becomes the Kafka key.
 */
@Repository
public class JdbcOutboxRepository implements OutboxRepository {

    private static final RowMapper<OutboxEntry> ENTRY = (rs, rowNum) -> new OutboxEntry(
        rs.getObject("id", UUID.class),
        rs.getString("event_type"),
        rs.getString("aggregate_id"),
        rs.getString("payload"),
        rs.getString("request_id")
    );

    private final JdbcTemplate jdbc;
    private final ObjectMapper objectMapper;

    public JdbcOutboxRepository(JdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
    }

    @Override
    public void save(DomainEvent event, String requestId) {
        jdbc.update("""
            INSERT INTO outbox (id, event_type, aggregate_id, payload, request_id, created_at)
            VALUES (?, ?, ?, ?::jsonb, ?, ?)
            """,
            event.eventId(),
            event.eventType(),
            event.aggregateId(),
            toJson(event),
            requestId,
            Timestamp.from(event.occurredAt())
        );
    }

    private String toJson(DomainEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + event.eventType() + " for discussion " + event.aggregateId(), e);
        }
    }

    /**
     * Oldest pending events first. Rows locked by a concurrent poller are skipped rather than waited on.
     */
    @Override
    public List<OutboxEntry> findUnprocessedWithLock(int limit) {
        return jdbc.query("""
            SELECT id, event_type, aggregate_id, payload::text AS payload, request_id
            FROM outbox
            WHERE processed_at IS NULL
            ORDER BY created_at, id
            LIMIT ?
            FOR UPDATE SKIP LOCKED
            """,
            ENTRY,
            limit
        );
    }

    @Override
    public void markAsProcessed(List<UUID> ids) {
        if (ids.isEmpty()) {
            return;
        }
        jdbc.update(
            "UPDATE outbox SET processed_at = ? WHERE id = ANY(string_to_array(?, ',')::uuid[])",
            Timestamp.from(Instant.now()),
            ids.stream().map(UUID::toString).collect(Collectors.joining(","))
        );
    }

    @Override
    public int deleteProcessedOlderThan(Instant threshold) {
        return jdbc.update(
            "DELETE FROM outbox WHERE processed_at < ?",
            Timestamp.from(threshold)
        );
    }

    @Override
    public long countUnprocessed() {
        Long pending = jdbc.queryForObject("SELECT COUNT(*) FROM outbox WHERE processed_at IS NULL", Long.class);
        return pending != null ? pending : 0;
    }
}
