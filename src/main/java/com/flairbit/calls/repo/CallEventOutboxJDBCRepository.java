package com.flairbit.calls.repo;

import com.flairbit.calls.models.CallEventOutbox;
import com.flairbit.calls.models.LifecycleEventType;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

import static com.flairbit.calls.utils.SqlTimestamps.from;
import static com.flairbit.calls.utils.SqlTimestamps.instant;
import static com.flairbit.calls.utils.SqlTimestamps.uuid;

/**
 * Lifecycle event outbox. cursor_id is the replay cursor handed to stream consumers.
 */
@Repository
@RequiredArgsConstructor
public class CallEventOutboxJDBCRepository {

    private final JdbcTemplate jdbc;

    private static final String COLUMNS = """
        cursor_id, event_id, event_type, call_id, recording_id, payload, created_at, retry_count, next_retry_at
        """;

    private static final String SQL_INSERT = """
        INSERT INTO call_events (event_id, event_type, call_id, recording_id, payload, created_at, published, retry_count, next_retry_at)
        VALUES (?, ?, ?, ?, ?, ?, false, 0, ?)
        """;

    private static final String SQL_SELECT_PENDING = "SELECT " + COLUMNS + """
         FROM call_events
        WHERE published = false
          AND next_retry_at <= ?
        ORDER BY cursor_id
        LIMIT ?
        FOR UPDATE SKIP LOCKED
        """;

    private static final String SQL_UPDATE_NEXT_RETRY = """
        UPDATE call_events SET next_retry_at = ?, retry_count = ? WHERE cursor_id = ?
        """;

    private static final String SQL_MARK_PROCESSED = """
        UPDATE call_events SET published = true, published_at = ?, retry_count = ? WHERE cursor_id = ?
        """;

    private static final String SQL_FIND_AFTER = "SELECT " + COLUMNS + """
         FROM call_events
        WHERE cursor_id > ?
        ORDER BY cursor_id
        LIMIT ?
        """;

    private static final String SQL_FIND_BY_CALL = "SELECT " + COLUMNS + """
         FROM call_events
        WHERE call_id = ?
        ORDER BY cursor_id
        """;

    public void save(CallEventOutbox event) {
        jdbc.update(SQL_INSERT,
                event.getEventId(),
                event.getType().getValue(),
                event.getCallId(),
                event.getRecordingId(),
                event.getPayload(),
                from(event.getCreatedAt()),
                from(event.getNextRetryAt()));
    }

    /**
     * Atomically claim up to batchSize rows with SELECT ... FOR UPDATE SKIP LOCKED and move their
     * next_retry_at to claimUntil. Must run in a transaction so the row locks hold until the update.
     */
    @Transactional
    public List<CallEventOutbox> claimPendingBatch(Instant now, int batchSize, Instant claimUntil) {
        List<CallEventOutbox> rows = jdbc.query(SQL_SELECT_PENDING, new CallEventRowMapper(), from(now), batchSize);
        if (rows.isEmpty()) return Collections.emptyList();

        jdbc.batchUpdate(SQL_UPDATE_NEXT_RETRY, rows, 100, (ps, o) -> {
            ps.setTimestamp(1, from(claimUntil));
            ps.setInt(2, o.getRetryCount());
            ps.setLong(3, o.getCursor());
        });
        return rows;
    }

    public void markProcessed(long cursor, int retryCount, Instant at) {
        jdbc.update(SQL_MARK_PROCESSED, from(at), retryCount, cursor);
    }

    public void markRetry(long cursor, int retryCount, Instant nextRetry) {
        jdbc.update(SQL_UPDATE_NEXT_RETRY, from(nextRetry), retryCount, cursor);
    }

    public List<CallEventOutbox> findAfter(long cursor, int limit) {
        return jdbc.query(SQL_FIND_AFTER, new CallEventRowMapper(), cursor, limit);
    }

    public List<CallEventOutbox> findByCall(UUID callId) {
        return jdbc.query(SQL_FIND_BY_CALL, new CallEventRowMapper(), callId);
    }

    private static class CallEventRowMapper implements RowMapper<CallEventOutbox> {
        @Override
        public CallEventOutbox mapRow(ResultSet rs, int rowNum) throws SQLException {
            return CallEventOutbox.builder()
                    .cursor(rs.getLong("cursor_id"))
                    .eventId(uuid(rs, "event_id"))
                    .type(LifecycleEventType.fromValue(rs.getString("event_type")))
                    .callId(uuid(rs, "call_id"))
                    .recordingId(uuid(rs, "recording_id"))
                    .payload(rs.getString("payload"))
                    .createdAt(instant(rs, "created_at"))
                    .retryCount(rs.getInt("retry_count"))
                    .nextRetryAt(instant(rs, "next_retry_at"))
                    .build();
        }
    }
}
