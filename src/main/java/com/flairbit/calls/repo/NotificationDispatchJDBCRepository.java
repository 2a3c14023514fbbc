package com.flairbit.calls.repo;

import com.flairbit.calls.models.DispatchStatus;
import com.flairbit.calls.models.NotificationDispatch;
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

@Repository
@RequiredArgsConstructor
public class NotificationDispatchJDBCRepository {

    private final JdbcTemplate jdbc;

    private static final String COLUMNS = """
        id, escalation_event_id, channel, recipient_role, payload, status, attempts, next_attempt_at,
        last_error, created_at, sent_at
        """;

    private static final String SQL_INSERT = """
        INSERT INTO notification_dispatches
        (id, escalation_event_id, channel, recipient_role, payload, status, attempts, next_attempt_at, created_at)
        VALUES (?, ?, ?, ?, ?, 'pending', 0, ?, ?)
        """;

    private static final String SQL_SELECT_DUE = "SELECT " + COLUMNS + """
         FROM notification_dispatches
        WHERE status = 'pending' AND next_attempt_at <= ?
        ORDER BY next_attempt_at
        LIMIT ?
        FOR UPDATE SKIP LOCKED
        """;

    private static final String SQL_CLAIM = """
        UPDATE notification_dispatches SET next_attempt_at = ? WHERE id = ?
        """;

    private static final String SQL_MARK_SENT = """
        UPDATE notification_dispatches SET status = 'sent', attempts = ?, sent_at = ?, last_error = NULL WHERE id = ?
        """;

    private static final String SQL_MARK_RETRY = """
        UPDATE notification_dispatches SET attempts = ?, next_attempt_at = ?, last_error = ? WHERE id = ?
        """;

    private static final String SQL_MARK_FAILED = """
        UPDATE notification_dispatches SET status = 'failed', attempts = ?, last_error = ? WHERE id = ?
        """;

    private static final String SQL_FIND_BY_EVENT = "SELECT " + COLUMNS + """
         FROM notification_dispatches
        WHERE escalation_event_id = ?
        ORDER BY channel
        """;

    public void saveAll(List<NotificationDispatch> dispatches) {
        if (dispatches == null || dispatches.isEmpty()) return;

        jdbc.batchUpdate(SQL_INSERT, dispatches, 100, (ps, d) -> {
            ps.setObject(1, d.getId());
            ps.setObject(2, d.getEscalationEventId());
            ps.setString(3, d.getChannel());
            ps.setString(4, d.getRecipientRole());
            ps.setString(5, d.getPayload());
            ps.setTimestamp(6, from(d.getNextAttemptAt()));
            ps.setTimestamp(7, from(d.getCreatedAt()));
        });
    }

    /**
     * Claims due dispatches by pushing their next_attempt_at to claimUntil inside the
     * locking transaction, so other instances skip them while they are being sent.
     */
    @Transactional
    public List<NotificationDispatch> claimDue(Instant now, int batchSize, Instant claimUntil) {
        List<NotificationDispatch> rows = jdbc.query(SQL_SELECT_DUE, new DispatchRowMapper(), from(now), batchSize);
        if (rows.isEmpty()) return Collections.emptyList();

        jdbc.batchUpdate(SQL_CLAIM, rows, 100, (ps, d) -> {
            ps.setTimestamp(1, from(claimUntil));
            ps.setObject(2, d.getId());
        });
        return rows;
    }

    public void markSent(UUID id, int attempts, Instant at) {
        jdbc.update(SQL_MARK_SENT, attempts, from(at), id);
    }

    public void markRetry(UUID id, int attempts, Instant nextAttempt, String error) {
        jdbc.update(SQL_MARK_RETRY, attempts, from(nextAttempt), truncate(error), id);
    }

    public void markFailed(UUID id, int attempts, String error) {
        jdbc.update(SQL_MARK_FAILED, attempts, truncate(error), id);
    }

    public List<NotificationDispatch> findByEvent(UUID escalationEventId) {
        return jdbc.query(SQL_FIND_BY_EVENT, new DispatchRowMapper(), escalationEventId);
    }

    private static String truncate(String error) {
        if (error == null) return null;
        return error.length() > 512 ? error.substring(0, 512) : error;
    }

    private static class DispatchRowMapper implements RowMapper<NotificationDispatch> {
        @Override
        public NotificationDispatch mapRow(ResultSet rs, int rowNum) throws SQLException {
            return NotificationDispatch.builder()
                    .id(uuid(rs, "id"))
                    .escalationEventId(uuid(rs, "escalation_event_id"))
                    .channel(rs.getString("channel"))
                    .recipientRole(rs.getString("recipient_role"))
                    .payload(rs.getString("payload"))
                    .status(DispatchStatus.fromValue(rs.getString("status")))
                    .attempts(rs.getInt("attempts"))
                    .nextAttemptAt(instant(rs, "next_attempt_at"))
                    .lastError(rs.getString("last_error"))
                    .createdAt(instant(rs, "created_at"))
                    .sentAt(instant(rs, "sent_at"))
                    .build();
        }
    }
}
