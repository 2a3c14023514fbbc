package com.flairbit.calls.repo;

import com.flairbit.calls.models.SignalKind;
import com.flairbit.calls.models.SignalingMessage;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static com.flairbit.calls.utils.SqlTimestamps.from;
import static com.flairbit.calls.utils.SqlTimestamps.instant;
import static com.flairbit.calls.utils.SqlTimestamps.uuid;

/**
 * Append-only signaling store. Rows are never updated except for the consumed flag.
 */
@Repository
@RequiredArgsConstructor
public class SignalingMessageJDBCRepository {

    private final JdbcTemplate jdbc;

    private static final String SQL_INSERT = """
        INSERT INTO signaling_messages (id, call_id, sender_id, recipient_id, kind, payload, created_at, consumed)
        VALUES (?, ?, ?, ?, ?, ?, ?, false)
        """;

    private static final String SQL_FIND_PENDING = """
        SELECT id, call_id, sender_id, recipient_id, kind, payload, created_at, consumed
        FROM signaling_messages
        WHERE call_id = ? AND recipient_id = ? AND consumed = false
        ORDER BY created_at, id
        """;

    private static final String SQL_FIND_BY_CALL = """
        SELECT id, call_id, sender_id, recipient_id, kind, payload, created_at, consumed
        FROM signaling_messages
        WHERE call_id = ?
        ORDER BY created_at, id
        """;

    private static final String SQL_MARK_CONSUMED = """
        UPDATE signaling_messages SET consumed = true, consumed_at = ?
        WHERE id = ? AND consumed = false
        """;

    private static final String SQL_COUNT_KIND_FROM = """
        SELECT COUNT(*) FROM signaling_messages WHERE call_id = ? AND kind = ?
        """;

    private static final String SQL_DELETE_FOR_ENDED_CALLS = """
        DELETE FROM signaling_messages
        WHERE call_id IN (
            SELECT id FROM call_sessions
            WHERE status IN ('ended', 'missed', 'failed') AND ended_at < ?
        )
        """;

    public SignalingMessage insert(SignalingMessage message) {
        jdbc.update(SQL_INSERT,
                message.getId(),
                message.getCallId(),
                message.getSenderId(),
                message.getRecipientId(),
                message.getKind().getValue(),
                message.getPayload(),
                from(message.getCreatedAt()));
        return message;
    }

    public List<SignalingMessage> findPending(UUID callId, UUID recipientId) {
        return jdbc.query(SQL_FIND_PENDING, new SignalingMessageRowMapper(), callId, recipientId);
    }

    public List<SignalingMessage> findByCall(UUID callId) {
        return jdbc.query(SQL_FIND_BY_CALL, new SignalingMessageRowMapper(), callId);
    }

    public void markConsumed(List<SignalingMessage> messages, Instant at) {
        if (messages.isEmpty()) return;
        jdbc.batchUpdate(SQL_MARK_CONSUMED, messages, 100, (ps, m) -> {
            ps.setTimestamp(1, from(at));
            ps.setObject(2, m.getId());
        });
    }

    public int countByKind(UUID callId, SignalKind kind) {
        Integer count = jdbc.queryForObject(SQL_COUNT_KIND_FROM, Integer.class, callId, kind.getValue());
        return count == null ? 0 : count;
    }

    public int deleteForCallsEndedBefore(Instant cutoff) {
        return jdbc.update(SQL_DELETE_FOR_ENDED_CALLS, from(cutoff));
    }

    private static class SignalingMessageRowMapper implements RowMapper<SignalingMessage> {
        @Override
        public SignalingMessage mapRow(ResultSet rs, int rowNum) throws SQLException {
            return SignalingMessage.builder()
                    .id(uuid(rs, "id"))
                    .callId(uuid(rs, "call_id"))
                    .senderId(uuid(rs, "sender_id"))
                    .recipientId(uuid(rs, "recipient_id"))
                    .kind(SignalKind.fromValue(rs.getString("kind")))
                    .payload(rs.getString("payload"))
                    .createdAt(instant(rs, "created_at"))
                    .consumed(rs.getBoolean("consumed"))
                    .build();
        }
    }
}
