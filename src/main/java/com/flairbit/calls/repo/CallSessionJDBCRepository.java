package com.flairbit.calls.repo;

import com.flairbit.calls.models.CallSession;
import com.flairbit.calls.models.CallStatus;
import com.flairbit.calls.models.CallType;
import com.flairbit.calls.models.MediaFormat;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static com.flairbit.calls.utils.SqlTimestamps.from;
import static com.flairbit.calls.utils.SqlTimestamps.instant;
import static com.flairbit.calls.utils.SqlTimestamps.uuid;

@Slf4j
@Repository
@RequiredArgsConstructor
public class CallSessionJDBCRepository {

    private final JdbcTemplate jdbc;

    private static final String COLUMNS = """
        id, initiator_id, counterpart_id, escalated_to_id, status, escalation_level, call_type, call_mode,
        call_context, created_at, ringing_at, answered_at, ended_at, end_reason, last_signal_at,
        initiator_last_seen_at, counterpart_last_seen_at, flagged_at, flagged_by, flag_reason
        """;

    private static final String SQL_INSERT = """
        INSERT INTO call_sessions
        (id, initiator_id, counterpart_id, status, escalation_level, call_type, call_mode, call_context,
         created_at, last_signal_at, initiator_last_seen_at, active_initiator_id)
        VALUES (?, ?, ?, ?, 0, ?, ?, ?, ?, ?, ?, ?)
        """;

    private static final String SQL_FIND_BY_ID = "SELECT " + COLUMNS + " FROM call_sessions WHERE id = ?";

    private static final String SQL_EXISTS_ACTIVE_FOR_USER = """
        SELECT COUNT(*) FROM call_sessions
        WHERE (initiator_id = ? OR counterpart_id = ?)
          AND status IN ('initiated', 'ringing', 'connected')
        """;

    private static final String SQL_FIND_ACTIVE = "SELECT " + COLUMNS + """
         FROM call_sessions
        WHERE status IN ('initiated', 'ringing', 'connected')
        ORDER BY created_at
        """;

    private static final String SQL_FIND_BY_PARTICIPANT = "SELECT " + COLUMNS + """
         FROM call_sessions
        WHERE initiator_id = ? OR counterpart_id = ?
        ORDER BY created_at DESC
        LIMIT ?
        """;

    private static final String SQL_FIND_IDLE = "SELECT " + COLUMNS + """
         FROM call_sessions
        WHERE status IN ('initiated', 'ringing', 'connected')
          AND COALESCE(last_signal_at, created_at) < ?
        """;

    private static final String SQL_FIND_RINGING_SINCE = "SELECT " + COLUMNS + """
         FROM call_sessions
        WHERE status = 'ringing'
          AND ringing_at < ?
        """;

    private static final String SQL_MARK_RINGING = """
        UPDATE call_sessions SET status = 'ringing', ringing_at = ?
        WHERE id = ? AND status = 'initiated'
        """;

    private static final String SQL_MARK_CONNECTED = """
        UPDATE call_sessions SET status = 'connected', answered_at = ?
        WHERE id = ? AND status = 'ringing'
        """;

    private static final String SQL_MARK_TERMINAL = """
        UPDATE call_sessions SET status = ?, ended_at = ?, end_reason = ?, active_initiator_id = NULL
        WHERE id = ? AND status = ?
        """;

    private static final String SQL_TOUCH_INITIATOR = """
        UPDATE call_sessions SET last_signal_at = ?, initiator_last_seen_at = ? WHERE id = ?
        """;

    private static final String SQL_TOUCH_COUNTERPART = """
        UPDATE call_sessions SET last_signal_at = ?, counterpart_last_seen_at = ? WHERE id = ?
        """;

    private static final String SQL_MARK_FLAGGED = """
        UPDATE call_sessions SET flagged_at = ?, flagged_by = ?, flag_reason = ?
        WHERE id = ? AND flagged_at IS NULL
        """;

    private static final String SQL_RAISE_LEVEL = """
        UPDATE call_sessions SET escalation_level = ?
        WHERE id = ? AND escalation_level < ?
        """;

    private static final String SQL_SET_ESCALATED_TO = """
        UPDATE call_sessions SET escalated_to_id = ?
        WHERE id = ? AND escalated_to_id IS NULL
        """;

    /**
     * active_initiator_id is unique and only set while the session is open, so a second open
     * session for the same initiator fails with {@link org.springframework.dao.DuplicateKeyException}.
     */
    public CallSession insert(CallSession session) {
        jdbc.update(SQL_INSERT,
                session.getId(),
                session.getInitiatorId(),
                session.getCounterpartId(),
                session.getStatus().getValue(),
                session.getCallType().getValue(),
                session.getMode().getValue(),
                session.getContext(),
                from(session.getCreatedAt()),
                from(session.getLastSignalAt()),
                from(session.getInitiatorLastSeenAt()),
                session.getStatus().isTerminal() ? null : session.getInitiatorId());
        return session;
    }

    public Optional<CallSession> findById(UUID id) {
        return jdbc.query(SQL_FIND_BY_ID, new CallSessionRowMapper(), id).stream().findFirst();
    }

    public boolean hasActiveSession(UUID userId) {
        Integer count = jdbc.queryForObject(SQL_EXISTS_ACTIVE_FOR_USER, Integer.class, userId, userId);
        return count != null && count > 0;
    }

    public List<CallSession> findActive() {
        return jdbc.query(SQL_FIND_ACTIVE, new CallSessionRowMapper());
    }

    public List<CallSession> findByParticipant(UUID userId, int limit) {
        return jdbc.query(SQL_FIND_BY_PARTICIPANT, new CallSessionRowMapper(), userId, userId, limit);
    }

    public List<CallSession> findIdleSince(Instant cutoff) {
        return jdbc.query(SQL_FIND_IDLE, new CallSessionRowMapper(), from(cutoff));
    }

    public List<CallSession> findRingingSince(Instant cutoff) {
        return jdbc.query(SQL_FIND_RINGING_SINCE, new CallSessionRowMapper(), from(cutoff));
    }

    public boolean markRinging(UUID id, Instant at) {
        return jdbc.update(SQL_MARK_RINGING, from(at), id) == 1;
    }

    public boolean markConnected(UUID id, Instant at) {
        return jdbc.update(SQL_MARK_CONNECTED, from(at), id) == 1;
    }

    /**
     * Compare-and-set into a terminal state; false when another writer moved the session first.
     */
    public boolean markTerminal(UUID id, CallStatus expected, CallStatus terminal, Instant at, String reason) {
        return jdbc.update(SQL_MARK_TERMINAL,
                terminal.getValue(), from(at), reason, id, expected.getValue()) == 1;
    }

    public void touch(UUID id, boolean initiator, Instant at) {
        jdbc.update(initiator ? SQL_TOUCH_INITIATOR : SQL_TOUCH_COUNTERPART, from(at), from(at), id);
    }

    public boolean markFlagged(UUID id, UUID by, String reason, Instant at) {
        return jdbc.update(SQL_MARK_FLAGGED, from(at), by, reason, id) == 1;
    }

    public boolean raiseEscalationLevel(UUID id, int level) {
        return jdbc.update(SQL_RAISE_LEVEL, level, id, level) == 1;
    }

    public boolean setEscalatedTo(UUID id, UUID userId) {
        return jdbc.update(SQL_SET_ESCALATED_TO, userId, id) == 1;
    }

    private static class CallSessionRowMapper implements RowMapper<CallSession> {
        @Override
        public CallSession mapRow(ResultSet rs, int rowNum) throws SQLException {
            return CallSession.builder()
                    .id(uuid(rs, "id"))
                    .initiatorId(uuid(rs, "initiator_id"))
                    .counterpartId(uuid(rs, "counterpart_id"))
                    .escalatedToId(uuid(rs, "escalated_to_id"))
                    .status(CallStatus.fromValue(rs.getString("status")))
                    .escalationLevel(rs.getInt("escalation_level"))
                    .callType(CallType.fromValue(rs.getString("call_type")))
                    .mode(MediaFormat.fromValue(rs.getString("call_mode")))
                    .context(rs.getString("call_context"))
                    .createdAt(instant(rs, "created_at"))
                    .ringingAt(instant(rs, "ringing_at"))
                    .answeredAt(instant(rs, "answered_at"))
                    .endedAt(instant(rs, "ended_at"))
                    .endReason(rs.getString("end_reason"))
                    .lastSignalAt(instant(rs, "last_signal_at"))
                    .initiatorLastSeenAt(instant(rs, "initiator_last_seen_at"))
                    .counterpartLastSeenAt(instant(rs, "counterpart_last_seen_at"))
                    .flaggedAt(instant(rs, "flagged_at"))
                    .flaggedBy(uuid(rs, "flagged_by"))
                    .flagReason(rs.getString("flag_reason"))
                    .build();
        }
    }
}
