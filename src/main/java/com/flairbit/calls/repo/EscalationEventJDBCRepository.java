package com.flairbit.calls.repo;

import com.flairbit.calls.models.EscalationEvent;
import lombok.RequiredArgsConstructor;
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

/**
 * Append-only record of escalations. (call_id, event_level) and (call_id, rule_id) are unique,
 * so a concurrent second writer fails with a duplicate key instead of double firing.
 */
@Repository
@RequiredArgsConstructor
public class EscalationEventJDBCRepository {

    private final JdbcTemplate jdbc;

    private static final String COLUMNS = """
        id, call_id, rule_id, event_level, triggered_at, acknowledged_by, acknowledged_at
        """;

    private static final String SQL_INSERT = """
        INSERT INTO escalation_events (id, call_id, rule_id, event_level, triggered_at)
        VALUES (?, ?, ?, ?, ?)
        """;

    private static final String SQL_FIND_BY_ID = "SELECT " + COLUMNS + " FROM escalation_events WHERE id = ?";

    private static final String SQL_FIND_BY_CALL = "SELECT " + COLUMNS + """
         FROM escalation_events
        WHERE call_id = ?
        ORDER BY event_level
        """;

    private static final String SQL_EXISTS_AT_OR_ABOVE = """
        SELECT COUNT(*) FROM escalation_events WHERE call_id = ? AND event_level >= ?
        """;

    private static final String SQL_ACKNOWLEDGE = """
        UPDATE escalation_events SET acknowledged_by = ?, acknowledged_at = ?
        WHERE id = ? AND acknowledged_at IS NULL
        """;

    public EscalationEvent insert(EscalationEvent event) {
        jdbc.update(SQL_INSERT,
                event.getId(),
                event.getCallId(),
                event.getRuleId(),
                event.getLevel(),
                from(event.getTriggeredAt()));
        return event;
    }

    public Optional<EscalationEvent> findById(UUID id) {
        return jdbc.query(SQL_FIND_BY_ID, new EscalationEventRowMapper(), id).stream().findFirst();
    }

    public List<EscalationEvent> findByCall(UUID callId) {
        return jdbc.query(SQL_FIND_BY_CALL, new EscalationEventRowMapper(), callId);
    }

    public boolean existsAtOrAbove(UUID callId, int level) {
        Integer count = jdbc.queryForObject(SQL_EXISTS_AT_OR_ABOVE, Integer.class, callId, level);
        return count != null && count > 0;
    }

    public boolean acknowledge(UUID id, UUID by, Instant at) {
        return jdbc.update(SQL_ACKNOWLEDGE, by, from(at), id) == 1;
    }

    private static class EscalationEventRowMapper implements RowMapper<EscalationEvent> {
        @Override
        public EscalationEvent mapRow(ResultSet rs, int rowNum) throws SQLException {
            return EscalationEvent.builder()
                    .id(uuid(rs, "id"))
                    .callId(uuid(rs, "call_id"))
                    .ruleId(uuid(rs, "rule_id"))
                    .level(rs.getInt("event_level"))
                    .triggeredAt(instant(rs, "triggered_at"))
                    .acknowledgedBy(uuid(rs, "acknowledged_by"))
                    .acknowledgedAt(instant(rs, "acknowledged_at"))
                    .build();
        }
    }
}
