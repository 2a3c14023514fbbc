package com.flairbit.calls.repo;

import com.flairbit.calls.models.AccessAction;
import com.flairbit.calls.models.AccessLogEntry;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.UUID;

import static com.flairbit.calls.utils.SqlTimestamps.from;
import static com.flairbit.calls.utils.SqlTimestamps.instant;
import static com.flairbit.calls.utils.SqlTimestamps.uuid;

/**
 * Append-only. There is deliberately no update or delete statement for this table.
 */
@Repository
@RequiredArgsConstructor
public class AccessLogJDBCRepository {

    private final JdbcTemplate jdbc;

    private static final String SQL_INSERT = """
        INSERT INTO access_log (id, recording_id, accessor_id, action, allowed, reason, source_address, accessed_at)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?)
        """;

    private static final String SQL_FIND_BY_RECORDING = """
        SELECT id, recording_id, accessor_id, action, allowed, reason, source_address, accessed_at
        FROM access_log
        WHERE recording_id = ?
        ORDER BY accessed_at DESC
        LIMIT ?
        """;

    public AccessLogEntry append(AccessLogEntry entry) {
        jdbc.update(SQL_INSERT,
                entry.getId(),
                entry.getRecordingId(),
                entry.getAccessorId(),
                entry.getAction().getValue(),
                entry.isAllowed(),
                entry.getReason(),
                entry.getSourceAddress(),
                from(entry.getTimestamp()));
        return entry;
    }

    public List<AccessLogEntry> findByRecording(UUID recordingId, int limit) {
        return jdbc.query(SQL_FIND_BY_RECORDING, new AccessLogRowMapper(), recordingId, limit);
    }

    private static class AccessLogRowMapper implements RowMapper<AccessLogEntry> {
        @Override
        public AccessLogEntry mapRow(ResultSet rs, int rowNum) throws SQLException {
            return AccessLogEntry.builder()
                    .id(uuid(rs, "id"))
                    .recordingId(uuid(rs, "recording_id"))
                    .accessorId(uuid(rs, "accessor_id"))
                    .action(AccessAction.fromValue(rs.getString("action")))
                    .allowed(rs.getBoolean("allowed"))
                    .reason(rs.getString("reason"))
                    .sourceAddress(rs.getString("source_address"))
                    .timestamp(instant(rs, "accessed_at"))
                    .build();
        }
    }
}
