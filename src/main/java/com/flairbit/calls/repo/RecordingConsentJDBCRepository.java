package com.flairbit.calls.repo;

import com.flairbit.calls.models.RecordingConsent;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import static com.flairbit.calls.utils.SqlTimestamps.from;
import static com.flairbit.calls.utils.SqlTimestamps.instant;
import static com.flairbit.calls.utils.SqlTimestamps.uuid;

/**
 * Append-only consent trail. entry_id orders entries that share a timestamp.
 */
@Repository
@RequiredArgsConstructor
public class RecordingConsentJDBCRepository {

    private final JdbcTemplate jdbc;

    private static final String SQL_INSERT = """
        INSERT INTO recording_consents (call_id, user_id, given, source_address, recorded_at)
        VALUES (?, ?, ?, ?, ?)
        """;

    private static final String SQL_FIND_BY_CALL = """
        SELECT entry_id, call_id, user_id, given, source_address, recorded_at
        FROM recording_consents
        WHERE call_id = ?
        ORDER BY entry_id
        """;

    private static final String SQL_LATEST_BY_USER = """
        SELECT c.user_id, c.given
        FROM recording_consents c
        WHERE c.call_id = ?
          AND c.entry_id = (SELECT MAX(m.entry_id) FROM recording_consents m
                            WHERE m.call_id = c.call_id AND m.user_id = c.user_id)
        """;

    public RecordingConsent append(RecordingConsent consent) {
        KeyHolder keys = new GeneratedKeyHolder();
        jdbc.update(con -> {
            PreparedStatement ps = con.prepareStatement(SQL_INSERT, new String[]{"entry_id"});
            ps.setObject(1, consent.getCallId());
            ps.setObject(2, consent.getUserId());
            ps.setBoolean(3, consent.isGiven());
            ps.setString(4, consent.getSourceAddress());
            ps.setTimestamp(5, from(consent.getRecordedAt()));
            return ps;
        }, keys);
        Number key = keys.getKey();
        consent.setEntryId(Objects.isNull(key) ? null : key.longValue());
        return consent;
    }

    public List<RecordingConsent> findByCall(UUID callId) {
        return jdbc.query(SQL_FIND_BY_CALL, new RecordingConsentRowMapper(), callId);
    }

    /** Current consent per participant who has ever answered. */
    public Map<UUID, Boolean> latestByUser(UUID callId) {
        Map<UUID, Boolean> latest = new HashMap<>();
        RowCallbackHandler collect = rs -> latest.put(uuid(rs, "user_id"), rs.getBoolean("given"));
        jdbc.query(SQL_LATEST_BY_USER, collect, callId);
        return latest;
    }

    private static class RecordingConsentRowMapper implements RowMapper<RecordingConsent> {
        @Override
        public RecordingConsent mapRow(ResultSet rs, int rowNum) throws SQLException {
            return RecordingConsent.builder()
                    .entryId(rs.getLong("entry_id"))
                    .callId(uuid(rs, "call_id"))
                    .userId(uuid(rs, "user_id"))
                    .given(rs.getBoolean("given"))
                    .sourceAddress(rs.getString("source_address"))
                    .recordedAt(instant(rs, "recorded_at"))
                    .build();
        }
    }
}
