package com.flairbit.calls.repo;

import com.flairbit.calls.models.AccessGrant;
import com.flairbit.calls.models.AccessPermission;
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
 * Grants are never deleted; revocation moves expires_at to the revocation time.
 */
@Repository
@RequiredArgsConstructor
public class AccessGrantJDBCRepository {

    private final JdbcTemplate jdbc;

    private static final String COLUMNS = "id, recording_id, grantee_id, permission, granted_by, granted_at, expires_at";

    private static final String SQL_INSERT = """
        INSERT INTO access_grants (id, recording_id, grantee_id, permission, granted_by, granted_at, expires_at)
        VALUES (?, ?, ?, ?, ?, ?, ?)
        """;

    private static final String SQL_FIND_ACTIVE = "SELECT " + COLUMNS + """
         FROM access_grants
        WHERE recording_id = ? AND grantee_id = ? AND (expires_at IS NULL OR expires_at > ?)
        """;

    private static final String SQL_FIND_BY_ID = "SELECT " + COLUMNS + " FROM access_grants WHERE id = ?";

    private static final String SQL_FIND_BY_RECORDING = "SELECT " + COLUMNS + """
         FROM access_grants
        WHERE recording_id = ?
        ORDER BY granted_at
        """;

    private static final String SQL_EXPIRE = """
        UPDATE access_grants SET expires_at = ?
        WHERE id = ? AND (expires_at IS NULL OR expires_at > ?)
        """;

    public AccessGrant insert(AccessGrant grant) {
        jdbc.update(SQL_INSERT,
                grant.getId(),
                grant.getRecordingId(),
                grant.getGranteeId(),
                grant.getPermission().getValue(),
                grant.getGrantedBy(),
                from(grant.getGrantedAt()),
                from(grant.getExpiresAt()));
        return grant;
    }

    public List<AccessGrant> findActive(UUID recordingId, UUID granteeId, Instant now) {
        return jdbc.query(SQL_FIND_ACTIVE, new AccessGrantRowMapper(), recordingId, granteeId, from(now));
    }

    public Optional<AccessGrant> findById(UUID id) {
        return jdbc.query(SQL_FIND_BY_ID, new AccessGrantRowMapper(), id).stream().findFirst();
    }

    public List<AccessGrant> findByRecording(UUID recordingId) {
        return jdbc.query(SQL_FIND_BY_RECORDING, new AccessGrantRowMapper(), recordingId);
    }

    public boolean expire(UUID id, Instant at) {
        return jdbc.update(SQL_EXPIRE, from(at), id, from(at)) == 1;
    }

    private static class AccessGrantRowMapper implements RowMapper<AccessGrant> {
        @Override
        public AccessGrant mapRow(ResultSet rs, int rowNum) throws SQLException {
            return AccessGrant.builder()
                    .id(uuid(rs, "id"))
                    .recordingId(uuid(rs, "recording_id"))
                    .granteeId(uuid(rs, "grantee_id"))
                    .permission(AccessPermission.fromValue(rs.getString("permission")))
                    .grantedBy(uuid(rs, "granted_by"))
                    .grantedAt(instant(rs, "granted_at"))
                    .expiresAt(instant(rs, "expires_at"))
                    .build();
        }
    }
}
