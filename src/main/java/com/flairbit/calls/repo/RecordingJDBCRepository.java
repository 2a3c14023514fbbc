package com.flairbit.calls.repo;

import com.flairbit.calls.models.MediaFormat;
import com.flairbit.calls.models.Recording;
import com.flairbit.calls.models.RecordingStatus;
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

@Repository
@RequiredArgsConstructor
public class RecordingJDBCRepository {

    private final JdbcTemplate jdbc;

    private static final String COLUMNS = """
        r.id, r.call_id, r.status, r.media_format, r.initiated_by, r.encryption_key_ref, r.created_at,
        r.started_at, r.stopped_at, r.ready_at, r.retention_expires_at, r.failure_reason,
        r.consent_verified_at, r.legal_hold, r.legal_hold_reason
        """;

    private static final String SQL_INSERT = """
        INSERT INTO recordings (id, call_id, status, media_format, initiated_by, encryption_key_ref, created_at)
        VALUES (?, ?, ?, ?, ?, ?, ?)
        """;

    private static final String SQL_FIND_BY_ID = "SELECT " + COLUMNS + " FROM recordings r WHERE r.id = ?";

    private static final String SQL_FIND_BY_CALL = "SELECT " + COLUMNS + " FROM recordings r WHERE r.call_id = ?";

    private static final String SQL_FIND_FOR_PARTICIPANT = "SELECT " + COLUMNS + """
         FROM recordings r
        JOIN call_sessions s ON s.id = r.call_id
        WHERE s.initiator_id = ? OR s.counterpart_id = ?
        ORDER BY r.created_at DESC
        """;

    private static final String SQL_FIND_GRANTED = "SELECT " + COLUMNS + """
         FROM recordings r
        WHERE r.id IN (
            SELECT g.recording_id FROM access_grants g
            WHERE g.grantee_id = ? AND (g.expires_at IS NULL OR g.expires_at > ?)
        )
        ORDER BY r.created_at DESC
        """;

    private static final String SQL_FIND_EXPIRED = "SELECT " + COLUMNS + """
         FROM recordings r
        WHERE r.status = 'ready' AND r.legal_hold = FALSE
          AND r.retention_expires_at IS NOT NULL AND r.retention_expires_at < ?
        ORDER BY r.retention_expires_at
        LIMIT ?
        """;

    private static final String SQL_START = """
        UPDATE recordings SET status = 'recording', media_format = ?, initiated_by = ?, started_at = ?,
               consent_verified_at = ?
        WHERE id = ? AND status = 'idle'
        """;

    private static final String SQL_TRANSITION = """
        UPDATE recordings SET status = ? WHERE id = ? AND status = ?
        """;

    private static final String SQL_STOP = """
        UPDATE recordings SET status = 'stopped', stopped_at = ?
        WHERE id = ? AND status IN ('recording', 'paused')
        """;

    private static final String SQL_MARK_READY = """
        UPDATE recordings SET status = 'ready', ready_at = ?, retention_expires_at = ?
        WHERE id = ? AND status = 'uploading'
        """;

    private static final String SQL_MARK_FAILED = """
        UPDATE recordings SET status = 'failed', failure_reason = ?
        WHERE id = ? AND status IN ('recording', 'paused', 'stopped', 'uploading')
        """;

    private static final String SQL_SET_LEGAL_HOLD = """
        UPDATE recordings SET legal_hold = ?, legal_hold_reason = ?
        WHERE id = ? AND legal_hold <> ?
        """;

    private static final String SQL_DELETE = "DELETE FROM recordings WHERE id = ?";

    public Recording insert(Recording recording) {
        jdbc.update(SQL_INSERT,
                recording.getId(),
                recording.getCallId(),
                recording.getStatus().getValue(),
                recording.getFormat().getValue(),
                recording.getInitiatedBy(),
                recording.getEncryptionKeyRef(),
                from(recording.getCreatedAt()));
        return recording;
    }

    public Optional<Recording> findById(UUID id) {
        return jdbc.query(SQL_FIND_BY_ID, new RecordingRowMapper(), id).stream().findFirst();
    }

    public Optional<Recording> findByCallId(UUID callId) {
        return jdbc.query(SQL_FIND_BY_CALL, new RecordingRowMapper(), callId).stream().findFirst();
    }

    public List<Recording> findForParticipant(UUID userId) {
        return jdbc.query(SQL_FIND_FOR_PARTICIPANT, new RecordingRowMapper(), userId, userId);
    }

    public List<Recording> findGrantedTo(UUID userId, Instant now) {
        return jdbc.query(SQL_FIND_GRANTED, new RecordingRowMapper(), userId, from(now));
    }

    public List<Recording> findExpired(Instant now, int limit) {
        return jdbc.query(SQL_FIND_EXPIRED, new RecordingRowMapper(), from(now), limit);
    }

    public boolean markStarted(UUID id, MediaFormat format, UUID initiatedBy, Instant at) {
        return jdbc.update(SQL_START, format.getValue(), initiatedBy, from(at), from(at), id) == 1;
    }

    public boolean transition(UUID id, RecordingStatus expected, RecordingStatus next) {
        return jdbc.update(SQL_TRANSITION, next.getValue(), id, expected.getValue()) == 1;
    }

    public boolean markStopped(UUID id, Instant at) {
        return jdbc.update(SQL_STOP, from(at), id) == 1;
    }

    public boolean markReady(UUID id, Instant at, Instant retentionExpiresAt) {
        return jdbc.update(SQL_MARK_READY, from(at), from(retentionExpiresAt), id) == 1;
    }

    public boolean markFailed(UUID id, String reason) {
        return jdbc.update(SQL_MARK_FAILED, reason, id) == 1;
    }

    /** False when the hold was already in the requested state. */
    public boolean setLegalHold(UUID id, boolean hold, String reason) {
        return jdbc.update(SQL_SET_LEGAL_HOLD, hold, hold ? reason : null, id, hold) == 1;
    }

    public void delete(UUID id) {
        jdbc.update(SQL_DELETE, id);
    }

    private static class RecordingRowMapper implements RowMapper<Recording> {
        @Override
        public Recording mapRow(ResultSet rs, int rowNum) throws SQLException {
            return Recording.builder()
                    .id(uuid(rs, "id"))
                    .callId(uuid(rs, "call_id"))
                    .status(RecordingStatus.fromValue(rs.getString("status")))
                    .format(MediaFormat.fromValue(rs.getString("media_format")))
                    .initiatedBy(uuid(rs, "initiated_by"))
                    .encryptionKeyRef(rs.getString("encryption_key_ref"))
                    .createdAt(instant(rs, "created_at"))
                    .startedAt(instant(rs, "started_at"))
                    .stoppedAt(instant(rs, "stopped_at"))
                    .readyAt(instant(rs, "ready_at"))
                    .retentionExpiresAt(instant(rs, "retention_expires_at"))
                    .failureReason(rs.getString("failure_reason"))
                    .consentVerifiedAt(instant(rs, "consent_verified_at"))
                    .legalHold(rs.getBoolean("legal_hold"))
                    .legalHoldReason(rs.getString("legal_hold_reason"))
                    .build();
        }
    }
}
