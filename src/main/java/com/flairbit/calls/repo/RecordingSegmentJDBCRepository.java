package com.flairbit.calls.repo;

import com.flairbit.calls.models.RecordingSegment;
import com.flairbit.calls.models.SegmentUploadStatus;
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
 * Segments are keyed by (recording_id, sequence_number) and only ever appended.
 * Once a segment is uploaded its row is not touched again.
 */
@Repository
@RequiredArgsConstructor
public class RecordingSegmentJDBCRepository {

    private final JdbcTemplate jdbc;

    private static final String COLUMNS = """
        recording_id, sequence_number, start_offset_ms, end_offset_ms, duration_ms, storage_path,
        checksum, size_bytes, upload_status, attempts, uploaded_at
        """;

    private static final String SQL_INSERT_OPEN = """
        INSERT INTO recording_segments (recording_id, sequence_number, start_offset_ms, storage_path, upload_status, attempts)
        VALUES (?, ?, ?, ?, 'open', 0)
        """;

    private static final String SQL_FIND_BY_RECORDING = "SELECT " + COLUMNS + """
         FROM recording_segments
        WHERE recording_id = ?
        ORDER BY sequence_number
        """;

    private static final String SQL_FIND_ONE = "SELECT " + COLUMNS + """
         FROM recording_segments
        WHERE recording_id = ? AND sequence_number = ?
        """;

    private static final String SQL_FIND_OPEN = "SELECT " + COLUMNS + """
         FROM recording_segments
        WHERE recording_id = ? AND upload_status = 'open'
        """;

    private static final String SQL_NEXT_SEQUENCE = """
        SELECT COALESCE(MAX(sequence_number) + 1, 0) FROM recording_segments WHERE recording_id = ?
        """;

    private static final String SQL_FINALIZE = """
        UPDATE recording_segments
        SET end_offset_ms = ?, duration_ms = ?, checksum = ?, size_bytes = ?, upload_status = 'pending'
        WHERE recording_id = ? AND sequence_number = ? AND upload_status = 'open'
        """;

    private static final String SQL_INCREMENT_ATTEMPTS = """
        UPDATE recording_segments SET attempts = attempts + 1
        WHERE recording_id = ? AND sequence_number = ?
        """;

    private static final String SQL_MARK_UPLOADED = """
        UPDATE recording_segments SET upload_status = 'uploaded', uploaded_at = ?
        WHERE recording_id = ? AND sequence_number = ? AND upload_status = 'pending'
        """;

    private static final String SQL_MARK_FAILED = """
        UPDATE recording_segments SET upload_status = 'failed'
        WHERE recording_id = ? AND sequence_number = ? AND upload_status IN ('open', 'pending')
        """;

    private static final String SQL_FAIL_UNFINISHED = """
        UPDATE recording_segments SET upload_status = 'failed'
        WHERE recording_id = ? AND upload_status IN ('open', 'pending')
        """;

    private static final String SQL_COUNT_NOT_UPLOADED = """
        SELECT COUNT(*) FROM recording_segments WHERE recording_id = ? AND upload_status <> 'uploaded'
        """;

    private static final String SQL_SUM_DURATION = """
        SELECT COALESCE(SUM(duration_ms), 0) FROM recording_segments
        WHERE recording_id = ? AND duration_ms IS NOT NULL
        """;

    private static final String SQL_DELETE_BY_RECORDING = "DELETE FROM recording_segments WHERE recording_id = ?";

    public RecordingSegment insertOpen(RecordingSegment segment) {
        jdbc.update(SQL_INSERT_OPEN,
                segment.getRecordingId(),
                segment.getSequenceNumber(),
                segment.getStartOffsetMs(),
                segment.getStoragePath());
        return segment;
    }

    public List<RecordingSegment> findByRecording(UUID recordingId) {
        return jdbc.query(SQL_FIND_BY_RECORDING, new SegmentRowMapper(), recordingId);
    }

    public Optional<RecordingSegment> find(UUID recordingId, int sequenceNumber) {
        return jdbc.query(SQL_FIND_ONE, new SegmentRowMapper(), recordingId, sequenceNumber).stream().findFirst();
    }

    public Optional<RecordingSegment> findOpen(UUID recordingId) {
        return jdbc.query(SQL_FIND_OPEN, new SegmentRowMapper(), recordingId).stream().findFirst();
    }

    public int nextSequenceNumber(UUID recordingId) {
        Integer next = jdbc.queryForObject(SQL_NEXT_SEQUENCE, Integer.class, recordingId);
        return next == null ? 0 : next;
    }

    public boolean finalizeSegment(RecordingSegment segment) {
        return jdbc.update(SQL_FINALIZE,
                segment.getEndOffsetMs(),
                segment.getDurationMs(),
                segment.getChecksum(),
                segment.getSizeBytes(),
                segment.getRecordingId(),
                segment.getSequenceNumber()) == 1;
    }

    public void incrementAttempts(UUID recordingId, int sequenceNumber) {
        jdbc.update(SQL_INCREMENT_ATTEMPTS, recordingId, sequenceNumber);
    }

    public boolean markUploaded(UUID recordingId, int sequenceNumber, Instant at) {
        return jdbc.update(SQL_MARK_UPLOADED, from(at), recordingId, sequenceNumber) == 1;
    }

    public void markFailed(UUID recordingId, int sequenceNumber) {
        jdbc.update(SQL_MARK_FAILED, recordingId, sequenceNumber);
    }

    public int failUnfinished(UUID recordingId) {
        return jdbc.update(SQL_FAIL_UNFINISHED, recordingId);
    }

    public int countNotUploaded(UUID recordingId) {
        Integer count = jdbc.queryForObject(SQL_COUNT_NOT_UPLOADED, Integer.class, recordingId);
        return count == null ? 0 : count;
    }

    public long totalDurationMs(UUID recordingId) {
        Long total = jdbc.queryForObject(SQL_SUM_DURATION, Long.class, recordingId);
        return total == null ? 0L : total;
    }

    public void deleteByRecording(UUID recordingId) {
        jdbc.update(SQL_DELETE_BY_RECORDING, recordingId);
    }

    private static class SegmentRowMapper implements RowMapper<RecordingSegment> {
        @Override
        public RecordingSegment mapRow(ResultSet rs, int rowNum) throws SQLException {
            long endOffset = rs.getLong("end_offset_ms");
            Long end = rs.wasNull() ? null : endOffset;
            long duration = rs.getLong("duration_ms");
            Long dur = rs.wasNull() ? null : duration;
            long size = rs.getLong("size_bytes");
            Long sizeBytes = rs.wasNull() ? null : size;
            return RecordingSegment.builder()
                    .recordingId(uuid(rs, "recording_id"))
                    .sequenceNumber(rs.getInt("sequence_number"))
                    .startOffsetMs(rs.getLong("start_offset_ms"))
                    .endOffsetMs(end)
                    .durationMs(dur)
                    .storagePath(rs.getString("storage_path"))
                    .checksum(rs.getString("checksum"))
                    .sizeBytes(sizeBytes)
                    .uploadStatus(SegmentUploadStatus.fromValue(rs.getString("upload_status")))
                    .attempts(rs.getInt("attempts"))
                    .uploadedAt(instant(rs, "uploaded_at"))
                    .build();
        }
    }
}
