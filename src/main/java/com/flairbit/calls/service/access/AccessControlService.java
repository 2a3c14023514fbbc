package com.flairbit.calls.service.access;

import com.flairbit.calls.exceptions.BadRequestException;
import com.flairbit.calls.exceptions.NotFoundException;
import com.flairbit.calls.exceptions.StorageUnavailableException;
import com.flairbit.calls.exceptions.UnauthorizedException;
import com.flairbit.calls.models.AccessAction;
import com.flairbit.calls.models.AccessGrant;
import com.flairbit.calls.models.AccessLogEntry;
import com.flairbit.calls.models.AccessPermission;
import com.flairbit.calls.models.CallSession;
import com.flairbit.calls.models.Recording;
import com.flairbit.calls.models.RecordingSegment;
import com.flairbit.calls.models.SegmentUploadStatus;
import com.flairbit.calls.repo.AccessGrantJDBCRepository;
import com.flairbit.calls.repo.AccessLogJDBCRepository;
import com.flairbit.calls.repo.CallSessionJDBCRepository;
import com.flairbit.calls.repo.RecordingJDBCRepository;
import com.flairbit.calls.repo.RecordingSegmentJDBCRepository;
import com.flairbit.calls.security.Actor;
import com.flairbit.calls.service.SessionLocks;
import com.flairbit.calls.service.recording.SegmentCipher;
import com.flairbit.calls.service.recording.SegmentStorage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Gate for every recording read. Each decision, allowed or denied, is written to the access log
 * before the caller gets an answer; if that write fails the request is denied.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AccessControlService {

    public static final String REASON_PARTICIPANT = "participant";
    public static final String REASON_ADMIN = "admin";
    public static final String REASON_GRANT = "grant";
    public static final String REASON_NO_GRANT = "no_grant";
    public static final String REASON_NOT_FOUND = "not_found";
    public static final String REASON_RETENTION = "retention_expired";
    public static final String REASON_HOLD_UNCHANGED = "hold_unchanged";

    private static final Set<String> ALLOWING = Set.of(REASON_PARTICIPANT, REASON_ADMIN, REASON_GRANT);

    private final RecordingJDBCRepository recordingRepo;
    private final RecordingSegmentJDBCRepository segmentRepo;
    private final CallSessionJDBCRepository sessionRepo;
    private final AccessGrantJDBCRepository grantRepo;
    private final AccessLogJDBCRepository logRepo;
    private final SegmentStorage storage;
    private final SegmentCipher cipher;
    private final SessionLocks locks;
    private final Clock clock;

    /**
     * @return the audit entry recording the allowed access
     * @throws UnauthorizedException when denied
     * @throws NotFoundException when the recording does not exist
     * @throws StorageUnavailableException when the audit entry cannot be written
     */
    public AccessLogEntry authorize(UUID recordingId, Actor accessor, AccessAction action, String sourceAddress) {
        Instant now = clock.instant();
        String reason = decide(recordingId, accessor, action, now);
        boolean allowed = ALLOWING.contains(reason);

        AccessLogEntry entry = audit(AccessLogEntry.builder()
                .id(UUID.randomUUID())
                .recordingId(recordingId)
                .accessorId(accessor.getId())
                .action(action)
                .allowed(allowed)
                .reason(reason)
                .sourceAddress(sourceAddress)
                .timestamp(now)
                .build());

        if (REASON_NOT_FOUND.equals(reason)) {
            throw new NotFoundException("Recording not found: " + recordingId);
        }
        if (!allowed) {
            log.warn("Denied {} of recording {} to {}", action.getValue(), recordingId, accessor.getId());
            throw new UnauthorizedException("Access to recording " + recordingId + " denied");
        }
        return entry;
    }

    private String decide(UUID recordingId, Actor accessor, AccessAction action, Instant now) {
        if (action != AccessAction.VIEW && action != AccessAction.DOWNLOAD) {
            return REASON_NO_GRANT;
        }
        Optional<Recording> recording = recordingRepo.findById(recordingId);
        if (recording.isEmpty()) {
            return REASON_NOT_FOUND;
        }
        Optional<CallSession> session = sessionRepo.findById(recording.get().getCallId());
        if (session.isPresent() && session.get().isParticipant(accessor.getId())) {
            return REASON_PARTICIPANT;
        }
        if (grantRepo.findActive(recordingId, accessor.getId(), now).stream()
                .anyMatch(g -> g.getPermission().covers(action))) {
            return REASON_GRANT;
        }
        if (accessor.isAdmin()) {
            return REASON_ADMIN;
        }
        return REASON_NO_GRANT;
    }

    /**
     * Final audit entry for a recording deleted by the retention sweep.
     */
    public AccessLogEntry recordPurge(UUID recordingId) {
        return audit(AccessLogEntry.builder()
                .id(UUID.randomUUID())
                .recordingId(recordingId)
                .accessorId(Actor.SYSTEM_ID)
                .action(AccessAction.PURGED)
                .allowed(true)
                .reason(REASON_RETENTION)
                .timestamp(clock.instant())
                .build());
    }

    /**
     * Places or releases a legal hold. A held recording is skipped by the retention sweep
     * until the hold is released. Every change is written to the access log; a change whose
     * audit entry cannot be written is not applied.
     *
     * @throws UnauthorizedException when the actor is not an admin
     * @throws NotFoundException when the recording does not exist
     */
    @Transactional
    public Recording setLegalHold(UUID recordingId, Actor actor, boolean hold, String reason, String sourceAddress) {
        requireAdmin(actor);
        Recording recording = recordingRepo.findById(recordingId)
                .orElseThrow(() -> new NotFoundException("Recording not found: " + recordingId));
        if (hold && (reason == null || reason.isBlank())) {
            throw new BadRequestException("A legal hold needs a reason");
        }
        // the retention sweep purges under the same call lock and re-reads the hold first
        return locks.call(recording.getCallId(), () -> {
            boolean changed = recordingRepo.setLegalHold(recordingId, hold, hold ? reason : null);
            audit(AccessLogEntry.builder()
                    .id(UUID.randomUUID())
                    .recordingId(recordingId)
                    .accessorId(actor.getId())
                    .action(hold ? AccessAction.LEGAL_HOLD : AccessAction.LEGAL_HOLD_RELEASED)
                    .allowed(true)
                    .reason(changed ? REASON_ADMIN : REASON_HOLD_UNCHANGED)
                    .sourceAddress(sourceAddress)
                    .timestamp(clock.instant())
                    .build());
            if (changed) {
                log.info("Legal hold on recording {} {} by {}", recordingId, hold ? "placed" : "released", actor.getId());
            }
            return recordingRepo.findById(recordingId).orElseThrow();
        });
    }

    public AccessGrant grant(UUID recordingId, UUID granteeId, AccessPermission permission, Instant expiresAt, Actor actor) {
        requireAdmin(actor);
        recordingRepo.findById(recordingId)
                .orElseThrow(() -> new NotFoundException("Recording not found: " + recordingId));
        Instant now = clock.instant();
        if (expiresAt != null && !expiresAt.isAfter(now)) {
            throw new BadRequestException("Grant expiry must be in the future");
        }
        AccessGrant grant = grantRepo.insert(AccessGrant.builder()
                .id(UUID.randomUUID())
                .recordingId(recordingId)
                .granteeId(granteeId)
                .permission(permission == null ? AccessPermission.VIEW : permission)
                .grantedBy(actor.getId())
                .grantedAt(now)
                .expiresAt(expiresAt)
                .build());
        log.info("Granted {} on recording {} to {} by {}", grant.getPermission().getValue(), recordingId, granteeId, actor.getId());
        return grant;
    }

    /** Expires the grant now. The row is kept for the audit trail. */
    public AccessGrant revoke(UUID grantId, Actor actor) {
        requireAdmin(actor);
        grantRepo.findById(grantId)
                .orElseThrow(() -> new NotFoundException("Grant not found: " + grantId));
        if (grantRepo.expire(grantId, clock.instant())) {
            log.info("Grant {} revoked by {}", grantId, actor.getId());
        }
        return grantRepo.findById(grantId).orElseThrow();
    }

    public List<AccessGrant> listGrants(UUID recordingId, Actor actor) {
        requireAdmin(actor);
        return grantRepo.findByRecording(recordingId);
    }

    public List<Recording> listAccessibleRecordings(UUID userId) {
        Map<UUID, Recording> byId = new LinkedHashMap<>();
        recordingRepo.findForParticipant(userId).forEach(r -> byId.put(r.getId(), r));
        recordingRepo.findGrantedTo(userId, clock.instant()).forEach(r -> byId.putIfAbsent(r.getId(), r));
        return byId.values().stream()
                .sorted(Comparator.comparing(Recording::getCreatedAt).reversed())
                .toList();
    }

    public List<AccessLogEntry> accessLog(UUID recordingId, Actor actor, int limit) {
        requireAdmin(actor);
        return logRepo.findByRecording(recordingId, Math.max(1, Math.min(limit, 1000)));
    }

    /**
     * Decrypted bytes of one uploaded segment, after a download authorization.
     */
    public byte[] openSegment(UUID recordingId, int sequenceNumber, Actor accessor, String sourceAddress) {
        authorize(recordingId, accessor, AccessAction.DOWNLOAD, sourceAddress);
        Recording recording = recordingRepo.findById(recordingId)
                .orElseThrow(() -> new NotFoundException("Recording not found: " + recordingId));
        RecordingSegment segment = segmentRepo.find(recordingId, sequenceNumber)
                .orElseThrow(() -> new NotFoundException("Segment " + sequenceNumber + " not found for recording " + recordingId));
        if (segment.getUploadStatus() != SegmentUploadStatus.UPLOADED) {
            throw new NotFoundException("Segment " + sequenceNumber + " is " + segment.getUploadStatus().getValue());
        }

        byte[] sealed = storage.get(segment.getStoragePath());
        if (segment.getChecksum() != null && !segment.getChecksum().equals(cipher.checksum(sealed))) {
            log.error("Checksum mismatch for segment {}#{}", recordingId, sequenceNumber);
            throw new StorageUnavailableException("Segment " + sequenceNumber + " failed integrity check");
        }
        return cipher.decrypt(recording.getEncryptionKeyRef(), recordingId, sequenceNumber, sealed);
    }

    private AccessLogEntry audit(AccessLogEntry entry) {
        try {
            return logRepo.append(entry);
        } catch (DataAccessException e) {
            log.error("Access log write failed for recording {}, denying: {}", entry.getRecordingId(), e.getMessage(), e);
            throw new StorageUnavailableException("Access audit unavailable", e);
        }
    }

    private void requireAdmin(Actor actor) {
        if (!actor.isAdmin()) {
            throw new UnauthorizedException("Administrative capability required");
        }
    }
}
