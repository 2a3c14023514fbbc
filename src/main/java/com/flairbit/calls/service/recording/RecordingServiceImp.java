package com.flairbit.calls.service.recording;

import com.flairbit.calls.exceptions.ConsentRequiredException;
import com.flairbit.calls.exceptions.InvalidStateTransitionException;
import com.flairbit.calls.exceptions.NotFoundException;
import com.flairbit.calls.exceptions.SessionClosedException;
import com.flairbit.calls.exceptions.StorageUnavailableException;
import com.flairbit.calls.exceptions.UnauthorizedException;
import com.flairbit.calls.exceptions.UploadExhaustedException;
import com.flairbit.calls.models.CallSession;
import com.flairbit.calls.models.CallStatus;
import com.flairbit.calls.models.LifecycleEventType;
import com.flairbit.calls.models.MediaFormat;
import com.flairbit.calls.models.Recording;
import com.flairbit.calls.models.RecordingConsent;
import com.flairbit.calls.models.RecordingSegment;
import com.flairbit.calls.models.RecordingStatus;
import com.flairbit.calls.models.SegmentUploadStatus;
import com.flairbit.calls.repo.CallSessionJDBCRepository;
import com.flairbit.calls.repo.RecordingConsentJDBCRepository;
import com.flairbit.calls.repo.RecordingJDBCRepository;
import com.flairbit.calls.repo.RecordingSegmentJDBCRepository;
import com.flairbit.calls.security.Actor;
import com.flairbit.calls.service.CallEventPublisher;
import com.flairbit.calls.service.CallSettingsService;
import com.flairbit.calls.service.SessionLocks;
import com.flairbit.calls.service.calls.CallLifecycleListener;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Recording state machine. All mutations of a recording run under the lock of its call, so
 * a pause racing a hangup is serialized with the session transition that force-stops it.
 */
@Slf4j
@Service
@Transactional
@RequiredArgsConstructor
public class RecordingServiceImp implements RecordingService, CallLifecycleListener, SegmentUploadListener {

    public static final String REASON_CONSENT_WITHDRAWN = "consent_withdrawn";

    private final RecordingJDBCRepository recordingRepo;
    private final RecordingSegmentJDBCRepository segmentRepo;
    private final CallSessionJDBCRepository sessionRepo;
    private final RecordingConsentJDBCRepository consentRepo;
    private final MediaCapture mediaCapture;
    private final SegmentCipher cipher;
    private final SegmentUploader uploader;
    private final CallEventPublisher events;
    private final CallSettingsService settings;
    private final SessionLocks locks;
    private final Clock clock;

    @Override
    public Recording start(UUID callId, UUID initiatorId, MediaFormat format) {
        return locks.call(callId, () -> {
            CallSession session = loadSession(callId);
            if (session.getStatus().isTerminal()) {
                throw new SessionClosedException("Call " + callId + " is " + session.getStatus().getValue());
            }
            if (session.getStatus() != CallStatus.CONNECTED) {
                throw new InvalidStateTransitionException("Recording requires a connected call, call is "
                        + session.getStatus().getValue());
            }
            if (!session.isParticipant(initiatorId)) {
                throw new UnauthorizedException("User " + initiatorId + " is not part of call " + callId);
            }
            requireConsent(session);

            Instant now = clock.instant();
            MediaFormat effective = format == null ? session.getMode() : format;
            Recording recording = recordingRepo.findByCallId(callId)
                    .orElseGet(() -> create(callId, initiatorId, effective, now));

            if (recording.getStatus() != RecordingStatus.IDLE
                    || !recordingRepo.markStarted(recording.getId(), effective, initiatorId, now)) {
                throw new InvalidStateTransitionException("Recording for call " + callId + " is already "
                        + recording.getStatus().getValue());
            }

            openSegment(recording.getId(), 0, 0L, effective);
            events.emit(LifecycleEventType.RECORDING_STARTED, callId, recording.getId(), Map.of(
                    "format", effective.getValue(),
                    "initiatedBy", initiatorId.toString()));
            log.info("Recording {} started for call {} by {}", recording.getId(), callId, initiatorId);
            return load(recording.getId());
        });
    }

    @Override
    public Recording pause(UUID recordingId, Actor actor) {
        Recording recording = load(recordingId);
        return locks.call(recording.getCallId(), () -> {
            Recording current = load(recordingId);
            verifyController(current, actor);
            if (current.getStatus() != RecordingStatus.RECORDING
                    || !recordingRepo.transition(recordingId, RecordingStatus.RECORDING, RecordingStatus.PAUSED)) {
                throw new InvalidStateTransitionException("Cannot pause recording in state " + current.getStatus().getValue());
            }
            Instant now = clock.instant();
            Runnable upload = finalizeOpenSegment(current, now);
            events.emit(LifecycleEventType.RECORDING_PAUSED, current.getCallId(), recordingId,
                    Map.of("offsetMs", offsetMs(current, now)));
            upload.run();
            return load(recordingId);
        });
    }

    @Override
    public Recording resume(UUID recordingId, Actor actor) {
        Recording recording = load(recordingId);
        return locks.call(recording.getCallId(), () -> {
            Recording current = load(recordingId);
            verifyController(current, actor);
            CallSession session = loadSession(current.getCallId());
            if (session.getStatus().isTerminal()) {
                throw new SessionClosedException("Call " + session.getId() + " is " + session.getStatus().getValue());
            }
            if (current.getStatus() != RecordingStatus.PAUSED
                    || !recordingRepo.transition(recordingId, RecordingStatus.PAUSED, RecordingStatus.RECORDING)) {
                throw new InvalidStateTransitionException("Cannot resume recording in state " + current.getStatus().getValue());
            }
            Instant now = clock.instant();
            long offset = offsetMs(current, now);
            openSegment(recordingId, segmentRepo.nextSequenceNumber(recordingId), offset, current.getFormat());
            events.emit(LifecycleEventType.RECORDING_RESUMED, current.getCallId(), recordingId, Map.of("offsetMs", offset));
            return load(recordingId);
        });
    }

    @Override
    public Recording stop(UUID recordingId, Actor actor) {
        Recording recording = load(recordingId);
        return locks.call(recording.getCallId(), () -> {
            Recording current = load(recordingId);
            verifyController(current, actor);
            stopInternal(current, "stopped");
            return load(recordingId);
        });
    }

    @Override
    @Transactional(readOnly = true)
    public Recording getRecordingStatus(UUID recordingId) {
        return load(recordingId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<RecordingSegment> listSegments(UUID recordingId) {
        load(recordingId);
        return segmentRepo.findByRecording(recordingId);
    }

    @Override
    @Transactional(readOnly = true)
    public Recording findByCall(UUID callId) {
        return recordingRepo.findByCallId(callId)
                .orElseThrow(() -> new NotFoundException("No recording for call " + callId));
    }

    /**
     * Forced stop when the call reaches a terminal state. Enqueued uploads are left to finish.
     */
    @Override
    public void onTransition(CallSession session, CallStatus from, CallStatus to) {
        if (!to.isTerminal()) return;
        recordingRepo.findByCallId(session.getId())
                .filter(r -> r.getStatus().isLive())
                .ifPresent(r -> {
                    log.info("Call {} reached {}, force-stopping recording {}", session.getId(), to.getValue(), r.getId());
                    forceStop(r, "call_" + to.getValue());
                });
    }

    @Override
    public RecordingConsent recordConsent(UUID callId, Actor actor, boolean given, String sourceAddress) {
        return locks.call(callId, () -> {
            CallSession session = loadSession(callId);
            if (!session.isParticipant(actor.getId())) {
                throw new UnauthorizedException("Only participants of call " + callId + " can answer for recording consent");
            }
            if (given && session.getStatus().isTerminal()) {
                throw new SessionClosedException("Call " + callId + " is " + session.getStatus().getValue());
            }
            RecordingConsent entry = consentRepo.append(RecordingConsent.builder()
                    .callId(callId)
                    .userId(actor.getId())
                    .given(given)
                    .sourceAddress(sourceAddress)
                    .recordedAt(clock.instant())
                    .build());
            log.info("Recording consent {} by {} on call {}", given ? "given" : "withdrawn", actor.getId(), callId);

            if (!given) {
                recordingRepo.findByCallId(callId)
                        .filter(r -> r.getStatus().isLive())
                        .ifPresent(r -> forceStop(r, REASON_CONSENT_WITHDRAWN));
            }
            return entry;
        });
    }

    @Override
    @Transactional(readOnly = true)
    public List<RecordingConsent> consentHistory(UUID callId, Actor actor) {
        CallSession session = loadSession(callId);
        if (!actor.isAdmin() && !session.isParticipant(actor.getId())) {
            throw new UnauthorizedException("User " + actor.getId() + " is not part of call " + callId);
        }
        return consentRepo.findByCall(callId);
    }

    @Override
    public void segmentUploaded(UUID recordingId, int sequenceNumber) {
        completeIfUploaded(recordingId);
    }

    /**
     * Runs on upload threads, which may already hold another call's lock when the pool is
     * saturated, so this relies on conditional updates instead of taking the call lock.
     */
    @Override
    public void segmentExhausted(UUID recordingId, int sequenceNumber, UploadExhaustedException cause) {
        Optional<Recording> found = recordingRepo.findById(recordingId);
        if (found.isEmpty()) return;
        if (fail(found.get(), "segment " + sequenceNumber + " upload exhausted", Map.of("sequenceNumber", sequenceNumber))) {
            log.error("Recording {} failed: {}", recordingId, cause.getMessage());
        }
    }

    private Recording create(UUID callId, UUID initiatorId, MediaFormat format, Instant now) {
        UUID id = UUID.randomUUID();
        return recordingRepo.insert(Recording.builder()
                .id(id)
                .callId(callId)
                .status(RecordingStatus.IDLE)
                .format(format)
                .initiatedBy(initiatorId)
                .encryptionKeyRef(cipher.keyRefFor(id))
                .createdAt(now)
                .build());
    }

    private void stopInternal(Recording recording, String reason) {
        if (!recording.getStatus().isLive()) {
            throw new InvalidStateTransitionException("Cannot stop recording in state " + recording.getStatus().getValue());
        }
        Instant now = clock.instant();
        if (!recordingRepo.markStopped(recording.getId(), now)) {
            throw new InvalidStateTransitionException("Recording " + recording.getId() + " changed state concurrently");
        }
        Runnable upload = finalizeOpenSegment(recording, now);
        events.emit(LifecycleEventType.RECORDING_STOPPED, recording.getCallId(), recording.getId(), Map.of(
                "reason", reason,
                "durationMs", segmentRepo.totalDurationMs(recording.getId())));

        boolean uploading = recordingRepo.transition(recording.getId(), RecordingStatus.STOPPED, RecordingStatus.UPLOADING);
        upload.run();
        if (uploading) {
            completeIfUploaded(recording.getId());
        }
    }

    /**
     * Stop that the caller cannot refuse: the call ended or consent was withdrawn. It does not
     * throw for capture or sealing errors; a stop that cannot finish fails the recording instead
     * of leaving it live or stopped with an open segment.
     */
    private void forceStop(Recording recording, String reason) {
        try {
            stopInternal(recording, reason);
        } catch (InvalidStateTransitionException e) {
            log.info("Recording {} left {} before the forced stop: {}",
                    recording.getId(), recording.getStatus().getValue(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Forced stop of recording {} failed: {}", recording.getId(), e.getMessage(), e);
            fail(recording, "forced stop failed: " + e.getMessage(), Map.of("stopReason", reason));
        }
    }

    /**
     * Releases any open capture, marks unfinished segments failed and moves the recording to
     * failed. Uploaded segments are kept.
     */
    private boolean fail(Recording recording, String reason, Map<String, Object> details) {
        segmentRepo.findOpen(recording.getId()).ifPresent(this::discardCapture);
        int abandoned = segmentRepo.failUnfinished(recording.getId());
        if (!recordingRepo.markFailed(recording.getId(), reason)) {
            return false;
        }
        Map<String, Object> data = new LinkedHashMap<>(details);
        data.put("reason", reason);
        data.put("abandonedSegments", abandoned);
        events.emit(LifecycleEventType.RECORDING_FAILED, recording.getCallId(), recording.getId(), data);
        return true;
    }

    private void requireConsent(CallSession session) {
        Map<UUID, Boolean> consent = consentRepo.latestByUser(session.getId());
        for (UUID participant : List.of(session.getInitiatorId(), session.getCounterpartId())) {
            if (!Boolean.TRUE.equals(consent.get(participant))) {
                throw new ConsentRequiredException("Recording call " + session.getId()
                        + " needs consent from participant " + participant);
            }
        }
    }

    private void completeIfUploaded(UUID recordingId) {
        if (segmentRepo.countNotUploaded(recordingId) > 0) return;
        Instant now = clock.instant();
        Duration retention = settings.recordingRetention();
        if (recordingRepo.markReady(recordingId, now, now.plus(retention))) {
            Recording ready = load(recordingId);
            events.emit(LifecycleEventType.RECORDING_READY, ready.getCallId(), recordingId, Map.of(
                    "durationMs", segmentRepo.totalDurationMs(recordingId),
                    "retentionExpiresAt", ready.getRetentionExpiresAt().toString()));
            log.info("Recording {} ready, retained until {}", recordingId, ready.getRetentionExpiresAt());
        }
    }

    private void openSegment(UUID recordingId, int sequenceNumber, long startOffsetMs, MediaFormat format) {
        segmentRepo.insertOpen(RecordingSegment.builder()
                .recordingId(recordingId)
                .sequenceNumber(sequenceNumber)
                .startOffsetMs(startOffsetMs)
                .storagePath(storagePath(recordingId, sequenceNumber))
                .uploadStatus(SegmentUploadStatus.OPEN)
                .build());
        mediaCapture.open(recordingId, sequenceNumber, format);
    }

    /**
     * Closes the open segment, seals it and records its bounds. Returns the action that
     * enqueues its upload, so callers can emit their own event first.
     */
    private Runnable finalizeOpenSegment(Recording recording, Instant now) {
        Optional<RecordingSegment> open = segmentRepo.findOpen(recording.getId());
        if (open.isEmpty()) return () -> { };

        RecordingSegment segment = open.get();
        long end = Math.max(segment.getStartOffsetMs(), offsetMs(recording, now));
        byte[] raw = mediaCapture.close(recording.getId(), segment.getSequenceNumber());
        byte[] sealed = cipher.encrypt(recording.getEncryptionKeyRef(), recording.getId(), segment.getSequenceNumber(), raw);

        RecordingSegment finalized = segment.toBuilder()
                .endOffsetMs(end)
                .durationMs(end - segment.getStartOffsetMs())
                .checksum(cipher.checksum(sealed))
                .sizeBytes((long) sealed.length)
                .uploadStatus(SegmentUploadStatus.PENDING)
                .build();
        if (!segmentRepo.finalizeSegment(finalized)) {
            log.warn("Segment {}#{} was already finalized", recording.getId(), segment.getSequenceNumber());
            return () -> { };
        }
        return () -> uploader.enqueue(finalized, sealed, this);
    }

    private void discardCapture(RecordingSegment open) {
        try {
            mediaCapture.close(open.getRecordingId(), open.getSequenceNumber());
        } catch (StorageUnavailableException e) {
            log.warn("Could not release capture for {}#{}: {}", open.getRecordingId(), open.getSequenceNumber(), e.getMessage());
        }
    }

    private void verifyController(Recording recording, Actor actor) {
        if (actor.isAdmin()) return;
        CallSession session = loadSession(recording.getCallId());
        if (!session.isParticipant(actor.getId())) {
            throw new UnauthorizedException("User " + actor.getId() + " cannot control recording " + recording.getId());
        }
    }

    private long offsetMs(Recording recording, Instant now) {
        return Math.max(0L, Duration.between(recording.getStartedAt(), now).toMillis());
    }

    private CallSession loadSession(UUID callId) {
        return sessionRepo.findById(callId)
                .orElseThrow(() -> new NotFoundException("Call session not found: " + callId));
    }

    private Recording load(UUID recordingId) {
        return recordingRepo.findById(recordingId)
                .orElseThrow(() -> new NotFoundException("Recording not found: " + recordingId));
    }

    private static String storagePath(UUID recordingId, int sequenceNumber) {
        return recordingId + "/" + String.format("%06d", sequenceNumber) + ".seg";
    }
}
