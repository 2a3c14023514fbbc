package com.flairbit.calls.scheduler;

import com.flairbit.calls.config.CallsProperties;
import com.flairbit.calls.exceptions.StorageUnavailableException;
import com.flairbit.calls.models.LifecycleEventType;
import com.flairbit.calls.models.Recording;
import com.flairbit.calls.models.RecordingSegment;
import com.flairbit.calls.repo.RecordingJDBCRepository;
import com.flairbit.calls.repo.RecordingSegmentJDBCRepository;
import com.flairbit.calls.service.CallEventPublisher;
import com.flairbit.calls.service.SessionLocks;
import com.flairbit.calls.service.access.AccessControlService;
import com.flairbit.calls.service.calls.SignalingRelay;
import com.flairbit.calls.service.recording.SegmentStorage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Deletes recordings past their retention and garbage-collects signaling of long-finished calls.
 * The purge audit entry is written first; a recording whose entry cannot be written is kept.
 * Recordings under legal hold are never selected.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RetentionSweeper {

    private static final int BATCH_SIZE = 100;

    private final RecordingJDBCRepository recordingRepo;
    private final RecordingSegmentJDBCRepository segmentRepo;
    private final SegmentStorage storage;
    private final AccessControlService accessControl;
    private final SignalingRelay relay;
    private final CallEventPublisher events;
    private final SessionLocks locks;
    private final CallsProperties properties;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${calls.retention.sweep-ms:300000}")
    public void sweep() {
        try {
            int purged = purgeExpired();
            int signals = collectSignaling();
            if (purged > 0 || signals > 0) {
                log.info("Retention sweep purged {} recordings and {} signaling messages", purged, signals);
            }
        } catch (Exception e) {
            log.error("Retention sweep failed: {}", e.getMessage(), e);
        }
    }

    public int purgeExpired() {
        Instant now = clock.instant();
        int purged = 0;
        List<Recording> expired;
        do {
            expired = recordingRepo.findExpired(now, BATCH_SIZE);
            int before = purged;
            for (Recording recording : expired) {
                if (purge(recording)) purged++;
            }
            if (purged == before) break;
        } while (expired.size() == BATCH_SIZE);
        return purged;
    }

    public int collectSignaling() {
        Instant cutoff = clock.instant().minus(properties.getSignaling().getRetention());
        return relay.purgeEndedBefore(cutoff);
    }

    private boolean purge(Recording recording) {
        return locks.call(recording.getCallId(), () -> {
            if (recordingRepo.findById(recording.getId()).map(Recording::isLegalHold).orElse(true)) {
                log.info("Skipping recording {}: held or already gone", recording.getId());
                return false;
            }
            try {
                accessControl.recordPurge(recording.getId());
            } catch (StorageUnavailableException e) {
                log.error("Keeping recording {}: purge could not be audited", recording.getId());
                return false;
            }
            try {
                for (RecordingSegment segment : segmentRepo.findByRecording(recording.getId())) {
                    storage.delete(segment.getStoragePath());
                }
            } catch (StorageUnavailableException e) {
                // rows stay so the next sweep retries the object deletes
                log.warn("Storage delete failed for recording {}: {}", recording.getId(), e.getMessage());
                return false;
            }
            segmentRepo.deleteByRecording(recording.getId());
            recordingRepo.delete(recording.getId());
            events.emit(LifecycleEventType.RECORDING_PURGED, recording.getCallId(), recording.getId(),
                    Map.of("retentionExpiresAt", recording.getRetentionExpiresAt().toString()));
            log.info("Recording {} purged after retention", recording.getId());
            return true;
        });
    }
}
