package com.flairbit.calls.service.recording;

import com.flairbit.calls.models.CallSession;
import com.flairbit.calls.models.CallStatus;
import com.flairbit.calls.models.MediaFormat;
import com.flairbit.calls.models.Recording;
import com.flairbit.calls.models.RecordingSegment;
import com.flairbit.calls.models.RecordingStatus;
import com.flairbit.calls.models.SegmentUploadStatus;
import com.flairbit.calls.security.Actor;
import com.flairbit.calls.support.CallsFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Recording behaviour with every service call running in its own transaction, as in the
 * deployed application.
 */
class RecordingTransactionTest {

    private CallsFixture f;
    private final ExecutorService callers = Executors.newFixedThreadPool(2);

    @BeforeEach
    void setUp() {
        f = CallsFixture.transactional();
    }

    @AfterEach
    void tearDown() {
        callers.shutdownNow();
        f.close();
    }

    @Test
    void failedForcedStopDoesNotRollBackHangup() {
        CallSession session = f.recordableCall();
        Recording recording = f.recordings.start(session.getId(), f.alice, MediaFormat.AUDIO);
        f.clock.advanceSeconds(8);
        f.capture.failCloses(true);

        CallSession ended = f.calls.end(session.getId(), Actor.user(f.bob), "hangup");

        assertThat(ended.getStatus()).isEqualTo(CallStatus.ENDED);
        assertThat(f.sessionRepo.findById(session.getId()).orElseThrow().getStatus()).isEqualTo(CallStatus.ENDED);
        Recording failed = f.recordingRepo.findById(recording.getId()).orElseThrow();
        assertThat(failed.getStatus()).isEqualTo(RecordingStatus.FAILED);
        assertThat(f.segmentRepo.findByRecording(recording.getId()))
                .extracting(RecordingSegment::getUploadStatus).containsExactly(SegmentUploadStatus.FAILED);
        assertThat(f.eventTypes(session.getId())).contains("call.ended", "recording.failed")
                .doesNotContain("recording.stopped");
    }

    @Test
    void recordingStartedInTransactionUploadsAfterCommit() {
        CallSession session = f.recordableCall();
        Recording recording = f.recordings.start(session.getId(), f.alice, MediaFormat.VIDEO);
        f.clock.advanceSeconds(4);

        Recording ready = f.recordings.stop(recording.getId(), Actor.user(f.alice));

        assertThat(ready.getStatus()).isIn(RecordingStatus.UPLOADING, RecordingStatus.READY);
        assertThat(f.recordingRepo.findById(recording.getId()).orElseThrow().getStatus()).isEqualTo(RecordingStatus.READY);
        RecordingSegment segment = f.segmentRepo.find(recording.getId(), 0).orElseThrow();
        assertThat(segment.getUploadStatus()).isEqualTo(SegmentUploadStatus.UPLOADED);
        assertThat(f.storage.contains(segment.getStoragePath())).isTrue();
    }

    @Test
    void hangupRacingPauseWaitsForPauseToCommit() throws Exception {
        CallSession session = f.recordableCall();
        Recording recording = f.recordings.start(session.getId(), f.alice, MediaFormat.AUDIO);
        f.clock.advanceSeconds(10);

        CountDownLatch closing = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        f.capture.holdNextClose(closing, release);

        CompletableFuture<Recording> pause = CompletableFuture.supplyAsync(
                () -> f.recordings.pause(recording.getId(), Actor.user(f.alice)), callers);
        assertThat(closing.await(5, TimeUnit.SECONDS)).isTrue();

        CompletableFuture<CallSession> hangup = CompletableFuture.supplyAsync(
                () -> f.calls.end(session.getId(), Actor.user(f.bob), "hangup"), callers);
        Thread.sleep(200);
        assertThat(hangup).isNotDone();

        release.countDown();
        assertThat(pause.get(5, TimeUnit.SECONDS).getStatus()).isEqualTo(RecordingStatus.PAUSED);
        assertThat(hangup.get(5, TimeUnit.SECONDS).getStatus()).isEqualTo(CallStatus.ENDED);

        Recording after = f.recordingRepo.findById(recording.getId()).orElseThrow();
        assertThat(after.getStatus()).isEqualTo(RecordingStatus.READY);
        assertThat(f.segmentRepo.findByRecording(recording.getId()))
                .extracting(RecordingSegment::getUploadStatus).containsExactly(SegmentUploadStatus.UPLOADED);
        assertThat(f.capture.openCount()).isZero();

        List<String> recordingEvents = f.outboxRepo.findByCall(session.getId()).stream()
                .filter(e -> e.getRecordingId() != null)
                .map(e -> e.getType().getValue())
                .toList();
        assertThat(recordingEvents).containsExactly(
                "recording.started", "recording.paused", "recording.stopped", "recording.ready");
    }
}
