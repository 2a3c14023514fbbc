package com.flairbit.calls.service.recording;

import com.flairbit.calls.config.CallsProperties;
import com.flairbit.calls.exceptions.StorageUnavailableException;
import com.flairbit.calls.exceptions.UploadExhaustedException;
import com.flairbit.calls.models.RecordingSegment;
import com.flairbit.calls.models.SegmentUploadStatus;
import com.flairbit.calls.repo.RecordingSegmentJDBCRepository;
import com.flairbit.calls.service.CallSettingsService;
import com.flairbit.calls.utils.AfterCommit;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;

/**
 * Uploads sealed segments on the shared upload pool.
 * <p>
 * Uploads of one recording form a chain so at most one is in flight per recording and they
 * land in sequence order; different recordings upload in parallel. Each upload retries
 * {@link StorageUnavailableException} with exponential backoff up to {@code upload.max-attempts}.
 * <p>
 * Uploads start after the enqueuing transaction commits and may run on its thread when the pool
 * is saturated, so their writes always go through a transaction of their own.
 */
@Slf4j
@Component
public class SegmentUploader {

    private final SegmentStorage storage;
    private final RecordingSegmentJDBCRepository segmentRepo;
    private final CallSettingsService settings;
    private final CallsProperties properties;
    private final Executor executor;
    private final TransactionTemplate transactions;
    private final Clock clock;

    private final ConcurrentMap<UUID, CompletableFuture<Void>> tails = new ConcurrentHashMap<>();

    public SegmentUploader(SegmentStorage storage,
                           RecordingSegmentJDBCRepository segmentRepo,
                           CallSettingsService settings,
                           CallsProperties properties,
                           @Qualifier("segmentUploadExecutor") Executor executor,
                           PlatformTransactionManager transactionManager,
                           Clock clock) {
        this.storage = storage;
        this.segmentRepo = segmentRepo;
        this.settings = settings;
        this.properties = properties;
        this.executor = executor;
        this.transactions = new TransactionTemplate(transactionManager);
        this.transactions.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.clock = clock;
    }

    public void enqueue(RecordingSegment segment, byte[] sealed, SegmentUploadListener listener) {
        AfterCommit.run(() -> chain(segment, sealed, listener));
    }

    /** Number of recordings with uploads queued or running. */
    public int inFlightRecordings() {
        return tails.size();
    }

    private void chain(RecordingSegment segment, byte[] sealed, SegmentUploadListener listener) {
        UUID recordingId = segment.getRecordingId();
        CompletableFuture<Void> next = tails.compute(recordingId, (id, tail) -> {
            CompletableFuture<?> previous = tail == null ? CompletableFuture.completedFuture(null) : tail;
            return previous
                    .handle((v, ex) -> null)
                    .thenRunAsync(() -> upload(segment, sealed, listener), executor);
        });
        next.whenComplete((v, ex) -> {
            tails.remove(recordingId, next);
            if (ex != null) {
                log.error("Upload chain for recording {} broke: {}", recordingId, ex.getMessage(), ex);
            }
        });
    }

    private void upload(RecordingSegment segment, byte[] sealed, SegmentUploadListener listener) {
        UUID recordingId = segment.getRecordingId();
        int seq = segment.getSequenceNumber();

        SegmentUploadStatus current = segmentRepo.find(recordingId, seq)
                .map(RecordingSegment::getUploadStatus)
                .orElse(null);
        if (current != SegmentUploadStatus.PENDING) {
            log.info("Skipping upload of {}#{} in state {}", recordingId, seq, current);
            return;
        }

        int maxAttempts = Math.max(1, settings.uploadMaxAttempts());
        Retry retry = Retry.of("segment-upload", RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(properties.getRecording().getUploadBackoff(), 2.0))
                .retryExceptions(StorageUnavailableException.class)
                .build());
        retry.getEventPublisher().onRetry(event ->
                log.warn("Upload of {}#{} failed (attempt {}), retrying in {}: {}",
                        recordingId, seq, event.getNumberOfRetryAttempts(), event.getWaitInterval(),
                        event.getLastThrowable() == null ? "" : event.getLastThrowable().getMessage()));

        try {
            retry.executeCallable(() -> {
                transactions.executeWithoutResult(status -> segmentRepo.incrementAttempts(recordingId, seq));
                storage.put(segment.getStoragePath(), sealed);
                return null;
            });
        } catch (Exception e) {
            UploadExhaustedException exhausted = new UploadExhaustedException(
                    "Upload of " + recordingId + "#" + seq + " failed after " + maxAttempts + " attempts", e);
            log.error(exhausted.getMessage(), e);
            transactions.executeWithoutResult(status -> {
                segmentRepo.markFailed(recordingId, seq);
                listener.segmentExhausted(recordingId, seq, exhausted);
            });
            return;
        }

        transactions.executeWithoutResult(status -> {
            segmentRepo.markUploaded(recordingId, seq, clock.instant());
            listener.segmentUploaded(recordingId, seq);
        });
        log.info("Uploaded segment {}#{} ({} bytes)", recordingId, seq, sealed.length);
    }
}
