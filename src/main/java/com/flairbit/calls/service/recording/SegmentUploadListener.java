package com.flairbit.calls.service.recording;

import com.flairbit.calls.exceptions.UploadExhaustedException;

import java.util.UUID;

public interface SegmentUploadListener {

    void segmentUploaded(UUID recordingId, int sequenceNumber);

    void segmentExhausted(UUID recordingId, int sequenceNumber, UploadExhaustedException cause);
}
