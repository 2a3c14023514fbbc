package com.flairbit.calls.service.recording;

import com.flairbit.calls.models.MediaFormat;

import java.util.UUID;

/**
 * Boundary to the media plane. The media server writes raw captured media for the open
 * segment; this service only marks segment boundaries and collects the bytes.
 */
public interface MediaCapture {

    void open(UUID recordingId, int sequenceNumber, MediaFormat format);

    /**
     * Ends capture of a segment and hands back its raw bytes. Capture data is released.
     */
    byte[] close(UUID recordingId, int sequenceNumber);
}
