package com.flairbit.calls.service.recording;

import com.flairbit.calls.config.CallsProperties;
import com.flairbit.calls.models.MediaFormat;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class SpoolDirectoryMediaCaptureTest {

    @TempDir
    Path spool;

    private SpoolDirectoryMediaCapture capture;
    private final UUID recordingId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        CallsProperties properties = new CallsProperties();
        properties.getRecording().setSpoolDir(spool.toString());
        capture = new SpoolDirectoryMediaCapture(properties);
    }

    @Test
    void closeHandsBackWhatTheMediaServerWrote() throws Exception {
        capture.open(recordingId, 3, MediaFormat.VIDEO);
        Path part = spool.resolve(recordingId.toString()).resolve("3.video.part");
        assertThat(part).exists();
        Files.write(part, new byte[]{7, 7, 7});

        assertThat(capture.close(recordingId, 3)).containsExactly(7, 7, 7);
        assertThat(part).doesNotExist();
    }

    @Test
    void closingWithoutSpoolYieldsEmptySegment() {
        assertThat(capture.close(recordingId, 0)).isEmpty();
    }

    @Test
    void sequenceNumbersDoNotCollideByPrefix() throws Exception {
        capture.open(recordingId, 1, MediaFormat.AUDIO);
        capture.open(recordingId, 10, MediaFormat.AUDIO);
        Files.write(spool.resolve(recordingId.toString()).resolve("10.audio.part"), new byte[]{1, 0});

        assertThat(capture.close(recordingId, 1)).isEmpty();
        assertThat(capture.close(recordingId, 10)).containsExactly(1, 0);
    }
}
