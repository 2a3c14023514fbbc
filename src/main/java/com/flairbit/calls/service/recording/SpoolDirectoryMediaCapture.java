package com.flairbit.calls.service.recording;

import com.flairbit.calls.config.CallsProperties;
import com.flairbit.calls.exceptions.StorageUnavailableException;
import com.flairbit.calls.models.MediaFormat;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.UUID;

/**
 * Media server writes each open segment to {@code <spool-dir>/<recordingId>/<seq>.<format>.part}.
 */
@Slf4j
@Component
public class SpoolDirectoryMediaCapture implements MediaCapture {

    private final Path spoolDir;

    public SpoolDirectoryMediaCapture(CallsProperties properties) {
        this.spoolDir = Paths.get(properties.getRecording().getSpoolDir());
    }

    @Override
    public void open(UUID recordingId, int sequenceNumber, MediaFormat format) {
        Path dir = spoolDir.resolve(recordingId.toString());
        try {
            Files.createDirectories(dir);
            Path part = dir.resolve(sequenceNumber + "." + format.getValue() + ".part");
            if (!Files.exists(part)) {
                Files.createFile(part);
            }
            log.debug("Capture opened at {}", part);
        } catch (IOException e) {
            throw new StorageUnavailableException("Cannot open capture spool for " + recordingId, e);
        }
    }

    @Override
    public byte[] close(UUID recordingId, int sequenceNumber) {
        Path dir = spoolDir.resolve(recordingId.toString());
        try {
            Path part = findPart(dir, sequenceNumber);
            if (part == null) {
                log.warn("No capture spool for {}#{}, segment is empty", recordingId, sequenceNumber);
                return new byte[0];
            }
            byte[] data = Files.readAllBytes(part);
            Files.deleteIfExists(part);
            return data;
        } catch (IOException e) {
            throw new StorageUnavailableException("Cannot read capture spool for " + recordingId, e);
        }
    }

    private Path findPart(Path dir, int sequenceNumber) throws IOException {
        if (!Files.isDirectory(dir)) return null;
        try (var files = Files.list(dir)) {
            return files.filter(p -> p.getFileName().toString().startsWith(sequenceNumber + "."))
                    .findFirst()
                    .orElse(null);
        }
    }
}
