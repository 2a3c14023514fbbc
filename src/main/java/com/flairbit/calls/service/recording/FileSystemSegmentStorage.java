package com.flairbit.calls.service.recording;

import com.flairbit.calls.config.CallsProperties;
import com.flairbit.calls.exceptions.NotFoundException;
import com.flairbit.calls.exceptions.StorageUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;

@Slf4j
@Component
public class FileSystemSegmentStorage implements SegmentStorage {

    private final Path root;

    public FileSystemSegmentStorage(CallsProperties properties) {
        this.root = Paths.get(properties.getRecording().getStorageRoot());
    }

    @Override
    public void put(String path, byte[] data) {
        Path target = resolve(path);
        try {
            Files.createDirectories(target.getParent());
            Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
            Files.write(tmp, data);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new StorageUnavailableException("Write failed for " + path, e);
        }
    }

    @Override
    public byte[] get(String path) {
        try {
            return Files.readAllBytes(resolve(path));
        } catch (NoSuchFileException e) {
            throw new NotFoundException("Segment object missing: " + path);
        } catch (IOException e) {
            throw new StorageUnavailableException("Read failed for " + path, e);
        }
    }

    @Override
    public void delete(String path) {
        try {
            Files.deleteIfExists(resolve(path));
        } catch (IOException e) {
            throw new StorageUnavailableException("Delete failed for " + path, e);
        }
    }

    private Path resolve(String path) {
        Path resolved = root.resolve(path).normalize();
        if (!resolved.startsWith(root.normalize())) {
            throw new IllegalArgumentException("Path escapes storage root: " + path);
        }
        return resolved;
    }
}
