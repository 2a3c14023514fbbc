package com.flairbit.calls.service.recording;

import com.flairbit.calls.config.CallsProperties;
import com.flairbit.calls.exceptions.NotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileSystemSegmentStorageTest {

    @TempDir
    Path root;

    private FileSystemSegmentStorage storage;

    @BeforeEach
    void setUp() {
        CallsProperties properties = new CallsProperties();
        properties.getRecording().setStorageRoot(root.toString());
        storage = new FileSystemSegmentStorage(properties);
    }

    @Test
    void storesUnderRecordingDirectory() {
        storage.put("rec-1/000000.seg", new byte[]{1, 2, 3});

        assertThat(Files.exists(root.resolve("rec-1/000000.seg"))).isTrue();
        assertThat(storage.get("rec-1/000000.seg")).containsExactly(1, 2, 3);
    }

    @Test
    void overwriteReplacesObject() {
        storage.put("rec-1/000000.seg", new byte[]{1});
        storage.put("rec-1/000000.seg", new byte[]{9, 9});

        assertThat(storage.get("rec-1/000000.seg")).containsExactly(9, 9);
    }

    @Test
    void missingObjectIsNotFoundAndDeleteIsIdempotent() {
        assertThatThrownBy(() -> storage.get("rec-1/000007.seg")).isInstanceOf(NotFoundException.class);

        storage.put("rec-1/000001.seg", new byte[]{1});
        storage.delete("rec-1/000001.seg");
        storage.delete("rec-1/000001.seg");
        assertThatThrownBy(() -> storage.get("rec-1/000001.seg")).isInstanceOf(NotFoundException.class);
    }

    @Test
    void pathsCannotEscapeRoot() {
        assertThatThrownBy(() -> storage.put("../outside.seg", new byte[]{1}))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
