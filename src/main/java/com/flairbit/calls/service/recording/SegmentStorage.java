package com.flairbit.calls.service.recording;

import com.flairbit.calls.exceptions.StorageUnavailableException;

/**
 * Object storage for sealed segments. Implementations signal transient failures with
 * {@link StorageUnavailableException}, which the uploader retries.
 */
public interface SegmentStorage {

    void put(String path, byte[] data);

    byte[] get(String path);

    void delete(String path);
}
