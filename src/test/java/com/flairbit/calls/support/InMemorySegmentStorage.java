package com.flairbit.calls.support;

import com.flairbit.calls.exceptions.NotFoundException;
import com.flairbit.calls.exceptions.StorageUnavailableException;
import com.flairbit.calls.service.recording.SegmentStorage;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

public class InMemorySegmentStorage implements SegmentStorage {

    private final Map<String, byte[]> objects = new ConcurrentHashMap<>();
    private final AtomicInteger putFailures = new AtomicInteger();
    private final AtomicInteger putCalls = new AtomicInteger();
    private volatile boolean unavailable;

    /** The next {@code count} puts fail with a transient error. */
    public void failNextPuts(int count) {
        putFailures.set(count);
    }

    public void setUnavailable(boolean unavailable) {
        this.unavailable = unavailable;
    }

    public int putCalls() {
        return putCalls.get();
    }

    public boolean contains(String path) {
        return objects.containsKey(path);
    }

    public int size() {
        return objects.size();
    }

    public void corrupt(String path) {
        byte[] data = objects.get(path).clone();
        data[data.length - 1] ^= 0x01;
        objects.put(path, data);
    }

    @Override
    public void put(String path, byte[] data) {
        putCalls.incrementAndGet();
        if (unavailable || putFailures.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            throw new StorageUnavailableException("simulated outage writing " + path);
        }
        objects.put(path, data.clone());
    }

    @Override
    public byte[] get(String path) {
        byte[] data = objects.get(path);
        if (data == null) {
            throw new NotFoundException("No object at " + path);
        }
        return data.clone();
    }

    @Override
    public void delete(String path) {
        if (unavailable) {
            throw new StorageUnavailableException("simulated outage deleting " + path);
        }
        objects.remove(path);
    }
}
