package com.vexrobotics.aimconnector;

import java.util.Arrays;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * Two-slot frame store with a single writer. The writer fills the slot that
 * readers are not looking at, then flips the index, so a reader always gets a
 * complete frame without taking a lock.
 */
public class ImageBuffer {

    /** Placeholder for "no frame": a single zero byte. */
    static final byte[] NO_IMAGE = { 0 };

    private final AtomicReferenceArray<byte[]> slots = new AtomicReferenceArray<>(new byte[][] { NO_IMAGE, NO_IMAGE });
    private final AtomicInteger current = new AtomicInteger(0);

    /** Writer side. */
    public void publish(byte[] frame) {
        int next = 1 - current.get();
        slots.set(next, frame);
        current.set(next);
    }

    public void publishMissing() {
        publish(NO_IMAGE);
    }

    /** The published array itself; callers must not modify it. */
    public byte[] latest() {
        return slots.get(current.get());
    }

    public boolean hasImage() {
        return !isMissing(latest());
    }

    static boolean isMissing(byte[] frame) {
        return frame == NO_IMAGE || Arrays.equals(frame, NO_IMAGE);
    }
}
