package com.vexrobotics.aimconnector;

import java.nio.charset.StandardCharsets;

/**
 * One inbound message from a channel.
 */
public final class Frame {
    private final byte[] data;
    private final boolean binary;

    public Frame(byte[] data, boolean binary) {
        this.data = data;
        this.binary = binary;
    }

    public static Frame text(String text) {
        return new Frame(text.getBytes(StandardCharsets.UTF_8), false);
    }

    public static Frame binary(byte[] data) {
        return new Frame(data, true);
    }

    public byte[] getData() {
        return data;
    }

    public boolean isBinary() {
        return binary;
    }

    public String getText() {
        return new String(data, StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return (binary ? "binary(" : "text(") + data.length + ")";
    }
}
