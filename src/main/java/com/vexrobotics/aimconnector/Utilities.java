package com.vexrobotics.aimconnector;

import java.io.PrintWriter;
import java.io.StringWriter;

public final class Utilities {
    private Utilities() { }

    static String stackTraceToString(Throwable e) {
        StringWriter sw = new StringWriter();
        PrintWriter pw = new PrintWriter(sw);
        e.printStackTrace(pw);
        return sw.toString();
    }

    public static String bytesToString(byte[] bytes) {
        return bytesToString(bytes, bytes.length);
    }

    // Hex dump of at most the first `limit` bytes.
    public static String bytesToString(byte[] bytes, int limit) {
        StringBuilder result = new StringBuilder();
        result.append("[ ");
        int n = Math.min(limit, bytes.length);
        for (int i = 0; i < n; i++) result.append(Integer.toHexString(bytes[i] & 0xFF)).append(' ');
        if (n < bytes.length) result.append("... ");
        result.append("]");
        return result.toString();
    }

    public static void putIntLE(byte[] dst, int offset, int value) {
        dst[offset] = (byte) value;
        dst[offset + 1] = (byte) (value >> 8);
        dst[offset + 2] = (byte) (value >> 16);
        dst[offset + 3] = (byte) (value >> 24);
    }

    public static int getIntLE(byte[] src, int offset) {
        return (src[offset] & 0xFF)
                | (src[offset + 1] & 0xFF) << 8
                | (src[offset + 2] & 0xFF) << 16
                | (src[offset + 3] & 0xFF) << 24;
    }

    public static int getShortLE(byte[] src, int offset) {
        return (src[offset] & 0xFF) | (src[offset + 1] & 0xFF) << 8;
    }

    /** Parses flag words such as "0x00000462"; the prefix is optional. */
    public static int parseHexFlags(String text) {
        String s = text.trim();
        if (s.startsWith("0x") || s.startsWith("0X")) s = s.substring(2);
        if (s.isEmpty()) return 0;
        return (int) Long.parseLong(s, 16);
    }

    public static String toHexFlags(int flags) {
        return String.format("0x%08x", flags);
    }

    public static void sleepMillis(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
