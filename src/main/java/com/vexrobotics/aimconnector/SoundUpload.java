package com.vexrobotics.aimconnector;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Builds the audio channel upload for a local WAV or MP3 file: a 64 byte
 * header followed by the file contents.
 * <pre>
 *  0      format (0 = wav, 1 = mp3)
 *  1      volume
 *  4..7   data length, little endian
 *  8..11  chunk index, always 0
 *  32..63 file name, ASCII, at most 32 bytes
 * </pre>
 */
public final class SoundUpload {
    static final Log LOG = Log.getLogger(SoundUpload.class);

    public static final int HEADER_BYTES = 64;
    public static final int MAX_DATA_BYTES = 255 * 1024;
    static final int NAME_OFFSET = 32;
    static final int NAME_BYTES = 32;

    public enum Format { WAV, MP3 }

    private final Format format;
    private final String name;
    private final int volume;
    private final byte[] data;

    private SoundUpload(Format format, String name, int volume, byte[] data) {
        this.format = format;
        this.name = name;
        this.volume = volume;
        this.data = data;
    }

    /**
     * @throws InvalidSoundFileException if the file is missing, too big, or not a usable WAV/MP3
     */
    public static SoundUpload fromFile(Path file, int volume) {
        String name = file.getFileName().toString();
        Format format = formatOf(name);
        long size;
        byte[] data;
        try {
            size = Files.size(file);
            if (size > MAX_DATA_BYTES) throw tooBig(size);
            data = Files.readAllBytes(file);
        } catch (IOException e) {
            throw new InvalidSoundFileException("could not read " + file + ": " + e.getMessage(), e);
        }
        return of(format, name, volume, data);
    }

    /**
     * @throws InvalidSoundFileException if the data is too big or not a usable WAV
     */
    public static SoundUpload of(Format format, String name, int volume, byte[] data) {
        if (data.length > MAX_DATA_BYTES) throw tooBig(data.length);
        if (format == Format.WAV) checkWave(name, data);
        return new SoundUpload(format, name, Math.max(0, Math.min(255, volume)), data);
    }

    static Format formatOf(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".wav")) return Format.WAV;
        if (lower.endsWith(".mp3")) return Format.MP3;
        int dot = name.lastIndexOf('.');
        String extension = dot < 0 ? "" : name.substring(dot);
        throw new InvalidSoundFileException("extension is " + extension + "; expected extension to be wav or mp3");
    }

    private static void checkWave(String name, byte[] data) {
        if (data.length < 24
                || !"RIFF".equals(new String(data, 0, 4, StandardCharsets.US_ASCII))
                || !"WAVE".equals(new String(data, 8, 4, StandardCharsets.US_ASCII))) {
            throw new InvalidSoundFileException("file extension was .wav but does not appear to actually be a WAVE file");
        }
        int channels = Utilities.getShortLE(data, 22);
        if (channels > 2) {
            throw new InvalidSoundFileException("only mono or stereo is supported, detected " + channels + " channels.");
        }
        if (channels == 2) LOG.warn("{} is stereo; mono is recommended", name);
    }

    private static InvalidSoundFileException tooBig(long size) {
        return new InvalidSoundFileException(String.format(Locale.ROOT,
                "file size of %d bytes is too big; max size allowed is %d bytes (%.1f kB)",
                size, MAX_DATA_BYTES, MAX_DATA_BYTES / 1024.0));
    }

    public byte[] encode() {
        byte[] packet = new byte[HEADER_BYTES + data.length];
        packet[0] = (byte) (format == Format.WAV ? 0 : 1);
        packet[1] = (byte) volume;
        Utilities.putIntLE(packet, 4, data.length);
        Utilities.putIntLE(packet, 8, 0);
        byte[] nameBytes = name.getBytes(StandardCharsets.US_ASCII);
        System.arraycopy(nameBytes, 0, packet, NAME_OFFSET, Math.min(NAME_BYTES, nameBytes.length));
        System.arraycopy(data, 0, packet, HEADER_BYTES, data.length);
        return packet;
    }

    public Format getFormat() {
        return format;
    }

    public String getName() {
        return name;
    }

    public int getVolume() {
        return volume;
    }

    public int getDataLength() {
        return data.length;
    }
}
