package com.vexrobotics.aimconnector;

/**
 * Audio upload channel. Uploads are fire-and-forget binary frames; the robot
 * sends nothing back.
 */
public class AudioWorker extends ChannelWorker {
    static final Log LOG = Log.getLogger(AudioWorker.class);

    static final int MAX_PAYLOAD_BYTES = SoundUpload.HEADER_BYTES + SoundUpload.MAX_DATA_BYTES;

    public AudioWorker(String host, ChannelTransport transport, ClientSettings settings, CancellationToken token) {
        super(Channel.AUDIO, host, transport, settings, token);
    }

    @Override
    protected long dutyCycle() {
        return settings.getCommandCycleMillis();
    }

    /**
     * @throws IllegalArgumentException if the payload exceeds the robot's upload limit
     * @throws DisconnectedException if the frame could not be sent
     */
    public void sendAudio(byte[] payload) {
        if (payload.length > MAX_PAYLOAD_BYTES) {
            throw new IllegalArgumentException(String.format("audio payload of %d bytes exceeds the %d byte limit", payload.length, MAX_PAYLOAD_BYTES));
        }
        LOG.debug("uploading {} bytes {}", payload.length, Utilities.bytesToString(payload, 12));
        send(payload, true);
    }
}
