package com.vexrobotics.aimconnector;

import java.util.function.Consumer;

/**
 * Receives the camera stream into an {@link ImageBuffer}. Streaming is switched
 * on and off with one byte control frames; a dropped connection switches it off.
 */
public class ImageWorker extends ChannelWorker {
    static final Log LOG = Log.getLogger(ImageWorker.class);

    static final byte[] STREAM_ON = { 1 };
    static final byte[] STREAM_OFF = { 0 };

    private final ImageBuffer buffer = new ImageBuffer();
    private volatile boolean streaming = false;
    private volatile Consumer<byte[]> frameListener;

    public ImageWorker(String host, ChannelTransport transport, ClientSettings settings, CancellationToken token) {
        super(Channel.IMAGE, host, transport, settings, token);
    }

    public void startStream() {
        streaming = true;
        send(STREAM_ON, true);
        LOG.debug("stream started");
    }

    public void stopStream() {
        streaming = false;
        send(STREAM_OFF, true);
        LOG.debug("stream stopped");
    }

    public boolean isStreaming() {
        return streaming;
    }

    public ImageBuffer getBuffer() {
        return buffer;
    }

    public void setFrameListener(Consumer<byte[]> listener) {
        frameListener = listener;
    }

    @Override
    protected long dutyCycle() {
        if (!streaming) return settings.getImageIdleMillis();
        receiveFrame();
        return 0;
    }

    void receiveFrame() {
        byte[] frame;
        try {
            frame = receive().getData();
        } catch (ReceiveErrorException e) {
            LOG.debug("frame lost: {}", e.getMessage());
            buffer.publishMissing();
            return;
        }
        buffer.publish(frame);
        Consumer<byte[]> listener = frameListener;
        if (listener != null) {
            try {
                listener.accept(frame);
            } catch (RuntimeException e) {
                LOG.error("frame listener failed: {}", e.toString(), e);
            }
        }
    }

    @Override
    protected void onDisconnected() {
        if (streaming) LOG.info("image stream interrupted by disconnect");
        streaming = false;
    }
}
