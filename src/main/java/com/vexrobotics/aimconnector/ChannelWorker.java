package com.vexrobotics.aimconnector;

import java.io.IOException;
import java.net.URI;

/**
 * Background thread that owns one channel connection. The loop resets a
 * connection that failed, reconnects while disconnected and otherwise runs the
 * subclass duty cycle. It is the only place that reconnects; send and receive
 * never retry, they flag the connection for reset and throw.
 */
public abstract class ChannelWorker extends Thread {
    static final Log LOG = Log.getLogger(ChannelWorker.class);

    private static final class IoLock { }

    // Serializes every operation on the connection.
    protected final Object ioLock = new IoLock();

    protected final Channel channel;
    protected final URI uri;
    protected final ChannelTransport transport;
    protected final ClientSettings settings;
    protected final CancellationToken token;

    private volatile boolean needsReset = false;
    private volatile boolean running = true;

    protected ChannelWorker(Channel channel, String host, ChannelTransport transport,
                            ClientSettings settings, CancellationToken token) {
        super("aim-" + channel.getPath());
        setDaemon(true);
        this.channel = channel;
        this.uri = channel.uri(host);
        this.transport = transport;
        this.settings = settings;
        this.token = token;
    }

    public Channel getChannel() {
        return channel;
    }

    public URI getUri() {
        return uri;
    }

    /**
     * First connection attempt, made before the worker thread starts.
     *
     * @throws DisconnectedException if the robot cannot be reached in time
     */
    public void connect(long timeoutMillis) {
        synchronized (ioLock) {
            try {
                transport.connect(uri, timeoutMillis);
                needsReset = false;
            } catch (IOException e) {
                throw new DisconnectedException(String.format("Could not connect to %s (reason: %s)", uri, e.getMessage()), e);
            }
        }
    }

    public boolean isConnected() {
        return !needsReset && transport.isConnected();
    }

    /**
     * @throws DisconnectedException if the frame could not be written
     */
    public void send(byte[] payload, boolean binary) {
        synchronized (ioLock) {
            try {
                transport.send(payload, binary);
            } catch (IOException e) {
                needsReset = true;
                throw new DisconnectedException(String.format("%s: error sending data to robot, apparently disconnected, will try to reconnect; error: '%s'",
                        channel.getPath(), e.getMessage()), e);
            }
        }
    }

    /**
     * Waits up to the receive timeout for the next frame.
     *
     * @throws ReceiveErrorException on timeout or a broken connection
     */
    public Frame receive() {
        synchronized (ioLock) {
            try {
                return transport.receive(settings.getReceiveTimeoutMillis());
            } catch (IOException e) {
                needsReset = true;
                throw new ReceiveErrorException(String.format("%s: error receiving data from robot, apparently disconnected, will try to reconnect; error: '%s'",
                        channel.getPath(), e.getMessage()), e);
            }
        }
    }

    public void close() {
        synchronized (ioLock) {
            transport.close();
        }
    }

    /** Stops the loop after the current cycle. */
    public void shutdown() {
        running = false;
        interrupt();
    }

    public boolean isRunning() {
        return running && !token.isCancelled();
    }

    @Override
    public void run() {
        LOG.debug("{} worker started", channel);
        while (isRunning()) {
            long pause;
            try {
                if (needsReset) {
                    close();
                    needsReset = false;
                }
                if (transport.isConnected()) {
                    pause = dutyCycle();
                } else {
                    onDisconnected();
                    pause = reconnect() ? 0 : settings.getReconnectDelayMillis();
                }
            } catch (RuntimeException e) {
                LOG.error("{} cycle failed: {}", channel, e.toString(), e);
                pause = settings.getReconnectDelayMillis();
            }
            if (pause > 0 && isRunning()) {
                try {
                    Thread.sleep(pause);
                } catch (InterruptedException e) {
                    LOG.debug("{} pause interrupted", channel);
                }
            }
        }
        close();
        LOG.debug("{} worker stopped", channel);
    }

    private boolean reconnect() {
        LOG.info("{} reconnecting", channel.getPath());
        synchronized (ioLock) {
            try {
                transport.connect(uri, settings.getConnectTimeoutMillis());
                needsReset = false;
                return true;
            } catch (IOException e) {
                LOG.debug("{} reconnect failed: {}", channel, e.getMessage());
            }
        }
        onReconnectFailed();
        return false;
    }

    /**
     * One iteration of work while connected.
     *
     * @return milliseconds to pause before the next iteration
     */
    protected abstract long dutyCycle();

    protected void onDisconnected() { }

    protected void onReconnectFailed() { }
}
