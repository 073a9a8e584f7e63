package com.vexrobotics.aimconnector;

import org.eclipse.jetty.websocket.api.Session;
import org.eclipse.jetty.websocket.api.WebSocketAdapter;
import org.eclipse.jetty.websocket.client.WebSocketClient;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.concurrent.*;

/**
 * {@link ChannelTransport} over a Jetty WebSocket session. Inbound frames are
 * queued by the Jetty callbacks and handed out by {@link #receive(long)}.
 */
public class WebSocketTransport implements ChannelTransport {
    static final Log LOG = Log.getLogger(WebSocketTransport.class);

    // Queued when the session ends so that a blocked receive wakes up.
    private static final Frame CLOSED = new Frame(new byte[0], false);

    private final WebSocketClient client;
    private final Channel channel;
    private final BlockingQueue<Frame> inbox = new LinkedBlockingQueue<>();
    private volatile Endpoint endpoint;
    private volatile Session session;

    public WebSocketTransport(WebSocketClient client, Channel channel) {
        this.client = client;
        this.channel = channel;
    }

    @Override
    public void connect(URI uri, long timeoutMillis) throws IOException {
        close();
        inbox.clear();
        Endpoint next = new Endpoint();
        endpoint = next;
        CompletableFuture<Session> future = client.connect(next, uri);
        try {
            session = future.get(timeoutMillis, TimeUnit.MILLISECONDS);
            LOG.debug("{} connected to {}", channel, uri);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new SocketTimeoutException("timed out after " + timeoutMillis + " ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new IOException(cause.getMessage(), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("interrupted while connecting to " + uri);
        }
    }

    @Override
    public boolean isConnected() {
        Session s = session;
        return s != null && s.isOpen();
    }

    @Override
    public void send(byte[] payload, boolean binary) throws IOException {
        Session s = session;
        if (s == null || !s.isOpen()) throw new IOException(channel + " is not connected");
        if (binary) {
            s.getRemote().sendBytes(ByteBuffer.wrap(payload));
        } else {
            s.getRemote().sendString(new String(payload, StandardCharsets.UTF_8));
        }
    }

    @Override
    public Frame receive(long timeoutMillis) throws IOException {
        Frame frame;
        try {
            frame = inbox.poll(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("interrupted while receiving on " + channel);
        }
        if (frame == null) throw new SocketTimeoutException("no frame within " + timeoutMillis + " ms");
        if (frame == CLOSED) {
            inbox.offer(CLOSED);
            throw new IOException(channel + " connection closed");
        }
        return frame;
    }

    @Override
    public void close() {
        Session s = session;
        session = null;
        endpoint = null;
        if (s != null) {
            try {
                s.close();
            } catch (Exception e) {
                LOG.debug("{} close failed: {}", channel, e.toString());
            }
        }
        inbox.offer(CLOSED);
    }

    private class Endpoint extends WebSocketAdapter {
        private boolean current() {
            return endpoint == this;
        }

        @Override
        public void onWebSocketBinary(byte[] payload, int offset, int len) {
            if (current()) inbox.offer(Frame.binary(Arrays.copyOfRange(payload, offset, offset + len)));
        }

        @Override
        public void onWebSocketText(String message) {
            if (current()) inbox.offer(Frame.text(message));
        }

        @Override
        public void onWebSocketClose(int statusCode, String reason) {
            super.onWebSocketClose(statusCode, reason);
            if (current()) {
                LOG.debug("{} closed ({}): {}", channel, statusCode, reason);
                inbox.offer(CLOSED);
            }
        }

        @Override
        public void onWebSocketError(Throwable cause) {
            if (current()) {
                LOG.debug("{} error: {}", channel, cause.toString());
                inbox.offer(CLOSED);
            }
        }
    }
}
