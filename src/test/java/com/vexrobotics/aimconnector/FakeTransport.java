package com.vexrobotics.aimconnector;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * In-memory channel. Frames queued with {@link #push} are returned by receive;
 * an optional responder produces the reply to every sent frame.
 */
class FakeTransport implements ChannelTransport {
    final BlockingQueue<Frame> inbox = new LinkedBlockingQueue<>();
    final List<byte[]> sent = new CopyOnWriteArrayList<>();
    final AtomicInteger connects = new AtomicInteger();

    volatile boolean connected = false;
    volatile boolean refuseConnect = false;
    volatile boolean failSend = false;
    volatile Function<byte[], Frame> responder;

    @Override
    public void connect(URI uri, long timeoutMillis) throws IOException {
        if (refuseConnect) throw new ConnectException("Connection refused");
        connected = true;
        connects.incrementAndGet();
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Override
    public void send(byte[] payload, boolean binary) throws IOException {
        if (!connected || failSend) throw new IOException("socket is closed");
        sent.add(payload.clone());
        Function<byte[], Frame> r = responder;
        if (r != null) {
            Frame reply = r.apply(payload);
            if (reply != null) inbox.add(reply);
        }
    }

    @Override
    public Frame receive(long timeoutMillis) throws IOException {
        if (!connected) throw new IOException("socket is closed");
        try {
            Frame frame = inbox.poll(timeoutMillis, TimeUnit.MILLISECONDS);
            if (frame == null) throw new SocketTimeoutException("no frame within " + timeoutMillis + " ms");
            return frame;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("interrupted");
        }
    }

    @Override
    public void close() {
        connected = false;
    }

    void push(String text) {
        inbox.add(Frame.text(text));
    }

    String sentText(int index) {
        return new String(sent.get(index), StandardCharsets.UTF_8);
    }
}
