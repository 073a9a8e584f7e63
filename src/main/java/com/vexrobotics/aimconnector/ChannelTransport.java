package com.vexrobotics.aimconnector;

import java.io.IOException;
import java.net.URI;

/**
 * A single reconnectable message connection. Implementations are not required
 * to be thread safe; {@link ChannelWorker} serializes access.
 */
public interface ChannelTransport {

    void connect(URI uri, long timeoutMillis) throws IOException; //open (or reopen) the connection
    boolean isConnected();
    void send(byte[] payload, boolean binary) throws IOException;
    Frame receive(long timeoutMillis) throws IOException; //next inbound frame, IOException on timeout or close
    void close(); //safe to call when already closed

}
