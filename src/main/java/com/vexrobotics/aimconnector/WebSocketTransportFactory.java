package com.vexrobotics.aimconnector;

import org.eclipse.jetty.websocket.client.WebSocketClient;

import java.time.Duration;

/**
 * Creates Jetty backed transports. All channels of one robot share a single
 * {@link WebSocketClient}, started on first use.
 */
public class WebSocketTransportFactory implements TransportFactory {
    static final Log LOG = Log.getLogger(WebSocketTransportFactory.class);

    // Camera frames are JPEGs well above Jetty's 64 KiB default.
    static final long MAX_MESSAGE_BYTES = 4L * 1024 * 1024;

    private WebSocketClient client;

    @Override
    public synchronized ChannelTransport create(Channel channel) {
        if (client == null) {
            WebSocketClient c = new WebSocketClient();
            c.setMaxBinaryMessageSize(MAX_MESSAGE_BYTES);
            c.setMaxTextMessageSize(MAX_MESSAGE_BYTES);
            c.setIdleTimeout(Duration.ofHours(1));
            try {
                c.start();
            } catch (Exception e) {
                throw new AimException("could not start websocket client", e);
            }
            client = c;
        }
        return new WebSocketTransport(client, channel);
    }

    @Override
    public synchronized void shutdown() {
        if (client == null) return;
        try {
            client.stop();
        } catch (Exception e) {
            LOG.warn("websocket client did not stop cleanly: {}", e.toString());
        }
        client = null;
    }
}
