package com.vexrobotics.aimconnector;

import java.net.URI;

/**
 * The four long-lived WebSocket endpoints the robot serves.
 */
public enum Channel {
    STATUS("ws_status"),
    IMAGE("ws_img"),
    COMMAND("ws_cmd"),
    AUDIO("ws_audio");

    private final String path;

    Channel(String path) {
        this.path = path;
    }

    public String getPath() {
        return path;
    }

    public URI uri(String host) {
        return URI.create("ws://" + host + "/" + path);
    }
}
