package com.vexrobotics.aimconnector;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.StringReader;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Settings")
class SettingsTest {

    @Test
    @DisplayName("the host comes from the connection section")
    void testParse() {
        Settings settings = Settings.parse(new StringReader("{\"connection\":{\"host\":\" 10.0.0.7 \"}}"));
        assertEquals("10.0.0.7", settings.getHost());
    }

    @Test
    @DisplayName("a missing or blank host falls back to the access point address")
    void testDefaults() {
        assertEquals(Settings.DEFAULT_HOST, Settings.parse(new StringReader("{}")).getHost());
        assertEquals(Settings.DEFAULT_HOST, Settings.parse(new StringReader("{\"connection\":{}}")).getHost());
        assertEquals(Settings.DEFAULT_HOST, Settings.parse(new StringReader("{\"connection\":{\"host\":\"\"}}")).getHost());
    }

    @Test
    @DisplayName("the aim.host property overrides the file")
    void testHostProperty() {
        System.setProperty("aim.host", "robot-7.local");
        try {
            assertEquals("robot-7.local", Settings.load().getHost());
        } finally {
            System.clearProperty("aim.host");
        }
    }

    @Test
    @DisplayName("client settings default to the firmware cadence")
    void testClientDefaults() {
        ClientSettings settings = ClientSettings.defaults();

        assertEquals(10000, settings.getBlockTimeoutMillis());
        assertEquals(5, settings.getMaxLostPackets());
        assertEquals(50, settings.getStatusPeriodMillis());
        assertEquals(500, settings.getImageWaitMillis());
        assertEquals(ClientSettings.RejectedCommandPolicy.LOG, settings.getRejectedCommandPolicy());
        assertTrue(settings.isExitOnCancel());
    }
}
