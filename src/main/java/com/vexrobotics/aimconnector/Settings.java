package com.vexrobotics.aimconnector;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Connection settings read from settings.json:
 * <pre>{ "connection": { "host": "192.168.4.1" } }</pre>
 * The file named by the {@code aim.settings} system property wins over the
 * bundled classpath resource, and {@code aim.host} overrides the host outright.
 */
public final class Settings {
    static final Log LOG = Log.getLogger(Settings.class);

    public static final String DEFAULT_HOST = "192.168.4.1";
    static final String RESOURCE = "/settings.json";

    private final String host;

    public Settings(String host) {
        this.host = host;
    }

    public String getHost() {
        return host;
    }

    public static Settings load() {
        Settings settings = loadFile();
        String override = System.getProperty("aim.host");
        if (override != null && !override.isBlank()) {
            return new Settings(override.trim());
        }
        return settings;
    }

    private static Settings loadFile() {
        String path = System.getProperty("aim.settings");
        if (path != null) {
            Path file = Paths.get(path);
            try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
                return parse(reader);
            } catch (IOException | JsonParseException | IllegalStateException e) {
                LOG.warn("could not read {}: {}", file, e.toString());
            }
        }
        InputStream in = Settings.class.getResourceAsStream(RESOURCE);
        if (in == null) {
            LOG.debug("no {} on the classpath, using {}", RESOURCE, DEFAULT_HOST);
            return new Settings(DEFAULT_HOST);
        }
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return parse(reader);
        } catch (IOException | JsonParseException | IllegalStateException e) {
            LOG.warn("could not read {}: {}", RESOURCE, e.toString());
            return new Settings(DEFAULT_HOST);
        }
    }

    static Settings parse(Reader reader) {
        JsonObject root = JsonParser.parseReader(reader).getAsJsonObject();
        JsonElement connection = root.get("connection");
        if (connection == null || !connection.isJsonObject()) return new Settings(DEFAULT_HOST);
        JsonElement host = connection.getAsJsonObject().get("host");
        if (host == null || host.isJsonNull() || host.getAsString().isBlank()) return new Settings(DEFAULT_HOST);
        return new Settings(host.getAsString().trim());
    }
}
