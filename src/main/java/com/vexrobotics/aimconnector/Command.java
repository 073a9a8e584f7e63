package com.vexrobotics.aimconnector;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/**
 * A device command: a {@code cmd_id} plus its parameters, encoded as one
 * compact JSON object.
 */
public final class Command {
    private static final Gson GSON = new Gson();

    private final String id;
    private final JsonObject params = new JsonObject();

    public Command(String id) {
        this.id = id;
    }

    public Command with(String name, Number value) {
        params.addProperty(name, value);
        return this;
    }

    public Command with(String name, String value) {
        params.addProperty(name, value);
        return this;
    }

    public Command with(String name, boolean value) {
        params.addProperty(name, value);
        return this;
    }

    public Command with(String name, JsonElement value) {
        params.add(name, value);
        return this;
    }

    public String getId() {
        return id;
    }

    public JsonElement get(String name) {
        return params.get(name);
    }

    public JsonObject toJsonObject() {
        JsonObject json = new JsonObject();
        json.addProperty("cmd_id", id);
        for (String key : params.keySet()) json.add(key, params.get(key));
        return json;
    }

    public String toJson() {
        return GSON.toJson(toJsonObject());
    }

    @Override
    public String toString() {
        return toJson();
    }
}
