package com.vexrobotics.aimconnector;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

/**
 * Lenient readers for status JSON. The robot sends some numbers as strings
 * ("12.5") and flag words as hex strings ("0x0462"); missing fields read as defaults.
 */
final class JsonFields {
    private JsonFields() { }

    static JsonObject object(JsonObject parent, String key) {
        JsonElement e = parent.get(key);
        return e != null && e.isJsonObject() ? e.getAsJsonObject() : new JsonObject();
    }

    static JsonArray array(JsonObject parent, String key) {
        JsonElement e = parent.get(key);
        return e != null && e.isJsonArray() ? e.getAsJsonArray() : new JsonArray();
    }

    static boolean has(JsonObject parent, String key) {
        JsonElement e = parent.get(key);
        return e != null && !e.isJsonNull();
    }

    static double number(JsonObject o, String key, double def) {
        JsonPrimitive p = primitive(o, key);
        if (p == null) return def;
        if (p.isNumber()) return p.getAsDouble();
        if (p.isBoolean()) return p.getAsBoolean() ? 1 : 0;
        String s = p.getAsString().trim();
        if (s.isEmpty()) return def;
        if (s.startsWith("0x") || s.startsWith("0X")) return Utilities.parseHexFlags(s);
        return Double.parseDouble(s);
    }

    static int integer(JsonObject o, String key, int def) {
        JsonPrimitive p = primitive(o, key);
        if (p == null) return def;
        if (p.isNumber()) return (int) p.getAsDouble();
        return (int) number(o, key, def);
    }

    static int hex(JsonObject o, String key, int def) {
        JsonPrimitive p = primitive(o, key);
        if (p == null) return def;
        if (p.isNumber()) return p.getAsInt();
        return Utilities.parseHexFlags(p.getAsString());
    }

    static String string(JsonObject o, String key, String def) {
        JsonPrimitive p = primitive(o, key);
        return p == null ? def : p.getAsString();
    }

    private static JsonPrimitive primitive(JsonObject o, String key) {
        JsonElement e = o.get(key);
        return e != null && e.isJsonPrimitive() ? e.getAsJsonPrimitive() : null;
    }
}
