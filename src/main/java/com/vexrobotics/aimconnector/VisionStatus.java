package com.vexrobotics.aimconnector;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import java.util.*;

/**
 * The "aivision" section of a status snapshot: the model class-name table and
 * the detections of the latest camera frame.
 */
public final class VisionStatus {

    static final Map<Integer, String> DEFAULT_CLASS_NAMES;
    static {
        Map<Integer, String> names = new LinkedHashMap<>();
        names.put(0, "SportsBall");
        names.put(1, "BlueBarrel");
        names.put(2, "OrangeBarrel");
        names.put(3, "Robot");
        DEFAULT_CLASS_NAMES = Collections.unmodifiableMap(names);
    }

    public static final VisionStatus EMPTY = new VisionStatus(DEFAULT_CLASS_NAMES, Collections.<RawDetection>emptyList());

    private final Map<Integer, String> classNames;
    private final List<RawDetection> detections;

    public VisionStatus(Map<Integer, String> classNames, List<RawDetection> detections) {
        this.classNames = Collections.unmodifiableMap(new LinkedHashMap<>(classNames));
        this.detections = Collections.unmodifiableList(new ArrayList<>(detections));
    }

    static VisionStatus from(JsonObject aivision) {
        Map<Integer, String> names = new LinkedHashMap<>();
        JsonArray nameItems = JsonFields.array(JsonFields.object(aivision, "classnames"), "items");
        for (int i = 0; i < nameItems.size(); i++) {
            JsonElement item = nameItems.get(i);
            if (item.isJsonObject()) names.put(i, JsonFields.string(item.getAsJsonObject(), "name", ""));
        }
        if (names.isEmpty()) names.putAll(DEFAULT_CLASS_NAMES);

        JsonObject objects = JsonFields.object(aivision, "objects");
        JsonArray items = JsonFields.array(objects, "items");
        int count = Math.min(JsonFields.integer(objects, "count", items.size()), items.size());
        List<RawDetection> detections = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            JsonElement item = items.get(i);
            if (item.isJsonObject()) detections.add(RawDetection.from(item.getAsJsonObject()));
        }
        return new VisionStatus(names, detections);
    }

    /** Class name for a model id, or the empty string when the table has no entry. */
    public String className(int id) {
        String name = classNames.get(id);
        return name == null ? "" : name;
    }

    public Map<Integer, String> getClassNames() {
        return classNames;
    }

    public List<RawDetection> getDetections() {
        return detections;
    }
}
