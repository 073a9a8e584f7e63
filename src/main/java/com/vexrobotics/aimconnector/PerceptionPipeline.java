package com.vexrobotics.aimconnector;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Turns the detections of a status snapshot into ranked objects: decode every
 * detection, keep those matching any of the descriptors, order them by area
 * (largest first, equal areas in the order the sensor reported them) and
 * truncate to the requested count. The largest match and the returned count
 * are kept for {@link #largestObject()} and {@link #objectCount()}.
 */
public class PerceptionPipeline {
    static final Log LOG = Log.getLogger(PerceptionPipeline.class);

    public static final int MAX_OBJECTS = 24;
    public static final int DEFAULT_COUNT = 8;

    private DetectedObject largest;
    private int count;

    /**
     * @throws AimException if no descriptor is given
     */
    public synchronized List<DetectedObject> query(VisionStatus vision, List<? extends Descriptor> descriptors, int maxCount) {
        if (descriptors.isEmpty()) throw new AimException("no descriptor passed to get_data");
        int limit = Math.max(0, Math.min(maxCount, MAX_OBJECTS));

        List<DetectedObject> ranked = new ArrayList<>();
        for (RawDetection raw : vision.getDetections()) {
            if (!matchesAny(raw, descriptors)) continue;
            insertByArea(ranked, DetectedObject.decode(raw, vision));
        }

        largest = ranked.isEmpty() ? null : ranked.get(0);
        count = Math.min(ranked.size(), limit);
        LOG.debug("{} of {} detections matched {}, returning {}", ranked.size(), vision.getDetections().size(), descriptors, count);
        return Collections.unmodifiableList(new ArrayList<>(ranked.subList(0, count)));
    }

    private static boolean matchesAny(RawDetection raw, List<? extends Descriptor> descriptors) {
        for (Descriptor descriptor : descriptors) {
            if (descriptor.matches(raw.getType(), raw.getId())) return true;
        }
        return false;
    }

    // Insert before the first strictly smaller object, so ties stay in arrival order.
    private static void insertByArea(List<DetectedObject> ranked, DetectedObject object) {
        int area = object.getArea();
        int i = 0;
        while (i < ranked.size() && ranked.get(i).getArea() >= area) i++;
        ranked.add(i, object);
    }

    /** Largest match of the last query, or null when it matched nothing. */
    public synchronized DetectedObject largestObject() {
        return largest;
    }

    /** Number of objects the last query returned. */
    public synchronized int objectCount() {
        return count;
    }
}
