package com.vexrobotics.aimconnector;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Predefined descriptors for {@link AiVision#getData}.
 */
public final class VisionObjects {
    private VisionObjects() { }

    public static final Descriptor.Model SPORTS_BALL = new Descriptor.Model(0);
    public static final Descriptor.Model BLUE_BARREL = new Descriptor.Model(1);
    public static final Descriptor.Model ORANGE_BARREL = new Descriptor.Model(2);
    public static final Descriptor.Model AIM_ROBOT = new Descriptor.Model(3);

    public static final Descriptor.Tag ALL_TAGS = new Descriptor.Tag(Descriptor.WILDCARD);
    public static final Descriptor.Color ALL_COLORS = new Descriptor.Color(Descriptor.WILDCARD, 0, 0, 0, 0, 0);
    public static final Descriptor.Code ALL_CODES = new Descriptor.Code(Descriptor.WILDCARD, ALL_COLORS, ALL_COLORS);
    public static final Descriptor.Model ALL_MODELS = new Descriptor.Model(Descriptor.WILDCARD);
    public static final Descriptor.Any ALL_VISION = new Descriptor.Any(Descriptor.WILDCARD);

    public static final List<Descriptor> COLORS_AND_CODES = Collections.unmodifiableList(Arrays.<Descriptor>asList(ALL_COLORS, ALL_CODES));
    public static final List<Descriptor> ALL_CARGO = Collections.unmodifiableList(Arrays.<Descriptor>asList(SPORTS_BALL, BLUE_BARREL, ORANGE_BARREL));

    public static final int TAG_COUNT = 38;
    private static final Descriptor.Tag[] TAGS = new Descriptor.Tag[TAG_COUNT];
    static {
        for (int i = 0; i < TAG_COUNT; i++) TAGS[i] = new Descriptor.Tag(i);
    }

    /** AprilTag descriptor for ids 0 to 37. */
    public static Descriptor.Tag tag(int id) {
        if (id < 0 || id >= TAG_COUNT) throw new IllegalArgumentException("tag id must be between 0 and " + (TAG_COUNT - 1));
        return TAGS[id];
    }
}
