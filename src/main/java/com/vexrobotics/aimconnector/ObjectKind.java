package com.vexrobotics.aimconnector;

/**
 * Detection categories reported by the AI vision sensor, as type bits.
 */
public enum ObjectKind {
    UNKNOWN(0),
    COLOR(1 << 0),
    CODE(1 << 1),
    MODEL(1 << 2),
    TAG(1 << 3);

    /** Mask matching every kind of detection. */
    public static final int ALL_MASK = 0x3F;

    private final int mask;

    ObjectKind(int mask) {
        this.mask = mask;
    }

    public int mask() {
        return mask;
    }

    public static ObjectKind of(int type) {
        for (ObjectKind kind : values()) {
            if (kind.mask == type) return kind;
        }
        return UNKNOWN;
    }
}
