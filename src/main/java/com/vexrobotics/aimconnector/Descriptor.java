package com.vexrobotics.aimconnector;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Selects detections for {@link PerceptionPipeline}: a detection matches when
 * its type bit is in the descriptor's kind mask and its id equals the
 * descriptor's id, or the descriptor id is {@link #WILDCARD}.
 */
public abstract class Descriptor {
    public static final int WILDCARD = 0xFFFF;

    private final int id;

    protected Descriptor(int id) {
        this.id = id;
    }

    public int getId() {
        return id;
    }

    public abstract int kindMask();

    public boolean matches(int type, int objectId) {
        return (type & kindMask()) != 0 && (id == WILDCARD || id == objectId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return id == ((Descriptor) o).id;
    }

    @Override
    public int hashCode() {
        return 31 * getClass().hashCode() + id;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + (id == WILDCARD ? "*" : String.valueOf(id)) + ")";
    }

    /** A color signature configured on the sensor (index 1 to 7). */
    public static class Color extends Descriptor {
        private final int red;
        private final int green;
        private final int blue;
        private final double hueRange;
        private final double saturationRange;

        public Color(int id, int red, int green, int blue, double hueRange, double saturationRange) {
            super(id);
            this.red = red;
            this.green = green;
            this.blue = blue;
            this.hueRange = hueRange;
            this.saturationRange = saturationRange;
        }

        @Override
        public int kindMask() {
            return ObjectKind.COLOR.mask();
        }

        public int getRed() { return red; }
        public int getGreen() { return green; }
        public int getBlue() { return blue; }
        public double getHueRange() { return hueRange; }
        public double getSaturationRange() { return saturationRange; }
    }

    /** A color code: two to five color signatures seen side by side (index 1 to 5). */
    public static class Code extends Descriptor {
        private final List<Color> colors;

        public Code(int id, Color first, Color second, Color... more) {
            super(id);
            if (more.length > 3) throw new IllegalArgumentException("a color code has at most 5 colors");
            List<Color> all = new ArrayList<>();
            all.add(first);
            all.add(second);
            all.addAll(Arrays.asList(more));
            colors = Collections.unmodifiableList(all);
        }

        @Override
        public int kindMask() {
            return ObjectKind.CODE.mask();
        }

        public List<Color> getColors() {
            return colors;
        }
    }

    /** An AprilTag id. */
    public static class Tag extends Descriptor {
        public Tag(int id) {
            super(id);
        }

        @Override
        public int kindMask() {
            return ObjectKind.TAG.mask();
        }
    }

    /** A class of the on-board AI model (sports ball, barrels, robot). */
    public static class Model extends Descriptor {
        public Model(int id) {
            super(id);
        }

        @Override
        public int kindMask() {
            return ObjectKind.MODEL.mask();
        }
    }

    /** Any known kind of detection with the given id. */
    public static class Any extends Descriptor {
        public Any(int id) {
            super(id);
        }

        @Override
        public int kindMask() {
            return ObjectKind.ALL_MASK;
        }
    }
}
