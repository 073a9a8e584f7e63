package com.vexrobotics.aimconnector;

/**
 * A detection decoded for use by programs: geometry in camera pixels, area, and
 * bearing in degrees relative to the robot's heading. Subclasses add what their
 * kind of detection carries.
 */
public abstract class DetectedObject {
    private final int id;
    private final int originX;
    private final int originY;
    private final int width;
    private final int height;
    private final int centerX;
    private final int centerY;
    private final double bearing;

    protected DetectedObject(RawDetection raw) {
        id = raw.getId();
        originX = raw.getOriginX();
        originY = raw.getOriginY();
        width = raw.getWidth();
        height = raw.getHeight();
        centerX = (int) (originX + width / 2.0);
        centerY = (int) (originY + height / 2.0);
        bearing = bearing(centerX, centerY);
    }

    /**
     * Camera calibration fit from pixel center to bearing in degrees.
     */
    public static double bearing(int cx, int cy) {
        return -34.656 + (cx * 0.22539) + (cy * 0.011526) + (cx * cx * -0.000042011)
                + (cx * cy * 0.000010433) + (cy * cy * -0.00007073);
    }

    static DetectedObject decode(RawDetection raw, VisionStatus vision) {
        switch (ObjectKind.of(raw.getType())) {
            case COLOR:
                return new ColorObject(raw);
            case CODE:
                return new CodeObject(raw);
            case MODEL:
                return new ModelObject(raw, vision.className(raw.getId()));
            case TAG:
                return new TagObject(raw);
            default:
                return new UnknownObject(raw, raw.getType());
        }
    }

    public abstract ObjectKind getKind();

    public int getId() { return id; }
    public int getOriginX() { return originX; }
    public int getOriginY() { return originY; }
    public int getWidth() { return width; }
    public int getHeight() { return height; }
    public int getCenterX() { return centerX; }
    public int getCenterY() { return centerY; }
    public double getBearing() { return bearing; }

    public int getArea() {
        return width * height;
    }

    /** Rotation in degrees; zero for kinds that do not report one. */
    public double getAngle() {
        return 0;
    }

    @Override
    public String toString() {
        return String.format("%s[id=%d, origin=(%d,%d), size=%dx%d, bearing=%.2f]",
                getClass().getSimpleName(), id, originX, originY, width, height, bearing);
    }

    public static class ColorObject extends DetectedObject {
        private final double angle;

        ColorObject(RawDetection raw) {
            super(raw);
            angle = raw.getAngle() * 0.01;
        }

        @Override
        public ObjectKind getKind() {
            return ObjectKind.COLOR;
        }

        @Override
        public double getAngle() {
            return angle;
        }
    }

    public static class CodeObject extends DetectedObject {
        private final double angle;

        CodeObject(RawDetection raw) {
            super(raw);
            angle = raw.getAngle() * 0.01;
        }

        @Override
        public ObjectKind getKind() {
            return ObjectKind.CODE;
        }

        @Override
        public double getAngle() {
            return angle;
        }
    }

    public static class ModelObject extends DetectedObject {
        private final String className;
        private final double score;

        ModelObject(RawDetection raw, String className) {
            super(raw);
            this.className = className;
            this.score = raw.getScore();
        }

        @Override
        public ObjectKind getKind() {
            return ObjectKind.MODEL;
        }

        public String getClassName() {
            return className;
        }

        public double getScore() {
            return score;
        }
    }

    public static class TagObject extends DetectedObject {
        private final int[] cornersX;
        private final int[] cornersY;

        TagObject(RawDetection raw) {
            super(raw);
            cornersX = raw.getCornersX();
            cornersY = raw.getCornersY();
        }

        @Override
        public ObjectKind getKind() {
            return ObjectKind.TAG;
        }

        /** Corner x coordinates, in the order the sensor reports them. */
        public int[] getCornersX() {
            return cornersX.clone();
        }

        public int[] getCornersY() {
            return cornersY.clone();
        }
    }

    public static class UnknownObject extends DetectedObject {
        private final int type;

        UnknownObject(RawDetection raw, int type) {
            super(raw);
            this.type = type;
        }

        @Override
        public ObjectKind getKind() {
            return ObjectKind.UNKNOWN;
        }

        public int getType() {
            return type;
        }
    }
}
