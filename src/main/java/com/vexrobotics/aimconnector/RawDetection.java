package com.vexrobotics.aimconnector;

import com.google.gson.JsonObject;

/**
 * One entry of the AI vision "objects" list, as reported by the robot.
 */
public final class RawDetection {
    private final int type;
    private final int id;
    private final int originX;
    private final int originY;
    private final int width;
    private final int height;
    private final int angle;
    private final double score;
    private final int[] cornersX;
    private final int[] cornersY;

    public RawDetection(int type, int id, int originX, int originY, int width, int height) {
        this(type, id, originX, originY, width, height, 0, 0, new int[4], new int[4]);
    }

    public RawDetection(int type, int id, int originX, int originY, int width, int height,
                        int angle, double score, int[] cornersX, int[] cornersY) {
        this.type = type;
        this.id = id;
        this.originX = originX;
        this.originY = originY;
        this.width = width;
        this.height = height;
        this.angle = angle;
        this.score = score;
        this.cornersX = cornersX.clone();
        this.cornersY = cornersY.clone();
    }

    static RawDetection from(JsonObject item) {
        int[] xs = new int[4];
        int[] ys = new int[4];
        for (int i = 0; i < 4; i++) {
            xs[i] = JsonFields.integer(item, "x" + i, 0);
            ys[i] = JsonFields.integer(item, "y" + i, 0);
        }
        return new RawDetection(
                JsonFields.integer(item, "type", 0),
                JsonFields.integer(item, "id", 0),
                JsonFields.integer(item, "originx", 0),
                JsonFields.integer(item, "originy", 0),
                JsonFields.integer(item, "width", 0),
                JsonFields.integer(item, "height", 0),
                JsonFields.integer(item, "angle", 0),
                JsonFields.number(item, "score", 0),
                xs, ys);
    }

    public int getType() { return type; }
    public int getId() { return id; }
    public int getOriginX() { return originX; }
    public int getOriginY() { return originY; }
    public int getWidth() { return width; }
    public int getHeight() { return height; }
    /** Rotation in hundredths of a degree. */
    public int getAngle() { return angle; }
    public double getScore() { return score; }
    public int[] getCornersX() { return cornersX.clone(); }
    public int[] getCornersY() { return cornersY.clone(); }
}
