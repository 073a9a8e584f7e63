package com.vexrobotics.aimconnector;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

/**
 * One decoded status message from the robot. Snapshots are immutable; the
 * status worker replaces the current one wholesale.
 */
public final class StatusSnapshot {

    /** Stands for "no status yet" or "status lost". Compare by identity. */
    public static final StatusSnapshot EMPTY = new StatusSnapshot(new JsonObject());

    // controller
    private final int controllerFlags;
    private final double stickX;
    private final double stickY;
    private final int controllerBattery;

    // robot
    private final int robotFlags;
    private final int battery;
    private final int touchFlags;
    private final double touchX;
    private final double touchY;
    private final double robotX;
    private final double robotY;
    private final double roll;
    private final double pitch;
    private final double yaw;
    private final double heading;
    private final double rotation;
    private final double[] acceleration;
    private final double[] gyroRate;
    private final int screenRow;
    private final int screenColumn;

    private final VisionStatus vision;

    private StatusSnapshot(JsonObject root) {
        JsonObject controller = JsonFields.object(root, "controller");
        controllerFlags = JsonFields.hex(controller, "flags", 0);
        stickX = JsonFields.number(controller, "stick_x", 0);
        stickY = JsonFields.number(controller, "stick_y", 0);
        controllerBattery = JsonFields.integer(controller, "battery", 0);

        JsonObject robot = JsonFields.object(root, "robot");
        robotFlags = JsonFields.hex(robot, "flags", 0);
        battery = JsonFields.integer(robot, "battery", 0);
        touchFlags = JsonFields.hex(robot, "touch_flags", 0);
        touchX = JsonFields.number(robot, "touch_x", 0);
        touchY = JsonFields.number(robot, "touch_y", 0);
        robotX = JsonFields.number(robot, "robot_x", 0);
        robotY = JsonFields.number(robot, "robot_y", 0);
        roll = JsonFields.number(robot, "roll", 0);
        pitch = JsonFields.number(robot, "pitch", 0);
        yaw = JsonFields.number(robot, "yaw", 0);
        heading = JsonFields.number(robot, "heading", 0);
        rotation = JsonFields.number(robot, "rotation", 0);
        acceleration = vector(JsonFields.object(robot, "acceleration"));
        gyroRate = vector(JsonFields.object(robot, "gyro_rate"));
        JsonObject screen = JsonFields.object(robot, "screen");
        screenRow = JsonFields.integer(screen, "row", 1);
        screenColumn = JsonFields.integer(screen, "column", 1);

        vision = VisionStatus.from(JsonFields.object(root, "aivision"));
    }

    private StatusSnapshot(StatusSnapshot source, int robotFlags) {
        controllerFlags = source.controllerFlags;
        stickX = source.stickX;
        stickY = source.stickY;
        controllerBattery = source.controllerBattery;
        this.robotFlags = robotFlags;
        battery = source.battery;
        touchFlags = source.touchFlags;
        touchX = source.touchX;
        touchY = source.touchY;
        robotX = source.robotX;
        robotY = source.robotY;
        roll = source.roll;
        pitch = source.pitch;
        yaw = source.yaw;
        heading = source.heading;
        rotation = source.rotation;
        acceleration = source.acceleration;
        gyroRate = source.gyroRate;
        screenRow = source.screenRow;
        screenColumn = source.screenColumn;
        vision = source.vision;
    }

    private static double[] vector(JsonObject o) {
        return new double[] {
                JsonFields.number(o, "x", 0),
                JsonFields.number(o, "y", 0),
                JsonFields.number(o, "z", 0)
        };
    }

    /**
     * Decodes a status message.
     *
     * @throws JsonParseException when the text is not a status object
     */
    public static StatusSnapshot parse(String json) {
        JsonElement element;
        try {
            element = JsonParser.parseString(json);
        } catch (JsonParseException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new JsonParseException("malformed status: " + e.getMessage(), e);
        }
        if (!element.isJsonObject()) throw new JsonParseException("status is not a JSON object");
        JsonObject root = element.getAsJsonObject();
        if (!JsonFields.has(root, "robot")) throw new JsonParseException("status has no robot section");
        try {
            return new StatusSnapshot(root);
        } catch (RuntimeException e) {
            throw new JsonParseException("malformed status field: " + e.getMessage(), e);
        }
    }

    public boolean isEmpty() {
        return this == EMPTY;
    }

    public StatusSnapshot withRobotFlags(int flags) {
        if (flags == robotFlags) return this;
        return new StatusSnapshot(this, flags);
    }

    public boolean has(RobotFlag flag) {
        return flag.isSetIn(robotFlags);
    }

    public boolean isScreenPressed() {
        return (touchFlags & 0x0001) != 0;
    }

    public int getControllerFlags() { return controllerFlags; }
    public double getStickX() { return stickX; }
    public double getStickY() { return stickY; }
    public int getControllerBattery() { return controllerBattery; }
    public int getRobotFlags() { return robotFlags; }
    public int getBattery() { return battery; }
    public int getTouchFlags() { return touchFlags; }
    public double getTouchX() { return touchX; }
    public double getTouchY() { return touchY; }
    public double getRobotX() { return robotX; }
    public double getRobotY() { return robotY; }
    public double getRoll() { return roll; }
    public double getPitch() { return pitch; }
    public double getYaw() { return yaw; }
    public double getHeading() { return heading; }
    public double getRotation() { return rotation; }
    public double getAcceleration(int axis) { return acceleration[axis]; }
    public double getGyroRate(int axis) { return gyroRate[axis]; }
    public int getScreenRow() { return screenRow; }
    public int getScreenColumn() { return screenColumn; }
    public VisionStatus getVision() { return vision; }

    @Override
    public String toString() {
        if (isEmpty()) return "StatusSnapshot[empty]";
        return "StatusSnapshot[flags=" + Utilities.toHexFlags(robotFlags) + ", battery=" + battery
                + ", heading=" + heading + ", objects=" + vision.getDetections().size() + "]";
    }
}
