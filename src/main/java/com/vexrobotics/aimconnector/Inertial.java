package com.vexrobotics.aimconnector;

/**
 * The robot's inertial sensor. Heading and rotation are reported relative to
 * offsets kept on this side, so resetting them sends nothing to the robot.
 */
public class Inertial {
    public enum Axis { X, Y, Z }

    public enum Sensitivity { LOW, MEDIUM, HIGH }

    private final Robot robot;
    private volatile double headingOffset = 0;
    private volatile double rotationOffset = 0;

    Inertial(Robot robot) {
        this.robot = robot;
    }

    public void calibrate() {
        robot.send(Commands.imuCalibrate());
    }

    public boolean isCalibrating() {
        return robot.getShadowFlags().isSet(RobotFlag.IMU_CALIBRATING, robot.getStatus().getRobotFlags());
    }

    public void setCrashSensitivity(Sensitivity sensitivity) {
        robot.send(Commands.imuSetCrashThreshold(sensitivity.ordinal()));
    }

    /** Makes the current raw heading read as {@code heading}. */
    public void setHeading(double heading) {
        headingOffset = getHeadingRaw() - heading;
    }

    public void resetHeading() {
        setHeading(0);
    }

    public void setRotation(double rotation) {
        rotationOffset = getRotationRaw() - rotation;
    }

    public void resetRotation() {
        setRotation(0);
    }

    /** @return heading in [0, 360) degrees */
    public double getHeading() {
        double heading = round2((getHeadingRaw() - headingOffset) % 360);
        if (heading < 0) heading += 360;
        return heading;
    }

    public double getRotation() {
        return round2(getRotationRaw() - rotationOffset);
    }

    public double getHeadingRaw() {
        return robot.getStatus().getHeading();
    }

    public double getRotationRaw() {
        return robot.getStatus().getRotation();
    }

    public double getHeadingOffset() {
        return headingOffset;
    }

    public double getRoll() {
        return round2(robot.getStatus().getRoll());
    }

    public double getPitch() {
        return round2(robot.getStatus().getPitch());
    }

    public double getYaw() {
        return round2(robot.getStatus().getYaw());
    }

    /** X is forward, Y rightward, Z downward. */
    public double getAcceleration(Axis axis) {
        return robot.getStatus().getAcceleration(axis.ordinal());
    }

    /** Gyro rate in degrees per second; X is roll, Y pitch, Z yaw. */
    public double getTurnRate(Axis axis) {
        return robot.getStatus().getGyroRate(axis.ordinal());
    }

    public void onCrash(Runnable callback) {
        robot.onCrash(callback);
    }

    static double round2(double value) {
        return Math.round(value * 100) / 100.0;
    }
}
