package com.vexrobotics.aimconnector;

/**
 * Bits of the robot "flags" word reported in each status snapshot.
 * Shadowed flags may be asserted locally by {@link ShadowFlags} ahead of the robot.
 */
public enum RobotFlag {
    SOUND_PLAYING(1 << 0, true),
    MOVE_ACTIVE(1 << 1, true),
    IMU_CALIBRATING(1 << 3, true),
    TURN_ACTIVE(1 << 4, true),
    MOVING(1 << 5, true),
    HAS_CRASHED(1 << 6, false),
    SHAKE(1 << 8, false),
    POWER_BUTTON(1 << 9, false),
    PROGRAM_ACTIVE(1 << 10, false),
    SOUND_DOWNLOADING(1 << 16, true);

    private final int mask;
    private final boolean shadowed;

    RobotFlag(int mask, boolean shadowed) {
        this.mask = mask;
        this.shadowed = shadowed;
    }

    public int mask() {
        return mask;
    }

    public boolean isShadowed() {
        return shadowed;
    }

    public boolean isSetIn(int flags) {
        return (flags & mask) != 0;
    }
}
