package com.vexrobotics.aimconnector;

public class Kicker {
    public enum KickType {
        SOFT("kick_soft"), MEDIUM("kick_medium"), HARD("kick_hard");

        private final String commandId;

        KickType(String commandId) {
            this.commandId = commandId;
        }

        public String getCommandId() {
            return commandId;
        }
    }

    private final Robot robot;

    Kicker(Robot robot) {
        this.robot = robot;
    }

    public void kick(KickType type) {
        robot.send(Commands.kick(type.getCommandId()));
    }

    /** Pushes a held object gently out in front of the robot. */
    public void place() {
        kick(KickType.SOFT);
    }
}
