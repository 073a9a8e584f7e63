package com.vexrobotics.aimconnector;

/**
 * The robot answered a command with status "error". Only raised when the
 * client is configured with {@link ClientSettings.RejectedCommandPolicy#THROW}.
 */
public class CommandRejectedException extends AimException {
    private final String commandId;
    private final String reason;

    public CommandRejectedException(String commandId, String reason) {
        super(String.format("robot rejected %s: %s", commandId, reason));
        this.commandId = commandId;
        this.reason = reason;
    }

    public String getCommandId() {
        return commandId;
    }

    public String getReason() {
        return reason;
    }
}
