package com.vexrobotics.aimconnector;

/**
 * The robot's reply to one command.
 */
public final class CommandResponse {
    public static final String COMPLETE = "complete";
    public static final String IN_PROGRESS = "in_progress";
    public static final String ERROR = "error";
    public static final String UNKNOWN_COMMAND = "cmd_unknown";

    static final CommandResponse UNPARSEABLE = new CommandResponse("", "", null);

    private final String commandId;
    private final String status;
    private final String errorInfo;

    public CommandResponse(String commandId, String status, String errorInfo) {
        this.commandId = commandId;
        this.status = status;
        this.errorInfo = errorInfo;
    }

    public String getCommandId() {
        return commandId;
    }

    public String getStatus() {
        return status;
    }

    public String getErrorInfo() {
        return errorInfo;
    }

    public boolean isAccepted() {
        return COMPLETE.equals(status) || IN_PROGRESS.equals(status);
    }

    public boolean isError() {
        return ERROR.equals(status);
    }

    public boolean isUnknownCommand() {
        return UNKNOWN_COMMAND.equals(commandId);
    }

    @Override
    public String toString() {
        return "CommandResponse[" + commandId + ", " + status + (errorInfo != null ? ", " + errorInfo : "") + "]";
    }
}
