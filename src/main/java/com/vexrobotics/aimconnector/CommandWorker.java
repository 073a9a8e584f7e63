package com.vexrobotics.aimconnector;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * Command/response channel. One command is in flight at a time: the request and
 * its reply are exchanged under the connection lock. Accepted motion and
 * calibration commands request the matching shadow flags so that state queries
 * reflect them before the robot reports it.
 */
public class CommandWorker extends ChannelWorker {
    static final Log LOG = Log.getLogger(CommandWorker.class);

    static final Set<String> MOVE_COMMANDS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList("drive", "drive_for")));
    static final Set<String> TURN_COMMANDS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList("turn", "turn_for", "turn_to")));
    static final String IMU_CALIBRATE = "imu_calibrate";

    private final ShadowFlags shadowFlags;

    public CommandWorker(String host, ChannelTransport transport, ClientSettings settings,
                         CancellationToken token, ShadowFlags shadowFlags) {
        super(Channel.COMMAND, host, transport, settings, token);
        this.shadowFlags = shadowFlags;
    }

    @Override
    protected long dutyCycle() {
        return settings.getCommandCycleMillis();
    }

    /**
     * Sends one command and waits for its reply.
     *
     * @throws DisconnectedException if the command could not be sent or no reply came back
     * @throws CommandRejectedException if the robot reported an error and the
     *                                  client is configured to throw
     */
    public CommandResponse send(Command command) {
        String id = command.getId();
        String json = command.toJson();
        Frame reply;
        synchronized (ioLock) {
            LOG.debug("sending {}", json);
            send(json.getBytes(StandardCharsets.UTF_8), true);
            try {
                reply = receive();
            } catch (ReceiveErrorException e) {
                throw new DisconnectedException("robot got disconnected after sending cmd_id: " + id, e);
            }
        }
        return handleReply(id, reply.getText());
    }

    CommandResponse handleReply(String sentId, String text) {
        CommandResponse response;
        try {
            response = parse(text);
        } catch (JsonParseException | IllegalStateException e) {
            LOG.error("{} Error: could not parse ws_cmd JSON response: '{}'", sentId, e.getMessage());
            LOG.debug("response_json {}", text);
            return CommandResponse.UNPARSEABLE;
        }

        if (response.isUnknownCommand()) {
            LOG.warn("robot: did not recognize command: {}", sentId);
            return response;
        }

        if (response.isError()) {
            String reason = response.getErrorInfo() != null ? response.getErrorInfo() : "no reason given";
            if (settings.getRejectedCommandPolicy() == ClientSettings.RejectedCommandPolicy.THROW) {
                throw new CommandRejectedException(sentId, reason);
            }
            LOG.warn("robot: error processing command {}, reason: {}", sentId, reason);
            return response;
        }

        if (response.isAccepted()) applyShadowFlags(response.getCommandId());
        return response;
    }

    private void applyShadowFlags(String id) {
        boolean move = MOVE_COMMANDS.contains(id);
        boolean turn = TURN_COMMANDS.contains(id);
        if (move) shadowFlags.requestSet(RobotFlag.MOVE_ACTIVE);
        if (turn) shadowFlags.requestSet(RobotFlag.TURN_ACTIVE);
        if (move || turn) shadowFlags.requestSet(RobotFlag.MOVING);
        if (IMU_CALIBRATE.equals(id)) shadowFlags.requestSet(RobotFlag.IMU_CALIBRATING);
    }

    static CommandResponse parse(String text) {
        JsonObject root = JsonParser.parseString(text).getAsJsonObject();
        JsonElement info = root.get("error_info");
        return new CommandResponse(
                JsonFields.string(root, "cmd_id", ""),
                JsonFields.string(root, "status", ""),
                info == null || info.isJsonNull() ? null : info.isJsonPrimitive() ? info.getAsString() : info.toString());
    }
}
