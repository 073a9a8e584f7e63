package com.vexrobotics.aimconnector;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Command worker")
@Timeout(10)
class CommandWorkerTest {

    private FakeTransport transport;
    private ShadowFlags shadowFlags;

    @BeforeEach
    void setUp() {
        transport = new FakeTransport();
        shadowFlags = new ShadowFlags(10);
    }

    private CommandWorker worker(ClientSettings.RejectedCommandPolicy policy) {
        ClientSettings settings = ClientSettings.builder()
                .receiveTimeoutMillis(100)
                .rejectedCommandPolicy(policy)
                .build();
        CommandWorker worker = new CommandWorker("robot.local", transport, settings, new CancellationToken(), shadowFlags);
        worker.connect(100);
        return worker;
    }

    private void reply(String id, String status) {
        transport.push("{\"cmd_id\":\"" + id + "\",\"status\":\"" + status + "\"}");
    }

    @Test
    @DisplayName("sends the command as JSON with cmd_id first and returns the reply")
    void testRoundTrip() {
        CommandWorker worker = worker(ClientSettings.RejectedCommandPolicy.LOG);
        reply("spin_wheels", CommandResponse.COMPLETE);

        CommandResponse response = worker.send(Commands.spinWheels(10, -20, 30));

        String sent = transport.sentText(0);
        assertTrue(sent.startsWith("{\"cmd_id\":\"spin_wheels\""), sent);
        JsonObject json = JsonParser.parseString(sent).getAsJsonObject();
        assertEquals(-20, json.get("vel2").getAsInt());
        assertTrue(response.isAccepted());
        assertEquals("spin_wheels", response.getCommandId());
    }

    @Test
    @DisplayName("an accepted move or turn asserts the matching shadow flags")
    void testShadowFlagsOnAccept() {
        CommandWorker worker = worker(ClientSettings.RejectedCommandPolicy.LOG);
        reply("drive_for", CommandResponse.IN_PROGRESS);
        worker.send(Commands.driveFor(100, 0, 100, 75, 0));

        assertEquals(ShadowFlags.State.PENDING_SET, shadowFlags.state(RobotFlag.MOVE_ACTIVE));
        assertEquals(ShadowFlags.State.PENDING_SET, shadowFlags.state(RobotFlag.MOVING));
        assertEquals(ShadowFlags.State.UNSET, shadowFlags.state(RobotFlag.TURN_ACTIVE));

        reply("turn_to", CommandResponse.COMPLETE);
        worker.send(Commands.turnTo(90, 75));
        assertEquals(ShadowFlags.State.PENDING_SET, shadowFlags.state(RobotFlag.TURN_ACTIVE));

        reply("imu_calibrate", CommandResponse.COMPLETE);
        worker.send(Commands.imuCalibrate());
        assertEquals(ShadowFlags.State.PENDING_SET, shadowFlags.state(RobotFlag.IMU_CALIBRATING));
    }

    @Test
    @DisplayName("a rejected command is logged, not raised, by default")
    void testRejectedLogged() {
        CommandWorker worker = worker(ClientSettings.RejectedCommandPolicy.LOG);
        transport.push("{\"cmd_id\":\"drive\",\"status\":\"error\",\"error_info\":\"busy\"}");

        CommandResponse response = worker.send(Commands.drive(0, 100));

        assertTrue(response.isError());
        assertEquals("busy", response.getErrorInfo());
        assertEquals(ShadowFlags.State.UNSET, shadowFlags.state(RobotFlag.MOVE_ACTIVE));
    }

    @Test
    @DisplayName("a rejected command raises when configured to")
    void testRejectedThrows() {
        CommandWorker worker = worker(ClientSettings.RejectedCommandPolicy.THROW);
        transport.push("{\"cmd_id\":\"drive\",\"status\":\"error\"}");

        CommandRejectedException e = assertThrows(CommandRejectedException.class,
                () -> worker.send(Commands.drive(0, 100)));
        assertEquals("drive", e.getCommandId());
        assertEquals("no reason given", e.getReason());
    }

    @Test
    @DisplayName("unknown and unparseable replies do not fail the caller")
    void testOddReplies() {
        CommandWorker worker = worker(ClientSettings.RejectedCommandPolicy.THROW);
        reply(CommandResponse.UNKNOWN_COMMAND, "error");
        assertTrue(worker.send(new Command("no_such_thing")).isUnknownCommand());

        transport.push("<<garbage>>");
        assertSame(CommandResponse.UNPARSEABLE, worker.send(Commands.hideEmoji()));
    }

    @Test
    @DisplayName("no reply means the robot is gone")
    void testNoReply() {
        CommandWorker worker = worker(ClientSettings.RejectedCommandPolicy.LOG);

        DisconnectedException e = assertThrows(DisconnectedException.class, () -> worker.send(Commands.nextRow()));

        assertTrue(e.getMessage().contains("lcd_next_row"));
        assertFalse(worker.isConnected());
    }

    @Test
    @DisplayName("a failed send is reported as a disconnect")
    void testSendFailure() {
        CommandWorker worker = worker(ClientSettings.RejectedCommandPolicy.LOG);
        transport.failSend = true;

        assertThrows(DisconnectedException.class, () -> worker.send(Commands.nextRow()));
        assertTrue(transport.sent.isEmpty());
    }

    @Test
    @DisplayName("error_info that is not a string is kept as JSON text")
    void testStructuredErrorInfo() {
        CommandResponse response = CommandWorker.parse("{\"cmd_id\":\"x\",\"status\":\"error\",\"error_info\":{\"code\":3}}");
        assertEquals("{\"code\":3}", response.getErrorInfo());
    }
}
