package com.vexrobotics.aimconnector;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Status worker")
@Timeout(20)
class StatusWorkerTest {

    private FakeTransport transport;
    private CancellationToken token;
    private ShadowFlags shadowFlags;
    private StatusWorker worker;

    @BeforeEach
    void setUp() throws Exception {
        transport = new FakeTransport();
        token = new CancellationToken();
        shadowFlags = new ShadowFlags(10);
        ClientSettings settings = ClientSettings.builder()
                .receiveTimeoutMillis(50)
                .statusPeriodMillis(5)
                .reconnectDelayMillis(10)
                .build();
        worker = new StatusWorker("robot.local", transport, settings, token, shadowFlags);
        worker.connect(100);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        worker.shutdown();
        worker.join(2000);
    }

    private static StatusSnapshot snapshot(StatusJson json) {
        return StatusSnapshot.parse(json.build());
    }

    @Test
    @DisplayName("a probe is answered by a new current snapshot")
    void testPoll() {
        transport.responder = probe -> Frame.text(new StatusJson().robot("battery", 64).build());

        worker.poll();

        assertArrayEquals(StatusWorker.STATUS_PROBE, transport.sent.get(0));
        assertFalse(worker.isCurrentStatusEmpty());
        assertEquals(64, worker.getCurrentStatus().getBattery());
        assertEquals(1, worker.getSequence());
    }

    @Test
    @DisplayName("up to five lost packets keep the last snapshot, the sixth empties it")
    void testLostPackets() {
        worker.publish(snapshot(new StatusJson().robot("battery", 50)));
        StatusSnapshot last = worker.getCurrentStatus();

        for (int i = 1; i <= 5; i++) {
            worker.poll(); // nothing queued: receive times out
            assertSame(last, worker.getCurrentStatus(), "after loss " + i);
            assertEquals(i, worker.getLostPackets());
        }
        worker.poll();
        assertTrue(worker.isCurrentStatusEmpty());
    }

    @Test
    @DisplayName("an undecodable status counts as a lost packet")
    void testUndecodableStatus() {
        worker.onStatusPayload("not json at all {");
        worker.onStatusPayload("{\"controller\":{}}");

        assertEquals(2, worker.getLostPackets());
        assertTrue(worker.isCurrentStatusEmpty());
    }

    @Test
    @DisplayName("a failed probe send counts as a lost packet")
    void testSendFailureIsLoss() {
        transport.failSend = true;

        worker.poll();

        assertEquals(1, worker.getLostPackets());
        assertFalse(worker.isConnected());
    }

    @Test
    @DisplayName("a good snapshot resets the loss counter")
    void testRecoveryResetsCounter() {
        worker.recordLoss("test");
        worker.recordLoss("test");
        worker.publish(snapshot(new StatusJson()));

        assertEquals(0, worker.getLostPackets());
    }

    @Test
    @DisplayName("pending shadow flags are folded into the published snapshot")
    void testShadowFlagsApplied() {
        shadowFlags.requestSet(RobotFlag.MOVE_ACTIVE);

        worker.publish(snapshot(new StatusJson().flags(0)));

        assertTrue(worker.getCurrentStatus().has(RobotFlag.MOVE_ACTIVE));
    }

    @Test
    @DisplayName("screen press and release fire once per edge")
    void testScreenEdges() {
        AtomicInteger pressed = new AtomicInteger();
        AtomicInteger released = new AtomicInteger();
        worker.addScreenPressedCallback(pressed::incrementAndGet);
        worker.addScreenReleasedCallback(released::incrementAndGet);

        worker.publish(snapshot(new StatusJson().touch(true)));
        worker.publish(snapshot(new StatusJson().touch(true)));
        assertEquals(1, pressed.get());
        assertEquals(0, released.get());

        worker.publish(snapshot(new StatusJson().touch(false)));
        worker.publish(snapshot(new StatusJson().touch(false)));
        assertEquals(1, released.get());
    }

    @Test
    @DisplayName("crash callbacks fire for every snapshot with the crash bit")
    void testCrashLevelTriggered() {
        AtomicInteger crashes = new AtomicInteger();
        worker.addCrashCallback(crashes::incrementAndGet);
        worker.addCrashCallback(() -> {
            throw new IllegalStateException("callback bug");
        });

        worker.publish(snapshot(new StatusJson().flags(RobotFlag.HAS_CRASHED)));
        worker.publish(snapshot(new StatusJson().flags(RobotFlag.HAS_CRASHED)));
        worker.publish(snapshot(new StatusJson()));

        assertEquals(2, crashes.get());
    }

    @Test
    @DisplayName("the power button cancels the program")
    void testPowerButton() {
        worker.publish(snapshot(new StatusJson().flags(RobotFlag.PROGRAM_ACTIVE)));
        assertFalse(token.isCancelled());

        worker.publish(snapshot(new StatusJson().flags(RobotFlag.PROGRAM_ACTIVE, RobotFlag.POWER_BUTTON)));

        assertTrue(token.isCancelled());
        assertTrue(token.getReason().contains("power button"));
    }

    @Test
    @DisplayName("the program-active bit dropping cancels the program")
    void testProgramEnded() {
        worker.publish(snapshot(new StatusJson().flags(0)));
        assertFalse(token.isCancelled(), "never active yet");

        worker.publish(snapshot(new StatusJson().flags(RobotFlag.PROGRAM_ACTIVE)));
        worker.publish(snapshot(new StatusJson().flags(0)));

        assertTrue(token.isCancelled());
    }

    @Test
    @DisplayName("the listener sees every published snapshot")
    void testListener() {
        AtomicInteger seen = new AtomicInteger();
        worker.setStatusListener(s -> seen.incrementAndGet());

        worker.publish(snapshot(new StatusJson()));
        worker.publish(snapshot(new StatusJson()));

        assertEquals(2, seen.get());
    }

    @Test
    @DisplayName("awaitSnapshots times out when nothing arrives")
    void testAwaitTimeout() {
        assertFalse(worker.awaitSnapshots(1, 50));
    }

    @Test
    @DisplayName("the running worker polls, and reconnects after the link drops")
    void testRunLoop() throws InterruptedException {
        transport.responder = probe -> Frame.text(new StatusJson().build());
        worker.start();

        assertTrue(worker.awaitSnapshots(3, 5000));
        assertEquals(1, transport.connects.get());

        transport.close();
        long before = worker.getSequence();
        assertTrue(worker.awaitSnapshots(3, 5000));
        assertTrue(worker.getSequence() >= before + 3);
        assertEquals(2, transport.connects.get());
    }

    @Test
    @DisplayName("the worker stops when the program is cancelled")
    void testStopsOnCancel() throws InterruptedException {
        transport.responder = probe -> Frame.text(new StatusJson().build());
        worker.start();
        assertTrue(worker.awaitSnapshots(1, 5000));

        token.cancel("test over");
        worker.join(3000);

        assertFalse(worker.isAlive());
        assertFalse(transport.isConnected());
    }
}
