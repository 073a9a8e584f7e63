package com.vexrobotics.aimconnector;

import com.google.gson.JsonParseException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Status snapshots")
class StatusSnapshotTest {

    @Test
    @DisplayName("flag words arrive as hex strings")
    void testHexFlags() {
        StatusSnapshot s = StatusSnapshot.parse("{\"robot\":{\"flags\":\"0x0222\",\"touch_flags\":\"0x0001\"}}");

        assertTrue(s.has(RobotFlag.MOVE_ACTIVE));
        assertTrue(s.has(RobotFlag.MOVING));
        assertTrue(s.has(RobotFlag.POWER_BUTTON));
        assertFalse(s.has(RobotFlag.TURN_ACTIVE));
        assertTrue(s.isScreenPressed());
    }

    @Test
    @DisplayName("numbers may arrive as strings and missing fields read as defaults")
    void testLenientNumbers() {
        StatusSnapshot s = StatusSnapshot.parse("{\"robot\":{\"heading\":\"12.5\",\"battery\":\"88\","
                + "\"acceleration\":{\"x\":\"0.25\",\"z\":1}}}");

        assertEquals(12.5, s.getHeading(), 1e-9);
        assertEquals(88, s.getBattery());
        assertEquals(0.25, s.getAcceleration(0), 1e-9);
        assertEquals(0, s.getAcceleration(1), 1e-9);
        assertEquals(1, s.getAcceleration(2), 1e-9);
        assertEquals(1, s.getScreenRow());
        assertFalse(s.isScreenPressed());
        assertFalse(s.isEmpty());
    }

    @Test
    @DisplayName("a message without a robot section is not a status")
    void testMissingRobot() {
        assertThrows(JsonParseException.class, () -> StatusSnapshot.parse("{\"controller\":{}}"));
        assertThrows(JsonParseException.class, () -> StatusSnapshot.parse("[1,2]"));
        assertThrows(JsonParseException.class, () -> StatusSnapshot.parse("{robot"));
        assertThrows(JsonParseException.class, () -> StatusSnapshot.parse("{\"robot\":{\"heading\":\"north\"}}"));
    }

    @Test
    @DisplayName("replacing the flag word keeps every other field")
    void testWithRobotFlags() {
        StatusSnapshot s = StatusSnapshot.parse("{\"robot\":{\"flags\":\"0x0000\",\"robot_x\":40}}");

        assertSame(s, s.withRobotFlags(0));
        StatusSnapshot moved = s.withRobotFlags(RobotFlag.MOVING.mask());
        assertTrue(moved.has(RobotFlag.MOVING));
        assertEquals(40, moved.getRobotX(), 1e-9);
        assertFalse(s.has(RobotFlag.MOVING));
    }

    @Test
    @DisplayName("the empty snapshot is recognised by identity")
    void testEmpty() {
        assertTrue(StatusSnapshot.EMPTY.isEmpty());
        assertEquals(0, StatusSnapshot.EMPTY.getRobotFlags());
    }
}
