package com.vexrobotics.aimconnector;

import com.google.gson.JsonObject;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Command factories")
class CommandsTest {

    @Test
    @DisplayName("motion commands are sent without stacking")
    void testMotion() {
        JsonObject drive = Commands.driveFor(100, 90, 50, 75, 0).toJsonObject();

        assertEquals("drive_for", drive.get("cmd_id").getAsString());
        assertEquals(Commands.STACKING_OFF, drive.get("stacking_type").getAsInt());
        assertEquals(75, drive.get("turn_speed").getAsInt());
    }

    @Test
    @DisplayName("unused code colors are sent as -1")
    void testCodeDescription() {
        Descriptor.Color red = new Descriptor.Color(1, 255, 0, 0, 10, 0.2);
        Descriptor.Color blue = new Descriptor.Color(2, 0, 0, 255, 10, 0.2);

        JsonObject code = Commands.codeDescription(new Descriptor.Code(1, red, blue)).toJsonObject();

        assertEquals(1, code.get("c1").getAsInt());
        assertEquals(2, code.get("c2").getAsInt());
        assertEquals(-1, code.get("c3").getAsInt());
        assertEquals(-1, code.get("c5").getAsInt());
    }

    @Test
    @DisplayName("light colors are nested under the light name")
    void testLightSet() {
        JsonObject light = Commands.lightSet("light2", 1, 2, 3).toJsonObject();

        JsonObject color = light.getAsJsonObject("light2");
        assertEquals(1, color.get("r").getAsInt());
        assertEquals(3, color.get("b").getAsInt());
    }
}
