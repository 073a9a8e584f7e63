package com.vexrobotics.aimconnector;

/**
 * The six RGB LEDs around the robot.
 */
public class Led {
    public enum Light {
        LED1("light1"), LED2("light2"), LED3("light3"), LED4("light4"), LED5("light5"), LED6("light6"),
        ALL("all");

        private final String wireName;

        Light(String wireName) {
            this.wireName = wireName;
        }

        public String getWireName() {
            return wireName;
        }

        /** LED by zero-based index; anything outside 0..5 means all of them. */
        public static Light of(int index) {
            return index >= 0 && index < 6 ? values()[index] : ALL;
        }
    }

    static final int GREY = 128;

    private final Robot robot;

    Led(Robot robot) {
        this.robot = robot;
    }

    public void on(Light light, int color) {
        on(light, (color >> 16) & 0xFF, (color >> 8) & 0xFF, color & 0xFF);
    }

    public void on(Light light, int r, int g, int b) {
        r = Robot.clampParameterToBounds(r, 0, 255, "on", "red");
        g = Robot.clampParameterToBounds(g, 0, 255, "on", "green");
        b = Robot.clampParameterToBounds(b, 0, 255, "on", "blue");
        robot.send(Commands.lightSet(light.getWireName(), r, g, b));
    }

    /** Grey when {@code lit}, dark otherwise. */
    public void on(Light light, boolean lit) {
        int level = lit ? GREY : 0;
        on(light, level, level, level);
    }

    public void off(Light light) {
        robot.send(Commands.lightSet(light.getWireName(), 0, 0, 0));
    }
}
