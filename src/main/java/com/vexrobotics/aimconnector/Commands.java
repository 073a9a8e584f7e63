package com.vexrobotics.aimconnector;

import com.google.gson.JsonObject;

/**
 * Factories for every command the robot understands.
 */
public final class Commands {
    private Commands() { }

    // motion commands are sent without stacking
    static final int STACKING_OFF = 0;

    public static Command programInit() {
        return new Command("program_init");
    }

    // motion

    public static Command drive(double angle, int speed) {
        return new Command("drive").with("angle", angle).with("speed", speed).with("stacking_type", STACKING_OFF);
    }

    public static Command driveFor(double distance, double angle, int driveSpeed, int turnSpeed, double finalHeading) {
        return new Command("drive_for")
                .with("distance", distance)
                .with("angle", angle)
                .with("final_heading", finalHeading)
                .with("drive_speed", driveSpeed)
                .with("turn_speed", turnSpeed)
                .with("stacking_type", STACKING_OFF);
    }

    public static Command turn(int turnRate) {
        return new Command("turn").with("turn_rate", turnRate).with("stacking_type", STACKING_OFF);
    }

    public static Command turnTo(double heading, int turnRate) {
        return new Command("turn_to").with("heading", heading).with("turn_rate", turnRate).with("stacking_type", STACKING_OFF);
    }

    public static Command turnFor(double angle, int turnRate) {
        return new Command("turn_for").with("angle", angle).with("turn_rate", turnRate).with("stacking_type", STACKING_OFF);
    }

    public static Command spinWheels(int vel1, int vel2, int vel3) {
        return new Command("spin_wheels").with("vel1", vel1).with("vel2", vel2).with("vel3", vel3);
    }

    public static Command setPose(double x, double y) {
        return new Command("set_pose").with("x", x).with("y", y);
    }

    // screen

    public static Command print(String text) {
        return new Command("lcd_print").with("string", text);
    }

    public static Command printAt(String text, int x, int y, boolean opaque) {
        return new Command("lcd_print_at").with("x", x).with("y", y).with("string", text).with("b_opaque", opaque);
    }

    public static Command setCursor(int row, int column) {
        return new Command("lcd_set_cursor").with("row", row).with("col", column);
    }

    public static Command setOrigin(int x, int y) {
        return new Command("lcd_set_origin").with("x", x).with("y", y);
    }

    public static Command nextRow() {
        return new Command("lcd_next_row");
    }

    public static Command clearRow(int row, int rgb) {
        return rgb(new Command("lcd_clear_row").with("number", row), rgb);
    }

    public static Command clearScreen(int rgb) {
        return rgb(new Command("lcd_clear_screen"), rgb);
    }

    public static Command setFont(String fontName) {
        return new Command("lcd_set_font").with("fontname", fontName);
    }

    public static Command setPenWidth(int width) {
        return new Command("lcd_set_pen_width").with("width", width);
    }

    public static Command setPenColor(int rgb) {
        return rgb(new Command("lcd_set_pen_color"), rgb);
    }

    public static Command setFillColor(int rgb, boolean transparent) {
        return rgb(new Command("lcd_set_fill_color"), rgb).with("b_transparency", transparent);
    }

    public static Command drawLine(int x1, int y1, int x2, int y2) {
        return new Command("lcd_draw_line").with("x1", x1).with("y1", y1).with("x2", x2).with("y2", y2);
    }

    public static Command drawRectangle(int x, int y, int width, int height, int rgb, boolean transparent) {
        Command c = new Command("lcd_draw_rectangle").with("x", x).with("y", y).with("width", width).with("height", height);
        return rgb(c, rgb).with("b_transparency", transparent);
    }

    public static Command drawCircle(int x, int y, int radius, int rgb, boolean transparent) {
        Command c = new Command("lcd_draw_circle").with("x", x).with("y", y).with("radius", radius);
        return rgb(c, rgb).with("b_transparency", transparent);
    }

    public static Command drawPixel(int x, int y) {
        return new Command("lcd_draw_pixel").with("x", x).with("y", y);
    }

    public static Command drawImageFromFile(String fileName, int x, int y) {
        return new Command("lcd_draw_image_from_file").with("filename", fileName).with("x", x).with("y", y);
    }

    public static Command setClipRegion(int x, int y, int width, int height) {
        return new Command("lcd_set_clip_region").with("x", x).with("y", y).with("width", width).with("height", height);
    }

    public static Command showEmoji(int emoji, int look) {
        return new Command("show_emoji").with("name", emoji).with("look", look);
    }

    public static Command hideEmoji() {
        return new Command("hide_emoji");
    }

    public static Command showAiVision() {
        return new Command("show_aivision");
    }

    public static Command hideAiVision() {
        return new Command("hide_aivision");
    }

    // inertial

    public static Command imuCalibrate() {
        return new Command(CommandWorker.IMU_CALIBRATE);
    }

    public static Command imuSetCrashThreshold(int sensitivity) {
        return new Command("imu_set_crash_threshold").with("sensitivity", sensitivity);
    }

    // kicker: the kick strength is the command id itself

    public static Command kick(String kickId) {
        return new Command(kickId);
    }

    // sound

    public static Command playSound(String name, int volume) {
        return new Command("play_sound").with("name", name).with("volume", volume);
    }

    public static Command playFile(String name, int volume) {
        return new Command("play_file").with("name", name).with("volume", volume);
    }

    public static Command playNote(int note, int octave, int duration, int volume) {
        return new Command("play_note").with("note", note).with("octave", octave).with("duration", duration).with("volume", volume);
    }

    public static Command stopSound() {
        return new Command("stop_sound");
    }

    // leds

    public static Command lightSet(String led, int r, int g, int b) {
        JsonObject color = new JsonObject();
        color.addProperty("r", r);
        color.addProperty("g", g);
        color.addProperty("b", b);
        return new Command("light_set").with(led, color);
    }

    // ai vision

    public static Command colorDescription(Descriptor.Color color) {
        return new Command("color_description")
                .with("id", color.getId())
                .with("red", color.getRed())
                .with("green", color.getGreen())
                .with("blue", color.getBlue())
                .with("hangle", color.getHueRange())
                .with("hdsat", color.getSaturationRange());
    }

    public static Command codeDescription(Descriptor.Code code) {
        Command c = new Command("code_description").with("id", code.getId());
        for (int i = 0; i < 5; i++) {
            int colorId = i < code.getColors().size() ? code.getColors().get(i).getId() : -1;
            c.with("c" + (i + 1), colorId);
        }
        return c;
    }

    public static Command tagDetection(boolean enable) {
        return new Command("tag_detection").with("b_enable", enable);
    }

    public static Command colorDetection(boolean enable, boolean merge) {
        return new Command("color_detection").with("b_enable", enable).with("b_merge", merge);
    }

    public static Command modelDetection(boolean enable) {
        return new Command("model_detection").with("b_enable", enable);
    }

    private static Command rgb(Command c, int rgb) {
        return c.with("r", (rgb >> 16) & 0xFF).with("g", (rgb >> 8) & 0xFF).with("b", rgb & 0xFF);
    }
}
