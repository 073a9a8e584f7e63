package com.vexrobotics.aimconnector;

/**
 * Named 0xRRGGBB colors for the screen and LEDs.
 */
public final class Colors {
    private Colors() { }

    public static final int BLACK = 0x000000;
    public static final int WHITE = 0xFFFFFF;
    public static final int RED = 0xFF0000;
    public static final int GREEN = 0x00FF00;
    public static final int BLUE = 0x001871;
    public static final int YELLOW = 0xFFFF00;
    public static final int ORANGE = 0xFF8500;
    public static final int PURPLE = 0xFF00FF;
    public static final int CYAN = 0x00FFFF;

    public static int rgb(int r, int g, int b) {
        return (r & 0xFF) << 16 | (g & 0xFF) << 8 | (b & 0xFF);
    }
}
