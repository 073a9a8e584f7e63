package com.vexrobotics.aimconnector;

/**
 * The robot's touch screen: text, drawing, emoji and touch state.
 * Colors are 0xRRGGBB ints, see {@link Colors}.
 */
public class Screen {
    public enum Font {
        MONO12, MONO15, MONO20, MONO24, MONO30, MONO36, MONO40, MONO60,
        PROP20, PROP24, PROP30, PROP36, PROP40, PROP60
    }

    public enum Emoji {
        EXCITED, CONFIDENT, SILLY, AMAZED, STRONG, THRILLED, HAPPY, PROUD, LAUGHING,
        OPTIMISTIC, DETERMINED, AFFECTIONATE, CALM, QUIET, SHY, CHEERFUL, LOVED,
        SURPRISED, THINKING, TIRED, CONFUSED, BORED, EMBARRASSED, WORRIED, SAD, SICK,
        DISAPPOINTED, NERVOUS, ANNOYED, STRESSED, ANGRY, FRUSTRATED, JEALOUS, SHOCKED,
        FEAR, DISGUST
    }

    public enum EmojiLook { FORWARD, LEFT, RIGHT }

    private final Robot robot;
    private volatile int fillColor = Colors.BLUE;
    private volatile boolean fillTransparent = false;
    private volatile int penColor = Colors.BLUE;

    Screen(Robot robot) {
        this.robot = robot;
    }

    /** Prints at the cursor in the current font. */
    public void print(Object... args) {
        robot.send(Commands.print(join(args)));
    }

    /** Prints at pixel (x, y), ignoring the cursor. */
    public void printAt(int x, int y, Object... args) {
        robot.send(Commands.printAt(join(args), x, y, true));
    }

    private static String join(Object[] args) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < args.length; i++) {
            if (i > 0) sb.append(' ');
            sb.append(args[i]);
        }
        return sb.toString();
    }

    public void setCursor(int row, int column) {
        robot.send(Commands.setCursor(row, column));
    }

    public void nextRow() {
        robot.send(Commands.nextRow());
    }

    public int getRow() {
        return robot.getStatus().getScreenRow();
    }

    public int getColumn() {
        return robot.getStatus().getScreenColumn();
    }

    public void setOrigin(int x, int y) {
        robot.send(Commands.setOrigin(x, y));
    }

    public void clearRow(int row) {
        clearRow(row, Colors.BLUE);
    }

    public void clearRow(int row, int color) {
        robot.send(Commands.clearRow(row, color));
    }

    public void clearScreen() {
        clearScreen(Colors.BLUE);
    }

    public void clearScreen(int color) {
        robot.send(Commands.clearScreen(color));
    }

    public void setFont(Font font) {
        robot.send(Commands.setFont(font.name().toLowerCase()));
    }

    public void setPenWidth(int width) {
        robot.send(Commands.setPenWidth(width));
    }

    public void setPenColor(int color) {
        penColor = color;
        robot.send(Commands.setPenColor(color));
    }

    public void setFillColor(int color) {
        setFillColor(color, false);
    }

    /** Fill for later shapes; a transparent fill draws outlines only. */
    public void setFillColor(int color, boolean transparent) {
        fillColor = color;
        fillTransparent = transparent;
        robot.send(Commands.setFillColor(color, transparent));
    }

    public int getPenColor() {
        return penColor;
    }

    public int getFillColor() {
        return fillColor;
    }

    public void drawPixel(int x, int y) {
        robot.send(Commands.drawPixel(x, y));
    }

    public void drawLine(int x1, int y1, int x2, int y2) {
        robot.send(Commands.drawLine(x1, y1, x2, y2));
    }

    /** Draws with the current fill color. */
    public void drawRectangle(int x, int y, int width, int height) {
        robot.send(Commands.drawRectangle(x, y, width, height, fillColor, fillTransparent));
    }

    public void drawRectangle(int x, int y, int width, int height, int color) {
        robot.send(Commands.drawRectangle(x, y, width, height, color, false));
    }

    public void drawCircle(int x, int y, int radius) {
        robot.send(Commands.drawCircle(x, y, radius, fillColor, fillTransparent));
    }

    public void drawCircle(int x, int y, int radius, int color) {
        robot.send(Commands.drawCircle(x, y, radius, color, false));
    }

    /**
     * Draws an image already stored on the robot.
     *
     * @throws InvalidImageFileException unless the name ends in bmp or png
     */
    public void showFile(String fileName, int x, int y) {
        String extension = fileName.length() >= 3 ? fileName.substring(fileName.length() - 3) : fileName;
        if (!extension.equals("bmp") && !extension.equals("png")) {
            throw new InvalidImageFileException("extension is " + extension + "; expected extension to be bmp or png");
        }
        robot.send(Commands.drawImageFromFile(fileName, x, y));
    }

    public void setClipRegion(int x, int y, int width, int height) {
        robot.send(Commands.setClipRegion(x, y, width, height));
    }

    public void showEmoji(Emoji emoji) {
        showEmoji(emoji, EmojiLook.FORWARD);
    }

    public void showEmoji(Emoji emoji, EmojiLook look) {
        robot.send(Commands.showEmoji(emoji.ordinal(), look.ordinal()));
    }

    public void hideEmoji() {
        robot.send(Commands.hideEmoji());
    }

    public void showAiVision() {
        robot.send(Commands.showAiVision());
    }

    public void hideAiVision() {
        robot.send(Commands.hideAiVision());
    }

    public boolean isPressing() {
        return robot.getStatus().isScreenPressed();
    }

    public double getXPosition() {
        return robot.getStatus().getTouchX();
    }

    public double getYPosition() {
        return robot.getStatus().getTouchY();
    }

    public void onPressed(Runnable callback) {
        robot.onScreenPressed(callback);
    }

    public void onReleased(Runnable callback) {
        robot.onScreenReleased(callback);
    }
}
