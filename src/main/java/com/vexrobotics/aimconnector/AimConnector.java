package com.vexrobotics.aimconnector;

import java.util.List;

/**
 * Command-line check of a robot connection: connects, reports battery and
 * heading, lists what the vision sensor sees and waves with the LEDs.
 * <p>
 * Usage: {@code java -jar aim-connector.jar [host]}; without a host the one in
 * settings.json is used.
 */
public class AimConnector {
    static final Log LOG = Log.getLogger(AimConnector.class);

    public static void main(String[] args) {
        String host = args.length > 0 ? args[0] : Settings.load().getHost();
        try (Robot robot = new Robot(host)) {
            LOG.info("connected to {}", host);
            System.out.println("battery: " + robot.getBatteryCapacity() + "%");
            System.out.println("heading: " + robot.getInertial().getHeading());

            List<DetectedObject> objects = robot.getVision().getData(VisionObjects.ALL_VISION, PerceptionPipeline.MAX_OBJECTS);
            System.out.println("vision sees " + objects.size() + " object(s)");
            for (DetectedObject object : objects) {
                System.out.println("  " + object);
            }

            robot.getScreen().showEmoji(Screen.Emoji.HAPPY);
            robot.getLed().on(Led.Light.ALL, Colors.GREEN);
            Robot.delay(1.0);
            robot.getLed().off(Led.Light.ALL);
            robot.getScreen().hideEmoji();
        } catch (AimException e) {
            LOG.error("robot session ended: {}", e.getMessage());
            System.exit(1);
        }
    }
}
