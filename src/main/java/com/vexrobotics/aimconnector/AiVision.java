package com.vexrobotics.aimconnector;

import java.util.Arrays;
import java.util.List;

/**
 * The AI vision sensor: object queries over the latest status snapshot, the
 * camera image stream and the sensor's detection settings.
 */
public class AiVision {
    static final Log LOG = Log.getLogger(AiVision.class);

    private final Robot robot;
    private final ImageWorker imageWorker;
    private final PerceptionPipeline pipeline = new PerceptionPipeline();
    private final long waitMillis;
    private final long pollMillis;

    AiVision(Robot robot, ImageWorker imageWorker, ClientSettings settings) {
        this.robot = robot;
        this.imageWorker = imageWorker;
        this.waitMillis = settings.getImageWaitMillis();
        this.pollMillis = settings.getImagePollMillis();
    }

    /** Up to 8 objects matching {@code descriptor}, largest first. */
    public List<DetectedObject> getData(Descriptor descriptor) {
        return getData(descriptor, PerceptionPipeline.DEFAULT_COUNT);
    }

    public List<DetectedObject> getData(Descriptor descriptor, int count) {
        return getData(Arrays.asList(descriptor), count);
    }

    /**
     * Objects matching any of {@code descriptors}, ordered by area, largest first.
     * At most {@code count} objects are returned, and never more than 24.
     *
     * @throws AimException if {@code descriptors} is empty
     */
    public List<DetectedObject> getData(List<? extends Descriptor> descriptors, int count) {
        return pipeline.query(robot.getStatus().getVision(), descriptors, count);
    }

    /** Largest match of the last getData call, or null. */
    public DetectedObject largestObject() {
        return pipeline.largestObject();
    }

    public int objectCount() {
        return pipeline.objectCount();
    }

    /**
     * Copy of the latest camera frame (JPEG bytes). The first call starts the
     * image stream and may take a few hundred milliseconds.
     *
     * @throws NoImageException if no frame arrived in time
     */
    public byte[] getCameraImage() {
        if (!imageWorker.isStreaming()) {
            LOG.debug("starting image stream");
            imageWorker.startStream();
        }
        ImageBuffer buffer = imageWorker.getBuffer();
        long deadline = System.currentTimeMillis() + waitMillis;
        while (!buffer.hasImage() && System.currentTimeMillis() < deadline) {
            Utilities.sleepMillis(pollMillis);
        }
        byte[] image = buffer.latest();
        if (ImageBuffer.isMissing(image)) throw new NoImageException("no image was received");
        return image.clone();
    }

    public void tagDetection(boolean enable) {
        robot.send(Commands.tagDetection(enable));
    }

    public void colorDetection(boolean enable) {
        colorDetection(enable, false);
    }

    /** @param merge merge adjacent color detections into one */
    public void colorDetection(boolean enable, boolean merge) {
        robot.send(Commands.colorDetection(enable, merge));
    }

    public void modelDetection(boolean enable) {
        robot.send(Commands.modelDetection(enable));
    }

    public void colorDescription(Descriptor.Color color) {
        robot.send(Commands.colorDescription(color));
    }

    public void codeDescription(Descriptor.Code code) {
        robot.send(Commands.codeDescription(code));
    }
}
