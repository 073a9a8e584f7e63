package com.vexrobotics.aimconnector;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Camera images")
@Timeout(10)
class AiVisionTest {

    private FakeTransport transport;
    private CancellationToken token;
    private ImageWorker worker;
    private AiVision vision;

    @BeforeEach
    void setUp() {
        transport = new FakeTransport();
        token = new CancellationToken();
        ClientSettings settings = ClientSettings.builder().receiveTimeoutMillis(1000).imageIdleMillis(5).build();
        worker = new ImageWorker("robot.local", transport, settings, token);
        worker.connect(100);
        // the camera path never touches the robot facade
        vision = new AiVision(null, worker, settings);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        token.cancel("test over");
        worker.join(2000);
    }

    @Test
    @DisplayName("no frame within half a second raises NoImageException")
    void testNoImage() {
        long start = System.currentTimeMillis();
        NoImageException e = assertThrows(NoImageException.class, () -> vision.getCameraImage());
        long elapsed = System.currentTimeMillis() - start;

        assertEquals("no image was received", e.getMessage());
        assertTrue(elapsed >= 450, "gave up after " + elapsed + " ms");
        assertTrue(worker.isStreaming());
        assertArrayEquals(ImageWorker.STREAM_ON, transport.sent.get(0));
    }

    @Test
    @DisplayName("the first call starts the stream and returns the first frame")
    void testFirstFrame() {
        byte[] jpeg = { (byte) 0xFF, (byte) 0xD8, 1, 2, 3 };
        transport.inbox.add(Frame.binary(jpeg));
        worker.start();

        assertArrayEquals(jpeg, vision.getCameraImage());
        assertEquals(1, transport.sent.size(), "stream is started once");
        vision.getCameraImage();
        assertEquals(1, transport.sent.size());
    }

    @Test
    @DisplayName("changing a returned image leaves the stored frame alone")
    void testImageIsCopied() {
        byte[] jpeg = { (byte) 0xFF, (byte) 0xD8, 7, 8, 9 };
        worker.getBuffer().publish(jpeg.clone());
        worker.startStream();

        byte[] first = vision.getCameraImage();
        first[2] = 0;

        assertArrayEquals(jpeg, vision.getCameraImage());
        assertArrayEquals(jpeg, worker.getBuffer().latest());
    }

    @Test
    @DisplayName("a lost frame is reported as no image")
    void testLostFrame() {
        worker.startStream();
        worker.receiveFrame(); // times out

        assertFalse(worker.getBuffer().hasImage());
        assertFalse(worker.isConnected(), "a receive error flags the link for reset");
    }

    @Test
    @DisplayName("a dropped connection turns the stream off")
    void testDisconnectStopsStream() throws InterruptedException {
        worker.startStream();
        transport.refuseConnect = true;
        transport.close();
        worker.start();

        long deadline = System.currentTimeMillis() + 3000;
        while (worker.isStreaming() && System.currentTimeMillis() < deadline) Thread.sleep(5);

        assertFalse(worker.isStreaming());
    }
}
