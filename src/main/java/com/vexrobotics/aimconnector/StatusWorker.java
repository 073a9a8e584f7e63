package com.vexrobotics.aimconnector;

import com.google.gson.JsonParseException;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Polls the status channel: every cycle sends a one byte probe, decodes the
 * reply and publishes it as the current {@link StatusSnapshot}. Pending shadow
 * flags are folded in before publishing, then the press/release, crash and
 * program-termination detectors run on the new snapshot.
 * <p>
 * A lost packet keeps the previous snapshot. After more than
 * {@link ClientSettings#getMaxLostPackets()} consecutive losses the snapshot is
 * replaced by {@link StatusSnapshot#EMPTY}.
 */
public class StatusWorker extends ChannelWorker {
    static final Log LOG = Log.getLogger(StatusWorker.class);

    static final byte[] STATUS_PROBE = { 1 };

    private static final class SequenceLock { }

    private final ShadowFlags shadowFlags;
    private final AtomicReference<StatusSnapshot> current = new AtomicReference<>(StatusSnapshot.EMPTY);
    private final Object sequenceLock = new SequenceLock();
    private long sequence = 0;

    // Touched by the status thread only.
    private int lostPackets = 0;
    private boolean lastPressed = false;
    private boolean programActive = false;

    private final List<Runnable> pressedCallbacks = new CopyOnWriteArrayList<>();
    private final List<Runnable> releasedCallbacks = new CopyOnWriteArrayList<>();
    private final List<Runnable> crashCallbacks = new CopyOnWriteArrayList<>();
    private volatile Consumer<StatusSnapshot> statusListener;

    public StatusWorker(String host, ChannelTransport transport, ClientSettings settings,
                        CancellationToken token, ShadowFlags shadowFlags) {
        super(Channel.STATUS, host, transport, settings, token);
        this.shadowFlags = shadowFlags;
    }

    @Override
    protected long dutyCycle() {
        poll();
        return settings.getStatusPeriodMillis();
    }

    @Override
    protected void onReconnectFailed() {
        recordLoss("not connected");
    }

    /** One probe/response exchange. */
    void poll() {
        String payload;
        try {
            synchronized (ioLock) {
                send(STATUS_PROBE, true);
                payload = receive().getText();
            }
        } catch (DisconnectedException | ReceiveErrorException e) {
            recordLoss(e.getMessage());
            return;
        }
        onStatusPayload(payload);
    }

    void onStatusPayload(String json) {
        StatusSnapshot decoded;
        try {
            decoded = StatusSnapshot.parse(json);
        } catch (JsonParseException e) {
            recordLoss("undecodable status: " + e.getMessage());
            return;
        }
        publish(decoded);
    }

    void recordLoss(String reason) {
        lostPackets++;
        LOG.warn("lost a status packet, counter: {}", lostPackets);
        LOG.debug("loss reason: {}", reason);
        if (lostPackets > settings.getMaxLostPackets() && current.getAndSet(StatusSnapshot.EMPTY) != StatusSnapshot.EMPTY) {
            LOG.warn("no status for {} packets, robot state is unknown", lostPackets);
        }
    }

    void publish(StatusSnapshot decoded) {
        lostPackets = 0;
        StatusSnapshot snapshot = decoded.withRobotFlags(shadowFlags.apply(decoded.getRobotFlags()));
        current.set(snapshot);

        Consumer<StatusSnapshot> listener = statusListener;
        if (listener != null) {
            try {
                listener.accept(snapshot);
            } catch (RuntimeException e) {
                LOG.error("status listener failed: {}", e.toString(), e);
            }
        }

        detectCrash(snapshot);
        detectScreenPress(snapshot);
        detectPowerButton(snapshot);
        detectProgramEnd(snapshot);

        synchronized (sequenceLock) {
            sequence++;
            sequenceLock.notifyAll();
        }
    }

    // Level triggered: fires on every snapshot while the bit is up.
    private void detectCrash(StatusSnapshot snapshot) {
        if (snapshot.has(RobotFlag.HAS_CRASHED)) fire(crashCallbacks, "crash");
    }

    private void detectScreenPress(StatusSnapshot snapshot) {
        boolean pressed = snapshot.isScreenPressed();
        if (pressed && !lastPressed) fire(pressedCallbacks, "screen pressed");
        if (!pressed && lastPressed) fire(releasedCallbacks, "screen released");
        lastPressed = pressed;
    }

    private void detectPowerButton(StatusSnapshot snapshot) {
        if (snapshot.has(RobotFlag.POWER_BUTTON)) {
            token.cancel("detected power button press, exiting program");
        }
    }

    private void detectProgramEnd(StatusSnapshot snapshot) {
        boolean active = snapshot.has(RobotFlag.PROGRAM_ACTIVE);
        if (programActive && !active) {
            token.cancel("detected that program is no longer active (robot power button pressed?), exiting program");
        }
        programActive = active;
    }

    private void fire(List<Runnable> callbacks, String event) {
        for (Runnable callback : callbacks) {
            try {
                callback.run();
            } catch (RuntimeException e) {
                LOG.error("{} callback failed: {}", event, e.toString(), e);
            }
        }
    }

    /**
     * Waits until {@code count} more snapshots have been published.
     *
     * @return false on timeout or interrupt
     */
    public boolean awaitSnapshots(int count, long timeoutMillis) {
        long deadline = System.currentTimeMillis() + timeoutMillis;
        synchronized (sequenceLock) {
            long target = sequence + count;
            while (sequence < target) {
                long left = deadline - System.currentTimeMillis();
                if (left <= 0) return false;
                try {
                    sequenceLock.wait(left);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return false;
                }
            }
            return true;
        }
    }

    public long getSequence() {
        synchronized (sequenceLock) {
            return sequence;
        }
    }

    public StatusSnapshot getCurrentStatus() {
        return current.get();
    }

    public boolean isCurrentStatusEmpty() {
        return current.get().isEmpty();
    }

    public ShadowFlags getShadowFlags() {
        return shadowFlags;
    }

    int getLostPackets() {
        return lostPackets;
    }

    public void addScreenPressedCallback(Runnable callback) {
        pressedCallbacks.add(callback);
    }

    public void addScreenReleasedCallback(Runnable callback) {
        releasedCallbacks.add(callback);
    }

    public void addCrashCallback(Runnable callback) {
        crashCallbacks.add(callback);
    }

    public void setStatusListener(Consumer<StatusSnapshot> listener) {
        statusListener = listener;
    }
}
