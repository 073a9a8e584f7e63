package com.vexrobotics.aimconnector;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Process-wide stop signal shared by the channel workers. Cancelling is one-shot:
 * listeners run once, on the thread that cancelled first.
 */
public class CancellationToken {
    static final Log LOG = Log.getLogger(CancellationToken.class);

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();
    private volatile String reason;

    public boolean cancel(String why) {
        if (!cancelled.compareAndSet(false, true)) return false;
        reason = why;
        LOG.info("cancelled: {}", why);
        for (Runnable listener : listeners) {
            try {
                listener.run();
            } catch (RuntimeException e) {
                LOG.error("cancel listener failed: {}", e.toString(), e);
            }
        }
        return true;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public String getReason() {
        return reason;
    }

    public void addListener(Runnable listener) {
        listeners.add(listener);
    }
}
