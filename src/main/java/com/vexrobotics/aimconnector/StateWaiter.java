package com.vexrobotics.aimconnector;

import java.util.function.BooleanSupplier;

/**
 * Blocks the caller while a robot state (for example "move active") holds.
 * A state must read false twice, a debounce interval apart, to end the wait.
 * If it is still true after the timeout the stop action runs once and the wait
 * ends.
 */
public class StateWaiter {
    static final Log LOG = Log.getLogger(StateWaiter.class);

    private final long timeoutMillis;
    private final long pollMillis;
    private final long debounceMillis;
    private final CancellationToken token;

    public StateWaiter(ClientSettings settings, CancellationToken token) {
        this(settings.getBlockTimeoutMillis(), settings.getBlockPollMillis(), settings.getBlockDebounceMillis(), token);
    }

    public StateWaiter(long timeoutMillis, long pollMillis, long debounceMillis, CancellationToken token) {
        this.timeoutMillis = timeoutMillis;
        this.pollMillis = pollMillis;
        this.debounceMillis = debounceMillis;
        this.token = token;
    }

    /**
     * @return true if the state cleared, false if the wait timed out (and
     *         {@code onTimeout} ran) or was cancelled
     */
    public boolean blockOn(String name, BooleanSupplier state, Runnable onTimeout) {
        long start = System.currentTimeMillis();
        while (true) {
            if (!state.getAsBoolean()) {
                Utilities.sleepMillis(debounceMillis);
                if (!state.getAsBoolean()) return true;
            }
            if (token.isCancelled() || Thread.currentThread().isInterrupted()) {
                LOG.debug("{} wait abandoned", name);
                return false;
            }
            long elapsed = System.currentTimeMillis() - start;
            Utilities.sleepMillis(pollMillis);
            if (elapsed > timeoutMillis) {
                LOG.warn("{} wait timed out, stopping", name);
                onTimeout.run();
                return false;
            }
        }
    }
}
