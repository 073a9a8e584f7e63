package com.vexrobotics.aimconnector;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("Blocking on robot state")
@Timeout(10)
class StateWaiterTest {

    private CancellationToken token;
    private Runnable stop;

    @BeforeEach
    void setUp() {
        token = new CancellationToken();
        stop = mock(Runnable.class);
    }

    @Test
    @DisplayName("a state that never clears times out and stops exactly once")
    void testTimeoutStopsOnce() {
        StateWaiter waiter = new StateWaiter(300, 20, 5, token);

        long start = System.currentTimeMillis();
        boolean cleared = waiter.blockOn("isMoveActive", () -> true, stop);
        long elapsed = System.currentTimeMillis() - start;

        assertFalse(cleared);
        assertTrue(elapsed >= 300, "returned after " + elapsed + " ms");
        verify(stop, times(1)).run();
    }

    @Test
    @DisplayName("a state that clears returns without stopping")
    void testClears() {
        StateWaiter waiter = new StateWaiter(5000, 10, 5, token);
        AtomicInteger reads = new AtomicInteger();

        boolean cleared = waiter.blockOn("isTurnActive", () -> reads.incrementAndGet() < 4, stop);

        assertTrue(cleared);
        verifyNoInteractions(stop);
    }

    @Test
    @DisplayName("a single false reading is not enough")
    void testDebounce() {
        StateWaiter waiter = new StateWaiter(5000, 10, 5, token);
        AtomicInteger reads = new AtomicInteger();
        // true, false (glitch), true, then false for good
        boolean[] pattern = { true, false, true, true, false, false };

        boolean cleared = waiter.blockOn("isMoveActive", () -> {
            int i = reads.getAndIncrement();
            return i < pattern.length ? pattern[i] : false;
        }, stop);

        assertTrue(cleared);
        assertTrue(reads.get() >= 6, "read " + reads.get() + " times");
        verifyNoInteractions(stop);
    }

    @Test
    @DisplayName("a cancelled program stops waiting without stopping the robot")
    void testCancelled() {
        StateWaiter waiter = new StateWaiter(5000, 10, 5, token);
        token.cancel("power button");

        assertFalse(waiter.blockOn("isMoveActive", () -> true, stop));
        verifyNoInteractions(stop);
    }

    @Test
    @DisplayName("defaults come from the client settings")
    void testSettingsConstructor() {
        ClientSettings settings = ClientSettings.builder().blockTimeoutMillis(100).blockPollMillis(10).build();
        StateWaiter waiter = new StateWaiter(settings, token);

        assertFalse(waiter.blockOn("isStopped", () -> true, stop));
        verify(stop).run();
    }
}
