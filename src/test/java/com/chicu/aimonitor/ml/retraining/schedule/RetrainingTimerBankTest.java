package com.chicu.aimonitor.ml.retraining.schedule;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RetrainingTimerBankTest {

    private final RetrainingTimerBank bank = new RetrainingTimerBank();

    @AfterEach
    void tearDown() {
        bank.shutdown();
    }

    @Test
    void timer_firesRepeatedly_untilStopped() throws Exception {
        CountDownLatch fired = new CountDownLatch(3);
        bank.start("s1", 20, fired::countDown);

        assertTrue(bank.isRunning("s1"));
        assertTrue(fired.await(5, TimeUnit.SECONDS));

        assertTrue(bank.stop("s1"));
        assertFalse(bank.isRunning("s1"));
        assertFalse(bank.stop("s1"));
    }

    @Test
    void failingCallback_doesNotKillTimer() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        CountDownLatch secondCall = new CountDownLatch(2);

        bank.start("s1", 20, () -> {
            calls.incrementAndGet();
            secondCall.countDown();
            throw new IllegalStateException("boom");
        });

        assertTrue(secondCall.await(5, TimeUnit.SECONDS));
        assertTrue(calls.get() >= 2);
        assertTrue(bank.isRunning("s1"));
    }

    @Test
    void restart_replacesExistingTimer() {
        bank.start("s1", 60_000, () -> { });
        bank.start("s1", 30_000, () -> { });
        bank.start("s2", 60_000, () -> { });

        assertEquals(2, bank.runningIds().size());

        bank.stopAll();
        assertTrue(bank.runningIds().isEmpty());
    }

    @Test
    void nonPositiveInterval_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> bank.start("s1", 0, () -> { }));
        assertFalse(bank.isRunning("s1"));
    }
}
