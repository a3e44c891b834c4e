package com.agentnet.sweeper;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

public class SweepTimerImplTest {
    private static final int INTERVAL_MS = 20;
    private SweepTimer timer;

    @BeforeEach
    public void setup() {
        timer = new SweepTimerImpl(Duration.ofMillis(INTERVAL_MS));
    }

    @AfterEach
    public void tearDown() {
        timer.shutdown();
    }

    @Test
    @Timeout(value = 5, unit = TimeUnit.SECONDS)
    public void testTimerFiresRepeatedly() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(3);
        timer.setSweepHandler(latch::countDown);
        timer.start();
        assertTrue(latch.await(2, TimeUnit.SECONDS), "Handler should run at least three times");
    }

    @Test
    public void testStartWithoutHandlerThrowsException() {
        assertThrows(IllegalStateException.class, () -> timer.start(),
                "Starting timer without a handler should throw IllegalStateException");
    }

    @Test
    public void testStopHaltsSweeps() throws InterruptedException {
        AtomicInteger runs = new AtomicInteger();
        timer.setSweepHandler(runs::incrementAndGet);
        timer.start();
        await().atMost(Duration.ofSeconds(2)).until(() -> runs.get() > 0);

        timer.stop();
        Thread.sleep(INTERVAL_MS * 2);
        int afterStop = runs.get();
        Thread.sleep(INTERVAL_MS * 5);
        assertEquals(afterStop, runs.get(), "Handler should not run after stop");
    }

    @Test
    public void testFailingHandlerKeepsTimerAlive() {
        AtomicInteger runs = new AtomicInteger();
        timer.setSweepHandler(() -> {
            runs.incrementAndGet();
            throw new IllegalStateException("boom");
        });
        timer.start();
        await().atMost(Duration.ofSeconds(2)).until(() -> runs.get() >= 3);
    }
}
