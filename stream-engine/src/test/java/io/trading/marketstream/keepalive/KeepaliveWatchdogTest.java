package io.trading.marketstream.keepalive;

import io.trading.marketstream.support.TestAwait;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for KeepaliveWatchdog.
 */
class KeepaliveWatchdogTest {

    private ScheduledExecutorService scheduler;
    private final AtomicInteger pings = new AtomicInteger();
    private final List<Long> unhealthy = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        scheduler = Executors.newScheduledThreadPool(1);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    private KeepaliveWatchdog watchdog(Runnable pinger) {
        return new KeepaliveWatchdog("test", scheduler, Duration.ofMillis(20), Duration.ofMillis(40),
            pinger, unhealthy::add);
    }

    @Test
    void testFiresOnceWithoutPong() throws InterruptedException {
        KeepaliveWatchdog watchdog = watchdog(pings::incrementAndGet);

        watchdog.arm();
        TestAwait.until(() -> !unhealthy.isEmpty(), "unhealthy signal");
        Thread.sleep(200);

        assertEquals(List.of(1L), unhealthy);
        assertFalse(watchdog.isArmed());
        assertTrue(pings.get() >= 1);
    }

    @Test
    void testPongsKeepItHealthy() throws InterruptedException {
        KeepaliveWatchdog[] holder = new KeepaliveWatchdog[1];
        holder[0] = watchdog(() -> {
            pings.incrementAndGet();
            holder[0].onPong();
        });

        holder[0].arm();
        Thread.sleep(250);

        assertTrue(unhealthy.isEmpty());
        assertTrue(holder[0].isArmed());
        assertTrue(pings.get() >= 3);
        holder[0].disarm();
    }

    @Test
    void testDisarmStopsPingsAndChecks() throws InterruptedException {
        KeepaliveWatchdog watchdog = watchdog(pings::incrementAndGet);

        watchdog.arm();
        TestAwait.until(() -> pings.get() >= 1, "first ping");
        watchdog.disarm();
        int sent = pings.get();
        Thread.sleep(150);

        assertTrue(unhealthy.isEmpty());
        assertEquals(sent, pings.get());
    }

    @Test
    void testRearmStartsNewEpisode() {
        KeepaliveWatchdog watchdog = watchdog(pings::incrementAndGet);

        watchdog.arm();
        TestAwait.until(() -> unhealthy.size() == 1, "first episode");
        watchdog.arm();
        TestAwait.until(() -> unhealthy.size() == 2, "second episode");

        assertEquals(List.of(1L, 2L), unhealthy);
        assertEquals(2L, watchdog.getEpisode());
    }

    @Test
    void testArmIsIdempotentWhileArmed() {
        KeepaliveWatchdog watchdog = watchdog(pings::incrementAndGet);

        watchdog.arm();
        watchdog.arm();

        assertEquals(1L, watchdog.getEpisode());
        watchdog.disarm();
    }

    @Test
    void testFailingPingerStillTimesOut() {
        KeepaliveWatchdog watchdog = watchdog(() -> {
            throw new IllegalStateException("socket gone");
        });

        watchdog.arm();

        TestAwait.until(() -> unhealthy.size() == 1, "unhealthy after failed ping");
    }

    @Test
    void testRejectsNonPositiveDurations() {
        assertThrows(IllegalArgumentException.class, () -> new KeepaliveWatchdog("test", scheduler,
            Duration.ZERO, Duration.ofMillis(1), () -> { }, e -> { }));
        assertThrows(IllegalArgumentException.class, () -> new KeepaliveWatchdog("test", scheduler,
            Duration.ofMillis(1), Duration.ZERO, () -> { }, e -> { }));
    }
}
