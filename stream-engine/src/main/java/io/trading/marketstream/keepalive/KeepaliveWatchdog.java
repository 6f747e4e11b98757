package io.trading.marketstream.keepalive;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Pings while a subscription is active and reports it unhealthy when a pong does not follow.
 *
 * <p>Each {@link #arm()} starts a new episode. Within an episode the unhealthy callback fires at
 * most once, after which pinging stops until the watchdog is armed again. Timer tasks left over
 * from an earlier episode are ignored.
 */
public final class KeepaliveWatchdog {

    private static final Logger LOGGER = LoggerFactory.getLogger(KeepaliveWatchdog.class);

    /**
     * Receives the unhealthy signal.
     */
    @FunctionalInterface
    public interface UnhealthyListener {
        /**
         * @param episode the episode in which the pong timed out
         */
        void onUnhealthy(long episode);
    }

    private final String name;
    private final ScheduledExecutorService scheduler;
    private final long pingIntervalNanos;
    private final long pongTimeoutNanos;
    private final Runnable pinger;
    private final UnhealthyListener listener;

    private long episode = 0;
    private boolean armed = false;
    private boolean fired = false;
    private long lastPingNanos = 0;
    private long lastPongNanos = 0;
    private ScheduledFuture<?> pingTask;

    /**
     * @param name         name used in logs
     * @param scheduler    timer thread
     * @param pingInterval time between pings
     * @param pongTimeout  time allowed for a pong after each ping
     * @param pinger       sends one ping
     * @param listener     told when a pong times out
     */
    public KeepaliveWatchdog(
        String name,
        ScheduledExecutorService scheduler,
        Duration pingInterval,
        Duration pongTimeout,
        Runnable pinger,
        UnhealthyListener listener
    ) {
        if (pingInterval.isZero() || pingInterval.isNegative()) {
            throw new IllegalArgumentException("pingInterval must be positive");
        }
        if (pongTimeout.isZero() || pongTimeout.isNegative()) {
            throw new IllegalArgumentException("pongTimeout must be positive");
        }
        this.name = name;
        this.scheduler = scheduler;
        this.pingIntervalNanos = pingInterval.toNanos();
        this.pongTimeoutNanos = pongTimeout.toNanos();
        this.pinger = pinger;
        this.listener = listener;
    }

    /**
     * Starts a new episode. Does nothing if already armed.
     */
    public synchronized void arm() {
        if (armed) {
            return;
        }
        armed = true;
        fired = false;
        episode++;
        lastPongNanos = System.nanoTime();
        long current = episode;
        pingTask = scheduler.scheduleAtFixedRate(
            () -> ping(current), pingIntervalNanos, pingIntervalNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Stops pinging; pending timeout checks become no-ops.
     */
    public synchronized void disarm() {
        armed = false;
        if (pingTask != null) {
            pingTask.cancel(false);
            pingTask = null;
        }
    }

    /**
     * Records a liveness reply.
     */
    public synchronized void onPong() {
        lastPongNanos = System.nanoTime();
    }

    private void ping(long forEpisode) {
        long sentAt;
        synchronized (this) {
            if (!armed || fired || forEpisode != episode) {
                return;
            }
            sentAt = System.nanoTime();
            lastPingNanos = sentAt;
        }
        try {
            pinger.run();
        } catch (RuntimeException e) {
            LOGGER.warn("{}: Ping failed: {}", name, e.toString());
        }
        scheduler.schedule(() -> checkPong(forEpisode, sentAt), pongTimeoutNanos, TimeUnit.NANOSECONDS);
    }

    private void checkPong(long forEpisode, long pingSentNanos) {
        synchronized (this) {
            if (!armed || fired || forEpisode != episode || lastPongNanos - pingSentNanos >= 0) {
                return;
            }
            fired = true;
            disarm();
        }
        LOGGER.warn("{}: No pong within {} ms", name, TimeUnit.NANOSECONDS.toMillis(pongTimeoutNanos));
        listener.onUnhealthy(forEpisode);
    }

    public synchronized boolean isArmed() {
        return armed;
    }

    public synchronized long getEpisode() {
        return episode;
    }

    public synchronized long getLastPingNanos() {
        return lastPingNanos;
    }
}
