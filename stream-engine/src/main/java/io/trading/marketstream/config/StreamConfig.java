package io.trading.marketstream.config;

import io.trading.marketstream.channel.OverflowPolicy;

import java.time.Duration;
import java.util.Locale;
import java.util.function.Function;

/**
 * Configuration shared by every stream of a client.
 *
 * @param bufferSize              Data channel capacity, 0 for unbuffered hand-off
 * @param overflowPolicy          What a full data channel drops
 * @param reconnect               Whether lost connections are re-established
 * @param maxReconnectAttempts    Failed attempts before giving up, 0 for unlimited
 * @param baseDelay               Backoff delay for the first retry
 * @param maxDelay                Backoff delay ceiling
 * @param pingInterval            Keepalive ping interval while active
 * @param pongTimeout             Time allowed for a pong after each ping
 * @param connectTimeout          Time allowed to reach ACTIVE, including the first book snapshot
 * @param errorBufferSize         Error channel capacity
 * @param maxStreamsPerConnection Exchange topics carried by one physical connection
 * @param snapshotDepth           Levels requested when fetching an order book snapshot
 * @param maxBufferedDiffs        Diffs held while waiting for a snapshot
 */
public record StreamConfig(
    int bufferSize,
    OverflowPolicy overflowPolicy,
    boolean reconnect,
    int maxReconnectAttempts,
    Duration baseDelay,
    Duration maxDelay,
    Duration pingInterval,
    Duration pongTimeout,
    Duration connectTimeout,
    int errorBufferSize,
    int maxStreamsPerConnection,
    int snapshotDepth,
    int maxBufferedDiffs
) {
    public static final int DEFAULT_BUFFER_SIZE = 100;
    public static final int DEFAULT_MAX_RECONNECT_ATTEMPTS = 10;
    public static final Duration DEFAULT_BASE_DELAY = Duration.ofSeconds(1);
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(60);
    public static final Duration DEFAULT_PING_INTERVAL = Duration.ofSeconds(20);
    public static final Duration DEFAULT_PONG_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    public static final int DEFAULT_ERROR_BUFFER_SIZE = 10;
    public static final int DEFAULT_MAX_STREAMS_PER_CONNECTION = 200;
    public static final int DEFAULT_SNAPSHOT_DEPTH = 1000;
    public static final int DEFAULT_MAX_BUFFERED_DIFFS = 1000;

    public StreamConfig {
        if (bufferSize < 0) {
            throw new IllegalArgumentException("bufferSize must be non-negative, got " + bufferSize);
        }
        if (overflowPolicy == null) {
            throw new IllegalArgumentException("overflowPolicy cannot be null");
        }
        if (maxReconnectAttempts < 0) {
            throw new IllegalArgumentException("maxReconnectAttempts must be non-negative, got " + maxReconnectAttempts);
        }
        requirePositive("baseDelay", baseDelay);
        requirePositive("maxDelay", maxDelay);
        if (maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay " + maxDelay + " is less than baseDelay " + baseDelay);
        }
        if (pingInterval == null || pongTimeout == null) {
            throw new IllegalArgumentException("pingInterval and pongTimeout cannot be null");
        }
        if (reconnect) {
            requirePositive("pingInterval", pingInterval);
            requirePositive("pongTimeout", pongTimeout);
        }
        requirePositive("connectTimeout", connectTimeout);
        if (errorBufferSize < 1) {
            throw new IllegalArgumentException("errorBufferSize must be positive, got " + errorBufferSize);
        }
        if (maxStreamsPerConnection < 1) {
            throw new IllegalArgumentException("maxStreamsPerConnection must be positive, got " + maxStreamsPerConnection);
        }
        if (snapshotDepth < 1) {
            throw new IllegalArgumentException("snapshotDepth must be positive, got " + snapshotDepth);
        }
        if (maxBufferedDiffs < 1) {
            throw new IllegalArgumentException("maxBufferedDiffs must be positive, got " + maxBufferedDiffs);
        }
    }

    private static void requirePositive(String name, Duration value) {
        if (value == null || value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be positive, got " + value);
        }
    }

    /**
     * Returns whether the keepalive watchdog runs for active streams.
     */
    public boolean keepaliveEnabled() {
        return !pingInterval.isZero() && !pingInterval.isNegative()
            && !pongTimeout.isZero() && !pongTimeout.isNegative();
    }

    /**
     * Returns the default configuration.
     */
    public static StreamConfig defaults() {
        return builder().build();
    }

    /**
     * Loads configuration from environment variables, falling back to defaults.
     *
     * Environment variables:
     * - STREAM_BUFFER_SIZE, STREAM_OVERFLOW_POLICY (drop_newest|drop_oldest)
     * - STREAM_RECONNECT, STREAM_MAX_RECONNECT_ATTEMPTS
     * - STREAM_BASE_DELAY_MS, STREAM_MAX_DELAY_MS
     * - STREAM_PING_INTERVAL_MS, STREAM_PONG_TIMEOUT_MS, STREAM_CONNECT_TIMEOUT_MS
     * - STREAM_MAX_STREAMS_PER_CONNECTION, STREAM_SNAPSHOT_DEPTH
     */
    public static StreamConfig fromEnv() {
        return fromEnv(System::getenv);
    }

    static StreamConfig fromEnv(Function<String, String> env) {
        return builder()
            .bufferSize(EnvValues.parseInt(env, "STREAM_BUFFER_SIZE", DEFAULT_BUFFER_SIZE))
            .overflowPolicy(OverflowPolicy.valueOf(
                EnvValues.parseString(env, "STREAM_OVERFLOW_POLICY", "drop_newest").toUpperCase(Locale.ROOT)))
            .reconnect(EnvValues.parseBoolean(env, "STREAM_RECONNECT", true))
            .maxReconnectAttempts(EnvValues.parseInt(env, "STREAM_MAX_RECONNECT_ATTEMPTS", DEFAULT_MAX_RECONNECT_ATTEMPTS))
            .baseDelay(EnvValues.parseMillis(env, "STREAM_BASE_DELAY_MS", DEFAULT_BASE_DELAY))
            .maxDelay(EnvValues.parseMillis(env, "STREAM_MAX_DELAY_MS", DEFAULT_MAX_DELAY))
            .pingInterval(EnvValues.parseMillis(env, "STREAM_PING_INTERVAL_MS", DEFAULT_PING_INTERVAL))
            .pongTimeout(EnvValues.parseMillis(env, "STREAM_PONG_TIMEOUT_MS", DEFAULT_PONG_TIMEOUT))
            .connectTimeout(EnvValues.parseMillis(env, "STREAM_CONNECT_TIMEOUT_MS", DEFAULT_CONNECT_TIMEOUT))
            .maxStreamsPerConnection(EnvValues.parseInt(env, "STREAM_MAX_STREAMS_PER_CONNECTION",
                DEFAULT_MAX_STREAMS_PER_CONNECTION))
            .snapshotDepth(EnvValues.parseInt(env, "STREAM_SNAPSHOT_DEPTH", DEFAULT_SNAPSHOT_DEPTH))
            .build();
    }

    /**
     * Creates a new builder for StreamConfig.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a builder pre-filled with this configuration.
     */
    public Builder toBuilder() {
        return new Builder()
            .bufferSize(bufferSize)
            .overflowPolicy(overflowPolicy)
            .reconnect(reconnect)
            .maxReconnectAttempts(maxReconnectAttempts)
            .baseDelay(baseDelay)
            .maxDelay(maxDelay)
            .pingInterval(pingInterval)
            .pongTimeout(pongTimeout)
            .connectTimeout(connectTimeout)
            .errorBufferSize(errorBufferSize)
            .maxStreamsPerConnection(maxStreamsPerConnection)
            .snapshotDepth(snapshotDepth)
            .maxBufferedDiffs(maxBufferedDiffs);
    }

    /**
     * Builder for StreamConfig.
     */
    public static class Builder {
        private int bufferSize = DEFAULT_BUFFER_SIZE;
        private OverflowPolicy overflowPolicy = OverflowPolicy.DROP_NEWEST;
        private boolean reconnect = true;
        private int maxReconnectAttempts = DEFAULT_MAX_RECONNECT_ATTEMPTS;
        private Duration baseDelay = DEFAULT_BASE_DELAY;
        private Duration maxDelay = DEFAULT_MAX_DELAY;
        private Duration pingInterval = DEFAULT_PING_INTERVAL;
        private Duration pongTimeout = DEFAULT_PONG_TIMEOUT;
        private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;
        private int errorBufferSize = DEFAULT_ERROR_BUFFER_SIZE;
        private int maxStreamsPerConnection = DEFAULT_MAX_STREAMS_PER_CONNECTION;
        private int snapshotDepth = DEFAULT_SNAPSHOT_DEPTH;
        private int maxBufferedDiffs = DEFAULT_MAX_BUFFERED_DIFFS;

        public Builder bufferSize(int bufferSize) {
            this.bufferSize = bufferSize;
            return this;
        }

        public Builder overflowPolicy(OverflowPolicy overflowPolicy) {
            this.overflowPolicy = overflowPolicy;
            return this;
        }

        public Builder reconnect(boolean reconnect) {
            this.reconnect = reconnect;
            return this;
        }

        public Builder maxReconnectAttempts(int maxReconnectAttempts) {
            this.maxReconnectAttempts = maxReconnectAttempts;
            return this;
        }

        public Builder baseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder pingInterval(Duration pingInterval) {
            this.pingInterval = pingInterval;
            return this;
        }

        public Builder pongTimeout(Duration pongTimeout) {
            this.pongTimeout = pongTimeout;
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder errorBufferSize(int errorBufferSize) {
            this.errorBufferSize = errorBufferSize;
            return this;
        }

        public Builder maxStreamsPerConnection(int maxStreamsPerConnection) {
            this.maxStreamsPerConnection = maxStreamsPerConnection;
            return this;
        }

        public Builder snapshotDepth(int snapshotDepth) {
            this.snapshotDepth = snapshotDepth;
            return this;
        }

        public Builder maxBufferedDiffs(int maxBufferedDiffs) {
            this.maxBufferedDiffs = maxBufferedDiffs;
            return this;
        }

        public StreamConfig build() {
            return new StreamConfig(
                bufferSize,
                overflowPolicy,
                reconnect,
                maxReconnectAttempts,
                baseDelay,
                maxDelay,
                pingInterval,
                pongTimeout,
                connectTimeout,
                errorBufferSize,
                maxStreamsPerConnection,
                snapshotDepth,
                maxBufferedDiffs
            );
        }
    }
}
