package io.trading.marketstream.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Summary;
import io.trading.marketstream.parser.model.Exchange;
import io.trading.marketstream.parser.model.FeedKind;
import io.trading.marketstream.stream.ErrorCategory;
import io.trading.marketstream.stream.StreamState;

/**
 * Prometheus metrics for market data streams.
 *
 * Tracks:
 * - Events emitted and dropped per exchange and feed
 * - Errors per exchange and category, decode errors and sequence gaps
 * - Reconnect attempts
 * - Open connections and subscriptions per state
 * - Order book snapshot fetch latency
 */
public class StreamMetrics {

    private final CollectorRegistry registry;

    private final Counter eventsEmitted;
    private final Counter eventsDropped;
    private final Counter errors;
    private final Counter decodeErrors;
    private final Counter sequenceGaps;
    private final Counter reconnects;

    private final Gauge connections;
    private final Gauge subscriptions;

    private final Summary snapshotLatencySeconds;

    /**
     * Registers the metrics with the default registry.
     */
    public StreamMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public StreamMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.eventsEmitted = Counter.build()
            .name("marketstream_events_emitted_total")
            .help("Events delivered to subscriber data channels")
            .labelNames("exchange", "feed")
            .register(registry);

        this.eventsDropped = Counter.build()
            .name("marketstream_events_dropped_total")
            .help("Events dropped because a subscriber data channel was full")
            .labelNames("exchange", "feed")
            .register(registry);

        this.errors = Counter.build()
            .name("marketstream_errors_total")
            .help("Stream errors by category")
            .labelNames("exchange", "category")
            .register(registry);

        this.decodeErrors = Counter.build()
            .name("marketstream_decode_errors_total")
            .help("Inbound messages that could not be decoded")
            .labelNames("exchange")
            .register(registry);

        this.sequenceGaps = Counter.build()
            .name("marketstream_sequence_gaps_total")
            .help("Order book sequence gaps detected")
            .labelNames("exchange")
            .register(registry);

        this.reconnects = Counter.build()
            .name("marketstream_reconnects_total")
            .help("Subscription reconnect attempts")
            .labelNames("exchange")
            .register(registry);

        // 1 per open physical connection
        this.connections = Gauge.build()
            .name("marketstream_connections")
            .help("Open WebSocket connections")
            .labelNames("exchange")
            .register(registry);

        this.subscriptions = Gauge.build()
            .name("marketstream_subscriptions")
            .help("Subscriptions by lifecycle state")
            .labelNames("exchange", "state")
            .register(registry);

        this.snapshotLatencySeconds = Summary.build()
            .name("marketstream_snapshot_latency_seconds")
            .help("Order book snapshot fetch latency in seconds")
            .labelNames("exchange")
            .quantile(0.5, 0.05)
            .quantile(0.99, 0.001)
            .register(registry);
    }

    public void recordEmitted(Exchange exchange, FeedKind feedKind) {
        eventsEmitted.labels(exchange.name(), feedKind.name()).inc();
    }

    public void recordDropped(Exchange exchange, FeedKind feedKind) {
        eventsDropped.labels(exchange.name(), feedKind.name()).inc();
    }

    public void recordError(Exchange exchange, ErrorCategory category) {
        errors.labels(exchange.name(), category.name()).inc();
    }

    public void recordDecodeError(Exchange exchange) {
        decodeErrors.labels(exchange.name()).inc();
    }

    public void recordSequenceGap(Exchange exchange) {
        sequenceGaps.labels(exchange.name()).inc();
    }

    public void recordReconnect(Exchange exchange) {
        reconnects.labels(exchange.name()).inc();
    }

    public void connectionOpened(Exchange exchange) {
        connections.labels(exchange.name()).inc();
    }

    public void connectionClosed(Exchange exchange) {
        connections.labels(exchange.name()).dec();
    }

    /**
     * Moves one subscription between state gauges. {@code from} may be null for a new subscription.
     */
    public void recordTransition(Exchange exchange, StreamState from, StreamState to) {
        if (from != null) {
            subscriptions.labels(exchange.name(), from.name()).dec();
        }
        if (to != StreamState.CLOSED) {
            subscriptions.labels(exchange.name(), to.name()).inc();
        }
    }

    public void recordSnapshotLatency(Exchange exchange, long nanos) {
        snapshotLatencySeconds.labels(exchange.name()).observe(nanos / 1e9);
    }

    public double getEmitted(Exchange exchange, FeedKind feedKind) {
        return eventsEmitted.labels(exchange.name(), feedKind.name()).get();
    }

    public double getDropped(Exchange exchange, FeedKind feedKind) {
        return eventsDropped.labels(exchange.name(), feedKind.name()).get();
    }

    public double getErrors(Exchange exchange, ErrorCategory category) {
        return errors.labels(exchange.name(), category.name()).get();
    }

    public double getDecodeErrors(Exchange exchange) {
        return decodeErrors.labels(exchange.name()).get();
    }

    public double getSequenceGaps(Exchange exchange) {
        return sequenceGaps.labels(exchange.name()).get();
    }

    public double getReconnects(Exchange exchange) {
        return reconnects.labels(exchange.name()).get();
    }

    public double getConnections(Exchange exchange) {
        return connections.labels(exchange.name()).get();
    }

    public double getSubscriptions(Exchange exchange, StreamState state) {
        return subscriptions.labels(exchange.name(), state.name()).get();
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
