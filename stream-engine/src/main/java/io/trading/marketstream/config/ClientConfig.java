package io.trading.marketstream.config;

import io.trading.marketstream.parser.model.Exchange;
import io.trading.marketstream.parser.model.Symbol;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Configuration of a market data client and the console application.
 *
 * @param exchange         Exchange to connect to
 * @param testnet          Whether to use the exchange's test endpoints
 * @param stream           Settings shared by every stream
 * @param transportThreads Netty event loop threads
 * @param metricsPort      Port for the metrics HTTP server, 0 to disable it
 * @param symbols          Symbols the console application subscribes to
 */
public record ClientConfig(
    Exchange exchange,
    boolean testnet,
    StreamConfig stream,
    int transportThreads,
    int metricsPort,
    List<Symbol> symbols
) {
    private static final int DEFAULT_TRANSPORT_THREADS = 1;
    private static final int DEFAULT_METRICS_PORT = 9090;
    private static final String DEFAULT_SYMBOLS = "BTCUSDT,ETHUSDT";

    public ClientConfig {
        if (exchange == null) {
            throw new IllegalArgumentException("exchange cannot be null");
        }
        if (stream == null) {
            throw new IllegalArgumentException("stream config cannot be null");
        }
        if (transportThreads < 1) {
            throw new IllegalArgumentException("transportThreads must be positive");
        }
        if (metricsPort < 0 || metricsPort > 65535) {
            throw new IllegalArgumentException("metricsPort must be between 0 and 65535");
        }
        symbols = symbols == null ? List.of() : List.copyOf(symbols);
    }

    /**
     * Loads configuration from environment variables.
     *
     * Environment variables:
     * - EXCHANGE: binance or bybit (default: binance)
     * - TESTNET: use test endpoints (default: false)
     * - TRANSPORT_THREADS: Netty event loop threads (default: 1)
     * - METRICS_PORT: metrics HTTP port, 0 disables it (default: 9090)
     * - SYMBOLS: comma-separated symbols (default: "BTCUSDT,ETHUSDT")
     * - STREAM_*: see {@link StreamConfig#fromEnv()}
     */
    public static ClientConfig fromEnv() {
        return fromEnv(System::getenv);
    }

    static ClientConfig fromEnv(Function<String, String> env) {
        String exchange = EnvValues.parseString(env, "EXCHANGE", "binance");
        String symbols = EnvValues.parseString(env, "SYMBOLS", DEFAULT_SYMBOLS);
        return builder()
            .exchange(Exchange.valueOf(exchange.toUpperCase(Locale.ROOT)))
            .testnet(EnvValues.parseBoolean(env, "TESTNET", false))
            .stream(StreamConfig.fromEnv(env))
            .transportThreads(EnvValues.parseInt(env, "TRANSPORT_THREADS", DEFAULT_TRANSPORT_THREADS))
            .metricsPort(EnvValues.parseInt(env, "METRICS_PORT", DEFAULT_METRICS_PORT))
            .symbols(parseSymbols(symbols))
            .build();
    }

    static List<Symbol> parseSymbols(String value) {
        return Arrays.stream(value.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .map(Symbol::of)
            .distinct()
            .collect(Collectors.toList());
    }

    /**
     * Creates a new builder for ClientConfig.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for ClientConfig.
     */
    public static class Builder {
        private Exchange exchange = Exchange.BINANCE;
        private boolean testnet = false;
        private StreamConfig stream = StreamConfig.defaults();
        private int transportThreads = DEFAULT_TRANSPORT_THREADS;
        private int metricsPort = 0;
        private List<Symbol> symbols = List.of();

        public Builder exchange(Exchange exchange) {
            this.exchange = exchange;
            return this;
        }

        public Builder testnet(boolean testnet) {
            this.testnet = testnet;
            return this;
        }

        public Builder stream(StreamConfig stream) {
            this.stream = stream;
            return this;
        }

        public Builder transportThreads(int transportThreads) {
            this.transportThreads = transportThreads;
            return this;
        }

        public Builder metricsPort(int metricsPort) {
            this.metricsPort = metricsPort;
            return this;
        }

        public Builder symbols(List<Symbol> symbols) {
            this.symbols = symbols;
            return this;
        }

        public ClientConfig build() {
            return new ClientConfig(exchange, testnet, stream, transportThreads, metricsPort, symbols);
        }
    }
}
