package io.trading.marketstream.netty;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrameAggregator;
import io.netty.handler.codec.http.websocketx.extensions.compression.WebSocketClientCompressionHandler;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.trading.marketstream.transport.Transport;
import io.trading.marketstream.transport.TransportConnection;
import io.trading.marketstream.transport.TransportListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLException;
import java.net.URI;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * WebSocket transport on Netty. All connections opened by one instance share an event loop group.
 */
public class NettyWebSocketTransport implements Transport {

    private static final Logger LOGGER = LoggerFactory.getLogger(NettyWebSocketTransport.class);
    private static final int MAX_MESSAGE_SIZE = 4 << 20;

    private final EventLoopGroup eventLoopGroup;
    private final SslContext sslContext;
    private final Duration connectTimeout;
    private final boolean enableCompression;

    /**
     * Creates a transport with compression enabled.
     *
     * @param threads        event loop threads
     * @param connectTimeout TCP connect timeout
     */
    public NettyWebSocketTransport(int threads, Duration connectTimeout) {
        this(threads, connectTimeout, true);
    }

    /**
     * @param threads           event loop threads
     * @param connectTimeout    TCP connect timeout
     * @param enableCompression whether to negotiate permessage-deflate (some servers have non-standard implementations)
     */
    public NettyWebSocketTransport(int threads, Duration connectTimeout, boolean enableCompression) {
        this.connectTimeout = connectTimeout;
        this.enableCompression = enableCompression;
        try {
            this.sslContext = SslContextBuilder.forClient()
                .protocols("TLSv1.2", "TLSv1.3")
                .build();
        } catch (SSLException e) {
            throw new IllegalStateException("Failed to create SSL context", e);
        }
        this.eventLoopGroup = NettyEventLoopFactory.createEventLoopGroup(threads, "ws-transport");
    }

    @Override
    public CompletableFuture<TransportConnection> open(URI endpoint, String name, TransportListener listener) {
        CompletableFuture<TransportConnection> result = new CompletableFuture<>();
        boolean secure = "wss".equalsIgnoreCase(endpoint.getScheme());
        String host = endpoint.getHost();
        int port = endpoint.getPort() > 0 ? endpoint.getPort() : (secure ? 443 : 80);
        WebSocketClientHandler handler = new WebSocketClientHandler(endpoint, name, listener);

        Bootstrap bootstrap = new Bootstrap()
            .group(eventLoopGroup)
            .channel(NettyEventLoopFactory.getClientChannelClass())
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) connectTimeout.toMillis())
            .option(ChannelOption.TCP_NODELAY, true)
            .handler(new ChannelInitializer<Channel>() {
                @Override
                protected void initChannel(Channel ch) {
                    ChannelPipeline pipeline = ch.pipeline();
                    if (secure) {
                        pipeline.addLast(sslContext.newHandler(ch.alloc(), host, port));
                    }
                    pipeline.addLast(new HttpClientCodec());
                    pipeline.addLast(new HttpObjectAggregator(8192));
                    if (enableCompression) {
                        pipeline.addLast(WebSocketClientCompressionHandler.INSTANCE);
                    }
                    pipeline.addLast(new WebSocketFrameAggregator(MAX_MESSAGE_SIZE));
                    pipeline.addLast(handler);
                }
            });

        LOGGER.info("{}: Connecting to {}:{}...", name, host, port);
        ChannelFuture connectFuture = bootstrap.connect(host, port);
        connectFuture.addListener(connected -> {
            if (!connected.isSuccess()) {
                LOGGER.warn("{}: Failed to connect: {}", name, connected.cause().toString());
                result.completeExceptionally(connected.cause());
                return;
            }
            Channel channel = connectFuture.channel();
            handler.handshakeFuture().addListener(handshake -> {
                if (handshake.isSuccess()) {
                    LOGGER.info("{}: Connected", name);
                    result.complete(new NettyConnection(name, channel));
                } else {
                    result.completeExceptionally(handshake.cause());
                    channel.close();
                }
            });
        });
        return result;
    }

    @Override
    public void close() {
        eventLoopGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS);
        LOGGER.info("WebSocket transport closed");
    }

    private static final class NettyConnection implements TransportConnection {

        private final String name;
        private final Channel channel;

        private NettyConnection(String name, Channel channel) {
            this.name = name;
            this.channel = channel;
        }

        @Override
        public void send(String text) {
            if (!channel.isActive()) {
                LOGGER.warn("{}: Cannot send message, not connected", name);
                return;
            }
            channel.writeAndFlush(new TextWebSocketFrame(text));
        }

        @Override
        public void ping() {
            if (channel.isActive()) {
                channel.writeAndFlush(new PingWebSocketFrame());
            }
        }

        @Override
        public boolean isOpen() {
            return channel.isActive();
        }

        @Override
        public void close() {
            channel.close();
        }

        @Override
        public String toString() {
            return name + "/" + channel.id().asShortText();
        }
    }
}
