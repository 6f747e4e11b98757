package io.trading.marketstream.netty;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelPromise;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PongWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshaker;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshakerFactory;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketVersion;
import io.trading.marketstream.transport.TransportListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;

/**
 * Netty handler for one exchange WebSocket connection.
 * Completes the handshake, answers server pings, forwards text and pong frames to the
 * listener and reports the close exactly once.
 */
public class WebSocketClientHandler extends SimpleChannelInboundHandler<Object> {

    private static final Logger LOGGER = LoggerFactory.getLogger(WebSocketClientHandler.class);
    private static final int MAX_FRAME_PAYLOAD = 1 << 20;

    private final String name;
    private final WebSocketClientHandshaker handshaker;
    private final TransportListener listener;

    private ChannelPromise handshakeFuture;
    private Throwable failure;
    private boolean closeReported = false;

    public WebSocketClientHandler(URI uri, String name, TransportListener listener) {
        this.name = name;
        this.handshaker = WebSocketClientHandshakerFactory.newHandshaker(
            uri,
            WebSocketVersion.V13,
            null,
            true,
            new DefaultHttpHeaders(),
            MAX_FRAME_PAYLOAD
        );
        this.listener = listener;
    }

    /**
     * Future completed when the WebSocket handshake finishes.
     */
    public ChannelPromise handshakeFuture() {
        return handshakeFuture;
    }

    @Override
    public void handlerAdded(ChannelHandlerContext ctx) {
        handshakeFuture = ctx.newPromise();
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) {
        handshaker.handshake(ctx.channel());
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) {
        LOGGER.debug("{}: Channel inactive", name);
        if (!handshakeFuture.isDone()) {
            handshakeFuture.tryFailure(failure != null ? failure
                : new IllegalStateException("connection closed during handshake"));
            return;
        }
        if (handshakeFuture.isSuccess() && !closeReported) {
            closeReported = true;
            listener.onClosed(failure);
        }
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, Object msg) {
        if (!handshaker.isHandshakeComplete()) {
            try {
                handshaker.finishHandshake(ctx.channel(), (FullHttpResponse) msg);
                LOGGER.debug("{}: Handshake complete", name);
                handshakeFuture.setSuccess();
            } catch (Exception e) {
                LOGGER.error("{}: Handshake failed", name, e);
                handshakeFuture.tryFailure(e);
                ctx.close();
            }
            return;
        }

        if (msg instanceof FullHttpResponse response) {
            throw new IllegalStateException(
                "Unexpected FullHttpResponse (status=" + response.status() + ")"
            );
        }

        WebSocketFrame frame = (WebSocketFrame) msg;

        if (frame instanceof TextWebSocketFrame textFrame) {
            listener.onMessage(textFrame.text());
            return;
        }

        if (frame instanceof PingWebSocketFrame ping) {
            ctx.writeAndFlush(new PongWebSocketFrame(ping.content().retain()));
            return;
        }

        if (frame instanceof PongWebSocketFrame) {
            listener.onPong();
            return;
        }

        if (frame instanceof CloseWebSocketFrame close) {
            LOGGER.debug("{}: Received close frame {} {}", name, close.statusCode(), close.reasonText());
            ctx.close();
            return;
        }

        LOGGER.warn("{}: Unsupported frame type: {}", name, frame.getClass().getName());
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        LOGGER.warn("{}: WebSocket exception: {}", name, cause.toString());
        if (failure == null) {
            failure = cause;
        }
        if (!handshakeFuture.isDone()) {
            handshakeFuture.tryFailure(cause);
        }
        ctx.close();
    }
}
