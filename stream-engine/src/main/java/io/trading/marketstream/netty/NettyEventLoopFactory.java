package io.trading.marketstream.netty;

import io.netty.channel.EventLoopGroup;
import io.netty.channel.epoll.Epoll;
import io.netty.channel.epoll.EpollEventLoopGroup;
import io.netty.channel.epoll.EpollSocketChannel;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.util.concurrent.DefaultThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates client event loop groups.
 * Uses epoll on Linux, NIO on other platforms.
 */
public final class NettyEventLoopFactory {

    private static final Logger LOGGER = LoggerFactory.getLogger(NettyEventLoopFactory.class);
    private static final boolean EPOLL_AVAILABLE = Epoll.isAvailable();

    static {
        LOGGER.info("Netty: Using {} transport", EPOLL_AVAILABLE ? "native epoll" : "NIO");
    }

    private NettyEventLoopFactory() {
    }

    /**
     * Creates an event loop group whose threads are daemons named after the pool.
     *
     * @param threads  number of threads
     * @param poolName thread name prefix
     */
    public static EventLoopGroup createEventLoopGroup(int threads, String poolName) {
        DefaultThreadFactory threadFactory = new DefaultThreadFactory(poolName, true);
        if (EPOLL_AVAILABLE) {
            return new EpollEventLoopGroup(threads, threadFactory);
        }
        return new NioEventLoopGroup(threads, threadFactory);
    }

    /**
     * Gets the socket channel class matching {@link #createEventLoopGroup(int, String)}.
     */
    public static Class<? extends SocketChannel> getClientChannelClass() {
        return EPOLL_AVAILABLE ? EpollSocketChannel.class : NioSocketChannel.class;
    }

    public static boolean isEpollAvailable() {
        return EPOLL_AVAILABLE;
    }
}
