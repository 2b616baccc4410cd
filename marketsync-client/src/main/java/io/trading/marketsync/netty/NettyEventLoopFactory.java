package io.trading.marketsync.netty;

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
 * Factory for creating Netty event loop groups.
 * Uses epoll on Linux, NIO on other platforms.
 */
public final class NettyEventLoopFactory {

    private static final Logger LOGGER = LoggerFactory.getLogger(NettyEventLoopFactory.class);

    private static final boolean EPOLL_AVAILABLE = Epoll.isAvailable();

    static {
        if (EPOLL_AVAILABLE) {
            LOGGER.info("Netty: Using native epoll transport");
        } else {
            LOGGER.info("Netty: Using NIO transport");
        }
    }

    private NettyEventLoopFactory() {
    }

    /**
     * Creates an EventLoopGroup of daemon threads.
     *
     * @param threads    Number of threads
     * @param poolName   Thread name prefix
     * @return EventLoopGroup instance
     */
    public static EventLoopGroup createEventLoopGroup(int threads, String poolName) {
        DefaultThreadFactory threadFactory = new DefaultThreadFactory(poolName, true);
        if (EPOLL_AVAILABLE) {
            return new EpollEventLoopGroup(threads, threadFactory);
        } else {
            return new NioEventLoopGroup(threads, threadFactory);
        }
    }

    /**
     * Gets the appropriate SocketChannel class for the current platform.
     */
    public static Class<? extends SocketChannel> getClientChannelClass() {
        if (EPOLL_AVAILABLE) {
            return EpollSocketChannel.class;
        } else {
            return NioSocketChannel.class;
        }
    }

    public static boolean isEpollAvailable() {
        return EPOLL_AVAILABLE;
    }
}
