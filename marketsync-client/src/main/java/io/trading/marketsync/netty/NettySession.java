package io.trading.marketsync.netty;

import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.trading.marketsync.transport.TransportSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link TransportSession} over an upgraded Netty channel.
 */
final class NettySession implements TransportSession {

    private static final Logger LOGGER = LoggerFactory.getLogger(NettySession.class);

    private final Channel channel;

    NettySession(Channel channel) {
        this.channel = channel;
    }

    @Override
    public void send(String text) {
        if (!channel.isActive()) {
            throw new IllegalStateException("Channel is closed");
        }
        channel.writeAndFlush(new TextWebSocketFrame(text)).addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                LOGGER.warn("Failed to write frame to {}", channel.remoteAddress(), future.cause());
            }
        });
    }

    @Override
    public void close(int code, String reason) {
        if (!channel.isActive()) {
            return;
        }
        channel.writeAndFlush(new CloseWebSocketFrame(code, reason))
            .addListener(ChannelFutureListener.CLOSE);
    }

    @Override
    public boolean isOpen() {
        return channel.isActive();
    }

    @Override
    public String toString() {
        return "NettySession{" + channel.remoteAddress() + "}";
    }
}
