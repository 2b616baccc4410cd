package io.trading.marketsync.netty;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.websocketx.WebSocketFrameAggregator;
import io.netty.handler.codec.http.websocketx.extensions.compression.WebSocketClientCompressionHandler;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.SslProvider;
import io.trading.marketsync.transport.Transport;
import io.trading.marketsync.transport.TransportListener;
import io.trading.marketsync.transport.TransportSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLException;
import java.net.URI;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Netty-based WebSocket transport.
 * Supports both epoll (Linux) and NIO (universal) event loop groups. One I/O thread is
 * shared by every session opened through this transport.
 */
public class NettyTransport implements Transport {

    private static final Logger LOGGER = LoggerFactory.getLogger(NettyTransport.class);
    static final int MAX_FRAME_PAYLOAD = 1 << 20;

    private final int connectTimeoutMs;
    private final boolean enableCompression;

    private EventLoopGroup eventLoopGroup;
    private SslContext sslContext;

    public NettyTransport(int connectTimeoutMs) {
        this(connectTimeoutMs, true);
    }

    /**
     * @param connectTimeoutMs  TCP connect timeout
     * @param enableCompression Whether to negotiate permessage-deflate
     */
    public NettyTransport(int connectTimeoutMs, boolean enableCompression) {
        this.connectTimeoutMs = connectTimeoutMs;
        this.enableCompression = enableCompression;
    }

    @Override
    public synchronized CompletableFuture<TransportSession> open(
        URI uri,
        Map<String, String> headers,
        TransportListener listener
    ) {
        CompletableFuture<TransportSession> handshakeFuture = new CompletableFuture<>();
        boolean secure = "wss".equalsIgnoreCase(uri.getScheme());

        SslContext ssl = null;
        if (secure) {
            try {
                ssl = sslContext();
            } catch (SSLException e) {
                LOGGER.error("Failed to create SSL context", e);
                handshakeFuture.completeExceptionally(e);
                return handshakeFuture;
            }
        }

        HttpHeaders httpHeaders = new DefaultHttpHeaders();
        headers.forEach(httpHeaders::add);

        String host = uri.getHost();
        int port = uri.getPort() > 0 ? uri.getPort() : (secure ? 443 : 80);
        SslContext pipelineSsl = ssl;

        Bootstrap bootstrap = new Bootstrap()
            .group(eventLoopGroup())
            .channel(NettyEventLoopFactory.getClientChannelClass())
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMs)
            .handler(new ChannelInitializer<SocketChannel>() {
                @Override
                protected void initChannel(SocketChannel ch) {
                    ChannelPipeline pipeline = ch.pipeline();

                    if (pipelineSsl != null) {
                        pipeline.addLast(pipelineSsl.newHandler(ch.alloc(), host, port));
                    }

                    addWebSocketHandlers(pipeline, enableCompression, new WebSocketClientHandler(
                        uri, httpHeaders, MAX_FRAME_PAYLOAD, listener, handshakeFuture));
                }
            });

        LOGGER.info("Connecting to {}:{}...", host, port);
        bootstrap.connect(host, port).addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                handshakeFuture.completeExceptionally(future.cause());
            }
        });
        return handshakeFuture;
    }

    /**
     * Adds the HTTP upgrade and WebSocket handlers. Fragmented messages are reassembled before
     * they reach the client handler.
     */
    static void addWebSocketHandlers(ChannelPipeline pipeline, boolean enableCompression, WebSocketClientHandler handler) {
        pipeline.addLast(new HttpClientCodec());
        pipeline.addLast(new HttpObjectAggregator(8192));

        if (enableCompression) {
            pipeline.addLast(WebSocketClientCompressionHandler.INSTANCE);
        }

        pipeline.addLast(new WebSocketFrameAggregator(MAX_FRAME_PAYLOAD));
        pipeline.addLast(handler);
    }

    private EventLoopGroup eventLoopGroup() {
        if (eventLoopGroup == null) {
            eventLoopGroup = NettyEventLoopFactory.createEventLoopGroup(1, "marketsync-io");
        }
        return eventLoopGroup;
    }

    private SslContext sslContext() throws SSLException {
        if (sslContext == null) {
            sslContext = SslContextBuilder.forClient()
                .protocols("TLSv1.2", "TLSv1.3")
                .sslProvider(SslProvider.JDK)
                .build();
        }
        return sslContext;
    }

    @Override
    public synchronized void close() {
        if (eventLoopGroup != null) {
            eventLoopGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS);
            eventLoopGroup = null;
            LOGGER.info("Transport closed");
        }
    }
}
