package io.trading.marketsync.netty;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PongWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshaker;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshakerFactory;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketVersion;
import io.trading.marketsync.protocol.api.CloseCodes;
import io.trading.marketsync.transport.TransportListener;
import io.trading.marketsync.transport.TransportSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.util.concurrent.CompletableFuture;

/**
 * Netty handler for WebSocket client connections.
 * Handles handshake, frame processing, and connection lifecycle events.
 */
public class WebSocketClientHandler extends SimpleChannelInboundHandler<Object> {

    private static final Logger LOGGER = LoggerFactory.getLogger(WebSocketClientHandler.class);

    private final WebSocketClientHandshaker handshaker;
    private final TransportListener listener;
    private final CompletableFuture<TransportSession> handshakeFuture;

    private int closeCode = CloseCodes.ABNORMAL;
    private String closeReason = "Connection lost";
    private boolean closeReported;

    public WebSocketClientHandler(
        URI uri,
        HttpHeaders headers,
        int maxFramePayloadLength,
        TransportListener listener,
        CompletableFuture<TransportSession> handshakeFuture
    ) {
        this.handshaker = WebSocketClientHandshakerFactory.newHandshaker(
            uri,
            WebSocketVersion.V13,
            null,
            true,
            headers,
            maxFramePayloadLength
        );
        this.listener = listener;
        this.handshakeFuture = handshakeFuture;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) {
        handshaker.handshake(ctx.channel());
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) {
        LOGGER.debug("WebSocket channel inactive");
        if (!handshakeFuture.isDone()) {
            handshakeFuture.completeExceptionally(new IOException("Connection closed before handshake completed"));
            return;
        }
        // a failed open is reported through the future only
        if (handshakeFuture.isCompletedExceptionally()) {
            return;
        }
        if (!closeReported) {
            closeReported = true;
            listener.onClose(closeCode, closeReason);
        }
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, Object msg) {
        if (!handshaker.isHandshakeComplete()) {
            try {
                handshaker.finishHandshake(ctx.channel(), (FullHttpResponse) msg);
                LOGGER.debug("WebSocket handshake complete");
                if (!handshakeFuture.complete(new NettySession(ctx.channel()))) {
                    // caller gave up waiting
                    LOGGER.debug("Handshake completed after the connect deadline, closing");
                    closeReported = true;
                    ctx.close();
                }
            } catch (RuntimeException e) {
                LOGGER.error("WebSocket handshake failed", e);
                closeReported = true;
                handshakeFuture.completeExceptionally(e);
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
            try {
                listener.onText(textFrame.text());
            } catch (RuntimeException e) {
                LOGGER.error("Error in message handler", e);
                listener.onError(e);
            }
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
            LOGGER.debug("Received close frame: {} {}", close.statusCode(), close.reasonText());
            if (close.statusCode() >= 0) {
                closeCode = close.statusCode();
                closeReason = close.reasonText();
            } else {
                closeCode = CloseCodes.NORMAL;
                closeReason = "";
            }
            ctx.close();
            return;
        }

        LOGGER.warn("Unsupported frame type: {}", frame.getClass().getName());
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (!handshakeFuture.isDone()) {
            LOGGER.error("WebSocket exception during handshake", cause);
            closeReported = true;
            handshakeFuture.completeExceptionally(cause);
        } else {
            LOGGER.error("WebSocket exception", cause);
            listener.onError(cause);
        }
        ctx.close();
    }
}
