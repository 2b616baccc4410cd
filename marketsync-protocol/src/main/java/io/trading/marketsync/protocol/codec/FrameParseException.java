package io.trading.marketsync.protocol.codec;

/**
 * Thrown when an inbound frame is not valid JSON or its payload does not match the channel.
 */
public class FrameParseException extends RuntimeException {

    public FrameParseException(String message) {
        super(message);
    }

    public FrameParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
