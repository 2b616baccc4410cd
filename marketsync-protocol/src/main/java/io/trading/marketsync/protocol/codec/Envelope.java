package io.trading.marketsync.protocol.codec;

import com.fasterxml.jackson.databind.JsonNode;
import io.trading.marketsync.protocol.api.Channel;

import java.util.Optional;

/**
 * Outer {@code {"type": ..., "data": ...}} wrapper of an inbound frame.
 *
 * @param type Raw channel tag
 * @param data Payload, a missing node when the frame has none
 */
public record Envelope(String type, JsonNode data) {

    public Optional<Channel> channel() {
        return Channel.fromTag(type);
    }
}
