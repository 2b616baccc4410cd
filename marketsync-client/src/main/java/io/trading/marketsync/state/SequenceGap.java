package io.trading.marketsync.state;

/**
 * A delta arrived out of sequence.
 *
 * @param expected Sequence number the book was waiting for
 * @param received Sequence number of the rejected delta
 */
public record SequenceGap(long expected, long received) {
}
