package io.trading.marketsync.event;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for EventChannel.
 */
class EventChannelTest {

    @Test
    void testPublishAndPoll() throws InterruptedException {
        EventChannel<String> channel = new EventChannel<>(4);

        assertFalse(channel.publish("a"));
        assertFalse(channel.publish("b"));

        assertEquals(2, channel.size());
        assertEquals("a", channel.poll(10, TimeUnit.MILLISECONDS));
        assertEquals("b", channel.poll());
        assertNull(channel.poll());
    }

    @Test
    void testFullChannelDropsOldest() {
        EventChannel<Integer> channel = new EventChannel<>(3);
        for (int i = 1; i <= 3; i++) {
            channel.publish(i);
        }

        assertTrue(channel.publish(4));
        assertTrue(channel.publish(5));

        List<Integer> drained = new ArrayList<>();
        channel.drainTo(drained);
        assertEquals(List.of(3, 4, 5), drained);
        assertEquals(2, channel.droppedCount());
        assertEquals(3, channel.capacity());
    }

    @Test
    void testPollTimesOutWhenEmpty() throws InterruptedException {
        EventChannel<String> channel = new EventChannel<>(1);

        assertNull(channel.poll(5, TimeUnit.MILLISECONDS));
    }

    @Test
    void testRejectsNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new EventChannel<String>(0));
    }
}
