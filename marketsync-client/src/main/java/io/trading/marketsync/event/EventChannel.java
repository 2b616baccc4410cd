package io.trading.marketsync.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded, ordered event queue between the connection loop and the application.
 *
 * The producer never blocks. When the queue is full the oldest pending event is discarded
 * to make room, and a warning is logged.
 *
 * @param <E> Event type
 */
public class EventChannel<E> {

    private static final Logger LOGGER = LoggerFactory.getLogger(EventChannel.class);

    private final BlockingQueue<E> queue;
    private final int capacity;
    private final AtomicLong droppedCount = new AtomicLong(0);

    public EventChannel(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    /**
     * Publishes an event, dropping the oldest pending one if the channel is full.
     *
     * @return true if an older event had to be dropped
     */
    public boolean publish(E event) {
        boolean dropped = false;
        while (!queue.offer(event)) {
            E oldest = queue.poll();
            if (oldest != null) {
                dropped = true;
                long total = droppedCount.incrementAndGet();
                LOGGER.warn("Event channel full (capacity {}), dropped oldest event {} ({} dropped so far)",
                    capacity, oldest, total);
            }
        }
        return dropped;
    }

    /**
     * Waits up to the given time for the next event.
     *
     * @return the next event, or null if none arrived in time
     */
    public E poll(long timeout, TimeUnit unit) throws InterruptedException {
        return queue.poll(timeout, unit);
    }

    /**
     * Returns the next event without waiting, or null.
     */
    public E poll() {
        return queue.poll();
    }

    public E take() throws InterruptedException {
        return queue.take();
    }

    public int drainTo(Collection<? super E> target) {
        return queue.drainTo(target);
    }

    public int size() {
        return queue.size();
    }

    public int capacity() {
        return capacity;
    }

    public long droppedCount() {
        return droppedCount.get();
    }
}
