package com.vantage.fanout;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Bounded FIFO that evicts its oldest element instead of rejecting a new one.
 */
public class DropOldestBuffer<M> {

    private final int capacity;
    private final Deque<M> queue;
    private long dropped;

    public DropOldestBuffer(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Buffer capacity must be positive, got " + capacity);
        }
        this.capacity = capacity;
        this.queue = new ArrayDeque<>(capacity);
    }

    /**
     * Appends a message.
     *
     * @return true if an older message had to be dropped to make room
     */
    public synchronized boolean offer(M message) {
        boolean evicted = false;
        if (queue.size() == capacity) {
            queue.pollFirst();
            dropped++;
            evicted = true;
        }
        queue.addLast(message);
        return evicted;
    }

    public synchronized M poll() {
        return queue.pollFirst();
    }

    public synchronized int size() {
        return queue.size();
    }

    public synchronized long droppedCount() {
        return dropped;
    }

    public synchronized void clear() {
        queue.clear();
    }

    public int capacity() {
        return capacity;
    }
}
