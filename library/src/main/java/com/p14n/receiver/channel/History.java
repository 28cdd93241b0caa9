package com.p14n.receiver.channel;

import java.util.ArrayDeque;

import com.google.common.collect.ImmutableList;

/**
 * Ordered buffer of previously broadcast values, bounded by the channel's
 * strategy. Not thread-safe; the owning channel guards it with its state lock.
 */
final class History<V> {

    private final int capacity;
    private final ArrayDeque<V> values = new ArrayDeque<>();

    History(Strategy strategy) {
        this.capacity = strategy.capacity();
    }

    void append(V value) {
        if (capacity == 0) {
            return;
        }
        values.addLast(value);
        while (values.size() > capacity) {
            values.removeFirst();
        }
    }

    /**
     * @return the retained values, oldest first
     */
    ImmutableList<V> snapshot() {
        return ImmutableList.copyOf(values);
    }

    int size() {
        return values.size();
    }
}
