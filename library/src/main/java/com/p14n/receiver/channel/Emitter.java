package com.p14n.receiver.channel;

/**
 * Write-only side of an emitter/channel pair. Holds its channel strongly;
 * the channel lives as long as the emitter (or any other holder) does.
 *
 * @param <V> The type of values broadcast
 */
public final class Emitter<V> {

    private final Channel<V> channel;

    Emitter(Channel<V> channel) {
        this.channel = channel;
    }

    /**
     * Sends a value to every listener of the paired channel and, depending on
     * the channel's strategy, retains it for listeners attaching later.
     *
     * @param value The value to broadcast, never null
     * @throws NullPointerException if the value is null
     */
    public void broadcast(V value) {
        channel.append(value);
    }

    /**
     * Broadcasts each value in iteration order.
     *
     * @param values The values to broadcast
     */
    public void broadcastAll(Iterable<? extends V> values) {
        for (V value : values) {
            channel.append(value);
        }
    }
}
