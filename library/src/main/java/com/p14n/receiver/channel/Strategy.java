package com.p14n.receiver.channel;

/**
 * Buffering strategy of a channel. Decides which previously broadcast values
 * a listener receives when it attaches.
 *
 * <ul>
 * <li>{@link Kind#NO_BUFFERING}: nothing is retained, a listener only sees
 * values broadcast after it attached</li>
 * <li>{@link Kind#BOUNDED_REPLAY}: the most recent {@code capacity} values are
 * retained and replayed, oldest first</li>
 * <li>{@link Kind#UNBOUNDED_REPLAY}: every value is retained and replayed</li>
 * </ul>
 *
 * <p>
 * Expecting replay from a no-buffering channel is a design mistake, not a
 * runtime error: such a channel silently discards values broadcast while
 * nobody listens.
 * </p>
 *
 * <pre>{@code
 * ChannelPair<Integer> pair = Channels.make(Strategy.boundedReplay(1));
 * pair.emitter().broadcast(1); // evicted by the next value
 * pair.emitter().broadcast(2); // retained
 * pair.channel().listen(value -> ...); // receives 2, then 3
 * pair.emitter().broadcast(3);
 * }</pre>
 *
 * @param kind     The kind of buffering
 * @param capacity Number of values retained: 0 for no buffering,
 *                 {@link Integer#MAX_VALUE} for unbounded replay
 */
public record Strategy(Kind kind, int capacity) {

    public enum Kind {
        NO_BUFFERING,
        BOUNDED_REPLAY,
        UNBOUNDED_REPLAY
    }

    private static final Strategy NO_BUFFERING = new Strategy(Kind.NO_BUFFERING, 0);
    private static final Strategy UNBOUNDED_REPLAY = new Strategy(Kind.UNBOUNDED_REPLAY, Integer.MAX_VALUE);

    public Strategy {
        if (kind == null) {
            throw new IllegalArgumentException("Kind cannot be null");
        }
        if (capacity < 0) {
            throw new IllegalArgumentException("Capacity cannot be negative: " + capacity);
        }
        if (kind == Kind.NO_BUFFERING && capacity != 0) {
            throw new IllegalArgumentException("No buffering retains nothing, capacity must be 0");
        }
        if (kind == Kind.UNBOUNDED_REPLAY && capacity != Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Unbounded replay capacity must be Integer.MAX_VALUE");
        }
    }

    public static Strategy noBuffering() {
        return NO_BUFFERING;
    }

    /**
     * Retains the most recent {@code capacity} values. A capacity of 0 retains
     * nothing; {@link Integer#MAX_VALUE} behaves as unbounded replay.
     *
     * @param capacity The number of values to retain
     * @return The strategy
     * @throws IllegalArgumentException if the capacity is negative
     */
    public static Strategy boundedReplay(int capacity) {
        return new Strategy(Kind.BOUNDED_REPLAY, capacity);
    }

    public static Strategy unboundedReplay() {
        return UNBOUNDED_REPLAY;
    }

    /**
     * @return true if a listener attaching late can receive earlier values
     */
    public boolean replays() {
        return capacity > 0;
    }
}
