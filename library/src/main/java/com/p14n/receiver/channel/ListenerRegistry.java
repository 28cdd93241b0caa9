package com.p14n.receiver.channel;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

import com.google.common.collect.ImmutableList;

/**
 * Mapping from listener tokens to handlers.
 * Tokens increase monotonically and are never reused, so a stale token can
 * never remove a listener registered later.
 *
 * <p>
 * Not thread-safe. {@link Channel} guards it with the same lock as its
 * history, so a registration and the history snapshot it replays are taken
 * together.
 * </p>
 *
 * @param <V> The type of values the handlers accept
 */
final class ListenerRegistry<V> {

    private final Map<Long, Consumer<? super V>> handlers = new LinkedHashMap<>();
    private long nextToken;

    /**
     * Registers a handler.
     *
     * @param handler The handler to register
     * @return The token identifying the registration
     */
    long add(Consumer<? super V> handler) {
        Objects.requireNonNull(handler, "handler");
        long token = nextToken++;
        handlers.put(token, handler);
        return token;
    }

    /**
     * Removes a registration.
     *
     * @param token The token returned by {@link #add(Consumer)}
     * @return true if a handler was removed, false if the token was unknown
     */
    boolean remove(long token) {
        return handlers.remove(token) != null;
    }

    /**
     * Copies out the current handlers, so callers may invoke them after
     * releasing the guarding lock.
     *
     * @return The registered handlers
     */
    ImmutableList<Consumer<? super V>> snapshot() {
        return ImmutableList.copyOf(handlers.values());
    }

    int size() {
        return handlers.size();
    }

    boolean isEmpty() {
        return handlers.isEmpty();
    }
}
