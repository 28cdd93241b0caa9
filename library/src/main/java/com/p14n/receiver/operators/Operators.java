package com.p14n.receiver.operators;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BiPredicate;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.p14n.receiver.channel.Channel;
import com.p14n.receiver.channel.Channels;
import com.p14n.receiver.channel.Emitter;
import com.p14n.receiver.channel.Strategy;

/**
 * Derived channels built on the public {@code listen}/{@code broadcast}
 * contract.
 *
 * <p>
 * Each operator creates a new pair with the source's configuration (same
 * strategy unless stated otherwise, name suffixed with the operator) and
 * listens to the source exactly once. The source's retained history is
 * replayed through the operator while it is being wired, so the derived
 * channel's own history matches the operator applied from the first value.
 * </p>
 *
 * <p>
 * The source keeps the derived channel alive through that listener, which
 * stays registered until {@link Channel#detach()} is called on the derived
 * channel. Detaching does not reach further upstream: in a chain, each
 * derived channel holds its own listener on the one before it.
 * </p>
 */
public final class Operators {

    private static final Logger logger = LoggerFactory.getLogger(Operators.class);

    private Operators() {
    }

    /**
     * Forwards {@code mapper.apply(value)} for every value. The mapper must not
     * return null; map to {@link Optional} and use {@link #skipNil(Channel)}
     * instead.
     */
    public static <V, R> Channel<R> map(Channel<V> source, Function<? super V, ? extends R> mapper) {
        Objects.requireNonNull(mapper, "mapper");
        return derive(source, "map", source.strategy(),
                emitter -> value -> emitter.broadcast(mapper.apply(value)));
    }

    /**
     * Forwards the values satisfying the predicate.
     */
    public static <V> Channel<V> filter(Channel<V> source, Predicate<? super V> predicate) {
        Objects.requireNonNull(predicate, "predicate");
        return derive(source, "filter", source.strategy(), emitter -> value -> {
            if (predicate.test(value)) {
                emitter.broadcast(value);
            }
        });
    }

    /**
     * Forwards a value only if it is not equal to the previously forwarded
     * one. The first value is always forwarded.
     */
    public static <V> Channel<V> skipRepeats(Channel<V> source) {
        return skipRepeats(source, Objects::equals);
    }

    /**
     * Forwards a value only if it is not equivalent to the previously
     * forwarded one. The first value is always forwarded.
     *
     * @param equivalence Returns true when two values count as a repeat
     */
    public static <V> Channel<V> skipRepeats(Channel<V> source, BiPredicate<? super V, ? super V> equivalence) {
        Objects.requireNonNull(equivalence, "equivalence");
        return derive(source, "skipRepeats", source.strategy(), emitter -> {
            AtomicReference<V> lastForwarded = new AtomicReference<>();
            return value -> {
                V last = lastForwarded.get();
                if (last == null || !equivalence.test(last, value)) {
                    lastForwarded.set(value);
                    emitter.broadcast(value);
                }
            };
        });
    }

    /**
     * Forwards a value only the first time this operator sees it.
     */
    public static <V> Channel<V> uniqueValues(Channel<V> source) {
        return derive(source, "uniqueValues", source.strategy(), emitter -> {
            Set<V> seen = ConcurrentHashMap.newKeySet();
            return value -> {
                if (seen.add(value)) {
                    emitter.broadcast(value);
                }
            };
        });
    }

    /**
     * Forwards each value paired with the value observed before it.
     */
    public static <V> Channel<ValueWithPrevious<V>> withPrevious(Channel<V> source) {
        return derive(source, "withPrevious", source.strategy(), emitter -> {
            AtomicReference<V> previous = new AtomicReference<>();
            return value -> {
                V last = previous.getAndSet(value);
                if (last == null) {
                    emitter.broadcast(ValueWithPrevious.first(value));
                } else {
                    emitter.broadcast(ValueWithPrevious.following(last, value));
                }
            };
        });
    }

    /**
     * Drops the first {@code count} values and forwards the rest. A count of
     * zero or less forwards everything.
     */
    public static <V> Channel<V> skip(Channel<V> source, int count) {
        return derive(source, "skip", source.strategy(), emitter -> {
            AtomicLong seen = new AtomicLong();
            return value -> {
                if (seen.incrementAndGet() > count) {
                    emitter.broadcast(value);
                }
            };
        });
    }

    /**
     * Forwards the first {@code count} values and nothing afterwards. A count
     * of zero or less forwards nothing. The listener on the source stays
     * registered but inert.
     */
    public static <V> Channel<V> take(Channel<V> source, int count) {
        return derive(source, "take", source.strategy(), emitter -> {
            AtomicLong taken = new AtomicLong();
            return value -> {
                if (taken.get() < count && taken.incrementAndGet() <= count) {
                    emitter.broadcast(value);
                }
            };
        });
    }

    /**
     * Drops empty optionals and forwards the unwrapped value of present ones.
     */
    public static <V> Channel<V> skipNil(Channel<Optional<V>> source) {
        return derive(source, "skipNil", source.strategy(),
                emitter -> value -> value.ifPresent(emitter::broadcast));
    }

    /**
     * Forwards every value through a channel that never buffers, so
     * listeners of the result only see values broadcast after they attach,
     * whatever the source retains.
     */
    public static <V> Channel<V> hotOnly(Channel<V> source) {
        return derive(source, "hotOnly", Strategy.noBuffering(), emitter -> emitter::broadcast);
    }

    private static <V, R> Channel<R> derive(Channel<V> source, String operator, Strategy strategy,
            Function<Emitter<R>, Consumer<V>> wiring) {
        Objects.requireNonNull(source, "source");
        Channel<R> derived = Channels.derive(source, source.config()
                .withName(source.name() + "." + operator)
                .withStrategy(strategy), wiring);
        logger.atDebug().log(() -> "Derived channel " + derived.name() + " from " + source.name());
        return derived;
    }
}
