package com.p14n.receiver.channel;

import static com.p14n.receiver.telemetry.OpenTelemetryFunctions.processWithTelemetry;
import static com.p14n.receiver.telemetry.OpenTelemetryFunctions.recordOnCurrentSpan;

import java.util.ArrayDeque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiPredicate;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.p14n.receiver.data.ReceiverConfig;
import com.p14n.receiver.disposal.Disposable;
import com.p14n.receiver.operators.Operators;
import com.p14n.receiver.operators.ValueWithPrevious;
import com.p14n.receiver.telemetry.ChannelMetrics;

import io.opentelemetry.api.trace.Tracer;

/**
 * Read-only side of an emitter/channel pair. Listeners registered with
 * {@link #listen(Consumer)} receive every value broadcast by the paired
 * {@link Emitter} from the moment they attach, preceded by whatever history the
 * channel's {@link Strategy} retained.
 *
 * <p>
 * Delivery is synchronous: handlers run on the thread calling
 * {@link Emitter#broadcast(Object)} (or {@link #listen(Consumer)} for replay).
 * Deliveries on one channel are serialized, so concurrent broadcasts and
 * registrations are totally ordered. A handler may call {@code listen},
 * {@code dispose} or {@code broadcast} on the same channel; such calls run
 * inline on the delivering thread.
 * </p>
 *
 * <p>
 * A channel is created with {@link Channels#make(Strategy)} and kept alive by
 * its emitter. Subscriptions only hold it weakly.
 * </p>
 *
 * @param <V> The type of values this channel delivers
 */
public class Channel<V> {

    private static final Logger logger = LoggerFactory.getLogger(Channel.class);

    private final ReceiverConfig config;
    private final History<V> history;
    private final ListenerRegistry<V> listeners = new ListenerRegistry<>();

    // Guards history and registry together; never held while user code runs.
    private final ReentrantLock stateLock = new ReentrantLock();
    // Serializes delivery; reentrant so a handler's nested calls run inline.
    private final ReentrantLock deliveryLock = new ReentrantLock();

    private final ChannelMetrics metrics;
    private final Tracer tracer;

    private volatile Disposable upstream;

    Channel(ReceiverConfig config) {
        this.config = config;
        this.history = new History<>(config.strategy());
        this.metrics = new ChannelMetrics(config.openTelemetry().getMeter(config.scopeName()), config.name());
        this.tracer = config.openTelemetry().getTracer(config.scopeName());
    }

    /**
     * Adds a listener. Retained history is replayed to this handler alone,
     * synchronously and oldest first, before this method returns; afterwards
     * the handler receives every broadcast until the returned handle is
     * disposed. No value is both replayed and delivered live, and none falls
     * between the two.
     *
     * @param handler Called with each value
     * @return A handle that removes the listener when disposed
     */
    public Disposable listen(Consumer<? super V> handler) {
        Objects.requireNonNull(handler, "handler");

        deliveryLock.lock();
        try {
            ReplayGate<V> gate = new ReplayGate<>(handler);
            long token;
            ImmutableList<V> replay;
            stateLock.lock();
            try {
                token = listeners.add(gate);
                replay = history.snapshot();
            } finally {
                stateLock.unlock();
            }
            metrics.recordListenerAdded();
            logger.atDebug().log(() -> "Listener " + token + " added to channel " + config.name()
                    + ", replaying " + replay.size() + " values");

            if (!replay.isEmpty()) {
                processWithTelemetry(tracer, "replay", config.name(), () -> {
                    for (V value : replay) {
                        invoke(handler, value);
                    }
                    metrics.recordReplayed(replay.size());
                });
            }
            // broadcasts made by the replayed handlers themselves come after the history
            V held;
            while ((held = gate.pending.poll()) != null) {
                invoke(handler, held);
            }
            gate.open = true;
            return new ListenerSubscription(this, token);
        } finally {
            deliveryLock.unlock();
        }
    }

    /**
     * Records the value in the history and hands it to every listener
     * registered at this instant.
     */
    void append(V value) {
        Objects.requireNonNull(value, "value");

        deliveryLock.lock();
        try {
            if (deliveryLock.getHoldCount() > 1) {
                logger.atTrace().log(() -> "Nested broadcast on channel " + config.name() + " delivered inline");
            }
            List<Consumer<? super V>> handlers;
            stateLock.lock();
            try {
                history.append(value);
                handlers = listeners.snapshot();
            } finally {
                stateLock.unlock();
            }
            metrics.recordBroadcast();

            if (!handlers.isEmpty()) {
                processWithTelemetry(tracer, "broadcast", config.name(), () -> {
                    for (Consumer<? super V> handler : handlers) {
                        invoke(handler, value);
                    }
                    metrics.recordDelivered(handlers.size());
                });
            }
        } finally {
            deliveryLock.unlock();
        }
    }

    /**
     * Removes a listener. Does not wait for a delivery in progress; a value
     * whose snapshot was taken just before may still reach the listener.
     */
    void remove(long token) {
        boolean removed;
        stateLock.lock();
        try {
            removed = listeners.remove(token);
        } finally {
            stateLock.unlock();
        }
        if (removed) {
            metrics.recordListenerRemoved();
            logger.atDebug().log(() -> "Listener " + token + " removed from channel " + config.name());
        }
    }

    private void invoke(Consumer<? super V> handler, V value) {
        try {
            handler.accept(value);
        } catch (RuntimeException e) {
            // one failing listener must not starve the others
            metrics.recordListenerFailure();
            recordOnCurrentSpan(e);
            logger.atError().setCause(e).log("Listener failed on channel " + config.name());
        }
    }

    public Strategy strategy() {
        return config.strategy();
    }

    public ReceiverConfig config() {
        return config;
    }

    public String name() {
        return config.name();
    }

    /**
     * @return number of listeners currently registered
     */
    public int listenerCount() {
        stateLock.lock();
        try {
            return listeners.size();
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * Stops this channel receiving values from the channel it was derived
     * from. Its own listeners and retained history are kept. Does nothing for
     * a channel made by {@link Channels#make(Strategy)} or one already
     * detached.
     */
    public void detach() {
        Disposable wiring = upstream;
        if (wiring != null) {
            wiring.dispose();
        }
    }

    void feedFrom(Disposable upstream) {
        this.upstream = upstream;
    }

    /**
     * @return number of values currently retained for replay
     */
    public int bufferedCount() {
        stateLock.lock();
        try {
            return history.size();
        } finally {
            stateLock.unlock();
        }
    }

    // Shortcuts for chaining; see Operators for the semantics.

    public <R> Channel<R> map(Function<? super V, ? extends R> mapper) {
        return Operators.map(this, mapper);
    }

    public Channel<V> filter(Predicate<? super V> predicate) {
        return Operators.filter(this, predicate);
    }

    public Channel<V> skipRepeats() {
        return Operators.skipRepeats(this);
    }

    public Channel<V> skipRepeats(BiPredicate<? super V, ? super V> equivalence) {
        return Operators.skipRepeats(this, equivalence);
    }

    public Channel<V> uniqueValues() {
        return Operators.uniqueValues(this);
    }

    public Channel<ValueWithPrevious<V>> withPrevious() {
        return Operators.withPrevious(this);
    }

    public Channel<V> skip(int count) {
        return Operators.skip(this, count);
    }

    public Channel<V> take(int count) {
        return Operators.take(this, count);
    }

    public Channel<V> hotOnly() {
        return Operators.hotOnly(this);
    }

    /**
     * Unwraps present values of a channel of optionals; see
     * {@link Operators#skipNil(Channel)}.
     */
    public static <T> Channel<T> skipNil(Channel<Optional<T>> source) {
        return Operators.skipNil(source);
    }

    /**
     * Registered in place of a new listener's handler while its history is
     * replayed. Values broadcast meanwhile are held back until the replay
     * is done. Only touched by the thread holding the delivery lock.
     */
    private static final class ReplayGate<V> implements Consumer<V> {

        private final Consumer<? super V> handler;
        private final ArrayDeque<V> pending = new ArrayDeque<>();
        private boolean open;

        ReplayGate(Consumer<? super V> handler) {
            this.handler = handler;
        }

        @Override
        public void accept(V value) {
            if (open) {
                handler.accept(value);
            } else {
                pending.add(value);
            }
        }
    }

    @Override
    public String toString() {
        return "Channel[" + config.name() + ", " + config.strategy() + "]";
    }
}
