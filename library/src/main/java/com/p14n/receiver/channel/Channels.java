package com.p14n.receiver.channel;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;

import com.p14n.receiver.data.ConfigData;
import com.p14n.receiver.data.ReceiverConfig;
import com.p14n.receiver.disposal.Disposable;

/**
 * Factory for emitter/channel pairs.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>{@code
 * ChannelPair<String> pair = Channels.make(Strategy.unboundedReplay());
 * pair.emitter().broadcast("a");
 * Disposable subscription = pair.channel().listen(System.out::println); // prints "a"
 * subscription.dispose();
 * }</pre>
 */
public final class Channels {

    private Channels() {
    }

    /**
     * Creates a pair that does not buffer.
     */
    public static <V> ChannelPair<V> make() {
        return make(new ConfigData());
    }

    public static <V> ChannelPair<V> make(Strategy strategy) {
        return make(new ConfigData(strategy));
    }

    public static <V> ChannelPair<V> make(ReceiverConfig config) {
        Objects.requireNonNull(config, "config");
        Channel<V> channel = new Channel<>(config);
        return new ChannelPair<>(new Emitter<>(channel), channel);
    }

    /**
     * Creates a channel fed by {@code source}. The handler built by
     * {@code wiring} listens to the source, receiving its retained history
     * before this method returns, and broadcasts through the new channel's
     * emitter. {@link Channel#detach()} on the result removes that listener.
     *
     * @param source The channel to listen to
     * @param config Configuration of the derived channel
     * @param wiring Builds the source handler from the derived emitter
     * @return The derived channel
     */
    public static <V, R> Channel<R> derive(Channel<V> source, ReceiverConfig config,
            Function<Emitter<R>, Consumer<V>> wiring) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(wiring, "wiring");
        ChannelPair<R> pair = make(config);
        Disposable upstream = source.listen(wiring.apply(pair.emitter()));
        pair.channel().feedFrom(upstream);
        return pair.channel();
    }
}
