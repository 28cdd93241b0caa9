package com.p14n.receiver.channel;

/**
 * An emitter and the channel it broadcasts to.
 */
public record ChannelPair<V>(Emitter<V> emitter, Channel<V> channel) {
}
