package com.p14n.receiver.data;

import com.p14n.receiver.channel.Strategy;

import io.opentelemetry.api.OpenTelemetry;

/**
 * Configuration for a single channel.
 * Defines how the channel buffers values and where it reports telemetry.
 */
public interface ReceiverConfig {

    /**
     * Gets the channel name, used in log lines and as the {@code channel}
     * attribute on metrics and spans.
     *
     * @return The channel name
     */
    String name();

    /**
     * Gets the buffering strategy, fixed for the lifetime of the channel.
     *
     * @return The buffering strategy
     */
    Strategy strategy();

    /**
     * Gets the OpenTelemetry instance supplying meters and tracers.
     *
     * @return The OpenTelemetry instance
     */
    OpenTelemetry openTelemetry();

    /**
     * Gets the instrumentation scope name for meters and tracers.
     * Default is {@code "receiver"}.
     *
     * @return The instrumentation scope name
     */
    default String scopeName() {
        return "receiver";
    }

    /**
     * Returns a copy of this configuration with another name.
     *
     * @param name The new channel name
     * @return The copied configuration
     */
    ReceiverConfig withName(String name);

    /**
     * Returns a copy of this configuration with another strategy.
     *
     * @param strategy The new buffering strategy
     * @return The copied configuration
     */
    ReceiverConfig withStrategy(Strategy strategy);
}
