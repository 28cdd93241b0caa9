package com.p14n.receiver.data;

import java.util.Objects;

import com.p14n.receiver.channel.Strategy;

import io.opentelemetry.api.OpenTelemetry;

public record ConfigData(String name,
        Strategy strategy,
        OpenTelemetry openTelemetry) implements ReceiverConfig {

    public static final String DEFAULT_NAME = "receiver";

    public ConfigData {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(strategy, "strategy");
        Objects.requireNonNull(openTelemetry, "openTelemetry");
    }

    public ConfigData(String name, Strategy strategy) {
        this(name, strategy, OpenTelemetry.noop());
    }

    public ConfigData(Strategy strategy) {
        this(DEFAULT_NAME, strategy, OpenTelemetry.noop());
    }

    public ConfigData() {
        this(DEFAULT_NAME, Strategy.noBuffering(), OpenTelemetry.noop());
    }

    @Override
    public ConfigData withName(String name) {
        return new ConfigData(name, strategy, openTelemetry);
    }

    @Override
    public ConfigData withStrategy(Strategy strategy) {
        return new ConfigData(name, strategy, openTelemetry);
    }
}
