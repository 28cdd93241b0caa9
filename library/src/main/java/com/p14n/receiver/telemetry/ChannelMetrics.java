package com.p14n.receiver.telemetry;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongUpDownCounter;
import io.opentelemetry.api.metrics.Meter;

/**
 * Manages OpenTelemetry metrics for channel operations.
 * Every instrument carries a {@code channel} attribute holding the channel
 * name, so derived channels report separately from their source.
 *
 * <p>
 * Instruments:
 * </p>
 * <ul>
 * <li>values_broadcast: Counter for values handed to an emitter</li>
 * <li>values_delivered: Counter for live deliveries to listeners</li>
 * <li>values_replayed: Counter for buffered values replayed to new
 * listeners</li>
 * <li>listener_failures: Counter for listeners that threw during delivery</li>
 * <li>active_listeners: Up/down counter for currently registered
 * listeners</li>
 * </ul>
 */
public class ChannelMetrics {
        private static final AttributeKey<String> CHANNEL = AttributeKey.stringKey("channel");

        private final LongCounter broadcastValues;
        private final LongCounter deliveredValues;
        private final LongCounter replayedValues;
        private final LongCounter listenerFailures;
        private final LongUpDownCounter activeListeners;
        private final Attributes attributes;

        /**
         * Creates the instruments for one channel.
         *
         * @param meter       OpenTelemetry meter used to create the instruments
         * @param channelName value of the {@code channel} attribute
         */
        public ChannelMetrics(Meter meter, String channelName) {
                attributes = Attributes.of(CHANNEL, channelName);

                broadcastValues = meter.counterBuilder("values_broadcast")
                                .setDescription("Number of values broadcast")
                                .build();

                deliveredValues = meter.counterBuilder("values_delivered")
                                .setDescription("Number of live deliveries to listeners")
                                .build();

                replayedValues = meter.counterBuilder("values_replayed")
                                .setDescription("Number of buffered values replayed to new listeners")
                                .build();

                listenerFailures = meter.counterBuilder("listener_failures")
                                .setDescription("Number of listener invocations that threw")
                                .build();

                activeListeners = meter.upDownCounterBuilder("active_listeners")
                                .setDescription("Number of registered listeners")
                                .build();
        }

        public void recordBroadcast() {
                broadcastValues.add(1, attributes);
        }

        /**
         * Records live deliveries of one broadcast value.
         *
         * @param listeners number of listeners the value was handed to
         */
        public void recordDelivered(int listeners) {
                if (listeners > 0) {
                        deliveredValues.add(listeners, attributes);
                }
        }

        /**
         * Records values replayed to a newly attached listener.
         *
         * @param values number of values replayed
         */
        public void recordReplayed(int values) {
                if (values > 0) {
                        replayedValues.add(values, attributes);
                }
        }

        public void recordListenerFailure() {
                listenerFailures.add(1, attributes);
        }

        public void recordListenerAdded() {
                activeListeners.add(1, attributes);
        }

        public void recordListenerRemoved() {
                activeListeners.add(-1, attributes);
        }
}
