package com.p14n.receiver.telemetry;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

public class OpenTelemetryFunctions {

        private static final AttributeKey<String> CHANNEL = AttributeKey.stringKey("channel");

        private OpenTelemetryFunctions() {
        }

        /**
         * Runs the action inside a span tagged with the channel name. Exceptions
         * are recorded on the span and rethrown.
         */
        public static void processWithTelemetry(Tracer tracer, String spanName, String channelName,
                                                Runnable action) {

                Span span = tracer.spanBuilder(spanName)
                        .setAttribute(CHANNEL, channelName)
                        .startSpan();
                try (Scope scope = span.makeCurrent()) {
                        action.run();
                } catch (RuntimeException e) {
                        span.recordException(e);
                        throw e;
                } finally {
                        span.end();
                }
        }

        /**
         * Records an exception on whatever span is current, typically the
         * broadcast or replay span of the delivering channel.
         */
        public static void recordOnCurrentSpan(Throwable error) {
                Span.current().recordException(error);
        }

}
