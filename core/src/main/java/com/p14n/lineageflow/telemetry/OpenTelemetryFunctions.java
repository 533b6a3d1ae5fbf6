package com.p14n.lineageflow.telemetry;

import java.util.function.Supplier;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

/**
 * Utility class providing OpenTelemetry instrumentation functions for queue
 * item processing.
 */
public class OpenTelemetryFunctions {

        /** Private constructor to prevent instantiation of utility class */
        private OpenTelemetryFunctions() {
        }

        /**
         * Executes an action within a new span tagged with the queue and message
         * id.
         *
         * @param <T>       Return type of the action
         * @param tracer    Tracer to create spans
         * @param spanName  Name of the span to create
         * @param queue     Queue attribute for the span
         * @param messageId Message id attribute for the span
         * @param action    Action to execute within the span
         * @return Result of the action execution
         * @throws RuntimeException if the action throws an exception
         */
        public static <T> T processWithTelemetry(Tracer tracer, String spanName, String queue, long messageId,
                        Supplier<T> action) {
                SpanBuilder sb = tracer.spanBuilder(spanName)
                                .setAttribute("queue", queue)
                                .setAttribute("message.id", messageId);
                return inSpan(sb.startSpan(), action);
        }

        private static <T> T inSpan(Span span, Supplier<T> action) {
                try (Scope scope = span.makeCurrent()) {
                        return action.get();
                } catch (RuntimeException e) {
                        span.recordException(e);
                        span.setStatus(StatusCode.ERROR);
                        throw e;
                } finally {
                        span.end();
                }
        }
}
