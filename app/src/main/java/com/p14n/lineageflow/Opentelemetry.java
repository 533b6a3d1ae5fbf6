package com.p14n.lineageflow;

import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.propagation.ContextPropagators;
import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporter;
import io.opentelemetry.exporter.prometheus.PrometheusHttpServer;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import io.opentelemetry.semconv.ResourceAttributes;

public class Opentelemetry {
        /**
         * Builds the SDK: metrics are served for scraping on
         * {@code metricsPort}, spans are exported over OTLP to
         * {@code otlpEndpoint}.
         */
        public static OpenTelemetrySdk create(String serviceName, int metricsPort, String otlpEndpoint) {
                Resource resource = Resource.create(Attributes.of(
                                ResourceAttributes.SERVICE_NAME, serviceName));

                SdkMeterProvider meterProvider = SdkMeterProvider.builder()
                                .setResource(resource)
                                .registerMetricReader(PrometheusHttpServer.builder()
                                                .setPort(metricsPort)
                                                .build())
                                .build();

                OtlpGrpcSpanExporter spanExporter = OtlpGrpcSpanExporter.builder()
                                .setEndpoint(otlpEndpoint)
                                .build();

                SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
                                .addSpanProcessor(BatchSpanProcessor.builder(spanExporter).build())
                                .setResource(resource)
                                .build();

                return OpenTelemetrySdk.builder()
                                .setMeterProvider(meterProvider)
                                .setTracerProvider(tracerProvider)
                                .setPropagators(ContextPropagators.create(W3CTraceContextPropagator.getInstance()))
                                .build();
        }
}
