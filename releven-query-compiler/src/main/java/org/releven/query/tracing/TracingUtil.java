package org.releven.query.tracing;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.propagation.ContextPropagators;
import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import io.opentelemetry.semconv.ServiceAttributes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lazily configured OpenTelemetry SDK for the query compiler.
 *
 * <p>Spans are exported via OTLP gRPC. Configuration comes from the
 * environment:</p>
 * <ul>
 *   <li>{@code OTEL_EXPORTER_OTLP_ENDPOINT} - OTLP endpoint
 *       (default: http://localhost:4317)</li>
 *   <li>{@code OTEL_SERVICE_NAME} - Service name
 *       (default: releven-query)</li>
 *   <li>{@code OTEL_TRACING_ENABLED} - Enable/disable tracing
 *       (default: true)</li>
 * </ul>
 *
 * <p>With tracing disabled a no-op instance is returned and nothing is
 * exported.</p>
 */
public final class TracingUtil {
    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        TracingUtil.class);

    /** Default service name. */
    static final String DEFAULT_SERVICE_NAME = "releven-query";

    /** Default OTLP endpoint. */
    static final String DEFAULT_OTLP_ENDPOINT = "http://localhost:4317";

    /** Environment variable for OTLP endpoint. */
    private static final String ENV_OTLP_ENDPOINT =
        "OTEL_EXPORTER_OTLP_ENDPOINT";

    /** Environment variable for service name. */
    private static final String ENV_SERVICE_NAME = "OTEL_SERVICE_NAME";

    /** Environment variable to enable/disable tracing. */
    private static final String ENV_TRACING_ENABLED = "OTEL_TRACING_ENABLED";

    /** Instrumentation scope name for query compilation. */
    public static final String SCOPE_COMPILER =
        "org.releven.query.SelectionQueryCompiler";

    /** Singleton OpenTelemetry instance. */
    private static volatile OpenTelemetry openTelemetry;

    /** Lock for initialization. */
    private static final Object INIT_LOCK = new Object();

    /** Prevent instantiation. */
    private TracingUtil() {
        throw new AssertionError("No instances");
    }

    /**
     * Initialize OpenTelemetry if not already initialized.
     *
     * @return the OpenTelemetry instance
     */
    public static OpenTelemetry getOpenTelemetry() {
        if (openTelemetry == null) {
            synchronized (INIT_LOCK) {
                if (openTelemetry == null) {
                    openTelemetry = initializeOpenTelemetry();
                }
            }
        }
        return openTelemetry;
    }

    /**
     * Get a tracer for the specified instrumentation scope.
     *
     * @param scopeName the instrumentation scope name
     * @return the tracer for the given scope
     */
    public static Tracer getTracer(final String scopeName) {
        return getOpenTelemetry().getTracer(scopeName);
    }

    private static OpenTelemetry initializeOpenTelemetry() {
        if (!Boolean.parseBoolean(getEnvOrDefault(ENV_TRACING_ENABLED,
                "true"))) {
            LOGGER.info("Compiler tracing is disabled");
            return OpenTelemetry.noop();
        }
        String serviceName = getEnvOrDefault(ENV_SERVICE_NAME,
            DEFAULT_SERVICE_NAME);
        String otlpEndpoint = getEnvOrDefault(ENV_OTLP_ENDPOINT,
            DEFAULT_OTLP_ENDPOINT);
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info("Exporting compiler spans of {} to {}", serviceName,
                otlpEndpoint);
        }
        SdkTracerProvider tracerProvider = tracerProvider(serviceName,
            otlpEndpoint);

        // flush pending spans on exit
        Runtime.getRuntime().addShutdownHook(
            new Thread(tracerProvider::shutdown));

        return OpenTelemetrySdk.builder()
            .setTracerProvider(tracerProvider)
            .setPropagators(ContextPropagators.create(
                W3CTraceContextPropagator.getInstance()))
            .build();
    }

    private static SdkTracerProvider tracerProvider(final String serviceName,
            final String otlpEndpoint) {
        Resource resource = Resource.getDefault()
            .merge(Resource.create(Attributes.of(
                ServiceAttributes.SERVICE_NAME, serviceName)));
        OtlpGrpcSpanExporter exporter = OtlpGrpcSpanExporter.builder()
            .setEndpoint(otlpEndpoint)
            .build();
        return SdkTracerProvider.builder()
            .addSpanProcessor(BatchSpanProcessor.builder(exporter).build())
            .setResource(resource)
            .build();
    }

    private static String getEnvOrDefault(final String name,
            final String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isEmpty()) ? value : defaultValue;
    }

    /**
     * Shutdown the tracing system gracefully.
     */
    public static void shutdown() {
        if (openTelemetry instanceof OpenTelemetrySdk sdk) {
            if (LOGGER.isInfoEnabled()) {
                LOGGER.info("Shutting down OpenTelemetry SDK");
            }
            sdk.getSdkTracerProvider().shutdown();
        }
    }
}
