package fr.lapetina.xplorer.infrastructure.metrics;

import fr.lapetina.xplorer.domain.model.ResponseStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Metrics for the debug server, backed by Micrometer.
 *
 * Provides:
 * - Request counters per transport and response status
 * - Dispatch latency per execution context (affinity thread or worker pool)
 * - P2P stream outcomes and live connection gauge
 * - JVM and system metrics
 * - Prometheus exposition
 */
public final class XplorerMetrics implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(XplorerMetrics.class);

    public static final String DEFAULT_PREFIX = "xplorer";

    private final MeterRegistry registry;
    private final PrometheusMeterRegistry prometheus;
    private final String prefix;

    private final ConcurrentHashMap<String, Counter> requestCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> streamCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<Boolean, Timer> dispatchTimers = new ConcurrentHashMap<>();

    private final AtomicInteger activeConnections = new AtomicInteger(0);

    public XplorerMetrics(String prefix) {
        this(prefix, new PrometheusMeterRegistry(PrometheusConfig.DEFAULT), true);
    }

    public XplorerMetrics() {
        this(DEFAULT_PREFIX);
    }

    private XplorerMetrics(String prefix, MeterRegistry registry, boolean bindJvmMetrics) {
        this.prefix = prefix;
        this.registry = registry;
        this.prometheus = registry instanceof PrometheusMeterRegistry p ? p : null;

        if (bindJvmMetrics) {
            new JvmMemoryMetrics().bindTo(registry);
            new JvmGcMetrics().bindTo(registry);
            new JvmThreadMetrics().bindTo(registry);
            new ProcessorMetrics().bindTo(registry);
        }

        Gauge.builder(prefix + "_p2p_connections_active", activeConnections, AtomicInteger::get)
                .description("Number of open P2P peer connections")
                .register(registry);

        log.debug("XplorerMetrics initialized with prefix: {}", prefix);
    }

    /**
     * Metrics that are recorded in memory but never exported.
     */
    public static XplorerMetrics disabled() {
        return new XplorerMetrics(DEFAULT_PREFIX, new SimpleMeterRegistry(), false);
    }

    /**
     * Counts a request answered by a transport.
     */
    public void incrementRequestCount(String transport, ResponseStatus status) {
        String key = transport + ":" + status.name();
        requestCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_requests_total")
                        .description("Total number of requests answered")
                        .tag("transport", transport)
                        .tag("status", String.valueOf(status.code()))
                        .register(registry)
        ).increment();
    }

    /**
     * Records how long a handler call took, queueing included.
     */
    public void recordDispatch(boolean affinity, long elapsedNanos) {
        dispatchTimers.computeIfAbsent(affinity, k ->
                Timer.builder(prefix + "_dispatch_latency")
                        .description("Handler dispatch latency")
                        .tag("affinity", String.valueOf(affinity))
                        .publishPercentiles(0.5, 0.9, 0.99)
                        .register(registry)
        ).record(elapsedNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Counts a finished P2P stream by outcome ({@code ok}, {@code protocol_error}, ...).
     */
    public void incrementStreamCount(String outcome) {
        streamCounters.computeIfAbsent(outcome, k ->
                Counter.builder(prefix + "_p2p_streams_total")
                        .description("Total number of P2P streams handled")
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();
    }

    public void connectionOpened() {
        activeConnections.incrementAndGet();
    }

    public void connectionClosed() {
        activeConnections.decrementAndGet();
    }

    public int getActiveConnections() {
        return activeConnections.get();
    }

    /**
     * Returns the Prometheus scrape output, or an empty string when metrics are disabled.
     */
    public String scrape() {
        return prometheus != null ? prometheus.scrape() : "";
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
