package fr.lapetina.tr064.infrastructure.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Action latency timers per service and action
 * - Error counters by service, action and type
 * - Call monitor event, drop and reconnect counters
 * - Discovered service gauge
 * - Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Timer> latencyTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> errorCounters = new ConcurrentHashMap<>();

    private final Counter monitorEvents;
    private final Counter monitorDropped;
    private final Counter monitorReconnects;
    private final AtomicInteger discoveredServices = new AtomicInteger(0);

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        Gauge.builder(prefix + "_discovered_services", discoveredServices, AtomicInteger::get)
                .description("Number of services found by the last discovery")
                .register(registry);

        this.monitorEvents = Counter.builder(prefix + "_monitor_events_total")
                .description("Call monitor lines received")
                .register(registry);
        this.monitorDropped = Counter.builder(prefix + "_monitor_events_dropped_total")
                .description("Call monitor lines dropped because the queue was full")
                .register(registry);
        this.monitorReconnects = Counter.builder(prefix + "_monitor_reconnects_total")
                .description("Call monitor reconnect attempts")
                .register(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this("tr064");
    }

    /**
     * Records the latency of one action call.
     */
    public void recordActionLatency(String service, String action, Duration latency) {
        String key = service + ":" + action;
        latencyTimers.computeIfAbsent(key, k ->
                Timer.builder(prefix + "_action_latency")
                        .description("Action call latency")
                        .tag("service", service)
                        .tag("action", action)
                        .publishPercentiles(0.5, 0.9, 0.99)
                        .register(registry)
        ).record(latency);
    }

    /**
     * Increments error counter.
     */
    public void incrementErrorCount(String service, String action, String type) {
        String key = service + ":" + action + ":" + type;
        errorCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_errors_total")
                        .description("Total number of failed action calls")
                        .tag("service", service)
                        .tag("action", action)
                        .tag("type", type)
                        .register(registry)
        ).increment();
    }

    public void incrementMonitorEvents() {
        monitorEvents.increment();
    }

    public void incrementMonitorDropped() {
        monitorDropped.increment();
    }

    public void incrementMonitorReconnects() {
        monitorReconnects.increment();
    }

    /**
     * Updates the discovered service count.
     */
    public void setDiscoveredServices(int value) {
        discoveredServices.set(value);
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
