package fr.lapetina.loadsim.infrastructure.metrics;

import fr.lapetina.loadsim.dispatcher.Dispatcher;
import fr.lapetina.loadsim.domain.model.RejectionReason;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Pool size, active worker and in-flight gauges
 * - Queue size and utilization gauges
 * - Completion, admission, rejection, discard and scaling counters
 * - Per-cycle completion distribution
 * - Prometheus exposition
 *
 * Counters read the dispatcher's cumulative totals, so the dispatcher stays
 * free of any metrics dependency.
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;
    private final DistributionSummary cycleCompletions;

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        this.cycleCompletions = DistributionSummary.builder(prefix + "_cycle_completions")
                .description("Work items completed per cycle")
                .register(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this("lb_sim");
    }

    /**
     * Registers gauges and counters backed by the dispatcher's telemetry.
     */
    public void bindDispatcher(Dispatcher dispatcher) {
        Gauge.builder(prefix + "_pool_size", dispatcher, Dispatcher::getPoolSize)
                .description("Number of workers in the pool")
                .register(registry);

        Gauge.builder(prefix + "_active_workers", dispatcher, Dispatcher::getActiveWorkerCount)
                .description("Number of active workers")
                .register(registry);

        Gauge.builder(prefix + "_inflight_items", dispatcher, Dispatcher::getInFlightCount)
                .description("Work items held by workers")
                .register(registry);

        Gauge.builder(prefix + "_queue_size", dispatcher, Dispatcher::getQueueSize)
                .description("Work items waiting in the admission queue")
                .register(registry);

        Gauge.builder(prefix + "_system_utilization_percent", dispatcher, Dispatcher::getSystemUtilization)
                .description("Mean utilization of active workers")
                .register(registry);

        Gauge.builder(prefix + "_queue_utilization_percent", dispatcher, Dispatcher::getQueueUtilization)
                .description("Admission queue fill level")
                .register(registry);

        FunctionCounter.builder(prefix + "_completed", dispatcher, Dispatcher::getTotalCompleted)
                .description("Total work items completed")
                .register(registry);

        FunctionCounter.builder(prefix + "_admitted", dispatcher, Dispatcher::getTotalAdmitted)
                .description("Total work items admitted to the queue")
                .register(registry);

        for (RejectionReason reason : RejectionReason.values()) {
            FunctionCounter.builder(prefix + "_rejected", dispatcher, d -> d.getRejectedCount(reason))
                    .description("Total work items refused at admission")
                    .tag("reason", reason.name())
                    .register(registry);
        }

        FunctionCounter.builder(prefix + "_discarded", dispatcher, Dispatcher::getDiscardedCount)
                .description("In-flight work items lost when a worker was removed")
                .register(registry);

        FunctionCounter.builder(prefix + "_scale_events", dispatcher, Dispatcher::getScaleUpCount)
                .description("Pool size changes")
                .tag("direction", "up")
                .register(registry);

        FunctionCounter.builder(prefix + "_scale_events", dispatcher, Dispatcher::getScaleDownCount)
                .description("Pool size changes")
                .tag("direction", "down")
                .register(registry);

        log.debug("Dispatcher metrics bound: prefix={}", prefix);
    }

    /**
     * Records the number of completions produced by one cycle.
     */
    public void recordCycle(int completions) {
        cycleCompletions.record(completions);
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
