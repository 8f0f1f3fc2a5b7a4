package fr.lapetina.loadsim.simulation;

import fr.lapetina.loadsim.dispatcher.Dispatcher;
import fr.lapetina.loadsim.domain.model.WorkItem;
import fr.lapetina.loadsim.infrastructure.config.SimulationConfig;
import fr.lapetina.loadsim.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Time-stepped driver around the dispatcher.
 *
 * Prefills the admission queue, then for each cycle possibly submits one new
 * request, advances the dispatcher and emits periodic statistics. All of the
 * dispatcher's state changes happen on the thread calling {@link #run()}.
 */
public final class SimulationRunner {

    private static final Logger log = LoggerFactory.getLogger(SimulationRunner.class);

    // Routed to the statistics file by logback.xml
    private static final Logger stats = LoggerFactory.getLogger("fr.lapetina.loadsim.stats");

    private final Dispatcher dispatcher;
    private final WorkItemGenerator generator;
    private final MetricsRegistry metricsRegistry;
    private final SimulationConfig.RunConfig run;
    private final SimulationConfig.ReportingConfig reporting;
    private final int backlogSize;

    private long nextItemId = 1;
    private volatile boolean stopRequested;

    public SimulationRunner(
            Dispatcher dispatcher,
            WorkItemGenerator generator,
            MetricsRegistry metricsRegistry,
            SimulationConfig config
    ) {
        this.dispatcher = dispatcher;
        this.generator = generator;
        this.metricsRegistry = metricsRegistry;
        this.run = config.getSimulation();
        this.reporting = config.getReporting();
        this.backlogSize = config.getPool().getInitialWorkers() * run.getBacklogPerWorker();
    }

    /**
     * Runs the configured number of cycles, or fewer if stopped or interrupted.
     *
     * @return final statistics
     */
    public SimulationReport run() {
        int cycles = run.getCycles();
        log.info("Starting simulation: cycles={}, workers={}, backlog={}",
                cycles, dispatcher.getPoolSize(), backlogSize);

        stats.info("Load Balancer Simulation Log");
        stats.info("Workers: {}, Cycles: {}", dispatcher.getPoolSize(), cycles);
        stats.info("Cycle    | Workers | Queue | Processed | System Util | Queue Util");
        stats.info("---------|---------|-------|-----------|-------------|-----------");

        prefill();

        long executed = 0;
        for (int cycle = 1; cycle <= cycles; cycle++) {
            if (stopRequested) {
                log.info("Simulation stopped on request: cycle={}", cycle);
                break;
            }

            maybeSubmitArrival(cycle, cycles);

            int completed = dispatcher.advanceOneCycle();
            metricsRegistry.recordCycle(completed);
            executed++;

            if (cycle % reporting.getStatsInterval() == 0 || cycle == cycles) {
                logStatistics(cycle);
            }
            if (cycle % reporting.getStatusInterval() == 0 || cycle == cycles) {
                logStatus(cycle);
            }

            if (!pause()) {
                break;
            }
        }

        SimulationReport report = buildReport(executed);
        log.info("Simulation complete: cycles={}, completed={}, discarded={}",
                executed, report.totalCompleted(), report.totalDiscarded());
        return report;
    }

    /**
     * Requests the loop to end before its next cycle.
     */
    public void stop() {
        stopRequested = true;
    }

    private void prefill() {
        log.info("Generating {} initial requests...", backlogSize);
        for (int i = 0; i < backlogSize; i++) {
            WorkItem item = generator.next(nextItemId++);
            if (!dispatcher.submit(item)) {
                log.warn("Could not add request {} - queue may be full", item.getId());
                break;
            }
        }
        log.info("Queue initialized with {} requests", dispatcher.getQueueSize());
    }

    private void maybeSubmitArrival(int cycle, int cycles) {
        // Arrivals stop near the end so the backlog can drain
        if (cycle >= cycles * run.getArrivalCutoff()) {
            return;
        }
        if (!generator.arrives(run.getArrivalProbability())) {
            return;
        }
        WorkItem item = generator.next(nextItemId++);
        if (dispatcher.submit(item)) {
            log.debug("New request added: cycle={}, itemId={}, origin={}",
                    cycle, item.getId(), item.getOriginAddress());
        }
    }

    private void logStatistics(int cycle) {
        stats.info(String.format(Locale.ROOT,
                "Cycle %5d | Workers: %2d | Queue: %4d | Processed: %6d | System Util: %5.1f%% | Queue Util: %5.1f%%",
                cycle,
                dispatcher.getActiveWorkerCount(),
                dispatcher.getQueueSize(),
                dispatcher.getTotalCompleted(),
                dispatcher.getSystemUtilization(),
                dispatcher.getQueueUtilization()));
    }

    private void logStatus(int cycle) {
        log.info(String.format(Locale.ROOT,
                "Cycle %d status: activeWorkers=%d, queueSize=%d, totalProcessed=%d, "
                        + "systemUtilization=%.1f%%, queueUtilization=%.1f%%",
                cycle,
                dispatcher.getActiveWorkerCount(),
                dispatcher.getQueueSize(),
                dispatcher.getTotalCompleted(),
                dispatcher.getSystemUtilization(),
                dispatcher.getQueueUtilization()));

        if (dispatcher.isOverloaded()) {
            log.warn("System overloaded: cycle={}, systemUtilization={}, queueUtilization={}",
                    cycle, dispatcher.getSystemUtilization(), dispatcher.getQueueUtilization());
        }
    }

    /**
     * @return false if the thread was interrupted while waiting
     */
    private boolean pause() {
        long delayMs = run.getCycleDelayMs();
        if (delayMs <= 0) {
            return !Thread.currentThread().isInterrupted();
        }
        try {
            Thread.sleep(delayMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Simulation interrupted");
            return false;
        }
    }

    private SimulationReport buildReport(long executed) {
        return new SimulationReport(
                executed,
                dispatcher.getTotalAdmitted(),
                dispatcher.getTotalRejected(),
                dispatcher.getTotalCompleted(),
                dispatcher.getDiscardedCount(),
                dispatcher.getInFlightCount(),
                dispatcher.getAverageProcessingTime(),
                dispatcher.getSystemUtilization(),
                dispatcher.getQueueSize(),
                dispatcher.getPoolSize(),
                dispatcher.getWorkerStatuses()
        );
    }
}
