package fr.lapetina.loadsim.infrastructure.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Root configuration object for the simulator.
 * Designed to be populated from YAML.
 */
public class SimulationConfig {

    private PoolConfig pool = new PoolConfig();
    private QueueConfig queue = new QueueConfig();
    private RunConfig simulation = new RunConfig();
    private ReportingConfig reporting = new ReportingConfig();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public PoolConfig getPool() { return pool; }
    public void setPool(PoolConfig pool) { this.pool = pool; }

    public QueueConfig getQueue() { return queue; }
    public void setQueue(QueueConfig queue) { this.queue = queue; }

    public RunConfig getSimulation() { return simulation; }
    public void setSimulation(RunConfig simulation) { this.simulation = simulation; }

    public ReportingConfig getReporting() { return reporting; }
    public void setReporting(ReportingConfig reporting) { this.reporting = reporting; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * Worker pool sizing and autoscaling.
     */
    public static class PoolConfig {
        private int initialWorkers = 5;
        private int minWorkers = 1;
        private int maxWorkers = 0;
        private int workerCapacity = 5;
        private double utilizationThreshold = 0.8;
        private int queueBacklogTrigger = 10;
        private double scaleDownFactor = 0.05;
        private int scaleDownSlack = 3;

        public int getInitialWorkers() { return initialWorkers; }
        public void setInitialWorkers(int initialWorkers) { this.initialWorkers = initialWorkers; }

        public int getMinWorkers() { return minWorkers; }
        public void setMinWorkers(int minWorkers) { this.minWorkers = minWorkers; }

        /** Configured maximum; 0 means twice the initial pool size. */
        public int getMaxWorkers() { return maxWorkers; }
        public void setMaxWorkers(int maxWorkers) { this.maxWorkers = maxWorkers; }

        public int getEffectiveMaxWorkers() {
            return maxWorkers > 0 ? maxWorkers : initialWorkers * 2;
        }

        public int getWorkerCapacity() { return workerCapacity; }
        public void setWorkerCapacity(int workerCapacity) { this.workerCapacity = workerCapacity; }

        public double getUtilizationThreshold() { return utilizationThreshold; }
        public void setUtilizationThreshold(double utilizationThreshold) { this.utilizationThreshold = utilizationThreshold; }

        public int getQueueBacklogTrigger() { return queueBacklogTrigger; }
        public void setQueueBacklogTrigger(int queueBacklogTrigger) { this.queueBacklogTrigger = queueBacklogTrigger; }

        public double getScaleDownFactor() { return scaleDownFactor; }
        public void setScaleDownFactor(double scaleDownFactor) { this.scaleDownFactor = scaleDownFactor; }

        public int getScaleDownSlack() { return scaleDownSlack; }
        public void setScaleDownSlack(int scaleDownSlack) { this.scaleDownSlack = scaleDownSlack; }
    }

    /**
     * Admission queue configuration.
     */
    public static class QueueConfig {
        private int capacity = 1000;
        private List<String> blockedOrigins = new ArrayList<>();

        public int getCapacity() { return capacity; }
        public void setCapacity(int capacity) { this.capacity = capacity; }

        public List<String> getBlockedOrigins() { return blockedOrigins; }
        public void setBlockedOrigins(List<String> blockedOrigins) { this.blockedOrigins = blockedOrigins; }
    }

    /**
     * Driver loop and synthetic load configuration.
     */
    public static class RunConfig {
        private int cycles = 10000;
        private Long seed;
        private int backlogPerWorker = 100;
        private double arrivalProbability = 0.05;
        private double arrivalCutoff = 0.8;
        private int minDuration = 5;
        private int maxDuration = 50;
        private long cycleDelayMs = 0;

        public int getCycles() { return cycles; }
        public void setCycles(int cycles) { this.cycles = cycles; }

        /** Random seed; null picks a fresh one per run. */
        public Long getSeed() { return seed; }
        public void setSeed(Long seed) { this.seed = seed; }

        public int getBacklogPerWorker() { return backlogPerWorker; }
        public void setBacklogPerWorker(int backlogPerWorker) { this.backlogPerWorker = backlogPerWorker; }

        public double getArrivalProbability() { return arrivalProbability; }
        public void setArrivalProbability(double arrivalProbability) { this.arrivalProbability = arrivalProbability; }

        public double getArrivalCutoff() { return arrivalCutoff; }
        public void setArrivalCutoff(double arrivalCutoff) { this.arrivalCutoff = arrivalCutoff; }

        public int getMinDuration() { return minDuration; }
        public void setMinDuration(int minDuration) { this.minDuration = minDuration; }

        public int getMaxDuration() { return maxDuration; }
        public void setMaxDuration(int maxDuration) { this.maxDuration = maxDuration; }

        public long getCycleDelayMs() { return cycleDelayMs; }
        public void setCycleDelayMs(long cycleDelayMs) { this.cycleDelayMs = cycleDelayMs; }
    }

    /**
     * Periodic statistics and status output.
     */
    public static class ReportingConfig {
        private int statsInterval = 100;
        private int statusInterval = 1000;

        public int getStatsInterval() { return statsInterval; }
        public void setStatsInterval(int statsInterval) { this.statsInterval = statsInterval; }

        public int getStatusInterval() { return statusInterval; }
        public void setStatusInterval(int statusInterval) { this.statusInterval = statusInterval; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "lb_sim";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
