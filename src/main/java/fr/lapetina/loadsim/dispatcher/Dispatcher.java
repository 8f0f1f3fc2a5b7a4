package fr.lapetina.loadsim.dispatcher;

import fr.lapetina.loadsim.domain.model.RejectionReason;
import fr.lapetina.loadsim.domain.model.WorkItem;
import fr.lapetina.loadsim.domain.queue.AdmissionQueue;
import fr.lapetina.loadsim.domain.scaling.HysteresisScalingPolicy;
import fr.lapetina.loadsim.domain.scaling.ScalingPolicy;
import fr.lapetina.loadsim.domain.scaling.ScalingSignal;
import fr.lapetina.loadsim.domain.strategy.PlacementStrategy;
import fr.lapetina.loadsim.domain.strategy.RoundRobinStrategy;
import fr.lapetina.loadsim.domain.worker.Worker;
import fr.lapetina.loadsim.domain.worker.WorkerSnapshot;
import fr.lapetina.loadsim.infrastructure.config.SimulationConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * The load balancer: owns the worker pool and the admission queue and moves
 * simulated time forward one cycle at a time.
 *
 * Each call to {@link #advanceOneCycle()} runs three steps in order:
 * <ol>
 *   <li>every active worker advances its in-flight items, freeing capacity;</li>
 *   <li>queued items are placed on workers by the placement strategy;</li>
 *   <li>the scaling policy may grow and/or shrink the pool by one worker.</li>
 * </ol>
 *
 * Rejections and bound violations are reported through return values, never
 * exceptions. Shrinking removes the most recently added worker and discards
 * whatever it still held; the loss is counted in {@link #getDiscardedCount()}.
 *
 * Every public method synchronizes on this instance, so concurrent callers
 * still observe whole cycles.
 */
public final class Dispatcher {

    private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);

    static final String WORKER_ADDRESS_PREFIX = "192.168.1.";

    private static final double OVERLOAD_SYSTEM_UTILIZATION = 90.0;
    private static final double OVERLOAD_QUEUE_UTILIZATION = 80.0;

    // Order defines the round-robin rotation; growth appends, shrink pops the tail.
    private final List<Worker> workers = new ArrayList<>();
    private final List<Consumer<PoolEvent>> listeners = new CopyOnWriteArrayList<>();
    private final AdmissionQueue queue;
    private final PlacementStrategy placementStrategy;
    private final ScalingPolicy scalingPolicy;
    private final int minWorkers;
    private final int maxWorkers;
    private final int workerCapacity;

    private long cycleCount;
    private long totalCompleted;
    private long totalProcessingTime;
    private long discardedCount;
    private long scaleUpCount;
    private long scaleDownCount;

    private Dispatcher(Builder builder) {
        this.queue = new AdmissionQueue(builder.queueCapacity);
        this.placementStrategy = builder.placementStrategy;
        this.scalingPolicy = builder.scalingPolicy;
        this.minWorkers = builder.minWorkers;
        this.maxWorkers = builder.maxWorkers;
        this.workerCapacity = builder.workerCapacity;

        for (String origin : builder.blockedOrigins) {
            queue.blockOrigin(origin);
        }
        for (int i = 0; i < builder.initialWorkers; i++) {
            addWorker();
        }

        log.info("Dispatcher created: workers={}, minWorkers={}, maxWorkers={}, workerCapacity={}, "
                        + "queueCapacity={}, strategy={}, scaling={}",
                workers.size(), minWorkers, maxWorkers, workerCapacity,
                queue.capacity(), placementStrategy.getName(), scalingPolicy);
    }

    /**
     * Offers a work item to the admission queue.
     *
     * @return true if admitted, false if its origin is blocked or the queue is full
     */
    public synchronized boolean submit(WorkItem item) {
        return queue.enqueue(item);
    }

    /**
     * Runs one simulated cycle: advance workers, distribute queued work, apply scaling.
     *
     * @return number of items completed during this cycle
     */
    public synchronized int advanceOneCycle() {
        cycleCount++;

        int completed = 0;
        for (Worker worker : workers) {
            if (worker.isActive()) {
                long processedBefore = worker.getTotalProcessingTime();
                completed += worker.advanceOneCycle();
                totalProcessingTime += worker.getTotalProcessingTime() - processedBefore;
            }
        }
        totalCompleted += completed;

        int placed = distribute();
        applyScaling();

        log.debug("Cycle complete: cycle={}, completed={}, placed={}, queueSize={}, workers={}",
                cycleCount, completed, placed, queue.size(), workers.size());
        return completed;
    }

    /**
     * Moves items from the head of the queue onto workers chosen by the placement strategy.
     * Bounded to twice the pool size per cycle; stops early as soon as no worker can accept.
     */
    private int distribute() {
        int maxAttempts = workers.size() * 2;
        int attempts = 0;

        while (!queue.isEmpty() && attempts < maxAttempts) {
            Optional<Worker> target = placementStrategy.selectWorker(workers);
            if (target.isEmpty()) {
                log.debug("No worker can accept: cycle={}, queueSize={}", cycleCount, queue.size());
                break;
            }

            Worker worker = target.get();
            // Checked before dequeue so a bad selection never loses the head item
            if (!worker.canAccept()) {
                log.warn("Placement strategy selected a worker that cannot accept: strategy={}, workerId={}, cycle={}",
                        placementStrategy.getName(), worker.getId(), cycleCount);
                break;
            }
            WorkItem item = queue.dequeueNext().orElseThrow();
            worker.accept(item);
            attempts++;

            log.debug("Item placed: itemId={}, workerId={}, workerLoad={}/{}",
                    item.getId(), worker.getId(), worker.getCurrentLoad(), worker.getMaxCapacity());
        }
        return attempts;
    }

    private void applyScaling() {
        if (workers.isEmpty()) {
            return;
        }

        // Observed once; the scale-down check sees the post-growth pool size only.
        ScalingSignal signal = new ScalingSignal(meanActiveUtilization() / 100.0, queue.size());

        if (scalingPolicy.shouldScaleUp(signal, workers.size(), maxWorkers)) {
            growPool();
        }
        if (scalingPolicy.shouldScaleDown(signal, workers.size(), minWorkers)) {
            shrinkPool();
        }
    }

    /**
     * Adds one active worker at the tail of the rotation.
     *
     * @return true if added, false if the pool is already at its maximum size
     */
    public synchronized boolean growPool() {
        if (workers.size() >= maxWorkers) {
            return false;
        }

        Worker worker = addWorker();
        scaleUpCount++;

        log.info("Worker added: workerId={}, address={}, poolSize={}, cycle={}",
                worker.getId(), worker.getAddress(), workers.size(), cycleCount);
        notifyListeners(new PoolEvent(PoolEvent.Type.WORKER_ADDED, worker.snapshot(), workers.size(), 0, cycleCount));
        return true;
    }

    // Identity and address follow the position in the pool: worker N lives at 192.168.1.N.
    private Worker addWorker() {
        int workerId = workers.size() + 1;
        Worker worker = Worker.builder()
                .id(workerId)
                .address(WORKER_ADDRESS_PREFIX + workerId)
                .maxCapacity(workerCapacity)
                .build();
        workers.add(worker);
        placementStrategy.onPoolResized(workers.size());
        return worker;
    }

    /**
     * Removes the most recently added worker. Its in-flight items are discarded, not requeued.
     *
     * @return true if removed, false if the pool is already at its minimum size
     */
    public synchronized boolean shrinkPool() {
        if (workers.size() <= minWorkers) {
            return false;
        }

        Worker removed = workers.remove(workers.size() - 1);
        int discarded = removed.drain().size();
        discardedCount += discarded;
        placementStrategy.onPoolResized(workers.size());
        scaleDownCount++;

        if (discarded > 0) {
            log.warn("Worker removed with in-flight work discarded: workerId={}, discarded={}, poolSize={}, cycle={}",
                    removed.getId(), discarded, workers.size(), cycleCount);
        } else {
            log.info("Worker removed: workerId={}, poolSize={}, cycle={}",
                    removed.getId(), workers.size(), cycleCount);
        }
        notifyListeners(new PoolEvent(PoolEvent.Type.WORKER_REMOVED, removed.snapshot(), workers.size(), discarded, cycleCount));
        return true;
    }

    public synchronized void blockOrigin(String address) {
        queue.blockOrigin(address);
    }

    public synchronized void unblockOrigin(String address) {
        queue.unblockOrigin(address);
    }

    public synchronized boolean isBlocked(String address) {
        return queue.isBlocked(address);
    }

    /**
     * Adds a listener for pool changes.
     */
    public void addListener(Consumer<PoolEvent> listener) {
        listeners.add(listener);
    }

    /**
     * Removes a listener.
     */
    public void removeListener(Consumer<PoolEvent> listener) {
        listeners.remove(listener);
    }

    private void notifyListeners(PoolEvent event) {
        for (Consumer<PoolEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (Exception e) {
                log.error("Error notifying pool listener", e);
            }
        }
    }

    public synchronized int getActiveWorkerCount() {
        int active = 0;
        for (Worker worker : workers) {
            if (worker.isActive()) {
                active++;
            }
        }
        return active;
    }

    public synchronized int getPoolSize() {
        return workers.size();
    }

    public synchronized int getQueueSize() {
        return queue.size();
    }

    public synchronized int getQueueCapacity() {
        return queue.capacity();
    }

    /**
     * Items currently held by workers, active or not.
     */
    public synchronized int getInFlightCount() {
        int inFlight = 0;
        for (Worker worker : workers) {
            inFlight += worker.getCurrentLoad();
        }
        return inFlight;
    }

    public synchronized long getTotalCompleted() {
        return totalCompleted;
    }

    public synchronized long getTotalProcessingTime() {
        return totalProcessingTime;
    }

    /**
     * Mean original duration of completed items, in cycles; 0 before the first completion.
     */
    public synchronized double getAverageProcessingTime() {
        if (totalCompleted == 0) {
            return 0.0;
        }
        return (double) totalProcessingTime / totalCompleted;
    }

    /**
     * Mean utilization of active workers as a percentage in [0, 100]; 0 when none is active.
     */
    public synchronized double getSystemUtilization() {
        return meanActiveUtilization();
    }

    private double meanActiveUtilization() {
        double total = 0.0;
        int active = 0;
        for (Worker worker : workers) {
            if (worker.isActive()) {
                total += worker.utilization();
                active++;
            }
        }
        return active > 0 ? total / active : 0.0;
    }

    /**
     * Queue fill level as a percentage in [0, 100].
     */
    public synchronized double getQueueUtilization() {
        return queue.utilization() * 100.0;
    }

    public synchronized boolean isOverloaded() {
        return meanActiveUtilization() > OVERLOAD_SYSTEM_UTILIZATION
                || queue.utilization() * 100.0 > OVERLOAD_QUEUE_UTILIZATION;
    }

    /**
     * One human-readable line per worker, in rotation order.
     */
    public synchronized List<String> getWorkerStatuses() {
        List<String> statuses = new ArrayList<>(workers.size());
        for (Worker worker : workers) {
            statuses.add(worker.getStatusSummary());
        }
        return statuses;
    }

    /**
     * Snapshots of the pool in rotation order. Workers themselves never leave the dispatcher.
     */
    public synchronized List<WorkerSnapshot> getWorkers() {
        List<WorkerSnapshot> snapshots = new ArrayList<>(workers.size());
        for (Worker worker : workers) {
            snapshots.add(worker.snapshot());
        }
        return Collections.unmodifiableList(snapshots);
    }

    /**
     * Activates or deactivates the worker at a rotation position. A deactivated worker keeps
     * its in-flight items but neither advances them nor accepts new ones.
     *
     * @return false if no worker sits at that position
     */
    public synchronized boolean setWorkerActive(int index, boolean active) {
        if (index < 0 || index >= workers.size()) {
            return false;
        }
        Worker worker = workers.get(index);
        worker.setActive(active);
        log.info("Worker {}: workerId={}, cycle={}", active ? "activated" : "deactivated", worker.getId(), cycleCount);
        return true;
    }

    public synchronized long getDiscardedCount() {
        return discardedCount;
    }

    public synchronized long getScaleUpCount() {
        return scaleUpCount;
    }

    public synchronized long getScaleDownCount() {
        return scaleDownCount;
    }

    public synchronized long getCycleCount() {
        return cycleCount;
    }

    public synchronized long getTotalAdmitted() {
        return queue.getTotalAdmitted();
    }

    public synchronized long getTotalRejected() {
        return queue.getTotalRejected();
    }

    public synchronized long getRejectedCount(RejectionReason reason) {
        return queue.getRejectedCount(reason);
    }

    public int getMinWorkers() {
        return minWorkers;
    }

    public int getMaxWorkers() {
        return maxWorkers;
    }

    public int getWorkerCapacity() {
        return workerCapacity;
    }

    public PlacementStrategy getPlacementStrategy() {
        return placementStrategy;
    }

    public ScalingPolicy getScalingPolicy() {
        return scalingPolicy;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for Dispatcher.
     */
    public static final class Builder {
        private int initialWorkers = 1;
        private int minWorkers = 1;
        private int maxWorkers = 20;
        private int workerCapacity = Worker.DEFAULT_CAPACITY;
        private int queueCapacity = AdmissionQueue.DEFAULT_CAPACITY;
        private double utilizationThreshold = HysteresisScalingPolicy.DEFAULT_THRESHOLD;
        private List<String> blockedOrigins = List.of();
        private PlacementStrategy placementStrategy;
        private ScalingPolicy scalingPolicy;

        public Builder initialWorkers(int initialWorkers) {
            this.initialWorkers = initialWorkers;
            return this;
        }

        public Builder minWorkers(int minWorkers) {
            this.minWorkers = minWorkers;
            return this;
        }

        public Builder maxWorkers(int maxWorkers) {
            this.maxWorkers = maxWorkers;
            return this;
        }

        public Builder workerCapacity(int workerCapacity) {
            this.workerCapacity = workerCapacity;
            return this;
        }

        public Builder queueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
            return this;
        }

        /**
         * Threshold for the default hysteresis policy; ignored when a scaling policy is set.
         */
        public Builder utilizationThreshold(double threshold) {
            this.utilizationThreshold = threshold;
            return this;
        }

        public Builder blockedOrigins(List<String> origins) {
            this.blockedOrigins = origins != null ? List.copyOf(origins) : List.of();
            return this;
        }

        public Builder placementStrategy(PlacementStrategy strategy) {
            this.placementStrategy = strategy;
            return this;
        }

        public Builder scalingPolicy(ScalingPolicy policy) {
            this.scalingPolicy = policy;
            return this;
        }

        public Builder fromConfig(SimulationConfig config) {
            SimulationConfig.PoolConfig pool = config.getPool();
            this.initialWorkers = pool.getInitialWorkers();
            this.minWorkers = pool.getMinWorkers();
            this.maxWorkers = pool.getEffectiveMaxWorkers();
            this.workerCapacity = pool.getWorkerCapacity();
            this.utilizationThreshold = pool.getUtilizationThreshold();
            this.queueCapacity = config.getQueue().getCapacity();
            this.blockedOrigins = List.copyOf(config.getQueue().getBlockedOrigins());
            this.scalingPolicy = new HysteresisScalingPolicy(
                    pool.getUtilizationThreshold(),
                    pool.getQueueBacklogTrigger(),
                    pool.getScaleDownFactor(),
                    pool.getScaleDownSlack()
            );
            return this;
        }

        public Dispatcher build() {
            if (minWorkers < 1) {
                throw new IllegalArgumentException("Minimum pool size must be at least 1: " + minWorkers);
            }
            if (minWorkers > maxWorkers) {
                throw new IllegalArgumentException("Minimum pool size " + minWorkers
                        + " exceeds maximum " + maxWorkers);
            }
            if (initialWorkers < minWorkers || initialWorkers > maxWorkers) {
                throw new IllegalArgumentException("Initial pool size " + initialWorkers
                        + " outside [" + minWorkers + ", " + maxWorkers + "]");
            }
            if (workerCapacity <= 0) {
                throw new IllegalArgumentException("Worker capacity must be positive: " + workerCapacity);
            }
            if (queueCapacity <= 0) {
                throw new IllegalArgumentException("Queue capacity must be positive: " + queueCapacity);
            }
            if (placementStrategy == null) {
                placementStrategy = new RoundRobinStrategy();
            }
            if (scalingPolicy == null) {
                scalingPolicy = new HysteresisScalingPolicy(utilizationThreshold);
            }
            return new Dispatcher(this);
        }
    }
}
