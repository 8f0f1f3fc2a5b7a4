package fr.lapetina.loadsim.domain.worker;

import fr.lapetina.loadsim.domain.model.WorkItem;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Capacity-limited processor of work items.
 *
 * Holds an internal FIFO of in-flight items; one item occupies one slot, so
 * the current load is always the FIFO length. Every cycle each in-flight item
 * advances by one unit of processing time, whatever the number of items
 * sharing the worker.
 *
 * Equality is identity: a worker re-created after a shrink reuses the
 * released id, so two workers with the same id are still distinct.
 *
 * Not thread-safe; owned by the dispatcher.
 */
public final class Worker {

    public static final int DEFAULT_CAPACITY = 5;

    private final int id;
    private final String address;
    private final int maxCapacity;

    private final Deque<WorkItem> inFlight = new ArrayDeque<>();
    private boolean active;
    private long completedCount;
    private long totalProcessingTime;

    private Worker(Builder builder) {
        this.id = builder.id;
        this.address = Objects.requireNonNull(builder.address, "Worker address is required");
        if (builder.maxCapacity < 0) {
            throw new IllegalArgumentException("Worker capacity must not be negative: " + builder.maxCapacity);
        }
        this.maxCapacity = builder.maxCapacity;
        this.active = builder.active;
    }

    public int getId() {
        return id;
    }

    public String getAddress() {
        return address;
    }

    public int getMaxCapacity() {
        return maxCapacity;
    }

    public int getCurrentLoad() {
        return inFlight.size();
    }

    public boolean isActive() {
        return active;
    }

    /**
     * Deactivating keeps in-flight items in place; they stop advancing until
     * the worker is reactivated.
     */
    public void setActive(boolean active) {
        this.active = active;
    }

    public long getCompletedCount() {
        return completedCount;
    }

    public long getTotalProcessingTime() {
        return totalProcessingTime;
    }

    /**
     * Checks if the worker can take one more item: active and below capacity.
     */
    public boolean canAccept() {
        return active && inFlight.size() < maxCapacity;
    }

    /**
     * Takes ownership of an item.
     *
     * @return true if accepted, false if inactive or at capacity
     */
    public boolean accept(WorkItem item) {
        if (!canAccept()) {
            return false;
        }
        inFlight.addLast(item);
        return true;
    }

    /**
     * Advances every in-flight item by one cycle, in FIFO order, each exactly once.
     * Items reaching zero remaining duration leave the worker and their original
     * duration is added to the processing-time counter.
     *
     * @return number of items completed during this cycle
     */
    public int advanceOneCycle() {
        if (!active || inFlight.isEmpty()) {
            return 0;
        }

        int completed = 0;
        int pending = inFlight.size();
        for (int i = 0; i < pending; i++) {
            WorkItem item = inFlight.pollFirst();
            if (item.consumeCycle() <= 0) {
                completed++;
                completedCount++;
                totalProcessingTime += item.getOriginalDuration();
            } else {
                inFlight.addLast(item);
            }
        }
        return completed;
    }

    /**
     * Removes every in-flight item and hands them back to the caller.
     */
    public List<WorkItem> drain() {
        List<WorkItem> drained = new ArrayList<>(inFlight);
        inFlight.clear();
        return drained;
    }

    /**
     * Load as a percentage of capacity in [0, 100]; 0 when capacity is 0.
     */
    public double utilization() {
        if (maxCapacity == 0) {
            return 0.0;
        }
        return (double) inFlight.size() / maxCapacity * 100.0;
    }

    public double getAverageProcessingTime() {
        if (completedCount == 0) {
            return 0.0;
        }
        return (double) totalProcessingTime / completedCount;
    }

    /**
     * One-line human readable status, e.g.
     * {@code Worker 1 (192.168.1.1): Load: 2/5 (40.0%) | Processed: 12 | Active: Yes}.
     */
    public String getStatusSummary() {
        return String.format(Locale.ROOT, "Worker %d (%s): Load: %d/%d (%.1f%%) | Processed: %d | Active: %s",
                id, address, inFlight.size(), maxCapacity, utilization(), completedCount,
                active ? "Yes" : "No");
    }

    /**
     * Copies the current state into an immutable view.
     */
    public WorkerSnapshot snapshot() {
        return new WorkerSnapshot(id, address, inFlight.size(), maxCapacity, active, completedCount);
    }

    @Override
    public String toString() {
        return "Worker{" +
                "id=" + id +
                ", address=" + address +
                ", active=" + active +
                ", load=" + inFlight.size() +
                "/" + maxCapacity +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int id;
        private String address;
        private int maxCapacity = DEFAULT_CAPACITY;
        private boolean active = true;

        public Builder id(int id) {
            this.id = id;
            return this;
        }

        public Builder address(String address) {
            this.address = address;
            return this;
        }

        public Builder maxCapacity(int maxCapacity) {
            this.maxCapacity = maxCapacity;
            return this;
        }

        public Builder active(boolean active) {
            this.active = active;
            return this;
        }

        public Worker build() {
            return new Worker(this);
        }
    }
}
