package fr.lapetina.loadsim.domain.model;

import java.time.Duration;
import java.util.Objects;

/**
 * A unit of simulated work travelling through the load balancer.
 *
 * Every attribute is fixed at creation except the remaining duration, which
 * the owning worker counts down one cycle at a time. A work item is held by
 * exactly one component at any time: first the admission queue, then a
 * single worker until it completes or is discarded.
 *
 * Not thread-safe; ownership is serialized by the dispatcher.
 */
public final class WorkItem {

    public static final int MIN_PRIORITY = 1;
    public static final int MAX_PRIORITY = 10;

    private final long id;
    private final String originAddress;
    private final String category;
    private final int priority;
    private final int originalDuration;
    private final long arrivalNanos;

    private int remainingDuration;

    private WorkItem(Builder builder) {
        this.id = builder.id;
        this.originAddress = Objects.requireNonNull(builder.originAddress, "Origin address is required");
        this.category = Objects.requireNonNull(builder.category, "Category is required");
        if (builder.priority < MIN_PRIORITY || builder.priority > MAX_PRIORITY) {
            throw new IllegalArgumentException("Priority must be between "
                    + MIN_PRIORITY + " and " + MAX_PRIORITY + ": " + builder.priority);
        }
        if (builder.duration <= 0) {
            throw new IllegalArgumentException("Processing duration must be positive: " + builder.duration);
        }
        this.priority = builder.priority;
        this.originalDuration = builder.duration;
        this.remainingDuration = builder.duration;
        this.arrivalNanos = builder.arrivalNanos != null ? builder.arrivalNanos : System.nanoTime();
    }

    public long getId() {
        return id;
    }

    public String getOriginAddress() {
        return originAddress;
    }

    public String getCategory() {
        return category;
    }

    /**
     * Priority in 1..10. Carried for callers; no dispatch decision reads it.
     */
    public int getPriority() {
        return priority;
    }

    public int getOriginalDuration() {
        return originalDuration;
    }

    public int getRemainingDuration() {
        return remainingDuration;
    }

    public long getArrivalNanos() {
        return arrivalNanos;
    }

    /**
     * Time elapsed since the item was created.
     */
    public Duration getWaitTime() {
        return Duration.ofNanos(System.nanoTime() - arrivalNanos);
    }

    /**
     * Consumes one cycle of processing.
     *
     * @return the remaining duration after this cycle
     */
    public int consumeCycle() {
        return --remainingDuration;
    }

    public boolean isComplete() {
        return remainingDuration <= 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkItem that = (WorkItem) o;
        return id == that.id;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(id);
    }

    @Override
    public String toString() {
        return "WorkItem{" +
                "id=" + id +
                ", origin='" + originAddress + '\'' +
                ", category=" + category +
                ", priority=" + priority +
                ", remaining=" + remainingDuration +
                "/" + originalDuration +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private long id;
        private String originAddress;
        private String category = "GET";
        private int priority = 5;
        private int duration = 10;
        private Long arrivalNanos;

        public Builder id(long id) {
            this.id = id;
            return this;
        }

        public Builder originAddress(String originAddress) {
            this.originAddress = originAddress;
            return this;
        }

        public Builder category(String category) {
            this.category = category;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder duration(int duration) {
            this.duration = duration;
            return this;
        }

        public Builder arrivalNanos(long arrivalNanos) {
            this.arrivalNanos = arrivalNanos;
            return this;
        }

        public WorkItem build() {
            return new WorkItem(this);
        }
    }
}
