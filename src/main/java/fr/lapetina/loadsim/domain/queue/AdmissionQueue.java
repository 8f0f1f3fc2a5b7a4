package fr.lapetina.loadsim.domain.queue;

import fr.lapetina.loadsim.domain.model.RejectionReason;
import fr.lapetina.loadsim.domain.model.WorkItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Bounded FIFO buffer that gatekeeps entry into the system.
 *
 * Admission fails, without throwing, when the item's origin is blocked or the
 * queue already holds {@code capacity} items. Blocking an origin never evicts
 * items that were admitted before the block.
 *
 * Not thread-safe; owned by the dispatcher.
 */
public final class AdmissionQueue {

    private static final Logger log = LoggerFactory.getLogger(AdmissionQueue.class);

    public static final int DEFAULT_CAPACITY = 1000;

    private final Deque<WorkItem> items = new ArrayDeque<>();
    private final Set<String> blockedOrigins = new HashSet<>();
    private final Map<RejectionReason, Long> rejections = new EnumMap<>(RejectionReason.class);
    private final int capacity;

    private long totalAdmitted;
    private long totalRemoved;

    public AdmissionQueue(int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("Queue capacity must not be negative: " + capacity);
        }
        this.capacity = capacity;
        for (RejectionReason reason : RejectionReason.values()) {
            rejections.put(reason, 0L);
        }
    }

    public AdmissionQueue() {
        this(DEFAULT_CAPACITY);
    }

    /**
     * Appends an item to the tail of the queue.
     *
     * @return true if admitted, false if the origin is blocked or the queue is full
     */
    public boolean enqueue(WorkItem item) {
        if (isBlocked(item.getOriginAddress())) {
            reject(item, RejectionReason.BLOCKED_ORIGIN);
            return false;
        }
        if (isFull()) {
            reject(item, RejectionReason.QUEUE_FULL);
            return false;
        }
        items.addLast(item);
        totalAdmitted++;
        log.debug("Item admitted: itemId={}, origin={}, queueSize={}/{}",
                item.getId(), item.getOriginAddress(), items.size(), capacity);
        return true;
    }

    private void reject(WorkItem item, RejectionReason reason) {
        rejections.merge(reason, 1L, Long::sum);
        log.debug("Item rejected: itemId={}, origin={}, reason={}",
                item.getId(), item.getOriginAddress(), reason);
    }

    /**
     * Removes and returns the head of the queue.
     *
     * @return the oldest admitted item, or empty if the queue is empty
     */
    public Optional<WorkItem> dequeueNext() {
        WorkItem head = items.pollFirst();
        if (head == null) {
            return Optional.empty();
        }
        totalRemoved++;
        return Optional.of(head);
    }

    public void blockOrigin(String address) {
        if (blockedOrigins.add(address)) {
            log.info("Origin blocked: address={}", address);
        }
    }

    public void unblockOrigin(String address) {
        if (blockedOrigins.remove(address)) {
            log.info("Origin unblocked: address={}", address);
        }
    }

    public boolean isBlocked(String address) {
        return blockedOrigins.contains(address);
    }

    public Set<String> getBlockedOrigins() {
        return Collections.unmodifiableSet(blockedOrigins);
    }

    /**
     * Fill ratio in [0, 1]; 0 for a zero-capacity queue.
     */
    public double utilization() {
        if (capacity == 0) {
            return 0.0;
        }
        return (double) items.size() / capacity;
    }

    public int size() {
        return items.size();
    }

    public int capacity() {
        return capacity;
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public boolean isFull() {
        return items.size() >= capacity;
    }

    public long getTotalAdmitted() {
        return totalAdmitted;
    }

    public long getTotalRemoved() {
        return totalRemoved;
    }

    public long getRejectedCount(RejectionReason reason) {
        return rejections.get(reason);
    }

    public long getTotalRejected() {
        long total = 0;
        for (long count : rejections.values()) {
            total += count;
        }
        return total;
    }

    @Override
    public String toString() {
        return "AdmissionQueue{" +
                "size=" + items.size() +
                "/" + capacity +
                ", blocked=" + blockedOrigins.size() +
                ", admitted=" + totalAdmitted +
                ", removed=" + totalRemoved +
                '}';
    }
}
