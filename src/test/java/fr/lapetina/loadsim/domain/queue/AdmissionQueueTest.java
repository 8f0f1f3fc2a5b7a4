package fr.lapetina.loadsim.domain.queue;

import fr.lapetina.loadsim.domain.model.RejectionReason;
import fr.lapetina.loadsim.domain.model.WorkItem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class AdmissionQueueTest {

    private AdmissionQueue queue;

    @BeforeEach
    void setUp() {
        queue = new AdmissionQueue(3);
    }

    private static WorkItem item(long id, String origin) {
        return WorkItem.builder().id(id).originAddress(origin).build();
    }

    @Test
    @DisplayName("should dequeue in FIFO order")
    void shouldDequeueInFifoOrder() {
        queue.enqueue(item(1, "10.0.0.1"));
        queue.enqueue(item(2, "10.0.0.2"));
        queue.enqueue(item(3, "10.0.0.3"));

        assertThat(queue.dequeueNext()).map(WorkItem::getId).contains(1L);
        assertThat(queue.dequeueNext()).map(WorkItem::getId).contains(2L);
        assertThat(queue.dequeueNext()).map(WorkItem::getId).contains(3L);
        assertThat(queue.dequeueNext()).isEmpty();
        assertThat(queue.getTotalRemoved()).isEqualTo(3);
    }

    @Test
    @DisplayName("should reject when full")
    void shouldRejectWhenFull() {
        assertThat(queue.enqueue(item(1, "10.0.0.1"))).isTrue();
        assertThat(queue.enqueue(item(2, "10.0.0.1"))).isTrue();
        assertThat(queue.enqueue(item(3, "10.0.0.1"))).isTrue();

        assertThat(queue.isFull()).isTrue();
        assertThat(queue.enqueue(item(4, "10.0.0.1"))).isFalse();

        assertThat(queue.size()).isEqualTo(3);
        assertThat(queue.getTotalAdmitted()).isEqualTo(3);
        assertThat(queue.getRejectedCount(RejectionReason.QUEUE_FULL)).isEqualTo(1);
    }

    @Test
    @DisplayName("should reject blocked origins even with room")
    void shouldRejectBlockedOrigins() {
        queue.blockOrigin("10.6.6.6");

        assertThat(queue.enqueue(item(1, "10.6.6.6"))).isFalse();
        assertThat(queue.isEmpty()).isTrue();
        assertThat(queue.getRejectedCount(RejectionReason.BLOCKED_ORIGIN)).isEqualTo(1);
        assertThat(queue.getRejectedCount(RejectionReason.QUEUE_FULL)).isZero();
    }

    @Test
    @DisplayName("should check the blocklist before capacity")
    void shouldCheckBlocklistBeforeCapacity() {
        queue.enqueue(item(1, "10.0.0.1"));
        queue.enqueue(item(2, "10.0.0.1"));
        queue.enqueue(item(3, "10.0.0.1"));
        queue.blockOrigin("10.6.6.6");

        assertThat(queue.enqueue(item(4, "10.6.6.6"))).isFalse();

        assertThat(queue.getRejectedCount(RejectionReason.BLOCKED_ORIGIN)).isEqualTo(1);
        assertThat(queue.getRejectedCount(RejectionReason.QUEUE_FULL)).isZero();
        assertThat(queue.getTotalRejected()).isEqualTo(1);
    }

    @Test
    @DisplayName("should keep items admitted before a block")
    void shouldKeepItemsAdmittedBeforeBlock() {
        queue.enqueue(item(1, "10.6.6.6"));
        queue.blockOrigin("10.6.6.6");

        assertThat(queue.size()).isEqualTo(1);
        assertThat(queue.dequeueNext()).map(WorkItem::getOriginAddress).contains("10.6.6.6");
    }

    @Test
    @DisplayName("should admit again after unblock")
    void shouldAdmitAfterUnblock() {
        queue.blockOrigin("10.6.6.6");
        queue.blockOrigin("10.6.6.6");
        assertThat(queue.getBlockedOrigins()).containsExactly("10.6.6.6");

        queue.unblockOrigin("10.6.6.6");
        queue.unblockOrigin("10.9.9.9");

        assertThat(queue.isBlocked("10.6.6.6")).isFalse();
        assertThat(queue.enqueue(item(1, "10.6.6.6"))).isTrue();
    }

    @Test
    @DisplayName("should report utilization as a fraction")
    void shouldReportUtilizationAsFraction() {
        AdmissionQueue large = new AdmissionQueue(10);
        for (int i = 0; i < 4; i++) {
            large.enqueue(item(i, "10.0.0.1"));
        }

        assertThat(large.utilization()).isCloseTo(0.4, within(1e-9));
    }

    @Test
    @DisplayName("should treat a zero-capacity queue as always full")
    void shouldHandleZeroCapacity() {
        AdmissionQueue empty = new AdmissionQueue(0);

        assertThat(empty.enqueue(item(1, "10.0.0.1"))).isFalse();
        assertThat(empty.utilization()).isZero();
        assertThat(empty.getRejectedCount(RejectionReason.QUEUE_FULL)).isEqualTo(1);
    }

    @Test
    @DisplayName("should default to a capacity of 1000")
    void shouldDefaultCapacity() {
        assertThat(new AdmissionQueue().capacity()).isEqualTo(1000);
    }

    @Test
    @DisplayName("should reject negative capacity")
    void shouldRejectNegativeCapacity() {
        assertThatThrownBy(() -> new AdmissionQueue(-1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
