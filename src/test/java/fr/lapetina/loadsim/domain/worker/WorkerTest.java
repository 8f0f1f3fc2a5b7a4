package fr.lapetina.loadsim.domain.worker;

import fr.lapetina.loadsim.domain.model.WorkItem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class WorkerTest {

    private Worker worker;

    @BeforeEach
    void setUp() {
        worker = Worker.builder()
                .id(1)
                .address("192.168.1.1")
                .maxCapacity(3)
                .build();
    }

    private static WorkItem item(long id, int duration) {
        return WorkItem.builder().id(id).originAddress("10.0.0.1").duration(duration).build();
    }

    @Test
    @DisplayName("should create worker with builder")
    void shouldCreateWorkerWithBuilder() {
        assertThat(worker.getId()).isEqualTo(1);
        assertThat(worker.getAddress()).isEqualTo("192.168.1.1");
        assertThat(worker.getMaxCapacity()).isEqualTo(3);
        assertThat(worker.isActive()).isTrue();
        assertThat(worker.getCurrentLoad()).isZero();
    }

    @Test
    @DisplayName("should default capacity to 5")
    void shouldDefaultCapacity() {
        Worker defaults = Worker.builder().id(2).address("192.168.1.2").build();

        assertThat(defaults.getMaxCapacity()).isEqualTo(Worker.DEFAULT_CAPACITY).isEqualTo(5);
    }

    @Test
    @DisplayName("should enforce max capacity")
    void shouldEnforceMaxCapacity() {
        assertThat(worker.accept(item(1, 5))).isTrue();
        assertThat(worker.accept(item(2, 5))).isTrue();
        assertThat(worker.accept(item(3, 5))).isTrue();

        assertThat(worker.canAccept()).isFalse();
        assertThat(worker.accept(item(4, 5))).isFalse();
        assertThat(worker.getCurrentLoad()).isEqualTo(3);
    }

    @Test
    @DisplayName("should complete an item of duration 3 on its third cycle")
    void shouldCompleteOnThirdCycle() {
        worker.accept(item(1, 3));

        assertThat(worker.advanceOneCycle()).isZero();
        assertThat(worker.advanceOneCycle()).isZero();
        assertThat(worker.advanceOneCycle()).isEqualTo(1);

        assertThat(worker.getCurrentLoad()).isZero();
        assertThat(worker.getCompletedCount()).isEqualTo(1);
        assertThat(worker.getTotalProcessingTime()).isEqualTo(3);
    }

    @Test
    @DisplayName("should advance every in-flight item once per cycle")
    void shouldAdvanceEveryItemOncePerCycle() {
        worker.accept(item(1, 1));
        worker.accept(item(2, 2));
        worker.accept(item(3, 1));

        assertThat(worker.advanceOneCycle()).isEqualTo(2);
        assertThat(worker.getCurrentLoad()).isEqualTo(1);

        assertThat(worker.advanceOneCycle()).isEqualTo(1);
        assertThat(worker.getCurrentLoad()).isZero();
        assertThat(worker.getTotalProcessingTime()).isEqualTo(4);
        assertThat(worker.getAverageProcessingTime()).isCloseTo(4.0 / 3.0, within(1e-9));
    }

    @Test
    @DisplayName("should not advance or accept while inactive")
    void shouldNotAdvanceWhileInactive() {
        worker.accept(item(1, 1));
        worker.setActive(false);

        assertThat(worker.canAccept()).isFalse();
        assertThat(worker.accept(item(2, 1))).isFalse();
        assertThat(worker.advanceOneCycle()).isZero();
        assertThat(worker.getCurrentLoad()).isEqualTo(1);

        worker.setActive(true);
        assertThat(worker.advanceOneCycle()).isEqualTo(1);
    }

    @Test
    @DisplayName("should hand back in-flight items on drain")
    void shouldDrainInFlightItems() {
        worker.accept(item(1, 4));
        worker.accept(item(2, 4));

        assertThat(worker.drain()).extracting(WorkItem::getId).containsExactly(1L, 2L);
        assertThat(worker.getCurrentLoad()).isZero();
        assertThat(worker.getCompletedCount()).isZero();
    }

    @Test
    @DisplayName("should report utilization as a percentage")
    void shouldReportUtilizationAsPercentage() {
        Worker five = Worker.builder().id(3).address("192.168.1.3").maxCapacity(5).build();
        five.accept(item(1, 9));
        five.accept(item(2, 9));

        assertThat(five.utilization()).isCloseTo(40.0, within(1e-9));
    }

    @Test
    @DisplayName("should report zero utilization for zero capacity")
    void shouldHandleZeroCapacity() {
        Worker none = Worker.builder().id(4).address("192.168.1.4").maxCapacity(0).build();

        assertThat(none.canAccept()).isFalse();
        assertThat(none.utilization()).isZero();
    }

    @Test
    @DisplayName("should format a status summary")
    void shouldFormatStatusSummary() {
        Worker five = Worker.builder().id(1).address("192.168.1.1").maxCapacity(5).build();
        five.accept(item(1, 1));
        five.accept(item(2, 9));
        five.advanceOneCycle();

        assertThat(five.getStatusSummary())
                .isEqualTo("Worker 1 (192.168.1.1): Load: 1/5 (20.0%) | Processed: 1 | Active: Yes");
    }

    @Test
    @DisplayName("should reject negative capacity")
    void shouldRejectNegativeCapacity() {
        assertThatThrownBy(() -> Worker.builder().id(1).address("192.168.1.1").maxCapacity(-1).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should copy state into a snapshot that does not track later changes")
    void shouldSnapshotState() {
        worker.accept(item(1, 1));
        WorkerSnapshot snapshot = worker.snapshot();

        worker.advanceOneCycle();
        worker.setActive(false);

        assertThat(snapshot.id()).isEqualTo(1);
        assertThat(snapshot.address()).isEqualTo("192.168.1.1");
        assertThat(snapshot.load()).isEqualTo(1);
        assertThat(snapshot.capacity()).isEqualTo(3);
        assertThat(snapshot.active()).isTrue();
        assertThat(snapshot.completed()).isZero();
        assertThat(snapshot.utilization()).isCloseTo(100.0 / 3, within(1e-9));
        assertThat(worker.snapshot().completed()).isEqualTo(1);
    }
}
