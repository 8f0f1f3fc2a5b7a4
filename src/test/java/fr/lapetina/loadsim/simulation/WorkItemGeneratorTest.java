package fr.lapetina.loadsim.simulation;

import fr.lapetina.loadsim.domain.model.WorkItem;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkItemGeneratorTest {

    @Test
    @DisplayName("should generate items within the configured ranges")
    void shouldGenerateWithinRanges() {
        WorkItemGenerator generator = new WorkItemGenerator(11L, 5, 50);

        for (long id = 1; id <= 500; id++) {
            WorkItem item = generator.next(id);

            assertThat(item.getId()).isEqualTo(id);
            assertThat(item.getOriginalDuration()).isBetween(5, 50);
            assertThat(item.getPriority()).isBetween(WorkItem.MIN_PRIORITY, WorkItem.MAX_PRIORITY);
            assertThat(item.getCategory()).isIn(WorkItemGenerator.CATEGORIES);
            assertThat(item.getOriginAddress()).matches("\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}");
            for (String octet : item.getOriginAddress().split("\\.")) {
                assertThat(Integer.parseInt(octet)).isBetween(1, 254);
            }
        }
    }

    @Test
    @DisplayName("should reproduce the same sequence for the same seed")
    void shouldBeDeterministic() {
        WorkItemGenerator first = new WorkItemGenerator(99L, 1, 10);
        WorkItemGenerator second = new WorkItemGenerator(99L, 1, 10);

        List<String> a = new ArrayList<>();
        List<String> b = new ArrayList<>();
        for (long id = 1; id <= 50; id++) {
            a.add(first.next(id).toString() + first.arrives(0.5));
            b.add(second.next(id).toString() + second.arrives(0.5));
        }

        assertThat(a).isEqualTo(b);
    }

    @Test
    @DisplayName("should honour arrival probability bounds")
    void shouldHonourArrivalBounds() {
        WorkItemGenerator generator = new WorkItemGenerator(3L, 1, 1);

        for (int i = 0; i < 100; i++) {
            assertThat(generator.arrives(0.0)).isFalse();
            assertThat(generator.arrives(1.0)).isTrue();
        }
    }

    @Test
    @DisplayName("should support a single-value duration range")
    void shouldSupportFixedDuration() {
        WorkItemGenerator generator = new WorkItemGenerator(5L, 7, 7);

        assertThat(generator.next(1).getOriginalDuration()).isEqualTo(7);
    }

    @Test
    @DisplayName("should reject an invalid duration range")
    void shouldRejectInvalidRange() {
        assertThatThrownBy(() -> new WorkItemGenerator(1L, 0, 5))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new WorkItemGenerator(1L, 6, 5))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
