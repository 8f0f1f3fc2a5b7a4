package fr.lapetina.loadsim.simulation;

import fr.lapetina.loadsim.domain.model.WorkItem;

import java.util.List;
import java.util.Random;

/**
 * Produces synthetic requests for the simulation.
 *
 * Owns its random source; two generators built with the same seed produce the
 * same sequence of items and arrivals. It never reads or writes dispatcher state.
 */
public final class WorkItemGenerator {

    static final List<String> CATEGORIES = List.of("GET", "POST", "PUT", "DELETE");

    private static final int MIN_OCTET = 1;
    private static final int MAX_OCTET = 254;

    private final Random random;
    private final int minDuration;
    private final int maxDuration;

    public WorkItemGenerator(long seed, int minDuration, int maxDuration) {
        if (minDuration <= 0 || minDuration > maxDuration) {
            throw new IllegalArgumentException("Duration range must satisfy 0 < min <= max: "
                    + minDuration + ".." + maxDuration);
        }
        this.random = new Random(seed);
        this.minDuration = minDuration;
        this.maxDuration = maxDuration;
    }

    /**
     * Generates the next request.
     *
     * @param id identity of the new item
     */
    public WorkItem next(long id) {
        return WorkItem.builder()
                .id(id)
                .originAddress(randomAddress())
                .category(CATEGORIES.get(random.nextInt(CATEGORIES.size())))
                .priority(between(WorkItem.MIN_PRIORITY, WorkItem.MAX_PRIORITY))
                .duration(between(minDuration, maxDuration))
                .build();
    }

    /**
     * Decides whether a new request arrives this cycle.
     *
     * @param probability chance of an arrival, in [0, 1]
     */
    public boolean arrives(double probability) {
        return random.nextDouble() < probability;
    }

    private String randomAddress() {
        return between(MIN_OCTET, MAX_OCTET) + "." +
                between(MIN_OCTET, MAX_OCTET) + "." +
                between(MIN_OCTET, MAX_OCTET) + "." +
                between(MIN_OCTET, MAX_OCTET);
    }

    // Inclusive on both ends
    private int between(int min, int max) {
        return min + random.nextInt(max - min + 1);
    }
}
