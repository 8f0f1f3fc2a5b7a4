package fr.lapetina.loadsim.domain.strategy;

import fr.lapetina.loadsim.domain.worker.Worker;

import java.util.List;
import java.util.Optional;

/**
 * Strategy interface for placing queued work on the worker pool.
 *
 * Implementations may keep state between calls (a rotation cursor, for
 * instance). They are driven by the dispatcher, which serializes access.
 */
public interface PlacementStrategy {

    /**
     * Returns the name of this strategy for configuration and logging.
     */
    String getName();

    /**
     * Selects the worker that receives the next item.
     *
     * @param workers the pool, in rotation order
     * @return a worker that can accept one more item, or empty if none can
     */
    Optional<Worker> selectWorker(List<Worker> workers);

    /**
     * Called after the pool grew or shrank.
     *
     * @param poolSize the new number of workers
     */
    default void onPoolResized(int poolSize) {
        // Default no-op
    }

    /**
     * Resets any internal state.
     */
    default void reset() {
        // Default no-op
    }
}
