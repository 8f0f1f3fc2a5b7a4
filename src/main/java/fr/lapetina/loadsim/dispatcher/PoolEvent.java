package fr.lapetina.loadsim.dispatcher;

import fr.lapetina.loadsim.domain.worker.WorkerSnapshot;

/**
 * Notification of a change in the worker pool.
 *
 * @param type           what happened
 * @param worker         the worker added or removed, as it was right after the change
 * @param poolSize       pool size after the change
 * @param discardedItems in-flight items lost with a removed worker (always 0 for additions)
 * @param cycle          cycle during which the change happened (0 before the first cycle)
 */
public record PoolEvent(Type type, WorkerSnapshot worker, int poolSize, int discardedItems, long cycle) {

    public enum Type {
        WORKER_ADDED,
        WORKER_REMOVED
    }
}
