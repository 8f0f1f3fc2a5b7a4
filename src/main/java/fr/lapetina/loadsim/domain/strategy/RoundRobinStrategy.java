package fr.lapetina.loadsim.domain.strategy;

import fr.lapetina.loadsim.domain.worker.Worker;

import java.util.List;
import java.util.Optional;

/**
 * Round-robin placement with a persistent rotation cursor.
 *
 * Each selection scans the pool from the cursor, wrapping around, and picks
 * the first worker that can accept. The cursor then moves to the position
 * just after the chosen worker, so the next selection (in this cycle or a
 * later one) starts from there instead of from index 0.
 */
public final class RoundRobinStrategy implements PlacementStrategy {

    private int cursor;

    @Override
    public String getName() {
        return "round-robin";
    }

    @Override
    public Optional<Worker> selectWorker(List<Worker> workers) {
        if (workers == null || workers.isEmpty()) {
            return Optional.empty();
        }

        int size = workers.size();
        int startIndex = cursor % size;

        for (int i = 0; i < size; i++) {
            int index = (startIndex + i) % size;
            Worker worker = workers.get(index);

            if (worker.canAccept()) {
                cursor = (index + 1) % size;
                return Optional.of(worker);
            }
        }

        return Optional.empty();
    }

    @Override
    public void onPoolResized(int poolSize) {
        // Keep the cursor a valid index; the scan start is unchanged modulo the new size.
        cursor = poolSize > 0 ? cursor % poolSize : 0;
    }

    @Override
    public void reset() {
        cursor = 0;
    }

    /**
     * Index at which the next scan begins.
     */
    public int getCursor() {
        return cursor;
    }
}
