package fr.lapetina.loadsim.domain.worker;

/**
 * Point-in-time, read-only view of a worker.
 *
 * @param id        worker identity
 * @param address   worker address
 * @param load      in-flight items when the snapshot was taken
 * @param capacity  maximum in-flight items
 * @param active    whether the worker was accepting and advancing work
 * @param completed items completed so far
 */
public record WorkerSnapshot(int id, String address, int load, int capacity, boolean active, long completed) {

    /**
     * Load as a percentage of capacity in [0, 100]; 0 when capacity is 0.
     */
    public double utilization() {
        return capacity == 0 ? 0.0 : (double) load / capacity * 100.0;
    }
}
