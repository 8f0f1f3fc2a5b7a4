package fr.lapetina.loadsim.domain.scaling;

/**
 * Load observed once per cycle, after dispatch, and fed to the scaling policy.
 *
 * @param meanUtilization mean load/capacity ratio of active workers in [0, 1]; 0 when none is active
 * @param queueSize       number of items waiting in the admission queue
 */
public record ScalingSignal(double meanUtilization, int queueSize) {

    public ScalingSignal {
        if (meanUtilization < 0.0) {
            throw new IllegalArgumentException("Utilization must not be negative: " + meanUtilization);
        }
        if (queueSize < 0) {
            throw new IllegalArgumentException("Queue size must not be negative: " + queueSize);
        }
    }
}
