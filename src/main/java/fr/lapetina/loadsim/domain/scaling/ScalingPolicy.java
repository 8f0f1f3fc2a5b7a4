package fr.lapetina.loadsim.domain.scaling;

/**
 * Decides when the worker pool grows or shrinks.
 *
 * Both questions are asked every cycle and are independent: the dispatcher
 * asks {@link #shouldScaleUp} first, applies it, then asks
 * {@link #shouldScaleDown} with the pool size that resulted.
 */
public interface ScalingPolicy {

    /**
     * @param signal   load observed this cycle
     * @param poolSize current number of workers
     * @param maxSize  upper pool bound
     */
    boolean shouldScaleUp(ScalingSignal signal, int poolSize, int maxSize);

    /**
     * @param signal   load observed this cycle
     * @param poolSize current number of workers
     * @param minSize  lower pool bound
     */
    boolean shouldScaleDown(ScalingSignal signal, int poolSize, int minSize);
}
