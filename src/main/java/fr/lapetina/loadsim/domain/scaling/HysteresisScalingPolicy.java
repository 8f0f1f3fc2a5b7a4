package fr.lapetina.loadsim.domain.scaling;

/**
 * Two-sided threshold scaling with asymmetric hysteresis.
 *
 * Scale up when:   utilization > threshold OR queue > queueBacklogTrigger, and pool below max.
 * Scale down when: utilization < threshold * scaleDownFactor AND queue empty,
 *                  and pool above min + scaleDownSlack.
 *
 * A single excursion above the threshold is enough to grow; shrinking needs a
 * much lower floor, an empty queue and spare workers, so one quiet cycle does
 * not make the pool flap.
 */
public final class HysteresisScalingPolicy implements ScalingPolicy {

    public static final double DEFAULT_THRESHOLD = 0.8;
    public static final int DEFAULT_QUEUE_BACKLOG_TRIGGER = 10;
    public static final double DEFAULT_SCALE_DOWN_FACTOR = 0.05;
    public static final int DEFAULT_SCALE_DOWN_SLACK = 3;

    private final double threshold;
    private final int queueBacklogTrigger;
    private final double scaleDownFactor;
    private final int scaleDownSlack;

    public HysteresisScalingPolicy(
            double threshold,
            int queueBacklogTrigger,
            double scaleDownFactor,
            int scaleDownSlack
    ) {
        if (threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("Utilization threshold must be within [0, 1]: " + threshold);
        }
        if (queueBacklogTrigger < 0) {
            throw new IllegalArgumentException("Queue backlog trigger must not be negative: " + queueBacklogTrigger);
        }
        if (scaleDownFactor < 0.0 || scaleDownFactor > 1.0) {
            throw new IllegalArgumentException("Scale-down factor must be within [0, 1]: " + scaleDownFactor);
        }
        if (scaleDownSlack < 0) {
            throw new IllegalArgumentException("Scale-down slack must not be negative: " + scaleDownSlack);
        }
        this.threshold = threshold;
        this.queueBacklogTrigger = queueBacklogTrigger;
        this.scaleDownFactor = scaleDownFactor;
        this.scaleDownSlack = scaleDownSlack;
    }

    public HysteresisScalingPolicy(double threshold) {
        this(threshold, DEFAULT_QUEUE_BACKLOG_TRIGGER, DEFAULT_SCALE_DOWN_FACTOR, DEFAULT_SCALE_DOWN_SLACK);
    }

    public HysteresisScalingPolicy() {
        this(DEFAULT_THRESHOLD);
    }

    @Override
    public boolean shouldScaleUp(ScalingSignal signal, int poolSize, int maxSize) {
        boolean underPressure = signal.meanUtilization() > threshold
                || signal.queueSize() > queueBacklogTrigger;
        return underPressure && poolSize < maxSize;
    }

    @Override
    public boolean shouldScaleDown(ScalingSignal signal, int poolSize, int minSize) {
        return signal.meanUtilization() < threshold * scaleDownFactor
                && signal.queueSize() == 0
                && poolSize > minSize + scaleDownSlack;
    }

    public double getThreshold() {
        return threshold;
    }

    public int getQueueBacklogTrigger() {
        return queueBacklogTrigger;
    }

    public double getScaleDownFactor() {
        return scaleDownFactor;
    }

    public int getScaleDownSlack() {
        return scaleDownSlack;
    }

    @Override
    public String toString() {
        return "HysteresisScalingPolicy{" +
                "threshold=" + threshold +
                ", queueBacklogTrigger=" + queueBacklogTrigger +
                ", scaleDownFactor=" + scaleDownFactor +
                ", scaleDownSlack=" + scaleDownSlack +
                '}';
    }
}
