package fr.lapetina.loadsim.simulation;

import java.util.List;
import java.util.Locale;

/**
 * Final statistics of a simulation run.
 * Immutable and thread-safe.
 */
public record SimulationReport(
        long cyclesExecuted,
        long totalAdmitted,
        long totalRejected,
        long totalCompleted,
        long totalDiscarded,
        int inFlight,
        double averageProcessingTime,
        double systemUtilization,
        int queueSize,
        int poolSize,
        List<String> workerStatuses
) {
    public SimulationReport {
        workerStatuses = workerStatuses != null ? List.copyOf(workerStatuses) : List.of();
    }

    /**
     * Multi-line summary suitable for logging.
     */
    public String format() {
        StringBuilder sb = new StringBuilder();
        sb.append("Final Statistics:").append(System.lineSeparator());
        sb.append(String.format(Locale.ROOT, "- Cycles executed: %d%n", cyclesExecuted));
        sb.append(String.format(Locale.ROOT, "- Total requests admitted: %d (rejected: %d)%n",
                totalAdmitted, totalRejected));
        sb.append(String.format(Locale.ROOT, "- Total requests processed: %d%n", totalCompleted));
        sb.append(String.format(Locale.ROOT, "- Requests discarded by scale-down: %d%n", totalDiscarded));
        sb.append(String.format(Locale.ROOT, "- Average processing time: %.2f cycles%n", averageProcessingTime));
        sb.append(String.format(Locale.ROOT, "- Final system utilization: %.1f%%%n", systemUtilization));
        sb.append(String.format(Locale.ROOT, "- Final queue size: %d%n", queueSize));
        sb.append(String.format(Locale.ROOT, "- Final pool size: %d (in flight: %d)%n", poolSize, inFlight));
        sb.append("Worker Statistics:");
        for (String status : workerStatuses) {
            sb.append(System.lineSeparator()).append("  ").append(status);
        }
        return sb.toString();
    }
}
