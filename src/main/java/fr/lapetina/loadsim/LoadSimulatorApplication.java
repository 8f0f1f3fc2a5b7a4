package fr.lapetina.loadsim;

import fr.lapetina.loadsim.simulation.SimulationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Main entry point for the Load Balancer Simulator.
 */
public class LoadSimulatorApplication implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LoadSimulatorApplication.class);

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 30;

    private final SimulationFactory factory;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public LoadSimulatorApplication(String configPath) {
        log.info("Starting Load Balancer Simulator...");
        this.factory = SimulationFactory.create(configPath);
        log.info("Load Balancer Simulator initialized");
    }

    public SimulationReport run() {
        SimulationReport report = factory.run();
        log.info("Simulation finished\n{}", report.format());
        return report;
    }

    public void requestShutdown() {
        factory.stop();
    }

    /**
     * Waits until {@link #close()} has completed.
     *
     * @return true if the application closed within the timeout
     */
    public boolean awaitShutdown(long timeout, TimeUnit unit) throws InterruptedException {
        return shutdownLatch.await(timeout, unit);
    }

    public SimulationFactory getFactory() {
        return factory;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        log.info("Shutting down Load Balancer Simulator...");

        try {
            factory.close();
        } catch (Exception e) {
            log.warn("Error closing factory", e);
        } finally {
            shutdownLatch.countDown();
        }

        log.info("Load Balancer Simulator shut down");
    }

    public static void main(String[] args) {
        String configPath = args.length > 0 ? args[0] : "simulation.yaml";

        LoadSimulatorApplication app;
        try {
            app = new LoadSimulatorApplication(configPath);
        } catch (Exception e) {
            log.error("Failed to start Load Balancer Simulator", e);
            System.exit(1);
            return;
        }

        // The JVM exits once hooks return, so the hook holds it until the run has reported and closed
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            app.requestShutdown();
            try {
                if (!app.awaitShutdown(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                    log.warn("Simulation did not stop within {}s", SHUTDOWN_TIMEOUT_SECONDS);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "simulation-shutdown"));

        try (app) {
            app.run();
        } catch (Exception e) {
            log.error("Simulation failed", e);
            System.exit(1);
        }
    }
}
