package fr.lapetina.loadsim;

import fr.lapetina.loadsim.dispatcher.Dispatcher;
import fr.lapetina.loadsim.dispatcher.PoolEvent;
import fr.lapetina.loadsim.infrastructure.config.ConfigLoader;
import fr.lapetina.loadsim.infrastructure.config.SimulationConfig;
import fr.lapetina.loadsim.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.loadsim.simulation.SimulationReport;
import fr.lapetina.loadsim.simulation.SimulationRunner;
import fr.lapetina.loadsim.simulation.WorkItemGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Factory for creating fully-wired simulation instances from configuration.
 * This is the primary entry point for obtaining a configured Dispatcher and driver.
 *
 * <p>Usage:
 * <pre>{@code
 * try (SimulationFactory factory = SimulationFactory.create("simulation.yaml")) {
 *     SimulationReport report = factory.run();
 *     // inspect report...
 * }
 * }</pre>
 */
public class SimulationFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SimulationFactory.class);

    private final SimulationConfig config;
    private final MetricsRegistry metricsRegistry;
    private final Dispatcher dispatcher;
    private final WorkItemGenerator generator;
    private final SimulationRunner runner;
    private final long seed;

    protected SimulationFactory(SimulationConfig config) {
        this.config = ConfigLoader.prepare(config);

        // Initialize metrics
        this.metricsRegistry = new MetricsRegistry(config.getMetrics().getPrefix());

        // Build dispatcher
        this.dispatcher = Dispatcher.builder()
                .fromConfig(config)
                .build();
        dispatcher.addListener(this::onPoolChanged);

        if (config.getMetrics().isEnabled()) {
            metricsRegistry.bindDispatcher(dispatcher);
        }

        // Synthetic load
        Long configuredSeed = config.getSimulation().getSeed();
        this.seed = configuredSeed != null ? configuredSeed : ThreadLocalRandom.current().nextLong();
        this.generator = new WorkItemGenerator(
                seed,
                config.getSimulation().getMinDuration(),
                config.getSimulation().getMaxDuration()
        );

        this.runner = new SimulationRunner(dispatcher, generator, metricsRegistry, config);

        log.info("SimulationFactory initialized: workers={}, cycles={}, seed={}",
                dispatcher.getPoolSize(), config.getSimulation().getCycles(), seed);
    }

    /**
     * Creates a factory from the specified configuration file.
     */
    public static SimulationFactory create(String configPath) {
        log.info("Initializing SimulationFactory from config: {}", configPath);
        return new SimulationFactory(new ConfigLoader(configPath).load());
    }

    /**
     * Creates a factory from an already built configuration.
     */
    public static SimulationFactory create(SimulationConfig config) {
        return new SimulationFactory(config);
    }

    /**
     * Creates a factory from the default configuration (simulation.yaml).
     */
    public static SimulationFactory create() {
        return create("simulation.yaml");
    }

    /**
     * Runs the simulation to completion.
     */
    public SimulationReport run() {
        SimulationReport report = runner.run();
        if (config.getMetrics().isEnabled() && log.isDebugEnabled()) {
            log.debug("Metrics at end of run:\n{}", metricsRegistry.scrape());
        }
        return report;
    }

    /**
     * Asks a running simulation to stop before its next cycle.
     */
    public void stop() {
        runner.stop();
    }

    public Dispatcher getDispatcher() {
        return dispatcher;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public WorkItemGenerator getGenerator() {
        return generator;
    }

    public SimulationConfig getConfig() {
        return config;
    }

    public long getSeed() {
        return seed;
    }

    private void onPoolChanged(PoolEvent event) {
        log.debug("Pool changed: type={}, workerId={}, poolSize={}, discarded={}, cycle={}",
                event.type(), event.worker().id(), event.poolSize(), event.discardedItems(), event.cycle());
    }

    @Override
    public void close() {
        log.info("Shutting down SimulationFactory...");

        try {
            metricsRegistry.close();
        } catch (Exception e) {
            log.warn("Error closing metrics registry", e);
        }

        log.info("SimulationFactory shut down");
    }
}
