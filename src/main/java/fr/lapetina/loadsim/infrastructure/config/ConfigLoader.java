package fr.lapetina.loadsim.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;

/**
 * Configuration loader for the simulator.
 *
 * Supports:
 * - Loading from the file system, falling back to the classpath
 * - Loading from an arbitrary stream
 * - Range normalization of driver settings and validation of pool bounds
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    static final int MIN_INITIAL_WORKERS = 1;
    static final int MAX_INITIAL_WORKERS = 50;
    static final int DEFAULT_INITIAL_WORKERS = 5;
    static final int MIN_CYCLES = 100;
    static final int MAX_CYCLES = 50_000;
    static final int DEFAULT_CYCLES = 10_000;

    private final Path configPath;
    private final Yaml yaml;

    public ConfigLoader(String configPath) {
        this.configPath = Paths.get(configPath);
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new Constructor(SimulationConfig.class, loaderOptions));
    }

    /**
     * Loads configuration from file or classpath.
     *
     * @return The loaded, normalized and validated configuration
     * @throws ConfigurationException if loading or validation fails
     */
    public SimulationConfig load() {
        return prepare(loadFromPath());
    }

    private SimulationConfig loadFromPath() {
        // Try file system first
        if (Files.exists(configPath)) {
            return loadFromFile(configPath);
        }

        // Try classpath
        String classpathResource = configPath.toString();
        if (classpathResource.startsWith("/")) {
            classpathResource = classpathResource.substring(1);
        }

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.info("Loading configuration from classpath: {}", classpathResource);
                return parse(is, classpathResource);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + classpathResource, e);
        }

        throw new ConfigurationException("Configuration file not found: " + configPath);
    }

    private SimulationConfig loadFromFile(Path path) {
        log.info("Loading configuration from file: {}", path);
        try (InputStream is = Files.newInputStream(path)) {
            return parse(is, path.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    /**
     * Loads configuration from an input stream.
     */
    public SimulationConfig loadFromStream(InputStream inputStream) {
        return prepare(parse(inputStream, "stream"));
    }

    private SimulationConfig parse(InputStream inputStream, String source) {
        try {
            SimulationConfig config = yaml.load(inputStream);
            // An empty document yields null
            return config != null ? config : createDefault();
        } catch (YAMLException e) {
            throw new ConfigurationException("Malformed configuration in " + source, e);
        }
    }

    /**
     * Normalizes and validates a configuration built in code or parsed from YAML.
     *
     * @return the same instance, ready for use
     * @throws ConfigurationException if the configuration is invalid
     */
    public static SimulationConfig prepare(SimulationConfig config) {
        normalize(config);
        validate(config);
        return config;
    }

    /**
     * Replaces out-of-range driver settings with their defaults.
     */
    static void normalize(SimulationConfig config) {
        // A section key with no body ("pool:") is bound as null
        if (config.getPool() == null) {
            log.warn("Empty pool section, using defaults");
            config.setPool(new SimulationConfig.PoolConfig());
        }
        if (config.getQueue() == null) {
            log.warn("Empty queue section, using defaults");
            config.setQueue(new SimulationConfig.QueueConfig());
        }
        if (config.getSimulation() == null) {
            log.warn("Empty simulation section, using defaults");
            config.setSimulation(new SimulationConfig.RunConfig());
        }
        if (config.getReporting() == null) {
            log.warn("Empty reporting section, using defaults");
            config.setReporting(new SimulationConfig.ReportingConfig());
        }
        if (config.getMetrics() == null) {
            log.warn("Empty metrics section, using defaults");
            config.setMetrics(new SimulationConfig.MetricsConfig());
        }

        SimulationConfig.PoolConfig pool = config.getPool();
        if (pool.getInitialWorkers() < MIN_INITIAL_WORKERS || pool.getInitialWorkers() > MAX_INITIAL_WORKERS) {
            log.warn("Invalid initial worker count {} (expected {}-{}), using default {}",
                    pool.getInitialWorkers(), MIN_INITIAL_WORKERS, MAX_INITIAL_WORKERS, DEFAULT_INITIAL_WORKERS);
            pool.setInitialWorkers(DEFAULT_INITIAL_WORKERS);
        }

        SimulationConfig.RunConfig run = config.getSimulation();
        if (run.getCycles() < MIN_CYCLES || run.getCycles() > MAX_CYCLES) {
            log.warn("Invalid simulation length {} cycles (expected {}-{}), using default {}",
                    run.getCycles(), MIN_CYCLES, MAX_CYCLES, DEFAULT_CYCLES);
            run.setCycles(DEFAULT_CYCLES);
        }

        if (config.getQueue().getBlockedOrigins() == null) {
            config.getQueue().setBlockedOrigins(new ArrayList<>());
        }
    }

    /**
     * Rejects configurations no dispatcher can be built from.
     *
     * @throws ConfigurationException on the first violation found
     */
    static void validate(SimulationConfig config) {
        SimulationConfig.PoolConfig pool = config.getPool();
        int maxWorkers = pool.getEffectiveMaxWorkers();

        require(pool.getMinWorkers() >= 1,
                "pool.minWorkers must be at least 1: " + pool.getMinWorkers());
        require(pool.getMinWorkers() <= maxWorkers,
                "pool.minWorkers (" + pool.getMinWorkers() + ") exceeds pool.maxWorkers (" + maxWorkers + ")");
        require(pool.getInitialWorkers() >= pool.getMinWorkers() && pool.getInitialWorkers() <= maxWorkers,
                "pool.initialWorkers (" + pool.getInitialWorkers() + ") outside ["
                        + pool.getMinWorkers() + ", " + maxWorkers + "]");
        require(pool.getWorkerCapacity() > 0,
                "pool.workerCapacity must be positive: " + pool.getWorkerCapacity());
        require(pool.getUtilizationThreshold() >= 0.0 && pool.getUtilizationThreshold() <= 1.0,
                "pool.utilizationThreshold must be within [0, 1]: " + pool.getUtilizationThreshold());
        require(pool.getScaleDownFactor() >= 0.0 && pool.getScaleDownFactor() <= 1.0,
                "pool.scaleDownFactor must be within [0, 1]: " + pool.getScaleDownFactor());
        require(pool.getQueueBacklogTrigger() >= 0 && pool.getScaleDownSlack() >= 0,
                "pool.queueBacklogTrigger and pool.scaleDownSlack must not be negative");

        require(config.getQueue().getCapacity() > 0,
                "queue.capacity must be positive: " + config.getQueue().getCapacity());

        SimulationConfig.RunConfig run = config.getSimulation();
        require(run.getMinDuration() > 0 && run.getMinDuration() <= run.getMaxDuration(),
                "simulation.minDuration/maxDuration must satisfy 0 < min <= max: "
                        + run.getMinDuration() + ".." + run.getMaxDuration());
        require(run.getArrivalProbability() >= 0.0 && run.getArrivalProbability() <= 1.0,
                "simulation.arrivalProbability must be within [0, 1]: " + run.getArrivalProbability());
        require(run.getArrivalCutoff() >= 0.0 && run.getArrivalCutoff() <= 1.0,
                "simulation.arrivalCutoff must be within [0, 1]: " + run.getArrivalCutoff());
        require(run.getBacklogPerWorker() >= 0,
                "simulation.backlogPerWorker must not be negative: " + run.getBacklogPerWorker());
        require(run.getCycleDelayMs() >= 0,
                "simulation.cycleDelayMs must not be negative: " + run.getCycleDelayMs());

        SimulationConfig.ReportingConfig reporting = config.getReporting();
        require(reporting.getStatsInterval() > 0 && reporting.getStatusInterval() > 0,
                "reporting intervals must be positive");
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new ConfigurationException("Invalid configuration: " + message);
        }
    }

    /**
     * Creates a default configuration.
     */
    public static SimulationConfig createDefault() {
        return new SimulationConfig();
    }

    /**
     * Exception for configuration errors.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
