package fr.lapetina.loadsim;

import fr.lapetina.loadsim.infrastructure.config.ConfigLoader;
import fr.lapetina.loadsim.infrastructure.config.SimulationConfig;
import fr.lapetina.loadsim.simulation.SimulationReport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end runs of a fully wired simulation.
 * Configuration is externalized to test-config.yaml.
 */
class SimulationFactoryTest {

    private SimulationFactory factory;

    @BeforeEach
    void setUp() {
        factory = SimulationFactory.create("test-config.yaml");
    }

    @AfterEach
    void tearDown() {
        if (factory != null) {
            factory.close();
        }
    }

    @Test
    @DisplayName("should wire the dispatcher from configuration")
    void shouldWireDispatcher() {
        assertThat(factory.getSeed()).isEqualTo(42L);
        assertThat(factory.getDispatcher().getPoolSize()).isEqualTo(3);
        assertThat(factory.getDispatcher().getMaxWorkers()).isEqualTo(6);
        assertThat(factory.getDispatcher().getWorkerCapacity()).isEqualTo(4);
        assertThat(factory.getDispatcher().isBlocked("10.0.0.66")).isTrue();
    }

    @Test
    @DisplayName("should run the configured simulation to completion")
    void shouldRunSimulation() {
        SimulationReport report = factory.run();

        assertThat(report.cyclesExecuted()).isEqualTo(300);
        assertThat(report.totalCompleted()).isPositive();
        assertThat(report.poolSize()).isBetween(1, 6);
        assertThat(report.totalAdmitted()).isEqualTo(
                report.queueSize() + report.inFlight() + report.totalCompleted() + report.totalDiscarded());
        assertThat(factory.getMetricsRegistry().scrape()).contains("test_sim_pool_size");
    }

    @Test
    @DisplayName("should reproduce a run from the same seed")
    void shouldBeReproducible() {
        SimulationReport first = factory.run();

        try (SimulationFactory second = SimulationFactory.create("test-config.yaml")) {
            SimulationReport again = second.run();

            assertThat(again.totalAdmitted()).isEqualTo(first.totalAdmitted());
            assertThat(again.totalCompleted()).isEqualTo(first.totalCompleted());
            assertThat(again.totalDiscarded()).isEqualTo(first.totalDiscarded());
            assertThat(again.workerStatuses()).isEqualTo(first.workerStatuses());
        }
    }

    @Test
    @DisplayName("should accept a configuration built in code")
    void shouldCreateFromConfig() {
        SimulationConfig config = ConfigLoader.createDefault();
        config.getPool().setInitialWorkers(2);
        config.getSimulation().setCycles(100);
        config.getSimulation().setSeed(7L);
        config.getMetrics().setEnabled(false);

        try (SimulationFactory custom = SimulationFactory.create(config)) {
            assertThat(custom.getDispatcher().getPoolSize()).isEqualTo(2);
            assertThat(custom.getMetricsRegistry().scrape()).doesNotContain("lb_sim_pool_size");
        }
    }

    @Test
    @DisplayName("should refuse an invalid configuration")
    void shouldRefuseInvalidConfig() {
        SimulationConfig config = ConfigLoader.createDefault();
        config.getPool().setMinWorkers(8);
        config.getPool().setMaxWorkers(6);

        assertThatThrownBy(() -> SimulationFactory.create(config))
                .isInstanceOf(ConfigLoader.ConfigurationException.class);
    }
}
