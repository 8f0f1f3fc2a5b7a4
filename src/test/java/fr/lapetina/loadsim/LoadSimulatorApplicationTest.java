package fr.lapetina.loadsim;

import fr.lapetina.loadsim.simulation.SimulationReport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class LoadSimulatorApplicationTest {

    @Test
    @DisplayName("should run and shut down cleanly")
    void shouldRunAndShutDown() {
        try (LoadSimulatorApplication app = new LoadSimulatorApplication("test-config.yaml")) {
            SimulationReport report = app.run();

            assertThat(report.cyclesExecuted()).isEqualTo(300);
            assertThat(app.getFactory().getDispatcher().getCycleCount()).isEqualTo(300);
        }
    }

    @Test
    @DisplayName("should end early when shutdown is requested")
    void shouldHonourShutdownRequest() {
        try (LoadSimulatorApplication app = new LoadSimulatorApplication("test-config.yaml")) {
            app.requestShutdown();

            assertThat(app.run().cyclesExecuted()).isZero();
        }
    }

    @Test
    @DisplayName("should let a shutdown request wait for the run to report and close")
    void shouldWaitForRunToCloseOnShutdown() throws Exception {
        LoadSimulatorApplication app = new LoadSimulatorApplication("slow-config.yaml");
        CompletableFuture<SimulationReport> running = CompletableFuture.supplyAsync(() -> {
            try (app) {
                return app.run();
            }
        });

        Thread.sleep(100);
        assertThat(app.awaitShutdown(10, TimeUnit.MILLISECONDS)).isFalse();

        app.requestShutdown();

        assertThat(app.awaitShutdown(10, TimeUnit.SECONDS)).isTrue();
        SimulationReport report = running.get(10, TimeUnit.SECONDS);
        assertThat(report.cyclesExecuted()).isLessThan(50000);
    }

    @Test
    @DisplayName("should tolerate being closed twice")
    void shouldCloseOnce() throws Exception {
        LoadSimulatorApplication app = new LoadSimulatorApplication("test-config.yaml");
        app.close();
        app.close();

        assertThat(app.awaitShutdown(0, TimeUnit.SECONDS)).isTrue();
    }
}
