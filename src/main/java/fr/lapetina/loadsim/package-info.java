/**
 * Load Balancer Simulator - discrete time-stepped model of an autoscaling load balancer.
 *
 * <p>Synthetic requests enter a bounded admission queue, are spread round-robin across a pool
 * of capacity-limited workers, and count down their processing time one cycle at a time.
 * The pool grows under pressure and shrinks, slowly, when idle.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.loadsim.SimulationFactory} - Main entry point for creating
 *       a fully-configured simulation from YAML configuration</li>
 *   <li>{@link fr.lapetina.loadsim.LoadSimulatorApplication} - Command-line runner</li>
 *   <li>{@link fr.lapetina.loadsim.dispatcher.Dispatcher} - The load balancer itself</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * Dispatcher dispatcher = Dispatcher.builder()
 *         .initialWorkers(3)
 *         .minWorkers(1)
 *         .maxWorkers(6)
 *         .build();
 *
 * dispatcher.submit(WorkItem.builder().id(1).originAddress("10.0.0.1").duration(4).build());
 * int completed = dispatcher.advanceOneCycle();
 * }</pre>
 *
 * @see fr.lapetina.loadsim.SimulationFactory
 * @see fr.lapetina.loadsim.dispatcher.Dispatcher
 */
package fr.lapetina.loadsim;
