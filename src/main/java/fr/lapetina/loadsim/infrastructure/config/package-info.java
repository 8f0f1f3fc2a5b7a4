/**
 * Configuration loading and validation.
 *
 * <p>This package parses the YAML configuration with SnakeYAML into a JavaBean tree and
 * rejects settings no dispatcher could be built from, before anything is constructed.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.loadsim.infrastructure.config.SimulationConfig} - Configuration model</li>
 *   <li>{@link fr.lapetina.loadsim.infrastructure.config.ConfigLoader} - YAML loading, normalization
 *       and validation</li>
 * </ul>
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code pool} - Initial, minimum and maximum worker counts, worker capacity, scaling thresholds</li>
 *   <li>{@code queue} - Admission queue capacity and blocked origins</li>
 *   <li>{@code simulation} - Run length, random seed and synthetic load shape</li>
 *   <li>{@code reporting} - Statistics and status intervals</li>
 *   <li>{@code metrics} - Prometheus metrics configuration</li>
 * </ul>
 *
 * @see fr.lapetina.loadsim.infrastructure.config.SimulationConfig
 * @see fr.lapetina.loadsim.infrastructure.config.ConfigLoader
 */
package fr.lapetina.loadsim.infrastructure.config;
