/**
 * Placement strategies for distributing queued work across the worker pool.
 *
 * <p>The dispatcher asks its strategy for one worker per placement attempt and
 * moves the head of the admission queue onto it. Strategies only ever return
 * workers that are active and below capacity.
 *
 * <h2>Available Strategies</h2>
 * <ul>
 *   <li>{@link fr.lapetina.loadsim.domain.strategy.RoundRobinStrategy} - Rotates through
 *       the pool from a cursor that persists across cycles</li>
 * </ul>
 *
 * @see fr.lapetina.loadsim.domain.strategy.PlacementStrategy
 */
package fr.lapetina.loadsim.domain.strategy;
