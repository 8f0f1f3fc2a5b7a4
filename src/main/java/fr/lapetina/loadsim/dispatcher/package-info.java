/**
 * The dispatcher: pool ownership, per-cycle orchestration, round-robin placement and autoscaling.
 *
 * <h2>Cycle Order</h2>
 * <ol>
 *   <li>Advance - every active worker consumes one cycle of each in-flight item</li>
 *   <li>Distribute - at most {@code 2 x poolSize} queued items are placed, halting as soon
 *       as no worker can accept</li>
 *   <li>Scale - grow by one worker under pressure, then shrink by one when the pool idles
 *       with slack above its minimum</li>
 * </ol>
 *
 * <h2>Thread Safety</h2>
 * <p>{@code Dispatcher} serializes every public call on its own monitor. The queue and the
 * workers it owns are not thread-safe and must only be reached through it.
 *
 * @see fr.lapetina.loadsim.dispatcher.Dispatcher
 * @see fr.lapetina.loadsim.dispatcher.PoolEvent
 */
package fr.lapetina.loadsim.dispatcher;
