/**
 * Domain values shared by every stage of the simulated load balancer.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.loadsim.domain.model.WorkItem} - A request whose remaining duration
 *       counts down once per cycle</li>
 *   <li>{@link fr.lapetina.loadsim.domain.model.RejectionReason} - Why admission refused an item</li>
 * </ul>
 *
 * <h2>Ownership</h2>
 * <p>A {@code WorkItem} is moved, never shared: the admission queue owns it until dispatch,
 * then exactly one worker owns it until it completes or is discarded by a pool shrink.
 *
 * @see fr.lapetina.loadsim.domain.queue.AdmissionQueue
 * @see fr.lapetina.loadsim.domain.worker.Worker
 */
package fr.lapetina.loadsim.domain.model;
