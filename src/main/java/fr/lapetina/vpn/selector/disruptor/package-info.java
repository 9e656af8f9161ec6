/**
 * LMAX Disruptor-based fan-out for evaluating candidate servers.
 *
 * <p>Each evaluation run builds a short-lived Disruptor whose ring buffer is drained by a
 * pool of competing {@link com.lmax.disruptor.WorkHandler}s. Every candidate is handled by
 * exactly one worker, which takes it through the whole chain:
 *
 * <pre>
 * Saturation check → Probe → Score → Name → Offer (per category × protocol)
 * </pre>
 *
 * <p>The pool width is bounded by the process's file-descriptor budget, and publishing
 * blocks while the ring is full, so a large candidate list never opens more sockets than
 * the budget allows.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.vpn.selector.disruptor.ServerSelectionEngine} - Runs one evaluation</li>
 *   <li>{@link fr.lapetina.vpn.selector.disruptor.handlers.CandidateEvaluationHandler} - Worker logic</li>
 *   <li>{@link fr.lapetina.vpn.selector.disruptor.exception.EvaluationInterruptedException} - Caller interrupted mid-run</li>
 * </ul>
 *
 * @see com.lmax.disruptor.dsl.Disruptor
 */
package fr.lapetina.vpn.selector.disruptor;
