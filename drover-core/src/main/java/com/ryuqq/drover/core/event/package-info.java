/**
 * Worker event package.
 *
 * <p>Events are the only way worker loops and the stall monitor talk to the
 * Orchestrator. They travel through a bounded FIFO channel and are applied by a
 * single consumer, so canonical run state has exactly one writer.</p>
 *
 * <h2>Event Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.drover.core.event.TaskCompleted} - Runner succeeded</li>
 *   <li>{@link com.ryuqq.drover.core.event.TaskFailed} - Runner failed (retriable or permanent)</li>
 *   <li>{@link com.ryuqq.drover.core.event.TaskBlocked} - Runner reported blockers</li>
 *   <li>{@link com.ryuqq.drover.core.event.Stalled} - No completion observed for longer than the stall threshold</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.drover.core.event;
