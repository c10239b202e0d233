/**
 * Task lifecycle state machine package.
 *
 * <p>This package implements the transition rules the Orchestrator applies when it
 * consumes worker outcome events. The Orchestrator is the only writer of task status.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.drover.core.statemachine.TaskStatus} - Task lifecycle states (enum) and Work Source status mapping</li>
 *   <li>{@link com.ryuqq.drover.core.statemachine.TaskTransition} - Transition validation and execution</li>
 * </ul>
 *
 * <h2>State Transition Rules</h2>
 * <pre>
 * READY → READY      (retriable failure, retry budget left)
 * READY → COMPLETED  (runner succeeded)
 * READY → FAILED     (non-retriable failure or budget exhausted)
 * READY → BLOCKED    (runner reported "blocked by ...")
 * BLOCKED → READY    (every blocker completed)
 *
 * Forbidden:
 * - COMPLETED → * (terminal state)
 * - FAILED → * (terminal state)
 * - * → IN_PROGRESS (ingestion-only state)
 * </pre>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.drover.core.statemachine;
