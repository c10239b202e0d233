/**
 * Canonical run state package.
 *
 * <p>{@link com.ryuqq.drover.application.state.RunState} holds the authoritative task map of a
 * single run together with its counters and the auto-unblock idempotency guard. Only the
 * Orchestrator writes it; every other component reads it under a shared lock.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.drover.application.state;
