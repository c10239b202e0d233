/**
 * Run orchestration package.
 *
 * <p>{@link com.ryuqq.drover.application.orchestrator.Orchestrator} owns the event loop of a
 * run: it applies worker outcomes to the canonical state, unblocks dependents, injects
 * remediation tasks for blockers and decides when the run is over.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.drover.application.orchestrator;
