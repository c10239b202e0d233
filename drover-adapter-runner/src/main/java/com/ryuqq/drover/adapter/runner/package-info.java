/**
 * Thread-pool worker adapter.
 *
 * <p>Runs a fixed number of worker loops that claim tasks, invoke the
 * {@link com.ryuqq.drover.core.spi.TaskRunner} under a deadline, and report exactly one
 * classified outcome per attempt.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.drover.adapter.runner;
