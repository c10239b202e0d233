/**
 * Runtime plumbing between the Orchestrator and its workers.
 *
 * <p>Defines the bounded {@link com.ryuqq.drover.application.runtime.EventChannel} that carries
 * worker outcomes, and the {@link com.ryuqq.drover.application.runtime.WorkerPool} contract that
 * adapters implement.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.drover.application.runtime;
