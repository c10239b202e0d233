/**
 * Contract tests shared by every {@link com.ryuqq.drover.core.spi.CheckpointStore} backend.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.drover.testkit.contract;
