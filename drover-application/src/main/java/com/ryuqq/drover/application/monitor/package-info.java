/**
 * Stall detection package.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.drover.application.monitor;
