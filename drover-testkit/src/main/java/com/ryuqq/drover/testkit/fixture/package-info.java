/**
 * Task fixtures and a scripted task runner for tests of the orchestration engine.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.drover.testkit.fixture;
