/**
 * Task claim registry package.
 *
 * <p>Serializes task selection among concurrent workers so that no task is handed to two
 * workers at once, and holds released tasks back until their outcome has been applied.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.drover.application.claim;
