/**
 * Boundary facade for starting runs.
 *
 * <p>{@link com.ryuqq.drover.application.launcher.RunLauncher} turns a
 * {@link com.ryuqq.drover.application.launcher.RunRequest} into a configured run and reports the
 * outcome together with the process exit code an outer CLI would use.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.drover.application.launcher;
