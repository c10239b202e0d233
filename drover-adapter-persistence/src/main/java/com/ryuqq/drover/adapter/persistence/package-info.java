/**
 * JDBC checkpoint store backends and connection-string based backend selection.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.drover.adapter.persistence;
