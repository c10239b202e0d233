/**
 * In-memory checkpoint store.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.drover.adapter.inmemory.checkpoint;
