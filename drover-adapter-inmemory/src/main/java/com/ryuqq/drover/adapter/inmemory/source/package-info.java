/**
 * In-memory work source backed by a list of work items.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.drover.adapter.inmemory.source;
