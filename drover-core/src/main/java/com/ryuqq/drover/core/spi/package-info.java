/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the ports the orchestration core consumes. Adapter modules
 * provide concrete implementations.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.drover.core.spi.WorkSource} - Enumerates, creates and closes tracked work items</li>
 *   <li>{@link com.ryuqq.drover.core.spi.TaskRunner} - Performs a single task</li>
 *   <li>{@link com.ryuqq.drover.core.spi.CheckpointStore} - Records run start and completion</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter layers (drover-adapter-inmemory, drover-adapter-persistence) provide the
 * Work Source and Checkpoint Store backends; the Task Runner is supplied by the embedding
 * application.</p>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Hexagonal Architecture:</strong> Core defines interfaces, adapters provide implementations</li>
 *   <li><strong>Dependency Inversion:</strong> Core does not depend on infrastructure</li>
 *   <li><strong>Pluggability:</strong> Backends are interchangeable without touching the core</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.drover.core.spi;
