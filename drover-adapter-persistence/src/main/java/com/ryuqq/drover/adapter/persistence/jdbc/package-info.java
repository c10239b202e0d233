/**
 * SQLite and PostgreSQL run tables over a shared JDBC template.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.drover.adapter.persistence.jdbc;
