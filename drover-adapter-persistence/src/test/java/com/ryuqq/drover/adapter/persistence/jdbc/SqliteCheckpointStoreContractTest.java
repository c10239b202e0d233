package com.ryuqq.drover.adapter.persistence.jdbc;

import com.ryuqq.drover.core.spi.CheckpointStore;
import com.ryuqq.drover.testkit.contract.AbstractCheckpointStoreContractTest;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

/**
 * Contract tests for {@link SqliteCheckpointStore}.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class SqliteCheckpointStoreContractTest extends AbstractCheckpointStoreContractTest {

    @TempDir
    Path tempDir;

    @Override
    protected CheckpointStore createStore() {
        return new SqliteCheckpointStore(tempDir.resolve("drover.db"));
    }
}
