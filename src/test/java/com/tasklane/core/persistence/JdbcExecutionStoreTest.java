package com.tasklane.core.persistence;

import com.tasklane.core.model.LogEntryKind;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the store contract against an in-memory H2 database in PostgreSQL mode.
 */
class JdbcExecutionStoreTest extends ExecutionStoreContract {

    private JdbcDataSource dataSource;

    @Override
    protected ExecutionStore createStore() throws Exception {
        dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:" + UUID.randomUUID() + ";MODE=PostgreSQL;DB_CLOSE_DELAY=-1");
        var jdbc = new JdbcExecutionStore(dataSource);
        jdbc.createTables();
        return jdbc;
    }

    @Test
    @DisplayName("log sequence continues after a restart")
    void sequenceSurvivesRestart() throws Exception {
        var before = store.appendLog("r1", "a", "w-1", LogEntryKind.SPAWNED, "spawned", T0);

        var reopened = new JdbcExecutionStore(dataSource);
        reopened.createTables();
        var after = reopened.appendLog("r1", "a", "w-2", LogEntryKind.RESUMED, "resumed", T0);

        assertTrue(after.sequence() > before.sequence());
        assertEquals(2, reopened.logForRun("r1").size());
    }

    @Test
    @DisplayName("createTables is idempotent")
    void createTablesTwice() {
        assertDoesNotThrow(() -> ((JdbcExecutionStore) store).createTables());
    }
}
