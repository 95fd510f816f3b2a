package com.tasklane.core.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.sql.SQLException;

/**
 * Provides the {@link ExecutionStore} bean.
 * <p>
 * When a {@link DataSource} is available (the {@code postgres} profile), a
 * {@link JdbcExecutionStore} is created and its tables ensured. Otherwise an
 * {@link InMemoryExecutionStore} is used; state is lost on restart.
 */
@Configuration
public class StoreConfig {

    private static final Logger log = LoggerFactory.getLogger(StoreConfig.class);

    @Bean
    public ExecutionStore executionStore(ObjectProvider<DataSource> dataSource) throws SQLException {
        DataSource ds = dataSource.getIfAvailable();
        if (ds != null) {
            log.info("Configuring JDBC execution store");
            var store = new JdbcExecutionStore(ds);
            store.createTables();
            return store;
        }
        log.info("No DataSource available; using in-memory execution store (state will not persist across restarts)");
        return new InMemoryExecutionStore();
    }
}
