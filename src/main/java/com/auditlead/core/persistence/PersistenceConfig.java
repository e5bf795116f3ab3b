package com.auditlead.core.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

/**
 * Provides the {@link TaskResultSink} bean.
 * <p>
 * With {@code auditlead.persistence.store=jdbc} (set by the {@code postgres} profile) results
 * are written to PostgreSQL through a {@link JdbcTaskResultSink}; otherwise they are kept
 * in an {@link InMemoryTaskResultSink}.
 */
@Configuration
public class PersistenceConfig {

    private static final Logger log = LoggerFactory.getLogger(PersistenceConfig.class);

    @Bean
    @ConditionalOnProperty(name = "auditlead.persistence.store", havingValue = "jdbc")
    public TaskResultSink jdbcTaskResultSink(DataSource dataSource) throws Exception {
        log.info("Configuring JDBC task result sink");
        var sink = new JdbcTaskResultSink(dataSource);
        sink.createTables();
        return sink;
    }

    @Bean
    @ConditionalOnProperty(name = "auditlead.persistence.store", havingValue = "memory", matchIfMissing = true)
    public TaskResultSink inMemoryTaskResultSink() {
        log.info("Task results are kept in memory only (state will not persist across restarts)");
        return new InMemoryTaskResultSink();
    }
}
