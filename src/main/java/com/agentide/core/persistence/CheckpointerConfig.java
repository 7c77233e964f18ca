package com.agentide.core.persistence;

import com.agentide.core.config.AgentIdeProperties;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the {@link CheckpointStore} bean.
 * <p>
 * When {@code agentide.checkpoint.jdbc-url} is set, a {@link JdbcCheckpointStore} over a
 * HikariCP pool is created and its table ensured at startup. Otherwise an
 * {@link InMemoryCheckpointStore} is used; suspended sessions are then lost on restart.
 */
@Configuration
public class CheckpointerConfig {

    private static final Logger log = LoggerFactory.getLogger(CheckpointerConfig.class);

    @Bean
    public CheckpointStore checkpointStore(AgentIdeProperties properties) throws Exception {
        var checkpoint = properties.getCheckpoint();
        if (!checkpoint.isJdbcConfigured()) {
            log.warn("No checkpoint database configured; using in-memory checkpoint store "
                    + "(suspended sessions will not survive a restart)");
            return new InMemoryCheckpointStore();
        }

        log.info("Configuring JDBC checkpoint store (PostgreSQL) at {}", checkpoint.getJdbcUrl());
        var hikari = new HikariConfig();
        hikari.setJdbcUrl(checkpoint.getJdbcUrl());
        hikari.setUsername(checkpoint.getUsername());
        hikari.setPassword(checkpoint.getPassword());
        hikari.setMaximumPoolSize(checkpoint.getMaxPoolSize());
        hikari.setPoolName("agentide-checkpoints");

        var store = new JdbcCheckpointStore(new HikariDataSource(hikari));
        store.createTables();
        return store;
    }
}
