package com.appforge.core.persistence;

import com.appforge.core.config.AppforgeProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

/**
 * Spring {@link Configuration} that provides the {@link CheckpointStore} bean.
 * <p>
 * When a {@link DataSource} is available and {@code appforge.checkpoint.store} is
 * {@code jdbc}, a {@link JdbcCheckpointStore} is created that persists checkpoints to
 * the database. Otherwise an {@link InMemoryCheckpointStore} is used as a fallback,
 * suitable for development and testing but not durable across restarts.
 */
@Configuration
public class CheckpointerConfig {

    private static final Logger log = LoggerFactory.getLogger(CheckpointerConfig.class);

    @Bean
    public SnapshotCodec snapshotCodec() {
        return new SnapshotCodec();
    }

    @Bean
    public CheckpointStore checkpointStore(ObjectProvider<DataSource> dataSource,
                                           AppforgeProperties properties,
                                           SnapshotCodec codec) throws Exception {
        DataSource ds = dataSource.getIfAvailable();
        if (ds != null && "jdbc".equalsIgnoreCase(properties.getCheckpoint().getStore())) {
            log.info("Configuring JDBC checkpoint store");
            var store = new JdbcCheckpointStore(ds, codec);
            store.createTables();
            return store;
        }
        log.info("Using in-memory checkpoint store (state will not persist across restarts)");
        return new InMemoryCheckpointStore(codec);
    }
}
