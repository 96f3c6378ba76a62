package com.appforge.core.persistence;

import com.appforge.core.config.AppforgeProperties;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.env.YamlPropertySourceLoader;
import org.springframework.core.env.PropertySource;
import org.springframework.core.io.ClassPathResource;

import javax.sql.DataSource;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class CheckpointerConfigTest {

    private final CheckpointerConfig config = new CheckpointerConfig();

    @SuppressWarnings("unchecked")
    private static ObjectProvider<DataSource> dataSource(DataSource ds) {
        ObjectProvider<DataSource> provider = mock(ObjectProvider.class);
        when(provider.getIfAvailable()).thenReturn(ds);
        return provider;
    }

    @Test
    @DisplayName("the packaged configuration asks for the jdbc store")
    void defaultsToJdbc() throws Exception {
        List<PropertySource<?>> sources = new YamlPropertySourceLoader()
                .load("application", new ClassPathResource("application.yml"));

        assertEquals("jdbc", String.valueOf(sources.get(0).getProperty("appforge.checkpoint.store")));
        assertEquals("jdbc", new AppforgeProperties.Checkpoint().getStore());
    }

    @Test
    @DisplayName("the jdbc store is used when a DataSource exists")
    void jdbcWithDataSource() throws Exception {
        JdbcDataSource ds = new JdbcDataSource();
        ds.setURL("jdbc:h2:mem:config-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");

        CheckpointStore store = config.checkpointStore(dataSource(ds), new AppforgeProperties(), new SnapshotCodec());

        assertInstanceOf(JdbcCheckpointStore.class, store);
        assertTrue(store.listGenerationIds().isEmpty());
    }

    @Test
    @DisplayName("without a DataSource the jdbc setting falls back to memory")
    void fallsBackToMemory() throws Exception {
        CheckpointStore store = config.checkpointStore(dataSource(null), new AppforgeProperties(), new SnapshotCodec());

        assertInstanceOf(InMemoryCheckpointStore.class, store);
    }
}
