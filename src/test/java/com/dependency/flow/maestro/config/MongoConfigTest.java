package com.dependency.flow.maestro.config;

import com.mongodb.MongoClientSettings;
import com.mongodb.WriteConcern;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class MongoConfigTest {

    @Test
    void clientSettings_followConfiguredPoolAndTimeouts() {
        MongoConfig config = new MongoConfig();
        ReflectionTestUtils.setField(config, "uri", "mongodb://localhost:27017");
        ReflectionTestUtils.setField(config, "database", "maestro");
        ReflectionTestUtils.setField(config, "maxPoolSize", 8);
        ReflectionTestUtils.setField(config, "timeoutMs", 2000L);

        MongoClientSettings settings = config.clientSettings();

        assertThat(settings.getWriteConcern()).isEqualTo(WriteConcern.MAJORITY);
        assertThat(settings.getConnectionPoolSettings().getMaxSize()).isEqualTo(8);
        assertThat(settings.getConnectionPoolSettings().getMaxWaitTime(TimeUnit.MILLISECONDS)).isEqualTo(2000);
        assertThat(settings.getSocketSettings().getReadTimeout(TimeUnit.MILLISECONDS)).isEqualTo(2000);
        assertThat(config.getDatabaseName()).isEqualTo("maestro");
    }
}
