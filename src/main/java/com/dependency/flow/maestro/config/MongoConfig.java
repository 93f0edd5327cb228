package com.dependency.flow.maestro.config;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.WriteConcern;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.config.AbstractMongoClientConfiguration;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

import java.util.concurrent.TimeUnit;

/**
 * Mongo client for updater state, subscriptions and flow events. Every updater invocation ends in
 * one acknowledged save of its state bundle, so writes wait for a majority.
 */
@Configuration
@EnableMongoRepositories(basePackages = "com.dependency.flow.maestro.repository")
public class MongoConfig extends AbstractMongoClientConfiguration {

    @Value("${spring.data.mongodb.uri}")
    private String uri;

    @Value("${spring.data.mongodb.database}")
    private String database;

    @Value("${maestro.mongodb.max-pool-size:20}")
    private int maxPoolSize;

    @Value("${maestro.mongodb.timeout-ms:5000}")
    private long timeoutMs;

    @Override
    protected String getDatabaseName() {
        return database;
    }

    // reminders.dueAt and target indexes are declared on the documents
    @Override
    protected boolean autoIndexCreation() {
        return true;
    }

    @Override
    public MongoClient mongoClient() {
        return MongoClients.create(clientSettings());
    }

    MongoClientSettings clientSettings() {
        return MongoClientSettings.builder()
                .applyConnectionString(new ConnectionString(uri))
                .writeConcern(WriteConcern.MAJORITY)
                .applyToConnectionPoolSettings(builder ->
                    builder.maxSize(maxPoolSize)
                           .maxWaitTime(timeoutMs, TimeUnit.MILLISECONDS))
                .applyToSocketSettings(builder ->
                    builder.connectTimeout((int) timeoutMs, TimeUnit.MILLISECONDS)
                           .readTimeout((int) timeoutMs, TimeUnit.MILLISECONDS))
                .build();
    }
}
