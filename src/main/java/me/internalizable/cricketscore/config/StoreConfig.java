package me.internalizable.cricketscore.config;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import me.internalizable.cricketscore.exception.StartupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.MongoDatabaseFactory;
import org.springframework.data.mongodb.core.SimpleMongoClientDatabaseFactory;

import java.util.concurrent.TimeUnit;

@Configuration
public class StoreConfig {

    private static final Logger logger = LoggerFactory.getLogger(StoreConfig.class);

    @Bean(destroyMethod = "close")
    public MongoClient mongoClient(
            @Value("${store.uri:}") String uri,
            @Value("${store.timeout-seconds:5}") int timeoutSeconds) {

        if (uri == null || uri.isBlank()) {
            throw new StartupException("MONGODB_URI environment variable is required");
        }

        ConnectionString connectionString;
        try {
            connectionString = new ConnectionString(uri);
        } catch (IllegalArgumentException e) {
            throw new StartupException("MONGODB_URI is not a valid connection string", e);
        }

        logger.info("Connecting to MongoDB hosts {} (timeout {}s)", connectionString.getHosts(), timeoutSeconds);
        return MongoClients.create(clientSettings(connectionString, timeoutSeconds));
    }

    @Bean
    public MongoDatabaseFactory mongoDatabaseFactory(
            MongoClient mongoClient,
            @Value("${store.database:cricket_db}") String database) {
        return new SimpleMongoClientDatabaseFactory(mongoClient, database);
    }

    /**
     * Every wait a store call can hit (server selection, pool checkout, connect, read)
     * is capped at the same timeout, and nothing is retried.
     */
    static MongoClientSettings clientSettings(ConnectionString connectionString, int timeoutSeconds) {
        return MongoClientSettings.builder()
                .applyConnectionString(connectionString)
                .retryWrites(false)
                .retryReads(false)
                .applyToClusterSettings(builder -> builder
                        .serverSelectionTimeout(timeoutSeconds, TimeUnit.SECONDS))
                .applyToConnectionPoolSettings(builder -> builder
                        .maxWaitTime(timeoutSeconds, TimeUnit.SECONDS))
                .applyToSocketSettings(builder -> builder
                        .connectTimeout(timeoutSeconds, TimeUnit.SECONDS)
                        .readTimeout(timeoutSeconds, TimeUnit.SECONDS))
                .build();
    }
}
