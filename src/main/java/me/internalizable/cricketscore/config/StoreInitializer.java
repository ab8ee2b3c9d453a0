package me.internalizable.cricketscore.config;

import jakarta.annotation.PostConstruct;
import me.internalizable.cricketscore.exception.StartupException;
import me.internalizable.cricketscore.store.MongoParticipantStore;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.data.mongodb.core.MongoOperations;
import org.springframework.stereotype.Component;

/**
 * Verifies the store is reachable before the application accepts traffic,
 * then makes sure the roll number index exists.
 */
@Component
public class StoreInitializer {

    private static final Logger logger = LoggerFactory.getLogger(StoreInitializer.class);

    private final MongoOperations mongoOperations;
    private final MongoParticipantStore participantStore;
    private final String database;

    public StoreInitializer(
            MongoOperations mongoOperations,
            MongoParticipantStore participantStore,
            @Value("${store.database:cricket_db}") String database) {
        this.mongoOperations = mongoOperations;
        this.participantStore = participantStore;
        this.database = database;
    }

    @PostConstruct
    public void init() {
        try {
            Document result = mongoOperations.executeCommand("{ ping: 1 }");
            logger.info("Connected to MongoDB database '{}' (ok={})", database, result.get("ok"));
        } catch (RuntimeException e) {
            throw new StartupException("Could not reach MongoDB database '" + database + "'", e);
        }

        try {
            participantStore.ensureIndexes();
        } catch (DataAccessException e) {
            logger.warn("Could not create roll number index, continuing with existing indexes", e);
        }
    }
}
