package me.internalizable.cricketscore.store;

import me.internalizable.cricketscore.model.Participant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoOperations;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public class MongoParticipantStore implements ParticipantStore {

    private static final Logger logger = LoggerFactory.getLogger(MongoParticipantStore.class);

    private final MongoOperations mongoOperations;

    public MongoParticipantStore(MongoOperations mongoOperations) {
        this.mongoOperations = mongoOperations;
    }

    @Override
    public void applyShot(String rollNumber, String name, long shot, Instant playedAt) {
        Query query = Query.query(Criteria.where(Participant.ROLL_NUMBER).is(rollNumber));
        Update update = new Update()
                .inc(Participant.SCORE, shot)
                .set(Participant.LAST_PLAYED, playedAt)
                .set(Participant.NAME, name)
                .setOnInsert(Participant.ROLL_NUMBER, rollNumber);

        mongoOperations.upsert(query, update, Participant.class);
        logger.debug("Applied shot {} for roll number {}", shot, rollNumber);
    }

    @Override
    public List<Participant> findAllRanked() {
        Query query = new Query().with(Sort.by(Sort.Direction.DESC, Participant.SCORE));
        return mongoOperations.find(query, Participant.class);
    }

    /**
     * Create the unique roll number index if it is missing.
     */
    public void ensureIndexes() {
        String indexName = mongoOperations.indexOps(Participant.class)
                .ensureIndex(new Index().on(Participant.ROLL_NUMBER, Sort.Direction.ASC).unique());
        logger.info("Index {} ready on {}", indexName, Participant.COLLECTION);
    }
}
