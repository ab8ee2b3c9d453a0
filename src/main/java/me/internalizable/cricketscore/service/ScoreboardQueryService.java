package me.internalizable.cricketscore.service;

import me.internalizable.cricketscore.cache.ScoreboardCache;
import me.internalizable.cricketscore.exception.StoreException;
import me.internalizable.cricketscore.model.Participant;
import me.internalizable.cricketscore.store.ParticipantStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Serves the ranked scoreboard, reading through {@link ScoreboardCache}.
 * Only a successful store read refills the cache.
 */
@Service
public class ScoreboardQueryService {

    private static final Logger logger = LoggerFactory.getLogger(ScoreboardQueryService.class);

    static final String STORE_ERROR = "Error fetching scoreboard";

    private final ScoreboardCache scoreboardCache;
    private final ParticipantStore participantStore;

    public ScoreboardQueryService(ScoreboardCache scoreboardCache, ParticipantStore participantStore) {
        this.scoreboardCache = scoreboardCache;
        this.participantStore = participantStore;
    }

    public List<Participant> getScoreboard() {
        Optional<List<Participant>> cached = scoreboardCache.get();
        if (cached.isPresent()) {
            return cached.get();
        }

        List<Participant> participants;
        try {
            participants = participantStore.findAllRanked();
        } catch (DataAccessException e) {
            throw new StoreException(STORE_ERROR, e);
        }

        if (participants == null) {
            participants = List.of();
        }
        scoreboardCache.put(participants);
        logger.debug("Scoreboard reloaded from store: {} participants", participants.size());
        return List.copyOf(participants);
    }
}
