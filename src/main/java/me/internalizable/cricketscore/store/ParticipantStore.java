package me.internalizable.cricketscore.store;

import me.internalizable.cricketscore.model.Participant;

import java.time.Instant;
import java.util.List;

/**
 * Persistent participant records. Implementations report failures as Spring
 * {@link org.springframework.dao.DataAccessException}s.
 */
public interface ParticipantStore {

    /**
     * Atomically add a shot to a participant's score, creating the record if it does not exist.
     * Name and last-played time are overwritten on every call.
     * @param rollNumber Unique participant key
     * @param name Display name to store
     * @param shot Signed score increment
     * @param playedAt Time of the shot
     */
    void applyShot(String rollNumber, String name, long shot, Instant playedAt);

    /**
     * @return All participants ordered by score, highest first. Order among equal scores is unspecified.
     */
    List<Participant> findAllRanked();
}
