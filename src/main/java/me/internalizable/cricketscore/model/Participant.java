package me.internalizable.cricketscore.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * A player on the scoreboard. One document per roll number; the store holds a
 * unique index on {@code rollNumber}.
 */
@Document(collection = Participant.COLLECTION)
public record Participant(
        @Id @JsonIgnore String id,
        String rollNumber,
        String name,
        long score,
        Instant lastPlayed
) {

    public static final String COLLECTION = "students_performance";

    public static final String ROLL_NUMBER = "rollNumber";
    public static final String NAME = "name";
    public static final String SCORE = "score";
    public static final String LAST_PLAYED = "lastPlayed";

    public static Participant of(String rollNumber, String name, long score, Instant lastPlayed) {
        return new Participant(null, rollNumber, name, score, lastPlayed);
    }
}
