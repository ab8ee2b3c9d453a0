package me.internalizable.cricketscore.cache;

import me.internalizable.cricketscore.model.Participant;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

public record ScoreboardSnapshot(
        List<Participant> participants,
        Instant capturedAt
) {
    public static ScoreboardSnapshot of(List<Participant> participants, Instant capturedAt) {
        return new ScoreboardSnapshot(List.copyOf(participants), capturedAt);
    }

    public boolean isFresh(Duration ttl, Instant now) {
        return getAge(now).compareTo(ttl) < 0;
    }

    public Duration getAge(Instant now) {
        return Duration.between(capturedAt, now);
    }
}
