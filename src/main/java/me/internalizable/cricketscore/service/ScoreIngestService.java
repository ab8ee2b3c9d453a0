package me.internalizable.cricketscore.service;

import me.internalizable.cricketscore.dto.HitRequest;
import me.internalizable.cricketscore.exception.InvalidSubmissionException;
import me.internalizable.cricketscore.exception.RateLimitExceededException;
import me.internalizable.cricketscore.exception.StoreException;
import me.internalizable.cricketscore.ratelimit.RateLimiter;
import me.internalizable.cricketscore.store.ParticipantStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.regex.Pattern;

/**
 * Records shots against a participant's cumulative score.
 *
 * Checks run in order: roll number format, name presence, rate limit. The rate
 * limit is recorded as soon as a submission is accepted and before the store
 * write, so a failed write still counts toward the cooldown.
 */
@Service
public class ScoreIngestService {

    private static final Logger logger = LoggerFactory.getLogger(ScoreIngestService.class);

    static final Pattern ROLL_NUMBER_PATTERN = Pattern.compile("^\\d{10}$");

    static final String INVALID_ROLL_NUMBER = "Roll number must be exactly 10 digits";
    static final String NAME_REQUIRED = "Name is required";
    static final String TOO_MANY_REQUESTS = "Too many requests. Please wait a few seconds.";
    static final String STORE_ERROR = "Error updating score";

    private final RateLimiter rateLimiter;
    private final ParticipantStore participantStore;
    private final Clock clock;

    public ScoreIngestService(RateLimiter rateLimiter, ParticipantStore participantStore, Clock clock) {
        this.rateLimiter = rateLimiter;
        this.participantStore = participantStore;
        this.clock = clock;
    }

    public void hit(HitRequest request) {
        String rollNumber = request.rollNumber();
        if (!isValidRollNumber(rollNumber)) {
            throw new InvalidSubmissionException(INVALID_ROLL_NUMBER);
        }

        if (request.name() == null || request.name().isEmpty()) {
            throw new InvalidSubmissionException(NAME_REQUIRED);
        }

        if (!rateLimiter.tryAcquire(rollNumber)) {
            throw new RateLimitExceededException(rollNumber, TOO_MANY_REQUESTS);
        }

        try {
            participantStore.applyShot(rollNumber, request.name(), request.shot(), clock.instant());
        } catch (DataAccessException e) {
            throw new StoreException(STORE_ERROR, e);
        }

        logger.debug("Recorded shot {} for {} ({})", request.shot(), rollNumber, request.name());
    }

    public static boolean isValidRollNumber(String rollNumber) {
        return rollNumber != null && ROLL_NUMBER_PATTERN.matcher(rollNumber).matches();
    }
}
