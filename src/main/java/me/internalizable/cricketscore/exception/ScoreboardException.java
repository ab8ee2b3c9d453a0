package me.internalizable.cricketscore.exception;

/**
 * Base type for failures surfaced by the scoring API.
 */
public abstract class ScoreboardException extends RuntimeException {

    protected ScoreboardException(String message) {
        super(message);
    }

    protected ScoreboardException(String message, Throwable cause) {
        super(message, cause);
    }
}
