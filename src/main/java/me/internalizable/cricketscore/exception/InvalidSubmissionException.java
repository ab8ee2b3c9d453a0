package me.internalizable.cricketscore.exception;

/**
 * Thrown when a shot submission fails validation. The message is safe to return to the caller.
 */
public class InvalidSubmissionException extends ScoreboardException {

    public InvalidSubmissionException(String message) {
        super(message);
    }
}
