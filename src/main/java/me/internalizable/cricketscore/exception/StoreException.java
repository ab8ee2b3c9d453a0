package me.internalizable.cricketscore.exception;

/**
 * Failure talking to the participant store. The message is the terse text shown to clients;
 * the underlying cause is only logged.
 */
public class StoreException extends ScoreboardException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
