package me.internalizable.cricketscore.exception;

/**
 * Missing configuration or an unreachable store at boot. Aborts context startup.
 */
public class StartupException extends ScoreboardException {

    public StartupException(String message) {
        super(message);
    }

    public StartupException(String message, Throwable cause) {
        super(message, cause);
    }
}
