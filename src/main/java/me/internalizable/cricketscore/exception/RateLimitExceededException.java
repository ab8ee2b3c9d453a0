package me.internalizable.cricketscore.exception;

public class RateLimitExceededException extends ScoreboardException {

    private final String rollNumber;

    public RateLimitExceededException(String rollNumber, String message) {
        super(message);
        this.rollNumber = rollNumber;
    }

    public String getRollNumber() {
        return rollNumber;
    }
}
