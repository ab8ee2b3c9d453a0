package me.internalizable.cricketscore.ratelimit;

/**
 * Per-identity cooldown throttle for scoring events.
 * An identity is throttled while less than the cooldown has passed since its last recorded event.
 */
public interface RateLimiter {

    /**
     * Check whether an identity is currently inside its cooldown window
     * @param identity The roll number
     * @return true if throttled, false if a new event may be accepted
     */
    boolean isThrottled(String identity);

    /**
     * Mark an event as accepted for an identity, overwriting any earlier timestamp
     * @param identity The roll number
     */
    void record(String identity);

    /**
     * Check and record in a single exclusive step
     * @param identity The roll number
     * @return true if the identity was not throttled and is now recorded, false if throttled
     */
    boolean tryAcquire(String identity);

    /**
     * Forget an identity (useful for testing or admin overrides)
     * @param identity The roll number
     */
    void reset(String identity);

    /**
     * @return Number of identities still inside their cooldown window
     */
    long size();
}
