package com.crowd.exception;

import java.time.Duration;

/**
 * A proximity query did not finish before its deadline. Retrying it is safe.
 */
public class ProximityQueryTimedOutException extends RuntimeException {

    private final Duration timeout;

    public ProximityQueryTimedOutException(Duration timeout, Throwable cause) {
        super("Proximity query exceeded its deadline of " + timeout.toMillis() + "ms", cause);
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
