package com.crowd.exception;

/**
 * A prefix scan of a proximity query failed. The whole query fails; retrying it is safe.
 */
public class ProximityQueryFailedException extends RuntimeException {

    public ProximityQueryFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
