package com.crowd.exception;

/**
 * Thrown when a referenced document does not exist
 */
public class EntityNotFoundException extends RuntimeException {

    public EntityNotFoundException(String kind, String id) {
        super(kind + " not found: " + id);
    }
}
