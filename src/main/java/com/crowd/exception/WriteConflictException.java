package com.crowd.exception;

/**
 * A batch write was rejected because one of its documents was deleted or
 * modified after it was read
 */
public class WriteConflictException extends RuntimeException {

    private final String id;

    public WriteConflictException(String id, String reason) {
        super("Write conflict on document " + id + ": " + reason);
        this.id = id;
    }

    public String getId() {
        return id;
    }
}
