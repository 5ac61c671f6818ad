package com.crowd.repository;

/**
 * Receives mutation events from a document store after the write is committed.
 * Delivery is at-least-once and unordered across documents, so handlers must be idempotent.
 */
public interface DocumentEventListener<T> {
    
    /**
     * A document was written under an id that did not exist before
     */
    default void onCreate(T entity) {
    }
    
    /**
     * An existing document was replaced through a single-document write
     */
    default void onUpdate(T before, T after) {
    }
    
    /**
     * A document was removed
     */
    default void onDelete(T entity) {
    }
}
