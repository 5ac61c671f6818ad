package com.crowd.repository;

import com.crowd.model.base.BaseSpatialEntity;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Predicate;

/**
 * Document store offering single-document operations, lexicographic range scans on
 * an indexed string field and bounded atomic batches. Every I/O call is asynchronous.
 */
public interface DocumentStore<T extends BaseSpatialEntity<String>> {
    
    /**
     * Name of the indexed geohash field
     */
    String CELL_FIELD = "cell";
    
    /**
     * Collection name, for logging
     */
    String name();
    
    /**
     * Get a document by id
     */
    CompletableFuture<Optional<T>> get(String id);
    
    /**
     * Create or replace a document; completes with the stored copy including its new version
     */
    CompletableFuture<T> put(T entity);
    
    /**
     * Remove a document; completes with the removed copy, empty when it did not exist
     */
    CompletableFuture<Optional<T>> delete(String id);
    
    /**
     * All documents whose field value lies in [lowerInclusive, upperExclusive)
     */
    CompletableFuture<List<T>> rangeQuery(String field, String lowerInclusive, String upperExclusive);
    
    /**
     * Unindexed scan of every document matching the filter, ordered by id
     */
    CompletableFuture<List<T>> findAll(Predicate<? super T> filter);
    
    /**
     * Atomically update existing documents. Each entry must carry the version it was
     * read with; the whole batch is rejected if any document was deleted or modified
     * since. At most {@link #maxBatchSize()} entries per call.
     */
    CompletableFuture<Void> batchWrite(List<T> entities);
    
    /**
     * Maximum number of entries accepted by one batch write
     */
    int maxBatchSize();
    
    /**
     * Register a listener for create, update and delete events
     */
    void addListener(DocumentEventListener<T> listener);
    
    /**
     * Number of stored documents
     */
    long count();
}
