package com.crowd.repository.impl;

import com.crowd.exception.WriteConflictException;
import com.crowd.model.base.BaseSpatialEntity;
import com.crowd.repository.DocumentEventListener;
import com.crowd.repository.DocumentStore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * In-memory document store with a sorted index on the geohash cell field.
 *
 * Documents are copied on the way in and out so callers never share state with the
 * store. Writes take a short store-wide monitor to keep documents and index in step;
 * reads are lock-free and re-check each hit against the current document. Events are
 * raised after the monitor is released, on the thread that performed the write.
 */
public class InMemoryDocumentStore<T extends BaseSpatialEntity<String>> implements DocumentStore<T> {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryDocumentStore.class);

    private final String name;
    private final Executor executor;
    private final UnaryOperator<T> copier;
    private final int maxBatchSize;

    // Single source of truth for documents
    private final Map<String, T> documents = new ConcurrentHashMap<>();

    // Cell value -> ids of the documents holding it
    private final ConcurrentSkipListMap<String, Set<String>> cellIndex = new ConcurrentSkipListMap<>();

    private final List<DocumentEventListener<T>> listeners = new CopyOnWriteArrayList<>();

    private final Object writeLock = new Object();

    public InMemoryDocumentStore(String name, Executor executor, UnaryOperator<T> copier, int maxBatchSize) {
        if (maxBatchSize < 1) {
            throw new IllegalArgumentException("maxBatchSize must be positive, got " + maxBatchSize);
        }
        this.name = name;
        this.executor = executor;
        this.copier = copier;
        this.maxBatchSize = maxBatchSize;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public CompletableFuture<Optional<T>> get(String id) {
        return CompletableFuture.supplyAsync(() -> Optional.ofNullable(documents.get(id)).map(copier), executor);
    }

    @Override
    public CompletableFuture<T> put(T entity) {
        return CompletableFuture.supplyAsync(() -> {
            String id = entity.getId();
            if (id == null || id.isEmpty()) {
                throw new IllegalArgumentException("Document id is required for " + name);
            }

            T previous;
            T stored = copier.apply(entity);
            synchronized (writeLock) {
                previous = documents.get(id);
                Instant now = Instant.now();
                if (previous != null) {
                    stored.setCreatedAt(previous.getCreatedAt());
                } else if (stored.getCreatedAt() == null) {
                    stored.setCreatedAt(now);
                }
                stored.setUpdatedAt(now);
                stored.setVersion(previous == null ? 1 : previous.getVersion() + 1);

                unindex(previous);
                documents.put(id, stored);
                index(stored);
            }

            logger.debug("Put {}/{} at version {}", name, id, stored.getVersion());
            if (previous == null) {
                fire(listener -> listener.onCreate(copier.apply(stored)));
            } else {
                fire(listener -> listener.onUpdate(copier.apply(previous), copier.apply(stored)));
            }
            return copier.apply(stored);
        }, executor);
    }

    @Override
    public CompletableFuture<Optional<T>> delete(String id) {
        return CompletableFuture.supplyAsync(() -> {
            T removed;
            synchronized (writeLock) {
                removed = documents.remove(id);
                unindex(removed);
            }

            if (removed == null) {
                return Optional.<T>empty();
            }
            logger.debug("Deleted {}/{}", name, id);
            fire(listener -> listener.onDelete(copier.apply(removed)));
            return Optional.of(copier.apply(removed));
        }, executor);
    }

    @Override
    public CompletableFuture<List<T>> rangeQuery(String field, String lowerInclusive, String upperExclusive) {
        return CompletableFuture.supplyAsync(() -> {
            if (!CELL_FIELD.equals(field)) {
                throw new UnsupportedOperationException("Field '" + field + "' is not indexed in " + name);
            }
            if (lowerInclusive.compareTo(upperExclusive) >= 0) {
                return Collections.<T>emptyList();
            }

            List<T> results = new ArrayList<>();
            for (Set<String> ids : cellIndex.subMap(lowerInclusive, true, upperExclusive, false).values()) {
                for (String id : ids) {
                    T document = documents.get(id);
                    // The document may have moved since the index was read
                    if (document != null && inRange(document.getCell(), lowerInclusive, upperExclusive)) {
                        results.add(copier.apply(document));
                    }
                }
            }
            results.sort(Comparator.comparing((T doc) -> doc.getCell()).thenComparing(doc -> doc.getId()));

            logger.debug("Range scan {}.{} [{}, {}) returned {} documents",
                        name, field, lowerInclusive, upperExclusive, results.size());
            return results;
        }, executor);
    }

    @Override
    public CompletableFuture<List<T>> findAll(Predicate<? super T> filter) {
        return CompletableFuture.supplyAsync(() -> {
            List<T> results = new ArrayList<>();
            for (T document : documents.values()) {
                if (filter.test(document)) {
                    results.add(copier.apply(document));
                }
            }
            results.sort(Comparator.comparing((T doc) -> doc.getId()));

            logger.debug("Full scan of {} matched {} of {} documents", name, results.size(), documents.size());
            return results;
        }, executor);
    }

    @Override
    public CompletableFuture<Void> batchWrite(List<T> entities) {
        return CompletableFuture.runAsync(() -> {
            if (entities.size() > maxBatchSize) {
                throw new IllegalArgumentException(String.format(
                    "Batch of %d entries exceeds the limit of %d for %s", entities.size(), maxBatchSize, name));
            }

            synchronized (writeLock) {
                Set<String> seen = new HashSet<>();
                for (T entity : entities) {
                    if (!seen.add(entity.getId())) {
                        throw new IllegalArgumentException("Duplicate id in batch: " + entity.getId());
                    }
                    T current = documents.get(entity.getId());
                    if (current == null) {
                        throw new WriteConflictException(entity.getId(), "document no longer exists");
                    }
                    if (current.getVersion() != entity.getVersion()) {
                        throw new WriteConflictException(entity.getId(), String.format(
                            "read at version %d but stored version is %d", entity.getVersion(), current.getVersion()));
                    }
                }

                Instant now = Instant.now();
                for (T entity : entities) {
                    T current = documents.get(entity.getId());
                    T stored = copier.apply(entity);
                    stored.setCreatedAt(current.getCreatedAt());
                    stored.setUpdatedAt(now);
                    stored.setVersion(current.getVersion() + 1);

                    unindex(current);
                    documents.put(stored.getId(), stored);
                    index(stored);
                }
            }

            logger.debug("Committed batch of {} documents to {}", entities.size(), name);
        }, executor);
    }

    @Override
    public int maxBatchSize() {
        return maxBatchSize;
    }

    @Override
    public void addListener(DocumentEventListener<T> listener) {
        listeners.add(listener);
    }

    @Override
    public long count() {
        return documents.size();
    }

    private void index(T document) {
        if (document == null || document.getCell() == null) {
            return;
        }
        cellIndex.computeIfAbsent(document.getCell(), k -> ConcurrentHashMap.newKeySet()).add(document.getId());
    }

    private void unindex(T document) {
        if (document == null || document.getCell() == null) {
            return;
        }
        cellIndex.computeIfPresent(document.getCell(), (cell, ids) -> {
            ids.remove(document.getId());
            return ids.isEmpty() ? null : ids;
        });
    }

    private static boolean inRange(String value, String lowerInclusive, String upperExclusive) {
        return value != null && value.compareTo(lowerInclusive) >= 0 && value.compareTo(upperExclusive) < 0;
    }

    private void fire(Consumer<DocumentEventListener<T>> event) {
        for (DocumentEventListener<T> listener : listeners) {
            try {
                event.accept(listener);
            } catch (RuntimeException e) {
                // A failing listener must not fail the write that already committed
                logger.error("Event listener {} failed on collection {}", listener.getClass().getSimpleName(), name, e);
            }
        }
    }
}
