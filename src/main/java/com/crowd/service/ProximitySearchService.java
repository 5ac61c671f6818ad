package com.crowd.service;

import com.crowd.model.SearchResult;
import com.crowd.model.base.BaseSpatialEntity;
import com.crowd.model.param.ProximityQuery;
import com.crowd.repository.DocumentStore;

import java.util.List;

/**
 * Radius search over a store that only offers range scans on the geohash cell field
 */
public interface ProximitySearchService {
    
    /**
     * Entities within the query radius of its origin, nearest first.
     *
     * Scans the cell holding the origin and its eight neighbors at a precision chosen
     * from the radius, removes duplicates and keeps only hits whose great-circle
     * distance is within the radius. Either every scan succeeds or the query fails.
     *
     * @throws IllegalArgumentException if the origin is not a valid coordinate or the radius is not positive
     * @throws com.crowd.exception.ProximityQueryFailedException if a prefix scan fails
     * @throws com.crowd.exception.ProximityQueryTimedOutException if the scans do not finish before the deadline
     */
    <T extends BaseSpatialEntity<String>> List<SearchResult<T>> findNear(DocumentStore<T> store, ProximityQuery query);
}
