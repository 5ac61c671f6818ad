package com.crowd.dubbo.api;

import com.crowd.model.Event;
import com.crowd.model.SearchResult;
import com.crowd.model.Signal;
import com.crowd.model.param.CreateSignalParam;

import java.util.List;

/**
 * Dubbo RPC interface for proximity lookups and signal management
 */
public interface CrowdRpcService {
    
    /**
     * Liveness check
     */
    String ping();
    
    /**
     * Geohash of a coordinate at the given precision
     */
    String encode(double latitude, double longitude, int precision);
    
    /**
     * Events within radiusKm of the point, nearest first
     */
    List<SearchResult<Event>> findNearbyEvents(double latitude, double longitude, double radiusKm);
    
    /**
     * Signals within radiusKm of the point, nearest first
     */
    List<SearchResult<Signal>> findNearbySignals(double latitude, double longitude, double radiusKm);
    
    Signal createSignal(CreateSignalParam param);
    
    /**
     * Get a signal by id, null when it does not exist
     */
    Signal getSignal(String id);
    
    /**
     * Delete a signal, false when it did not exist
     */
    boolean deleteSignal(String id);
}
