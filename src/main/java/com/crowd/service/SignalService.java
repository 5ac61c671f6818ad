package com.crowd.service;

import com.crowd.model.SearchResult;
import com.crowd.model.Signal;
import com.crowd.model.param.CreateSignalParam;
import com.crowd.model.param.ProximityQuery;
import com.crowd.model.param.UpdateSignalParam;
import com.crowd.model.result.RecomputeResult;

import java.util.List;

/**
 * Signal lifecycle, nearby signal lookup and density recompute requests
 */
public interface SignalService {
    
    /**
     * Store a new signal with the density of its group, itself included.
     * The other members of the group are brought up to date asynchronously.
     *
     * @throws com.crowd.exception.EntityNotFoundException if the referenced event does not exist
     */
    Signal createSignal(CreateSignalParam param);
    
    Signal getSignal(String id);
    
    /**
     * Signals attached to an event, newest first
     *
     * @throws com.crowd.exception.EntityNotFoundException if the event does not exist
     */
    List<Signal> getSignalsForEvent(String eventId);
    
    /**
     * Change the strength and/or the location of a signal. A new location re-derives the cell.
     */
    Signal updateSignal(String id, UpdateSignalParam param);
    
    Signal deleteSignal(String id);
    
    List<SearchResult<Signal>> findNearbySignals(ProximityQuery query);
    
    /**
     * Run a recompute of the group holding the cell on the calling thread
     */
    RecomputeResult requestRecompute(String cell);
}
