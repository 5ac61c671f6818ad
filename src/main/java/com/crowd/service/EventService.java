package com.crowd.service;

import com.crowd.model.Event;
import com.crowd.model.SearchResult;
import com.crowd.model.param.CreateEventParam;
import com.crowd.model.param.ProximityQuery;
import com.crowd.model.param.UpdateEventParam;

import java.util.List;

/**
 * Event lifecycle and nearby event lookup
 */
public interface EventService {
    
    Event createEvent(CreateEventParam param);
    
    /**
     * @throws com.crowd.exception.EntityNotFoundException if no event has the id
     */
    Event getEvent(String id);
    
    /**
     * Change the given fields of an event. A new location re-derives the cell.
     *
     * @throws com.crowd.exception.EntityNotFoundException if no event has the id
     */
    Event updateEvent(String id, UpdateEventParam param);
    
    /**
     * Remove an event together with every signal attached to it
     *
     * @throws com.crowd.exception.EntityNotFoundException if no event has the id
     */
    Event deleteEvent(String id);
    
    List<SearchResult<Event>> findNearbyEvents(ProximityQuery query);
}
