package com.crowd.service.impl;

import com.crowd.aspect.Timed;
import com.crowd.config.CrowdGeoProperties;
import com.crowd.exception.EntityNotFoundException;
import com.crowd.model.Event;
import com.crowd.model.GeoPoint;
import com.crowd.model.SearchResult;
import com.crowd.model.Signal;
import com.crowd.model.param.CreateEventParam;
import com.crowd.model.param.ProximityQuery;
import com.crowd.model.param.UpdateEventParam;
import com.crowd.repository.DocumentStore;
import com.crowd.service.EventService;
import com.crowd.service.ProximitySearchService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Event handlers over the event store. Deleting an event also deletes its signals
 * one by one, so the recompute dispatcher sees every removal.
 */
@Service
public class EventServiceImpl implements EventService {
    
    private static final Logger logger = LoggerFactory.getLogger(EventServiceImpl.class);
    
    @Autowired
    @Qualifier("eventStore")
    private DocumentStore<Event> eventStore;
    
    @Autowired
    @Qualifier("signalStore")
    private DocumentStore<Signal> signalStore;
    
    @Autowired
    private ProximitySearchService proximitySearchService;
    
    @Autowired
    private CrowdGeoProperties properties;
    
    @Override
    public Event createEvent(CreateEventParam param) {
        if (param == null) {
            throw new IllegalArgumentException("Event parameters are required");
        }
        if (param.getTitle() == null || param.getTitle().isBlank()) {
            throw new IllegalArgumentException("Event title is required");
        }
        GeoPoint location = ParamChecks.location(param.getLatitude(), param.getLongitude());
        checkRadius(param.getRadiusMeters());
        checkSchedule(param.getStartsAt(), param.getEndsAt());
        
        String id = param.getId() != null ? param.getId() : UUID.randomUUID().toString();
        if (param.getId() != null && StoreCalls.await(eventStore.get(id)).isPresent()) {
            throw new IllegalArgumentException("Event already exists: " + id);
        }
        
        Event event = Event.builder()
                .id(id)
                .title(param.getTitle().trim())
                .hostId(param.getHostId())
                .radiusMeters(param.getRadiusMeters() != null ? param.getRadiusMeters() : Event.DEFAULT_RADIUS_METERS)
                .startsAt(param.getStartsAt())
                .endsAt(param.getEndsAt())
                .tags(param.getTags() != null ? new ArrayList<>(param.getTags()) : null)
                .build();
        event.locate(location, properties.getCellPrecision());
        
        Event stored = StoreCalls.await(eventStore.put(event));
        logger.debug("Created event {} in cell {}", stored.getId(), stored.getCell());
        return stored;
    }
    
    @Override
    public Event getEvent(String id) {
        return StoreCalls.await(eventStore.get(id))
                .orElseThrow(() -> new EntityNotFoundException("Event", id));
    }
    
    @Override
    public Event updateEvent(String id, UpdateEventParam param) {
        if (param == null) {
            throw new IllegalArgumentException("Update parameters are required");
        }
        if ((param.getLatitude() == null) != (param.getLongitude() == null)) {
            throw new IllegalArgumentException("Latitude and longitude must be updated together");
        }
        if (param.getTitle() != null && param.getTitle().isBlank()) {
            throw new IllegalArgumentException("Event title must not be blank");
        }
        checkRadius(param.getRadiusMeters());
        GeoPoint location = param.hasLocation()
                ? ParamChecks.location(param.getLatitude(), param.getLongitude())
                : null;
        
        Event event = getEvent(id);
        Instant startsAt = param.getStartsAt() != null ? param.getStartsAt() : event.getStartsAt();
        Instant endsAt = param.getEndsAt() != null ? param.getEndsAt() : event.getEndsAt();
        checkSchedule(startsAt, endsAt);
        
        if (param.getTitle() != null) {
            event.setTitle(param.getTitle().trim());
        }
        if (param.getRadiusMeters() != null) {
            event.setRadiusMeters(param.getRadiusMeters());
        }
        if (param.getTags() != null) {
            event.setTags(new ArrayList<>(param.getTags()));
        }
        event.setStartsAt(startsAt);
        event.setEndsAt(endsAt);
        if (location != null) {
            event.locate(location, properties.getCellPrecision());
        }
        
        Event stored = StoreCalls.await(eventStore.put(event));
        logger.debug("Updated event {} to version {} in cell {}", id, stored.getVersion(), stored.getCell());
        return stored;
    }
    
    @Override
    public Event deleteEvent(String id) {
        Event removed = StoreCalls.await(eventStore.delete(id))
                .orElseThrow(() -> new EntityNotFoundException("Event", id));
        
        // The event is gone first so no new signal can attach to it during the cleanup
        List<Signal> attached = StoreCalls.await(signalStore.findAll(signal -> id.equals(signal.getEventId())));
        List<CompletableFuture<?>> deletions = new ArrayList<>();
        for (Signal signal : attached) {
            deletions.add(signalStore.delete(signal.getId()));
        }
        StoreCalls.await(CompletableFuture.allOf(deletions.toArray(new CompletableFuture<?>[0])));
        
        logger.debug("Deleted event {} and its {} signals", id, attached.size());
        return removed;
    }
    
    @Override
    @Timed("findNearbyEvents")
    public List<SearchResult<Event>> findNearbyEvents(ProximityQuery query) {
        return proximitySearchService.findNear(eventStore, query);
    }
    
    private static void checkRadius(Double radiusMeters) {
        if (radiusMeters != null && !(radiusMeters > 0)) {
            throw new IllegalArgumentException("Event radius must be positive, got " + radiusMeters);
        }
    }
    
    private static void checkSchedule(Instant startsAt, Instant endsAt) {
        if (startsAt != null && endsAt != null && endsAt.isBefore(startsAt)) {
            throw new IllegalArgumentException("Event must not end before it starts");
        }
    }
}
