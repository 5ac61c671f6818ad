package com.crowd.service.impl;

import com.crowd.aspect.Timed;
import com.crowd.config.CrowdGeoProperties;
import com.crowd.exception.EntityNotFoundException;
import com.crowd.geohash.GeohashCodec;
import com.crowd.model.DensityState;
import com.crowd.model.Event;
import com.crowd.model.GeoPoint;
import com.crowd.model.SearchResult;
import com.crowd.model.Signal;
import com.crowd.model.param.CreateSignalParam;
import com.crowd.model.param.ProximityQuery;
import com.crowd.model.param.UpdateSignalParam;
import com.crowd.model.result.RecomputeResult;
import com.crowd.repository.DocumentStore;
import com.crowd.service.DensityAggregationService;
import com.crowd.service.DensityTierClassifier;
import com.crowd.service.ProximitySearchService;
import com.crowd.service.SignalService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Signal handlers. Density of the other group members is maintained by the recompute
 * dispatcher from the store's events, not here.
 */
@Service
public class SignalServiceImpl implements SignalService {
    
    private static final Logger logger = LoggerFactory.getLogger(SignalServiceImpl.class);
    
    @Autowired
    @Qualifier("signalStore")
    private DocumentStore<Signal> signalStore;
    
    @Autowired
    @Qualifier("eventStore")
    private DocumentStore<Event> eventStore;
    
    @Autowired
    private ProximitySearchService proximitySearchService;
    
    @Autowired
    private DensityAggregationService densityAggregationService;
    
    @Autowired
    private DensityTierClassifier densityTierClassifier;
    
    @Autowired
    private CrowdGeoProperties properties;
    
    @Override
    @Timed(value = "createSignal", logLevel = Timed.LogLevel.INFO)
    public Signal createSignal(CreateSignalParam param) {
        if (param == null) {
            throw new IllegalArgumentException("Signal parameters are required");
        }
        if (param.getUserId() == null || param.getUserId().isBlank()) {
            throw new IllegalArgumentException("Signal userId is required");
        }
        if (param.getEventId() == null || param.getEventId().isBlank()) {
            throw new IllegalArgumentException("Signal eventId is required");
        }
        GeoPoint location = ParamChecks.location(param.getLatitude(), param.getLongitude());
        int strength = ParamChecks.signalStrength(param.getSignalStrength(), Signal.MIN_STRENGTH,
                                                  Signal.MIN_STRENGTH, Signal.MAX_STRENGTH);
        
        if (StoreCalls.await(eventStore.get(param.getEventId())).isEmpty()) {
            throw new EntityNotFoundException("Event", param.getEventId());
        }
        
        String id = param.getId() != null ? param.getId() : UUID.randomUUID().toString();
        if (param.getId() != null && StoreCalls.await(signalStore.get(id)).isPresent()) {
            throw new IllegalArgumentException("Signal already exists: " + id);
        }
        
        Signal signal = Signal.builder()
                .id(id)
                .userId(param.getUserId())
                .eventId(param.getEventId())
                .signalStrength(strength)
                .build();
        signal.locate(location, properties.getCellPrecision());
        signal.setDensity(densityIncluding(signal));
        
        Signal stored = StoreCalls.await(signalStore.put(signal));
        logger.debug("Created signal {} in cell {} with {} people in its group",
                    stored.getId(), stored.getCell(), stored.getDensity().getPeopleCount());
        return stored;
    }
    
    @Override
    public Signal getSignal(String id) {
        return StoreCalls.await(signalStore.get(id))
                .orElseThrow(() -> new EntityNotFoundException("Signal", id));
    }
    
    @Override
    public List<Signal> getSignalsForEvent(String eventId) {
        if (eventId == null || eventId.isBlank()) {
            throw new IllegalArgumentException("Event id is required");
        }
        if (StoreCalls.await(eventStore.get(eventId)).isEmpty()) {
            throw new EntityNotFoundException("Event", eventId);
        }
        
        List<Signal> signals = StoreCalls.await(signalStore.findAll(signal -> eventId.equals(signal.getEventId())));
        Comparator<Signal> newestFirst = Comparator.comparing(Signal::getCreatedAt,
                                                              Comparator.nullsLast(Comparator.<Instant>reverseOrder()));
        signals.sort(newestFirst.thenComparing(Signal::getId));
        return signals;
    }
    
    @Override
    public Signal updateSignal(String id, UpdateSignalParam param) {
        if (param == null) {
            throw new IllegalArgumentException("Update parameters are required");
        }
        if ((param.getLatitude() == null) != (param.getLongitude() == null)) {
            throw new IllegalArgumentException("Latitude and longitude must be updated together");
        }
        Signal signal = getSignal(id);
        
        if (param.getSignalStrength() != null) {
            signal.setSignalStrength(ParamChecks.signalStrength(param.getSignalStrength(), Signal.MIN_STRENGTH,
                                                                Signal.MIN_STRENGTH, Signal.MAX_STRENGTH));
        }
        if (param.hasLocation()) {
            signal.locate(ParamChecks.location(param.getLatitude(), param.getLongitude()),
                          properties.getCellPrecision());
        }
        
        Signal stored = StoreCalls.await(signalStore.put(signal));
        logger.debug("Updated signal {} to version {}", id, stored.getVersion());
        return stored;
    }
    
    @Override
    public Signal deleteSignal(String id) {
        Signal removed = StoreCalls.await(signalStore.delete(id))
                .orElseThrow(() -> new EntityNotFoundException("Signal", id));
        logger.debug("Deleted signal {} from cell {}", id, removed.getCell());
        return removed;
    }
    
    @Override
    @Timed("findNearbySignals")
    public List<SearchResult<Signal>> findNearbySignals(ProximityQuery query) {
        return proximitySearchService.findNear(signalStore, query);
    }
    
    @Override
    @Timed(value = "requestRecompute", logLevel = Timed.LogLevel.INFO)
    public RecomputeResult requestRecompute(String cell) {
        if (cell == null) {
            throw new IllegalArgumentException("Cell is required");
        }
        GeohashCodec.decode(cell);
        return densityAggregationService.recomputeCellGroup(cell, properties.getGroupingPrecision());
    }
    
    /**
     * Density of the signal's group counting the signal itself once
     */
    private DensityState densityIncluding(Signal signal) {
        String groupPrefix = signal.cellPrefix(properties.getGroupingPrecision());
        List<Signal> members = StoreCalls.await(signalStore.rangeQuery(DocumentStore.CELL_FIELD, groupPrefix,
                                                                         GeohashCodec.prefixUpperBound(groupPrefix)));
        Set<String> others = new HashSet<>();
        for (Signal member : members) {
            if (!member.getId().equals(signal.getId())) {
                others.add(member.getId());
            }
        }
        int peopleCount = others.size() + 1;
        return DensityState.of(peopleCount, densityTierClassifier.classify(peopleCount));
    }
}
