package com.crowd.controller;

import com.crowd.aspect.TimingAspect;
import com.crowd.geohash.DecodedCell;
import com.crowd.geohash.GeohashCodec;
import com.crowd.geohash.RangePlanner;
import com.crowd.model.Event;
import com.crowd.model.GeoPoint;
import com.crowd.model.SearchResult;
import com.crowd.model.Signal;
import com.crowd.model.param.CreateEventParam;
import com.crowd.model.param.CreateSignalParam;
import com.crowd.model.param.ProximityQuery;
import com.crowd.model.param.UpdateEventParam;
import com.crowd.model.param.UpdateSignalParam;
import com.crowd.model.result.ApiResponse;
import com.crowd.model.result.CellResult;
import com.crowd.model.result.CoverageResult;
import com.crowd.model.result.RecomputeResult;
import com.crowd.service.EventService;
import com.crowd.service.SignalService;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.locationtech.jts.geom.GeometryFactory;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * HTTP REST API for events, signals and geohash cells
 */
@RestController
@RequestMapping("/api/v1")
@Slf4j
public class CrowdGeoController {
    
    @Autowired
    private EventService eventService;
    
    @Autowired
    private SignalService signalService;
    
    @Autowired
    private GeometryFactory geometryFactory;
    
    /**
     * POST /api/v1/events
     */
    @PostMapping("/events")
    public ResponseEntity<ApiResponse<Event>> createEvent(@RequestBody CreateEventParam param) {
        long startTime = System.currentTimeMillis();
        Event event = eventService.createEvent(param);
        long duration = System.currentTimeMillis() - startTime;
        
        log.debug("Created event {} in {}ms", event.getId(), duration);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(event, duration + "ms"));
    }
    
    @GetMapping("/events/{id}")
    public ResponseEntity<ApiResponse<Event>> getEvent(@PathVariable String id) {
        return ResponseEntity.ok(ApiResponse.success(eventService.getEvent(id)));
    }
    
    @PutMapping("/events/{id}")
    public ResponseEntity<ApiResponse<Event>> updateEvent(@PathVariable String id,
                                                          @RequestBody UpdateEventParam param) {
        return ResponseEntity.ok(ApiResponse.success(eventService.updateEvent(id, param)));
    }
    
    /**
     * DELETE /api/v1/events/{id}
     * Also removes the event's signals
     */
    @DeleteMapping("/events/{id}")
    public ResponseEntity<ApiResponse<Event>> deleteEvent(@PathVariable String id) {
        long startTime = System.currentTimeMillis();
        Event event = eventService.deleteEvent(id);
        long duration = System.currentTimeMillis() - startTime;
        
        return ResponseEntity.ok(ApiResponse.success(event, duration + "ms"));
    }
    
    @GetMapping("/events/{id}/signals")
    public ResponseEntity<ApiResponse<List<Signal>>> eventSignals(@PathVariable String id) {
        return ResponseEntity.ok(ApiResponse.success(signalService.getSignalsForEvent(id)));
    }
    
    /**
     * GET /api/v1/events/nearby?lat=..&lng=..&radiusKm=..[&timeoutMs=..]
     */
    @GetMapping("/events/nearby")
    public ResponseEntity<ApiResponse<List<SearchResult<Event>>>> nearbyEvents(
            @RequestParam double lat,
            @RequestParam double lng,
            @RequestParam(defaultValue = "10") double radiusKm,
            @RequestParam(required = false) Long timeoutMs) {
        
        long startTime = System.currentTimeMillis();
        List<SearchResult<Event>> results = eventService.findNearbyEvents(query(lat, lng, radiusKm, timeoutMs));
        long duration = System.currentTimeMillis() - startTime;
        
        log.debug("Nearby events around ({}, {}) r={}km returned {} in {}ms", lat, lng, radiusKm, results.size(), duration);
        return ResponseEntity.ok(ApiResponse.success(results, duration + "ms"));
    }
    
    /**
     * POST /api/v1/signals
     */
    @PostMapping("/signals")
    public ResponseEntity<ApiResponse<Signal>> createSignal(@RequestBody CreateSignalParam param) {
        long startTime = System.currentTimeMillis();
        Signal signal = signalService.createSignal(param);
        long duration = System.currentTimeMillis() - startTime;
        
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(signal, duration + "ms"));
    }
    
    @GetMapping("/signals/{id}")
    public ResponseEntity<ApiResponse<Signal>> getSignal(@PathVariable String id) {
        return ResponseEntity.ok(ApiResponse.success(signalService.getSignal(id)));
    }
    
    @PutMapping("/signals/{id}")
    public ResponseEntity<ApiResponse<Signal>> updateSignal(@PathVariable String id,
                                                            @RequestBody UpdateSignalParam param) {
        return ResponseEntity.ok(ApiResponse.success(signalService.updateSignal(id, param)));
    }
    
    @DeleteMapping("/signals/{id}")
    public ResponseEntity<ApiResponse<Signal>> deleteSignal(@PathVariable String id) {
        return ResponseEntity.ok(ApiResponse.success(signalService.deleteSignal(id)));
    }
    
    /**
     * GET /api/v1/signals/nearby?lat=..&lng=..&radiusKm=..[&timeoutMs=..]
     */
    @GetMapping("/signals/nearby")
    public ResponseEntity<ApiResponse<List<SearchResult<Signal>>>> nearbySignals(
            @RequestParam double lat,
            @RequestParam double lng,
            @RequestParam(defaultValue = "10") double radiusKm,
            @RequestParam(required = false) Long timeoutMs) {
        
        List<SearchResult<Signal>> results = signalService.findNearbySignals(query(lat, lng, radiusKm, timeoutMs));
        
        // Duration measured by the timing aspect around the service call
        return ResponseEntity.ok(ApiResponse.success(results, TimingAspect.getAndClearExecutionTime()));
    }
    
    /**
     * POST /api/v1/signals/recompute?cell=..
     * Runs the density pass for the group holding the cell and waits for it
     */
    @PostMapping("/signals/recompute")
    public ResponseEntity<ApiResponse<RecomputeResult>> recompute(@RequestParam String cell) {
        RecomputeResult result = signalService.requestRecompute(cell);
        String elapsed = TimingAspect.getAndClearExecutionTime();
        
        log.info("Manual recompute of group {} updated {} signals in {}",
                result.getGroupPrefix(), result.getSignalsUpdated(), elapsed);
        return ResponseEntity.ok(ApiResponse.success(result, elapsed));
    }
    
    /**
     * GET /api/v1/cells/cover?lat=..&lng=..&radiusKm=..
     * The prefixes a radius query scans, center cell first
     */
    @GetMapping("/cells/cover")
    public ResponseEntity<ApiResponse<CoverageResult>> cover(
            @RequestParam double lat,
            @RequestParam double lng,
            @RequestParam(defaultValue = "10") double radiusKm) {
        
        GeoPoint origin = GeoPoint.of(lat, lng);
        if (!origin.isValid() || !(radiusKm > 0) || Double.isInfinite(radiusKm)) {
            throw new IllegalArgumentException("Valid coordinates and a positive radius are required");
        }
        
        List<CellResult> cells = new ArrayList<>();
        for (String cell : RangePlanner.cellsCovering(origin, radiusKm)) {
            cells.add(toCellResult(GeohashCodec.decode(cell)));
        }
        
        CoverageResult result = CoverageResult.builder()
                .origin(origin)
                .radiusKm(radiusKm)
                .precision(RangePlanner.precisionFor(radiusKm))
                .cells(cells)
                .build();
        return ResponseEntity.ok(ApiResponse.success(result));
    }
    
    /**
     * GET /api/v1/cells/{cell}
     */
    @GetMapping("/cells/{cell}")
    public ResponseEntity<ApiResponse<CellResult>> decodeCell(@PathVariable String cell) {
        return ResponseEntity.ok(ApiResponse.success(toCellResult(GeohashCodec.decode(cell))));
    }
    
    private CellResult toCellResult(DecodedCell decoded) {
        return CellResult.builder()
                .cell(decoded.getCell())
                .latitude(decoded.getLatitude())
                .longitude(decoded.getLongitude())
                .latitudeError(decoded.getLatitudeError())
                .longitudeError(decoded.getLongitudeError())
                .bounds(geometryFactory.toGeometry(decoded.toEnvelope()))
                .build();
    }
    
    private static ProximityQuery query(double lat, double lng, double radiusKm, Long timeoutMs) {
        ProximityQuery query = ProximityQuery.of(lat, lng, radiusKm);
        if (timeoutMs != null) {
            query.setTimeout(Duration.ofMillis(timeoutMs));
        }
        return query;
    }
}
