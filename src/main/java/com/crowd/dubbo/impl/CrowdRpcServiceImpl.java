package com.crowd.dubbo.impl;

import com.crowd.dubbo.api.CrowdRpcService;
import com.crowd.exception.EntityNotFoundException;
import com.crowd.geohash.GeohashCodec;
import com.crowd.model.Event;
import com.crowd.model.SearchResult;
import com.crowd.model.Signal;
import com.crowd.model.param.CreateSignalParam;
import com.crowd.model.param.ProximityQuery;
import com.crowd.service.EventService;
import com.crowd.service.SignalService;

import org.apache.dubbo.config.annotation.DubboService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Dubbo RPC service implementation delegating to the domain handlers
 */
@Service
@Slf4j
@DubboService
public class CrowdRpcServiceImpl implements CrowdRpcService {

    @Autowired
    private EventService eventService;
    
    @Autowired
    private SignalService signalService;

    @Override
    public String ping() {
        return "PONG";
    }

    @Override
    public String encode(double latitude, double longitude, int precision) {
        return GeohashCodec.encode(latitude, longitude, precision);
    }

    @Override
    public List<SearchResult<Event>> findNearbyEvents(double latitude, double longitude, double radiusKm) {
        List<SearchResult<Event>> results = eventService.findNearbyEvents(ProximityQuery.of(latitude, longitude, radiusKm));
        log.debug("Nearby events via DUBBO around ({}, {}) r={}km: {}", latitude, longitude, radiusKm, results.size());
        return results;
    }

    @Override
    public List<SearchResult<Signal>> findNearbySignals(double latitude, double longitude, double radiusKm) {
        List<SearchResult<Signal>> results = signalService.findNearbySignals(ProximityQuery.of(latitude, longitude, radiusKm));
        log.debug("Nearby signals via DUBBO around ({}, {}) r={}km: {}", latitude, longitude, radiusKm, results.size());
        return results;
    }

    @Override
    public Signal createSignal(CreateSignalParam param) {
        Signal signal = signalService.createSignal(param);
        log.debug("Created signal via DUBBO: {}", signal.getId());
        return signal;
    }

    @Override
    public Signal getSignal(String id) {
        try {
            return signalService.getSignal(id);
        } catch (EntityNotFoundException e) {
            log.debug("Signal {} requested via DUBBO does not exist", id);
            return null;
        }
    }

    @Override
    public boolean deleteSignal(String id) {
        try {
            signalService.deleteSignal(id);
            return true;
        } catch (EntityNotFoundException e) {
            log.debug("Signal {} to delete via DUBBO does not exist", id);
            return false;
        }
    }
}
