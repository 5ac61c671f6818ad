package com.crowd.controller;

import com.crowd.exception.InvalidCellCharException;
import com.crowd.model.Event;
import com.crowd.model.SearchResult;
import com.crowd.model.Signal;
import com.crowd.model.param.CreateSignalParam;
import com.crowd.model.param.ProximityQuery;
import com.crowd.model.param.UpdateEventParam;
import com.crowd.model.result.ApiResponse;
import com.crowd.model.result.CellResult;
import com.crowd.model.result.CoverageResult;
import com.crowd.model.result.RecomputeResult;
import com.crowd.service.EventService;
import com.crowd.service.SignalService;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.locationtech.jts.geom.GeometryFactory;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CrowdGeoControllerTest {
    
    @Mock
    private EventService eventService;
    
    @Mock
    private SignalService signalService;
    
    @Spy
    private GeometryFactory geometryFactory = new GeometryFactory();
    
    @InjectMocks
    private CrowdGeoController controller;
    
    @Test
    void testCreateSignal() {
        // Given
        CreateSignalParam param = CreateSignalParam.builder()
                .userId("user-1")
                .eventId("event-1")
                .latitude(40.7128)
                .longitude(-74.0060)
                .build();
        Signal signal = Signal.builder().id("s1").userId("user-1").eventId("event-1").signalStrength(1).build();
        when(signalService.createSignal(param)).thenReturn(signal);
        
        // When
        ResponseEntity<ApiResponse<Signal>> response = controller.createSignal(param);
        
        // Then
        assertEquals(HttpStatus.CREATED, response.getStatusCode());
        assertNotNull(response.getBody());
        assertTrue(response.getBody().getOk());
        assertEquals("s1", response.getBody().getData().getId());
    }
    
    @Test
    void testNearbyEventsPassesRadiusAndTimeout() {
        // Given
        Event event = Event.builder().id("e1").title("Concert").build();
        SearchResult<Event> hit = SearchResult.<Event>builder().id("e1").entity(event).distanceKm(0.4).build();
        when(eventService.findNearbyEvents(any(ProximityQuery.class))).thenReturn(List.of(hit));
        
        // When
        ResponseEntity<ApiResponse<List<SearchResult<Event>>>> response =
                controller.nearbyEvents(40.7128, -74.0060, 2.5, 300L);
        
        // Then
        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals(1, response.getBody().getData().size());
        assertNotNull(response.getBody().getElapsed());
        
        ArgumentCaptor<ProximityQuery> captor = ArgumentCaptor.forClass(ProximityQuery.class);
        verify(eventService).findNearbyEvents(captor.capture());
        assertEquals(2.5, captor.getValue().getRadiusKm());
        assertEquals(40.7128, captor.getValue().getOrigin().getLatitude());
        assertEquals(Duration.ofMillis(300), captor.getValue().getTimeout());
    }
    
    @Test
    void testNearbySignalsWithoutTimeoutUsesDefault() {
        when(signalService.findNearbySignals(any(ProximityQuery.class))).thenReturn(List.of());
        
        ResponseEntity<ApiResponse<List<SearchResult<Signal>>>> response = controller.nearbySignals(1.0, 2.0, 10, null);
        
        assertTrue(response.getBody().getData().isEmpty());
        ArgumentCaptor<ProximityQuery> captor = ArgumentCaptor.forClass(ProximityQuery.class);
        verify(signalService).findNearbySignals(captor.capture());
        assertNull(captor.getValue().getTimeout());
    }
    
    @Test
    void testUpdateEvent() {
        UpdateEventParam param = UpdateEventParam.builder().title("Moved").latitude(51.5074).longitude(-0.1278).build();
        Event moved = Event.builder().id("e1").title("Moved").build();
        when(eventService.updateEvent("e1", param)).thenReturn(moved);
        
        ResponseEntity<ApiResponse<Event>> response = controller.updateEvent("e1", param);
        
        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals("Moved", response.getBody().getData().getTitle());
    }
    
    @Test
    void testDeleteEventAndListSignals() {
        // Given
        Signal signal = Signal.builder().id("s1").eventId("e1").signalStrength(1).build();
        when(signalService.getSignalsForEvent("e1")).thenReturn(List.of(signal));
        when(eventService.deleteEvent("e1")).thenReturn(Event.builder().id("e1").build());
        
        // When
        ResponseEntity<ApiResponse<List<Signal>>> signals = controller.eventSignals("e1");
        ResponseEntity<ApiResponse<Event>> deleted = controller.deleteEvent("e1");
        
        // Then
        assertEquals("s1", signals.getBody().getData().get(0).getId());
        assertEquals("e1", deleted.getBody().getData().getId());
        assertTrue(deleted.getBody().getElapsed().endsWith("ms"));
    }
    
    @Test
    void testRecompute() {
        RecomputeResult result = RecomputeResult.builder().groupPrefix("dr5re").peopleCount(3).signalsUpdated(3).build();
        when(signalService.requestRecompute("dr5regw3p")).thenReturn(result);
        
        ResponseEntity<ApiResponse<RecomputeResult>> response = controller.recompute("dr5regw3p");
        
        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertSame(result, response.getBody().getData());
    }
    
    @Test
    void testDecodeCellWithBounds() {
        ResponseEntity<ApiResponse<CellResult>> response = controller.decodeCell("ezs42");
        
        CellResult cell = response.getBody().getData();
        assertEquals(42.60498046875, cell.getLatitude(), 1e-12);
        assertEquals(-5.60302734375, cell.getLongitude(), 1e-12);
        assertEquals("Polygon", cell.getBounds().getGeometryType());
        assertEquals(-5.625, cell.getBounds().getEnvelopeInternal().getMinX(), 1e-12);
        assertEquals(42.626953125, cell.getBounds().getEnvelopeInternal().getMaxY(), 1e-12);
    }
    
    @Test
    void testDecodeMalformedCell() {
        assertThrows(InvalidCellCharException.class, () -> controller.decodeCell("ezs4a"));
    }
    
    @Test
    void testCover() {
        ResponseEntity<ApiResponse<CoverageResult>> response = controller.cover(40.7128, -74.0060, 3);
        
        CoverageResult coverage = response.getBody().getData();
        assertEquals(5, coverage.getPrecision());
        assertEquals(9, coverage.getCells().size());
        assertEquals("dr5re", coverage.getCells().get(0).getCell());
    }
    
    @Test
    void testCoverRejectsInvalidInput() {
        assertThrows(IllegalArgumentException.class, () -> controller.cover(95, 0, 3));
        assertThrows(IllegalArgumentException.class, () -> controller.cover(0, 0, 0));
    }
}
