package com.crowd.integration;

import com.crowd.exception.EntityNotFoundException;
import com.crowd.model.DensityTier;
import com.crowd.model.Event;
import com.crowd.model.Signal;
import com.crowd.model.param.CreateEventParam;
import com.crowd.model.param.CreateSignalParam;
import com.crowd.model.param.UpdateSignalParam;
import com.crowd.service.EventService;
import com.crowd.service.RecomputeDispatcher;
import com.crowd.service.SignalService;

import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Signal mutations flow through store events and the recompute workers until
 * every signal of the group carries the group's size
 */
@SpringBootTest
@ActiveProfiles("test")
class DensityConvergenceIntegrationTest {
    
    @Autowired
    private EventService eventService;
    
    @Autowired
    private SignalService signalService;
    
    @Autowired
    private RecomputeDispatcher recomputeDispatcher;
    
    @Autowired
    private MeterRegistry meterRegistry;
    
    @Test
    void testGroupConvergesAfterCreatesAndDeletes() throws InterruptedException {
        // Given
        Event event = eventService.createEvent(CreateEventParam.builder()
                .title("Street festival")
                .latitude(40.72)
                .longitude(-74.02)
                .build());
        
        // When
        for (int i = 0; i < 27; i++) {
            signalService.createSignal(CreateSignalParam.builder()
                    .id("conv-" + i)
                    .userId("user-" + i)
                    .eventId(event.getId())
                    .latitude(40.71 + i * 0.0005)
                    .longitude(-74.02)
                    .build());
        }
        assertTrue(recomputeDispatcher.awaitIdle(Duration.ofSeconds(10)));
        
        // Then
        for (int i = 0; i < 27; i++) {
            Signal signal = signalService.getSignal("conv-" + i);
            assertEquals(27, signal.getDensity().getPeopleCount(), "signal conv-" + i);
            assertEquals(DensityTier.ELEVATED, signal.getDensity().getTier());
        }
        
        // When
        signalService.deleteSignal("conv-0");
        signalService.deleteSignal("conv-1");
        assertTrue(recomputeDispatcher.awaitIdle(Duration.ofSeconds(10)));
        
        // Then
        for (int i = 2; i < 27; i++) {
            Signal signal = signalService.getSignal("conv-" + i);
            assertEquals(25, signal.getDensity().getPeopleCount());
            assertEquals(DensityTier.BASE, signal.getDensity().getTier());
            assertEquals("#FFD700", signal.getDensity().getColorHex());
        }
        assertTrue(meterRegistry.counter("crowd.density.recompute.passes").count() >= 2);
    }
    
    @Test
    void testMovedSignalLeavesItsOldGroup() throws InterruptedException {
        // Given
        Event event = eventService.createEvent(CreateEventParam.builder()
                .title("Book fair")
                .latitude(48.8566)
                .longitude(2.3522)
                .build());
        for (int i = 0; i < 3; i++) {
            signalService.createSignal(CreateSignalParam.builder()
                    .id("move-" + i)
                    .userId("user-" + i)
                    .eventId(event.getId())
                    .latitude(48.8566)
                    .longitude(2.3522 + i * 0.0005)
                    .build());
        }
        assertTrue(recomputeDispatcher.awaitIdle(Duration.ofSeconds(10)));
        
        // When
        Signal moved = signalService.updateSignal("move-0", UpdateSignalParam.builder()
                .latitude(45.7640)
                .longitude(4.8357)
                .build());
        assertTrue(recomputeDispatcher.awaitIdle(Duration.ofSeconds(10)));
        
        // Then
        assertNotEquals("u09tv", moved.cellPrefix(5));
        assertEquals(2, signalService.getSignal("move-1").getDensity().getPeopleCount());
        assertEquals(1, signalService.getSignal("move-0").getDensity().getPeopleCount());
    }
    
    @Test
    void testThirtySignalsAtOneSpotAreElevated() throws InterruptedException {
        // Given
        Event event = eventService.createEvent(CreateEventParam.builder()
                .title("Crossing")
                .latitude(35.6595)
                .longitude(139.7005)
                .build());
        
        // When
        for (int i = 0; i < 30; i++) {
            signalService.createSignal(CreateSignalParam.builder()
                    .id("spot-" + i)
                    .userId("user-" + i)
                    .eventId(event.getId())
                    .latitude(35.6595)
                    .longitude(139.7005)
                    .build());
        }
        assertTrue(recomputeDispatcher.awaitIdle(Duration.ofSeconds(10)));
        
        // Then
        for (int i = 0; i < 30; i++) {
            Signal signal = signalService.getSignal("spot-" + i);
            assertEquals(30, signal.getDensity().getPeopleCount(), "signal spot-" + i);
            assertEquals(DensityTier.ELEVATED, signal.getDensity().getTier());
        }
    }
    
    @Test
    void testDeletedEventTakesItsSignalsOutOfTheGroup() throws InterruptedException {
        // Given
        Event leaving = eventService.createEvent(CreateEventParam.builder()
                .title("Pop-up stall")
                .latitude(10.0)
                .longitude(10.0)
                .build());
        Event staying = eventService.createEvent(CreateEventParam.builder()
                .title("Market")
                .latitude(10.0)
                .longitude(10.0)
                .build());
        signalService.createSignal(CreateSignalParam.builder()
                .id("stall-1").userId("user-1").eventId(leaving.getId()).latitude(10.0).longitude(10.0).build());
        signalService.createSignal(CreateSignalParam.builder()
                .id("market-1").userId("user-2").eventId(staying.getId()).latitude(10.0).longitude(10.0).build());
        assertTrue(recomputeDispatcher.awaitIdle(Duration.ofSeconds(10)));
        assertEquals(2, signalService.getSignal("market-1").getDensity().getPeopleCount());
        assertEquals(List.of("stall-1"),
                signalService.getSignalsForEvent(leaving.getId()).stream().map(Signal::getId).toList());
        
        // When
        eventService.deleteEvent(leaving.getId());
        assertTrue(recomputeDispatcher.awaitIdle(Duration.ofSeconds(10)));
        
        // Then
        assertThrows(EntityNotFoundException.class, () -> signalService.getSignal("stall-1"));
        assertEquals(1, signalService.getSignal("market-1").getDensity().getPeopleCount());
        assertEquals(DensityTier.BASE, signalService.getSignal("market-1").getDensity().getTier());
    }
}
