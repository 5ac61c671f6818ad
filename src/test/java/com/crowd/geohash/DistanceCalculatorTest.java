package com.crowd.geohash;

import com.crowd.model.GeoPoint;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DistanceCalculatorTest {
    
    @Test
    void testKnownDistances() {
        assertEquals(3935.75, DistanceCalculator.distanceKm(40.7128, -74.0060, 34.0522, -118.2437), 0.01);
        assertEquals(343.56, DistanceCalculator.distanceKm(GeoPoint.of(51.5074, -0.1278), GeoPoint.of(48.8566, 2.3522)), 0.01);
    }
    
    @Test
    void testOneDegreeOfLongitudeAtEquator() {
        assertEquals(111.195, DistanceCalculator.distanceKm(0, 0, 0, 1), 0.001);
    }
    
    @Test
    void testZeroAndSymmetric() {
        assertEquals(0.0, DistanceCalculator.distanceKm(12.5, 45.1, 12.5, 45.1), 1e-12);
        assertEquals(DistanceCalculator.distanceKm(10, 20, 30, 40), DistanceCalculator.distanceKm(30, 40, 10, 20), 1e-9);
    }
    
    @Test
    void testShortestPathAcrossAntimeridian() {
        assertEquals(22.239, DistanceCalculator.distanceKm(0, 179.9, 0, -179.9), 0.001);
    }
    
    @Test
    void testNaNPropagates() {
        assertTrue(Double.isNaN(DistanceCalculator.distanceKm(Double.NaN, 0, 0, 0)));
    }
}
