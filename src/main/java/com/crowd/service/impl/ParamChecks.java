package com.crowd.service.impl;

import com.crowd.model.GeoPoint;

/**
 * Input checks shared by the domain handlers
 */
final class ParamChecks {
    
    private ParamChecks() {
    }
    
    /**
     * Build a point from request coordinates, both required and in range
     */
    static GeoPoint location(Double latitude, Double longitude) {
        if (latitude == null || longitude == null) {
            throw new IllegalArgumentException("Latitude and longitude are required");
        }
        GeoPoint point = GeoPoint.of(latitude, longitude);
        if (!point.isValid()) {
            throw new IllegalArgumentException(String.format(
                "Coordinates out of range: lat=%s, lng=%s", latitude, longitude));
        }
        return point;
    }
    
    static int signalStrength(Integer strength, int defaultValue, int min, int max) {
        int value = strength != null ? strength : defaultValue;
        if (value < min || value > max) {
            throw new IllegalArgumentException(String.format(
                "Signal strength must be between %d and %d, got %d", min, max, value));
        }
        return value;
    }
}
