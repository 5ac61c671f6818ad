package com.crowd.model.param;

import lombok.Data;
import lombok.Builder;
import lombok.AllArgsConstructor;
import lombok.NoArgsConstructor;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.crowd.model.GeoPoint;

import java.time.Duration;

/**
 * Parameters of a radius search around a point
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProximityQuery {
    
    /**
     * Search center
     */
    private GeoPoint origin;
    
    /**
     * Search radius in kilometers
     */
    private double radiusKm;
    
    /**
     * Deadline for the whole query, the configured default when absent
     */
    private Duration timeout;
    
    public static ProximityQuery of(double latitude, double longitude, double radiusKm) {
        return ProximityQuery.builder()
                .origin(GeoPoint.of(latitude, longitude))
                .radiusKm(radiusKm)
                .build();
    }
    
    /**
     * Check that the origin is a valid coordinate and the radius a positive finite number
     */
    @JsonIgnore
    public boolean isValid() {
        return origin != null && origin.isValid()
                && Double.isFinite(radiusKm) && radiusKm > 0;
    }
}
