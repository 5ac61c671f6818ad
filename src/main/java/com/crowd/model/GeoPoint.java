package com.crowd.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.io.Serializable;

/**
 * Immutable latitude/longitude pair in decimal degrees
 */
@Value
@Builder
@Jacksonized
public class GeoPoint implements Serializable {

    double latitude;
    double longitude;

    public static GeoPoint of(double latitude, double longitude) {
        return GeoPoint.builder()
                .latitude(latitude)
                .longitude(longitude)
                .build();
    }

    /**
     * Check that both coordinates are finite and inside their ranges
     */
    @JsonIgnore
    public boolean isValid() {
        return latitude >= -90 && latitude <= 90
                && longitude >= -180 && longitude <= 180;
    }
}
