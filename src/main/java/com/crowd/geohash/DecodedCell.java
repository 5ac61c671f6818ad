package com.crowd.geohash;

import lombok.Value;
import org.locationtech.jts.geom.Envelope;

/**
 * Centroid and half extents of a decoded geohash cell
 */
@Value
public class DecodedCell {

    String cell;
    double latitude;
    double longitude;
    double latitudeError;
    double longitudeError;

    public double getMinLatitude() {
        return latitude - latitudeError;
    }

    public double getMaxLatitude() {
        return latitude + latitudeError;
    }

    public double getMinLongitude() {
        return longitude - longitudeError;
    }

    public double getMaxLongitude() {
        return longitude + longitudeError;
    }

    /**
     * Whether the point lies inside the cell's bounding box, edges included
     */
    public boolean contains(double lat, double lng) {
        return lat >= getMinLatitude() && lat <= getMaxLatitude()
                && lng >= getMinLongitude() && lng <= getMaxLongitude();
    }

    /**
     * Bounding box in x = longitude, y = latitude order
     */
    public Envelope toEnvelope() {
        return new Envelope(getMinLongitude(), getMaxLongitude(), getMinLatitude(), getMaxLatitude());
    }
}
