package com.crowd.geohash;

import com.crowd.model.GeoPoint;

/**
 * Great-circle distance using the Haversine formula
 */
public final class DistanceCalculator {

    public static final double EARTH_RADIUS_KM = 6371.0;

    private DistanceCalculator() {
    }

    public static double distanceKm(GeoPoint from, GeoPoint to) {
        return distanceKm(from.getLatitude(), from.getLongitude(), to.getLatitude(), to.getLongitude());
    }

    /**
     * Distance in kilometers; NaN inputs propagate to a NaN result.
     */
    public static double distanceKm(double lat1, double lng1, double lat2, double lng2) {
        double dLat = Math.toRadians(lat2 - lat1);
        double dLng = Math.toRadians(lng2 - lng1);

        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2))
                * Math.sin(dLng / 2) * Math.sin(dLng / 2);

        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return EARTH_RADIUS_KM * c;
    }
}
