package com.crowd.geohash;

import com.crowd.model.GeoPoint;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Chooses the cell prefixes to scan for a radius query.
 *
 * The precision comes from a fixed radius table and the scan covers the cell holding
 * the origin plus its eight neighbors. This covers the search disk only when the
 * radius is of the order of the chosen cell size; near a tier boundary entities can
 * be missed, so the distance post-filter only removes false positives.
 */
public final class RangePlanner {

    // Radius upper bounds in km, paired by position with PRECISIONS
    private static final double[] RADIUS_LIMITS_KM = {0.02, 0.15, 1.2, 5, 20, 80};
    private static final int[] PRECISIONS = {8, 7, 6, 5, 4, 3};
    private static final int WIDEST_PRECISION = 2;

    private RangePlanner() {
    }

    /**
     * Cell length to use for a search radius: smaller radius, longer cell.
     */
    public static int precisionFor(double radiusKm) {
        for (int i = 0; i < RADIUS_LIMITS_KM.length; i++) {
            if (radiusKm <= RADIUS_LIMITS_KM[i]) {
                return PRECISIONS[i];
            }
        }
        return WIDEST_PRECISION;
    }

    /**
     * Center cell followed by its eight neighbors, in scan order.
     */
    public static Set<String> cellsCovering(GeoPoint origin, double radiusKm) {
        int precision = precisionFor(radiusKm);
        String center = GeohashCodec.encode(origin.getLatitude(), origin.getLongitude(), precision);

        Set<String> cells = new LinkedHashSet<>();
        cells.add(center);
        cells.addAll(NeighborResolver.neighbors(center));
        return Collections.unmodifiableSet(cells);
    }
}
