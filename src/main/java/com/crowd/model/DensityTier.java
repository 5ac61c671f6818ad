package com.crowd.model;

/**
 * Crowd density band with the color and radius clients render it with
 */
public enum DensityTier {
    BASE("#FFD700", 75),
    ELEVATED("#FF6B6B", 125),
    DEEP("#8B0000", 200);

    private final String colorHex;
    private final int radiusMeters;

    DensityTier(String colorHex, int radiusMeters) {
        this.colorHex = colorHex;
        this.radiusMeters = radiusMeters;
    }

    public String getColorHex() {
        return colorHex;
    }

    public int getRadiusMeters() {
        return radiusMeters;
    }
}
