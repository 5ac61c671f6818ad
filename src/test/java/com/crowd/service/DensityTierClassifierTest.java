package com.crowd.service;

import com.crowd.model.DensityTier;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DensityTierClassifierTest {
    
    private final DensityTierClassifier classifier = new DensityTierClassifier();
    
    @Test
    void testBandBoundaries() {
        assertEquals(DensityTier.BASE, classifier.classify(0));
        assertEquals(DensityTier.BASE, classifier.classify(9));
        assertEquals(DensityTier.BASE, classifier.classify(25));
        assertEquals(DensityTier.ELEVATED, classifier.classify(26));
        assertEquals(DensityTier.ELEVATED, classifier.classify(50));
        assertEquals(DensityTier.DEEP, classifier.classify(51));
        assertEquals(DensityTier.DEEP, classifier.classify(10_000));
    }
    
    @Test
    void testTierPresentation() {
        assertEquals("#FFD700", DensityTier.BASE.getColorHex());
        assertEquals(75, DensityTier.BASE.getRadiusMeters());
        assertEquals("#FF6B6B", DensityTier.ELEVATED.getColorHex());
        assertEquals(125, DensityTier.ELEVATED.getRadiusMeters());
        assertEquals("#8B0000", DensityTier.DEEP.getColorHex());
        assertEquals(200, DensityTier.DEEP.getRadiusMeters());
    }
    
    @Test
    void testNegativeCountRejected() {
        assertThrows(IllegalArgumentException.class, () -> classifier.classify(-1));
    }
}
