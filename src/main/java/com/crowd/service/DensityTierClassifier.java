package com.crowd.service;

import com.crowd.model.DensityTier;
import org.springframework.stereotype.Component;

/**
 * Maps the number of people in a cell group to its density tier
 */
@Component
public class DensityTierClassifier {
    
    public static final int DEEP_THRESHOLD = 50;
    public static final int ELEVATED_THRESHOLD = 25;
    
    public DensityTier classify(int peopleCount) {
        if (peopleCount < 0) {
            throw new IllegalArgumentException("People count must not be negative, got " + peopleCount);
        }
        if (peopleCount > DEEP_THRESHOLD) {
            return DensityTier.DEEP;
        }
        if (peopleCount > ELEVATED_THRESHOLD) {
            return DensityTier.ELEVATED;
        }
        return DensityTier.BASE;
    }
}
