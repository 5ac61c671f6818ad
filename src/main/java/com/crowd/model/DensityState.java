package com.crowd.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.io.Serializable;

/**
 * Derived crowd density attached to a signal
 */
@Value
@Builder
@Jacksonized
public class DensityState implements Serializable {

    int peopleCount;
    DensityTier tier;
    String colorHex;
    int radiusMeters;

    public static DensityState of(int peopleCount, DensityTier tier) {
        return DensityState.builder()
                .peopleCount(peopleCount)
                .tier(tier)
                .colorHex(tier.getColorHex())
                .radiusMeters(tier.getRadiusMeters())
                .build();
    }
}
