package com.crowd.model;

import lombok.Data;
import lombok.experimental.SuperBuilder;
import lombok.AllArgsConstructor;
import lombok.NoArgsConstructor;
import lombok.EqualsAndHashCode;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.crowd.model.base.BaseSpatialEntity;

/**
 * A user's participation at a location, carrying the density of its cell group
 */
@Data
@SuperBuilder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Signal extends BaseSpatialEntity<String> {
    
    public static final int MIN_STRENGTH = 1;
    public static final int MAX_STRENGTH = 5;
    
    private String userId;
    
    private String eventId;
    
    private int signalStrength;
    
    /**
     * Recomputed in place by the density aggregation pass
     */
    private DensityState density;
}
