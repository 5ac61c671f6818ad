package com.crowd.model;

import lombok.Data;
import lombok.experimental.SuperBuilder;
import lombok.AllArgsConstructor;
import lombok.NoArgsConstructor;
import lombok.EqualsAndHashCode;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.crowd.model.base.BaseSpatialEntity;

import java.time.Instant;
import java.util.List;

/**
 * A hosted gathering at a fixed location
 */
@Data
@SuperBuilder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Event extends BaseSpatialEntity<String> {
    
    public static final double DEFAULT_RADIUS_METERS = 60;
    
    private String title;
    
    private String hostId;
    
    private double radiusMeters;
    
    private Instant startsAt;
    
    private Instant endsAt;
    
    private List<String> tags;
}
