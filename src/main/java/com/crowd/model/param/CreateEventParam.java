package com.crowd.model.param;

import lombok.Data;
import lombok.Builder;
import lombok.AllArgsConstructor;
import lombok.NoArgsConstructor;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

/**
 * Parameters for creating an event
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CreateEventParam {
    
    /**
     * Optional client-chosen id, generated when absent
     */
    private String id;
    
    private String title;
    
    private String hostId;
    
    private Double latitude;
    
    private Double longitude;
    
    private Double radiusMeters;
    
    private Instant startsAt;
    
    private Instant endsAt;
    
    private List<String> tags;
}
