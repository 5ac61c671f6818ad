package com.crowd.model.param;

import lombok.Data;
import lombok.Builder;
import lombok.AllArgsConstructor;
import lombok.NoArgsConstructor;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.List;

/**
 * Partial update of an event; absent fields are left unchanged. The host cannot be changed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UpdateEventParam {
    
    private String title;
    
    private Double latitude;
    
    private Double longitude;
    
    private Double radiusMeters;
    
    private Instant startsAt;
    
    private Instant endsAt;
    
    private List<String> tags;
    
    @JsonIgnore
    public boolean hasLocation() {
        return latitude != null && longitude != null;
    }
}
