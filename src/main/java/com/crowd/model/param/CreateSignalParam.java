package com.crowd.model.param;

import lombok.Data;
import lombok.Builder;
import lombok.AllArgsConstructor;
import lombok.NoArgsConstructor;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;

/**
 * Parameters for creating a signal
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CreateSignalParam implements Serializable {
    
    /**
     * Optional client-chosen id, generated when absent
     */
    private String id;
    
    private String userId;
    
    private String eventId;
    
    private Double latitude;
    
    private Double longitude;
    
    /**
     * 1 to 5, defaults to 1
     */
    private Integer signalStrength;
}
