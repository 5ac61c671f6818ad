package com.crowd.model.param;

import lombok.Data;
import lombok.Builder;
import lombok.AllArgsConstructor;
import lombok.NoArgsConstructor;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Partial update of a signal; absent fields are left unchanged
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UpdateSignalParam {
    
    private Integer signalStrength;
    
    private Double latitude;
    
    private Double longitude;
    
    @JsonIgnore
    public boolean hasLocation() {
        return latitude != null && longitude != null;
    }
}
