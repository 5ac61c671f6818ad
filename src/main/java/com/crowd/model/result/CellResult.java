package com.crowd.model.result;

import lombok.Data;
import lombok.Builder;
import lombok.AllArgsConstructor;
import lombok.NoArgsConstructor;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.locationtech.jts.geom.Geometry;

/**
 * A geohash cell with its centroid, error bounds and bounding polygon
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CellResult {
    
    private String cell;
    private double latitude;
    private double longitude;
    private double latitudeError;
    private double longitudeError;
    private Geometry bounds;
}
