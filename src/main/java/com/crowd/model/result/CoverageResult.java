package com.crowd.model.result;

import lombok.Data;
import lombok.Builder;
import lombok.AllArgsConstructor;
import lombok.NoArgsConstructor;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.crowd.model.GeoPoint;

import java.util.List;

/**
 * The prefixes a radius query would scan, center cell first
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CoverageResult {
    
    private GeoPoint origin;
    private double radiusKm;
    private int precision;
    private List<CellResult> cells;
}
