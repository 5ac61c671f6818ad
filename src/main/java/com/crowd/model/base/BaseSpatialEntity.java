package com.crowd.model.base;

import lombok.Data;
import lombok.experimental.SuperBuilder;
import lombok.NoArgsConstructor;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import com.crowd.geohash.GeohashCodec;
import com.crowd.model.GeoPoint;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Base spatial entity with a point location and its geohash cell
 * The cell is an index key derived from the location, never independent state
 */
@Data
@SuperBuilder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public abstract class BaseSpatialEntity<ID> extends BaseEntity<ID> {
    
    /**
     * Point location of the entity
     */
    private GeoPoint location;
    
    /**
     * Geohash of the location at the configured precision
     */
    private String cell;
    
    /**
     * Set the location and re-derive the cell from it
     */
    public void locate(GeoPoint location, int precision) {
        this.location = location;
        this.cell = GeohashCodec.encode(location.getLatitude(), location.getLongitude(), precision);
    }
    
    /**
     * Prefix of the cell used to group co-located entities
     */
    public String cellPrefix(int precision) {
        return cell == null ? null : GeohashCodec.truncate(cell, precision);
    }
}
