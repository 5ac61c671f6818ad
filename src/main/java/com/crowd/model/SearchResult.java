package com.crowd.model;

import lombok.Data;
import lombok.experimental.SuperBuilder;
import lombok.AllArgsConstructor;
import lombok.NoArgsConstructor;
import lombok.EqualsAndHashCode;
import com.crowd.model.base.BaseSearchResult;

/**
 * Proximity search hit with its exact distance from the query origin
 */
@Data
@SuperBuilder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = true)
public class SearchResult<T> extends BaseSearchResult<T, String> {
    
    private double distanceKm;
}
