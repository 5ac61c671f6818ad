package com.crowd.model.base;

import lombok.Data;
import lombok.experimental.SuperBuilder;
import lombok.NoArgsConstructor;
import lombok.AllArgsConstructor;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;

/**
 * Generic base class for search results
 */
@Data
@SuperBuilder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public abstract class BaseSearchResult<T, ID> implements Serializable {
    
    /**
     * Result identifier
     */
    private ID id;
    
    /**
     * The matched entity
     */
    private T entity;
}
