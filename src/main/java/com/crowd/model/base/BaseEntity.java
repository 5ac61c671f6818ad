package com.crowd.model.base;

import lombok.Data;
import lombok.experimental.SuperBuilder;
import lombok.NoArgsConstructor;
import lombok.AllArgsConstructor;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;
import java.time.Instant;

/**
 * Base entity with common fields using generics
 * Provides the identity and write bookkeeping shared by every stored document
 */
@Data
@SuperBuilder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public abstract class BaseEntity<ID> implements Serializable {
    
    /**
     * Unique identifier for the entity
     */
    private ID id;
    
    /**
     * Creation timestamp
     */
    private Instant createdAt;
    
    /**
     * Timestamp of the last successful write
     */
    private Instant updatedAt;
    
    /**
     * Write counter maintained by the store, used as a precondition for batch writes
     */
    private long version;
}
