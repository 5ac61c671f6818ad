package com.crowd.model.result;

import lombok.Data;
import lombok.Builder;
import lombok.AllArgsConstructor;
import lombok.NoArgsConstructor;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.crowd.model.DensityTier;

/**
 * Outcome of one density recompute pass over a cell group
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RecomputeResult {
    
    private String groupPrefix;
    private int peopleCount;
    private DensityTier tier;
    private int signalsUpdated;
    private int chunksCommitted;
    private int chunksFailed;
    
    public boolean isComplete() {
        return chunksFailed == 0;
    }
}
