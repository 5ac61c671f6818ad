package com.crowd.exception;

/**
 * One batch chunk of a density recompute pass could not be committed.
 * Logged by the pass and never propagated to the mutation that triggered it.
 */
public class RecomputeChunkFailedException extends RuntimeException {

    private final String groupPrefix;
    private final int chunkIndex;

    public RecomputeChunkFailedException(String groupPrefix, int chunkIndex, int chunkSize, Throwable cause) {
        super(String.format("Recompute chunk %d (%d signals) for group '%s' failed: %s",
                            chunkIndex, chunkSize, groupPrefix, cause.getMessage()), cause);
        this.groupPrefix = groupPrefix;
        this.chunkIndex = chunkIndex;
    }

    public String getGroupPrefix() {
        return groupPrefix;
    }

    public int getChunkIndex() {
        return chunkIndex;
    }
}
