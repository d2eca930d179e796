package com.izapolsky.gallery;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Aggregate of one pipeline pass
 */
public final class PipelineResult {

    private final int successCount;
    private final int failureCount;
    private final ImmutableList<FetchTarget> failingTargets;

    public PipelineResult(int successCount, int failureCount, List<FetchTarget> failingTargets) {
        this.successCount = successCount;
        this.failureCount = failureCount;
        this.failingTargets = ImmutableList.copyOf(failingTargets);
    }

    public int getSuccessCount() {
        return successCount;
    }

    public int getFailureCount() {
        return failureCount;
    }

    public int getTotal() {
        return successCount + failureCount;
    }

    /**
     * @return failed targets in the order their failures were observed
     */
    public ImmutableList<FetchTarget> getFailingTargets() {
        return failingTargets;
    }

    @Override
    public String toString() {
        return String.format("Total: %1$d  |  Saved: %2$d  |  Failed: %3$d", getTotal(), successCount, failureCount);
    }
}
