package com.izapolsky.gallery;

/**
 * Callback interface to notify that a target of a pipeline run has been processed
 */
public interface ProgressListener {

    ProgressListener NONE = (label, completed, total, outcome) -> {
    };

    /**
     * Called from the orchestrating thread after the outcome was logged, in completion order
     *
     * @param label     name of the pass, e.g. Downloading or Retrying
     * @param completed targets finished so far, including this one
     * @param total     targets scheduled in this pass
     * @param outcome
     */
    void notifyCompleted(String label, int completed, int total, FetchOutcome outcome);
}
