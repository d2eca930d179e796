package com.izapolsky.gallery;

import java.util.List;

/**
 * Durable, append-only record of fetch outcomes across runs
 */
public interface OutcomeLog {

    String STATUS_SUCCESS = "success";
    String STATUS_FAILED = "failed";

    /**
     * Creates the log with its header row unless it already exists
     */
    void ensureInitialized();

    /**
     * Appends exactly one row; safe to call from several workers at once
     *
     * @param outcome
     */
    void append(FetchOutcome outcome);

    /**
     * Urls whose most recent row is not a success, in order of first appearance
     *
     * @return
     */
    List<String> readFailingUrls();
}
