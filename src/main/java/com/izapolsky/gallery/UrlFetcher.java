package com.izapolsky.gallery;

/**
 * Service for downloading a single gallery image
 */
public interface UrlFetcher {

    /**
     * Downloads target into the output directory, retrying the whole operation as needed.
     * Per-target problems are reported in the outcome, never thrown.
     *
     * @param target
     * @param options
     * @return
     */
    FetchOutcome fetch(FetchTarget target, FetchOptions options);
}
