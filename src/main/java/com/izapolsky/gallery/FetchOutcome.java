package com.izapolsky.gallery;

import java.time.Instant;

/**
 * Result of one complete fetch of one target. Never mutated once built.
 */
public final class FetchOutcome {

    private final String url;
    private final boolean success;
    private final int attempts;
    private final Integer httpStatus;
    private final String mediaId;
    private final String variant;
    private final String filename;
    private final String errorMessage;
    private final String advisory;
    private final Instant timestamp;

    private FetchOutcome(String url, boolean success, int attempts, Integer httpStatus, String filename,
                         String errorMessage, String advisory, Instant timestamp) {
        if (attempts < 1) {
            throw new IllegalArgumentException(String.format("Attempts must be positive for %1$s", url));
        }
        Pair<String, String> media = GalleryUrls.extractMediaInfo(url);
        this.url = url;
        this.success = success;
        this.attempts = attempts;
        this.httpStatus = httpStatus;
        this.mediaId = media.first;
        this.variant = media.second;
        this.filename = filename != null ? filename : GalleryUrls.filenameFromUrl(url);
        this.errorMessage = success ? null : errorMessage;
        this.advisory = advisory;
        this.timestamp = timestamp;
    }

    public static FetchOutcome success(String url, int attempts, Integer httpStatus, String filename, String advisory,
                                       Instant timestamp) {
        return new FetchOutcome(url, true, attempts, httpStatus, filename, null, advisory, timestamp);
    }

    public static FetchOutcome failure(String url, int attempts, Integer httpStatus, String filename, String errorMessage,
                                       Instant timestamp) {
        return new FetchOutcome(url, false, attempts, httpStatus, filename, errorMessage, null, timestamp);
    }

    public String getUrl() {
        return url;
    }

    public boolean isSuccess() {
        return success;
    }

    public int getAttempts() {
        return attempts;
    }

    /**
     * @return last observed status, null when no response was ever received
     */
    public Integer getHttpStatus() {
        return httpStatus;
    }

    public String getMediaId() {
        return mediaId;
    }

    public String getVariant() {
        return variant;
    }

    public String getFilename() {
        return filename;
    }

    /**
     * @return failure reason, always null for successful outcomes
     */
    public String getErrorMessage() {
        return errorMessage;
    }

    /**
     * @return non-fatal note, e.g. metadata could not be written
     */
    public String getAdvisory() {
        return advisory;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return String.format("%1$s %2$s after %3$d attempt(s), status %4$s%5$s", success ? "saved" : "failed", url,
                attempts, httpStatus, errorMessage == null ? "" : ": " + errorMessage);
    }
}
