package com.izapolsky.gallery;

/**
 * Per-run options of a fetch: metadata patch and whole-operation attempt budget
 */
public final class FetchOptions {

    public static final int DEFAULT_MAX_ATTEMPTS = 5;

    private final boolean metadataEnabled;
    private final Double latitude;
    private final Double longitude;
    private final int maxAttempts;

    public FetchOptions(boolean metadataEnabled, Double latitude, Double longitude, int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException(String.format("At least one attempt required, got %1$s", maxAttempts));
        }
        this.metadataEnabled = metadataEnabled;
        this.latitude = latitude;
        this.longitude = longitude;
        this.maxAttempts = maxAttempts;
    }

    public static FetchOptions withoutMetadata(int maxAttempts) {
        return new FetchOptions(false, null, null, maxAttempts);
    }

    public boolean isMetadataEnabled() {
        return metadataEnabled;
    }

    public Double getLatitude() {
        return latitude;
    }

    public Double getLongitude() {
        return longitude;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }
}
