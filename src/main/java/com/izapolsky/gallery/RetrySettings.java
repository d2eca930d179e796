package com.izapolsky.gallery;

/**
 * Timing knobs of both retry layers. Immutable; tests shrink the delays through the constructor.
 */
public final class RetrySettings {

    public static final int DEFAULT_TRANSPORT_RETRIES = 5;
    public static final long DEFAULT_TRANSPORT_BACKOFF_MILLIS = 1000L;
    public static final long DEFAULT_MAX_TRANSPORT_BACKOFF_MILLIS = 120_000L;
    public static final int DEFAULT_REQUEST_TIMEOUT_MILLIS = 30_000;
    public static final long DEFAULT_ATTEMPT_BACKOFF_MILLIS = 2000L;
    public static final long DEFAULT_ATTEMPT_JITTER_MILLIS = 500L;

    public static final RetrySettings DEFAULTS = new RetrySettings(DEFAULT_TRANSPORT_RETRIES,
            DEFAULT_TRANSPORT_BACKOFF_MILLIS, DEFAULT_MAX_TRANSPORT_BACKOFF_MILLIS, DEFAULT_REQUEST_TIMEOUT_MILLIS,
            DEFAULT_ATTEMPT_BACKOFF_MILLIS, DEFAULT_ATTEMPT_JITTER_MILLIS);

    private final int transportRetries;
    private final long transportBackoffMillis;
    private final long maxTransportBackoffMillis;
    private final int requestTimeoutMillis;
    private final long attemptBackoffMillis;
    private final long attemptJitterMillis;

    /**
     * @param transportRetries          retries the http client performs on its own, on top of the first request
     * @param transportBackoffMillis    first transport backoff, doubled on every further retry
     * @param maxTransportBackoffMillis upper bound of a single transport backoff
     * @param requestTimeoutMillis      connect, read and pool lease timeout
     * @param attemptBackoffMillis      whole-operation pause is this times the attempt number
     * @param attemptJitterMillis       random extra pause in [0, value)
     */
    public RetrySettings(int transportRetries, long transportBackoffMillis, long maxTransportBackoffMillis,
                         int requestTimeoutMillis, long attemptBackoffMillis, long attemptJitterMillis) {
        if (transportRetries < 0) {
            throw new IllegalArgumentException(String.format("Negative transport retries: %1$s", transportRetries));
        }
        if (transportBackoffMillis < 0 || maxTransportBackoffMillis < 0 || attemptBackoffMillis < 0 || attemptJitterMillis < 0) {
            throw new IllegalArgumentException("Backoff values must not be negative");
        }
        if (requestTimeoutMillis <= 0) {
            throw new IllegalArgumentException(String.format("Request timeout must be positive: %1$s", requestTimeoutMillis));
        }
        this.transportRetries = transportRetries;
        this.transportBackoffMillis = transportBackoffMillis;
        this.maxTransportBackoffMillis = maxTransportBackoffMillis;
        this.requestTimeoutMillis = requestTimeoutMillis;
        this.attemptBackoffMillis = attemptBackoffMillis;
        this.attemptJitterMillis = attemptJitterMillis;
    }

    public int getTransportRetries() {
        return transportRetries;
    }

    public long getTransportBackoffMillis() {
        return transportBackoffMillis;
    }

    public long getMaxTransportBackoffMillis() {
        return maxTransportBackoffMillis;
    }

    public int getRequestTimeoutMillis() {
        return requestTimeoutMillis;
    }

    public long getAttemptBackoffMillis() {
        return attemptBackoffMillis;
    }

    public long getAttemptJitterMillis() {
        return attemptJitterMillis;
    }
}
