package com.izapolsky.gallery;

import com.google.common.collect.ImmutableSet;
import com.google.common.primitives.Longs;
import org.apache.http.Header;
import org.apache.http.HttpEntityEnclosingRequest;
import org.apache.http.HttpHeaders;
import org.apache.http.HttpRequest;
import org.apache.http.HttpResponse;
import org.apache.http.client.HttpRequestRetryHandler;
import org.apache.http.client.ServiceUnavailableRetryStrategy;
import org.apache.http.client.protocol.HttpClientContext;
import org.apache.http.client.utils.DateUtils;
import org.apache.http.protocol.HttpContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Date;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Transport level retries for idempotent requests: I/O failures and transient statuses, with exponential
 * backoff and {@code Retry-After} support.
 * <p>
 * HttpClient asks {@link #getRetryInterval()} on the executing thread right after a positive
 * {@link #retryRequest(HttpResponse, int, HttpContext)}, so the pending interval is kept per thread.
 * <p>
 * I/O and status retries draw from one budget per execution, counted in the request context, since HttpClient
 * restarts the I/O execution count on every status retry.
 */
public class TransportRetryPolicy implements HttpRequestRetryHandler, ServiceUnavailableRetryStrategy {

    private static final Logger LOG = LoggerFactory.getLogger(TransportRetryPolicy.class);

    public static final Set<Integer> RETRYABLE_STATUSES = ImmutableSet.of(429, 500, 502, 503, 504);

    static final String RETRIES_USED = "gallery.transport.retries-used";

    private final int maxRetries;
    private final long backoffMillis;
    private final long maxBackoffMillis;
    private final ThreadLocal<Long> pendingInterval = ThreadLocal.withInitial(() -> 0L);

    public TransportRetryPolicy(RetrySettings settings) {
        this(settings.getTransportRetries(), settings.getTransportBackoffMillis(), settings.getMaxTransportBackoffMillis());
    }

    public TransportRetryPolicy(int maxRetries, long backoffMillis, long maxBackoffMillis) {
        this.maxRetries = maxRetries;
        this.backoffMillis = backoffMillis;
        this.maxBackoffMillis = maxBackoffMillis;
    }

    @Override
    public boolean retryRequest(IOException exception, int executionCount, HttpContext context) {
        if (executionCount > maxRetries) {
            return false;
        }
        HttpRequest request = HttpClientContext.adapt(context).getRequest();
        if (request instanceof HttpEntityEnclosingRequest) {
            return false;
        }
        int retry = claimRetry(context);
        if (retry < 0) {
            return false;
        }
        long delay = backoffFor(retry);
        LOG.debug("Transport retry {}/{} after {} ms: {}", retry, maxRetries, delay, exception.toString());
        try {
            TimeUnit.MILLISECONDS.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
        return true;
    }

    @Override
    public boolean retryRequest(HttpResponse response, int executionCount, HttpContext context) {
        int status = response.getStatusLine().getStatusCode();
        if (!RETRYABLE_STATUSES.contains(status) || executionCount > maxRetries) {
            return false;
        }
        int retry = claimRetry(context);
        if (retry < 0) {
            return false;
        }
        Long retryAfter = retryAfterMillis(response, System.currentTimeMillis());
        long delay = retryAfter != null ? retryAfter : backoffFor(retry);
        pendingInterval.set(delay);
        LOG.debug("Transport retry {}/{} on HTTP {} after {} ms", retry, maxRetries, status, delay);
        return true;
    }

    @Override
    public long getRetryInterval() {
        long interval = pendingInterval.get();
        pendingInterval.remove();
        return interval;
    }

    /**
     * Takes one retry from the budget of this execution
     *
     * @param context
     * @return 1 based number of the retry, -1 when the budget is spent
     */
    int claimRetry(HttpContext context) {
        Object used = context.getAttribute(RETRIES_USED);
        int retry = (used instanceof Integer ? (Integer) used : 0) + 1;
        if (retry > maxRetries) {
            return -1;
        }
        context.setAttribute(RETRIES_USED, retry);
        return retry;
    }

    /**
     * Exponential backoff: base, 2*base, 4*base ... capped
     *
     * @param retryNumber 1 based
     * @return
     */
    long backoffFor(int retryNumber) {
        if (backoffMillis == 0) {
            return 0;
        }
        int shift = Math.min(Math.max(retryNumber - 1, 0), 30);
        long delay = backoffMillis << shift;
        if (delay < 0 || delay > maxBackoffMillis) {
            return maxBackoffMillis;
        }
        return delay;
    }

    /**
     * Reads {@code Retry-After} as delta seconds or HTTP date.
     *
     * @param response
     * @param nowMillis
     * @return delay, null when header missing or unparseable
     */
    static Long retryAfterMillis(HttpResponse response, long nowMillis) {
        Header header = response.getFirstHeader(HttpHeaders.RETRY_AFTER);
        if (header == null || header.getValue() == null) {
            return null;
        }
        String value = header.getValue().trim();
        Long seconds = Longs.tryParse(value);
        if (seconds != null) {
            return Math.max(seconds, 0) * 1000L;
        }
        Date date = DateUtils.parseDate(value);
        if (date == null) {
            return null;
        }
        return Math.max(date.getTime() - nowMillis, 0);
    }
}
