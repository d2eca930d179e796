package com.izapolsky.gallery;

import org.apache.commons.io.FileUtils;
import org.apache.http.HttpEntity;
import org.apache.http.HttpHeaders;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * Fetcher implementation: GET through the shared retrying client, optional EXIF rewrite, atomic save.
 */
public class UrlFetcherImpl implements UrlFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(UrlFetcherImpl.class);

    private static final byte[] NO_BODY = new byte[0];

    private final CloseableHttpClient chc;
    private final File outputDir;
    private final MetadataRewriter metadataRewriter;
    private final RetrySettings settings;

    public UrlFetcherImpl(CloseableHttpClient chc, File outputDir, MetadataRewriter metadataRewriter, RetrySettings settings) {
        this.chc = chc;
        this.outputDir = outputDir;
        this.metadataRewriter = metadataRewriter;
        this.settings = settings;
    }

    @Override
    public FetchOutcome fetch(FetchTarget target, FetchOptions options) {
        String url = target.getUrl();
        String filename = GalleryUrls.filenameFromUrl(url);
        LocalDateTime capturedAt = GalleryUrls.parseCapturedAt(url);
        int maxAttempts = options.getMaxAttempts();

        Integer httpStatus = null;
        String pendingError = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                Pair<Integer, byte[]> response = download(target);
                httpStatus = response.first;
                byte[] body = response.second;

                if (isSuccessStatus(httpStatus) && body.length > 0) {
                    Pair<byte[], String> patched = options.isMetadataEnabled()
                            ? applyMetadata(url, body, capturedAt, options)
                            : new Pair<>(body, null);
                    File destination = persist(filename, patched.first);
                    applyModificationTime(destination, capturedAt);
                    LOG.debug("Saved {} as {} on attempt {}", url, destination, attempt);
                    return FetchOutcome.success(url, attempt, httpStatus, filename, patched.second, Instant.now());
                }

                pendingError = isSuccessStatus(httpStatus)
                        ? String.format("Empty body (HTTP %1$d)", httpStatus)
                        : String.format("HTTP %1$d", httpStatus);
            } catch (IOException | RuntimeException e) {
                pendingError = describe(e);
            }

            LOG.debug("Attempt {}/{} for {} failed: {}", attempt, maxAttempts, url, pendingError);
            if (attempt < maxAttempts && !pause(attempt)) {
                return FetchOutcome.failure(url, attempt, httpStatus, filename,
                        String.format("Interrupted after: %1$s", pendingError), Instant.now());
            }
        }

        return FetchOutcome.failure(url, maxAttempts, httpStatus, filename, pendingError, Instant.now());
    }

    /**
     * One GET through the shared client; transport retries happen inside the client.
     *
     * @param target
     * @return final status and body, body is empty unless status is 2xx
     * @throws IOException when transport retries are exhausted
     */
    protected Pair<Integer, byte[]> download(FetchTarget target) throws IOException {
        HttpGet imageGet = new HttpGet(target.getUrl());
        for (Map.Entry<String, String> header : target.getHeaders().entrySet()) {
            imageGet.setHeader(header.getKey(), header.getValue());
        }
        if (target.getReferer() != null) {
            imageGet.setHeader(HttpHeaders.REFERER, target.getReferer());
        }

        try (CloseableHttpResponse response = chc.execute(imageGet)) {
            int status = response.getStatusLine().getStatusCode();
            HttpEntity entity = response.getEntity();
            if (!isSuccessStatus(status) || entity == null) {
                EntityUtils.consumeQuietly(entity);
                return new Pair<>(status, NO_BODY);
            }
            byte[] body = EntityUtils.toByteArray(entity);
            return new Pair<>(status, body == null ? NO_BODY : body);
        }
    }

    /**
     * @return bytes to save and advisory, advisory is null when metadata went in fine
     */
    protected Pair<byte[], String> applyMetadata(String url, byte[] body, LocalDateTime capturedAt, FetchOptions options) {
        MetadataRewriter.RewriteResult result;
        try {
            result = metadataRewriter.rewrite(body, capturedAt, options.getLatitude(), options.getLongitude());
        } catch (RuntimeException e) {
            result = MetadataRewriter.RewriteResult.unchanged(body, String.format("EXIF write failed: %1$s", describe(e)));
        }
        if (!result.isRewritten()) {
            LOG.warn("Keeping original bytes of {}: {}", url, result.getAdvisory());
        }
        return new Pair<>(result.getBytes(), result.getAdvisory());
    }

    /**
     * Writes to a temporary sibling, then moves it over the final name. Same-named targets replace each other.
     *
     * @param filename
     * @param data
     * @return
     * @throws IOException
     */
    protected File persist(String filename, byte[] data) throws IOException {
        FileUtils.forceMkdir(outputDir);
        File destination = new File(outputDir, filename);
        File temp = File.createTempFile(".fetch-", ".part", outputDir);
        try {
            FileUtils.writeByteArrayToFile(temp, data);
            try {
                Files.move(temp.toPath(), destination.toPath(), StandardCopyOption.REPLACE_EXISTING,
                        StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp.toPath(), destination.toPath(), StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            FileUtils.deleteQuietly(temp);
        }
        return destination;
    }

    /**
     * Best effort, capture time is naive so it is read in the system zone
     */
    protected void applyModificationTime(File destination, LocalDateTime capturedAt) {
        if (capturedAt == null) {
            return;
        }
        try {
            Instant instant = capturedAt.atZone(ZoneId.systemDefault()).toInstant();
            Files.setLastModifiedTime(destination.toPath(), FileTime.from(instant));
        } catch (IOException | RuntimeException e) {
            LOG.debug("Could not set modification time of {}: {}", destination, e.getMessage());
        }
    }

    /**
     * Sleeps 2s * attempt plus jitter before the next whole-operation attempt.
     *
     * @param attempt
     * @return false when interrupted
     */
    protected boolean pause(int attempt) {
        long jitter = settings.getAttemptJitterMillis() > 0
                ? ThreadLocalRandom.current().nextLong(settings.getAttemptJitterMillis())
                : 0;
        try {
            TimeUnit.MILLISECONDS.sleep(settings.getAttemptBackoffMillis() * attempt + jitter);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    protected static boolean isSuccessStatus(int status) {
        return status >= 200 && status < 300;
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getName();
    }
}
