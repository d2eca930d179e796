package com.izapolsky.gallery;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Fans targets out over a bounded worker pool and records every outcome in completion order.
 * <p>
 * A pipeline can be run more than once, typically a primary pass followed by a retry pass over
 * {@link PipelineResult#getFailingTargets()}.
 */
public class FetchPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(FetchPipeline.class);

    public static final int DEFAULT_CONCURRENCY = 8;
    public static final String LABEL_DOWNLOADING = "Downloading";
    public static final String LABEL_RETRYING = "Retrying";

    private final UrlFetcher fetcher;
    private final OutcomeLog outcomeLog;
    private final ProgressListener progressListener;

    public FetchPipeline(UrlFetcher fetcher, OutcomeLog outcomeLog, ProgressListener progressListener) {
        this.fetcher = fetcher;
        this.outcomeLog = outcomeLog;
        this.progressListener = progressListener == null ? ProgressListener.NONE : progressListener;
    }

    public PipelineResult run(List<FetchTarget> targets, int concurrency, FetchOptions options) {
        return run(LABEL_DOWNLOADING, targets, concurrency, options);
    }

    /**
     * Processes every target exactly once. Blocks until all of them are done.
     *
     * @param label       pass name handed to the progress listener
     * @param targets
     * @param concurrency pool size, values below 1 mean 1
     * @param options
     * @return counts and failing targets in observed order
     */
    public PipelineResult run(String label, List<FetchTarget> targets, int concurrency, FetchOptions options) {
        int poolSize = Math.max(1, concurrency);
        ExecutorService ioBoundService = new ThreadPoolExecutor(poolSize, poolSize, 0, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(), new ThreadFactoryBuilder().setNameFormat("fetch-%d").setDaemon(true).build());
        CompletionService<FetchOutcome> completions = new ExecutorCompletionService<>(ioBoundService);

        int successes = 0;
        int failures = 0;
        List<FetchTarget> failing = new ArrayList<>();
        try {
            Map<Future<FetchOutcome>, FetchTarget> scheduled = new HashMap<>(targets.size() * 2);
            for (FetchTarget target : targets) {
                scheduled.put(completions.submit(() -> fetcher.fetch(target, options)), target);
            }

            int total = scheduled.size();
            for (int completed = 1; completed <= total; completed++) {
                Future<FetchOutcome> done = completions.take();
                FetchTarget target = scheduled.get(done);
                FetchOutcome outcome = outcomeOf(done, target);

                record(outcome);
                if (outcome.isSuccess()) {
                    successes++;
                } else {
                    failures++;
                    failing.add(target);
                }
                progressListener.notifyCompleted(label, completed, total, outcome);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException(String.format("Interrupted while %1$s %2$s targets", label, targets.size()), e);
        } finally {
            ioBoundService.shutdownNow();
        }

        PipelineResult result = new PipelineResult(successes, failures, failing);
        LOG.info("{} finished: {}", label, result);
        return result;
    }

    /**
     * A worker that throws anyway still yields a failure row for its target
     */
    protected FetchOutcome outcomeOf(Future<FetchOutcome> done, FetchTarget target) throws InterruptedException {
        try {
            return done.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            LOG.error("Fetch of {} crashed", target, cause);
            return FetchOutcome.failure(target.getUrl(), 1, null, null, String.valueOf(cause), Instant.now());
        }
    }

    private void record(FetchOutcome outcome) {
        try {
            outcomeLog.append(outcome);
        } catch (RuntimeException e) {
            LOG.error("Could not log outcome of {}", outcome.getUrl(), e);
        }
    }
}
