package com.izapolsky.gallery;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class FetchPipelineTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private CsvOutcomeLog outcomeLog;
    private ScriptedFetcher fetcher;
    private List<int[]> progress;

    /**
     * Fails urls listed in {@link #failing}, crashes on urls containing "crash", records concurrency
     */
    static class ScriptedFetcher implements UrlFetcher {
        final Set<String> failing = ConcurrentHashMap.newKeySet();
        final Map<String, AtomicInteger> calls = new ConcurrentHashMap<>();
        final AtomicInteger inFlight = new AtomicInteger();
        final AtomicInteger maxInFlight = new AtomicInteger();

        @Override
        public FetchOutcome fetch(FetchTarget target, FetchOptions options) {
            calls.computeIfAbsent(target.getUrl(), u -> new AtomicInteger()).incrementAndGet();
            int now = inFlight.incrementAndGet();
            maxInFlight.accumulateAndGet(now, Math::max);
            try {
                Thread.sleep(5);
                if (target.getUrl().contains("crash")) {
                    throw new IllegalStateException("worker blew up");
                }
                if (failing.contains(target.getUrl())) {
                    return FetchOutcome.failure(target.getUrl(), options.getMaxAttempts(), 503, null, "HTTP 503", Instant.now());
                }
                return FetchOutcome.success(target.getUrl(), 1, 200, null, null, Instant.now());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return FetchOutcome.failure(target.getUrl(), 1, null, null, "interrupted", Instant.now());
            } finally {
                inFlight.decrementAndGet();
            }
        }
    }

    @Before
    public void setUp() throws Exception {
        outcomeLog = new CsvOutcomeLog(new File(folder.getRoot(), "download_log.csv"));
        outcomeLog.ensureInitialized();
        fetcher = new ScriptedFetcher();
        progress = Collections.synchronizedList(new ArrayList<>());
    }

    private FetchPipeline pipeline() {
        return new FetchPipeline(fetcher, outcomeLog, (label, completed, total, outcome) -> progress.add(new int[]{completed, total}));
    }

    private static List<FetchTarget> targets(int count) {
        List<FetchTarget> result = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            result.add(FetchTarget.of(String.format("https://host/v1/media/%1$d/large", i)));
        }
        return result;
    }

    @Test
    public void testMixedOutcomes() {
        List<FetchTarget> targets = targets(10);
        fetcher.failing.add(targets.get(2).getUrl());
        fetcher.failing.add(targets.get(7).getUrl());

        PipelineResult result = pipeline().run(targets, 4, FetchOptions.withoutMetadata(3));

        assertEquals(8, result.getSuccessCount());
        assertEquals(2, result.getFailureCount());
        assertEquals(10, result.getTotal());
        assertEquals(new HashSet<>(Arrays.asList(targets.get(2), targets.get(7))), new HashSet<>(result.getFailingTargets()));
        assertEquals(new HashSet<>(Arrays.asList(targets.get(2).getUrl(), targets.get(7).getUrl())),
                new HashSet<>(outcomeLog.readFailingUrls()));
        for (FetchTarget target : targets) {
            assertEquals("each target fetched once", 1, fetcher.calls.get(target.getUrl()).get());
        }
    }

    @Test
    public void testProgressIsReportedPerCompletion() {
        pipeline().run(targets(6), 3, FetchOptions.withoutMetadata(1));

        assertEquals(6, progress.size());
        for (int i = 0; i < progress.size(); i++) {
            assertEquals(i + 1, progress.get(i)[0]);
            assertEquals(6, progress.get(i)[1]);
        }
    }

    @Test
    public void testConcurrencyIsBounded() {
        pipeline().run(targets(30), 3, FetchOptions.withoutMetadata(1));

        assertTrue("max in flight " + fetcher.maxInFlight.get(), fetcher.maxInFlight.get() <= 3);
    }

    @Test
    public void testConcurrencyBelowOneMeansOne() {
        PipelineResult result = pipeline().run(targets(5), 0, FetchOptions.withoutMetadata(1));

        assertEquals(5, result.getSuccessCount());
        assertEquals(1, fetcher.maxInFlight.get());
    }

    @Test
    public void testEmptyTargetList() {
        PipelineResult result = pipeline().run(Collections.emptyList(), 8, FetchOptions.withoutMetadata(1));

        assertEquals(0, result.getTotal());
        assertTrue(progress.isEmpty());
    }

    @Test
    public void testCrashingWorkerBecomesFailure() {
        List<FetchTarget> targets = new ArrayList<>(targets(3));
        FetchTarget crashing = FetchTarget.of("https://host/v1/media/crash/large");
        targets.add(crashing);

        PipelineResult result = pipeline().run(targets, 2, FetchOptions.withoutMetadata(1));

        assertEquals(3, result.getSuccessCount());
        assertEquals(Collections.singletonList(crashing), result.getFailingTargets());
        assertEquals(Collections.singletonList(crashing.getUrl()), outcomeLog.readFailingUrls());
    }

    @Test
    public void testLogFailureDoesNotStopPipeline() {
        OutcomeLog broken = new OutcomeLog() {
            @Override
            public void ensureInitialized() {
            }

            @Override
            public void append(FetchOutcome outcome) {
                throw new IllegalStateException("disk full");
            }

            @Override
            public List<String> readFailingUrls() {
                return Collections.emptyList();
            }
        };

        PipelineResult result = new FetchPipeline(fetcher, broken, null).run(targets(4), 2, FetchOptions.withoutMetadata(1));

        assertEquals(4, result.getSuccessCount());
    }

    @Test
    public void testRetryPassRecoversAndLogReflectsLatestStatus() {
        List<FetchTarget> targets = targets(5);
        fetcher.failing.add(targets.get(0).getUrl());
        fetcher.failing.add(targets.get(3).getUrl());
        FetchPipeline pipeline = pipeline();

        PipelineResult primary = pipeline.run(targets, 2, FetchOptions.withoutMetadata(1));
        assertEquals(2, primary.getFailureCount());

        fetcher.failing.remove(targets.get(3).getUrl());
        PipelineResult retry = pipeline.run(FetchPipeline.LABEL_RETRYING, primary.getFailingTargets(), 2, FetchOptions.withoutMetadata(1));

        assertEquals(1, retry.getSuccessCount());
        assertEquals(1, retry.getFailureCount());
        assertEquals(Collections.singletonList(targets.get(0).getUrl()), outcomeLog.readFailingUrls());
        assertFalse(outcomeLog.readFailingUrls().contains(targets.get(3).getUrl()));
    }
}
