package com.izapolsky.gallery;

import ch.qos.logback.classic.Level;
import com.beust.jcommander.DynamicParameter;
import com.beust.jcommander.IValueValidator;
import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.beust.jcommander.validators.PositiveInteger;
import org.apache.commons.io.FileUtils;
import org.apache.http.impl.client.CloseableHttpClient;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Main entry point for the gallery fetcher
 */
public class Main {

    public static final double DEFAULT_LATITUDE = 51.49009034271866;
    public static final double DEFAULT_LONGITUDE = -3.163831280770506;

    public static class ReadableFileValidator implements IValueValidator<File> {
        @Override
        public void validate(String name, File value) throws ParameterException {
            if (value != null && (!value.isFile() || !value.canRead())) {
                throw new ParameterException(String.format("Parameter %1$s (%2$s) has to be readable file", name, value.getAbsolutePath()));
            }
        }
    }

    public static class Args {
        @Parameter(names = {"-v", "--debug"}, description = "Verbose mode")
        public boolean debug;

        @Parameter(names = {"-o", "--out-dir"}, description = "Output directory for images")
        public File outputDir = new File("gallery");

        @Parameter(names = "--log-file", description = "CSV log file")
        public File logFile = new File("download_log.csv");

        @Parameter(names = "--lat", description = "GPS latitude to embed")
        public Double latitude = DEFAULT_LATITUDE;

        @Parameter(names = "--lon", description = "GPS longitude to embed")
        public Double longitude = DEFAULT_LONGITUDE;

        @Parameter(names = "--skip-exif", description = "Do not write EXIF date/GPS")
        public boolean skipExif;

        @Parameter(names = "--retry-failed", description = "Retry failed URLs from a previous CSV log")
        public boolean retryFailed;

        @Parameter(names = "--no-prompt", description = "Skip interactive retry prompt at the end")
        public boolean noPrompt;

        @Parameter(names = "--workers", description = "Number of parallel download workers", validateWith = PositiveInteger.class)
        public int workers = FetchPipeline.DEFAULT_CONCURRENCY;

        @Parameter(names = "--max-tries", description = "Per-file attempts (wrapper retries)", validateWith = PositiveInteger.class)
        public int maxTries = FetchOptions.DEFAULT_MAX_ATTEMPTS;

        @Parameter(names = "--urls-file", description = "Text file with one image url per line", validateValueWith = ReadableFileValidator.class)
        public File urlsFile;

        @Parameter(names = "--gallery-page", description = "Saved gallery html page to take image urls from", validateValueWith = ReadableFileValidator.class)
        public File galleryPage;

        @Parameter(names = "--base-url", description = "Url the gallery page was saved from")
        public String baseUrl;

        @Parameter(names = "--url-contains", description = "Keep only gallery page urls containing this text")
        public String urlContains;

        @DynamicParameter(names = "-H", assignment = ":", description = "Request header, e.g. -H Cookie:session=abc")
        public Map<String, String> headers = new LinkedHashMap<>();

        @Parameter(names = "--referer", description = "Referer sent with every image request")
        public String referer;

        @Parameter(names = {"-h", "--help"}, help = true, description = "Displays help")
        public boolean showHelp;

        @Parameter(names = "--keep-going", description = "Do not kill JVM on exit", hidden = true)
        public boolean keepGoing = false;
    }

    public static void main(String... args) {
        Args parsedCmdLine = new Args();
        JCommander jc = JCommander.newBuilder()
                .addObject(parsedCmdLine)
                .programName(Main.class.getName())
                .build();
        jc.parse(args);

        if (parsedCmdLine.showHelp) {
            jc.usage();
            return;
        }

        new Main(parsedCmdLine);

        if (!parsedCmdLine.keepGoing) {
            System.exit(0);
        }
    }

    private final InputStream in;
    private final PrintStream out;

    public Main(Args parsedArgs) {
        this(parsedArgs, System.in, System.out);
    }

    public Main(Args parsedArgs, InputStream in, PrintStream out) {
        this.in = in;
        this.out = out;
        execute(parsedArgs);
    }

    protected void execute(Args parsedArgs) {
        if (parsedArgs.debug) {
            enableDebugLogging();
        }

        Map<String, String> headers = trimmed(parsedArgs.headers);
        UrlSource source = parsedArgs.retryFailed ? null : createSource(parsedArgs, headers);

        CsvOutcomeLog outcomeLog = new CsvOutcomeLog(parsedArgs.logFile);
        outcomeLog.ensureInitialized();
        try {
            FileUtils.forceMkdir(parsedArgs.outputDir);
        } catch (IOException e) {
            throw new RuntimeException(String.format("Failed to create output directory %1$s", parsedArgs.outputDir.getAbsolutePath()), e);
        }

        List<FetchTarget> targets;
        if (parsedArgs.retryFailed) {
            List<String> urls = outcomeLog.readFailingUrls();
            if (urls.isEmpty()) {
                out.println("No failed URLs found in log; nothing to retry.");
                return;
            }
            out.println(String.format("Retrying %1$d previously failed URLs...", urls.size()));
            // retried urls are expected to carry their own signed parameters
            targets = new GallerySession(urls, headers, parsedArgs.referer).toTargets();
        } else {
            GallerySession session = source.discover();
            if (session.isEmpty()) {
                out.println("No images detected; check the gallery page or url list.");
                return;
            }
            out.println(String.format("Found %1$d images", session.getUrls().size()));
            targets = session.toTargets();
        }

        FetchOptions options = new FetchOptions(!parsedArgs.skipExif, parsedArgs.latitude, parsedArgs.longitude, parsedArgs.maxTries);
        RetrySettings settings = retrySettings();

        try (CloseableHttpClient chc = ImageHttpClients.create(settings)) {
            FetchPipeline pipeline = new FetchPipeline(
                    new UrlFetcherImpl(chc, parsedArgs.outputDir, new ExifMetadataRewriter(), settings),
                    outcomeLog, new ConsoleProgressListener(out));

            PipelineResult primary = pipeline.run(FetchPipeline.LABEL_DOWNLOADING, targets, parsedArgs.workers, options);

            out.println();
            out.println("--- Summary ---");
            out.println(primary);
            out.println(String.format("Log: %1$s", parsedArgs.logFile.getAbsolutePath()));

            if (!parsedArgs.retryFailed && primary.getFailureCount() > 0 && !parsedArgs.noPrompt) {
                offerRetry(pipeline, primary, parsedArgs, options);
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to release http client", e);
        }
    }

    protected void offerRetry(FetchPipeline pipeline, PipelineResult primary, Args parsedArgs, FetchOptions options) {
        out.print("Retry the failed downloads now? [y/N]: ");
        out.flush();
        if (!"y".equalsIgnoreCase(readAnswer())) {
            out.println("Okay, not retrying now. You can run again later with --retry-failed.");
            return;
        }

        List<FetchTarget> failed = new ArrayList<>(primary.getFailingTargets());
        Collections.shuffle(failed);
        out.println(String.format("Retrying %1$d failed items...", failed.size()));
        PipelineResult retry = pipeline.run(FetchPipeline.LABEL_RETRYING, failed, parsedArgs.workers, options);
        out.println(String.format("Retry complete. Recovered: %1$d  |  Still failing: %2$d",
                retry.getSuccessCount(), retry.getFailureCount()));
        out.println(String.format("Updated log: %1$s", parsedArgs.logFile.getAbsolutePath()));
    }

    protected UrlSource createSource(Args parsedArgs, Map<String, String> headers) {
        if (parsedArgs.urlsFile != null && parsedArgs.galleryPage != null) {
            throw new ParameterException("Use either --urls-file or --gallery-page, not both");
        }
        if (parsedArgs.urlsFile != null) {
            return new UrlListFileSource(parsedArgs.urlsFile, headers, parsedArgs.referer);
        }
        if (parsedArgs.galleryPage != null) {
            return new GalleryPageSource(parsedArgs.galleryPage, parsedArgs.baseUrl, GalleryPageSource.DEFAULT_IMAGE_SELECTOR,
                    parsedArgs.urlContains, headers, parsedArgs.referer);
        }
        throw new ParameterException("One of --urls-file, --gallery-page or --retry-failed is required");
    }

    protected RetrySettings retrySettings() {
        return RetrySettings.DEFAULTS;
    }

    private String readAnswer() {
        try {
            String line = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8)).readLine();
            return line == null ? "" : line.trim();
        } catch (IOException e) {
            throw new RuntimeException("Failed to read answer from console", e);
        }
    }

    private static Map<String, String> trimmed(Map<String, String> headers) {
        Map<String, String> result = new LinkedHashMap<>();
        for (Map.Entry<String, String> header : headers.entrySet()) {
            result.put(header.getKey().trim(), header.getValue().trim());
        }
        return result;
    }

    private static void enableDebugLogging() {
        org.slf4j.Logger logger = LoggerFactory.getLogger(Main.class.getPackage().getName());
        if (logger instanceof ch.qos.logback.classic.Logger) {
            ((ch.qos.logback.classic.Logger) logger).setLevel(Level.DEBUG);
        }
    }
}
