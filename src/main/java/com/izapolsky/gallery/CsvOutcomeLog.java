package com.izapolsky.gallery;

import com.google.common.base.Strings;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.CSVWriter;
import com.opencsv.RFC4180ParserBuilder;
import com.opencsv.exceptions.CsvValidationException;
import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.StandardOpenOption;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Outcome log kept as a UTF-8 CSV file with a header row.
 * <p>
 * Writes from every instance in the process go through one lock, each append opens, writes one row, flushes
 * and closes the file.
 */
public class CsvOutcomeLog implements OutcomeLog {

    private static final Logger LOG = LoggerFactory.getLogger(CsvOutcomeLog.class);

    public static final String[] HEADERS = {
            "timestamp", "status", "attempts", "http_status",
            "media_id", "variant", "filename", "url", "error"
    };

    static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    private static final ReentrantLock WRITE_LOCK = new ReentrantLock();

    private final File logFile;
    private final ZoneId zone;

    public CsvOutcomeLog(File logFile) {
        this(logFile, ZoneId.systemDefault());
    }

    public CsvOutcomeLog(File logFile, ZoneId zone) {
        this.logFile = logFile;
        this.zone = zone;
    }

    @Override
    public void ensureInitialized() {
        WRITE_LOCK.lock();
        try {
            if (logFile.length() > 0) {
                return;
            }
            File parent = logFile.getAbsoluteFile().getParentFile();
            if (parent != null) {
                FileUtils.forceMkdir(parent);
            }
            try (CSVWriter writer = new CSVWriter(open(StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.WRITE))) {
                writer.writeNext(HEADERS, false);
            }
            LOG.debug("Created outcome log {}", logFile);
        } catch (IOException e) {
            throw new UncheckedIOException(String.format("Failed to initialize log %1$s", logFile.getAbsolutePath()), e);
        } finally {
            WRITE_LOCK.unlock();
        }
    }

    @Override
    public void append(FetchOutcome outcome) {
        String[] row = toRow(outcome);
        WRITE_LOCK.lock();
        try (CSVWriter writer = new CSVWriter(open(StandardOpenOption.CREATE, StandardOpenOption.APPEND))) {
            writer.writeNext(row, false);
            writer.flush();
        } catch (IOException e) {
            throw new UncheckedIOException(String.format("Failed writing to %1$s", logFile.getAbsolutePath()), e);
        } finally {
            WRITE_LOCK.unlock();
        }
    }

    /**
     * Folds rows to the last status per url, so a url that failed and later succeeded is not returned.
     * Rows too short to carry status and url are skipped.
     */
    @Override
    public List<String> readFailingUrls() {
        Map<String, String> lastStatus = readLastStatuses();
        List<String> failing = new ArrayList<>();
        for (Map.Entry<String, String> entry : lastStatus.entrySet()) {
            if (!STATUS_SUCCESS.equals(entry.getValue())) {
                failing.add(entry.getKey());
            }
        }
        return failing;
    }

    /**
     * @return url to most recent status, keyed in order of first appearance
     */
    public Map<String, String> readLastStatuses() {
        Map<String, String> lastStatus = new LinkedHashMap<>();
        if (!logFile.isFile()) {
            return lastStatus;
        }
        try (Reader reader = Files.newBufferedReader(logFile.toPath(), StandardCharsets.UTF_8);
             CSVReader csv = newReader(reader)) {
            String[] header = csv.readNext();
            if (header == null) {
                return lastStatus;
            }
            List<String> columns = Arrays.asList(header);
            int statusColumn = columns.indexOf("status");
            int urlColumn = columns.indexOf("url");
            if (statusColumn < 0 || urlColumn < 0) {
                throw new IllegalStateException(String.format("Log %1$s has no status/url columns: %2$s",
                        logFile.getAbsolutePath(), columns));
            }

            String[] row;
            while ((row = csv.readNext()) != null) {
                if (row.length <= Math.max(statusColumn, urlColumn)) {
                    continue;
                }
                String url = row[urlColumn];
                if (!Strings.isNullOrEmpty(url)) {
                    lastStatus.put(url, row[statusColumn]);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException(String.format("Failed to read %1$s", logFile.getAbsolutePath()), e);
        } catch (CsvValidationException e) {
            throw new IllegalStateException(String.format("Malformed log %1$s", logFile.getAbsolutePath()), e);
        }
        return lastStatus;
    }

    protected String[] toRow(FetchOutcome outcome) {
        return new String[]{
                outcome.getTimestamp() == null ? "" : TIMESTAMP_FORMAT.format(outcome.getTimestamp().atZone(zone)),
                outcome.isSuccess() ? STATUS_SUCCESS : STATUS_FAILED,
                String.valueOf(outcome.getAttempts()),
                str(outcome.getHttpStatus()),
                str(outcome.getMediaId()),
                str(outcome.getVariant()),
                str(outcome.getFilename()),
                outcome.getUrl(),
                outcome.isSuccess() ? "" : str(outcome.getErrorMessage())
        };
    }

    /**
     * Reader symmetric to {@link CSVWriter}: only quotes are escaped, by doubling, backslashes are plain text
     */
    static CSVReader newReader(Reader reader) {
        return new CSVReaderBuilder(reader)
                .withCSVParser(new RFC4180ParserBuilder().build())
                .build();
    }

    private Writer open(StandardOpenOption... options) throws IOException {
        return Files.newBufferedWriter(logFile.toPath(), StandardCharsets.UTF_8, options);
    }

    private static String str(Object val) {
        return val == null ? "" : val.toString();
    }
}
