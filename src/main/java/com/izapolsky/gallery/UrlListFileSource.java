package com.izapolsky.gallery;

import org.apache.commons.io.FileUtils;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads urls from a plain text file, one per line. Blank lines and lines starting with # are skipped.
 */
public class UrlListFileSource implements UrlSource {

    private final File urlsFile;
    private final Map<String, String> headers;
    private final String referer;

    public UrlListFileSource(File urlsFile, Map<String, String> headers, String referer) {
        this.urlsFile = urlsFile;
        this.headers = headers;
        this.referer = referer;
    }

    @Override
    public GallerySession discover() {
        List<String> lines;
        try {
            lines = FileUtils.readLines(urlsFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException(String.format("Failed to read url list %1$s", urlsFile.getAbsolutePath()), e);
        }

        List<String> urls = new ArrayList<>(lines.size());
        for (String line : lines) {
            String trimmed = line.trim();
            if (!trimmed.isEmpty() && !trimmed.startsWith("#")) {
                urls.add(trimmed);
            }
        }
        return new GallerySession(urls, headers, referer);
    }
}
