package com.izapolsky.gallery;

import com.google.common.base.Strings;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URL;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Discovers image urls from a gallery page saved to disk, taking the widest {@code srcset} candidate of each image.
 */
public class GalleryPageSource implements UrlSource {

    private static final Logger LOG = LoggerFactory.getLogger(GalleryPageSource.class);

    public static final String DEFAULT_IMAGE_SELECTOR = "img";

    private static final Pattern WIDTH_CANDIDATE = Pattern.compile("(\\S+)\\s+(\\d+)w$");
    private static final Pattern ABSOLUTE_URL = Pattern.compile("^https?://.*");

    private final File page;
    private final String baseUrl;
    private final String imageSelector;
    private final String urlFilter;
    private final Map<String, String> headers;
    private final String referer;

    /**
     * @param page          saved html
     * @param baseUrl       url the page was saved from, used to resolve relative sources; may be null
     * @param imageSelector css selector for image elements
     * @param urlFilter     keep only urls containing this text; null keeps all
     * @param headers
     * @param referer       defaults to base url when null
     */
    public GalleryPageSource(File page, String baseUrl, String imageSelector, String urlFilter,
                             Map<String, String> headers, String referer) {
        this.page = page;
        this.baseUrl = Strings.nullToEmpty(baseUrl);
        this.imageSelector = Strings.isNullOrEmpty(imageSelector) ? DEFAULT_IMAGE_SELECTOR : imageSelector;
        this.urlFilter = Strings.emptyToNull(urlFilter);
        this.headers = headers;
        this.referer = referer != null ? referer : Strings.emptyToNull(baseUrl);
    }

    @Override
    public GallerySession discover() {
        Document doc;
        try {
            //TODO - encoding detection, saved pages are assumed utf-8
            doc = Jsoup.parse(page, "utf-8", baseUrl);
        } catch (IOException e) {
            throw new RuntimeException(String.format("Failed processing page %1$s", page.getAbsolutePath()), e);
        }

        List<String> urls = new ArrayList<>();
        for (Element img : doc.select(imageSelector)) {
            String url = img.hasAttr("srcset") && !img.attr("srcset").trim().isEmpty()
                    ? resolve(pickLargestFromSrcset(img.attr("srcset")))
                    : img.absUrl("src");
            if (Strings.isNullOrEmpty(url)) {
                continue;
            }
            if (urlFilter == null || url.contains(urlFilter)) {
                urls.add(url);
            }
        }
        LOG.debug("Found {} image urls in {}", urls.size(), page);
        return new GallerySession(urls, headers, referer);
    }

    /**
     * Widest {@code w} candidate wins; without width descriptors the first absolute candidate is used.
     *
     * @param srcset
     * @return candidate url, null if none qualifies
     */
    static String pickLargestFromSrcset(String srcset) {
        String best = null;
        long bestWidth = -1;
        for (String candidate : srcset.split(",")) {
            String trimmed = candidate.trim();
            Matcher m = WIDTH_CANDIDATE.matcher(trimmed);
            if (m.matches()) {
                long width = Long.parseLong(m.group(2));
                if (width > bestWidth) {
                    best = m.group(1);
                    bestWidth = width;
                }
            } else if (best == null && ABSOLUTE_URL.matcher(trimmed).matches()) {
                best = trimmed.split("\\s+")[0];
            }
        }
        return best;
    }

    private String resolve(String candidate) {
        if (candidate == null) {
            return null;
        }
        if (ABSOLUTE_URL.matcher(candidate).matches()) {
            return candidate;
        }
        if (baseUrl.isEmpty()) {
            return null;
        }
        try {
            return new URL(new URL(baseUrl), candidate).toString();
        } catch (MalformedURLException e) {
            LOG.debug("Skipping unresolvable srcset candidate {}: {}", candidate, e.getMessage());
            return null;
        }
    }
}
