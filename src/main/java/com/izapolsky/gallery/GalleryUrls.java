package com.izapolsky.gallery;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import org.apache.http.NameValuePair;
import org.apache.http.client.utils.URLEncodedUtils;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.List;

/**
 * Helpers deriving local names and capture time from gallery image urls.
 * <p>
 * Gallery urls look like {@code https://host/v1/media/42/large?u=2023-05-01T10:00:00&key=...},
 * where the segments after {@value #MEDIA_MARKER} are the media id and the size variant.
 */
public final class GalleryUrls {

    public static final String MEDIA_MARKER = "media";
    public static final String CAPTURED_AT_PARAM = "u";
    public static final String DEFAULT_FILENAME = "image.jpg";
    public static final String DEFAULT_VARIANT = "file";

    private static final Splitter PATH_SPLITTER = Splitter.on('/');
    private static final CharMatcher SLASH = CharMatcher.is('/');

    // 2023-05-01, 2023-05-01T10:00, 2023-05-01T10:00:00.123+01:00
    private static final DateTimeFormatter ISO_LIKE = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
            .appendLiteral('T')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart()
            .appendOffsetId()
            .optionalEnd()
            .optionalEnd()
            .toFormatter();

    private GalleryUrls() {
    }

    /**
     * Local file name for given url, stable for the same url
     *
     * @param url
     * @return
     */
    public static String filenameFromUrl(String url) {
        List<String> segments = pathSegments(url);
        Pair<String, String> media = mediaInfo(segments);
        if (media != null) {
            return String.format("%1$s_%2$s.jpg", media.first, media.second);
        }
        String last = segments.get(segments.size() - 1);
        if (last.isEmpty() || ".".equals(last) || "..".equals(last)) {
            return DEFAULT_FILENAME;
        }
        return last;
    }

    /**
     * Extracts media id and variant, both empty when url has no media marker followed by a segment
     *
     * @param url
     * @return
     */
    public static Pair<String, String> extractMediaInfo(String url) {
        Pair<String, String> media = mediaInfo(pathSegments(url));
        return media != null ? media : new Pair<>("", "");
    }

    private static Pair<String, String> mediaInfo(List<String> segments) {
        int i = segments.indexOf(MEDIA_MARKER);
        if (i < 0 || i + 1 >= segments.size()) {
            return null;
        }
        String variant = i + 2 < segments.size() ? segments.get(i + 2) : DEFAULT_VARIANT;
        return new Pair<>(segments.get(i + 1), variant);
    }

    /**
     * Parses capture time from the {@value #CAPTURED_AT_PARAM} query parameter.
     *
     * @param url
     * @return capture time as naive local date-time, or null when absent or malformed
     */
    public static LocalDateTime parseCapturedAt(String url) {
        String raw = null;
        try {
            for (NameValuePair param : URLEncodedUtils.parse(new URI(url), StandardCharsets.UTF_8)) {
                if (CAPTURED_AT_PARAM.equals(param.getName())) {
                    raw = param.getValue();
                    break;
                }
            }
        } catch (URISyntaxException | IllegalArgumentException e) {
            return null;
        }
        if (Strings.isNullOrEmpty(raw)) {
            return null;
        }
        return parseIsoLike(raw.trim());
    }

    static LocalDateTime parseIsoLike(String value) {
        String stripped = value;
        while (stripped.endsWith("Z")) {
            stripped = stripped.substring(0, stripped.length() - 1);
        }
        try {
            TemporalAccessor parsed = ISO_LIKE.parseBest(stripped, OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
            if (parsed instanceof OffsetDateTime) {
                return ((OffsetDateTime) parsed).toLocalDateTime();
            }
            if (parsed instanceof LocalDateTime) {
                return (LocalDateTime) parsed;
            }
            return ((LocalDate) parsed).atStartOfDay();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    /**
     * Raw path segments, percent-escapes kept, outer slashes trimmed and inner empty segments kept.
     * Never empty, a bare host yields one empty segment.
     */
    private static List<String> pathSegments(String url) {
        String path;
        try {
            path = new URI(url).getRawPath();
        } catch (URISyntaxException e) {
            int queryStart = url.indexOf('?');
            path = queryStart < 0 ? url : url.substring(0, queryStart);
        }
        return PATH_SPLITTER.splitToList(SLASH.trimFrom(Strings.nullToEmpty(path)));
    }
}
