package com.izapolsky.gallery;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;

import java.util.Map;
import java.util.Objects;

/**
 * One url to download, with the request headers and referer shared by its run
 */
public final class FetchTarget {

    private final String url;
    private final String referer;
    private final ImmutableMap<String, String> headers;

    public FetchTarget(String url, String referer, Map<String, String> headers) {
        if (Strings.isNullOrEmpty(url)) {
            throw new IllegalArgumentException("Target url is required");
        }
        this.url = url;
        this.referer = Strings.emptyToNull(referer);
        this.headers = headers == null ? ImmutableMap.of() : ImmutableMap.copyOf(headers);
    }

    public static FetchTarget of(String url) {
        return new FetchTarget(url, null, null);
    }

    public String getUrl() {
        return url;
    }

    /**
     * @return referer, null if none
     */
    public String getReferer() {
        return referer;
    }

    public ImmutableMap<String, String> getHeaders() {
        return headers;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FetchTarget)) {
            return false;
        }
        FetchTarget that = (FetchTarget) o;
        return url.equals(that.url) && Objects.equals(referer, that.referer) && headers.equals(that.headers);
    }

    @Override
    public int hashCode() {
        return Objects.hash(url, referer, headers);
    }

    @Override
    public String toString() {
        return url;
    }
}
