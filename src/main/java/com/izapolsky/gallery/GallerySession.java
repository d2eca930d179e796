package com.izapolsky.gallery;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Urls of one gallery plus the request headers and referer needed to fetch them
 */
public final class GallerySession {

    private final ImmutableList<String> urls;
    private final ImmutableMap<String, String> headers;
    private final String referer;

    /**
     * @param urls    duplicates are dropped, first occurrence wins
     * @param headers
     * @param referer may be null
     */
    public GallerySession(Collection<String> urls, Map<String, String> headers, String referer) {
        this.urls = ImmutableList.copyOf(new LinkedHashSet<>(urls));
        this.headers = headers == null ? ImmutableMap.of() : ImmutableMap.copyOf(headers);
        this.referer = referer;
    }

    public ImmutableList<String> getUrls() {
        return urls;
    }

    public ImmutableMap<String, String> getHeaders() {
        return headers;
    }

    public String getReferer() {
        return referer;
    }

    public boolean isEmpty() {
        return urls.isEmpty();
    }

    public List<FetchTarget> toTargets() {
        List<FetchTarget> targets = new ArrayList<>(urls.size());
        for (String url : urls) {
            targets.add(new FetchTarget(url, referer, headers));
        }
        return targets;
    }
}
