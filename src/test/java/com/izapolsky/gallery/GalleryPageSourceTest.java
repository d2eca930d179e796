package com.izapolsky.gallery;

import org.junit.Before;
import org.junit.Test;

import java.io.File;
import java.util.Arrays;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

public class GalleryPageSourceTest {

    private static final String BASE = "https://api.example.com/gallery/2023";

    private File page;

    @Before
    public void setUp() throws Exception {
        page = new File(getClass().getResource("/gallery.html").toURI());
    }

    @Test
    public void testPicksWidestCandidateAndFilters() {
        GallerySession session = new GalleryPageSource(page, BASE, null, "api.example.com", null, null).discover();

        assertEquals(Arrays.asList(
                "https://api.example.com/v1/media/101/full",
                "https://api.example.com/v1/media/102/large?u=2023-05-01T10:00:00",
                "https://api.example.com/v1/media/103/large"), session.getUrls());
        assertEquals("referer defaults to base url", BASE, session.getReferer());
    }

    @Test
    public void testWithoutFilterKeepsEverything() {
        GallerySession session = new GalleryPageSource(page, BASE, "img", null, null, "https://other.example.com/").discover();

        assertEquals(4, session.getUrls().size());
        assertEquals("https://cdn.example.org/static/logo.png", session.getUrls().get(3));
        assertEquals("https://other.example.com/", session.getReferer());
    }

    @Test
    public void testRelativeCandidatesDroppedWithoutBase() {
        GallerySession session = new GalleryPageSource(page, null, null, "/media/", null, null).discover();

        assertEquals(Arrays.asList(
                "https://api.example.com/v1/media/101/full",
                "https://api.example.com/v1/media/102/large?u=2023-05-01T10:00:00"), session.getUrls());
        assertNull(session.getReferer());
    }

    @Test
    public void testSelectorNarrowsImages() {
        GallerySession session = new GalleryPageSource(page, BASE, "picture img", null, null, null).discover();

        assertEquals(Arrays.asList("https://api.example.com/v1/media/101/full"), session.getUrls());
    }

    @Test
    public void testPickLargestFromSrcset() {
        assertEquals("b.jpg", GalleryPageSource.pickLargestFromSrcset("a.jpg 100w, b.jpg 900w, c.jpg 300w"));
        assertEquals("https://h/x.jpg", GalleryPageSource.pickLargestFromSrcset("https://h/x.jpg 2x"));
        assertEquals("https://h/y.jpg", GalleryPageSource.pickLargestFromSrcset("https://h/x.jpg 2x, https://h/y.jpg 10w"));
        assertNull(GalleryPageSource.pickLargestFromSrcset("x.jpg 2x"));
        assertNull(GalleryPageSource.pickLargestFromSrcset(" "));
    }
}
