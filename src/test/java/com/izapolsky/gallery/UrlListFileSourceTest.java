package com.izapolsky.gallery;

import com.google.common.collect.ImmutableMap;
import org.junit.Test;

import java.io.File;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class UrlListFileSourceTest {

    @Test
    public void testReadsUniqueUrlsSkippingCommentsAndBlanks() throws Exception {
        File urls = new File(getClass().getResource("/urls.txt").toURI());
        GallerySession session = new UrlListFileSource(urls, ImmutableMap.of("Cookie", "a=b"), "https://gallery.example.com/").discover();

        assertEquals(Arrays.asList("https://api.example.com/v1/media/1/large", "https://api.example.com/v1/media/2/large"),
                session.getUrls());

        List<FetchTarget> targets = session.toTargets();
        assertEquals(2, targets.size());
        assertEquals("https://gallery.example.com/", targets.get(0).getReferer());
        assertEquals("a=b", targets.get(1).getHeaders().get("Cookie"));
    }

    @Test(expected = RuntimeException.class)
    public void testMissingFile() {
        new UrlListFileSource(new File("does-not-exist-urls.txt"), null, null).discover();
    }

    @Test
    public void testNoHeadersNoReferer() throws Exception {
        File urls = new File(getClass().getResource("/urls.txt").toURI());
        FetchTarget target = new UrlListFileSource(urls, null, null).discover().toTargets().get(0);

        assertEquals(null, target.getReferer());
        assertTrue(target.getHeaders().isEmpty());
    }
}
