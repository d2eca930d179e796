package com.izapolsky.gallery;

/**
 * Supplies the gallery urls to download together with the headers and referer to send
 */
public interface UrlSource {
    /**
     * Discovers image urls, in gallery order and without duplicates
     * @return
     */
    GallerySession discover();
}
