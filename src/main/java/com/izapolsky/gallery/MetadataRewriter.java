package com.izapolsky.gallery;

import java.time.LocalDateTime;

/**
 * Embeds capture time and location into image bytes. Implementations must not perform I/O.
 */
public interface MetadataRewriter {

    /**
     * Produces new image bytes carrying given metadata.
     *
     * @param rawBytes   image as downloaded
     * @param capturedAt capture time, may be null
     * @param latitude   may be null, ignored unless longitude is given too
     * @param longitude  may be null, ignored unless latitude is given too
     * @return rewritten bytes, or the original bytes with an advisory when rewriting failed
     */
    RewriteResult rewrite(byte[] rawBytes, LocalDateTime capturedAt, Double latitude, Double longitude);

    /**
     * Outcome of a rewrite: bytes to persist plus optional advisory
     */
    final class RewriteResult {
        private final byte[] bytes;
        private final String advisory;

        private RewriteResult(byte[] bytes, String advisory) {
            this.bytes = bytes;
            this.advisory = advisory;
        }

        public static RewriteResult rewritten(byte[] bytes) {
            return new RewriteResult(bytes, null);
        }

        public static RewriteResult unchanged(byte[] original, String advisory) {
            return new RewriteResult(original, advisory);
        }

        public byte[] getBytes() {
            return bytes;
        }

        /**
         * @return why the original bytes were kept, null when rewrite succeeded
         */
        public String getAdvisory() {
            return advisory;
        }

        public boolean isRewritten() {
            return advisory == null;
        }
    }
}
