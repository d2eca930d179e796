package com.izapolsky.gallery;

import org.apache.commons.imaging.Imaging;
import org.apache.commons.imaging.common.ImageMetadata;
import org.apache.commons.imaging.formats.jpeg.JpegImageMetadata;
import org.apache.commons.imaging.formats.jpeg.exif.ExifRewriter;
import org.apache.commons.imaging.formats.tiff.TiffImageMetadata;
import org.apache.commons.imaging.formats.tiff.constants.ExifTagConstants;
import org.apache.commons.imaging.formats.tiff.constants.GpsTagConstants;
import org.apache.commons.imaging.formats.tiff.constants.TiffTagConstants;
import org.apache.commons.imaging.formats.tiff.write.TiffOutputDirectory;
import org.apache.commons.imaging.formats.tiff.write.TiffOutputSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Iterator;

/**
 * EXIF based rewriter for JPEG images.
 * <p>
 * Pixels are re-encoded through ImageIO at fixed quality, then the EXIF block built from the source
 * image (or an empty one when the source carries none or it is unreadable) is inserted.
 */
public class ExifMetadataRewriter implements MetadataRewriter {

    private static final Logger LOG = LoggerFactory.getLogger(ExifMetadataRewriter.class);

    public static final float JPEG_QUALITY = 0.95f;
    public static final DateTimeFormatter EXIF_DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy:MM:dd HH:mm:ss");

    private static final byte[] GPS_VERSION = {2, 3, 0, 0};

    @Override
    public RewriteResult rewrite(byte[] rawBytes, LocalDateTime capturedAt, Double latitude, Double longitude) {
        try {
            TiffOutputSet outputSet = existingOrEmpty(rawBytes);
            if (capturedAt != null) {
                applyCapturedAt(outputSet, capturedAt);
            }
            if (latitude != null && longitude != null) {
                applyLocation(outputSet, latitude, longitude);
            }

            byte[] reencoded = reencode(rawBytes);
            if (outputSet.getDirectories().isEmpty()) {
                return RewriteResult.rewritten(reencoded);
            }
            ByteArrayOutputStream out = new ByteArrayOutputStream(reencoded.length + 1024);
            new ExifRewriter().updateExifMetadataLossless(reencoded, out, outputSet);
            return RewriteResult.rewritten(out.toByteArray());
        } catch (IOException | RuntimeException e) {
            return RewriteResult.unchanged(rawBytes, String.format("EXIF write failed: %1$s", e.getMessage()));
        }
    }

    /**
     * Starts from source EXIF so orientation and camera fields survive
     */
    protected TiffOutputSet existingOrEmpty(byte[] rawBytes) {
        try {
            ImageMetadata metadata = Imaging.getMetadata(rawBytes);
            if (metadata instanceof JpegImageMetadata) {
                TiffImageMetadata exif = ((JpegImageMetadata) metadata).getExif();
                if (exif != null) {
                    TiffOutputSet outputSet = exif.getOutputSet();
                    if (outputSet != null) {
                        return outputSet;
                    }
                }
            }
        } catch (IOException | RuntimeException e) {
            LOG.debug("Unreadable source metadata, starting from empty EXIF: {}", e.getMessage());
        }
        return new TiffOutputSet();
    }

    protected void applyCapturedAt(TiffOutputSet outputSet, LocalDateTime capturedAt) throws IOException {
        String stamp = EXIF_DATE_FORMAT.format(capturedAt);

        TiffOutputDirectory root = outputSet.getOrCreateRootDirectory();
        root.removeField(TiffTagConstants.TIFF_TAG_DATE_TIME);
        root.add(TiffTagConstants.TIFF_TAG_DATE_TIME, stamp);

        TiffOutputDirectory exif = outputSet.getOrCreateExifDirectory();
        exif.removeField(ExifTagConstants.EXIF_TAG_DATE_TIME_ORIGINAL);
        exif.add(ExifTagConstants.EXIF_TAG_DATE_TIME_ORIGINAL, stamp);
        exif.removeField(ExifTagConstants.EXIF_TAG_DATE_TIME_DIGITIZED);
        exif.add(ExifTagConstants.EXIF_TAG_DATE_TIME_DIGITIZED, stamp);
    }

    protected void applyLocation(TiffOutputSet outputSet, double latitude, double longitude) throws IOException {
        GpsRationals lat = GpsRationals.fromDecimalDegrees(latitude);
        GpsRationals lon = GpsRationals.fromDecimalDegrees(longitude);

        TiffOutputDirectory gps = outputSet.getOrCreateGpsDirectory();
        gps.removeField(GpsTagConstants.GPS_TAG_GPS_VERSION_ID);
        gps.add(GpsTagConstants.GPS_TAG_GPS_VERSION_ID, GPS_VERSION);
        gps.removeField(GpsTagConstants.GPS_TAG_GPS_LATITUDE_REF);
        gps.add(GpsTagConstants.GPS_TAG_GPS_LATITUDE_REF, lat.hemisphere("N", "S"));
        gps.removeField(GpsTagConstants.GPS_TAG_GPS_LATITUDE);
        gps.add(GpsTagConstants.GPS_TAG_GPS_LATITUDE, lat.toRationals());
        gps.removeField(GpsTagConstants.GPS_TAG_GPS_LONGITUDE_REF);
        gps.add(GpsTagConstants.GPS_TAG_GPS_LONGITUDE_REF, lon.hemisphere("E", "W"));
        gps.removeField(GpsTagConstants.GPS_TAG_GPS_LONGITUDE);
        gps.add(GpsTagConstants.GPS_TAG_GPS_LONGITUDE, lon.toRationals());
    }

    /**
     * Decodes and re-encodes as baseline RGB JPEG
     *
     * @param rawBytes
     * @return
     * @throws IOException when bytes are not a decodable image
     */
    protected byte[] reencode(byte[] rawBytes) throws IOException {
        BufferedImage decoded = ImageIO.read(new ByteArrayInputStream(rawBytes));
        if (decoded == null) {
            throw new IOException("no ImageIO reader understands the downloaded bytes");
        }

        BufferedImage rgb = new BufferedImage(decoded.getWidth(), decoded.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = rgb.createGraphics();
        try {
            g.drawImage(decoded, 0, 0, null);
        } finally {
            g.dispose();
        }

        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
        if (!writers.hasNext()) {
            throw new IOException("no JPEG writer available");
        }
        ImageWriter writer = writers.next();
        ByteArrayOutputStream out = new ByteArrayOutputStream(rawBytes.length);
        try (ImageOutputStream ios = ImageIO.createImageOutputStream(out)) {
            ImageWriteParam param = writer.getDefaultWriteParam();
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            param.setCompressionQuality(JPEG_QUALITY);
            writer.setOutput(ios);
            writer.write(null, new IIOImage(rgb, null, null), param);
        } finally {
            writer.dispose();
        }
        return out.toByteArray();
    }
}
