package com.izapolsky.gallery;

import org.apache.commons.imaging.Imaging;
import org.apache.commons.imaging.common.ImageMetadata;
import org.apache.commons.imaging.common.RationalNumber;
import org.apache.commons.imaging.formats.jpeg.JpegImageMetadata;
import org.apache.commons.imaging.formats.tiff.TiffField;
import org.apache.commons.imaging.formats.tiff.TiffImageMetadata;
import org.apache.commons.imaging.formats.tiff.constants.ExifTagConstants;
import org.apache.commons.imaging.formats.tiff.constants.GpsTagConstants;
import org.apache.commons.imaging.formats.tiff.taginfos.TagInfo;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

/** Utility methods for building JPEG fixtures and reading back their EXIF in tests. */
public final class ImageTestData {
    private ImageTestData() {}

    public static byte[] jpeg(int width, int height) throws IOException {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        try {
            g.setColor(Color.ORANGE);
            g.fillRect(0, 0, width, height);
            g.setColor(Color.BLUE);
            g.fillRect(0, 0, width / 2, height / 2);
        } finally {
            g.dispose();
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ImageIO.write(image, "jpg", out);
        return out.toByteArray();
    }

    public static TiffImageMetadata exif(byte[] jpeg) throws IOException {
        ImageMetadata metadata = Imaging.getMetadata(jpeg);
        if (!(metadata instanceof JpegImageMetadata)) {
            return null;
        }
        return ((JpegImageMetadata) metadata).getExif();
    }

    public static String dateTimeOriginal(byte[] jpeg) throws IOException {
        return stringField(jpeg, ExifTagConstants.EXIF_TAG_DATE_TIME_ORIGINAL);
    }

    public static String stringField(byte[] jpeg, TagInfo tag) throws IOException {
        TiffImageMetadata exif = exif(jpeg);
        if (exif == null) {
            return null;
        }
        TiffField field = exif.findField(tag);
        return field == null ? null : field.getStringValue().trim();
    }

    public static double latitude(byte[] jpeg) throws IOException {
        return signed(degrees(jpeg, GpsTagConstants.GPS_TAG_GPS_LATITUDE),
                stringField(jpeg, GpsTagConstants.GPS_TAG_GPS_LATITUDE_REF), "S");
    }

    public static double longitude(byte[] jpeg) throws IOException {
        return signed(degrees(jpeg, GpsTagConstants.GPS_TAG_GPS_LONGITUDE),
                stringField(jpeg, GpsTagConstants.GPS_TAG_GPS_LONGITUDE_REF), "W");
    }

    private static double degrees(byte[] jpeg, TagInfo tag) throws IOException {
        TiffField field = exif(jpeg).findField(tag);
        RationalNumber[] dms = (RationalNumber[]) field.getValue();
        return dms[0].doubleValue() + dms[1].doubleValue() / 60.0 + dms[2].doubleValue() / 3600.0;
    }

    private static double signed(double abs, String ref, String negativeRef) {
        return negativeRef.equals(ref) ? -abs : abs;
    }
}
