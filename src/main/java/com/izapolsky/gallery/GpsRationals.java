package com.izapolsky.gallery;

import com.google.common.math.LongMath;
import org.apache.commons.imaging.common.RationalNumber;

/**
 * Sexagesimal decomposition of a signed decimal degree into EXIF degree/minute/second rationals.
 */
public final class GpsRationals {

    /**
     * Seconds are kept to 4 decimal places
     */
    static final long SECONDS_SCALE = 10_000L;

    private final long degrees;
    private final long minutes;
    private final long secondsNumerator;
    private final long secondsDenominator;
    private final boolean negative;

    private GpsRationals(long degrees, long minutes, long secondsNumerator, long secondsDenominator, boolean negative) {
        this.degrees = degrees;
        this.minutes = minutes;
        this.secondsNumerator = secondsNumerator;
        this.secondsDenominator = secondsDenominator;
        this.negative = negative;
    }

    public static GpsRationals fromDecimalDegrees(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException(String.format("Not a coordinate: %1$s", value));
        }
        double abs = Math.abs(value);
        long d = (long) Math.floor(abs);
        double minutesFloat = (abs - d) * 60;
        long m = (long) Math.floor(minutesFloat);
        long scaledSeconds = Math.round((minutesFloat - m) * 60 * SECONDS_SCALE);

        // 59.99999s rounds to a full minute
        if (scaledSeconds >= 60 * SECONDS_SCALE) {
            scaledSeconds -= 60 * SECONDS_SCALE;
            m++;
        }
        if (m >= 60) {
            m -= 60;
            d++;
        }

        long gcd = scaledSeconds == 0 ? SECONDS_SCALE : LongMath.gcd(scaledSeconds, SECONDS_SCALE);
        return new GpsRationals(d, m, scaledSeconds / gcd, SECONDS_SCALE / gcd, value < 0);
    }

    public long getDegrees() {
        return degrees;
    }

    public long getMinutes() {
        return minutes;
    }

    public long getSecondsNumerator() {
        return secondsNumerator;
    }

    public long getSecondsDenominator() {
        return secondsDenominator;
    }

    public boolean isNegative() {
        return negative;
    }

    /**
     * @param positiveRef reference letter for non-negative values, N or E
     * @param negativeRef reference letter for negative values, S or W
     * @return
     */
    public String hemisphere(String positiveRef, String negativeRef) {
        return negative ? negativeRef : positiveRef;
    }

    public RationalNumber[] toRationals() {
        return new RationalNumber[]{
                new RationalNumber((int) degrees, 1),
                new RationalNumber((int) minutes, 1),
                new RationalNumber((int) secondsNumerator, (int) secondsDenominator)
        };
    }

    public double toDecimalDegrees() {
        double abs = degrees + minutes / 60.0 + ((double) secondsNumerator / secondsDenominator) / 3600.0;
        return negative ? -abs : abs;
    }

    @Override
    public String toString() {
        return String.format("%1$d deg %2$d' %3$d/%4$d\" %5$s", degrees, minutes, secondsNumerator, secondsDenominator,
                negative ? "-" : "+");
    }
}
