package com.izapolsky.gallery;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class GpsRationalsTest {

    @Test
    public void testWholeDegrees() {
        GpsRationals lat = GpsRationals.fromDecimalDegrees(51.0);
        assertEquals(51, lat.getDegrees());
        assertEquals(0, lat.getMinutes());
        assertEquals(0, lat.getSecondsNumerator());
        assertEquals("N", lat.hemisphere("N", "S"));
    }

    @Test
    public void testNegativeLongitude() {
        GpsRationals lon = GpsRationals.fromDecimalDegrees(-3.163831280770506);
        assertTrue(lon.isNegative());
        assertEquals("W", lon.hemisphere("E", "W"));
        assertEquals(3, lon.getDegrees());
        assertEquals(9, lon.getMinutes());
        assertEquals(-3.163831280770506, lon.toDecimalDegrees(), 0.0003);
    }

    @Test
    public void testSecondsKeepFourDecimals() {
        // 51.49009034271866 -> 51 deg 29' 24.3252"
        GpsRationals lat = GpsRationals.fromDecimalDegrees(51.49009034271866);
        assertEquals(51, lat.getDegrees());
        assertEquals(29, lat.getMinutes());
        assertEquals(24.3252, (double) lat.getSecondsNumerator() / lat.getSecondsDenominator(), 1e-9);
        assertTrue(lat.getSecondsDenominator() <= GpsRationals.SECONDS_SCALE);
    }

    @Test
    public void testSecondsAreReduced() {
        GpsRationals half = GpsRationals.fromDecimalDegrees(10.5);
        assertEquals(30, half.getMinutes());
        assertEquals(0, half.getSecondsNumerator());
        assertEquals(1, half.getSecondsDenominator());

        GpsRationals quarterSecond = GpsRationals.fromDecimalDegrees(1 + 0.25 / 3600);
        assertEquals(1, quarterSecond.getSecondsNumerator());
        assertEquals(4, quarterSecond.getSecondsDenominator());
    }

    @Test
    public void testRoundingCarriesIntoMinutesAndDegrees() {
        GpsRationals almost = GpsRationals.fromDecimalDegrees(9.99999999999);
        assertEquals(10, almost.getDegrees());
        assertEquals(0, almost.getMinutes());
        assertEquals(0, almost.getSecondsNumerator());
    }

    @Test
    public void testZeroIsNorthEast() {
        GpsRationals zero = GpsRationals.fromDecimalDegrees(0.0);
        assertFalse(zero.isNegative());
        assertEquals("E", zero.hemisphere("E", "W"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRejectsNaN() {
        GpsRationals.fromDecimalDegrees(Double.NaN);
    }
}
