package in.co.bhava.services;

import in.co.bhava.pojos.ZodiacSign;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link HouseGeometry}.
 *
 * Naming convention: test_<scenario>_<expectedBehaviour>
 */
public class HouseGeometryTest {

    private static final double DELTA = 0.0001;

    // =========================================================================
    // Longitudes
    // =========================================================================

    @Test
    public void test_normalizeNegativeAndOverflow_wrapIntoCircle() {
        assertEquals(350.0, HouseGeometry.normalize(-10.0), DELTA);
        assertEquals(10.0, HouseGeometry.normalize(370.0), DELTA);
        assertEquals(0.0, HouseGeometry.normalize(720.0), DELTA);
        assertEquals(0.0, HouseGeometry.normalize(-1e-15), DELTA);
    }

    @Test
    public void test_normalizeNaN_throws() {
        assertThrows(IllegalArgumentException.class, () -> HouseGeometry.normalize(Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> HouseGeometry.normalize(Double.POSITIVE_INFINITY));
    }

    @Test
    public void test_signOfLongitude_boundariesBelongToNextSign() {
        assertEquals(ZodiacSign.ARIES, HouseGeometry.signOfLongitude(0.0));
        assertEquals(ZodiacSign.ARIES, HouseGeometry.signOfLongitude(29.999));
        assertEquals(ZodiacSign.TAURUS, HouseGeometry.signOfLongitude(30.0));
        assertEquals(ZodiacSign.PISCES, HouseGeometry.signOfLongitude(359.99));
    }

    @Test
    public void test_houseOfLongitude_countsFromAscendantDegree() {
        assertEquals(1, HouseGeometry.houseOfLongitude(15.0, 15.0));
        assertEquals(1, HouseGeometry.houseOfLongitude(44.9, 15.0));
        assertEquals(2, HouseGeometry.houseOfLongitude(45.0, 15.0));
        // wraps past 360
        assertEquals(12, HouseGeometry.houseOfLongitude(5.0, 15.0));
        assertEquals(7, HouseGeometry.houseOfLongitude(195.0, 15.0));
    }

    @Test
    public void test_houseOfLongitude_everyPairLandsInOneToTwelve() {
        for (int asc = 0; asc < 360; asc += 7) {
            for (double lon = 0.0; lon < 360.0; lon += 0.5) {
                int house = HouseGeometry.houseOfLongitude(lon, asc + 0.25);
                assertTrue(house >= 1 && house <= 12, "house " + house + " for lon " + lon + " asc " + asc);
            }
        }
        assertEquals(12, HouseGeometry.houseOfLongitude(359.9999999, 0.0));
    }

    @Test
    public void test_houseCenterLongitude_isFifteenDegreesIntoHouse() {
        assertEquals(15.0, HouseGeometry.houseCenterLongitude(1, 0.0), DELTA);
        assertEquals(195.0, HouseGeometry.houseCenterLongitude(7, 0.0), DELTA);
        assertEquals(5.0, HouseGeometry.houseCenterLongitude(12, 20.0), DELTA);
    }

    @Test
    public void test_angularSeparation_takesShortArc() {
        assertEquals(20.0, HouseGeometry.angularSeparation(350.0, 10.0), DELTA);
        assertEquals(180.0, HouseGeometry.angularSeparation(0.0, 180.0), DELTA);
        assertEquals(0.0, HouseGeometry.angularSeparation(42.0, 42.0), DELTA);
    }

    // =========================================================================
    // House counting
    // =========================================================================

    @Test
    public void test_houseDistance_countsInclusively() {
        assertEquals(7, HouseGeometry.houseDistance(1, 7));
        assertEquals(4, HouseGeometry.houseDistance(10, 1));
        assertEquals(12, HouseGeometry.houseDistance(2, 1));
    }

    @Test
    public void test_houseDistanceToSelf_isOneNeverZero() {
        for (int h = 1; h <= 12; h++) {
            assertEquals(1, HouseGeometry.houseDistance(h, h), "self distance of house " + h);
        }
    }

    @Test
    public void test_houseByOffset_wrapsPastTwelve() {
        assertEquals(1, HouseGeometry.houseByOffset(7, 7));
        assertEquals(10, HouseGeometry.houseByOffset(1, 10));
        assertEquals(3, HouseGeometry.houseByOffset(12, 4));
        assertEquals(5, HouseGeometry.houseByOffset(5, 1));
    }

    @Test
    public void test_distanceOfOffset_returnsSameDistance() {
        for (int h = 1; h <= 12; h++) {
            for (int d = 1; d <= 12; d++) {
                int target = HouseGeometry.houseByOffset(h, d);
                assertTrue(target >= 1 && target <= 12);
                assertEquals(d, HouseGeometry.houseDistance(h, target), "h=" + h + " d=" + d);
            }
        }
    }

    @Test
    public void test_invalidHouseOrDistance_throws() {
        assertThrows(IllegalArgumentException.class, () -> HouseGeometry.houseDistance(0, 5));
        assertThrows(IllegalArgumentException.class, () -> HouseGeometry.houseDistance(5, 13));
        assertThrows(IllegalArgumentException.class, () -> HouseGeometry.houseByOffset(1, 0));
        assertThrows(IllegalArgumentException.class, () -> HouseGeometry.signOfHouse(13, ZodiacSign.ARIES));
    }

    @Test
    public void test_signOfHouse_countsFromAscendantSign() {
        assertEquals(ZodiacSign.ARIES, HouseGeometry.signOfHouse(1, ZodiacSign.ARIES));
        assertEquals(ZodiacSign.CAPRICORN, HouseGeometry.signOfHouse(10, ZodiacSign.ARIES));
        assertEquals(ZodiacSign.CANCER, HouseGeometry.signOfHouse(9, ZodiacSign.SCORPIO));
        assertEquals(9, HouseGeometry.houseOfSign(ZodiacSign.CANCER, ZodiacSign.SCORPIO));
    }
}
