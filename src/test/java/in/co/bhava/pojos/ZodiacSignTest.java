package in.co.bhava.pojos;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ZodiacSignTest {

    @Test
    public void testFromNumber() {
        assertEquals(ZodiacSign.ARIES, ZodiacSign.fromNumber(1));
        assertEquals(ZodiacSign.PISCES, ZodiacSign.fromNumber(12));
        assertThrows(IllegalArgumentException.class, () -> ZodiacSign.fromNumber(0));
        assertThrows(IllegalArgumentException.class, () -> ZodiacSign.fromNumber(13));
    }

    @Test
    public void testFromName_CaseInsensitive() {
        assertEquals(ZodiacSign.SAGITTARIUS, ZodiacSign.fromName("SAGITTARIUS"));
        assertEquals(ZodiacSign.LIBRA, ZodiacSign.fromName("libra"));
        assertThrows(IllegalArgumentException.class, () -> ZodiacSign.fromName(null));
        assertThrows(IllegalArgumentException.class, () -> ZodiacSign.fromName("Ophiuchus"));
    }

    @Test
    public void testPlus_WrapsPastPisces() {
        assertEquals(ZodiacSign.ARIES, ZodiacSign.PISCES.plus(1));
        assertEquals(ZodiacSign.CAPRICORN, ZodiacSign.ARIES.plus(9));
        assertEquals(ZodiacSign.PISCES, ZodiacSign.ARIES.plus(-1));
    }

    @Test
    public void testLords() {
        assertEquals(Planet.MARS, ZodiacSign.SCORPIO.getLord());
        assertEquals(Planet.SATURN, ZodiacSign.AQUARIUS.getLord());
        assertEquals(Planet.JUPITER, ZodiacSign.PISCES.getLord());
        for (ZodiacSign sign : ZodiacSign.values()) {
            assertTrue(sign.getLord().rules(sign), sign + " is ruled by its lord");
        }
    }
}
