package in.co.bhava.pojos;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class PlanetTest {

    @Test
    public void testDignityIn() {
        assertEquals(Dignity.EXALTED, Planet.SUN.dignityIn(ZodiacSign.ARIES));
        assertEquals(Dignity.DEBILITATED, Planet.SUN.dignityIn(ZodiacSign.LIBRA));
        assertEquals(Dignity.OWN_SIGN, Planet.SUN.dignityIn(ZodiacSign.LEO));
        assertEquals(Dignity.NEUTRAL, Planet.SUN.dignityIn(ZodiacSign.GEMINI));
        // exaltation wins over own sign for Mercury in Virgo
        assertEquals(Dignity.EXALTED, Planet.MERCURY.dignityIn(ZodiacSign.VIRGO));
        assertEquals(Dignity.EXALTED, Planet.RAHU.dignityIn(ZodiacSign.GEMINI));
        assertEquals(Dignity.DEBILITATED, Planet.KETU.dignityIn(ZodiacSign.GEMINI));
    }

    @Test
    public void testBeneficsAndMalefics() {
        assertTrue(Planet.JUPITER.isBenefic());
        assertTrue(Planet.MOON.isBenefic());
        assertTrue(Planet.SATURN.isMalefic());
        assertTrue(Planet.RAHU.isMalefic());
        assertFalse(Planet.VENUS.isMalefic());
    }

    @Test
    public void testFromName() {
        assertEquals(Planet.MARS, Planet.fromName(" mars ").orElseThrow());
        assertEquals(Planet.KETU, Planet.fromName("KETU").orElseThrow());
        assertTrue(Planet.fromName("Uranus").isEmpty());
        assertTrue(Planet.fromName("Ascendant").isEmpty());
        assertTrue(Planet.fromName(null).isEmpty());
    }
}
