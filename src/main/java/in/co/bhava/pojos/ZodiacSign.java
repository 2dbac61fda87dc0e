package in.co.bhava.pojos;

/**
 * The twelve sidereal signs in zodiacal order, each with its ruling planet.
 */
public enum ZodiacSign {
    ARIES("Aries", Planet.MARS),
    TAURUS("Taurus", Planet.VENUS),
    GEMINI("Gemini", Planet.MERCURY),
    CANCER("Cancer", Planet.MOON),
    LEO("Leo", Planet.SUN),
    VIRGO("Virgo", Planet.MERCURY),
    LIBRA("Libra", Planet.VENUS),
    SCORPIO("Scorpio", Planet.MARS),
    SAGITTARIUS("Sagittarius", Planet.JUPITER),
    CAPRICORN("Capricorn", Planet.SATURN),
    AQUARIUS("Aquarius", Planet.SATURN),
    PISCES("Pisces", Planet.JUPITER);

    private static final ZodiacSign[] ORDERED = values();

    private final String displayName;
    private final Planet lord;

    ZodiacSign(String displayName, Planet lord) {
        this.displayName = displayName;
        this.lord = lord;
    }

    public String getDisplayName() {
        return displayName;
    }

    public Planet getLord() {
        return lord;
    }

    /**
     * 1-based position in the zodiac (Aries = 1, Pisces = 12).
     */
    public int getNumber() {
        return ordinal() + 1;
    }

    /**
     * Sign {@code count} places after this one, wrapping past Pisces.
     */
    public ZodiacSign plus(int count) {
        return ORDERED[Math.floorMod(ordinal() + count, ORDERED.length)];
    }

    /**
     * @param number 1..12
     * @throws IllegalArgumentException for any other number
     */
    public static ZodiacSign fromNumber(int number) {
        if (number < 1 || number > ORDERED.length) {
            throw new IllegalArgumentException("Unknown sign number: " + number);
        }
        return ORDERED[number - 1];
    }

    /**
     * Case-insensitive lookup by name ("Aries", "ARIES", "aries").
     *
     * @throws IllegalArgumentException if the name is null or not one of the twelve signs
     */
    public static ZodiacSign fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Sign name is null");
        }
        String trimmed = name.trim();
        for (ZodiacSign sign : ORDERED) {
            if (sign.displayName.equalsIgnoreCase(trimmed)) {
                return sign;
            }
        }
        throw new IllegalArgumentException("Unknown sign: " + name);
    }

    @Override
    public String toString() {
        return displayName;
    }
}
