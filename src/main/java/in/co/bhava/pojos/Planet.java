package in.co.bhava.pojos;

import java.util.Locale;
import java.util.Optional;

/**
 * The nine classical bodies (grahas) used by the engine.
 *
 * <p>Dignity signs are kept as sign numbers (Aries = 1) rather than {@link ZodiacSign} constants
 * because {@code ZodiacSign} refers back to this enum for its lords.</p>
 */
public enum Planet {
    SUN("Sun", false, 1, 7, 5),
    MOON("Moon", true, 2, 8, 4),
    MARS("Mars", false, 10, 4, 1, 8),
    MERCURY("Mercury", true, 6, 12, 3, 6),
    JUPITER("Jupiter", true, 4, 10, 9, 12),
    VENUS("Venus", true, 12, 6, 2, 7),
    SATURN("Saturn", false, 7, 1, 10, 11),
    RAHU("Rahu", false, 3, 9),
    KETU("Ketu", false, 9, 3);

    private final String displayName;
    private final boolean benefic;
    private final int exaltationSign;
    private final int debilitationSign;
    private final int[] ownSigns;

    Planet(String displayName, boolean benefic, int exaltationSign, int debilitationSign, int... ownSigns) {
        this.displayName = displayName;
        this.benefic = benefic;
        this.exaltationSign = exaltationSign;
        this.debilitationSign = debilitationSign;
        this.ownSigns = ownSigns;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isBenefic() {
        return benefic;
    }

    public boolean isMalefic() {
        return !benefic;
    }

    public boolean rules(ZodiacSign sign) {
        for (int own : ownSigns) {
            if (own == sign.getNumber()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Classical dignity of this planet when placed in {@code sign}. Only exaltation, debilitation
     * and own sign are derivable from the sign alone; everything else is {@link Dignity#NEUTRAL}.
     */
    public Dignity dignityIn(ZodiacSign sign) {
        if (sign.getNumber() == exaltationSign) return Dignity.EXALTED;
        if (sign.getNumber() == debilitationSign) return Dignity.DEBILITATED;
        if (rules(sign)) return Dignity.OWN_SIGN;
        return Dignity.NEUTRAL;
    }

    /**
     * Map a body name as sent by ephemeris providers ("Sun", "mars", "RAHU") to a planet.
     * Outer planets, the ascendant and anything unrecognised map to empty.
     */
    public static Optional<Planet> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String key = name.trim().toUpperCase(Locale.ROOT);
        for (Planet planet : values()) {
            if (planet.name().equals(key)) {
                return Optional.of(planet);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return displayName;
    }
}
