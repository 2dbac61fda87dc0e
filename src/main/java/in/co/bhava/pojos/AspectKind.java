package in.co.bhava.pojos;

/**
 * Aspect kinds reported by the aspect calculator. The first five are angular aspects measured in
 * degrees with an orb; {@link #GRAHA_DRISHTI} is the classical whole-house aspect a planet casts
 * on fixed houses counted from its own.
 */
public enum AspectKind {
    CONJUNCTION("Conjunction", 0.0, 8.0),
    SEXTILE("Sextile", 60.0, 6.0),
    SQUARE("Square", 90.0, 8.0),
    TRINE("Trine", 120.0, 8.0),
    OPPOSITION("Opposition", 180.0, 8.0),
    GRAHA_DRISHTI("Graha Drishti", Double.NaN, Double.NaN);

    private final String displayName;
    private final double angle;
    private final double defaultOrb;

    AspectKind(String displayName, double angle, double defaultOrb) {
        this.displayName = displayName;
        this.angle = angle;
        this.defaultOrb = defaultOrb;
    }

    public String getDisplayName() {
        return displayName;
    }

    /** Exact angle in degrees; NaN for graha drishti. */
    public double getAngle() {
        return angle;
    }

    /** Orb used when no override is configured; NaN for graha drishti. */
    public double getDefaultOrb() {
        return defaultOrb;
    }

    public boolean isAngular() {
        return this != GRAHA_DRISHTI;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
