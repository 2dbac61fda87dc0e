package in.co.bhava.pojos;

/**
 * Qualitative strength of a planet in its current sign.
 */
public enum Dignity {
    EXALTED("Exalted", 3),
    OWN_SIGN("Own Sign", 2),
    FRIENDLY("Friendly", 0),
    NEUTRAL("Neutral", 0),
    ENEMY("Enemy", 0),
    DEBILITATED("Debilitated", -2);

    private final String label;
    private final int houseStrengthBonus;

    Dignity(String label, int houseStrengthBonus) {
        this.label = label;
        this.houseStrengthBonus = houseStrengthBonus;
    }

    /**
     * Contribution of a house lord with this dignity to the strength of the house it rules.
     */
    public int getHouseStrengthBonus() {
        return houseStrengthBonus;
    }

    /**
     * Parse the labels used by chart providers ("Exalted", "Own Sign", "own", "debilitated").
     * Returns null if the label is not recognised so callers can fall back to a derived dignity.
     */
    public static Dignity fromLabel(String value) {
        if (value == null) return null;
        String normalized = value.trim().replace('_', ' ').replace('-', ' ');
        for (Dignity dignity : values()) {
            if (dignity.label.equalsIgnoreCase(normalized)) {
                return dignity;
            }
        }
        switch (normalized.toLowerCase()) {
            case "own":
            case "own house": return OWN_SIGN;
            case "friend": return FRIENDLY;
            case "enemy sign": return ENEMY;
            default: return null;
        }
    }

    @Override
    public String toString() {
        return label;
    }
}
