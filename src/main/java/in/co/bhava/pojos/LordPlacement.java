package in.co.bhava.pojos;

/**
 * Where a house lord sits relative to the house it rules, classified from the inclusive
 * distance between the two. The first matching bucket wins, in declaration order.
 */
public enum LordPlacement {
    OWN_HOUSE("Own House"),
    KENDRA("Kendra from own"),
    TRIKONA("Trikona from own"),
    DUSTHANA("Dusthana from own"),
    NEUTRAL("Neutral");

    private final String displayName;

    LordPlacement(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * @param distanceFromOwn inclusive distance from the ruled house to the lord's house, 1..12
     */
    public static LordPlacement fromDistance(int distanceFromOwn) {
        if (distanceFromOwn == 1) return OWN_HOUSE;
        if (HouseNature.KENDRA.contains(distanceFromOwn)) return KENDRA;
        if (HouseNature.TRIKONA.contains(distanceFromOwn)) return TRIKONA;
        if (HouseNature.DUSTHANA.contains(distanceFromOwn)) return DUSTHANA;
        return NEUTRAL;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
