package in.co.bhava.pojos;

import java.util.Objects;

/**
 * Condition of the planet ruling one house. Recomputed for every chart, never cached.
 */
public final class HouseLordInfo {

    private final Planet planet;
    private final int ruledHouse;
    private final int currentHouse;
    private final ZodiacSign currentSign;
    private final Dignity dignity;
    private final int houseDistanceFromOwn;
    private final LordPlacement placementQuality;
    private final int strengthScore;

    public HouseLordInfo(Planet planet, int ruledHouse, int currentHouse, ZodiacSign currentSign,
                         Dignity dignity, int houseDistanceFromOwn, LordPlacement placementQuality,
                         int strengthScore) {
        this.planet = Objects.requireNonNull(planet, "planet");
        this.ruledHouse = ruledHouse;
        this.currentHouse = currentHouse;
        this.currentSign = Objects.requireNonNull(currentSign, "currentSign");
        this.dignity = Objects.requireNonNull(dignity, "dignity");
        this.houseDistanceFromOwn = houseDistanceFromOwn;
        this.placementQuality = Objects.requireNonNull(placementQuality, "placementQuality");
        this.strengthScore = strengthScore;
    }

    public Planet getPlanet() {
        return planet;
    }

    public int getRuledHouse() {
        return ruledHouse;
    }

    public int getCurrentHouse() {
        return currentHouse;
    }

    public ZodiacSign getCurrentSign() {
        return currentSign;
    }

    public Dignity getDignity() {
        return dignity;
    }

    public boolean isInOwnHouse() {
        return currentHouse == ruledHouse;
    }

    /** Inclusive count from the ruled house to the lord's house; 1 means the lord is at home. */
    public int getHouseDistanceFromOwn() {
        return houseDistanceFromOwn;
    }

    public LordPlacement getPlacementQuality() {
        return placementQuality;
    }

    /** Lord condition score, 1..8. */
    public int getStrengthScore() {
        return strengthScore;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HouseLordInfo)) return false;
        HouseLordInfo that = (HouseLordInfo) o;
        return ruledHouse == that.ruledHouse && currentHouse == that.currentHouse
                && houseDistanceFromOwn == that.houseDistanceFromOwn && strengthScore == that.strengthScore
                && planet == that.planet && currentSign == that.currentSign
                && dignity == that.dignity && placementQuality == that.placementQuality;
    }

    @Override
    public int hashCode() {
        return Objects.hash(planet, ruledHouse, currentHouse, currentSign, dignity,
                houseDistanceFromOwn, placementQuality, strengthScore);
    }

    @Override
    public String toString() {
        return String.format("%s (lord of %d) in house %d, %s, %s, %s, score %d",
                planet, ruledHouse, currentHouse, currentSign, dignity, placementQuality, strengthScore);
    }
}
