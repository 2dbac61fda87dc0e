package in.co.bhava.pojos;

import java.util.Objects;

/**
 * One aspect a planet casts on a house. A planet may produce several results for the same house
 * (an angular aspect and a graha drishti, for instance); they are reported separately.
 */
public final class AspectResult {

    private final Planet sourcePlanet;
    private final int sourceHouse;
    private final int targetHouse;
    private final AspectKind kind;
    private final Double orbDegrees;
    private final Integer drishtiHouse;
    private final int strengthPercent;

    private AspectResult(Planet sourcePlanet, int sourceHouse, int targetHouse, AspectKind kind,
                         Double orbDegrees, Integer drishtiHouse, int strengthPercent) {
        this.sourcePlanet = sourcePlanet;
        this.sourceHouse = sourceHouse;
        this.targetHouse = targetHouse;
        this.kind = kind;
        this.orbDegrees = orbDegrees;
        this.drishtiHouse = drishtiHouse;
        this.strengthPercent = strengthPercent;
    }

    public static AspectResult angular(Planet sourcePlanet, int sourceHouse, int targetHouse,
                                       AspectKind kind, double orbDegrees, int strengthPercent) {
        if (!kind.isAngular()) {
            throw new IllegalArgumentException("Not an angular aspect: " + kind);
        }
        return new AspectResult(sourcePlanet, sourceHouse, targetHouse, kind, orbDegrees, null, strengthPercent);
    }

    /**
     * @param drishtiHouse the house the aspect falls on, counted inclusively from the planet's house (e.g. 4 for Mars' 4th aspect)
     */
    public static AspectResult drishti(Planet sourcePlanet, int sourceHouse, int targetHouse,
                                       int drishtiHouse, int strengthPercent) {
        return new AspectResult(sourcePlanet, sourceHouse, targetHouse, AspectKind.GRAHA_DRISHTI,
                null, drishtiHouse, strengthPercent);
    }

    public Planet getSourcePlanet() {
        return sourcePlanet;
    }

    public int getSourceHouse() {
        return sourceHouse;
    }

    public int getTargetHouse() {
        return targetHouse;
    }

    public AspectKind getKind() {
        return kind;
    }

    /** Deviation from the exact aspect angle; null for graha drishti. */
    public Double getOrbDegrees() {
        return orbDegrees;
    }

    /** Ordinal of the drishti (4, 7, 8, ...); null for angular aspects. */
    public Integer getDrishtiHouse() {
        return drishtiHouse;
    }

    /** 0..100 */
    public int getStrengthPercent() {
        return strengthPercent;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AspectResult)) return false;
        AspectResult that = (AspectResult) o;
        return sourceHouse == that.sourceHouse
                && targetHouse == that.targetHouse
                && strengthPercent == that.strengthPercent
                && sourcePlanet == that.sourcePlanet
                && kind == that.kind
                && Objects.equals(orbDegrees, that.orbDegrees)
                && Objects.equals(drishtiHouse, that.drishtiHouse);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourcePlanet, sourceHouse, targetHouse, kind, orbDegrees, drishtiHouse, strengthPercent);
    }

    @Override
    public String toString() {
        if (kind == AspectKind.GRAHA_DRISHTI) {
            return String.format("%s drishti (%d from own house) on house %d (%d%%)", sourcePlanet, drishtiHouse, targetHouse, strengthPercent);
        }
        return String.format("%s %s house %d, orb %.2f° (%d%%)", sourcePlanet, kind, targetHouse, orbDegrees, strengthPercent);
    }
}
