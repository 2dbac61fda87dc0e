package in.co.bhava.pojos;

import java.util.Objects;

/**
 * Immutable per-term contributions behind one house's strength score.
 *
 * <p>{@code rawTotal} is the unclamped sum; {@code strength} is {@code rawTotal} clamped to [1, 10].
 * Lord terms are 0 when the lord has no position in the chart.</p>
 */
public final class StrengthBreakdown {

    /** Always 5. */
    public final int base;

    /** Exalted +3, Own Sign +2, Debilitated -2, otherwise 0. */
    public final int lordDignity;

    /** +2 when the lord occupies the house it rules. */
    public final int lordInOwnHouse;

    /** +1 when the lord's distance from its own house is a kendra or trikona number. */
    public final int lordPlacement;

    /** +1 per benefic occupant of a kendra/trikona house, +1 per malefic occupant of an upachaya house. */
    public final int occupants;

    /** +1 kendra, +1 trikona, -1 dusthana. */
    public final int houseCategory;

    public final int rawTotal;

    public final int strength;

    private StrengthBreakdown(int base, int lordDignity, int lordInOwnHouse, int lordPlacement,
                              int occupants, int houseCategory, int rawTotal, int strength) {
        this.base = base;
        this.lordDignity = lordDignity;
        this.lordInOwnHouse = lordInOwnHouse;
        this.lordPlacement = lordPlacement;
        this.occupants = occupants;
        this.houseCategory = houseCategory;
        this.rawTotal = rawTotal;
        this.strength = strength;
    }

    /**
     * Sums the terms and clamps the total to [min, max].
     */
    public static StrengthBreakdown of(int base, int lordDignity, int lordInOwnHouse, int lordPlacement,
                                       int occupants, int houseCategory, int min, int max) {
        int rawTotal = base + lordDignity + lordInOwnHouse + lordPlacement + occupants + houseCategory;
        int strength = Math.max(min, Math.min(max, rawTotal));
        return new StrengthBreakdown(base, lordDignity, lordInOwnHouse, lordPlacement,
                occupants, houseCategory, rawTotal, strength);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StrengthBreakdown)) return false;
        StrengthBreakdown that = (StrengthBreakdown) o;
        return base == that.base && lordDignity == that.lordDignity
                && lordInOwnHouse == that.lordInOwnHouse && lordPlacement == that.lordPlacement
                && occupants == that.occupants && houseCategory == that.houseCategory
                && rawTotal == that.rawTotal && strength == that.strength;
    }

    @Override
    public int hashCode() {
        return Objects.hash(base, lordDignity, lordInOwnHouse, lordPlacement,
                occupants, houseCategory, rawTotal, strength);
    }

    @Override
    public String toString() {
        return String.format(
                "StrengthBreakdown{base=%d, dignity=%d, ownHouse=%d, placement=%d, " +
                "occupants=%d, category=%d, raw=%d, strength=%d}",
                base, lordDignity, lordInOwnHouse, lordPlacement,
                occupants, houseCategory, rawTotal, strength);
    }
}
