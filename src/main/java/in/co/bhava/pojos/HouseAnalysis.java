package in.co.bhava.pojos;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything the engine derives for a single house.
 */
public final class HouseAnalysis {

    private final int houseNumber;
    private final ZodiacSign sign;
    private final Planet lord;
    private final HouseLordInfo lordInfo;
    private final HouseSignification signification;
    private final List<Planet> occupants;
    private final List<AspectResult> aspects;
    private final StrengthBreakdown breakdown;

    public HouseAnalysis(int houseNumber, ZodiacSign sign, Planet lord, HouseLordInfo lordInfo,
                         List<Planet> occupants, List<AspectResult> aspects, StrengthBreakdown breakdown) {
        this.houseNumber = houseNumber;
        this.sign = Objects.requireNonNull(sign, "sign");
        this.lord = Objects.requireNonNull(lord, "lord");
        this.lordInfo = lordInfo;
        this.signification = HouseSignification.of(houseNumber);
        this.occupants = List.copyOf(occupants);
        this.aspects = List.copyOf(aspects);
        this.breakdown = Objects.requireNonNull(breakdown, "breakdown");
    }

    public int getHouseNumber() {
        return houseNumber;
    }

    public ZodiacSign getSign() {
        return sign;
    }

    /** Ruling planet of the house sign. Always known, even when its position is not. */
    public Planet getLord() {
        return lord;
    }

    /** Empty when the chart carries no position for the lord. */
    public Optional<HouseLordInfo> getLordInfo() {
        return Optional.ofNullable(lordInfo);
    }

    public HouseSignification getSignification() {
        return signification;
    }

    /** Occupying planets in {@link Planet} order. */
    public List<Planet> getOccupants() {
        return occupants;
    }

    public boolean isEmpty() {
        return occupants.isEmpty();
    }

    public List<AspectResult> getAspects() {
        return aspects;
    }

    /** 1..10 */
    public int getStrength() {
        return breakdown.strength;
    }

    public StrengthGrade getGrade() {
        return StrengthGrade.of(breakdown.strength);
    }

    public StrengthBreakdown getBreakdown() {
        return breakdown;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HouseAnalysis)) return false;
        HouseAnalysis that = (HouseAnalysis) o;
        return houseNumber == that.houseNumber && sign == that.sign && lord == that.lord
                && Objects.equals(lordInfo, that.lordInfo) && occupants.equals(that.occupants)
                && aspects.equals(that.aspects) && breakdown.equals(that.breakdown);
    }

    @Override
    public int hashCode() {
        return Objects.hash(houseNumber, sign, lord, lordInfo, occupants, aspects, breakdown);
    }

    @Override
    public String toString() {
        return String.format("House %d %s (%s): strength %d %s, lord %s, occupants %s",
                houseNumber, signification.getName(), sign, getStrength(), getGrade(),
                lordInfo != null ? lordInfo : lord + " (no position)", occupants);
    }
}
