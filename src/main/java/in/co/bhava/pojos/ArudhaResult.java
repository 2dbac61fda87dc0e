package in.co.bhava.pojos;

import java.util.Objects;

/**
 * Arudha (projected image) of one house.
 *
 * <p>{@code rawProjectedHouse} is the house reached by counting the lord's distance again from the
 * lord; {@code correctedHouse} is the final answer after at most one correction.</p>
 */
public final class ArudhaResult {

    private final int originHouse;
    private final Planet houseLord;
    private final int lordHouse;
    private final int countedDistance;
    private final int rawProjectedHouse;
    private final int correctedHouse;
    private final ZodiacSign sign;
    private final ArudhaExceptionKind exceptionKind;

    public ArudhaResult(int originHouse, Planet houseLord, int lordHouse, int countedDistance,
                        int rawProjectedHouse, int correctedHouse, ZodiacSign sign,
                        ArudhaExceptionKind exceptionKind) {
        this.originHouse = originHouse;
        this.houseLord = Objects.requireNonNull(houseLord, "houseLord");
        this.lordHouse = lordHouse;
        this.countedDistance = countedDistance;
        this.rawProjectedHouse = rawProjectedHouse;
        this.correctedHouse = correctedHouse;
        this.sign = Objects.requireNonNull(sign, "sign");
        this.exceptionKind = Objects.requireNonNull(exceptionKind, "exceptionKind");
    }

    /** "AL" for the first house, otherwise "A2".."A12". */
    public String label() {
        return originHouse == 1 ? "AL" : "A" + originHouse;
    }

    public int getOriginHouse() {
        return originHouse;
    }

    public Planet getHouseLord() {
        return houseLord;
    }

    public int getLordHouse() {
        return lordHouse;
    }

    public int getCountedDistance() {
        return countedDistance;
    }

    public int getRawProjectedHouse() {
        return rawProjectedHouse;
    }

    public int getCorrectedHouse() {
        return correctedHouse;
    }

    public ZodiacSign getSign() {
        return sign;
    }

    public boolean isExceptionApplied() {
        return exceptionKind != ArudhaExceptionKind.NONE;
    }

    public ArudhaExceptionKind getExceptionKind() {
        return exceptionKind;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ArudhaResult)) return false;
        ArudhaResult that = (ArudhaResult) o;
        return originHouse == that.originHouse && lordHouse == that.lordHouse
                && countedDistance == that.countedDistance && rawProjectedHouse == that.rawProjectedHouse
                && correctedHouse == that.correctedHouse && houseLord == that.houseLord
                && sign == that.sign && exceptionKind == that.exceptionKind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(originHouse, houseLord, lordHouse, countedDistance,
                rawProjectedHouse, correctedHouse, sign, exceptionKind);
    }

    @Override
    public String toString() {
        return String.format("%s: house %d (%s), lord %s in %d, distance %d, raw %d, exception %s",
                label(), correctedHouse, sign, houseLord, lordHouse, countedDistance,
                rawProjectedHouse, exceptionKind);
    }
}
