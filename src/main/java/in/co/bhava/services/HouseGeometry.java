package in.co.bhava.services;

import in.co.bhava.pojos.ZodiacSign;

/**
 * Stateless arithmetic on the zodiac and the twelve-house wheel.
 *
 * <h2>Counting convention</h2>
 * Houses are counted inclusively, the way the classical texts count them: the house you start
 * from is the 1st. Counting from the 1st house to the 7th gives 7, and the 7th house counted
 * from the 7th is the 1st.
 * <pre>
 *   houseDistance(from, to) = ((to - from + 12) mod 12) + 1        in 1..12
 *   houseByOffset(start, n) = ((start - 1 + n - 1) mod 12) + 1     in 1..12
 * </pre>
 * so {@code houseDistance(h, houseByOffset(h, n)) == n} for every n in 1..12, and neither
 * function ever returns 0.
 *
 * <p>Every other component goes through these methods instead of doing its own modular
 * arithmetic, so wrap-around behaves the same everywhere.</p>
 */
public final class HouseGeometry {

    public static final int HOUSE_COUNT = 12;
    public static final double SIGN_SPAN_DEGREES = 30.0;
    public static final double FULL_CIRCLE_DEGREES = 360.0;

    private HouseGeometry() {}

    // -------------------------------------------------------------------------
    // Longitudes
    // -------------------------------------------------------------------------

    /**
     * Normalize any finite longitude into [0, 360).
     *
     * @throws IllegalArgumentException for NaN or infinite input
     */
    public static double normalize(double longitude) {
        if (Double.isNaN(longitude) || Double.isInfinite(longitude)) {
            throw new IllegalArgumentException("Longitude is not a finite number: " + longitude);
        }
        double normalized = longitude % FULL_CIRCLE_DEGREES;
        if (normalized < 0) {
            normalized += FULL_CIRCLE_DEGREES;
        }
        // -1e-15 % 360 + 360 rounds to exactly 360.0
        return normalized >= FULL_CIRCLE_DEGREES ? 0.0 : normalized;
    }

    /**
     * Sign occupied by a longitude: {@code floor(normalize(longitude) / 30) mod 12}.
     */
    public static ZodiacSign signOfLongitude(double longitude) {
        int index = (int) Math.floor(normalize(longitude) / SIGN_SPAN_DEGREES) % HOUSE_COUNT;
        return ZodiacSign.fromNumber(index + 1);
    }

    /**
     * House of a longitude, counting 30° arcs from the ascendant degree:
     * {@code floor(normalize(longitude - ascendantLongitude) / 30) + 1}.
     *
     * @return 1..12
     */
    public static int houseOfLongitude(double longitude, double ascendantLongitude) {
        double difference = normalize(longitude - ascendantLongitude);
        int house = (int) Math.floor(difference / SIGN_SPAN_DEGREES) + 1;
        // difference is < 360 so house is at most 12; the clamp only guards floating edge cases
        return Math.min(house, HOUSE_COUNT);
    }

    /**
     * Longitude of the middle of a house: 15° past its starting degree.
     */
    public static double houseCenterLongitude(int house, double ascendantLongitude) {
        requireHouse(house);
        return normalize(ascendantLongitude + (house - 1) * SIGN_SPAN_DEGREES + SIGN_SPAN_DEGREES / 2);
    }

    /**
     * Shortest arc between two longitudes: {@code min(|a - b|, 360 - |a - b|)}, in [0, 180].
     */
    public static double angularSeparation(double a, double b) {
        double delta = Math.abs(normalize(a) - normalize(b));
        return Math.min(delta, FULL_CIRCLE_DEGREES - delta);
    }

    // -------------------------------------------------------------------------
    // Houses
    // -------------------------------------------------------------------------

    /**
     * Inclusive count of houses from {@code fromHouse} to {@code toHouse}. The starting house is
     * counted as 1, so the result is always in 1..12.
     */
    public static int houseDistance(int fromHouse, int toHouse) {
        requireHouse(fromHouse);
        requireHouse(toHouse);
        return Math.floorMod(toHouse - fromHouse, HOUSE_COUNT) + 1;
    }

    /**
     * The {@code distance}-th house counted inclusively from {@code startHouse}, wrapping past 12.
     * {@code houseByOffset(7, 7) == 1}, {@code houseByOffset(1, 10) == 10}.
     *
     * @param distance 1..12
     */
    public static int houseByOffset(int startHouse, int distance) {
        requireHouse(startHouse);
        if (distance < 1 || distance > HOUSE_COUNT) {
            throw new IllegalArgumentException("House distance must be in 1..12: " + distance);
        }
        return Math.floorMod(startHouse - 1 + distance - 1, HOUSE_COUNT) + 1;
    }

    /**
     * Sign on a house, counting forward from the ascendant sign (house 1 carries the ascendant sign).
     */
    public static ZodiacSign signOfHouse(int house, ZodiacSign ascendantSign) {
        requireHouse(house);
        return ascendantSign.plus(house - 1);
    }

    /**
     * House on which a sign falls, counting from the ascendant sign.
     */
    public static int houseOfSign(ZodiacSign sign, ZodiacSign ascendantSign) {
        return Math.floorMod(sign.ordinal() - ascendantSign.ordinal(), HOUSE_COUNT) + 1;
    }

    /**
     * @throws IllegalArgumentException if {@code house} is outside 1..12
     */
    public static int requireHouse(int house) {
        if (house < 1 || house > HOUSE_COUNT) {
            throw new IllegalArgumentException("Invalid house number: " + house);
        }
        return house;
    }
}
