package in.co.bhava.pojos;

import java.util.Objects;

/**
 * Position of one planet in a chart. Sign and dignity are always resolved: either supplied by the
 * chart provider or derived from the longitude when the chart is built.
 */
public final class PlanetPosition {

    private final Planet planet;
    private final double longitude;
    private final ZodiacSign sign;
    private final Dignity dignity;
    private final boolean retrograde;

    PlanetPosition(Planet planet, double longitude, ZodiacSign sign, Dignity dignity, boolean retrograde) {
        this.planet = Objects.requireNonNull(planet, "planet");
        this.longitude = longitude;
        this.sign = Objects.requireNonNull(sign, "sign");
        this.dignity = Objects.requireNonNull(dignity, "dignity");
        this.retrograde = retrograde;
    }

    public Planet getPlanet() {
        return planet;
    }

    /** Sidereal longitude in degrees, [0, 360). */
    public double getLongitude() {
        return longitude;
    }

    public ZodiacSign getSign() {
        return sign;
    }

    public Dignity getDignity() {
        return dignity;
    }

    public boolean isRetrograde() {
        return retrograde;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PlanetPosition)) return false;
        PlanetPosition that = (PlanetPosition) o;
        return Double.compare(that.longitude, longitude) == 0
                && retrograde == that.retrograde
                && planet == that.planet
                && sign == that.sign
                && dignity == that.dignity;
    }

    @Override
    public int hashCode() {
        return Objects.hash(planet, longitude, sign, dignity, retrograde);
    }

    @Override
    public String toString() {
        return String.format("%s %.2f° %s (%s%s)", planet, longitude, sign, dignity, retrograde ? ", R" : "");
    }
}
