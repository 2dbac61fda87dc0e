package in.co.bhava.pojos;

import in.co.bhava.services.HouseGeometry;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable birth chart snapshot: the ascendant and the positions of the nine grahas.
 *
 * <p>Construct with {@link #builder()}. Every input shape (keyed JSON, provider responses, test
 * fixtures) is normalised into this one value before any calculation runs.</p>
 */
public final class Chart {

    private final String id;
    private final ZodiacSign ascendantSign;
    private final double ascendantLongitude;
    private final Map<Planet, PlanetPosition> positions;

    private Chart(Builder builder, Map<Planet, PlanetPosition> positions) {
        this.id = builder.id;
        this.ascendantSign = builder.resolvedAscendantSign;
        this.ascendantLongitude = builder.ascendantLongitude;
        this.positions = Collections.unmodifiableMap(positions);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Caller supplied identifier used for log correlation, may be null. */
    public String getId() {
        return id;
    }

    public ZodiacSign getAscendantSign() {
        return ascendantSign;
    }

    public double getAscendantLongitude() {
        return ascendantLongitude;
    }

    public Optional<PlanetPosition> getPosition(Planet planet) {
        return Optional.ofNullable(positions.get(planet));
    }

    /** Positions in {@link Planet} declaration order. */
    public Map<Planet, PlanetPosition> getPositions() {
        return positions;
    }

    public boolean hasPlanetData() {
        return !positions.isEmpty();
    }

    /** Grahas the provider did not send a position for. */
    public Set<Planet> getMissingPlanets() {
        Set<Planet> missing = EnumSet.allOf(Planet.class);
        missing.removeAll(positions.keySet());
        return Collections.unmodifiableSet(missing);
    }

    @Override
    public String toString() {
        return "Chart{id=" + id + ", ascendant=" + ascendantSign + " " + ascendantLongitude
                + ", planets=" + positions.keySet() + "}";
    }

    public static final class Builder {
        private String id;
        private String ascendantSignName;
        private ZodiacSign ascendantSign;
        private ZodiacSign resolvedAscendantSign;
        private Double ascendantLongitudeInput;
        private double ascendantLongitude;
        private final Map<Planet, PlanetInput> planets = new EnumMap<>(Planet.class);

        private Builder() {
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder ascendant(ZodiacSign sign, double longitude) {
            this.ascendantSign = sign;
            this.ascendantSignName = null;
            this.ascendantLongitudeInput = longitude;
            return this;
        }

        /**
         * @param signName  sign name as sent by the caller; null derives the sign from the longitude
         * @param longitude ascendant longitude; null marks the ascendant as missing
         */
        public Builder ascendant(String signName, Double longitude) {
            this.ascendantSign = null;
            this.ascendantSignName = signName;
            this.ascendantLongitudeInput = longitude;
            return this;
        }

        public Builder planet(Planet planet, double longitude) {
            return planet(planet, longitude, null, null, false);
        }

        public Builder planet(Planet planet, double longitude, Dignity dignity) {
            return planet(planet, longitude, null, dignity, false);
        }

        /**
         * @param sign    precomputed sign, null to derive from the longitude
         * @param dignity precomputed dignity, null to derive from the sign
         */
        public Builder planet(Planet planet, double longitude, ZodiacSign sign, Dignity dignity, boolean retrograde) {
            if (planet == null) {
                throw new MalformedChartException("Planet identifier is missing");
            }
            planets.put(planet, new PlanetInput(longitude, sign, dignity, retrograde));
            return this;
        }

        /**
         * @throws MalformedChartException if the ascendant is missing, its sign disagrees with its
         *                                 longitude, or any longitude is outside [0, 360)
         */
        public Chart build() {
            if (ascendantLongitudeInput == null) {
                throw new MalformedChartException("Ascendant longitude is missing");
            }
            ascendantLongitude = requireLongitude("Ascendant", ascendantLongitudeInput);
            ZodiacSign signOfLongitude = HouseGeometry.signOfLongitude(ascendantLongitude);
            ZodiacSign supplied = ascendantSign;
            if (supplied == null && ascendantSignName != null && !ascendantSignName.isBlank()) {
                try {
                    supplied = ZodiacSign.fromName(ascendantSignName);
                } catch (IllegalArgumentException e) {
                    throw new MalformedChartException("Unrecognised ascendant sign: " + ascendantSignName, e);
                }
            }
            // house signs follow the sign, house positions follow the longitude
            if (supplied != null && supplied != signOfLongitude) {
                throw new MalformedChartException("Ascendant sign " + supplied + " does not match longitude "
                        + ascendantLongitude + " (" + signOfLongitude + ")");
            }
            resolvedAscendantSign = signOfLongitude;

            Map<Planet, PlanetPosition> positions = new EnumMap<>(Planet.class);
            for (Map.Entry<Planet, PlanetInput> entry : planets.entrySet()) {
                Planet planet = entry.getKey();
                PlanetInput input = entry.getValue();
                double longitude = requireLongitude(planet.getDisplayName(), input.longitude);
                ZodiacSign sign = input.sign != null ? input.sign : HouseGeometry.signOfLongitude(longitude);
                Dignity dignity = input.dignity != null ? input.dignity : planet.dignityIn(sign);
                positions.put(planet, new PlanetPosition(planet, longitude, sign, dignity, input.retrograde));
            }
            return new Chart(this, positions);
        }

        private static double requireLongitude(String body, double longitude) {
            if (Double.isNaN(longitude) || Double.isInfinite(longitude)) {
                throw new MalformedChartException(body + " longitude is not a finite number: " + longitude);
            }
            if (longitude < 0.0 || longitude >= 360.0) {
                throw new MalformedChartException(body + " longitude out of range [0, 360): " + longitude);
            }
            return longitude;
        }
    }

    private static final class PlanetInput {
        final double longitude;
        final ZodiacSign sign;
        final Dignity dignity;
        final boolean retrograde;

        PlanetInput(double longitude, ZodiacSign sign, Dignity dignity, boolean retrograde) {
            this.longitude = longitude;
            this.sign = sign;
            this.dignity = dignity;
            this.retrograde = retrograde;
        }
    }
}
