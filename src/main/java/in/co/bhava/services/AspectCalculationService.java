package in.co.bhava.services;

import in.co.bhava.pojos.AspectKind;
import in.co.bhava.pojos.AspectResult;
import in.co.bhava.pojos.Chart;
import in.co.bhava.pojos.Planet;
import in.co.bhava.pojos.PlanetPosition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Computes the aspects falling on a house.
 *
 * <h2>Angular aspects</h2>
 * Measured from each planet's longitude to the middle of the target house:
 * <pre>
 *   separation = angularSeparation(planet, houseCenter)
 *   error      = |separation - aspectAngle|          match when error &lt;= orb
 *   strength   = max(0, round(100 * (1 - error / orb)))
 * </pre>
 *
 * <h2>Graha drishti</h2>
 * Whole-house aspects counted inclusively from the planet's house. Only the grahas with special
 * aspects are listed; the universal 7th is included in each of their sets.
 * <pre>
 *   Mars        4, 7, 8     75%
 *   Jupiter     5, 7, 9     80%
 *   Saturn      3, 7, 10    70%
 *   Rahu, Ketu  5, 7, 9     60%
 * </pre>
 *
 * A planet can produce both an angular result and a drishti result on the same house; both are
 * reported. Results are ordered by strength (descending), then planet order, then angular before
 * drishti.
 */
public class AspectCalculationService {

    private static final Map<Planet, int[]> DRISHTI_HOUSES = new EnumMap<>(Planet.class);
    private static final Map<Planet, Integer> DRISHTI_STRENGTH = new EnumMap<>(Planet.class);

    static {
        DRISHTI_HOUSES.put(Planet.MARS, new int[]{4, 7, 8});
        DRISHTI_HOUSES.put(Planet.JUPITER, new int[]{5, 7, 9});
        DRISHTI_HOUSES.put(Planet.SATURN, new int[]{3, 7, 10});
        DRISHTI_HOUSES.put(Planet.RAHU, new int[]{5, 7, 9});
        DRISHTI_HOUSES.put(Planet.KETU, new int[]{5, 7, 9});

        DRISHTI_STRENGTH.put(Planet.MARS, EngineConfig.MARS_DRISHTI_STRENGTH);
        DRISHTI_STRENGTH.put(Planet.JUPITER, EngineConfig.JUPITER_DRISHTI_STRENGTH);
        DRISHTI_STRENGTH.put(Planet.SATURN, EngineConfig.SATURN_DRISHTI_STRENGTH);
        DRISHTI_STRENGTH.put(Planet.RAHU, EngineConfig.NODE_DRISHTI_STRENGTH);
        DRISHTI_STRENGTH.put(Planet.KETU, EngineConfig.NODE_DRISHTI_STRENGTH);
    }

    private static final Comparator<AspectResult> ORDER =
            Comparator.comparingInt(AspectResult::getStrengthPercent).reversed()
                    .thenComparing(AspectResult::getSourcePlanet)
                    .thenComparing(AspectResult::getKind)
                    .thenComparingInt(r -> r.getDrishtiHouse() == null ? 0 : r.getDrishtiHouse());

    private final Map<AspectKind, Double> orbs;

    /**
     * Uses the default orbs, overridden by {@code orb.<kind>} entries in {@value EngineConfig#CONFIG_RESOURCE}.
     */
    public AspectCalculationService() {
        this(configuredOrbs());
    }

    /**
     * @param orbs orb per angular aspect kind; kinds not present fall back to their default
     */
    public AspectCalculationService(Map<AspectKind, Double> orbs) {
        Map<AspectKind, Double> resolved = new EnumMap<>(AspectKind.class);
        for (AspectKind kind : AspectKind.values()) {
            if (!kind.isAngular()) {
                continue;
            }
            Double orb = orbs.get(kind);
            double value = orb != null ? orb : kind.getDefaultOrb();
            if (!(value > 0)) {
                throw new IllegalArgumentException("Orb for " + kind + " must be positive: " + value);
            }
            resolved.put(kind, value);
        }
        this.orbs = Collections.unmodifiableMap(resolved);
    }

    public double getOrb(AspectKind kind) {
        Double orb = orbs.get(kind);
        if (orb == null) {
            throw new IllegalArgumentException("No orb for " + kind);
        }
        return orb;
    }

    /**
     * All aspects on {@code houseNumber}, strongest first. Empty when the chart has no planets.
     *
     * @throws IllegalArgumentException if the house is outside 1..12
     */
    public List<AspectResult> aspectsOnHouse(Chart chart, int houseNumber) {
        HouseGeometry.requireHouse(houseNumber);
        double ascendant = chart.getAscendantLongitude();
        double houseCenter = HouseGeometry.houseCenterLongitude(houseNumber, ascendant);

        List<AspectResult> results = new ArrayList<>();
        for (PlanetPosition position : chart.getPositions().values()) {
            int sourceHouse = HouseGeometry.houseOfLongitude(position.getLongitude(), ascendant);
            AspectResult angular = angularAspect(position, sourceHouse, houseNumber, houseCenter);
            if (angular != null) {
                results.add(angular);
            }
            results.addAll(drishti(position.getPlanet(), sourceHouse, houseNumber));
        }
        results.sort(ORDER);
        return results;
    }

    /**
     * Graha drishti results only, in the same order as {@link #aspectsOnHouse}.
     */
    public List<AspectResult> planetsAspectingHouse(Chart chart, int houseNumber) {
        HouseGeometry.requireHouse(houseNumber);
        double ascendant = chart.getAscendantLongitude();
        List<AspectResult> results = new ArrayList<>();
        for (PlanetPosition position : chart.getPositions().values()) {
            int sourceHouse = HouseGeometry.houseOfLongitude(position.getLongitude(), ascendant);
            results.addAll(drishti(position.getPlanet(), sourceHouse, houseNumber));
        }
        results.sort(ORDER);
        return results;
    }

    // -------------------------------------------------------------------------
    // Internals
    // -------------------------------------------------------------------------

    private AspectResult angularAspect(PlanetPosition position, int sourceHouse, int targetHouse, double houseCenter) {
        double separation = HouseGeometry.angularSeparation(position.getLongitude(), houseCenter);
        AspectResult best = null;
        for (Map.Entry<AspectKind, Double> entry : orbs.entrySet()) {
            AspectKind kind = entry.getKey();
            double orb = entry.getValue();
            double error = Math.abs(separation - kind.getAngle());
            if (error > orb) {
                continue;
            }
            int strength = (int) Math.max(0, Math.round(100 * (1 - error / orb)));
            // overlapping orbs are only possible with widened overrides; keep the closer match
            if (best == null || error < best.getOrbDegrees()) {
                best = AspectResult.angular(position.getPlanet(), sourceHouse, targetHouse, kind, error, strength);
            }
        }
        return best;
    }

    private static List<AspectResult> drishti(Planet planet, int sourceHouse, int targetHouse) {
        int[] houses = DRISHTI_HOUSES.get(planet);
        if (houses == null) {
            return Collections.emptyList();
        }
        List<AspectResult> results = new ArrayList<>(1);
        for (int n : houses) {
            if (HouseGeometry.houseByOffset(sourceHouse, n) == targetHouse) {
                results.add(AspectResult.drishti(planet, sourceHouse, targetHouse, n, DRISHTI_STRENGTH.get(planet)));
            }
        }
        return results;
    }

    private static Map<AspectKind, Double> configuredOrbs() {
        Map<AspectKind, Double> orbs = new EnumMap<>(AspectKind.class);
        for (AspectKind kind : AspectKind.values()) {
            if (kind.isAngular()) {
                String key = EngineConfig.KEY_ORB_PREFIX + kind.name().toLowerCase(Locale.ROOT);
                orbs.put(kind, EngineConfigProvider.getDouble(key, kind.getDefaultOrb()));
            }
        }
        return orbs;
    }
}
