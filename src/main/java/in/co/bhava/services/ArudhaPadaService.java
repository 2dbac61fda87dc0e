package in.co.bhava.services;

import in.co.bhava.pojos.ArudhaExceptionKind;
import in.co.bhava.pojos.ArudhaLagnaProfile;
import in.co.bhava.pojos.ArudhaPadaReport;
import in.co.bhava.pojos.ArudhaResult;
import in.co.bhava.pojos.Chart;
import in.co.bhava.pojos.Planet;
import in.co.bhava.pojos.PlanetPosition;
import in.co.bhava.pojos.ZodiacSign;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Computes Arudha padas (projected images) of houses.
 *
 * <h2>Rule</h2>
 * For house H whose lord sits in house P:
 * <pre>
 *   distance  = houseDistance(H, P)
 *   candidate = houseByOffset(P, distance)
 *   candidate == H                        -&gt; houseByOffset(candidate, 10)   SELF_COINCIDENCE
 *   candidate is 7th from H (either way)  -&gt; houseByOffset(candidate, 10)   SEVENTH_HOUSE_COINCIDENCE
 *   otherwise                             -&gt; candidate
 * </pre>
 * The correction is applied once. The corrected house is not checked again, even if it happens
 * to land on H or its 7th.
 *
 * <p>The sign of an Arudha is counted from the ascendant sign.</p>
 */
public class ArudhaPadaService {

    private static final int SEVENTH = 7;

    private final AspectCalculationService aspectCalculationService;

    public ArudhaPadaService(AspectCalculationService aspectCalculationService) {
        this.aspectCalculationService = aspectCalculationService;
    }

    /**
     * Arudha of one house; empty when the chart has no position for the house lord.
     *
     * @throws IllegalArgumentException if the house is outside 1..12
     */
    public Optional<ArudhaResult> arudhaPada(Chart chart, int houseNumber) {
        HouseGeometry.requireHouse(houseNumber);
        ZodiacSign lagna = chart.getAscendantSign();
        Planet lord = HouseGeometry.signOfHouse(houseNumber, lagna).getLord();
        Optional<PlanetPosition> position = chart.getPosition(lord);
        if (position.isEmpty()) {
            return Optional.empty();
        }
        int lordHouse = HouseGeometry.houseOfLongitude(position.get().getLongitude(), chart.getAscendantLongitude());
        return Optional.of(project(houseNumber, lord, lordHouse, lagna));
    }

    /**
     * Arudhas A1..A12, each computed independently.
     */
    public ArudhaPadaReport analyzeArudhaPadas(Chart chart) {
        Map<Integer, ArudhaResult> padas = new TreeMap<>();
        List<Integer> absent = new ArrayList<>();
        for (int house = 1; house <= HouseGeometry.HOUSE_COUNT; house++) {
            Optional<ArudhaResult> pada = arudhaPada(chart, house);
            if (pada.isPresent()) {
                padas.put(house, pada.get());
            } else {
                absent.add(house);
            }
        }
        if (!absent.isEmpty()) {
            LoggingService.debug("arudha_padas_omitted", LoggingService.data("houses", absent));
        }
        return new ArudhaPadaReport(padas, absent);
    }

    /**
     * Arudha of the first house.
     */
    public Optional<ArudhaResult> arudhaLagna(Chart chart) {
        return arudhaPada(chart, 1);
    }

    /**
     * Arudha Lagna with its occupants, the grahas casting drishti on it, and the 2nd and 12th
     * houses from it. Empty when the lagna lord has no position.
     */
    public Optional<ArudhaLagnaProfile> arudhaLagnaProfile(Chart chart) {
        Optional<ArudhaResult> arudhaLagna = arudhaLagna(chart);
        if (arudhaLagna.isEmpty()) {
            return Optional.empty();
        }
        ArudhaResult al = arudhaLagna.get();
        ZodiacSign lagna = chart.getAscendantSign();
        int alHouse = al.getCorrectedHouse();
        int second = HouseGeometry.houseByOffset(alHouse, 2);
        int twelfth = HouseGeometry.houseByOffset(alHouse, 12);

        return Optional.of(new ArudhaLagnaProfile(
                al,
                lagna,
                HouseStrengthService.occupants(chart, alHouse),
                aspectCalculationService.planetsAspectingHouse(chart, alHouse),
                second, HouseGeometry.signOfHouse(second, lagna), HouseStrengthService.occupants(chart, second),
                twelfth, HouseGeometry.signOfHouse(twelfth, lagna), HouseStrengthService.occupants(chart, twelfth)));
    }

    /**
     * Projection rule on bare house numbers.
     */
    static ArudhaResult project(int originHouse, Planet lord, int lordHouse, ZodiacSign lagna) {
        int distance = HouseGeometry.houseDistance(originHouse, lordHouse);
        int candidate = HouseGeometry.houseByOffset(lordHouse, distance);

        ArudhaExceptionKind exception = ArudhaExceptionKind.NONE;
        int corrected = candidate;
        if (candidate == originHouse) {
            exception = ArudhaExceptionKind.SELF_COINCIDENCE;
            corrected = HouseGeometry.houseByOffset(candidate, EngineConfig.ARUDHA_CORRECTION_OFFSET);
        } else if (HouseGeometry.houseDistance(originHouse, candidate) == SEVENTH
                || HouseGeometry.houseDistance(candidate, originHouse) == SEVENTH) {
            exception = ArudhaExceptionKind.SEVENTH_HOUSE_COINCIDENCE;
            corrected = HouseGeometry.houseByOffset(candidate, EngineConfig.ARUDHA_CORRECTION_OFFSET);
        }

        return new ArudhaResult(originHouse, lord, lordHouse, distance, candidate, corrected,
                HouseGeometry.signOfHouse(corrected, lagna), exception);
    }
}
