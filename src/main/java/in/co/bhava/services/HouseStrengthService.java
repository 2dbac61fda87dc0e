package in.co.bhava.services;

import in.co.bhava.pojos.AspectResult;
import in.co.bhava.pojos.Chart;
import in.co.bhava.pojos.HouseAnalysis;
import in.co.bhava.pojos.HouseAnalysisReport;
import in.co.bhava.pojos.HouseLordInfo;
import in.co.bhava.pojos.HouseNature;
import in.co.bhava.pojos.HouseRanking;
import in.co.bhava.pojos.LordPlacement;
import in.co.bhava.pojos.Planet;
import in.co.bhava.pojos.PlanetPosition;
import in.co.bhava.pojos.StrengthBreakdown;
import in.co.bhava.pojos.ZodiacSign;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Scores the twelve houses of a chart and ranks them.
 *
 * <h2>House strength</h2>
 * <pre>
 *   strength = 5
 *            + dignity of the lord            (Exalted +3, Own Sign +2, Debilitated -2)
 *            + 2  lord sits in the house it rules
 *            + 1  houseDistance(house, lordHouse) is a kendra or trikona number
 *            + 1  per benefic occupant          (kendra / trikona houses)
 *            + 1  per malefic occupant          (upachaya houses)
 *            + 1 kendra, + 1 trikona, - 1 dusthana
 *   clamped to [1, 10]
 * </pre>
 * When the lord has no position all lord terms are skipped and {@link HouseAnalysis#getLordInfo()}
 * is empty. Aspects are attached to each house for reading but do not change the score.
 *
 * <h2>Lord condition score</h2>
 * <pre>
 *   score = 3 + dignity + 1 kendra + 1 trikona - 1 dusthana (of the house the lord sits in)
 *   clamped to [1, 8]
 * </pre>
 */
public class HouseStrengthService {

    private static final HouseNature[] AVERAGED_CATEGORIES = {
            HouseNature.KENDRA, HouseNature.TRIKONA, HouseNature.DUSTHANA, HouseNature.UPACHAYA
    };

    private final AspectCalculationService aspectCalculationService;

    public HouseStrengthService(AspectCalculationService aspectCalculationService) {
        this.aspectCalculationService = aspectCalculationService;
    }

    /**
     * Analyse all twelve houses.
     */
    public HouseAnalysisReport analyzeHouses(Chart chart) {
        List<HouseAnalysis> houses = new ArrayList<>(HouseGeometry.HOUSE_COUNT);
        for (int house = 1; house <= HouseGeometry.HOUSE_COUNT; house++) {
            houses.add(analyzeHouse(chart, house));
        }
        HouseRanking ranking = rank(houses);
        Map<HouseNature, Double> averages = categoryAverages(houses);

        LoggingService.debug("houses_analyzed", LoggingService.data(
                "strongest", ranking.getStrongest(),
                "weakest", ranking.getWeakest(),
                "missingPlanets", chart.getMissingPlanets().size()));
        return new HouseAnalysisReport(houses, ranking, averages, chart.getMissingPlanets());
    }

    /**
     * Analyse one house.
     *
     * @throws IllegalArgumentException if the house is outside 1..12
     */
    public HouseAnalysis analyzeHouse(Chart chart, int houseNumber) {
        HouseGeometry.requireHouse(houseNumber);
        ZodiacSign sign = HouseGeometry.signOfHouse(houseNumber, chart.getAscendantSign());
        Planet lord = sign.getLord();
        HouseLordInfo lordInfo = houseLord(chart, houseNumber).orElse(null);
        List<Planet> occupants = occupants(chart, houseNumber);

        int dignity = 0;
        int ownHouse = 0;
        int placement = 0;
        if (lordInfo != null) {
            dignity = lordInfo.getDignity().getHouseStrengthBonus();
            if (lordInfo.isInOwnHouse()) {
                ownHouse = EngineConfig.LORD_IN_OWN_HOUSE_BONUS;
            }
            int distance = lordInfo.getHouseDistanceFromOwn();
            if (HouseNature.KENDRA.contains(distance) || HouseNature.TRIKONA.contains(distance)) {
                placement = EngineConfig.LORD_KENDRA_TRIKONA_FROM_OWN_BONUS;
            }
        }

        int occupantTerm = 0;
        boolean kendraOrTrikona = HouseNature.KENDRA.contains(houseNumber) || HouseNature.TRIKONA.contains(houseNumber);
        boolean upachaya = HouseNature.UPACHAYA.contains(houseNumber);
        for (Planet occupant : occupants) {
            if (kendraOrTrikona && occupant.isBenefic()) {
                occupantTerm += EngineConfig.OCCUPANT_BONUS;
            }
            if (upachaya && occupant.isMalefic()) {
                occupantTerm += EngineConfig.OCCUPANT_BONUS;
            }
        }

        StrengthBreakdown breakdown = StrengthBreakdown.of(
                EngineConfig.BASE_HOUSE_STRENGTH, dignity, ownHouse, placement, occupantTerm,
                categoryTerm(houseNumber),
                EngineConfig.MIN_HOUSE_STRENGTH, EngineConfig.MAX_HOUSE_STRENGTH);

        List<AspectResult> aspects = aspectCalculationService.aspectsOnHouse(chart, houseNumber);
        return new HouseAnalysis(houseNumber, sign, lord, lordInfo, occupants, aspects, breakdown);
    }

    /**
     * Condition of the lord of {@code houseNumber}; empty when the chart has no position for it.
     */
    public Optional<HouseLordInfo> houseLord(Chart chart, int houseNumber) {
        HouseGeometry.requireHouse(houseNumber);
        Planet lord = HouseGeometry.signOfHouse(houseNumber, chart.getAscendantSign()).getLord();
        Optional<PlanetPosition> position = chart.getPosition(lord);
        if (position.isEmpty()) {
            return Optional.empty();
        }
        PlanetPosition lordPosition = position.get();
        int currentHouse = HouseGeometry.houseOfLongitude(lordPosition.getLongitude(), chart.getAscendantLongitude());
        int distance = HouseGeometry.houseDistance(houseNumber, currentHouse);

        int score = EngineConfig.BASE_LORD_STRENGTH
                + lordPosition.getDignity().getHouseStrengthBonus()
                + categoryTerm(currentHouse);
        score = Math.max(EngineConfig.MIN_LORD_STRENGTH, Math.min(EngineConfig.MAX_LORD_STRENGTH, score));

        return Optional.of(new HouseLordInfo(lord, houseNumber, currentHouse, lordPosition.getSign(),
                lordPosition.getDignity(), distance, LordPlacement.fromDistance(distance), score));
    }

    // -------------------------------------------------------------------------
    // Internals
    // -------------------------------------------------------------------------

    static List<Planet> occupants(Chart chart, int houseNumber) {
        List<Planet> occupants = new ArrayList<>();
        for (PlanetPosition position : chart.getPositions().values()) {
            if (HouseGeometry.houseOfLongitude(position.getLongitude(), chart.getAscendantLongitude()) == houseNumber) {
                occupants.add(position.getPlanet());
            }
        }
        return occupants;
    }

    private static int categoryTerm(int houseNumber) {
        int term = 0;
        if (HouseNature.KENDRA.contains(houseNumber)) term += EngineConfig.KENDRA_HOUSE_BONUS;
        if (HouseNature.TRIKONA.contains(houseNumber)) term += EngineConfig.TRIKONA_HOUSE_BONUS;
        if (HouseNature.DUSTHANA.contains(houseNumber)) term += EngineConfig.DUSTHANA_HOUSE_PENALTY;
        return term;
    }

    private static HouseRanking rank(List<HouseAnalysis> houses) {
        List<HouseAnalysis> sorted = new ArrayList<>(houses);
        // List.sort is stable and houses arrive in house order, so equal strengths keep house order
        sorted.sort(Comparator.comparingInt(HouseAnalysis::getStrength).reversed());

        int size = Math.min(EngineConfig.RANKING_SIZE, sorted.size());
        List<Integer> strongest = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            strongest.add(sorted.get(i).getHouseNumber());
        }
        List<Integer> weakest = new ArrayList<>(size);
        for (int i = sorted.size() - 1; i >= sorted.size() - size; i--) {
            weakest.add(sorted.get(i).getHouseNumber());
        }

        return new HouseRanking(strongest, weakest,
                housesIn(houses, HouseNature.KENDRA),
                housesIn(houses, HouseNature.TRIKONA),
                housesIn(houses, HouseNature.DUSTHANA));
    }

    private static List<Integer> housesIn(List<HouseAnalysis> houses, HouseNature nature) {
        List<Integer> result = new ArrayList<>();
        for (HouseAnalysis house : houses) {
            if (nature.contains(house.getHouseNumber())) {
                result.add(house.getHouseNumber());
            }
        }
        return result;
    }

    private static Map<HouseNature, Double> categoryAverages(List<HouseAnalysis> houses) {
        Map<HouseNature, Double> averages = new EnumMap<>(HouseNature.class);
        for (HouseNature nature : AVERAGED_CATEGORIES) {
            int total = 0;
            int count = 0;
            for (HouseAnalysis house : houses) {
                if (nature.contains(house.getHouseNumber())) {
                    total += house.getStrength();
                    count++;
                }
            }
            averages.put(nature, count == 0 ? 0.0 : (double) total / count);
        }
        return averages;
    }
}
