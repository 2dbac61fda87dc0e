package in.co.bhava.pojos;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Result of analysing all twelve houses of one chart.
 */
public final class HouseAnalysisReport {

    private final List<HouseAnalysis> houses;
    private final HouseRanking ranking;
    private final Map<HouseNature, Double> categoryAverages;
    private final Set<Planet> missingPlanets;

    public HouseAnalysisReport(List<HouseAnalysis> houses, HouseRanking ranking,
                               Map<HouseNature, Double> categoryAverages, Set<Planet> missingPlanets) {
        this.houses = List.copyOf(houses);
        this.ranking = Objects.requireNonNull(ranking, "ranking");
        this.categoryAverages = Collections.unmodifiableMap(new EnumMap<>(categoryAverages));
        Set<Planet> missing = EnumSet.noneOf(Planet.class);
        missing.addAll(missingPlanets);
        this.missingPlanets = Collections.unmodifiableSet(missing);
    }

    /** All twelve houses, house 1 first. */
    public List<HouseAnalysis> getHouses() {
        return houses;
    }

    public HouseAnalysis getHouse(int houseNumber) {
        if (houseNumber < 1 || houseNumber > houses.size()) {
            throw new IllegalArgumentException("Invalid house number: " + houseNumber);
        }
        return houses.get(houseNumber - 1);
    }

    public HouseRanking getRanking() {
        return ranking;
    }

    /** Average strength for kendra, trikona, dusthana and upachaya houses. */
    public Map<HouseNature, Double> getCategoryAverages() {
        return categoryAverages;
    }

    public double getCategoryAverage(HouseNature nature) {
        Double average = categoryAverages.get(nature);
        if (average == null) {
            throw new IllegalArgumentException("No average computed for " + nature);
        }
        return average;
    }

    /** Grahas without a position; their lord-derived terms were skipped. */
    public Set<Planet> getMissingPlanets() {
        return missingPlanets;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HouseAnalysisReport)) return false;
        HouseAnalysisReport that = (HouseAnalysisReport) o;
        return houses.equals(that.houses) && ranking.equals(that.ranking)
                && categoryAverages.equals(that.categoryAverages) && missingPlanets.equals(that.missingPlanets);
    }

    @Override
    public int hashCode() {
        return Objects.hash(houses, ranking, categoryAverages, missingPlanets);
    }

    @Override
    public String toString() {
        return "HouseAnalysisReport{" + ranking + ", averages=" + categoryAverages
                + ", missing=" + missingPlanets + "}";
    }
}
