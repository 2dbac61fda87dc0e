package in.co.bhava.pojos;

import java.util.List;
import java.util.Objects;

/**
 * Houses ordered by strength, plus the category buckets used for summaries.
 */
public final class HouseRanking {

    private final List<Integer> strongest;
    private final List<Integer> weakest;
    private final List<Integer> kendraHouses;
    private final List<Integer> trikonaHouses;
    private final List<Integer> dusthanaHouses;

    public HouseRanking(List<Integer> strongest, List<Integer> weakest, List<Integer> kendraHouses,
                        List<Integer> trikonaHouses, List<Integer> dusthanaHouses) {
        this.strongest = List.copyOf(strongest);
        this.weakest = List.copyOf(weakest);
        this.kendraHouses = List.copyOf(kendraHouses);
        this.trikonaHouses = List.copyOf(trikonaHouses);
        this.dusthanaHouses = List.copyOf(dusthanaHouses);
    }

    /** Strongest houses, strongest first. */
    public List<Integer> getStrongest() {
        return strongest;
    }

    /** Weakest houses, weakest first. */
    public List<Integer> getWeakest() {
        return weakest;
    }

    public List<Integer> getKendraHouses() {
        return kendraHouses;
    }

    public List<Integer> getTrikonaHouses() {
        return trikonaHouses;
    }

    public List<Integer> getDusthanaHouses() {
        return dusthanaHouses;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HouseRanking)) return false;
        HouseRanking that = (HouseRanking) o;
        return strongest.equals(that.strongest) && weakest.equals(that.weakest)
                && kendraHouses.equals(that.kendraHouses) && trikonaHouses.equals(that.trikonaHouses)
                && dusthanaHouses.equals(that.dusthanaHouses);
    }

    @Override
    public int hashCode() {
        return Objects.hash(strongest, weakest, kendraHouses, trikonaHouses, dusthanaHouses);
    }

    @Override
    public String toString() {
        return "HouseRanking{strongest=" + strongest + ", weakest=" + weakest + "}";
    }
}
