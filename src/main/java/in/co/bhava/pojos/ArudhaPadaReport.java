package in.co.bhava.pojos;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Arudhas A1..A12 of one chart. Houses whose lord has no position are listed in
 * {@link #getAbsentHouses()} instead of {@link #getPadas()}.
 */
public final class ArudhaPadaReport {

    private final Map<Integer, ArudhaResult> padas;
    private final List<Integer> absentHouses;

    public ArudhaPadaReport(Map<Integer, ArudhaResult> padas, List<Integer> absentHouses) {
        this.padas = Collections.unmodifiableMap(new TreeMap<>(padas));
        this.absentHouses = List.copyOf(absentHouses);
    }

    /** Keyed by origin house, ascending. */
    public Map<Integer, ArudhaResult> getPadas() {
        return padas;
    }

    public Optional<ArudhaResult> getPada(int originHouse) {
        return Optional.ofNullable(padas.get(originHouse));
    }

    public Optional<ArudhaResult> getArudhaLagna() {
        return getPada(1);
    }

    public List<Integer> getAbsentHouses() {
        return absentHouses;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ArudhaPadaReport)) return false;
        ArudhaPadaReport that = (ArudhaPadaReport) o;
        return padas.equals(that.padas) && absentHouses.equals(that.absentHouses);
    }

    @Override
    public int hashCode() {
        return Objects.hash(padas, absentHouses);
    }

    @Override
    public String toString() {
        return "ArudhaPadaReport{padas=" + padas.values() + ", absent=" + absentHouses + "}";
    }
}
