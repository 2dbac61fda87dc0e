package in.co.bhava.pojos;

import java.util.List;
import java.util.Objects;

/**
 * The Arudha Lagna together with the houses read around it: its occupants, the grahas casting
 * drishti on it, and the 2nd and 12th houses counted from it.
 */
public final class ArudhaLagnaProfile {

    private final ArudhaResult arudhaLagna;
    private final ZodiacSign lagnaSign;
    private final List<Planet> occupants;
    private final List<AspectResult> drishtiOnArudha;
    private final int secondHouse;
    private final ZodiacSign secondSign;
    private final List<Planet> secondHouseOccupants;
    private final int twelfthHouse;
    private final ZodiacSign twelfthSign;
    private final List<Planet> twelfthHouseOccupants;

    public ArudhaLagnaProfile(ArudhaResult arudhaLagna, ZodiacSign lagnaSign, List<Planet> occupants,
                              List<AspectResult> drishtiOnArudha,
                              int secondHouse, ZodiacSign secondSign, List<Planet> secondHouseOccupants,
                              int twelfthHouse, ZodiacSign twelfthSign, List<Planet> twelfthHouseOccupants) {
        this.arudhaLagna = Objects.requireNonNull(arudhaLagna, "arudhaLagna");
        this.lagnaSign = Objects.requireNonNull(lagnaSign, "lagnaSign");
        this.occupants = List.copyOf(occupants);
        this.drishtiOnArudha = List.copyOf(drishtiOnArudha);
        this.secondHouse = secondHouse;
        this.secondSign = secondSign;
        this.secondHouseOccupants = List.copyOf(secondHouseOccupants);
        this.twelfthHouse = twelfthHouse;
        this.twelfthSign = twelfthSign;
        this.twelfthHouseOccupants = List.copyOf(twelfthHouseOccupants);
    }

    public ArudhaResult getArudhaLagna() {
        return arudhaLagna;
    }

    public ZodiacSign getLagnaSign() {
        return lagnaSign;
    }

    public boolean isSameSignAsLagna() {
        return arudhaLagna.getSign() == lagnaSign;
    }

    public List<Planet> getOccupants() {
        return occupants;
    }

    public List<AspectResult> getDrishtiOnArudha() {
        return drishtiOnArudha;
    }

    public int getSecondHouse() {
        return secondHouse;
    }

    public ZodiacSign getSecondSign() {
        return secondSign;
    }

    public List<Planet> getSecondHouseOccupants() {
        return secondHouseOccupants;
    }

    public int getTwelfthHouse() {
        return twelfthHouse;
    }

    public ZodiacSign getTwelfthSign() {
        return twelfthSign;
    }

    public List<Planet> getTwelfthHouseOccupants() {
        return twelfthHouseOccupants;
    }

    @Override
    public String toString() {
        return String.format("ArudhaLagnaProfile{AL=%d %s, occupants=%s, 2nd=%d %s, 12th=%d %s}",
                arudhaLagna.getCorrectedHouse(), arudhaLagna.getSign(), occupants,
                secondHouse, secondSign, twelfthHouse, twelfthSign);
    }
}
