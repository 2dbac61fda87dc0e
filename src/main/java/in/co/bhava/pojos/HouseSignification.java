package in.co.bhava.pojos;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Read-only reference data for one of the twelve houses (bhavas).
 *
 * <p>Use {@link #of(int)}; the twelve instances are built once and shared.</p>
 */
public final class HouseSignification {

    private static final List<HouseSignification> TABLE = List.of(
            new HouseSignification(1, "Lagna", HouseNature.KENDRA, Purushartha.DHARMA, Planet.SUN,
                    List.of("personality", "health", "appearance", "self", "vitality")),
            new HouseSignification(2, "Dhana", HouseNature.MARAKA, Purushartha.ARTHA, Planet.JUPITER,
                    List.of("wealth", "family", "speech", "values", "face", "food")),
            new HouseSignification(3, "Sahaja", HouseNature.UPACHAYA, Purushartha.KAMA, Planet.MARS,
                    List.of("siblings", "courage", "communication", "short journeys", "skills")),
            new HouseSignification(4, "Sukha", HouseNature.KENDRA, Purushartha.MOKSHA, Planet.MOON,
                    List.of("mother", "home", "happiness", "land", "education", "vehicles")),
            new HouseSignification(5, "Putra", HouseNature.TRIKONA, Purushartha.DHARMA, Planet.JUPITER,
                    List.of("children", "creativity", "intelligence", "romance", "speculation")),
            new HouseSignification(6, "Ripu", HouseNature.DUSTHANA, Purushartha.ARTHA, Planet.MARS,
                    List.of("enemies", "disease", "debts", "service", "obstacles")),
            new HouseSignification(7, "Kalatra", HouseNature.KENDRA, Purushartha.KAMA, Planet.VENUS,
                    List.of("spouse", "partnerships", "business", "public dealings")),
            new HouseSignification(8, "Ayur", HouseNature.DUSTHANA, Purushartha.MOKSHA, Planet.SATURN,
                    List.of("longevity", "transformation", "occult", "research", "inheritance")),
            new HouseSignification(9, "Bhagya", HouseNature.TRIKONA, Purushartha.DHARMA, Planet.JUPITER,
                    List.of("fortune", "father", "dharma", "higher learning", "long journeys")),
            new HouseSignification(10, "Karma", HouseNature.KENDRA, Purushartha.ARTHA, Planet.SUN,
                    List.of("career", "reputation", "authority", "status", "government")),
            new HouseSignification(11, "Labha", HouseNature.UPACHAYA, Purushartha.KAMA, Planet.JUPITER,
                    List.of("gains", "elder siblings", "hopes", "social circle", "income")),
            new HouseSignification(12, "Vyaya", HouseNature.DUSTHANA, Purushartha.MOKSHA, Planet.SATURN,
                    List.of("losses", "spirituality", "foreign lands", "expenses", "liberation"))
    );

    private final int houseNumber;
    private final String name;
    private final HouseNature nature;
    private final Purushartha purushartha;
    private final Planet karaka;
    private final List<String> significations;

    private HouseSignification(int houseNumber, String name, HouseNature nature,
                               Purushartha purushartha, Planet karaka, List<String> significations) {
        this.houseNumber = houseNumber;
        this.name = name;
        this.nature = nature;
        this.purushartha = purushartha;
        this.karaka = karaka;
        this.significations = significations;
    }

    /**
     * @param houseNumber 1..12
     * @throws IllegalArgumentException for any other number
     */
    public static HouseSignification of(int houseNumber) {
        if (houseNumber < 1 || houseNumber > 12) {
            throw new IllegalArgumentException("Invalid house number: " + houseNumber);
        }
        return TABLE.get(houseNumber - 1);
    }

    public static List<HouseSignification> all() {
        return TABLE;
    }

    public int getHouseNumber() {
        return houseNumber;
    }

    public String getName() {
        return name;
    }

    /** Primary classification as listed in the classical tables. */
    public HouseNature getNature() {
        return nature;
    }

    /**
     * Every category this house belongs to, e.g. {KENDRA, UPACHAYA} for the 10th.
     */
    public Set<HouseNature> getCategories() {
        Set<HouseNature> categories = EnumSet.noneOf(HouseNature.class);
        for (HouseNature candidate : HouseNature.values()) {
            if (candidate.contains(houseNumber)) {
                categories.add(candidate);
            }
        }
        return Collections.unmodifiableSet(categories);
    }

    public Purushartha getPurushartha() {
        return purushartha;
    }

    public Planet getKaraka() {
        return karaka;
    }

    public List<String> getSignifications() {
        return significations;
    }

    @Override
    public String toString() {
        return houseNumber + " (" + name + ")";
    }
}
