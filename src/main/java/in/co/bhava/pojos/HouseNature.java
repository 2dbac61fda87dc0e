package in.co.bhava.pojos;

import java.util.Set;

/**
 * Classical house categories. A house may belong to several (house 1 is both kendra and trikona,
 * house 6 is both dusthana and upachaya).
 */
public enum HouseNature {
    KENDRA("Kendra", Set.of(1, 4, 7, 10)),
    TRIKONA("Trikona", Set.of(1, 5, 9)),
    DUSTHANA("Dusthana", Set.of(6, 8, 12)),
    UPACHAYA("Upachaya", Set.of(3, 6, 10, 11)),
    MARAKA("Maraka", Set.of(2, 7));

    private final String displayName;
    private final Set<Integer> houses;

    HouseNature(String displayName, Set<Integer> houses) {
        this.displayName = displayName;
        this.houses = houses;
    }

    public String getDisplayName() {
        return displayName;
    }

    public Set<Integer> getHouses() {
        return houses;
    }

    public boolean contains(int house) {
        return houses.contains(house);
    }

    @Override
    public String toString() {
        return displayName;
    }
}
