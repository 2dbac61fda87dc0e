package in.co.bhava.pojos;

/**
 * Presentation grade for a house strength on the 1..10 scale.
 */
public enum StrengthGrade {
    EXCELLENT("Excellent", 8),
    GOOD("Good", 6),
    AVERAGE("Average", 4),
    WEAK("Weak", 2),
    VERY_WEAK("Very Weak", Integer.MIN_VALUE);

    private final String displayName;
    private final int minimumStrength;

    StrengthGrade(String displayName, int minimumStrength) {
        this.displayName = displayName;
        this.minimumStrength = minimumStrength;
    }

    public String getDisplayName() {
        return displayName;
    }

    public static StrengthGrade of(int strength) {
        for (StrengthGrade grade : values()) {
            if (strength >= grade.minimumStrength) {
                return grade;
            }
        }
        return VERY_WEAK;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
