package in.co.bhava.services;

/**
 * Configuration class for the chart analysis engine.
 * Scoring constants are fixed; orbs and batch sizing can be overridden through
 * {@value #CONFIG_RESOURCE} on the classpath (see {@link EngineConfigProvider}).
 */
public class EngineConfig {

    // Override file, looked up on the classpath
    public static final String CONFIG_RESOURCE = "bhava-engine.json";

    // Override keys
    public static final String KEY_ORB_PREFIX = "orb.";
    public static final String KEY_BATCH_THREADS = "batch.threads";
    public static final String KEY_BATCH_TIMEOUT_SECONDS = "batch.timeoutSeconds";

    // House strength
    public static final int BASE_HOUSE_STRENGTH = 5;
    public static final int MIN_HOUSE_STRENGTH = 1;
    public static final int MAX_HOUSE_STRENGTH = 10;
    public static final int LORD_IN_OWN_HOUSE_BONUS = 2;
    public static final int LORD_KENDRA_TRIKONA_FROM_OWN_BONUS = 1;
    public static final int OCCUPANT_BONUS = 1;
    public static final int KENDRA_HOUSE_BONUS = 1;
    public static final int TRIKONA_HOUSE_BONUS = 1;
    public static final int DUSTHANA_HOUSE_PENALTY = -1;
    public static final int RANKING_SIZE = 3;

    // House lord condition score
    public static final int BASE_LORD_STRENGTH = 3;
    public static final int MIN_LORD_STRENGTH = 1;
    public static final int MAX_LORD_STRENGTH = 8;

    // Graha drishti strengths (percent)
    public static final int MARS_DRISHTI_STRENGTH = 75;
    public static final int JUPITER_DRISHTI_STRENGTH = 80;
    public static final int SATURN_DRISHTI_STRENGTH = 70;
    public static final int NODE_DRISHTI_STRENGTH = 60;

    // Arudha correction: take the 10th from the coinciding house
    public static final int ARUDHA_CORRECTION_OFFSET = 10;

    // Batch analysis
    public static final int DEFAULT_BATCH_THREADS = 4;
    public static final int DEFAULT_BATCH_TIMEOUT_SECONDS = 30;
}
