package in.co.bhava.pojos;

public enum AnalysisErrorKind {
    /** Chart missing the ascendant, or carrying an unusable longitude or sign. */
    MALFORMED_CHART
}
