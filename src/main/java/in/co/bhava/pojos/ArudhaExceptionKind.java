package in.co.bhava.pojos;

/**
 * Which classical correction, if any, moved an Arudha away from its raw projection.
 */
public enum ArudhaExceptionKind {
    NONE,
    /** Projection fell back on the house itself. */
    SELF_COINCIDENCE,
    /** Projection fell on the house seventh from the original. */
    SEVENTH_HOUSE_COINCIDENCE
}
