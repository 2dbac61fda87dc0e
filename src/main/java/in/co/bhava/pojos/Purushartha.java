package in.co.bhava.pojos;

/**
 * The four aims of life the houses are grouped under.
 */
public enum Purushartha {
    DHARMA,
    ARTHA,
    KAMA,
    MOKSHA
}
