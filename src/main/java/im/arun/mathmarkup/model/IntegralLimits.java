package im.arun.mathmarkup.model;

/**
 * Which bound slots a newly created integral carries.
 */
public enum IntegralLimits {
    BOTH(true, true),
    LOWER_ONLY(true, false),
    UPPER_ONLY(false, true),
    NONE(false, false);

    private final boolean lower;
    private final boolean upper;

    IntegralLimits(boolean lower, boolean upper) {
        this.lower = lower;
        this.upper = upper;
    }

    public boolean hasLower() {
        return lower;
    }

    public boolean hasUpper() {
        return upper;
    }
}
