package im.arun.mathmarkup.symbols;

import im.arun.mathmarkup.model.IntegralLimits;
import im.arun.mathmarkup.model.LimitMode;

/**
 * Suffix part of an integral command. Encodes which bounds are present,
 * how many arguments follow and where the limits go.
 */
public enum IntegralForm {
    INDEFINITE("", 2, IntegralLimits.NONE, LimitMode.DEFAULT),
    SUB("sub", 3, IntegralLimits.LOWER_ONLY, LimitMode.DEFAULT),
    SUB_NOLIMITS("subnolim", 3, IntegralLimits.LOWER_ONLY, LimitMode.NOLIMITS),
    SUB_LIMITS("sublim", 3, IntegralLimits.LOWER_ONLY, LimitMode.LIMITS),
    DEFINITE("l", 4, IntegralLimits.BOTH, LimitMode.DEFAULT),
    DEFINITE_NOLIMITS("nolim", 4, IntegralLimits.BOTH, LimitMode.NOLIMITS),
    DEFINITE_LIMITS("lim", 4, IntegralLimits.BOTH, LimitMode.LIMITS),
    /** Older spelling of {@link #SUB_LIMITS}, accepted on input only. */
    LOWER("lower", 3, IntegralLimits.LOWER_ONLY, LimitMode.LIMITS);

    private final String suffix;
    private final int arity;
    private final IntegralLimits limits;
    private final LimitMode limitMode;

    IntegralForm(String suffix, int arity, IntegralLimits limits, LimitMode limitMode) {
        this.suffix = suffix;
        this.arity = arity;
        this.limits = limits;
        this.limitMode = limitMode;
    }

    public String getSuffix() {
        return suffix;
    }

    public int getArity() {
        return arity;
    }

    public IntegralLimits getLimits() {
        return limits;
    }

    public LimitMode getLimitMode() {
        return limitMode;
    }

    public boolean isAlias() {
        return this == LOWER;
    }

    /**
     * The form the serializer emits for the given bounds and placement.
     * An upper bound without a lower one has no spelling of its own and
     * uses the four-argument form with an empty lower bound.
     */
    public static IntegralForm forEmission(IntegralLimits limits, LimitMode limitMode) {
        switch (limits) {
            case NONE:
                return INDEFINITE;
            case LOWER_ONLY:
                switch (limitMode) {
                    case NOLIMITS:
                        return SUB_NOLIMITS;
                    case LIMITS:
                        return SUB_LIMITS;
                    default:
                        return SUB;
                }
            default:
                switch (limitMode) {
                    case NOLIMITS:
                        return DEFINITE_NOLIMITS;
                    case LIMITS:
                        return DEFINITE_LIMITS;
                    default:
                        return DEFINITE;
                }
        }
    }
}
