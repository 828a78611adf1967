package im.arun.mathmarkup.model;

/**
 * Where the limits of a large operator or integral are placed.
 */
public enum LimitMode {
    DEFAULT,
    NOLIMITS,
    LIMITS
}
