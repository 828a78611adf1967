package im.arun.mathmarkup.model;

/**
 * Inline or display sizing of fractions, large operators, integrals and derivatives.
 * A null mode on a node means no style was requested.
 */
public enum DisplayMode {
    INLINE,
    DISPLAY
}
