package im.arun.mathmarkup.serializer;

/**
 * How bracket delimiters are sized in emitted markup.
 */
public enum BracketSizing {
    /** {@code \left ... \right}, sized by the typesetter. */
    AUTO,
    /** Explicit {@code \bigl .. \Biggl} sizes, largest on the outermost bracket. */
    DEPTH_SCALED
}
