package im.arun.mathmarkup.model;

/**
 * Argument layout of a function: plain, with a base subscript, or with a limit-style constraint.
 */
public enum FunctionShape {
    SIMPLE,
    SUB,
    LIM
}
