package im.arun.mathmarkup.model;

public enum NodeType {
    TEXT,
    FRACTION,
    BEVELLED_FRACTION,
    SQRT,
    NTHROOT,
    SCRIPT,
    BRACKET,
    LARGE_OPERATOR,
    DERIVATIVE,
    INTEGRAL,
    MATRIX,
    STACK,
    CASES,
    ACCENT,
    FUNCTION
}
