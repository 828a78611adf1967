package im.arun.mathmarkup.model;

public enum SlotName {
    NUMERATOR,
    DENOMINATOR,
    RADICAND,
    INDEX,
    BASE,
    SUPERSCRIPT,
    SUBSCRIPT,
    CONTENT,
    LOWER_LIMIT,
    UPPER_LIMIT,
    OPERAND,
    ORDER,
    FUNCTION,
    VARIABLE,
    INTEGRAND,
    DIFFERENTIAL_VARIABLE,
    CELL,
    ACCENT_BASE,
    ACCENT_LABEL,
    FUNCTION_NAME,
    FUNCTION_CONSTRAINT,
    FUNCTION_BASE,
    FUNCTION_ARGUMENT
}
