package im.arun.mathmarkup.model;

/**
 * Formatting that can be applied around any node, not only text.
 */
public enum WrapperKind {
    UNDERLINE,
    CANCEL,
    COLOR,
    TEXT_MODE
}
