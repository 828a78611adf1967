package im.arun.mathmarkup.model;

public enum UnderlineStyle {
    SINGLE,
    DOUBLE
}
