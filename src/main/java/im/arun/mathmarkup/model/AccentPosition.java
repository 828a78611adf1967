package im.arun.mathmarkup.model;

public enum AccentPosition {
    OVER,
    UNDER
}
