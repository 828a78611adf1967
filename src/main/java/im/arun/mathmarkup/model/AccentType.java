package im.arun.mathmarkup.model;

/**
 * Accent decorations. The position is fixed by the type and labeled braces
 * carry an extra label slot.
 */
public enum AccentType {
    HAT("hat", AccentPosition.OVER, false),
    TILDE("tilde", AccentPosition.OVER, false),
    BAR("bar", AccentPosition.OVER, false),
    DOT("dot", AccentPosition.OVER, false),
    DDOT("ddot", AccentPosition.OVER, false),
    VEC("vec", AccentPosition.OVER, false),
    WIDEHAT("widehat", AccentPosition.OVER, false),
    WIDETILDE("widetilde", AccentPosition.OVER, false),
    WIDEBAR("overline", AccentPosition.OVER, false),
    OVERRIGHTARROW("overrightarrow", AccentPosition.OVER, false),
    OVERLEFTARROW("overleftarrow", AccentPosition.OVER, false),
    OVERLEFTRIGHTARROW("overleftrightarrow", AccentPosition.OVER, false),
    OVERBRACE("overbrace", AccentPosition.OVER, false),
    UNDERBRACE("underbrace", AccentPosition.UNDER, false),
    LABELEDOVERBRACE("overbrace", AccentPosition.OVER, true),
    LABELEDUNDERBRACE("underbrace", AccentPosition.UNDER, true),
    OVERPAREN("overparen", AccentPosition.OVER, false),
    UNDERPAREN("underparen", AccentPosition.UNDER, false);

    private final String command;
    private final AccentPosition position;
    private final boolean labeled;

    AccentType(String command, AccentPosition position, boolean labeled) {
        this.command = command;
        this.position = position;
        this.labeled = labeled;
    }

    /**
     * Markup command name without the leading backslash.
     */
    public String getCommand() {
        return command;
    }

    public AccentPosition getPosition() {
        return position;
    }

    public boolean isLabeled() {
        return labeled;
    }
}
