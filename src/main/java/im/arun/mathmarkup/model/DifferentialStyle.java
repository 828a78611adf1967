package im.arun.mathmarkup.model;

/**
 * Typeface of the differential "d". Italic maps to the custom derivative and
 * integral commands, roman to the physics-style ones.
 */
public enum DifferentialStyle {
    ITALIC("i"),
    ROMAN("d");

    private final String commandInfix;

    DifferentialStyle(String commandInfix) {
        this.commandInfix = commandInfix;
    }

    /**
     * Letter inserted after the integral base in command spellings, e.g. {@code \int<b>i</b>l}.
     */
    public String getCommandInfix() {
        return commandInfix;
    }
}
