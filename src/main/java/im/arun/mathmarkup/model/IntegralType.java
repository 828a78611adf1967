package im.arun.mathmarkup.model;

public enum IntegralType {
    SINGLE("int", "∫"),
    DOUBLE("iint", "∬"),
    TRIPLE("iiint", "∭"),
    CONTOUR("oint", "∮");

    private final String commandBase;
    private final String symbol;

    IntegralType(String commandBase, String symbol) {
        this.commandBase = commandBase;
        this.symbol = symbol;
    }

    public String getCommandBase() {
        return commandBase;
    }

    public String getSymbol() {
        return symbol;
    }
}
