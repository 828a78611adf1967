package im.arun.mathmarkup.model;

/**
 * Built-in and user-defined functions.
 */
public enum FunctionType {
    SIN("sin", FunctionShape.SIMPLE, true),
    COS("cos", FunctionShape.SIMPLE, true),
    TAN("tan", FunctionShape.SIMPLE, true),
    SEC("sec", FunctionShape.SIMPLE, true),
    CSC("csc", FunctionShape.SIMPLE, true),
    COT("cot", FunctionShape.SIMPLE, true),
    ASIN("asin", FunctionShape.SIMPLE, false),
    ACOS("acos", FunctionShape.SIMPLE, false),
    ATAN("atan", FunctionShape.SIMPLE, false),
    SINH("sinh", FunctionShape.SIMPLE, true),
    COSH("cosh", FunctionShape.SIMPLE, true),
    TANH("tanh", FunctionShape.SIMPLE, true),
    ASINH("asinh", FunctionShape.SIMPLE, false),
    ACOSH("acosh", FunctionShape.SIMPLE, false),
    ATANH("atanh", FunctionShape.SIMPLE, false),
    LOG("log", FunctionShape.SIMPLE, true),
    LOGN("log", FunctionShape.SUB, true),
    LN("ln", FunctionShape.SIMPLE, true),
    MAX("max", FunctionShape.LIM, true),
    MIN("min", FunctionShape.LIM, true),
    LIM("lim", FunctionShape.LIM, true),
    ARGMAX("argmax", FunctionShape.LIM, false),
    ARGMIN("argmin", FunctionShape.LIM, false),
    FUNCTION(null, FunctionShape.SIMPLE, false),
    FUNCTIONSUB(null, FunctionShape.SUB, false),
    FUNCTIONLIM(null, FunctionShape.LIM, false);

    private final String name;
    private final FunctionShape shape;
    private final boolean builtinCommand;

    FunctionType(String name, FunctionShape shape, boolean builtinCommand) {
        this.name = name;
        this.shape = shape;
        this.builtinCommand = builtinCommand;
    }

    /**
     * Printed name, or null for user-defined functions whose name lives in a slot.
     */
    public String getName() {
        return name;
    }

    public FunctionShape getShape() {
        return shape;
    }

    /**
     * True when the typesetting engine knows {@code \name} directly; otherwise the
     * name goes through {@code \operatorname}.
     */
    public boolean hasBuiltinCommand() {
        return builtinCommand;
    }

    public boolean isUserDefined() {
        return name == null;
    }

    public static FunctionType userDefined(FunctionShape shape) {
        switch (shape) {
            case SUB:
                return FUNCTIONSUB;
            case LIM:
                return FUNCTIONLIM;
            default:
                return FUNCTION;
        }
    }
}
