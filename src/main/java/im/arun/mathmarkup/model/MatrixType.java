package im.arun.mathmarkup.model;

public enum MatrixType {
    PARENTHESES("pmatrix"),
    BRACKETS("bmatrix"),
    BRACES("Bmatrix"),
    BARS("vmatrix"),
    DOUBLE_BARS("Vmatrix"),
    NONE("matrix");

    private final String environment;

    MatrixType(String environment) {
        this.environment = environment;
    }

    public String getEnvironment() {
        return environment;
    }

    public static MatrixType fromEnvironment(String environment) {
        for (MatrixType type : values()) {
            if (type.environment.equals(environment)) {
                return type;
            }
        }
        return null;
    }
}
