package im.arun.mathmarkup.model;

/**
 * Evaluation bar {@code F|_a^b} or square evaluation {@code [F]_a^b}.
 */
public enum EvaluationBracketType {
    BAR(".", "|"),
    SQUARE("[", "]");

    private final String left;
    private final String right;

    EvaluationBracketType(String left, String right) {
        this.left = left;
        this.right = right;
    }

    public String getLeft() {
        return left;
    }

    public String getRight() {
        return right;
    }
}
