package im.arun.mathmarkup.model;

import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Piecewise definition with a left brace.
 */
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class CasesNode extends GridNode {

    public CasesNode(String id, int rows, int cols) {
        super(id, rows, cols);
    }

    @Override
    public NodeType getType() {
        return NodeType.CASES;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitCases(this);
    }
}
