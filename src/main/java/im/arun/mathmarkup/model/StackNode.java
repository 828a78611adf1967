package im.arun.mathmarkup.model;

import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Vertical arrangement without delimiters.
 */
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class StackNode extends GridNode {

    public StackNode(String id, int rows, int cols) {
        super(id, rows, cols);
    }

    @Override
    public NodeType getType() {
        return NodeType.STACK;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitStack(this);
    }
}
