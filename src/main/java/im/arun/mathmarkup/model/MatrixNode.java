package im.arun.mathmarkup.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class MatrixNode extends GridNode {

    @JsonProperty("matrix_type")
    private MatrixType matrixType = MatrixType.PARENTHESES;

    public MatrixNode(String id, int rows, int cols, MatrixType matrixType) {
        super(id, rows, cols);
        this.matrixType = matrixType;
    }

    @Override
    public NodeType getType() {
        return NodeType.MATRIX;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitMatrix(this);
    }
}
