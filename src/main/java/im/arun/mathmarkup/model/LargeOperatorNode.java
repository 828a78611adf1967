package im.arun.mathmarkup.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;

/**
 * Sum, product, big union and the like. The operator is stored as its
 * Unicode glyph.
 */
@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class LargeOperatorNode extends Node {

    @JsonProperty("operator")
    private String operator;

    @JsonProperty("limit_mode")
    private LimitMode limitMode = LimitMode.DEFAULT;

    @JsonProperty("display_mode")
    private DisplayMode displayMode;

    @JsonProperty("lower_limit")
    private List<Node> lowerLimit = new ArrayList<>();

    @JsonProperty("upper_limit")
    private List<Node> upperLimit = new ArrayList<>();

    @JsonProperty("operand")
    private List<Node> operand = new ArrayList<>();

    public LargeOperatorNode(String id, String operator, DisplayMode displayMode, LimitMode limitMode) {
        super(id);
        this.operator = operator;
        this.displayMode = displayMode;
        this.limitMode = limitMode;
    }

    @Override
    public NodeType getType() {
        return NodeType.LARGE_OPERATOR;
    }

    @Override
    public List<Slot> getSlots() {
        return List.of(
            Slot.of(SlotName.LOWER_LIMIT, lowerLimit),
            Slot.of(SlotName.UPPER_LIMIT, upperLimit),
            Slot.of(SlotName.OPERAND, operand));
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitLargeOperator(this);
    }
}
