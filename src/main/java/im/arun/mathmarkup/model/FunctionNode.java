package im.arun.mathmarkup.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;

/**
 * A named function applied to an argument. All four slots always exist;
 * which of them are meaningful depends on the function type's shape and on
 * whether the name is user-defined.
 */
@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class FunctionNode extends Node {

    @JsonProperty("function_type")
    private FunctionType functionType;

    @JsonProperty("function_name")
    private List<Node> functionName = new ArrayList<>();

    @JsonProperty("function_argument")
    private List<Node> functionArgument = new ArrayList<>();

    @JsonProperty("function_base")
    private List<Node> functionBase = new ArrayList<>();

    @JsonProperty("function_constraint")
    private List<Node> functionConstraint = new ArrayList<>();

    public FunctionNode(String id, FunctionType functionType) {
        super(id);
        this.functionType = functionType;
    }

    @Override
    public NodeType getType() {
        return NodeType.FUNCTION;
    }

    @Override
    public List<Slot> getSlots() {
        List<Slot> slots = new ArrayList<>();
        if (functionType.isUserDefined()) {
            slots.add(Slot.of(SlotName.FUNCTION_NAME, functionName));
        }
        if (functionType.getShape() == FunctionShape.LIM) {
            slots.add(Slot.of(SlotName.FUNCTION_CONSTRAINT, functionConstraint));
        }
        if (functionType.getShape() == FunctionShape.SUB) {
            slots.add(Slot.of(SlotName.FUNCTION_BASE, functionBase));
        }
        slots.add(Slot.of(SlotName.FUNCTION_ARGUMENT, functionArgument));
        return slots;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitFunction(this);
    }
}
