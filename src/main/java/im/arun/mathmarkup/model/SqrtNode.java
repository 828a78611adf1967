package im.arun.mathmarkup.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class SqrtNode extends Node {

    @JsonProperty("radicand")
    private List<Node> radicand = new ArrayList<>();

    public SqrtNode(String id) {
        super(id);
    }

    @Override
    public NodeType getType() {
        return NodeType.SQRT;
    }

    @Override
    public List<Slot> getSlots() {
        return List.of(Slot.of(SlotName.RADICAND, radicand));
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitSqrt(this);
    }
}
