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
public class NthRootNode extends Node {

    @JsonProperty("index")
    private List<Node> index = new ArrayList<>();

    @JsonProperty("radicand")
    private List<Node> radicand = new ArrayList<>();

    public NthRootNode(String id) {
        super(id);
    }

    @Override
    public NodeType getType() {
        return NodeType.NTHROOT;
    }

    @Override
    public List<Slot> getSlots() {
        return List.of(Slot.of(SlotName.RADICAND, radicand), Slot.of(SlotName.INDEX, index));
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitNthRoot(this);
    }
}
