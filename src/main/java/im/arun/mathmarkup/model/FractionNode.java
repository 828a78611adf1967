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
public class FractionNode extends Node {

    @JsonProperty("display_mode")
    private DisplayMode displayMode;

    @JsonProperty("numerator")
    private List<Node> numerator = new ArrayList<>();

    @JsonProperty("denominator")
    private List<Node> denominator = new ArrayList<>();

    public FractionNode(String id, DisplayMode displayMode) {
        super(id);
        this.displayMode = displayMode;
    }

    @Override
    public NodeType getType() {
        return NodeType.FRACTION;
    }

    @Override
    public List<Slot> getSlots() {
        return List.of(Slot.of(SlotName.NUMERATOR, numerator), Slot.of(SlotName.DENOMINATOR, denominator));
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitFraction(this);
    }
}
