package im.arun.mathmarkup.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
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
public class AccentNode extends Node {

    @JsonProperty("accent_type")
    private AccentType accentType;

    @JsonProperty("accent_base")
    private List<Node> accentBase = new ArrayList<>();

    @JsonProperty("accent_label")
    private List<Node> accentLabel;

    public AccentNode(String id, AccentType accentType) {
        super(id);
        this.accentType = accentType;
        this.accentLabel = accentType.isLabeled() ? new ArrayList<>() : null;
    }

    @JsonIgnore
    public AccentPosition getPosition() {
        return accentType.getPosition();
    }

    @Override
    public NodeType getType() {
        return NodeType.ACCENT;
    }

    @Override
    public List<Slot> getSlots() {
        List<Slot> slots = new ArrayList<>();
        slots.add(Slot.of(SlotName.ACCENT_BASE, accentBase));
        if (accentLabel != null) {
            slots.add(Slot.of(SlotName.ACCENT_LABEL, accentLabel));
        }
        return slots;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitAccent(this);
    }
}
