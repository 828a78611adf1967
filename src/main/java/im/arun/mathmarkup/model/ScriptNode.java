package im.arun.mathmarkup.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;

/**
 * A base with an optional superscript and an optional subscript.
 * An absent script slot is null, which differs from a present empty one.
 */
@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class ScriptNode extends Node {

    @JsonProperty("base")
    private List<Node> base = new ArrayList<>();

    @JsonProperty("superscript")
    private List<Node> superscript;

    @JsonProperty("subscript")
    private List<Node> subscript;

    public ScriptNode(String id, boolean hasSuper, boolean hasSub) {
        super(id);
        this.superscript = hasSuper ? new ArrayList<>() : null;
        this.subscript = hasSub ? new ArrayList<>() : null;
    }

    @Override
    public NodeType getType() {
        return NodeType.SCRIPT;
    }

    @Override
    public List<Slot> getSlots() {
        List<Slot> slots = new ArrayList<>();
        slots.add(Slot.of(SlotName.BASE, base));
        if (superscript != null) {
            slots.add(Slot.of(SlotName.SUPERSCRIPT, superscript));
        }
        if (subscript != null) {
            slots.add(Slot.of(SlotName.SUBSCRIPT, subscript));
        }
        return slots;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitScript(this);
    }
}
