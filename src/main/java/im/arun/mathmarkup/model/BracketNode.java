package im.arun.mathmarkup.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;

/**
 * A pair of stretchy delimiters around content. The glyphs are independent,
 * so mismatched pairs such as {@code [a, b)} are allowed; {@code "."} is the
 * invisible delimiter. Evaluation brackets also carry bound slots.
 * <p>
 * Nesting depth and scale factor are derived by the structural passes and do
 * not take part in equality.
 */
@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class BracketNode extends Node {

    @JsonProperty("left_symbol")
    private String leftSymbol;

    @JsonProperty("right_symbol")
    private String rightSymbol;

    @JsonProperty("content")
    private List<Node> content = new ArrayList<>();

    @JsonProperty("superscript")
    private List<Node> superscript;

    @JsonProperty("subscript")
    private List<Node> subscript;

    @EqualsAndHashCode.Exclude
    @JsonProperty("nesting_depth")
    private int nestingDepth;

    @EqualsAndHashCode.Exclude
    @JsonProperty("scale_factor")
    private Double scaleFactor;

    public BracketNode(String id, String leftSymbol, String rightSymbol) {
        super(id);
        this.leftSymbol = leftSymbol;
        this.rightSymbol = rightSymbol;
    }

    @JsonIgnore
    public boolean isEvaluation() {
        return superscript != null || subscript != null;
    }

    @Override
    public NodeType getType() {
        return NodeType.BRACKET;
    }

    @Override
    public List<Slot> getSlots() {
        List<Slot> slots = new ArrayList<>();
        slots.add(Slot.of(SlotName.CONTENT, content));
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
        return visitor.visitBracket(this);
    }
}
