package im.arun.mathmarkup.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A run of literal characters, usually a single symbol.
 * {@code italic} is tri-state: null keeps the symbol's natural slant.
 */
@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class TextNode extends Node {

    @JsonProperty("value")
    private String value;

    @JsonProperty("bold")
    private boolean bold;

    @JsonProperty("italic")
    private Boolean italic;

    @JsonProperty("underline")
    private UnderlineStyle underline;

    @JsonProperty("strikethrough")
    private boolean strikethrough;

    @JsonProperty("color")
    private String color;

    @JsonProperty("text_mode")
    private boolean textMode;

    @EqualsAndHashCode.Exclude
    @JsonProperty("scale_factor")
    private Double scaleFactor;

    public TextNode(String id, String value) {
        super(id);
        this.value = value;
    }

    /**
     * True when both nodes would be emitted under the same formatting commands.
     */
    public boolean hasSameFormatting(TextNode other) {
        return bold == other.bold
            && Objects.equals(italic, other.italic)
            && underline == other.underline
            && strikethrough == other.strikethrough
            && Objects.equals(color, other.color)
            && textMode == other.textMode;
    }

    @JsonIgnore
    public boolean isPlain() {
        return !bold && italic == null && underline == null && !strikethrough && color == null && !textMode;
    }

    @Override
    public NodeType getType() {
        return NodeType.TEXT;
    }

    @Override
    public List<Slot> getSlots() {
        return Collections.emptyList();
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitText(this);
    }
}
