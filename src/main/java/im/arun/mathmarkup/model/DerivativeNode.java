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
 * {@code df/dx} in fraction or long form. The order is either a positive
 * integer or, when symbolic, a node sequence in {@code orderNodes}; exactly
 * one of the two is set.
 */
@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class DerivativeNode extends Node {

    @JsonProperty("order")
    private Integer order;

    @JsonProperty("order_nodes")
    private List<Node> orderNodes;

    @JsonProperty("long_form")
    private boolean longForm;

    @JsonProperty("partial")
    private boolean partial;

    @JsonProperty("display_mode")
    private DisplayMode displayMode;

    @JsonProperty("function")
    private List<Node> function = new ArrayList<>();

    @JsonProperty("variable")
    private List<Node> variable = new ArrayList<>();

    public DerivativeNode(String id, int order, DisplayMode displayMode, boolean longForm, boolean partial) {
        super(id);
        this.order = order;
        this.displayMode = displayMode;
        this.longForm = longForm;
        this.partial = partial;
    }

    public DerivativeNode(String id, List<Node> orderNodes, DisplayMode displayMode, boolean longForm, boolean partial) {
        super(id);
        this.orderNodes = orderNodes;
        this.displayMode = displayMode;
        this.longForm = longForm;
        this.partial = partial;
    }

    @JsonIgnore
    public boolean isSymbolicOrder() {
        return orderNodes != null;
    }

    @Override
    public NodeType getType() {
        return NodeType.DERIVATIVE;
    }

    @Override
    public List<Slot> getSlots() {
        List<Slot> slots = new ArrayList<>();
        if (orderNodes != null) {
            slots.add(Slot.of(SlotName.ORDER, orderNodes));
        }
        slots.add(Slot.of(SlotName.FUNCTION, function));
        slots.add(Slot.of(SlotName.VARIABLE, variable));
        return slots;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitDerivative(this);
    }
}
