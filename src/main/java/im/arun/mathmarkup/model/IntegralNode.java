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
 * Single, double, triple or contour integral with separate integrand and
 * differential-variable slots. Either bound may be absent (null).
 */
@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class IntegralNode extends Node {

    @JsonProperty("integral_type")
    private IntegralType integralType = IntegralType.SINGLE;

    @JsonProperty("differential_style")
    private DifferentialStyle differentialStyle = DifferentialStyle.ITALIC;

    @JsonProperty("limit_mode")
    private LimitMode limitMode = LimitMode.DEFAULT;

    @JsonProperty("display_mode")
    private DisplayMode displayMode;

    @JsonProperty("lower_limit")
    private List<Node> lowerLimit;

    @JsonProperty("upper_limit")
    private List<Node> upperLimit;

    @JsonProperty("integrand")
    private List<Node> integrand = new ArrayList<>();

    @JsonProperty("differential_variable")
    private List<Node> differentialVariable = new ArrayList<>();

    public IntegralNode(String id, IntegralType integralType, DisplayMode displayMode,
                        DifferentialStyle differentialStyle, LimitMode limitMode, IntegralLimits limits) {
        super(id);
        this.integralType = integralType;
        this.displayMode = displayMode;
        this.differentialStyle = differentialStyle;
        this.limitMode = limitMode;
        this.lowerLimit = limits.hasLower() ? new ArrayList<>() : null;
        this.upperLimit = limits.hasUpper() ? new ArrayList<>() : null;
    }

    @JsonIgnore
    public IntegralLimits getLimits() {
        if (lowerLimit != null && upperLimit != null) {
            return IntegralLimits.BOTH;
        } else if (lowerLimit != null) {
            return IntegralLimits.LOWER_ONLY;
        } else if (upperLimit != null) {
            return IntegralLimits.UPPER_ONLY;
        }
        return IntegralLimits.NONE;
    }

    @Override
    public NodeType getType() {
        return NodeType.INTEGRAL;
    }

    @Override
    public List<Slot> getSlots() {
        List<Slot> slots = new ArrayList<>();
        if (upperLimit != null) {
            slots.add(Slot.of(SlotName.UPPER_LIMIT, upperLimit));
        }
        if (lowerLimit != null) {
            slots.add(Slot.of(SlotName.LOWER_LIMIT, lowerLimit));
        }
        slots.add(Slot.of(SlotName.INTEGRAND, integrand));
        slots.add(Slot.of(SlotName.DIFFERENTIAL_VARIABLE, differentialVariable));
        return slots;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitIntegral(this);
    }
}
