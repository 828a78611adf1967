package im.arun.mathmarkup.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.util.List;

/**
 * A node of the equation tree. Each node owns its child slots; no node is
 * shared between two slots. Ids take no part in equality, so two trees that
 * differ only in ids compare equal.
 */
@Getter
@Setter
@EqualsAndHashCode
@ToString
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = TextNode.class, name = "text"),
    @JsonSubTypes.Type(value = FractionNode.class, name = "fraction"),
    @JsonSubTypes.Type(value = BevelledFractionNode.class, name = "bevelled-fraction"),
    @JsonSubTypes.Type(value = SqrtNode.class, name = "sqrt"),
    @JsonSubTypes.Type(value = NthRootNode.class, name = "nthroot"),
    @JsonSubTypes.Type(value = ScriptNode.class, name = "script"),
    @JsonSubTypes.Type(value = BracketNode.class, name = "bracket"),
    @JsonSubTypes.Type(value = LargeOperatorNode.class, name = "large-operator"),
    @JsonSubTypes.Type(value = DerivativeNode.class, name = "derivative"),
    @JsonSubTypes.Type(value = IntegralNode.class, name = "integral"),
    @JsonSubTypes.Type(value = MatrixNode.class, name = "matrix"),
    @JsonSubTypes.Type(value = StackNode.class, name = "stack"),
    @JsonSubTypes.Type(value = CasesNode.class, name = "cases"),
    @JsonSubTypes.Type(value = AccentNode.class, name = "accent"),
    @JsonSubTypes.Type(value = FunctionNode.class, name = "function")
})
public abstract class Node {

    @EqualsAndHashCode.Exclude
    @JsonProperty("id")
    private String id;

    @JsonProperty("wrappers")
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private Wrappers wrappers = new Wrappers();

    protected Node() {
    }

    protected Node(String id) {
        this.id = id;
    }

    public void setWrappers(Wrappers wrappers) {
        this.wrappers = wrappers == null ? new Wrappers() : wrappers;
    }

    @JsonIgnore
    public abstract NodeType getType();

    /**
     * Present child slots in navigation order. Optional slots that are absent
     * are left out; grid cells come row-major.
     */
    @JsonIgnore
    public abstract List<Slot> getSlots();

    public abstract <R> R accept(NodeVisitor<R> visitor);
}
