package im.arun.mathmarkup.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The wrapper set of a node. Iteration order is application order: the first
 * wrapper is the innermost one. Each kind appears at most once, so the order
 * can never name a kind that is not in the set.
 */
public class Wrappers implements Iterable<Wrapper> {

    private final Map<WrapperKind, Wrapper> applied = new LinkedHashMap<>();

    public Wrappers() {
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Wrappers of(List<Wrapper> wrappers) {
        Wrappers result = new Wrappers();
        if (wrappers != null) {
            wrappers.forEach(result::apply);
        }
        return result;
    }

    /**
     * Apply a wrapper outside everything applied so far. Re-applying a kind
     * replaces its parameters and moves it outermost.
     */
    public void apply(Wrapper wrapper) {
        applied.remove(wrapper.getKind());
        applied.put(wrapper.getKind(), wrapper);
    }

    public boolean remove(WrapperKind kind) {
        return applied.remove(kind) != null;
    }

    public Optional<Wrapper> get(WrapperKind kind) {
        return Optional.ofNullable(applied.get(kind));
    }

    public boolean has(WrapperKind kind) {
        return applied.containsKey(kind);
    }

    public boolean isEmpty() {
        return applied.isEmpty();
    }

    public int size() {
        return applied.size();
    }

    @JsonValue
    public List<Wrapper> inApplicationOrder() {
        return new ArrayList<>(applied.values());
    }

    /**
     * Same kinds with the same parameters, regardless of application order.
     */
    public boolean sameSetAs(Wrappers other) {
        return applied.equals(other.applied);
    }

    public Wrappers copy() {
        return of(inApplicationOrder());
    }

    @Override
    public Iterator<Wrapper> iterator() {
        return inApplicationOrder().iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Wrappers)) return false;
        return inApplicationOrder().equals(((Wrappers) o).inApplicationOrder());
    }

    @Override
    public int hashCode() {
        return inApplicationOrder().hashCode();
    }

    @Override
    public String toString() {
        return inApplicationOrder().toString();
    }
}
