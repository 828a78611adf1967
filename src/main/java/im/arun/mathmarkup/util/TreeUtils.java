package im.arun.mathmarkup.util;

import im.arun.mathmarkup.model.Node;
import im.arun.mathmarkup.model.NodeType;
import im.arun.mathmarkup.model.Slot;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Generic traversal over the equation tree. Every walk goes through
 * {@link Node#getSlots()}, so adding a variant never touches this class.
 */
public final class TreeUtils {

    private TreeUtils() {
    }

    /**
     * Visitor for {@link #walk}: receives each node with the number of
     * bracket nodes above it.
     */
    @FunctionalInterface
    public interface DepthVisitor {
        void visit(Node node, int bracketDepth);
    }

    /**
     * Pre-order, depth-first search over all slots.
     */
    public static Optional<Node> find(List<Node> nodes, Predicate<Node> predicate) {
        if (nodes == null) {
            return Optional.empty();
        }
        for (Node node : nodes) {
            if (predicate.test(node)) {
                return Optional.of(node);
            }
            for (Slot slot : node.getSlots()) {
                Optional<Node> found = find(slot.getNodes(), predicate);
                if (found.isPresent()) {
                    return found;
                }
            }
        }
        return Optional.empty();
    }

    public static Optional<Node> findById(List<Node> nodes, String id) {
        return find(nodes, node -> id.equals(node.getId()));
    }

    /**
     * Pre-order walk. Every slot of a bracket node counts as one level deeper;
     * other variants are transparent.
     */
    public static void walk(List<Node> nodes, DepthVisitor visitor) {
        walk(nodes, 0, visitor);
    }

    private static void walk(List<Node> nodes, int depth, DepthVisitor visitor) {
        if (nodes == null) {
            return;
        }
        for (Node node : nodes) {
            visitor.visit(node, depth);
            int childDepth = node.getType() == NodeType.BRACKET ? depth + 1 : depth;
            for (Slot slot : node.getSlots()) {
                walk(slot.getNodes(), childDepth, visitor);
            }
        }
    }

    /**
     * Post-order over sibling lists: the lists inside a node's slots are
     * handed out before the list that contains the node.
     */
    public static void forEachSiblingList(List<Node> nodes, Consumer<List<Node>> action) {
        if (nodes == null) {
            return;
        }
        for (Node node : nodes) {
            for (Slot slot : node.getSlots()) {
                forEachSiblingList(slot.getNodes(), action);
            }
        }
        action.accept(nodes);
    }

    /**
     * Deepest bracket nesting found in the tree, or 0 when it has no brackets
     * inside brackets.
     */
    public static int maxBracketDepth(List<Node> nodes) {
        int[] max = {0};
        walk(nodes, (node, depth) -> {
            if (node.getType() == NodeType.BRACKET && depth > max[0]) {
                max[0] = depth;
            }
        });
        return max[0];
    }

    public static int countNodes(List<Node> nodes) {
        int[] count = {0};
        walk(nodes, (node, depth) -> count[0]++);
        return count[0];
    }
}
