package im.arun.mathmarkup.tree;

import im.arun.mathmarkup.model.BracketNode;
import im.arun.mathmarkup.model.Node;
import im.arun.mathmarkup.model.NodeType;
import im.arun.mathmarkup.model.TextNode;
import im.arun.mathmarkup.util.TreeUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Structural passes that derive cosmetic attributes from the live shape of
 * the tree. Both are idempotent and safe to run after any edit.
 */
public class TreeNormalizer {
    private static final Logger logger = LoggerFactory.getLogger(TreeNormalizer.class);

    public static final double FRACTION_PAREN_SCALE = 1.5;
    public static final double DEFAULT_PAREN_SCALE = 1.0;

    /**
     * Set each bracket's nesting depth to the number of bracket ancestors it has.
     */
    public void recomputeBracketNesting(List<Node> equation) {
        int[] brackets = {0};
        TreeUtils.walk(equation, (node, depth) -> {
            if (node instanceof BracketNode) {
                ((BracketNode) node).setNestingDepth(depth);
                brackets[0]++;
            }
        });
        logger.debug("Recomputed nesting depth for {} brackets", brackets[0]);
    }

    /**
     * Pair literal "(" and ")" text nodes within each sibling list and scale
     * a pair up when a fraction sits directly between them. Inner lists are
     * processed before outer ones. Every parenthesis starts from the default
     * scale, so unmatched ones end up at 1.
     */
    public void recomputeParenScaling(List<Node> equation) {
        int[] pairs = {0};
        TreeUtils.forEachSiblingList(equation, siblings -> pairs[0] += scaleSiblings(siblings));
        logger.debug("Recomputed scale for {} parenthesis pairs", pairs[0]);
    }

    private int scaleSiblings(List<Node> siblings) {
        for (Node node : siblings) {
            if (isParen(node, "(") || isParen(node, ")")) {
                ((TextNode) node).setScaleFactor(DEFAULT_PAREN_SCALE);
            }
        }
        Deque<Integer> open = new ArrayDeque<>();
        int pairs = 0;
        for (int i = 0; i < siblings.size(); i++) {
            Node node = siblings.get(i);
            if (isParen(node, "(")) {
                open.push(i);
            } else if (isParen(node, ")") && !open.isEmpty()) {
                int start = open.pop();
                double scale = containsFraction(siblings, start + 1, i) ? FRACTION_PAREN_SCALE : DEFAULT_PAREN_SCALE;
                ((TextNode) siblings.get(start)).setScaleFactor(scale);
                ((TextNode) node).setScaleFactor(scale);
                pairs++;
            }
        }
        return pairs;
    }

    private static boolean containsFraction(List<Node> siblings, int from, int to) {
        for (int i = from; i < to; i++) {
            NodeType type = siblings.get(i).getType();
            if (type == NodeType.FRACTION || type == NodeType.BEVELLED_FRACTION) {
                return true;
            }
        }
        return false;
    }

    private static boolean isParen(Node node, String glyph) {
        return node instanceof TextNode && glyph.equals(((TextNode) node).getValue());
    }
}
