package im.arun.mathmarkup.tree;

import im.arun.mathmarkup.model.AccentNode;
import im.arun.mathmarkup.model.AccentType;
import im.arun.mathmarkup.model.BevelledFractionNode;
import im.arun.mathmarkup.model.BracketNode;
import im.arun.mathmarkup.model.CasesNode;
import im.arun.mathmarkup.model.DerivativeNode;
import im.arun.mathmarkup.model.DifferentialStyle;
import im.arun.mathmarkup.model.DisplayMode;
import im.arun.mathmarkup.model.EvaluationBracketType;
import im.arun.mathmarkup.model.FractionNode;
import im.arun.mathmarkup.model.FunctionNode;
import im.arun.mathmarkup.model.FunctionType;
import im.arun.mathmarkup.model.IntegralLimits;
import im.arun.mathmarkup.model.IntegralNode;
import im.arun.mathmarkup.model.IntegralType;
import im.arun.mathmarkup.model.LargeOperatorNode;
import im.arun.mathmarkup.model.LimitMode;
import im.arun.mathmarkup.model.MatrixNode;
import im.arun.mathmarkup.model.MatrixType;
import im.arun.mathmarkup.model.Node;
import im.arun.mathmarkup.model.NthRootNode;
import im.arun.mathmarkup.model.ScriptNode;
import im.arun.mathmarkup.model.SqrtNode;
import im.arun.mathmarkup.model.StackNode;
import im.arun.mathmarkup.model.TextNode;
import im.arun.mathmarkup.util.TreeUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Owns an equation (the root sibling list) and mints nodes for it.
 * <p>
 * Ids have the form {@code element-N} and come from a per-builder counter
 * that only moves forward, so an id is never handed out twice by the same
 * builder, not even after {@link #clear()}. Not thread-safe.
 */
public class EquationBuilder {
    private static final Logger logger = LoggerFactory.getLogger(EquationBuilder.class);

    private final TreeNormalizer normalizer = new TreeNormalizer();
    private List<Node> equation = new ArrayList<>();
    private int elementIdCounter = 0;

    public List<Node> getEquation() {
        return equation;
    }

    public void setEquation(List<Node> equation) {
        this.equation = equation == null ? new ArrayList<>() : equation;
    }

    public void clear() {
        equation = new ArrayList<>();
    }

    public boolean isEmpty() {
        return equation.isEmpty();
    }

    public String generateElementId() {
        return "element-" + elementIdCounter++;
    }

    /**
     * Insert {@code node} into {@code slot} so that it ends up at {@code position}.
     *
     * @throws IndexOutOfBoundsException if position is outside {@code [0, slot.size()]}
     */
    public void insert(Node node, List<Node> slot, int position) {
        if (position < 0 || position > slot.size()) {
            throw new IndexOutOfBoundsException(
                "Insert position " + position + " outside slot of size " + slot.size());
        }
        slot.add(position, node);
    }

    /**
     * @throws IndexOutOfBoundsException if position is outside {@code [0, slot.size())}
     */
    public Node remove(List<Node> slot, int position) {
        if (position < 0 || position >= slot.size()) {
            throw new IndexOutOfBoundsException(
                "Remove position " + position + " outside slot of size " + slot.size());
        }
        return slot.remove(position);
    }

    public Optional<Node> findById(String id) {
        return TreeUtils.findById(equation, id);
    }

    public void recomputeBracketNesting() {
        normalizer.recomputeBracketNesting(equation);
    }

    public void recomputeParenScaling() {
        normalizer.recomputeParenScaling(equation);
    }

    public TextNode createText(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Text value must not be null");
        }
        return new TextNode(generateElementId(), value);
    }

    public FractionNode createFraction() {
        return new FractionNode(generateElementId(), null);
    }

    public FractionNode createDisplayFraction() {
        return new FractionNode(generateElementId(), DisplayMode.DISPLAY);
    }

    public BevelledFractionNode createBevelledFraction() {
        return new BevelledFractionNode(generateElementId());
    }

    public SqrtNode createSquareRoot() {
        return new SqrtNode(generateElementId());
    }

    public NthRootNode createNthRoot() {
        return new NthRootNode(generateElementId());
    }

    public ScriptNode createScript(boolean hasSuper, boolean hasSub) {
        return new ScriptNode(generateElementId(), hasSuper, hasSub);
    }

    public BracketNode createBracket(String leftSymbol, String rightSymbol) {
        if (leftSymbol == null || rightSymbol == null) {
            throw new IllegalArgumentException("Bracket glyphs must not be null");
        }
        return new BracketNode(generateElementId(), leftSymbol, rightSymbol);
    }

    /**
     * Bracket with evaluation bounds: {@code F|_a^b} for BAR, {@code [F]_a^b} for SQUARE.
     */
    public BracketNode createEvaluationBracket(EvaluationBracketType type) {
        BracketNode bracket = new BracketNode(generateElementId(), type.getLeft(), type.getRight());
        bracket.setSuperscript(new ArrayList<>());
        bracket.setSubscript(new ArrayList<>());
        return bracket;
    }

    public LargeOperatorNode createLargeOperator(String operator, DisplayMode displayMode, LimitMode limitMode) {
        if (operator == null) {
            throw new IllegalArgumentException("Operator glyph must not be null");
        }
        return new LargeOperatorNode(generateElementId(), operator, displayMode,
            limitMode == null ? LimitMode.DEFAULT : limitMode);
    }

    public DerivativeNode createDerivative(int order, DisplayMode displayMode, boolean longForm, boolean partial) {
        if (order < 1) {
            throw new IllegalArgumentException("Derivative order must be positive, got " + order);
        }
        return new DerivativeNode(generateElementId(), order, inlineIfUnset(displayMode), longForm, partial);
    }

    /**
     * Derivative of symbolic order, e.g. the n in {@code d^n f / dx^n}.
     */
    public DerivativeNode createDerivative(List<Node> order, DisplayMode displayMode, boolean longForm, boolean partial) {
        if (order == null) {
            throw new IllegalArgumentException("Symbolic derivative order must not be null");
        }
        return new DerivativeNode(generateElementId(), order, inlineIfUnset(displayMode), longForm, partial);
    }

    // derivatives always carry a mode; there is no bare derivative markup
    private static DisplayMode inlineIfUnset(DisplayMode displayMode) {
        return displayMode == null ? DisplayMode.INLINE : displayMode;
    }

    public IntegralNode createIntegral(IntegralType type, DisplayMode displayMode, DifferentialStyle style,
                                       LimitMode limitMode, IntegralLimits limits) {
        return new IntegralNode(generateElementId(),
            type == null ? IntegralType.SINGLE : type,
            displayMode,
            style == null ? DifferentialStyle.ITALIC : style,
            limitMode == null ? LimitMode.DEFAULT : limitMode,
            limits == null ? IntegralLimits.NONE : limits);
    }

    public MatrixNode createMatrix(int rows, int cols, MatrixType type) {
        checkDimensions(rows, cols);
        return new MatrixNode(generateElementId(), rows, cols, type == null ? MatrixType.PARENTHESES : type);
    }

    public StackNode createStack(int rows, int cols) {
        checkDimensions(rows, cols);
        return new StackNode(generateElementId(), rows, cols);
    }

    public CasesNode createCases(int rows, int cols) {
        checkDimensions(rows, cols);
        return new CasesNode(generateElementId(), rows, cols);
    }

    public AccentNode createAccent(AccentType type) {
        if (type == null) {
            throw new IllegalArgumentException("Accent type must not be null");
        }
        return new AccentNode(generateElementId(), type);
    }

    public FunctionNode createFunction(FunctionType type) {
        if (type == null) {
            throw new IllegalArgumentException("Function type must not be null");
        }
        return new FunctionNode(generateElementId(), type);
    }

    private static void checkDimensions(int rows, int cols) {
        if (rows < 1 || cols < 1) {
            throw new IllegalArgumentException("Grid needs at least one row and column, got " + rows + "x" + cols);
        }
        logger.debug("Creating {}x{} grid", rows, cols);
    }
}
