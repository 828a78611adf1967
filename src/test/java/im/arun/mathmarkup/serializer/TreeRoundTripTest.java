package im.arun.mathmarkup.serializer;

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
import im.arun.mathmarkup.model.UnderlineStyle;
import im.arun.mathmarkup.model.Wrapper;
import im.arun.mathmarkup.parser.MarkupParser;
import im.arun.mathmarkup.tree.EquationBuilder;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Builder-made trees must read back from their markup as the same tree,
 * ids aside.
 */
class TreeRoundTripTest {

    private static final EquationBuilder BUILDER = new EquationBuilder();
    private static final SerializerOptions DEFAULTS = SerializerOptions.defaults();
    private static final SerializerOptions PHYSICS = SerializerOptions.builder().physicsDifferentials(true).build();
    private static final SerializerOptions SCALED =
        SerializerOptions.builder().bracketSizing(BracketSizing.DEPTH_SCALED).build();

    @ParameterizedTest(name = "{0}")
    @MethodSource("trees")
    void treeSurvivesSerializationAndParsing(String name, SerializerOptions options, List<Node> tree) {
        String markup = new MarkupSerializer(options).serialize(tree);
        List<Node> parsed = new MarkupParser(new EquationBuilder()).parse(markup);
        assertEquals(tree, parsed, () -> name + " read back differently from " + markup);
    }

    static Stream<Arguments> trees() {
        return Stream.of(
            Arguments.of("symbols and operators", DEFAULTS, texts("x", "+", "α", " ", "2")),
            Arguments.of("escaped characters", DEFAULTS, texts("{", "}", "#", "&", "%", "~", "^", "_", "\\")),
            Arguments.of("slash between letters", DEFAULTS, texts("a", "/", "b")),
            Arguments.of("colored text around a slash", DEFAULTS,
                List.of(colored("a", "red"), text("/"), colored("b", "blue"))),
            Arguments.of("colored text before a slash and a script", DEFAULTS,
                List.of(colored("a", "red"), text("/"), script(true, false))),

            Arguments.of("bare fraction", DEFAULTS, List.of(fraction(null))),
            Arguments.of("inline fraction", DEFAULTS, List.of(fraction(DisplayMode.INLINE))),
            Arguments.of("display fraction", DEFAULTS, List.of(fraction(DisplayMode.DISPLAY))),
            Arguments.of("bevelled fraction", DEFAULTS, List.of(bevelled(null))),
            Arguments.of("inline bevelled fraction", DEFAULTS, List.of(bevelled(DisplayMode.INLINE))),

            Arguments.of("square root", DEFAULTS, List.of(squareRoot())),
            Arguments.of("cube root", DEFAULTS, List.of(nthRoot("3"))),
            Arguments.of("root with closing bracket index", DEFAULTS, List.of(nthRoot("]"), text("y"))),
            Arguments.of("root with opening bracket index", DEFAULTS, List.of(nthRoot("["), text("y"))),

            Arguments.of("superscript and subscript", DEFAULTS, List.of(script(true, true))),
            Arguments.of("superscript only", DEFAULTS, List.of(script(true, false))),
            Arguments.of("subscript only", DEFAULTS, List.of(script(false, true))),

            Arguments.of("parentheses", DEFAULTS, List.of(bracket("(", ")", texts("x", "+", "1")))),
            Arguments.of("mismatched glyphs", DEFAULTS, List.of(bracket("⟨", "|", texts("x")))),
            Arguments.of("nested brackets", DEFAULTS, List.of(nestedBrackets())),
            Arguments.of("depth-scaled nested brackets", SCALED, List.of(nestedBrackets())),
            Arguments.of("evaluation bar", DEFAULTS, List.of(evaluation(EvaluationBracketType.BAR))),
            Arguments.of("evaluation square", DEFAULTS, List.of(evaluation(EvaluationBracketType.SQUARE))),

            Arguments.of("inline sum with limits", DEFAULTS,
                List.of(largeOperator("∑", DisplayMode.INLINE, LimitMode.LIMITS))),
            Arguments.of("display sum without limits", DEFAULTS,
                List.of(largeOperator("∑", DisplayMode.DISPLAY, LimitMode.NOLIMITS))),
            Arguments.of("bare product", DEFAULTS, List.of(largeOperator("∏", null, null))),

            Arguments.of("lower-bound integral", DEFAULTS, List.of(integral(IntegralType.SINGLE,
                DisplayMode.INLINE, DifferentialStyle.ITALIC, LimitMode.DEFAULT, IntegralLimits.LOWER_ONLY))),
            Arguments.of("lower-bound double integral with limits", DEFAULTS, List.of(integral(IntegralType.DOUBLE,
                DisplayMode.DISPLAY, DifferentialStyle.ITALIC, LimitMode.LIMITS, IntegralLimits.LOWER_ONLY))),
            Arguments.of("definite roman triple integral", DEFAULTS, List.of(integral(IntegralType.TRIPLE,
                null, DifferentialStyle.ROMAN, LimitMode.NOLIMITS, IntegralLimits.BOTH))),
            Arguments.of("definite integral", DEFAULTS, List.of(integral(IntegralType.SINGLE,
                DisplayMode.INLINE, DifferentialStyle.ROMAN, LimitMode.DEFAULT, IntegralLimits.BOTH))),
            Arguments.of("indefinite contour integral", DEFAULTS, List.of(integral(IntegralType.CONTOUR,
                null, DifferentialStyle.ITALIC, LimitMode.DEFAULT, IntegralLimits.NONE))),

            Arguments.of("second derivative", DEFAULTS, List.of(derivative(2, DisplayMode.INLINE, false, false))),
            Arguments.of("display third derivative", DEFAULTS,
                List.of(derivative(3, DisplayMode.DISPLAY, false, false))),
            Arguments.of("long partial derivative", DEFAULTS,
                List.of(derivative(1, DisplayMode.DISPLAY, true, true))),
            Arguments.of("symbolic order", DEFAULTS, List.of(symbolicDerivative("n", false))),
            Arguments.of("physics second derivative", PHYSICS,
                List.of(derivative(2, DisplayMode.INLINE, false, false))),
            Arguments.of("physics long partial derivative", PHYSICS,
                List.of(derivative(1, DisplayMode.DISPLAY, true, true))),
            Arguments.of("physics symbolic order", PHYSICS, List.of(symbolicDerivative("n", false))),
            Arguments.of("physics order holding a bracket", PHYSICS, List.of(symbolicDerivative("]", true))),

            Arguments.of("bracket matrix with empty cell", DEFAULTS, List.of(matrix())),
            Arguments.of("stack", DEFAULTS, List.of(stack())),
            Arguments.of("cases", DEFAULTS, List.of(cases())),

            Arguments.of("hat", DEFAULTS, List.of(accent(AccentType.HAT, false))),
            Arguments.of("plain underbrace", DEFAULTS, List.of(accent(AccentType.UNDERBRACE, false))),
            Arguments.of("labeled overbrace", DEFAULTS, List.of(accent(AccentType.LABELEDOVERBRACE, true))),
            Arguments.of("labeled underbrace", DEFAULTS, List.of(accent(AccentType.LABELEDUNDERBRACE, true))),

            Arguments.of("sine", DEFAULTS, List.of(function(FunctionType.SIN, null))),
            Arguments.of("log", DEFAULTS, List.of(function(FunctionType.LOG, null))),
            Arguments.of("log with base", DEFAULTS, List.of(function(FunctionType.LOGN, null))),
            Arguments.of("arcsine", DEFAULTS, List.of(function(FunctionType.ASIN, null))),
            Arguments.of("limit", DEFAULTS, List.of(function(FunctionType.LIM, null))),
            Arguments.of("argmax", DEFAULTS, List.of(function(FunctionType.ARGMAX, null))),
            Arguments.of("user function", DEFAULTS, List.of(function(FunctionType.FUNCTION, "g"))),
            Arguments.of("user function with base", DEFAULTS, List.of(function(FunctionType.FUNCTIONSUB, "g"))),
            Arguments.of("user function with constraint", DEFAULTS,
                List.of(function(FunctionType.FUNCTIONLIM, "g"))),

            Arguments.of("underline inside cancel", DEFAULTS,
                List.of(wrapped(text("x"), Wrapper.underline(UnderlineStyle.SINGLE), Wrapper.cancel()))),
            Arguments.of("cancel inside underline", DEFAULTS,
                List.of(wrapped(text("x"), Wrapper.cancel(), Wrapper.underline(UnderlineStyle.SINGLE)))),
            Arguments.of("four wrappers", DEFAULTS, List.of(wrapped(text("y"), Wrapper.cancel(),
                Wrapper.underline(UnderlineStyle.DOUBLE), Wrapper.color("blue"), Wrapper.textMode()))),
            Arguments.of("siblings sharing a wrapper", DEFAULTS, List.of(
                wrapped(text("a"), Wrapper.cancel()), wrapped(text("b"), Wrapper.cancel()), text("c"))),
            Arguments.of("wrapped fraction", DEFAULTS,
                List.of(wrapped(fraction(null), Wrapper.color("red")))),

            Arguments.of("bold", DEFAULTS, List.of(formatted("x", node -> node.setBold(true)))),
            Arguments.of("bold italic symbol", DEFAULTS, List.of(formatted("α", node -> {
                node.setBold(true);
                node.setItalic(true);
            }))),
            Arguments.of("bold italic digit", DEFAULTS, List.of(formatted("1", node -> {
                node.setBold(true);
                node.setItalic(true);
            }))),
            Arguments.of("bold roman", DEFAULTS, List.of(formatted("x", node -> {
                node.setBold(true);
                node.setItalic(false);
            }))),
            Arguments.of("italic", DEFAULTS, List.of(formatted("y", node -> node.setItalic(true)))),
            Arguments.of("roman", DEFAULTS, List.of(formatted("y", node -> node.setItalic(false)))),
            Arguments.of("double underline attribute", DEFAULTS,
                List.of(formatted("y", node -> node.setUnderline(UnderlineStyle.DOUBLE)))),
            Arguments.of("text mode attribute", DEFAULTS, List.of(formatted("y", node -> node.setTextMode(true)))),
            Arguments.of("decorated colored text", DEFAULTS, List.of(formatted("y", node -> {
                node.setUnderline(UnderlineStyle.SINGLE);
                node.setStrikethrough(true);
                node.setColor("red");
            })))
        );
    }

    private static TextNode text(String value) {
        return BUILDER.createText(value);
    }

    private static List<Node> texts(String... values) {
        List<Node> nodes = new ArrayList<>();
        for (String value : values) {
            nodes.add(text(value));
        }
        return nodes;
    }

    private static TextNode colored(String value, String color) {
        TextNode node = text(value);
        node.setColor(color);
        return node;
    }

    private static TextNode formatted(String value, Consumer<TextNode> format) {
        TextNode node = text(value);
        format.accept(node);
        return node;
    }

    private static Node wrapped(Node node, Wrapper... wrappers) {
        for (Wrapper wrapper : wrappers) {
            node.getWrappers().apply(wrapper);
        }
        return node;
    }

    private static FractionNode fraction(DisplayMode mode) {
        FractionNode fraction = BUILDER.createFraction();
        fraction.setDisplayMode(mode);
        fraction.getNumerator().add(text("a"));
        fraction.getDenominator().add(text("b"));
        return fraction;
    }

    private static BevelledFractionNode bevelled(DisplayMode mode) {
        BevelledFractionNode fraction = BUILDER.createBevelledFraction();
        fraction.setDisplayMode(mode);
        fraction.getNumerator().add(text("a"));
        fraction.getDenominator().add(text("b"));
        return fraction;
    }

    private static SqrtNode squareRoot() {
        SqrtNode root = BUILDER.createSquareRoot();
        root.getRadicand().add(text("x"));
        return root;
    }

    private static NthRootNode nthRoot(String index) {
        NthRootNode root = BUILDER.createNthRoot();
        root.getIndex().add(text(index));
        root.getRadicand().add(text("x"));
        return root;
    }

    private static ScriptNode script(boolean hasSuper, boolean hasSub) {
        ScriptNode script = BUILDER.createScript(hasSuper, hasSub);
        script.getBase().add(text("x"));
        if (hasSuper) {
            script.getSuperscript().add(text("2"));
        }
        if (hasSub) {
            script.getSubscript().add(text("i"));
        }
        return script;
    }

    private static BracketNode bracket(String left, String right, List<Node> content) {
        BracketNode bracket = BUILDER.createBracket(left, right);
        bracket.getContent().addAll(content);
        return bracket;
    }

    private static BracketNode nestedBrackets() {
        return bracket("(", ")", List.of(bracket("[", "]", texts("x")), text("y")));
    }

    private static BracketNode evaluation(EvaluationBracketType type) {
        BracketNode bracket = BUILDER.createEvaluationBracket(type);
        bracket.getContent().add(text("F"));
        bracket.getSubscript().add(text("a"));
        bracket.getSuperscript().add(text("b"));
        return bracket;
    }

    private static LargeOperatorNode largeOperator(String glyph, DisplayMode mode, LimitMode limitMode) {
        LargeOperatorNode operator = BUILDER.createLargeOperator(glyph, mode, limitMode);
        operator.getLowerLimit().add(text("i"));
        operator.getUpperLimit().add(text("n"));
        operator.getOperand().add(text("i"));
        return operator;
    }

    private static IntegralNode integral(IntegralType type, DisplayMode mode, DifferentialStyle style,
                                         LimitMode limitMode, IntegralLimits limits) {
        IntegralNode integral = BUILDER.createIntegral(type, mode, style, limitMode, limits);
        integral.getIntegrand().add(text("f"));
        integral.getDifferentialVariable().add(text("x"));
        if (limits.hasLower()) {
            integral.getLowerLimit().add(text("0"));
        }
        if (limits.hasUpper()) {
            integral.getUpperLimit().add(text("1"));
        }
        return integral;
    }

    private static DerivativeNode derivative(int order, DisplayMode mode, boolean longForm, boolean partial) {
        DerivativeNode derivative = BUILDER.createDerivative(order, mode, longForm, partial);
        derivative.getFunction().add(text("y"));
        derivative.getVariable().add(text("t"));
        return derivative;
    }

    private static DerivativeNode symbolicDerivative(String order, boolean partial) {
        DerivativeNode derivative = BUILDER.createDerivative(texts(order), DisplayMode.INLINE, false, partial);
        derivative.getFunction().add(text("y"));
        derivative.getVariable().add(text("x"));
        return derivative;
    }

    private static MatrixNode matrix() {
        MatrixNode matrix = BUILDER.createMatrix(2, 2, MatrixType.BRACKETS);
        matrix.getCell(0, 0).add(text("a"));
        matrix.getCell(0, 1).add(text("b"));
        matrix.getCell(1, 0).add(text("c"));
        return matrix;
    }

    private static StackNode stack() {
        StackNode stack = BUILDER.createStack(2, 2);
        stack.getCell(0, 0).add(text("1"));
        stack.getCell(0, 1).add(text("2"));
        stack.getCell(1, 0).add(text("3"));
        stack.getCell(1, 1).add(text("4"));
        return stack;
    }

    private static CasesNode cases() {
        CasesNode cases = BUILDER.createCases(2, 2);
        cases.getCell(0, 0).add(text("1"));
        cases.getCell(0, 1).addAll(texts("x", ">", "0"));
        cases.getCell(1, 0).add(text("0"));
        cases.getCell(1, 1).addAll(texts("x", "<", "0"));
        return cases;
    }

    private static AccentNode accent(AccentType type, boolean labeled) {
        AccentNode accent = BUILDER.createAccent(type);
        accent.getAccentBase().add(text("a"));
        if (labeled) {
            accent.getAccentLabel().add(text("n"));
        }
        return accent;
    }

    private static FunctionNode function(FunctionType type, String name) {
        FunctionNode function = BUILDER.createFunction(type);
        if (name != null) {
            function.getFunctionName().add(text(name));
        }
        switch (type.getShape()) {
            case SUB:
                function.getFunctionBase().add(text("2"));
                break;
            case LIM:
                function.getFunctionConstraint().add(text("c"));
                break;
            default:
                break;
        }
        function.getFunctionArgument().add(text("x"));
        return function;
    }
}
