package im.arun.mathmarkup.parser;

import im.arun.mathmarkup.model.AccentNode;
import im.arun.mathmarkup.model.AccentType;
import im.arun.mathmarkup.model.BevelledFractionNode;
import im.arun.mathmarkup.model.BracketNode;
import im.arun.mathmarkup.model.CasesNode;
import im.arun.mathmarkup.model.DerivativeNode;
import im.arun.mathmarkup.model.DifferentialStyle;
import im.arun.mathmarkup.model.DisplayMode;
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
import im.arun.mathmarkup.model.NodeType;
import im.arun.mathmarkup.model.NthRootNode;
import im.arun.mathmarkup.model.ScriptNode;
import im.arun.mathmarkup.model.SqrtNode;
import im.arun.mathmarkup.model.StackNode;
import im.arun.mathmarkup.model.TextNode;
import im.arun.mathmarkup.model.UnderlineStyle;
import im.arun.mathmarkup.model.Wrapper;
import im.arun.mathmarkup.model.WrapperKind;
import im.arun.mathmarkup.tree.EquationBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MarkupParserTest {

    private MarkupParser parser;

    @BeforeEach
    void setUp() {
        parser = new MarkupParser(new EquationBuilder());
    }

    private static String text(List<Node> nodes) {
        return nodes.stream()
            .map(node -> ((TextNode) node).getValue())
            .collect(Collectors.joining());
    }

    private <T extends Node> T single(String markup, Class<T> type) {
        List<Node> nodes = parser.parse(markup);
        assertEquals(1, nodes.size(), () -> "nodes for " + markup + ": " + nodes);
        return assertInstanceOf(type, nodes.get(0));
    }

    @Test
    void emptyInputGivesEmptyEquation() {
        assertTrue(parser.parse("").isEmpty());
        assertTrue(parser.parse(null).isEmpty());
        assertTrue(parser.parse("   ").isEmpty());
    }

    @Test
    void plainTextAndSymbols() {
        List<Node> nodes = parser.parse("x + \\alpha \\leq 1");
        assertEquals("x+α≤1", text(nodes));
    }

    @Test
    void unknownCommandDegradesToLiteralText() {
        List<Node> nodes = parser.parse("\\unknownxyz{a}");
        assertTrue(nodes.stream().allMatch(node -> node.getType() == NodeType.TEXT));
        assertEquals("\\unknownxyza", text(nodes));
    }

    @Test
    void escapedCharactersBecomeText() {
        assertEquals("{}#&%~^_", text(parser.parse("\\{\\}\\#\\text{＆}\\%\\textasciitilde{}{\\text{^}}{\\_}")));
        assertEquals("a b", text(parser.parse("a\\ b")));
        assertEquals("\\", text(parser.parse("\\backslash")));
    }

    @Test
    void fractionModes() {
        assertNull(single("\\frac{1}{2}", FractionNode.class).getDisplayMode());
        assertEquals(DisplayMode.DISPLAY, single("\\dfrac{1}{2}", FractionNode.class).getDisplayMode());
        assertEquals(DisplayMode.INLINE, single("\\tfrac{1}{2}", FractionNode.class).getDisplayMode());
        FractionNode styled = single("{\\textstyle \\frac{1}{2}}", FractionNode.class);
        assertEquals(DisplayMode.INLINE, styled.getDisplayMode());
        assertEquals("1", text(styled.getNumerator()));
        assertEquals("2", text(styled.getDenominator()));
        assertEquals(DisplayMode.DISPLAY, single("\\displaystyle \\frac{a}{b}", FractionNode.class).getDisplayMode());
    }

    @Test
    void styleWrapperAroundOtherContentIsDropped() {
        List<Node> nodes = parser.parse("{\\displaystyle x+y}");
        assertEquals("x+y", text(nodes));
    }

    @Test
    void bevelledFraction() {
        BevelledFractionNode fraction = single("{a}/{b}", BevelledFractionNode.class);
        assertEquals("a", text(fraction.getNumerator()));
        assertEquals("b", text(fraction.getDenominator()));
        assertEquals(DisplayMode.DISPLAY,
            single("{\\displaystyle {a}/{b}}", BevelledFractionNode.class).getDisplayMode());
    }

    @Test
    void coloredTextAroundSlashIsNotAFraction() {
        List<Node> nodes = parser.parse("{\\color{red} a}/{\\color{blue} b}");
        assertEquals(3, nodes.size(), nodes::toString);
        assertEquals("red", assertInstanceOf(TextNode.class, nodes.get(0)).getColor());
        assertEquals("/", assertInstanceOf(TextNode.class, nodes.get(1)).getValue());
        assertEquals("blue", assertInstanceOf(TextNode.class, nodes.get(2)).getColor());
        assertEquals("b", ((TextNode) nodes.get(2)).getValue());
    }

    @Test
    void bracketInsideBracedOptionalArgument() {
        NthRootNode root = assertInstanceOf(NthRootNode.class, parser.parse("\\sqrt[{]}]{x}y").get(0));
        assertEquals("]", text(root.getIndex()));
        assertEquals("x", text(root.getRadicand()));

        DerivativeNode derivative = single("\\dv[{]}]{f}{x}", DerivativeNode.class);
        assertEquals("]", text(derivative.getOrderNodes()));
        assertEquals("f", text(derivative.getFunction()));
    }

    @Test
    void roots() {
        assertEquals("x", text(single("\\sqrt{x}", SqrtNode.class).getRadicand()));
        NthRootNode root = single("\\sqrt[3]{x}", NthRootNode.class);
        assertEquals("3", text(root.getIndex()));
        assertEquals("x", text(root.getRadicand()));
    }

    @Test
    void bareScripts() {
        ScriptNode sup = single("x^2", ScriptNode.class);
        assertEquals("x", text(sup.getBase()));
        assertEquals("2", text(sup.getSuperscript()));
        assertNull(sup.getSubscript());

        ScriptNode both = single("x_{1}^{2}", ScriptNode.class);
        assertEquals("1", text(both.getSubscript()));
        assertEquals("2", text(both.getSuperscript()));
    }

    @Test
    void groupedScriptBase() {
        ScriptNode script = single("{x+1}^{2}_{i}", ScriptNode.class);
        assertEquals("x+1", text(script.getBase()));
        assertEquals("2", text(script.getSuperscript()));
        assertEquals("i", text(script.getSubscript()));
    }

    @Test
    void scriptWithoutBaseHasEmptyBase() {
        ScriptNode script = single("^{2}", ScriptNode.class);
        assertTrue(script.getBase().isEmpty());
    }

    @Test
    void brackets() {
        BracketNode bracket = single("\\left(x+1\\right]", BracketNode.class);
        assertEquals("(", bracket.getLeftSymbol());
        assertEquals("]", bracket.getRightSymbol());
        assertEquals("x+1", text(bracket.getContent()));
        assertFalse(bracket.isEvaluation());

        BracketNode nested = single("\\left\\langle \\left(a\\right)\\right\\rangle", BracketNode.class);
        assertEquals("⟨", nested.getLeftSymbol());
        assertInstanceOf(BracketNode.class, nested.getContent().get(0));

        BracketNode sized = single("\\bigl[x\\bigr]", BracketNode.class);
        assertEquals("[", sized.getLeftSymbol());
    }

    @Test
    void evaluationBracket() {
        BracketNode bracket = single("\\left.x^{2}\\right|_{0}^{1}", BracketNode.class);
        assertTrue(bracket.isEvaluation());
        assertEquals(".", bracket.getLeftSymbol());
        assertEquals("|", bracket.getRightSymbol());
        assertEquals("0", text(bracket.getSubscript()));
        assertEquals("1", text(bracket.getSuperscript()));
    }

    @Test
    void bracketWithSingleScriptBecomesScriptBase() {
        ScriptNode script = single("\\left(x\\right)^{2}", ScriptNode.class);
        assertInstanceOf(BracketNode.class, script.getBase().get(0));
    }

    @Test
    void unterminatedBracketClosesAtEnd() {
        BracketNode bracket = single("\\left(x", BracketNode.class);
        assertEquals(".", bracket.getRightSymbol());
        assertEquals("x", text(bracket.getContent()));
    }

    @Test
    void largeOperators() {
        LargeOperatorNode sum = single("\\sum\\limits_{i=1}^{n} {i}", LargeOperatorNode.class);
        assertEquals("∑", sum.getOperator());
        assertEquals(LimitMode.LIMITS, sum.getLimitMode());
        assertNull(sum.getDisplayMode());
        assertEquals("i=1", text(sum.getLowerLimit()));
        assertEquals("n", text(sum.getUpperLimit()));
        assertEquals("i", text(sum.getOperand()));

        LargeOperatorNode prod = single("{\\displaystyle \\prod^{n}_{k}}", LargeOperatorNode.class);
        assertEquals(DisplayMode.DISPLAY, prod.getDisplayMode());
        assertEquals(LimitMode.DEFAULT, prod.getLimitMode());
        assertEquals("k", text(prod.getLowerLimit()));
        assertTrue(prod.getOperand().isEmpty());
    }

    @Test
    void lowerBoundOnlyIntegral() {
        IntegralNode integral = single("{\\textstyle \\intisub{f}{x}{a}}", IntegralNode.class);
        assertEquals(IntegralType.SINGLE, integral.getIntegralType());
        assertEquals(DifferentialStyle.ITALIC, integral.getDifferentialStyle());
        assertEquals(DisplayMode.INLINE, integral.getDisplayMode());
        assertEquals(IntegralLimits.LOWER_ONLY, integral.getLimits());
        assertEquals("a", text(integral.getLowerLimit()));
        assertNull(integral.getUpperLimit());
        assertEquals("f", text(integral.getIntegrand()));
        assertEquals("x", text(integral.getDifferentialVariable()));
    }

    @Test
    void integralFamilies() {
        IntegralNode definite = single("\\iintdnolim{f}{A}{0}{1}", IntegralNode.class);
        assertEquals(IntegralType.DOUBLE, definite.getIntegralType());
        assertEquals(DifferentialStyle.ROMAN, definite.getDifferentialStyle());
        assertEquals(LimitMode.NOLIMITS, definite.getLimitMode());
        assertEquals("1", text(definite.getUpperLimit()));

        IntegralNode legacy = single("\\ointilower{f}{s}{C}", IntegralNode.class);
        assertEquals(IntegralType.CONTOUR, legacy.getIntegralType());
        assertEquals(LimitMode.LIMITS, legacy.getLimitMode());
        assertEquals(IntegralLimits.LOWER_ONLY, legacy.getLimits());

        IntegralNode indefinite = single("\\inti{f}{x}", IntegralNode.class);
        assertEquals(IntegralLimits.NONE, indefinite.getLimits());
        assertNull(indefinite.getDisplayMode());
    }

    @Test
    void customDerivatives() {
        DerivativeNode second = single("\\derivfrac{d^{2}{y}}{d{x}^{2}}", DerivativeNode.class);
        assertEquals(2, second.getOrder());
        assertEquals(DisplayMode.INLINE, second.getDisplayMode());
        assertFalse(second.isPartial());
        assertFalse(second.isLongForm());
        assertEquals("y", text(second.getFunction()));
        assertEquals("x", text(second.getVariable()));

        DerivativeNode display = single("\\derivdfrac{dy}{dx}", DerivativeNode.class);
        assertEquals(DisplayMode.DISPLAY, display.getDisplayMode());
        assertEquals(1, display.getOrder());

        DerivativeNode partial = single("\\derivfrac{\\partial{f}}{\\partial{t}}", DerivativeNode.class);
        assertTrue(partial.isPartial());
        assertEquals("f", text(partial.getFunction()));

        DerivativeNode symbolic = single("\\derivfrac{d^{n}{y}}{d{x}^{n}}", DerivativeNode.class);
        assertTrue(symbolic.isSymbolicOrder());
        assertEquals("n", text(symbolic.getOrderNodes()));

        DerivativeNode longForm = single("\\derivldfrac{d^{2}}{d{x}^{2}}{y}", DerivativeNode.class);
        assertTrue(longForm.isLongForm());
        assertEquals(DisplayMode.DISPLAY, longForm.getDisplayMode());
        assertEquals("y", text(longForm.getFunction()));
    }

    @Test
    void derivativeFractionWithUnknownShapeFallsBackToFraction() {
        FractionNode fraction = single("\\derivfrac{a}{b}", FractionNode.class);
        assertEquals(DisplayMode.INLINE, fraction.getDisplayMode());
        assertEquals("a", text(fraction.getNumerator()));
        assertEquals("b", text(fraction.getDenominator()));

        // orders disagree
        assertInstanceOf(FractionNode.class, parser.parse("\\derivdfrac{d^{2}y}{dx^{3}}").get(0));

        List<Node> longForm = parser.parse("\\derivlfrac{q}{dx}{y}");
        assertEquals(2, longForm.size());
        assertInstanceOf(FractionNode.class, longForm.get(0));
    }

    @Test
    void physicsDerivatives() {
        DerivativeNode dv = single("\\dv[2]{y}{x}", DerivativeNode.class);
        assertEquals(2, dv.getOrder());
        assertEquals(DisplayMode.INLINE, dv.getDisplayMode());
        assertEquals("y", text(dv.getFunction()));
        assertEquals("x", text(dv.getVariable()));

        DerivativeNode pdv = single("{\\displaystyle \\pdv{f}{t}}", DerivativeNode.class);
        assertTrue(pdv.isPartial());
        assertEquals(DisplayMode.DISPLAY, pdv.getDisplayMode());

        DerivativeNode longForm = single("\\dv{x}\\grande{f}", DerivativeNode.class);
        assertTrue(longForm.isLongForm());
        assertEquals("x", text(longForm.getVariable()));
        assertEquals("f", text(longForm.getFunction()));

        DerivativeNode operator = single("\\dv{x}", DerivativeNode.class);
        assertTrue(operator.isLongForm());
        assertTrue(operator.getFunction().isEmpty());
    }

    @Test
    void matrices() {
        MatrixNode matrix = single("\\begin{bmatrix} a & b \\\\ c & d \\end{bmatrix}", MatrixNode.class);
        assertEquals(MatrixType.BRACKETS, matrix.getMatrixType());
        assertEquals(2, matrix.getRows());
        assertEquals(2, matrix.getCols());
        assertEquals("d", text(matrix.getCell(1, 1)));

        MatrixNode ragged = single("\\begin{vmatrix} a & b \\\\ c \\end{vmatrix}", MatrixNode.class);
        assertEquals(2, ragged.getCols());
        assertTrue(ragged.getCell(1, 1).isEmpty());

        StackNode stack = single("\\begin{array}{cc} 1 & 2 \\end{array}", StackNode.class);
        assertEquals(1, stack.getRows());
        assertEquals("2", text(stack.getCell(0, 1)));

        CasesNode cases = single("\\begin{cases} x & y>0 \\\\ -x & y<0 \\end{cases}", CasesNode.class);
        assertEquals(2, cases.getRows());
        assertEquals("-x", text(cases.getCell(1, 0)));
    }

    @Test
    void nestedMatrixStaysInItsCell() {
        MatrixNode outer = single(
            "\\begin{pmatrix} \\begin{pmatrix} 1 & 2 \\end{pmatrix} & b \\end{pmatrix}", MatrixNode.class);
        assertEquals(2, outer.getCols());
        assertInstanceOf(MatrixNode.class, outer.getCell(0, 0).get(0));
    }

    @Test
    void accents() {
        AccentNode hat = single("\\hat{x}", AccentNode.class);
        assertEquals(AccentType.HAT, hat.getAccentType());
        assertEquals(AccentType.WIDEBAR, single("\\overline{AB}", AccentNode.class).getAccentType());

        AccentNode labeled = single("\\underbrace{a+b}_{n}", AccentNode.class);
        assertEquals(AccentType.LABELEDUNDERBRACE, labeled.getAccentType());
        assertEquals("n", text(labeled.getAccentLabel()));

        assertEquals(AccentType.OVERBRACE, single("\\overbrace{a}", AccentNode.class).getAccentType());
    }

    @Test
    void functions() {
        FunctionNode sin = single("\\sin{x}", FunctionNode.class);
        assertEquals(FunctionType.SIN, sin.getFunctionType());
        assertEquals("x", text(sin.getFunctionArgument()));

        assertEquals(FunctionType.SINH, single("\\sinh{x}", FunctionNode.class).getFunctionType());

        FunctionNode log = single("\\log_{2}{8}", FunctionNode.class);
        assertEquals(FunctionType.LOGN, log.getFunctionType());
        assertEquals("2", text(log.getFunctionBase()));

        FunctionNode lim = single("\\lim_{x}{f}", FunctionNode.class);
        assertEquals(FunctionType.LIM, lim.getFunctionType());
        assertEquals("x", text(lim.getFunctionConstraint()));

        assertEquals(FunctionType.ASIN, single("\\operatorname{asin}{x}", FunctionNode.class).getFunctionType());
        FunctionNode argmax = single("\\operatorname*{argmax}_{x}{f}", FunctionNode.class);
        assertEquals(FunctionType.ARGMAX, argmax.getFunctionType());
        assertEquals("x", text(argmax.getFunctionConstraint()));
    }

    @Test
    void userDefinedFunctions() {
        FunctionNode plain = single("\\operatorname{g}{x}", FunctionNode.class);
        assertEquals(FunctionType.FUNCTION, plain.getFunctionType());
        assertEquals("g", text(plain.getFunctionName()));

        FunctionNode sub = single("\\operatorname{g}_{2}{x}", FunctionNode.class);
        assertEquals(FunctionType.FUNCTIONSUB, sub.getFunctionType());
        assertEquals("2", text(sub.getFunctionBase()));

        FunctionNode lim = single("\\operatorname*{mode}_{x}{y}", FunctionNode.class);
        assertEquals(FunctionType.FUNCTIONLIM, lim.getFunctionType());
        assertEquals("mode", text(lim.getFunctionName()));
    }

    @Test
    void textAttributes() {
        TextNode bold = single("\\mathbf{x}", TextNode.class);
        assertTrue(bold.isBold());
        assertNull(bold.getItalic());

        TextNode boldItalic = single("\\boldsymbol{\\alpha}", TextNode.class);
        assertTrue(boldItalic.isBold());
        assertEquals(Boolean.TRUE, boldItalic.getItalic());

        TextNode boldRoman = single("\\mathbf{\\mathrm{x}}", TextNode.class);
        assertTrue(boldRoman.isBold());
        assertEquals(Boolean.FALSE, boldRoman.getItalic());

        List<Node> digits = parser.parse("\\textit{\\textbf{12}}");
        assertEquals(2, digits.size());
        assertTrue(((TextNode) digits.get(1)).isBold());
        assertEquals(Boolean.TRUE, ((TextNode) digits.get(1)).getItalic());

        assertEquals(UnderlineStyle.DOUBLE, single("\\uuline{x}", TextNode.class).getUnderline());
        assertTrue(single("\\sout{x}", TextNode.class).isStrikethrough());
        assertTrue(single("\\textrm{x}", TextNode.class).isTextMode());
        assertEquals("red", single("{\\color{red} x}", TextNode.class).getColor());
    }

    @ParameterizedTest
    @ValueSource(strings = {"\\cancel{ab}", "\\text{ab}", "\\textcolor{blue}{ab}", "\\underline{ab}"})
    void wrapperCommandsReachEveryProducedNode(String markup) {
        List<Node> nodes = parser.parse(markup);
        assertEquals(2, nodes.size());
        assertEquals(1, nodes.get(0).getWrappers().size());
        assertTrue(nodes.get(0).getWrappers().sameSetAs(nodes.get(1).getWrappers()));
    }

    @Test
    void wrapperOrderIsInnermostFirst() {
        Node node = single("\\cancel{\\underline{x}}", TextNode.class);
        List<Wrapper> order = node.getWrappers().inApplicationOrder();
        assertEquals(WrapperKind.UNDERLINE, order.get(0).getKind());
        assertEquals(WrapperKind.CANCEL, order.get(1).getKind());
    }

    @Test
    void nestedUnderlineIsDouble() {
        Node node = single("\\underline{\\underline{x}}", TextNode.class);
        assertEquals(UnderlineStyle.DOUBLE, node.getWrappers().get(WrapperKind.UNDERLINE).orElseThrow().getUnderline());
        assertEquals(1, node.getWrappers().size());
    }

    @Test
    void idsComeFromTheBuilder() {
        List<Node> nodes = parser.parse("a\\frac{b}{c}");
        assertEquals("element-0", nodes.get(0).getId());
        assertTrue(nodes.get(1).getId().startsWith("element-"));
    }

    @Test
    void unterminatedGroupClosesAtEnd() {
        FractionNode fraction = single("\\frac{1}{2", FractionNode.class);
        assertEquals("2", text(fraction.getDenominator()));
    }
}
