package im.arun.mathmarkup.parser;

import im.arun.mathmarkup.model.AccentNode;
import im.arun.mathmarkup.model.AccentType;
import im.arun.mathmarkup.model.BevelledFractionNode;
import im.arun.mathmarkup.model.BracketNode;
import im.arun.mathmarkup.model.DerivativeNode;
import im.arun.mathmarkup.model.DisplayMode;
import im.arun.mathmarkup.model.FractionNode;
import im.arun.mathmarkup.model.FunctionNode;
import im.arun.mathmarkup.model.FunctionShape;
import im.arun.mathmarkup.model.FunctionType;
import im.arun.mathmarkup.model.GridNode;
import im.arun.mathmarkup.model.IntegralNode;
import im.arun.mathmarkup.model.LargeOperatorNode;
import im.arun.mathmarkup.model.LimitMode;
import im.arun.mathmarkup.model.MatrixType;
import im.arun.mathmarkup.model.Node;
import im.arun.mathmarkup.model.NthRootNode;
import im.arun.mathmarkup.model.ScriptNode;
import im.arun.mathmarkup.model.SqrtNode;
import im.arun.mathmarkup.model.TextNode;
import im.arun.mathmarkup.model.UnderlineStyle;
import im.arun.mathmarkup.model.Wrapper;
import im.arun.mathmarkup.parser.MarkupScanner.Group;
import im.arun.mathmarkup.symbols.CommandMatch;
import im.arun.mathmarkup.symbols.CommandTables;
import im.arun.mathmarkup.symbols.Delimiter;
import im.arun.mathmarkup.symbols.IntegralCommand;
import im.arun.mathmarkup.symbols.SymbolInfo;
import im.arun.mathmarkup.tree.EquationBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

import static im.arun.mathmarkup.parser.MarkupScanner.readArgument;
import static im.arun.mathmarkup.parser.MarkupScanner.readGroup;
import static im.arun.mathmarkup.parser.MarkupScanner.skipSpaces;
import static im.arun.mathmarkup.symbols.CommandTables.matchesCommand;

/**
 * Recursive-descent reader for the math-markup dialect.
 * <p>
 * Never throws on malformed input: unknown commands come out as literal
 * text one character at a time, groups left open close at end of input and
 * derivative fractions that fit no known shape become plain fractions.
 * Node ids come from the supplied builder.
 */
public class MarkupParser {
    private static final Logger logger = LoggerFactory.getLogger(MarkupParser.class);

    private static final int NO_MATCH = -1;

    private static final Map<String, String> LITERAL_ESCAPES = new LinkedHashMap<>();
    private static final Map<String, AccentType> ACCENT_COMMANDS = new LinkedHashMap<>();

    static {
        LITERAL_ESCAPES.put("{\\text{^}}", "^");
        LITERAL_ESCAPES.put("{\\_}", "_");
        LITERAL_ESCAPES.put("\\text{＆}", "&");
        LITERAL_ESCAPES.put("\\textasciitilde{}", "~");
        LITERAL_ESCAPES.put("\\{", "{");
        LITERAL_ESCAPES.put("\\}", "}");
        LITERAL_ESCAPES.put("\\#", "#");
        LITERAL_ESCAPES.put("\\%", "%");
        LITERAL_ESCAPES.put("\\&", "&");
        LITERAL_ESCAPES.put("\\_", "_");
        LITERAL_ESCAPES.put("\\ ", " ");
        LITERAL_ESCAPES.put("\\|", "‖");

        for (AccentType type : AccentType.values()) {
            if (!type.isLabeled()) {
                ACCENT_COMMANDS.put("\\" + type.getCommand(), type);
            }
        }
    }

    private final EquationBuilder builder;
    private final CommandTables tables;

    public MarkupParser(EquationBuilder builder) {
        this(builder, CommandTables.standard());
    }

    public MarkupParser(EquationBuilder builder, CommandTables tables) {
        this.builder = builder;
        this.tables = tables;
    }

    /**
     * Parse markup into a sibling list of fresh nodes.
     */
    public List<Node> parse(String markup) {
        if (markup == null || markup.isEmpty()) {
            return new ArrayList<>();
        }
        return parseSequence(markup);
    }

    private List<Node> parseSequence(String text) {
        List<Node> result = new ArrayList<>();
        DisplayMode pendingStyle = null;
        int i = 0;
        while (i < text.length()) {
            if (Character.isWhitespace(text.charAt(i))) {
                i++;
                continue;
            }
            // a bare style switch applies to the node that follows it
            if (matchesCommand(text, i, "\\displaystyle")) {
                pendingStyle = DisplayMode.DISPLAY;
                i += "\\displaystyle".length();
                continue;
            }
            if (matchesCommand(text, i, "\\textstyle")) {
                pendingStyle = DisplayMode.INLINE;
                i += "\\textstyle".length();
                continue;
            }
            int before = result.size();
            i = parseAt(text, i, result);
            if (pendingStyle != null && result.size() > before) {
                applyStyle(result.get(before), pendingStyle);
                pendingStyle = null;
            }
        }
        return result;
    }

    private int parseAt(String text, int i, List<Node> out) {
        int next;
        if ((next = parseLiteralEscape(text, i, out)) != NO_MATCH) return next;
        if ((next = parseStyleGroup(text, i, out)) != NO_MATCH) return next;
        if ((next = parseDerivative(text, i, out)) != NO_MATCH) return next;
        if ((next = parseFraction(text, i, out)) != NO_MATCH) return next;
        if ((next = parseEnvironment(text, i, out)) != NO_MATCH) return next;
        if ((next = parseLargeOperator(text, i, out)) != NO_MATCH) return next;
        if ((next = parseIntegral(text, i, out)) != NO_MATCH) return next;
        if ((next = parseFunction(text, i, out)) != NO_MATCH) return next;
        if ((next = parseStructure(text, i, out)) != NO_MATCH) return next;
        if ((next = parseSymbol(text, i, out)) != NO_MATCH) return next;
        if ((next = parseFallback(text, i, out)) != NO_MATCH) return next;
        return parseLiteral(text, i, out);
    }

    // ---------------------------------------------------------------- escapes and styles

    private int parseLiteralEscape(String text, int i, List<Node> out) {
        for (Map.Entry<String, String> escape : LITERAL_ESCAPES.entrySet()) {
            if (text.startsWith(escape.getKey(), i)) {
                out.add(builder.createText(escape.getValue()));
                return i + escape.getKey().length();
            }
        }
        if (matchesCommand(text, i, "\\backslash")) {
            out.add(builder.createText("\\"));
            return i + "\\backslash".length();
        }
        // thin and medium spaces carry no node
        if (text.startsWith("\\,", i) || text.startsWith("\\;", i) || text.startsWith("\\:", i) || text.startsWith("\\!", i)) {
            return i + 2;
        }
        return NO_MATCH;
    }

    private int parseStyleGroup(String text, int i, List<Node> out) {
        if (text.charAt(i) != '{') {
            return NO_MATCH;
        }
        int inner = skipSpaces(text, i + 1);
        DisplayMode mode;
        String command;
        if (matchesCommand(text, inner, "\\displaystyle")) {
            mode = DisplayMode.DISPLAY;
            command = "\\displaystyle";
        } else if (matchesCommand(text, inner, "\\textstyle")) {
            mode = DisplayMode.INLINE;
            command = "\\textstyle";
        } else {
            return NO_MATCH;
        }
        Group group = readGroup(text, i);
        String content = group.getContent().substring(inner + command.length() - (i + 1));
        List<Node> nodes = parseSequence(content);
        if (nodes.size() == 1) {
            applyStyle(nodes.get(0), mode);
        } else {
            logger.debug("Style wrapper around {} nodes ignored", nodes.size());
        }
        out.addAll(nodes);
        return group.getEndIndex();
    }

    private static boolean applyStyle(Node node, DisplayMode mode) {
        switch (node.getType()) {
            case FRACTION:
                ((FractionNode) node).setDisplayMode(mode);
                return true;
            case BEVELLED_FRACTION:
                ((BevelledFractionNode) node).setDisplayMode(mode);
                return true;
            case LARGE_OPERATOR:
                ((LargeOperatorNode) node).setDisplayMode(mode);
                return true;
            case INTEGRAL:
                ((IntegralNode) node).setDisplayMode(mode);
                return true;
            case DERIVATIVE:
                ((DerivativeNode) node).setDisplayMode(mode);
                return true;
            default:
                return false;
        }
    }

    // ---------------------------------------------------------------- derivatives

    private int parseDerivative(String text, int i, List<Node> out) {
        if (matchesCommand(text, i, "\\derivldfrac")) {
            return parseLongDerivativeFraction(text, i + "\\derivldfrac".length(), DisplayMode.DISPLAY, out);
        }
        if (matchesCommand(text, i, "\\derivlfrac")) {
            return parseLongDerivativeFraction(text, i + "\\derivlfrac".length(), DisplayMode.INLINE, out);
        }
        if (matchesCommand(text, i, "\\derivdfrac")) {
            return parseDerivativeFraction(text, i + "\\derivdfrac".length(), DisplayMode.DISPLAY, out);
        }
        if (matchesCommand(text, i, "\\derivfrac")) {
            return parseDerivativeFraction(text, i + "\\derivfrac".length(), DisplayMode.INLINE, out);
        }
        if (matchesCommand(text, i, "\\pdv")) {
            return parsePhysicsDerivative(text, i + "\\pdv".length(), true, out);
        }
        if (matchesCommand(text, i, "\\dv")) {
            return parsePhysicsDerivative(text, i + "\\dv".length(), false, out);
        }
        return NO_MATCH;
    }

    private int parseDerivativeFraction(String text, int pos, DisplayMode mode, List<Node> out) {
        Group numerator = readArgument(text, skipSpaces(text, pos));
        Group denominator = readArgument(text, skipSpaces(text, numerator.getEndIndex()));
        DerivativeNode derivative = matchDerivative(numerator.getContent(), denominator.getContent(), mode, null);
        if (derivative != null) {
            out.add(derivative);
        } else {
            logger.debug("Derivative fraction {{{}}}/{{{}}} has no known shape, reading it as a fraction",
                numerator.getContent(), denominator.getContent());
            out.add(plainFraction(numerator.getContent(), denominator.getContent(), mode));
        }
        return denominator.getEndIndex();
    }

    private int parseLongDerivativeFraction(String text, int pos, DisplayMode mode, List<Node> out) {
        Group numerator = readArgument(text, skipSpaces(text, pos));
        Group denominator = readArgument(text, skipSpaces(text, numerator.getEndIndex()));
        Group function = readArgument(text, skipSpaces(text, denominator.getEndIndex()));
        DerivativeNode derivative = matchDerivative(numerator.getContent(), denominator.getContent(), mode,
            function.getContent());
        if (derivative != null) {
            out.add(derivative);
        } else {
            logger.debug("Long-form derivative {{{}}}/{{{}}} has no known shape, reading it as a fraction",
                numerator.getContent(), denominator.getContent());
            out.add(plainFraction(numerator.getContent(), denominator.getContent(), mode));
            out.addAll(parseSequence(function.getContent()));
        }
        return function.getEndIndex();
    }

    private FractionNode plainFraction(String numerator, String denominator, DisplayMode mode) {
        FractionNode fraction = mode == DisplayMode.DISPLAY ? builder.createDisplayFraction() : builder.createFraction();
        fraction.setDisplayMode(mode);
        fraction.getNumerator().addAll(parseSequence(numerator));
        fraction.getDenominator().addAll(parseSequence(denominator));
        return fraction;
    }

    /**
     * Match {@code d^{n}{f} / d{x}^{n}} (or the {@code \partial} spelling).
     * For the long form the numerator holds only the operator and the
     * function comes separately. Returns null when the shape does not fit.
     */
    private DerivativeNode matchDerivative(String numerator, String denominator, DisplayMode mode, String longFunction) {
        DifferentialPart top = DifferentialPart.read(numerator.trim(), false);
        DifferentialPart bottom = DifferentialPart.read(denominator.trim(), true);
        if (top == null || bottom == null || top.isPartial() != bottom.isPartial()) {
            return null;
        }
        if (longFunction != null && !top.getRest().isEmpty()) {
            return null;
        }
        String order = top.getOrder();
        if (order == null ? bottom.getOrder() != null : !order.trim().equals(trimOrNull(bottom.getOrder()))) {
            return null;
        }
        DerivativeNode derivative = createDerivative(order, mode, longFunction != null, top.isPartial());
        String function = longFunction != null ? longFunction : MarkupScanner.unwrapGroup(top.getRest());
        derivative.getFunction().addAll(parseSequence(function));
        derivative.getVariable().addAll(parseSequence(bottom.getRest()));
        return derivative;
    }

    private static String trimOrNull(String value) {
        return value == null ? null : value.trim();
    }

    private DerivativeNode createDerivative(String orderMarkup, DisplayMode mode, boolean longForm, boolean partial) {
        if (orderMarkup == null) {
            return builder.createDerivative(1, mode, longForm, partial);
        }
        String trimmed = orderMarkup.trim();
        if (trimmed.matches("[1-9][0-9]{0,8}")) {
            return builder.createDerivative(Integer.parseInt(trimmed), mode, longForm, partial);
        }
        return builder.createDerivative(parseSequence(trimmed), mode, longForm, partial);
    }

    private int parsePhysicsDerivative(String text, int pos, boolean partial, List<Node> out) {
        int p = skipSpaces(text, pos);
        Group order = MarkupScanner.readOptional(text, p);
        if (order != null) {
            p = skipSpaces(text, order.getEndIndex());
        }
        Group first = readArgument(text, p);
        p = skipSpaces(text, first.getEndIndex());
        String orderMarkup = order == null ? null : order.getContent();
        DerivativeNode derivative;
        int end;
        if (matchesCommand(text, p, "\\grande")) {
            Group function = readArgument(text, skipSpaces(text, p + "\\grande".length()));
            derivative = createDerivative(orderMarkup, DisplayMode.INLINE, true, partial);
            derivative.getVariable().addAll(parseSequence(first.getContent()));
            derivative.getFunction().addAll(parseSequence(function.getContent()));
            end = function.getEndIndex();
        } else if (p < text.length() && text.charAt(p) == '{') {
            Group variable = readGroup(text, p);
            derivative = createDerivative(orderMarkup, DisplayMode.INLINE, false, partial);
            derivative.getFunction().addAll(parseSequence(first.getContent()));
            derivative.getVariable().addAll(parseSequence(variable.getContent()));
            end = variable.getEndIndex();
        } else {
            // operator form d/dx with nothing to differentiate
            derivative = createDerivative(orderMarkup, DisplayMode.INLINE, true, partial);
            derivative.getVariable().addAll(parseSequence(first.getContent()));
            end = first.getEndIndex();
        }
        out.add(derivative);
        return end;
    }

    // ---------------------------------------------------------------- fractions and environments

    private int parseFraction(String text, int i, List<Node> out) {
        DisplayMode mode;
        int pos;
        if (matchesCommand(text, i, "\\dfrac")) {
            mode = DisplayMode.DISPLAY;
            pos = i + "\\dfrac".length();
        } else if (matchesCommand(text, i, "\\tfrac")) {
            mode = DisplayMode.INLINE;
            pos = i + "\\tfrac".length();
        } else if (matchesCommand(text, i, "\\frac")) {
            mode = null;
            pos = i + "\\frac".length();
        } else if (text.charAt(i) == '{') {
            return parseBevelledFraction(text, i, out);
        } else {
            return NO_MATCH;
        }
        Group numerator = readArgument(text, skipSpaces(text, pos));
        Group denominator = readArgument(text, skipSpaces(text, numerator.getEndIndex()));
        out.add(plainFraction(numerator.getContent(), denominator.getContent(), mode));
        return denominator.getEndIndex();
    }

    private int parseBevelledFraction(String text, int i, List<Node> out) {
        Group numerator = readGroup(text, i);
        int slash = numerator.getEndIndex();
        if (slash + 1 >= text.length() || text.charAt(slash) != '/' || text.charAt(slash + 1) != '{') {
            return NO_MATCH;
        }
        // {\color{c} ..} is colored text, never a numerator
        if (matchesCommand(numerator.getContent(), skipSpaces(numerator.getContent(), 0), "\\color")) {
            return NO_MATCH;
        }
        Group denominator = readGroup(text, slash + 1);
        BevelledFractionNode fraction = builder.createBevelledFraction();
        fraction.getNumerator().addAll(parseSequence(numerator.getContent()));
        fraction.getDenominator().addAll(parseSequence(denominator.getContent()));
        out.add(fraction);
        return denominator.getEndIndex();
    }

    private int parseEnvironment(String text, int i, List<Node> out) {
        if (!text.startsWith("\\begin{", i)) {
            return NO_MATCH;
        }
        Group name = readGroup(text, i + "\\begin".length());
        String environment = name.getContent().trim();
        MatrixType matrixType = MatrixType.fromEnvironment(environment);
        boolean stack = "array".equals(environment);
        boolean cases = "cases".equals(environment);
        if (matrixType == null && !stack && !cases) {
            logger.debug("Unknown environment {}", environment);
            return NO_MATCH;
        }
        int bodyStart = name.getEndIndex();
        if (stack) {
            int columns = skipSpaces(text, bodyStart);
            if (columns < text.length() && text.charAt(columns) == '{') {
                bodyStart = readGroup(text, columns).getEndIndex();
            }
        }
        int bodyEnd = MarkupScanner.findEnvironmentEnd(text, bodyStart, environment);
        int end = Math.min(text.length(), bodyEnd + ("\\end{" + environment + "}").length());

        List<List<String>> rows = MarkupScanner.splitGrid(text.substring(bodyStart, bodyEnd));
        int cols = rows.stream().mapToInt(List::size).max().orElse(1);
        GridNode grid;
        if (stack) {
            grid = builder.createStack(rows.size(), cols);
        } else if (cases) {
            grid = builder.createCases(rows.size(), cols);
        } else {
            grid = builder.createMatrix(rows.size(), cols, matrixType);
        }
        for (int r = 0; r < rows.size(); r++) {
            List<String> row = rows.get(r);
            for (int c = 0; c < row.size(); c++) {
                grid.getCell(r, c).addAll(parseSequence(row.get(c)));
            }
        }
        out.add(grid);
        return end;
    }

    // ---------------------------------------------------------------- operators and integrals

    private int parseLargeOperator(String text, int i, List<Node> out) {
        if (text.charAt(i) != '\\') {
            return NO_MATCH;
        }
        Optional<CommandMatch<SymbolInfo>> match = tables.matchLargeOperator(text, i);
        if (match.isEmpty()) {
            return NO_MATCH;
        }
        int pos = match.get().getEndIndex();
        LimitMode limitMode = LimitMode.DEFAULT;
        if (matchesCommand(text, pos, "\\limits")) {
            limitMode = LimitMode.LIMITS;
            pos += "\\limits".length();
        } else if (matchesCommand(text, pos, "\\nolimits")) {
            limitMode = LimitMode.NOLIMITS;
            pos += "\\nolimits".length();
        }
        LargeOperatorNode operator = builder.createLargeOperator(match.get().getEntry().getUnicode(), null, limitMode);
        for (int k = 0; k < 2; k++) {
            int p = skipSpaces(text, pos);
            if (p < text.length() && text.charAt(p) == '_') {
                Group lower = readArgument(text, skipSpaces(text, p + 1));
                operator.getLowerLimit().addAll(parseSequence(lower.getContent()));
                pos = lower.getEndIndex();
            } else if (p < text.length() && text.charAt(p) == '^') {
                Group upper = readArgument(text, skipSpaces(text, p + 1));
                operator.getUpperLimit().addAll(parseSequence(upper.getContent()));
                pos = upper.getEndIndex();
            }
        }
        int p = skipSpaces(text, pos);
        if (p < text.length() && text.charAt(p) == '{') {
            Group operand = readGroup(text, p);
            operator.getOperand().addAll(parseSequence(operand.getContent()));
            pos = operand.getEndIndex();
        }
        out.add(operator);
        return pos;
    }

    private int parseIntegral(String text, int i, List<Node> out) {
        if (text.charAt(i) != '\\') {
            return NO_MATCH;
        }
        Optional<CommandMatch<IntegralCommand>> match = tables.matchIntegral(text, i);
        if (match.isEmpty()) {
            return NO_MATCH;
        }
        IntegralCommand command = match.get().getEntry();
        List<String> args = new ArrayList<>();
        int pos = match.get().getEndIndex();
        for (int k = 0; k < command.getArity(); k++) {
            Group arg = readArgument(text, skipSpaces(text, pos));
            args.add(arg.getContent());
            pos = arg.getEndIndex();
        }
        IntegralNode integral = builder.createIntegral(command.getIntegralType(), null,
            command.getDifferentialStyle(), command.getForm().getLimitMode(), command.getForm().getLimits());
        integral.getIntegrand().addAll(parseSequence(args.get(0)));
        integral.getDifferentialVariable().addAll(parseSequence(args.get(1)));
        if (args.size() > 2) {
            integral.getLowerLimit().addAll(parseSequence(args.get(2)));
        }
        if (args.size() > 3) {
            integral.getUpperLimit().addAll(parseSequence(args.get(3)));
        }
        out.add(integral);
        return pos;
    }

    // ---------------------------------------------------------------- functions

    private int parseFunction(String text, int i, List<Node> out) {
        if (text.charAt(i) != '\\') {
            return NO_MATCH;
        }
        if (text.startsWith("\\operatorname", i)) {
            return parseOperatorName(text, i, out);
        }
        for (FunctionType type : FunctionType.values()) {
            if (!type.hasBuiltinCommand() || type.getShape() == FunctionShape.SUB) {
                continue;
            }
            String command = "\\" + type.getName();
            if (matchesCommand(text, i, command)) {
                int pos = i + command.length();
                FunctionType resolved = type;
                if (type == FunctionType.LOG && peek(text, pos) == '_') {
                    resolved = FunctionType.LOGN;
                }
                return readFunctionArguments(text, pos, builder.createFunction(resolved), out);
            }
        }
        return NO_MATCH;
    }

    private int parseOperatorName(String text, int i, List<Node> out) {
        int pos = i + "\\operatorname".length();
        boolean starred = pos < text.length() && text.charAt(pos) == '*';
        if (starred) {
            pos++;
        } else if (pos < text.length() && CommandTables.isAsciiLetter(text.charAt(pos))) {
            return NO_MATCH;
        }
        Group name = readArgument(text, skipSpaces(text, pos));
        String functionName = name.getContent().trim();
        pos = name.getEndIndex();

        FunctionType type = null;
        for (FunctionType candidate : FunctionType.values()) {
            if (!candidate.isUserDefined() && !candidate.hasBuiltinCommand() && candidate.getName().equals(functionName)) {
                type = candidate;
                break;
            }
        }
        if (type == null) {
            FunctionShape shape = starred ? FunctionShape.LIM
                : peek(text, pos) == '_' ? FunctionShape.SUB : FunctionShape.SIMPLE;
            type = FunctionType.userDefined(shape);
        }
        FunctionNode function = builder.createFunction(type);
        if (type.isUserDefined()) {
            function.getFunctionName().addAll(parseSequence(functionName));
        }
        return readFunctionArguments(text, pos, function, out);
    }

    private int readFunctionArguments(String text, int pos, FunctionNode function, List<Node> out) {
        FunctionShape shape = function.getFunctionType().getShape();
        int p = skipSpaces(text, pos);
        if (shape != FunctionShape.SIMPLE && p < text.length() && text.charAt(p) == '_') {
            Group script = readArgument(text, skipSpaces(text, p + 1));
            List<Node> target = shape == FunctionShape.SUB ? function.getFunctionBase() : function.getFunctionConstraint();
            target.addAll(parseSequence(script.getContent()));
            pos = script.getEndIndex();
            p = skipSpaces(text, pos);
        }
        if (p < text.length() && text.charAt(p) == '{') {
            Group argument = readGroup(text, p);
            function.getFunctionArgument().addAll(parseSequence(argument.getContent()));
            pos = argument.getEndIndex();
        }
        out.add(function);
        return pos;
    }

    private static char peek(String text, int pos) {
        int p = skipSpaces(text, pos);
        return p < text.length() ? text.charAt(p) : '\0';
    }

    // ---------------------------------------------------------------- roots, accents, formatting

    private int parseStructure(String text, int i, List<Node> out) {
        if (text.charAt(i) != '\\') {
            return NO_MATCH;
        }
        if (matchesCommand(text, i, "\\sqrt")) {
            return parseRoot(text, i + "\\sqrt".length(), out);
        }
        for (Map.Entry<String, AccentType> accent : ACCENT_COMMANDS.entrySet()) {
            if (matchesCommand(text, i, accent.getKey())) {
                return parseAccent(text, i + accent.getKey().length(), accent.getValue(), out);
            }
        }
        if (matchesCommand(text, i, "\\boldsymbol")) {
            return applyAttribute(text, i + "\\boldsymbol".length(), out, node -> {
                node.setBold(true);
                setItalicIfUnset(node, true);
            });
        }
        if (matchesCommand(text, i, "\\mathbf") || matchesCommand(text, i, "\\textbf")) {
            return applyAttribute(text, i + "\\mathbf".length(), out, node -> node.setBold(true));
        }
        if (matchesCommand(text, i, "\\mathit") || matchesCommand(text, i, "\\textit")) {
            return applyAttribute(text, i + "\\mathit".length(), out, node -> setItalicIfUnset(node, true));
        }
        if (matchesCommand(text, i, "\\mathrm")) {
            return applyAttribute(text, i + "\\mathrm".length(), out, node -> setItalicIfUnset(node, false));
        }
        if (matchesCommand(text, i, "\\uuline")) {
            return applyAttribute(text, i + "\\uuline".length(), out, node -> node.setUnderline(UnderlineStyle.DOUBLE));
        }
        if (matchesCommand(text, i, "\\uline")) {
            return applyAttribute(text, i + "\\uline".length(), out, node -> node.setUnderline(UnderlineStyle.SINGLE));
        }
        if (matchesCommand(text, i, "\\sout")) {
            return applyAttribute(text, i + "\\sout".length(), out, node -> node.setStrikethrough(true));
        }
        if (matchesCommand(text, i, "\\textrm")) {
            return applyAttribute(text, i + "\\textrm".length(), out, node -> node.setTextMode(true));
        }
        if (matchesCommand(text, i, "\\underline")) {
            return parseUnderline(text, i + "\\underline".length(), out);
        }
        if (matchesCommand(text, i, "\\cancel")) {
            return applyWrapper(text, i + "\\cancel".length(), Wrapper.cancel(), out);
        }
        if (matchesCommand(text, i, "\\textcolor")) {
            Group color = readArgument(text, skipSpaces(text, i + "\\textcolor".length()));
            return applyWrapper(text, color.getEndIndex(), Wrapper.color(color.getContent().trim()), out);
        }
        if (matchesCommand(text, i, "\\text")) {
            return applyWrapper(text, i + "\\text".length(), Wrapper.textMode(), out);
        }
        return NO_MATCH;
    }

    private int parseRoot(String text, int pos, List<Node> out) {
        int p = skipSpaces(text, pos);
        Group index = MarkupScanner.readOptional(text, p);
        if (index != null) {
            p = skipSpaces(text, index.getEndIndex());
        }
        Group radicand = readArgument(text, p);
        if (index != null) {
            NthRootNode root = builder.createNthRoot();
            root.getIndex().addAll(parseSequence(index.getContent()));
            root.getRadicand().addAll(parseSequence(radicand.getContent()));
            out.add(root);
        } else {
            SqrtNode root = builder.createSquareRoot();
            root.getRadicand().addAll(parseSequence(radicand.getContent()));
            out.add(root);
        }
        return radicand.getEndIndex();
    }

    private int parseAccent(String text, int pos, AccentType type, List<Node> out) {
        Group base = readArgument(text, skipSpaces(text, pos));
        int end = base.getEndIndex();
        int p = skipSpaces(text, end);
        AccentType resolved = type;
        Group label = null;
        if (type == AccentType.OVERBRACE && p < text.length() && text.charAt(p) == '^') {
            resolved = AccentType.LABELEDOVERBRACE;
            label = readArgument(text, skipSpaces(text, p + 1));
        } else if (type == AccentType.UNDERBRACE && p < text.length() && text.charAt(p) == '_') {
            resolved = AccentType.LABELEDUNDERBRACE;
            label = readArgument(text, skipSpaces(text, p + 1));
        }
        AccentNode accent = builder.createAccent(resolved);
        accent.getAccentBase().addAll(parseSequence(base.getContent()));
        if (label != null) {
            accent.getAccentLabel().addAll(parseSequence(label.getContent()));
            end = label.getEndIndex();
        }
        out.add(accent);
        return end;
    }

    private static void setItalicIfUnset(TextNode node, boolean italic) {
        if (node.getItalic() == null) {
            node.setItalic(italic);
        }
    }

    /**
     * Parse one argument and apply a text attribute to the text nodes it yields.
     */
    private int applyAttribute(String text, int pos, List<Node> out, Consumer<TextNode> attribute) {
        Group content = readArgument(text, skipSpaces(text, pos));
        List<Node> nodes = parseSequence(content.getContent());
        for (Node node : nodes) {
            if (node instanceof TextNode) {
                attribute.accept((TextNode) node);
            }
        }
        out.addAll(nodes);
        return content.getEndIndex();
    }

    /**
     * Parse one argument and add the wrapper, outermost, to every node it yields.
     */
    private int applyWrapper(String text, int pos, Wrapper wrapper, List<Node> out) {
        Group content = readArgument(text, skipSpaces(text, pos));
        List<Node> nodes = parseSequence(content.getContent());
        nodes.forEach(node -> node.getWrappers().apply(wrapper));
        out.addAll(nodes);
        return content.getEndIndex();
    }

    private int parseUnderline(String text, int pos, List<Node> out) {
        Group content = readArgument(text, skipSpaces(text, pos));
        String inner = content.getContent().trim();
        if (matchesCommand(inner, 0, "\\underline")) {
            int p = skipSpaces(inner, "\\underline".length());
            if (p < inner.length() && inner.charAt(p) == '{' && readGroup(inner, p).getEndIndex() == inner.length()) {
                List<Node> nodes = parseSequence(readGroup(inner, p).getContent());
                nodes.forEach(node -> node.getWrappers().apply(Wrapper.underline(UnderlineStyle.DOUBLE)));
                out.addAll(nodes);
                return content.getEndIndex();
            }
        }
        List<Node> nodes = parseSequence(content.getContent());
        nodes.forEach(node -> node.getWrappers().apply(Wrapper.underline(UnderlineStyle.SINGLE)));
        out.addAll(nodes);
        return content.getEndIndex();
    }

    // ---------------------------------------------------------------- symbols and fallbacks

    private int parseSymbol(String text, int i, List<Node> out) {
        Optional<CommandMatch<SymbolInfo>> match = tables.matchSymbol(text, i);
        if (match.isEmpty()) {
            return NO_MATCH;
        }
        out.add(builder.createText(match.get().getEntry().getUnicode()));
        return match.get().getEndIndex();
    }

    private int parseFallback(String text, int i, List<Node> out) {
        char c = text.charAt(i);
        if (c == '^' || c == '_') {
            return attachScript(text, i, out);
        }
        if (c == '{') {
            return parseGroup(text, i, out);
        }
        for (String size : CommandTables.BRACKET_SIZE_LEFT) {
            if (matchesCommand(text, i, size)) {
                return parseBracket(text, i, size, out);
            }
        }
        for (String size : CommandTables.BRACKET_SIZE_RIGHT) {
            if (matchesCommand(text, i, size)) {
                // closing delimiter without an opening one
                Optional<CommandMatch<Delimiter>> delimiter = tables.matchDelimiter(text, i + size.length());
                if (delimiter.isEmpty()) {
                    return NO_MATCH;
                }
                if (!".".equals(delimiter.get().getEntry().getGlyph())) {
                    out.add(builder.createText(delimiter.get().getEntry().getGlyph()));
                }
                return delimiter.get().getEndIndex();
            }
        }
        return NO_MATCH;
    }

    private int attachScript(String text, int i, List<Node> out) {
        boolean superscript = text.charAt(i) == '^';
        Group content = readArgument(text, skipSpaces(text, i + 1));
        List<Node> nodes = parseSequence(content.getContent());
        Node last = out.isEmpty() ? null : out.get(out.size() - 1);
        if (last instanceof ScriptNode) {
            ScriptNode script = (ScriptNode) last;
            if (superscript && script.getSuperscript() == null) {
                script.setSuperscript(nodes);
                return content.getEndIndex();
            }
            if (!superscript && script.getSubscript() == null) {
                script.setSubscript(nodes);
                return content.getEndIndex();
            }
        }
        ScriptNode script = builder.createScript(superscript, !superscript);
        if (last != null) {
            out.remove(out.size() - 1);
            script.getBase().add(last);
        }
        if (superscript) {
            script.setSuperscript(nodes);
        } else {
            script.setSubscript(nodes);
        }
        out.add(script);
        return content.getEndIndex();
    }

    private int parseGroup(String text, int i, List<Node> out) {
        Group group = readGroup(text, i);
        String content = group.getContent();
        int colorStart = skipSpaces(content, 0);
        if (matchesCommand(content, colorStart, "\\color")) {
            Group color = readArgument(content, skipSpaces(content, colorStart + "\\color".length()));
            List<Node> nodes = parseSequence(content.substring(color.getEndIndex()));
            for (Node node : nodes) {
                if (node instanceof TextNode && ((TextNode) node).getColor() == null) {
                    ((TextNode) node).setColor(color.getContent().trim());
                }
            }
            out.addAll(nodes);
            return group.getEndIndex();
        }
        List<Node> nodes = parseSequence(content);
        char next = peek(text, group.getEndIndex());
        if (next == '^' || next == '_') {
            ScriptNode script = builder.createScript(false, false);
            script.getBase().addAll(nodes);
            out.add(script);
        } else {
            out.addAll(nodes);
        }
        return group.getEndIndex();
    }

    private int parseBracket(String text, int i, String size, List<Node> out) {
        Optional<CommandMatch<Delimiter>> left = tables.matchDelimiter(text, i + size.length());
        if (left.isEmpty()) {
            return NO_MATCH;
        }
        int contentStart = left.get().getEndIndex();
        int depth = 1;
        int j = contentStart;
        String rightGlyph = ".";
        int contentEnd = text.length();
        int end = text.length();
        scan:
        while (j < text.length()) {
            for (String open : CommandTables.BRACKET_SIZE_LEFT) {
                if (matchesCommand(text, j, open) && tables.matchDelimiter(text, j + open.length()).isPresent()) {
                    depth++;
                    j = tables.matchDelimiter(text, j + open.length()).get().getEndIndex();
                    continue scan;
                }
            }
            for (String close : CommandTables.BRACKET_SIZE_RIGHT) {
                if (matchesCommand(text, j, close)) {
                    Optional<CommandMatch<Delimiter>> right = tables.matchDelimiter(text, j + close.length());
                    if (right.isPresent()) {
                        depth--;
                        if (depth == 0) {
                            rightGlyph = right.get().getEntry().getGlyph();
                            contentEnd = j;
                            end = right.get().getEndIndex();
                            break scan;
                        }
                        j = right.get().getEndIndex();
                        continue scan;
                    }
                }
            }
            j += text.charAt(j) == '\\' ? 2 : 1;
        }

        BracketNode bracket = builder.createBracket(left.get().getEntry().getGlyph(), rightGlyph);
        bracket.getContent().addAll(parseSequence(text.substring(contentStart, Math.min(contentEnd, text.length()))));
        end = readEvaluationBounds(text, end, bracket);
        out.add(bracket);
        return end;
    }

    /**
     * A bracket directly followed by both a subscript and a superscript is an
     * evaluation bracket. A single script is left for the script fallback.
     */
    private int readEvaluationBounds(String text, int pos, BracketNode bracket) {
        int p = skipSpaces(text, pos);
        if (p >= text.length() || (text.charAt(p) != '_' && text.charAt(p) != '^')) {
            return pos;
        }
        char firstMark = text.charAt(p);
        Group first = readArgument(text, skipSpaces(text, p + 1));
        int q = skipSpaces(text, first.getEndIndex());
        char secondMark = firstMark == '_' ? '^' : '_';
        if (q >= text.length() || text.charAt(q) != secondMark) {
            return pos;
        }
        Group second = readArgument(text, skipSpaces(text, q + 1));
        Group lower = firstMark == '_' ? first : second;
        Group upper = firstMark == '_' ? second : first;
        bracket.setSubscript(parseSequence(lower.getContent()));
        bracket.setSuperscript(parseSequence(upper.getContent()));
        return second.getEndIndex();
    }

    private int parseLiteral(String text, int i, List<Node> out) {
        int codePoint = text.codePointAt(i);
        if (codePoint == '\\') {
            logger.debug("Unrecognized command at offset {}, keeping it as literal text", i);
        }
        out.add(builder.createText(new String(Character.toChars(codePoint))));
        return i + Character.charCount(codePoint);
    }
}
