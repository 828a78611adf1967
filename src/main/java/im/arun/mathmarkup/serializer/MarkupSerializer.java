package im.arun.mathmarkup.serializer;

import im.arun.mathmarkup.model.AccentNode;
import im.arun.mathmarkup.model.AccentType;
import im.arun.mathmarkup.model.BevelledFractionNode;
import im.arun.mathmarkup.model.BracketNode;
import im.arun.mathmarkup.model.CasesNode;
import im.arun.mathmarkup.model.DerivativeNode;
import im.arun.mathmarkup.model.DisplayMode;
import im.arun.mathmarkup.model.FractionNode;
import im.arun.mathmarkup.model.FunctionNode;
import im.arun.mathmarkup.model.FunctionShape;
import im.arun.mathmarkup.model.FunctionType;
import im.arun.mathmarkup.model.GridNode;
import im.arun.mathmarkup.model.IntegralLimits;
import im.arun.mathmarkup.model.IntegralNode;
import im.arun.mathmarkup.model.LargeOperatorNode;
import im.arun.mathmarkup.model.LimitMode;
import im.arun.mathmarkup.model.MatrixNode;
import im.arun.mathmarkup.model.Node;
import im.arun.mathmarkup.model.NodeVisitor;
import im.arun.mathmarkup.model.NthRootNode;
import im.arun.mathmarkup.model.ScriptNode;
import im.arun.mathmarkup.model.SqrtNode;
import im.arun.mathmarkup.model.StackNode;
import im.arun.mathmarkup.model.TextNode;
import im.arun.mathmarkup.model.UnderlineStyle;
import im.arun.mathmarkup.model.Wrapper;
import im.arun.mathmarkup.symbols.CommandTables;
import im.arun.mathmarkup.symbols.IntegralCommand;
import im.arun.mathmarkup.symbols.IntegralForm;
import im.arun.mathmarkup.util.TreeUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Emits math markup for an equation tree.
 * <p>
 * Output depends only on the tree and the options. Adjacent text nodes with
 * the same formatting are emitted as one run, and adjacent siblings with the
 * same wrapper set share one set of wrapper commands.
 */
public class MarkupSerializer {

    private static final Map<String, String> ESCAPES = Map.of(
        "{", "\\{",
        "}", "\\}",
        "#", "\\#",
        "&", "\\text{＆}",
        "%", "\\%",
        "~", "\\textasciitilde{}",
        "^", "{\\text{^}}",
        "_", "{\\_}");

    private final CommandTables tables;
    private final SerializerOptions options;

    public MarkupSerializer() {
        this(CommandTables.standard(), SerializerOptions.defaults());
    }

    public MarkupSerializer(SerializerOptions options) {
        this(CommandTables.standard(), options);
    }

    public MarkupSerializer(CommandTables tables, SerializerOptions options) {
        this.tables = tables;
        this.options = options == null ? SerializerOptions.defaults() : options;
    }

    public SerializerOptions getOptions() {
        return options;
    }

    public String serialize(List<Node> equation) {
        if (equation == null || equation.isEmpty()) {
            return "";
        }
        Emitter emitter = new Emitter(TreeUtils.maxBracketDepth(equation));
        return trim(emitter.list(equation));
    }

    /**
     * Strip outer whitespace without breaking a trailing {@code \ }.
     */
    private static String trim(String markup) {
        String trimmed = markup.strip();
        if (trimmed.endsWith("\\") && trimmed.length() < markup.length()) {
            int slashes = 0;
            for (int i = trimmed.length() - 1; i >= 0 && trimmed.charAt(i) == '\\'; i--) {
                slashes++;
            }
            if (slashes % 2 == 1) {
                return trimmed + " ";
            }
        }
        return trimmed;
    }

    /**
     * One serialization pass. Tracks the bracket depth while descending.
     */
    private class Emitter implements NodeVisitor<String> {
        private final int maxDepth;
        private int depth;

        Emitter(int maxDepth) {
            this.maxDepth = maxDepth;
        }

        String list(List<Node> nodes) {
            if (nodes == null) {
                return "";
            }
            StringBuilder out = new StringBuilder();
            int i = 0;
            while (i < nodes.size()) {
                Node first = nodes.get(i);
                int end = i + 1;
                while (end < nodes.size() && nodes.get(end).getWrappers().sameSetAs(first.getWrappers())) {
                    end++;
                }
                String inner = run(nodes.subList(i, end));
                for (Wrapper wrapper : first.getWrappers().inApplicationOrder()) {
                    inner = wrap(wrapper, inner);
                }
                out.append(inner);
                i = end;
            }
            return out.toString();
        }

        /**
         * Slot content in braces; an empty slot is {@code { }}.
         */
        String group(List<Node> nodes) {
            String content = trim(list(nodes));
            return content.isEmpty() ? "{ }" : "{" + content + "}";
        }

        private String run(List<Node> nodes) {
            StringBuilder out = new StringBuilder();
            int i = 0;
            while (i < nodes.size()) {
                Node node = nodes.get(i);
                if (node instanceof TextNode) {
                    TextNode format = (TextNode) node;
                    StringBuilder value = new StringBuilder(format.getValue());
                    int end = i + 1;
                    while (end < nodes.size() && nodes.get(end) instanceof TextNode
                        && ((TextNode) nodes.get(end)).hasSameFormatting(format)) {
                        value.append(((TextNode) nodes.get(end)).getValue());
                        end++;
                    }
                    out.append(text(value.toString(), format));
                    i = end;
                } else {
                    out.append(node.accept(this));
                    i++;
                }
            }
            return out.toString();
        }

        private String wrap(Wrapper wrapper, String inner) {
            switch (wrapper.getKind()) {
                case UNDERLINE:
                    String once = "\\underline{" + inner + "}";
                    return wrapper.getUnderline() == UnderlineStyle.DOUBLE ? "\\underline{" + once + "}" : once;
                case CANCEL:
                    return "\\cancel{" + inner + "}";
                case COLOR:
                    return "\\textcolor{" + wrapper.getColor() + "}{" + inner + "}";
                case TEXT_MODE:
                    return "\\text{" + inner + "}";
                default:
                    return inner;
            }
        }

        // ------------------------------------------------------------ text

        private String text(String value, TextNode format) {
            String markup = textValue(value);
            if (format.isPlain()) {
                return markup;
            }
            markup = trim(markup);
            Boolean italic = format.getItalic();
            if (format.isBold() && Boolean.TRUE.equals(italic)) {
                markup = value.chars().allMatch(Character::isDigit)
                    ? "\\textit{\\textbf{" + markup + "}}"
                    : "\\boldsymbol{" + markup + "}";
            } else if (format.isBold() && Boolean.FALSE.equals(italic)) {
                markup = "\\mathbf{\\mathrm{" + markup + "}}";
            } else if (format.isBold()) {
                markup = "\\mathbf{" + markup + "}";
            } else if (Boolean.TRUE.equals(italic)) {
                markup = "\\mathit{" + markup + "}";
            } else if (Boolean.FALSE.equals(italic)) {
                markup = "\\mathrm{" + markup + "}";
            }
            if (format.getUnderline() != null) {
                markup = (format.getUnderline() == UnderlineStyle.DOUBLE ? "\\uuline{" : "\\uline{") + markup + "}";
            }
            if (format.isStrikethrough()) {
                markup = "\\sout{" + markup + "}";
            }
            if (format.isTextMode()) {
                markup = "\\textrm{" + markup + "}";
            }
            if (format.getColor() != null) {
                markup = "{\\color{" + format.getColor() + "} " + markup + "}";
            }
            return markup;
        }

        private String textValue(String value) {
            StringBuilder out = new StringBuilder();
            value.codePoints().forEach(cp -> out.append(symbol(new String(Character.toChars(cp)))));
            return out.toString();
        }

        private String symbol(String glyph) {
            if (" ".equals(glyph)) {
                return "\\ ";
            }
            if ("\\".equals(glyph)) {
                return "\\backslash ";
            }
            String escaped = ESCAPES.get(glyph);
            if (escaped != null) {
                return escaped;
            }
            // a large operator command would read back as an operator node
            if (tables.isLargeOperatorGlyph(glyph)) {
                return glyph;
            }
            String command = tables.preferredCommand(glyph).orElse(glyph);
            if (tables.isOperatorCharacter(glyph)) {
                return " " + command + " ";
            }
            if (command.startsWith("\\") && CommandTables.isAsciiLetter(command.charAt(command.length() - 1))) {
                return command + " ";
            }
            return command;
        }

        private String styled(DisplayMode mode, String markup) {
            if (mode == DisplayMode.DISPLAY) {
                return "{\\displaystyle " + markup + "}";
            }
            if (mode == DisplayMode.INLINE) {
                return "{\\textstyle " + markup + "}";
            }
            return markup;
        }

        // ------------------------------------------------------------ variants

        @Override
        public String visitText(TextNode node) {
            return text(node.getValue(), node);
        }

        @Override
        public String visitFraction(FractionNode node) {
            String body = group(node.getNumerator()) + group(node.getDenominator());
            if (node.getDisplayMode() == DisplayMode.DISPLAY) {
                return "\\dfrac" + body;
            }
            return styled(node.getDisplayMode(), "\\frac" + body);
        }

        @Override
        public String visitBevelledFraction(BevelledFractionNode node) {
            return styled(node.getDisplayMode(), group(node.getNumerator()) + "/" + group(node.getDenominator()));
        }

        @Override
        public String visitSqrt(SqrtNode node) {
            return "\\sqrt" + group(node.getRadicand());
        }

        @Override
        public String visitNthRoot(NthRootNode node) {
            return "\\sqrt" + optional(trim(list(node.getIndex()))) + group(node.getRadicand());
        }

        /**
         * An optional {@code [..]} argument. Content holding a square bracket
         * is braced so the closing {@code ]} is found again on reading.
         */
        private String optional(String content) {
            if (content.indexOf('[') >= 0 || content.indexOf(']') >= 0) {
                return "[{" + content + "}]";
            }
            return "[" + content + "]";
        }

        @Override
        public String visitScript(ScriptNode node) {
            StringBuilder out = new StringBuilder(group(node.getBase()));
            if (node.getSuperscript() != null) {
                out.append('^').append(group(node.getSuperscript()));
            }
            if (node.getSubscript() != null) {
                out.append('_').append(group(node.getSubscript()));
            }
            return out.toString();
        }

        @Override
        public String visitBracket(BracketNode node) {
            String open = "\\left";
            String close = "\\right";
            if (options.getBracketSizing() == BracketSizing.DEPTH_SCALED) {
                int size = Math.min(maxDepth - depth, CommandTables.BRACKET_SIZE_LEFT.size() - 1);
                open = CommandTables.BRACKET_SIZE_LEFT.get(size);
                close = CommandTables.BRACKET_SIZE_RIGHT.get(size);
            }
            depth++;
            try {
                StringBuilder out = new StringBuilder();
                out.append(open).append(delimiter(node.getLeftSymbol()));
                out.append(list(node.getContent()));
                out.append(close).append(delimiter(node.getRightSymbol()));
                if (node.getSubscript() != null) {
                    out.append('_').append(group(node.getSubscript()));
                }
                if (node.getSuperscript() != null) {
                    out.append('^').append(group(node.getSuperscript()));
                }
                return out.toString();
            } finally {
                depth--;
            }
        }

        private String delimiter(String glyph) {
            String markup = tables.delimiterMarkup(glyph);
            return CommandTables.isAsciiLetter(markup.charAt(markup.length() - 1)) ? markup + " " : markup;
        }

        @Override
        public String visitLargeOperator(LargeOperatorNode node) {
            StringBuilder out = new StringBuilder();
            out.append(tables.largeOperatorCommand(node.getOperator()).orElse(node.getOperator()));
            if (node.getLimitMode() == LimitMode.LIMITS) {
                out.append("\\limits");
            } else if (node.getLimitMode() == LimitMode.NOLIMITS) {
                out.append("\\nolimits");
            }
            out.append('_').append(group(node.getLowerLimit()));
            out.append('^').append(group(node.getUpperLimit()));
            out.append(' ').append(group(node.getOperand()));
            return styled(node.getDisplayMode(), out.toString());
        }

        @Override
        public String visitIntegral(IntegralNode node) {
            IntegralLimits limits = node.getLimits();
            IntegralForm form = IntegralForm.forEmission(limits, node.getLimitMode());
            IntegralCommand command = tables.integralCommand(node.getIntegralType(), node.getDifferentialStyle(), form);
            StringBuilder out = new StringBuilder(command.getSpelling());
            out.append(group(node.getIntegrand()));
            out.append(group(node.getDifferentialVariable()));
            if (command.getArity() >= 3) {
                out.append(group(node.getLowerLimit()));
            }
            if (command.getArity() == 4) {
                out.append(group(node.getUpperLimit()));
            }
            return styled(node.getDisplayMode(), out.toString());
        }

        @Override
        public String visitDerivative(DerivativeNode node) {
            return options.isPhysicsDifferentials() ? physicsDerivative(node) : fractionDerivative(node);
        }

        private String orderMarkup(DerivativeNode node) {
            if (node.isSymbolicOrder()) {
                return trim(list(node.getOrderNodes()));
            }
            Integer order = node.getOrder();
            return order == null || order == 1 ? null : String.valueOf(order);
        }

        private String fractionDerivative(DerivativeNode node) {
            String operator = node.isPartial() ? "\\partial" : "d";
            String order = orderMarkup(node);
            String power = order == null ? "" : "^{" + order + "}";
            String denominator = operator + group(node.getVariable()) + power;
            boolean display = node.getDisplayMode() == DisplayMode.DISPLAY;
            if (node.isLongForm()) {
                String command = display ? "\\derivldfrac" : "\\derivlfrac";
                return command + "{" + operator + power + "}{" + denominator + "}" + group(node.getFunction());
            }
            String command = display ? "\\derivdfrac" : "\\derivfrac";
            return command + "{" + operator + power + group(node.getFunction()) + "}{" + denominator + "}";
        }

        private String physicsDerivative(DerivativeNode node) {
            String order = orderMarkup(node);
            StringBuilder out = new StringBuilder(node.isPartial() ? "\\pdv" : "\\dv");
            if (order != null) {
                out.append(optional(order));
            }
            if (node.isLongForm()) {
                out.append(group(node.getVariable())).append("\\grande").append(group(node.getFunction()));
            } else {
                out.append(group(node.getFunction())).append(group(node.getVariable()));
            }
            return node.getDisplayMode() == DisplayMode.DISPLAY ? styled(DisplayMode.DISPLAY, out.toString()) : out.toString();
        }

        @Override
        public String visitMatrix(MatrixNode node) {
            return grid(node.getMatrixType().getEnvironment(), "", node);
        }

        @Override
        public String visitStack(StackNode node) {
            return grid("array", "{" + "c".repeat(node.getCols()) + "}", node);
        }

        @Override
        public String visitCases(CasesNode node) {
            return grid("cases", "", node);
        }

        private String grid(String environment, String columnSpec, GridNode node) {
            List<String> rows = new ArrayList<>();
            for (int r = 0; r < node.getRows(); r++) {
                List<String> cells = new ArrayList<>();
                for (int c = 0; c < node.getCols(); c++) {
                    String cell = trim(list(node.getCell(r, c)));
                    cells.add(cell.isEmpty() ? "{ }" : cell);
                }
                rows.add(String.join(" & ", cells));
            }
            return "\\begin{" + environment + "}" + columnSpec + " "
                + String.join(" \\\\ ", rows)
                + " \\end{" + environment + "}";
        }

        @Override
        public String visitAccent(AccentNode node) {
            AccentType type = node.getAccentType();
            String out = "\\" + type.getCommand() + group(node.getAccentBase());
            if (type == AccentType.LABELEDOVERBRACE) {
                out += "^" + group(node.getAccentLabel());
            } else if (type == AccentType.LABELEDUNDERBRACE) {
                out += "_" + group(node.getAccentLabel());
            }
            return out;
        }

        @Override
        public String visitFunction(FunctionNode node) {
            FunctionType type = node.getFunctionType();
            FunctionShape shape = type.getShape();
            StringBuilder out = new StringBuilder();
            if (type.hasBuiltinCommand()) {
                out.append('\\').append(type.getName());
            } else {
                String name = type.isUserDefined() ? trim(list(node.getFunctionName())) : type.getName();
                out.append(shape == FunctionShape.LIM ? "\\operatorname*" : "\\operatorname");
                out.append('{').append(name).append('}');
            }
            if (shape == FunctionShape.SUB) {
                out.append('_').append(group(node.getFunctionBase()));
            } else if (shape == FunctionShape.LIM) {
                out.append('_').append(group(node.getFunctionConstraint()));
            }
            out.append(group(node.getFunctionArgument()));
            return out.toString();
        }
    }
}
