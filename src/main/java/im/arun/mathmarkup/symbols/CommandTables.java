package im.arun.mathmarkup.symbols;

import im.arun.mathmarkup.model.DifferentialStyle;
import im.arun.mathmarkup.model.IntegralType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Static lookup data shared by the parser and the serializer: symbols,
 * large operators, delimiters and the integral command family.
 * <p>
 * Immutable once built. {@link #standard()} returns the shared instance.
 */
public final class CommandTables {

    private static final CommandTables STANDARD = new CommandTables();

    /** Characters emitted with a space on each side. */
    public static final Set<String> OPERATOR_CHARACTERS = Set.of("+", "-", "=", "×", "÷", "±", "∓");

    public static final List<String> BRACKET_SIZE_LEFT = List.of("\\left", "\\bigl", "\\Bigl", "\\biggl", "\\Biggl");
    public static final List<String> BRACKET_SIZE_RIGHT = List.of("\\right", "\\bigr", "\\Bigr", "\\biggr", "\\Biggr");

    private final Map<String, SymbolInfo> byCommand;
    private final Map<String, String> preferredCommand;
    private final Map<String, SymbolInfo> byUnicode;
    private final List<SymbolInfo> symbolsLongestFirst;
    private final Map<String, String> largeOperatorGlyphToCommand;
    private final List<Delimiter> delimiters;
    private final List<Delimiter> delimiterAliases;
    private final List<IntegralCommand> integralCommands;

    private CommandTables() {
        List<SymbolInfo> table = new ArrayList<>();
        addSymbols(table);

        Map<String, SymbolInfo> commands = new LinkedHashMap<>();
        Map<String, String> preferred = new LinkedHashMap<>();
        Map<String, SymbolInfo> unicode = new LinkedHashMap<>();
        Map<String, String> largeOps = new LinkedHashMap<>();
        for (SymbolInfo info : table) {
            commands.put(info.getCommand(), info);
            // first declaration wins
            preferred.putIfAbsent(info.getUnicode(), info.getCommand());
            unicode.putIfAbsent(info.getUnicode(), info);
            if (info.isLargeOperator()) {
                largeOps.putIfAbsent(info.getUnicode(), info.getCommand());
            }
        }
        this.byCommand = Collections.unmodifiableMap(commands);
        this.preferredCommand = Collections.unmodifiableMap(preferred);
        this.byUnicode = Collections.unmodifiableMap(unicode);
        this.largeOperatorGlyphToCommand = Collections.unmodifiableMap(largeOps);

        List<SymbolInfo> sorted = new ArrayList<>(table);
        sorted.sort(Comparator.comparingInt((SymbolInfo s) -> s.getCommand().length()).reversed());
        this.symbolsLongestFirst = Collections.unmodifiableList(sorted);

        this.delimiters = List.of(
            new Delimiter("(", "("),
            new Delimiter(")", ")"),
            new Delimiter("[", "["),
            new Delimiter("]", "]"),
            new Delimiter("{", "\\{"),
            new Delimiter("}", "\\}"),
            new Delimiter("⟨", "\\langle"),
            new Delimiter("⟩", "\\rangle"),
            new Delimiter("⌊", "\\lfloor"),
            new Delimiter("⌋", "\\rfloor"),
            new Delimiter("⌈", "\\lceil"),
            new Delimiter("⌉", "\\rceil"),
            new Delimiter("‖", "\\|"),
            new Delimiter("|", "|"),
            new Delimiter(".", "."));
        this.delimiterAliases = List.of(
            new Delimiter("|", "\\lvert"),
            new Delimiter("|", "\\rvert"),
            new Delimiter("‖", "\\lVert"),
            new Delimiter("‖", "\\rVert"));

        List<IntegralCommand> integrals = new ArrayList<>();
        for (IntegralType type : IntegralType.values()) {
            for (DifferentialStyle style : DifferentialStyle.values()) {
                for (IntegralForm form : IntegralForm.values()) {
                    integrals.add(new IntegralCommand(type, style, form));
                }
            }
        }
        integrals.sort(Comparator.comparingInt((IntegralCommand c) -> c.getSpelling().length()).reversed());
        this.integralCommands = Collections.unmodifiableList(integrals);
    }

    public static CommandTables standard() {
        return STANDARD;
    }

    public Optional<String> unicodeFor(String command) {
        SymbolInfo info = byCommand.get(command);
        return info == null ? Optional.empty() : Optional.of(info.getUnicode());
    }

    /**
     * Command for a Unicode symbol. When several commands share a glyph the
     * one declared first is returned.
     */
    public Optional<String> preferredCommand(String unicode) {
        return Optional.ofNullable(preferredCommand.get(unicode));
    }

    /**
     * Natural slant of a symbol. Latin letters are italic, digits upright;
     * anything not in the table is treated as upright.
     */
    public boolean isDefaultItalic(String unicode) {
        SymbolInfo info = byUnicode.get(unicode);
        if (info != null) {
            return info.isDefaultItalic();
        }
        return unicode.length() == 1 && isAsciiLetter(unicode.charAt(0));
    }

    public boolean isOperatorCharacter(String value) {
        return OPERATOR_CHARACTERS.contains(value);
    }

    public boolean isLargeOperatorGlyph(String unicode) {
        return largeOperatorGlyphToCommand.containsKey(unicode);
    }

    public Optional<String> largeOperatorCommand(String glyph) {
        return Optional.ofNullable(largeOperatorGlyphToCommand.get(glyph));
    }

    /**
     * Longest symbol command spelled at {@code index}. Commands ending in a
     * letter only match when the next character is not a letter.
     */
    public Optional<CommandMatch<SymbolInfo>> matchSymbol(String text, int index) {
        for (SymbolInfo info : symbolsLongestFirst) {
            if (matchesCommand(text, index, info.getCommand())) {
                return Optional.of(new CommandMatch<>(info, index + info.getCommand().length()));
            }
        }
        return Optional.empty();
    }

    public Optional<CommandMatch<SymbolInfo>> matchLargeOperator(String text, int index) {
        for (SymbolInfo info : symbolsLongestFirst) {
            if (info.isLargeOperator() && matchesCommand(text, index, info.getCommand())) {
                return Optional.of(new CommandMatch<>(info, index + info.getCommand().length()));
            }
        }
        return Optional.empty();
    }

    /**
     * Longest integral spelling at {@code index}, so {@code \intilim} is never
     * read as {@code \intil} followed by "im".
     */
    public Optional<CommandMatch<IntegralCommand>> matchIntegral(String text, int index) {
        for (IntegralCommand command : integralCommands) {
            if (matchesCommand(text, index, command.getSpelling())) {
                return Optional.of(new CommandMatch<>(command, index + command.getSpelling().length()));
            }
        }
        return Optional.empty();
    }

    public List<IntegralCommand> getIntegralCommands() {
        return integralCommands;
    }

    public IntegralCommand integralCommand(IntegralType type, DifferentialStyle style, IntegralForm form) {
        return new IntegralCommand(type, style, form);
    }

    /**
     * Delimiter markup at {@code index}, as it appears after {@code \left} or a size command.
     */
    public Optional<CommandMatch<Delimiter>> matchDelimiter(String text, int index) {
        Delimiter best = null;
        for (Delimiter d : delimiters) {
            if (text.startsWith(d.getMarkup(), index) && (best == null || d.getMarkup().length() > best.getMarkup().length())) {
                best = d;
            }
        }
        for (Delimiter d : delimiterAliases) {
            if (matchesCommand(text, index, d.getMarkup()) && (best == null || d.getMarkup().length() > best.getMarkup().length())) {
                best = d;
            }
        }
        if (best == null) {
            return Optional.empty();
        }
        return Optional.of(new CommandMatch<>(best, index + best.getMarkup().length()));
    }

    public String delimiterMarkup(String glyph) {
        for (Delimiter d : delimiters) {
            if (d.getGlyph().equals(glyph)) {
                return d.getMarkup();
            }
        }
        return glyph;
    }

    /**
     * True when {@code command} is spelled at {@code index} and, if it ends in
     * a letter, is not followed by another letter.
     */
    public static boolean matchesCommand(String text, int index, String command) {
        if (!text.startsWith(command, index)) {
            return false;
        }
        char last = command.charAt(command.length() - 1);
        int next = index + command.length();
        if (command.startsWith("\\") && isAsciiLetter(last) && next < text.length()) {
            return !isAsciiLetter(text.charAt(next));
        }
        return true;
    }

    public static boolean isAsciiLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static void addSymbols(List<SymbolInfo> t) {
        // Greek lowercase
        italic(t, "\\alpha", "α");
        italic(t, "\\beta", "β");
        italic(t, "\\gamma", "γ");
        italic(t, "\\delta", "δ");
        italic(t, "\\epsilon", "ε");
        italic(t, "\\varepsilon", "ε");
        italic(t, "\\zeta", "ζ");
        italic(t, "\\eta", "η");
        italic(t, "\\theta", "θ");
        italic(t, "\\vartheta", "ϑ");
        italic(t, "\\iota", "ι");
        italic(t, "\\kappa", "κ");
        italic(t, "\\lambda", "λ");
        italic(t, "\\mu", "μ");
        italic(t, "\\nu", "ν");
        italic(t, "\\xi", "ξ");
        italic(t, "\\omicron", "ο");
        italic(t, "\\pi", "π");
        italic(t, "\\varpi", "ϖ");
        italic(t, "\\rho", "ρ");
        italic(t, "\\varrho", "ϱ");
        italic(t, "\\sigma", "σ");
        italic(t, "\\varsigma", "ς");
        italic(t, "\\tau", "τ");
        italic(t, "\\upsilon", "υ");
        italic(t, "\\phi", "φ");
        italic(t, "\\varphi", "φ");
        italic(t, "\\chi", "χ");
        italic(t, "\\psi", "ψ");
        italic(t, "\\omega", "ω");

        // Greek uppercase
        upright(t, "\\Gamma", "Γ");
        upright(t, "\\Delta", "Δ");
        upright(t, "\\Theta", "Θ");
        upright(t, "\\Lambda", "Λ");
        upright(t, "\\Xi", "Ξ");
        upright(t, "\\Pi", "Π");
        upright(t, "\\Sigma", "Σ");
        upright(t, "\\Upsilon", "Υ");
        upright(t, "\\Phi", "Φ");
        upright(t, "\\Psi", "Ψ");
        upright(t, "\\Omega", "Ω");
        // capitals without a command of their own, keyed by the glyph
        for (String glyph : List.of("Α", "Β", "Ε", "Ζ", "Η", "Ι", "Κ", "Μ", "Ν", "Ο", "Ρ", "Τ", "Χ")) {
            upright(t, glyph, glyph);
        }

        // Calculus
        italic(t, "\\partial", "∂");
        upright(t, "\\nabla", "∇");
        upright(t, "\\infty", "∞");

        // Arithmetic
        upright(t, "\\times", "×");
        upright(t, "\\divsymbol", "÷");
        upright(t, "\\pm", "±");
        upright(t, "\\mp", "∓");
        upright(t, "\\cdot", "·");
        upright(t, "\\ast", "∗");
        upright(t, "\\star", "⋆");
        upright(t, "\\circ", "∘");
        upright(t, "\\bullet", "•");

        // Relations
        upright(t, "=", "=");
        upright(t, "<", "<");
        upright(t, ">", ">");
        upright(t, "+", "+");
        upright(t, "-", "-");
        upright(t, "\\neq", "≠");
        upright(t, "\\sim", "∼");
        upright(t, "\\simeq", "≃");
        upright(t, "\\approx", "≈");
        upright(t, "\\equiv", "≡");
        upright(t, "\\cong", "≅");
        upright(t, "\\ncong", "≇");
        upright(t, "\\propto", "∝");
        upright(t, "\\leq", "≤");
        upright(t, "\\geq", "≥");
        upright(t, "\\nless", "≮");
        upright(t, "\\ngtr", "≯");
        upright(t, "\\nleq", "≰");
        upright(t, "\\ngeq", "≱");
        upright(t, "\\prec", "≺");
        upright(t, "\\succ", "≻");
        upright(t, "\\preceq", "⪯");
        upright(t, "\\succeq", "⪰");
        upright(t, "\\ll", "≪");
        upright(t, "\\gg", "≫");

        // Sets
        upright(t, "\\cap", "∩");
        upright(t, "\\cup", "∪");
        upright(t, "\\setminus", "∖");
        upright(t, "\\in", "∈");
        upright(t, "\\ni", "∋");
        upright(t, "\\notin", "∉");
        upright(t, "\\subset", "⊂");
        upright(t, "\\supset", "⊃");
        upright(t, "\\subseteq", "⊆");
        upright(t, "\\supseteq", "⊇");
        upright(t, "\\nsubseteq", "⊈");
        upright(t, "\\nsupseteq", "⊉");
        upright(t, "\\subsetneq", "⊊");
        upright(t, "\\supsetneq", "⊋");

        // Binary operators
        upright(t, "\\oplus", "⊕");
        upright(t, "\\ominus", "⊖");
        upright(t, "\\otimes", "⊗");
        upright(t, "\\oslash", "⊘");
        upright(t, "\\odot", "⊙");
        upright(t, "\\triangleleft", "◁");
        upright(t, "\\triangleright", "▷");
        upright(t, "\\wr", "≀");

        // Logic
        upright(t, "\\wedge", "∧");
        upright(t, "\\vee", "∨");
        upright(t, "\\vdash", "⊢");
        upright(t, "\\models", "⊨");
        upright(t, "\\top", "⊤");
        upright(t, "\\bot", "⊥");

        // Arrows
        upright(t, "\\rightarrow", "→");
        upright(t, "\\leftarrow", "←");
        upright(t, "\\uparrow", "↑");
        upright(t, "\\downarrow", "↓");
        upright(t, "\\leftrightarrow", "↔");
        upright(t, "\\updownarrow", "↕");
        upright(t, "\\nearrow", "↗");
        upright(t, "\\searrow", "↘");
        upright(t, "\\Rightarrow", "⇒");
        upright(t, "\\Leftarrow", "⇐");
        upright(t, "\\Uparrow", "⇑");
        upright(t, "\\Downarrow", "⇓");
        upright(t, "\\Leftrightarrow", "⇔");
        upright(t, "\\Updownarrow", "⇕");
        upright(t, "\\longrightarrow", "⟶");
        upright(t, "\\longleftarrow", "⟵");
        upright(t, "\\longleftrightarrow", "⟷");
        upright(t, "\\Longrightarrow", "⟹");
        upright(t, "\\Longleftarrow", "⟸");
        upright(t, "\\Longleftrightarrow", "⟺");
        upright(t, "\\circlearrowleft", "↺");
        upright(t, "\\circlearrowright", "↻");
        upright(t, "\\curvearrowleft", "↶");
        upright(t, "\\curvearrowright", "↷");
        upright(t, "\\hookleftarrow", "↩");
        upright(t, "\\hookrightarrow", "↪");

        // Miscellaneous
        upright(t, "\\bowtie", "⋈");
        upright(t, "\\diamond", "⋄");
        upright(t, "\\asymp", "≍");
        upright(t, "\\triangleq", "≜");
        upright(t, "\\therefore", "∴");
        upright(t, "\\because", "∵");
        upright(t, "\\forall", "∀");
        upright(t, "\\exists", "∃");
        upright(t, "\\nexists", "∄");
        upright(t, "\\emptyset", "∅");
        upright(t, "\\varnothing", "∅");

        // Letter-like
        upright(t, "\\mathbb{R}", "ℝ");
        upright(t, "\\mathbb{Z}", "ℤ");
        upright(t, "\\mathbb{Q}", "ℚ");
        upright(t, "\\mathbb{N}", "ℕ");
        upright(t, "\\mathbb{C}", "ℂ");
        upright(t, "\\mathbb{H}", "ℍ");
        upright(t, "\\mathbb{P}", "ℙ");
        upright(t, "\\wp", "℘");
        upright(t, "\\aleph", "ℵ");
        upright(t, "\\beth", "ℶ");
        upright(t, "\\gimel", "ℷ");
        upright(t, "\\daleth", "ℸ");

        // Geometry
        upright(t, "\\angle", "∠");
        upright(t, "\\measuredangle", "∡");
        upright(t, "\\sphericalangle", "∢");
        upright(t, "\\parallel", "∥");
        upright(t, "\\nparallel", "∦");
        upright(t, "\\triangle", "△");
        upright(t, "\\square", "□");
        upright(t, "\\blacksquare", "■");
        upright(t, "\\lozenge", "◊");
        upright(t, "\\blacklozenge", "⧫");
        upright(t, "\\bigcirc", "○");
        upright(t, "\\degree", "°");

        // Large operators
        large(t, "\\sum", "∑");
        large(t, "\\prod", "∏");
        large(t, "\\coprod", "∐");
        large(t, "\\bigcup", "⋃");
        large(t, "\\bigcap", "⋂");
        large(t, "\\bigvee", "⋁");
        large(t, "\\bigwedge", "⋀");
        large(t, "\\bigoplus", "⨁");
        large(t, "\\bigotimes", "⨂");
        large(t, "\\bigodot", "⨀");
        large(t, "\\biguplus", "⨄");
        large(t, "\\int", "∫");
        large(t, "\\oint", "∮");
    }

    private static void italic(List<SymbolInfo> t, String command, String unicode) {
        t.add(new SymbolInfo(command, unicode, true, false));
    }

    private static void upright(List<SymbolInfo> t, String command, String unicode) {
        t.add(new SymbolInfo(command, unicode, false, false));
    }

    private static void large(List<SymbolInfo> t, String command, String unicode) {
        t.add(new SymbolInfo(command, unicode, false, true));
    }
}
