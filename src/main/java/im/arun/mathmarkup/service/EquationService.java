package im.arun.mathmarkup.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import im.arun.mathmarkup.config.MathMarkupConfig;
import im.arun.mathmarkup.model.DifferentialStyle;
import im.arun.mathmarkup.model.Node;
import im.arun.mathmarkup.parser.MarkupParser;
import im.arun.mathmarkup.serializer.BracketSizing;
import im.arun.mathmarkup.serializer.MarkupSerializer;
import im.arun.mathmarkup.serializer.SerializerOptions;
import im.arun.mathmarkup.symbols.CommandTables;
import im.arun.mathmarkup.tree.EquationBuilder;
import im.arun.mathmarkup.tree.TreeNormalizer;
import im.arun.mathmarkup.util.TreeUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Main entry point: markup to tree, tree to markup, and the JSON form of a tree.
 * Holds one builder, so ids stay unique across every parse done through the
 * same service. Not thread-safe.
 */
public class EquationService {
    private static final Logger logger = LoggerFactory.getLogger(EquationService.class);

    private static final Pattern PHYSICS_DERIVATIVE = Pattern.compile("\\\\p?dv(?![a-zA-Z])");
    private static final TypeReference<List<Node>> NODE_LIST = new TypeReference<>() {
    };

    private final MathMarkupConfig config;
    private final CommandTables tables;
    private final EquationBuilder builder;
    private final TreeNormalizer normalizer;
    private final MarkupParser parser;
    private final MarkupSerializer serializer;
    private final ObjectMapper objectMapper;

    public EquationService() {
        this(new MathMarkupConfig());
    }

    public EquationService(MathMarkupConfig config) {
        this.config = config;
        this.tables = CommandTables.standard();
        this.builder = new EquationBuilder();
        this.normalizer = new TreeNormalizer();
        this.parser = new MarkupParser(builder, tables);
        this.serializer = new MarkupSerializer(tables, serializerOptions(config));
        this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public MathMarkupConfig getConfig() {
        return config;
    }

    public EquationBuilder getBuilder() {
        return builder;
    }

    /**
     * Parse markup into a new sibling list. Never throws for any input.
     */
    public List<Node> parse(String markup) {
        List<Node> equation = parser.parse(markup);
        if (config.isNormalizeAfterParse()) {
            normalize(equation);
        }
        logger.debug("Parsed {} nodes from {} characters", TreeUtils.countNodes(equation),
            markup == null ? 0 : markup.length());
        return equation;
    }

    /**
     * Parse markup into the service's builder, replacing its current equation.
     */
    public List<Node> load(String markup) {
        builder.setEquation(parse(markup));
        return builder.getEquation();
    }

    public String serialize(List<Node> equation) {
        return serializer.serialize(equation);
    }

    /**
     * Parse then serialize, which yields the canonical spelling of the markup.
     */
    public String canonicalize(String markup) {
        return serialize(parse(markup));
    }

    public void normalize(List<Node> equation) {
        normalizer.recomputeBracketNesting(equation);
        normalizer.recomputeParenScaling(equation);
    }

    public String toJson(List<Node> equation) throws JsonProcessingException {
        return objectMapper.writerFor(NODE_LIST).writeValueAsString(equation);
    }

    public List<Node> fromJson(String json) throws JsonProcessingException {
        return objectMapper.readValue(json, NODE_LIST);
    }

    public Map<String, List<Object>> macroDefinitions() {
        return MacroDefinitions.build(tables);
    }

    public String macroDefinitionsJson() throws JsonProcessingException {
        return objectMapper.writeValueAsString(Map.of("macros", macroDefinitions()));
    }

    /**
     * Guess which derivative family a piece of markup was written with.
     * Physics commands mean roman; anything else, including markup with no
     * derivative at all, means italic.
     */
    public static DifferentialStyle detectDifferentialStyle(String markup) {
        if (markup != null && PHYSICS_DERIVATIVE.matcher(markup).find()) {
            return DifferentialStyle.ROMAN;
        }
        return DifferentialStyle.ITALIC;
    }

    static SerializerOptions serializerOptions(MathMarkupConfig config) {
        SerializerOptions.SerializerOptionsBuilder options = SerializerOptions.builder();
        String style = config.getDifferentialStyle();
        if ("roman".equalsIgnoreCase(style)) {
            options.physicsDifferentials(true);
        } else if (style != null && !"italic".equalsIgnoreCase(style)) {
            logger.warn("Unknown differential_style '{}', using italic", style);
        }
        String sizing = config.getBracketSizing();
        if ("depth_scaled".equalsIgnoreCase(sizing)) {
            options.bracketSizing(BracketSizing.DEPTH_SCALED);
        } else if (sizing != null && !"auto".equalsIgnoreCase(sizing)) {
            logger.warn("Unknown bracket_sizing '{}', using auto", sizing);
        }
        return options.build();
    }
}
