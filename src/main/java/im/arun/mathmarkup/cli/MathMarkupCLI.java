package im.arun.mathmarkup.cli;

import im.arun.mathmarkup.config.ConfigLoader;
import im.arun.mathmarkup.config.MathMarkupConfig;
import im.arun.mathmarkup.model.Node;
import im.arun.mathmarkup.service.EquationService;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command-line interface using Picocli.
 */
@Command(
    name = "mathmarkup",
    description = "Convert math markup to an equation tree and back",
    mixinStandardHelpOptions = true,
    version = "mathmarkup 1.0"
)
public class MathMarkupCLI implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Option(names = {"--latex"}, description = "Markup to convert")
    private String latex;

    @Option(names = {"--input"}, description = "File holding the markup to convert")
    private String inputPath;

    @Option(names = {"--format"}, description = "Output format: latex, tree or macros", defaultValue = "latex")
    private String format;

    @Option(names = {"--differential-style"}, description = "Derivative markup: italic (\\derivfrac) or roman (\\dv)")
    private String differentialStyle;

    @Option(names = {"--bracket-sizing"}, description = "Bracket sizing: auto or depth_scaled")
    private String bracketSizing;

    @Option(names = {"--config"}, description = "Path to a config.yaml")
    private String configPath;

    @Option(names = {"--output"}, description = "Output file path")
    private String outputPath;

    @Override
    public Integer call() throws Exception {
        PrintWriter err = spec.commandLine().getErr();
        String normalizedFormat = format.toLowerCase();
        if (!List.of("latex", "tree", "macros").contains(normalizedFormat)) {
            err.println("Error: unknown format '" + format + "', expected latex, tree or macros");
            return 1;
        }

        // Create config
        Map<String, Object> overrides = new HashMap<>();
        if (differentialStyle != null) {
            overrides.put("differential_style", differentialStyle);
        }
        if (bracketSizing != null) {
            overrides.put("bracket_sizing", bracketSizing);
        }
        MathMarkupConfig config = new ConfigLoader(configPath).load(overrides);
        EquationService service = new EquationService(config);

        String output;
        if ("macros".equals(normalizedFormat)) {
            output = service.macroDefinitionsJson();
        } else {
            String markup = readMarkup(err);
            if (markup == null) {
                return 1;
            }
            List<Node> equation = service.parse(markup);
            output = "tree".equals(normalizedFormat) ? service.toJson(equation) : service.serialize(equation);
        }

        if (outputPath != null) {
            Files.writeString(Paths.get(outputPath), output, StandardCharsets.UTF_8);
            err.println("Output written to: " + outputPath);
        } else {
            spec.commandLine().getOut().println(output);
        }
        spec.commandLine().getOut().flush();
        return 0;
    }

    private String readMarkup(PrintWriter err) {
        if (latex != null) {
            return latex;
        }
        if (inputPath == null) {
            err.println("Error: markup must be provided via --latex or --input");
            return null;
        }
        Path path = Paths.get(inputPath);
        if (!Files.exists(path)) {
            err.println("Error: input file not found: " + inputPath);
            return null;
        }
        try {
            return Files.readString(path, StandardCharsets.UTF_8).strip();
        } catch (IOException e) {
            err.println("Error reading input file: " + e.getMessage());
            return null;
        }
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MathMarkupCLI()).execute(args);
        System.exit(exitCode);
    }
}
