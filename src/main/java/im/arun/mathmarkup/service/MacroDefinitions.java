package im.arun.mathmarkup.service;

import im.arun.mathmarkup.model.DifferentialStyle;
import im.arun.mathmarkup.model.LimitMode;
import im.arun.mathmarkup.symbols.CommandTables;
import im.arun.mathmarkup.symbols.IntegralCommand;
import im.arun.mathmarkup.symbols.IntegralForm;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Macro table for a MathJax-style renderer: command name (without the
 * backslash) to a {@code [definition, argumentCount]} pair. Covers the
 * custom integral and derivative commands of the dialect; {@code \dv} and
 * {@code \pdv} come from the renderer's physics package.
 */
public final class MacroDefinitions {

    private MacroDefinitions() {
    }

    public static Map<String, List<Object>> build(CommandTables tables) {
        Map<String, List<Object>> macros = new LinkedHashMap<>();
        for (IntegralCommand command : sortedBySpelling(tables)) {
            macros.put(command.getSpelling().substring(1), List.of(integralBody(command), command.getArity()));
        }
        macros.put("derivfrac", List.of("\\frac{#1}{#2}", 2));
        macros.put("derivdfrac", List.of("\\dfrac{#1}{#2}", 2));
        macros.put("derivlfrac", List.of("\\frac{#1}{#2}#3", 3));
        macros.put("derivldfrac", List.of("\\dfrac{#1}{#2}#3", 3));
        macros.put("grande", List.of("\\left(#1\\right)", 1));
        return macros;
    }

    private static List<IntegralCommand> sortedBySpelling(CommandTables tables) {
        List<IntegralCommand> commands = new ArrayList<>(tables.getIntegralCommands());
        commands.sort(Comparator.comparing(IntegralCommand::getSpelling));
        return commands;
    }

    static String integralBody(IntegralCommand command) {
        IntegralForm form = command.getForm();
        StringBuilder body = new StringBuilder("\\").append(command.getIntegralType().getCommandBase());
        if (form.getLimitMode() == LimitMode.LIMITS) {
            body.append("\\limits");
        } else if (form.getLimitMode() == LimitMode.NOLIMITS) {
            body.append("\\nolimits");
        }
        if (form.getLimits().hasLower()) {
            body.append("_{#3}");
        }
        if (form.getLimits().hasUpper()) {
            body.append("^{#4}");
        }
        String d = command.getDifferentialStyle() == DifferentialStyle.ROMAN ? "\\mathrm{d}" : "d";
        return body.append(" #1\\,").append(d).append("#2").toString();
    }
}
