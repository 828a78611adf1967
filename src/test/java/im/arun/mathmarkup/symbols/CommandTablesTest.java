package im.arun.mathmarkup.symbols;

import im.arun.mathmarkup.model.DifferentialStyle;
import im.arun.mathmarkup.model.IntegralType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CommandTablesTest {

    private final CommandTables tables = CommandTables.standard();

    @Test
    void firstDeclaredCommandWinsForSharedGlyph() {
        assertEquals(Optional.of("\\epsilon"), tables.preferredCommand("ε"));
        assertEquals(Optional.of("ε"), tables.unicodeFor("\\varepsilon"));
    }

    @Test
    void symbolMatchRespectsLetterBoundary() {
        assertFalse(tables.matchSymbol("\\alphabet", 0).isPresent());
        CommandMatch<SymbolInfo> match = tables.matchSymbol("\\alpha+1", 0).orElseThrow();
        assertEquals("α", match.getEntry().getUnicode());
        assertEquals(6, match.getEndIndex());
    }

    @Test
    void longestSymbolSpellingWins() {
        CommandMatch<SymbolInfo> match = tables.matchSymbol("\\simeq x", 0).orElseThrow();
        assertEquals("≃", match.getEntry().getUnicode());
    }

    @ParameterizedTest
    @CsvSource({
        "'\\intilim{f}{x}{a}{b}', \\intilim, 4",
        "'\\intil{f}{x}{a}{b}', \\intil, 4",
        "'\\intisublim{f}{x}{a}', \\intisublim, 3",
        "'\\intisub{f}{x}{a}', \\intisub, 3",
        "'\\intd{f}{x}', \\intd, 2",
        "'\\iiintdnolim{f}{x}{a}{b}', \\iiintdnolim, 4",
        "'\\ointilower{f}{x}{a}', \\ointilower, 3"
    })
    void integralSpellingsMatchLongestFirst(String markup, String spelling, int arity) {
        CommandMatch<IntegralCommand> match = tables.matchIntegral(markup, 0).orElseThrow();
        assertEquals(spelling, match.getEntry().getSpelling());
        assertEquals(arity, match.getEntry().getArity());
        assertEquals(spelling.length(), match.getEndIndex());
    }

    @Test
    void integralSpellingsAreUnique() {
        Set<String> spellings = new HashSet<>();
        for (IntegralCommand command : tables.getIntegralCommands()) {
            assertTrue(spellings.add(command.getSpelling()), command.getSpelling());
        }
        assertEquals(IntegralType.values().length * DifferentialStyle.values().length * IntegralForm.values().length,
            spellings.size());
    }

    @Test
    void legacyLowerFormReadsAsLimitsPlacement() {
        IntegralCommand command = tables.matchIntegral("\\intilower{f}{x}{a}", 0).orElseThrow().getEntry();
        assertTrue(command.getForm().isAlias());
        assertEquals(IntegralForm.SUB_LIMITS.getLimitMode(), command.getForm().getLimitMode());
    }

    @Test
    void defaultItalicFollowsTableThenLatinLetters() {
        assertTrue(tables.isDefaultItalic("x"));
        assertTrue(tables.isDefaultItalic("α"));
        assertFalse(tables.isDefaultItalic("1"));
        assertFalse(tables.isDefaultItalic("∞"));
    }

    @Test
    void delimitersIncludeAliases() {
        assertEquals("⟨", tables.matchDelimiter("\\langle x", 0).orElseThrow().getEntry().getGlyph());
        assertEquals("|", tables.matchDelimiter("\\lvert x", 0).orElseThrow().getEntry().getGlyph());
        assertEquals("\\{", tables.delimiterMarkup("{"));
        assertFalse(tables.matchDelimiter("x", 0).isPresent());
    }

    @Test
    void largeOperatorGlyphsMapBackToCommands() {
        assertTrue(tables.isLargeOperatorGlyph("∑"));
        assertEquals(Optional.of("\\sum"), tables.largeOperatorCommand("∑"));
        assertFalse(tables.isLargeOperatorGlyph("+"));
        assertTrue(tables.isOperatorCharacter("+"));
    }
}
