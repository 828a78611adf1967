package im.arun.mathmarkup.symbols;

import lombok.Value;

/**
 * One row of the symbol table. The command is usually a backslash command,
 * but a few entries use the bare character (relations, Greek capitals that
 * have no command of their own).
 */
@Value
public class SymbolInfo {
    String command;
    String unicode;
    boolean defaultItalic;
    boolean largeOperator;
}
