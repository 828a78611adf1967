package im.arun.mathmarkup.symbols;

import lombok.Value;

/**
 * A bracket glyph and the markup that produces it after a sizing command.
 */
@Value
public class Delimiter {
    String glyph;
    String markup;
}
