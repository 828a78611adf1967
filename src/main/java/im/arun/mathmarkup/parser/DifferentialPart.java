package im.arun.mathmarkup.parser;

import im.arun.mathmarkup.symbols.CommandTables;
import lombok.Value;

/**
 * One side of a derivative fraction: the {@code d} or {@code \partial}
 * operator, an optional {@code ^{n}} order and whatever follows.
 * On the denominator side the rest is the variable and the order comes after it.
 */
@Value
class DifferentialPart {
    boolean partial;
    String order;
    String rest;

    /**
     * @return the split, or null when the text does not start with a differential
     */
    static DifferentialPart read(String text, boolean denominator) {
        boolean partial;
        int pos;
        if (CommandTables.matchesCommand(text, 0, "\\partial")) {
            partial = true;
            pos = "\\partial".length();
        } else if (text.startsWith("d")) {
            partial = false;
            pos = 1;
        } else {
            return null;
        }
        pos = MarkupScanner.skipSpaces(text, pos);
        if (!denominator) {
            String order = null;
            if (pos < text.length() && text.charAt(pos) == '^') {
                MarkupScanner.Group group = MarkupScanner.readArgument(text, MarkupScanner.skipSpaces(text, pos + 1));
                order = group.getContent();
                pos = group.getEndIndex();
            }
            return new DifferentialPart(partial, order, text.substring(pos).trim());
        }

        String variable;
        if (pos < text.length() && text.charAt(pos) == '{') {
            MarkupScanner.Group group = MarkupScanner.readGroup(text, pos);
            variable = group.getContent();
            pos = group.getEndIndex();
        } else {
            int end = topLevelCaret(text, pos);
            variable = text.substring(pos, end).trim();
            pos = end;
        }
        pos = MarkupScanner.skipSpaces(text, pos);
        String order = null;
        if (pos < text.length() && text.charAt(pos) == '^') {
            MarkupScanner.Group group = MarkupScanner.readArgument(text, MarkupScanner.skipSpaces(text, pos + 1));
            order = group.getContent();
            pos = group.getEndIndex();
        }
        if (!text.substring(pos).trim().isEmpty()) {
            return null;
        }
        return new DifferentialPart(partial, order, variable);
    }

    private static int topLevelCaret(String text, int from) {
        int braces = 0;
        int i = from;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == '{') {
                braces++;
            } else if (c == '}') {
                braces--;
            } else if (c == '^' && braces == 0) {
                return i;
            }
            i++;
        }
        return text.length();
    }
}
