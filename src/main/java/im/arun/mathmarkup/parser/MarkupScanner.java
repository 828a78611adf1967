package im.arun.mathmarkup.parser;

import im.arun.mathmarkup.symbols.CommandTables;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Brace-counting helpers over raw markup. Escaped characters such as
 * {@code \{} never count as grouping. A group left open at end of input is
 * closed there.
 */
final class MarkupScanner {

    private MarkupScanner() {
    }

    @Value
    static class Group {
        String content;
        int endIndex;
    }

    static int skipSpaces(String text, int index) {
        while (index < text.length() && Character.isWhitespace(text.charAt(index))) {
            index++;
        }
        return index;
    }

    /**
     * Read one argument at {@code index}: a braced group, a single backslash
     * command, or a single character. At end of input the group is empty.
     */
    static Group readArgument(String text, int index) {
        if (index >= text.length()) {
            return new Group("", text.length());
        }
        char c = text.charAt(index);
        if (c == '{') {
            return readGroup(text, index);
        }
        if (c == '\\' && index + 1 < text.length()) {
            int end = index + 1;
            while (end < text.length() && CommandTables.isAsciiLetter(text.charAt(end))) {
                end++;
            }
            if (end == index + 1) {
                end++;
            }
            return new Group(text.substring(index, end), end);
        }
        int end = index + Character.charCount(text.codePointAt(index));
        return new Group(text.substring(index, end), end);
    }

    /**
     * Read a braced group starting at {@code index}, which must hold '{'.
     */
    static Group readGroup(String text, int index) {
        int depth = 0;
        int i = index;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return new Group(text.substring(index + 1, i), i + 1);
                }
            }
            i++;
        }
        return new Group(text.substring(Math.min(index + 1, text.length())), text.length());
    }

    /**
     * Read an optional {@code [..]} argument. Returns null when none is present.
     */
    static Group readOptional(String text, int index) {
        if (index >= text.length() || text.charAt(index) != '[') {
            return null;
        }
        int depth = 0;
        int braces = 0;
        int i = index;
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
            } else if (braces == 0 && c == '[') {
                depth++;
            } else if (braces == 0 && c == ']') {
                depth--;
                if (depth == 0) {
                    return new Group(text.substring(index + 1, i), i + 1);
                }
            }
            i++;
        }
        return new Group(text.substring(index + 1), text.length());
    }

    /**
     * True when the whole of {@code text} is exactly one braced group.
     */
    static boolean isSingleGroup(String text) {
        String trimmed = text.trim();
        if (trimmed.isEmpty() || trimmed.charAt(0) != '{') {
            return false;
        }
        return readGroup(trimmed, 0).getEndIndex() == trimmed.length();
    }

    static String unwrapGroup(String text) {
        String trimmed = text.trim();
        return isSingleGroup(trimmed) ? readGroup(trimmed, 0).getContent() : trimmed;
    }

    /**
     * Find the end of an environment body. Returns the index of the matching
     * {@code \end{name}}, or the input length when it is missing.
     */
    static int findEnvironmentEnd(String text, int index, String name) {
        String begin = "\\begin{" + name + "}";
        String end = "\\end{" + name + "}";
        int depth = 1;
        int i = index;
        while (i < text.length()) {
            if (text.startsWith(begin, i)) {
                depth++;
                i += begin.length();
            } else if (text.startsWith(end, i)) {
                depth--;
                if (depth == 0) {
                    return i;
                }
                i += end.length();
            } else if (text.charAt(i) == '\\') {
                i += 2;
            } else {
                i++;
            }
        }
        return text.length();
    }

    /**
     * Split an environment body into rows on top-level {@code \\} and each row
     * into cells on top-level {@code &}.
     */
    static List<List<String>> splitGrid(String body) {
        List<List<String>> rows = new ArrayList<>();
        List<String> row = new ArrayList<>();
        StringBuilder cell = new StringBuilder();
        int braces = 0;
        int environments = 0;
        int i = 0;
        while (i < body.length()) {
            char c = body.charAt(i);
            if (c == '\\' && i + 1 < body.length() && body.charAt(i + 1) == '\\' && braces == 0 && environments == 0) {
                row.add(cell.toString());
                rows.add(row);
                row = new ArrayList<>();
                cell.setLength(0);
                i += 2;
                continue;
            }
            if (c == '\\') {
                if (body.startsWith("\\begin{", i)) {
                    environments++;
                } else if (body.startsWith("\\end{", i)) {
                    environments--;
                }
                int next = Math.min(i + 2, body.length());
                cell.append(body, i, next);
                i = next;
                continue;
            }
            if (c == '{') {
                braces++;
            } else if (c == '}') {
                braces--;
            } else if (c == '&' && braces == 0 && environments == 0) {
                row.add(cell.toString());
                cell.setLength(0);
                i++;
                continue;
            }
            cell.append(c);
            i++;
        }
        row.add(cell.toString());
        rows.add(row);
        // a trailing \\ leaves one blank row behind
        if (rows.size() > 1) {
            List<String> last = rows.get(rows.size() - 1);
            if (last.size() == 1 && last.get(0).isBlank()) {
                rows.remove(rows.size() - 1);
            }
        }
        return rows;
    }
}
