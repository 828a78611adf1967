package im.arun.mathmarkup.symbols;

import lombok.Value;

/**
 * A table entry recognized in markup text, with the index just past it.
 */
@Value
public class CommandMatch<T> {
    T entry;
    int endIndex;
}
