package im.arun.mathmarkup.serializer;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable knobs for {@link MarkupSerializer}.
 */
@Value
@Builder
public class SerializerOptions {

    /** Emit {@code \dv}/{@code \pdv} instead of the {@code \derivfrac} family. */
    @Builder.Default
    boolean physicsDifferentials = false;

    @Builder.Default
    BracketSizing bracketSizing = BracketSizing.AUTO;

    public static SerializerOptions defaults() {
        return SerializerOptions.builder().build();
    }
}
