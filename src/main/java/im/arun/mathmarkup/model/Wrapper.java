package im.arun.mathmarkup.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * One applied wrapper with its parameters. Only underline carries a style
 * and only color carries a color value.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Wrapper {
    @JsonProperty("kind")
    WrapperKind kind;

    @JsonProperty("underline")
    UnderlineStyle underline;

    @JsonProperty("color")
    String color;

    @JsonCreator
    public Wrapper(@JsonProperty("kind") WrapperKind kind,
                   @JsonProperty("underline") UnderlineStyle underline,
                   @JsonProperty("color") String color) {
        this.kind = kind;
        this.underline = kind == WrapperKind.UNDERLINE
            ? (underline == null ? UnderlineStyle.SINGLE : underline)
            : null;
        this.color = kind == WrapperKind.COLOR ? color : null;
    }

    public static Wrapper underline(UnderlineStyle style) {
        return new Wrapper(WrapperKind.UNDERLINE, style, null);
    }

    public static Wrapper cancel() {
        return new Wrapper(WrapperKind.CANCEL, null, null);
    }

    public static Wrapper color(String color) {
        return new Wrapper(WrapperKind.COLOR, null, color);
    }

    public static Wrapper textMode() {
        return new Wrapper(WrapperKind.TEXT_MODE, null, null);
    }
}
