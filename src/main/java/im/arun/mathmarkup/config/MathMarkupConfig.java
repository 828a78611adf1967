package im.arun.mathmarkup.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class MathMarkupConfig {

    /** "italic" emits the \derivfrac family, "roman" the \dv/\pdv family. */
    @JsonProperty("differential_style")
    private String differentialStyle = "italic";

    /** "auto" or "depth_scaled". */
    @JsonProperty("bracket_sizing")
    private String bracketSizing = "auto";

    @JsonProperty("normalize_after_parse")
    private boolean normalizeAfterParse = true;
}
