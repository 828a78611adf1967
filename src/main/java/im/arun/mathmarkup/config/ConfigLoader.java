package im.arun.mathmarkup.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final MathMarkupConfig defaultConfig;

    public ConfigLoader() {
        this(null);
    }

    public ConfigLoader(String configPath) {
        this.defaultConfig = loadDefaultConfig(configPath);
    }

    private MathMarkupConfig loadDefaultConfig(String configPath) {
        try {
            // An explicit file wins over the bundled one
            if (configPath != null) {
                Path path = Paths.get(configPath);
                if (Files.exists(path)) {
                    return yamlMapper.readValue(path.toFile(), MathMarkupConfig.class);
                }
                logger.warn("Config file {} not found, falling back to classpath config.yaml", configPath);
            }

            try (InputStream resourceStream = getClass().getClassLoader().getResourceAsStream("config.yaml")) {
                if (resourceStream != null) {
                    return yamlMapper.readValue(resourceStream, MathMarkupConfig.class);
                }
            }

            logger.warn("No config.yaml found, using default configuration");
            return new MathMarkupConfig();
        } catch (IOException e) {
            logger.warn("Failed to load configuration, using defaults: {}", e.getMessage());
            return new MathMarkupConfig();
        }
    }

    public MathMarkupConfig getDefaultConfig() {
        return copyConfig(defaultConfig);
    }

    public MathMarkupConfig load(Map<String, Object> userOptions) {
        MathMarkupConfig config = copyConfig(defaultConfig);

        if (userOptions == null || userOptions.isEmpty()) {
            return config;
        }

        // Merge user options into config
        userOptions.forEach((key, value) -> {
            try {
                switch (key) {
                    case "differential_style":
                    case "differentialStyle":
                        if (value instanceof String) config.setDifferentialStyle((String) value);
                        break;
                    case "bracket_sizing":
                    case "bracketSizing":
                        if (value instanceof String) config.setBracketSizing((String) value);
                        break;
                    case "normalize_after_parse":
                    case "normalizeAfterParse":
                        config.setNormalizeAfterParse(parseBoolean(value));
                        break;
                    default:
                        logger.warn("Unknown configuration key: {}", key);
                }
            } catch (Exception e) {
                logger.error("Error setting config key {}: {}", key, e.getMessage());
            }
        });

        return config;
    }

    private boolean parseBoolean(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return "yes".equalsIgnoreCase((String) value) || "true".equalsIgnoreCase((String) value);
        }
        return false;
    }

    private MathMarkupConfig copyConfig(MathMarkupConfig source) {
        MathMarkupConfig copy = new MathMarkupConfig();
        copy.setDifferentialStyle(source.getDifferentialStyle());
        copy.setBracketSizing(source.getBracketSizing());
        copy.setNormalizeAfterParse(source.isNormalizeAfterParse());
        return copy;
    }
}
