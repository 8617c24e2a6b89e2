package im.arun.normaindex.config;

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

/**
 * Loads {@link ExtractorConfig} from YAML and applies command-line overrides.
 * Lookup order: explicit file, classpath config.yaml, built-in defaults.
 */
public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final ExtractorConfig defaultConfig;

    public ConfigLoader() {
        this(null);
    }

    public ConfigLoader(String configPath) {
        this.defaultConfig = loadDefaultConfig(configPath);
    }

    private ExtractorConfig loadDefaultConfig(String configPath) {
        try {
            if (configPath != null) {
                Path path = Paths.get(configPath);
                if (Files.exists(path)) {
                    logger.info("Loading configuration from {}", path);
                    return yamlMapper.readValue(path.toFile(), ExtractorConfig.class);
                }
                logger.warn("Config file {} not found, falling back to classpath", configPath);
            }

            try (InputStream resourceStream = getClass().getClassLoader().getResourceAsStream("config.yaml")) {
                if (resourceStream != null) {
                    return yamlMapper.readValue(resourceStream, ExtractorConfig.class);
                }
            }

            logger.warn("No config.yaml found, using default configuration");
            return new ExtractorConfig();
        } catch (IOException e) {
            logger.warn("Failed to load configuration, using defaults: {}", e.getMessage());
            return new ExtractorConfig();
        }
    }

    /**
     * Returns a fresh copy of the loaded configuration with the given overrides applied.
     */
    public ExtractorConfig load(Map<String, Object> userOptions) {
        ExtractorConfig config = copyConfig(defaultConfig);

        if (userOptions == null || userOptions.isEmpty()) {
            return config;
        }

        userOptions.forEach((key, value) -> {
            try {
                switch (key) {
                    case "figures":
                    case "figures.enabled":
                        config.getFigures().setEnabled(parseBoolean(value));
                        break;
                    case "dpi":
                    case "figures.renderDpi":
                        if (value instanceof Number) config.getFigures().setRenderDpi(((Number) value).floatValue());
                        break;
                    case "max_figures":
                    case "figures.maxPerDocument":
                        if (value instanceof Integer) config.getFigures().setMaxPerDocument((Integer) value);
                        break;
                    case "snap_tolerance":
                    case "tables.snapTolerance":
                        if (value instanceof Number) config.getTables().setSnapTolerance(((Number) value).doubleValue());
                        break;
                    case "join_tolerance":
                    case "tables.joinTolerance":
                        if (value instanceof Number) config.getTables().setJoinTolerance(((Number) value).doubleValue());
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

    private ExtractorConfig copyConfig(ExtractorConfig source) {
        // Deep copy so callers can tweak nested settings without touching the defaults
        return yamlMapper.convertValue(source, ExtractorConfig.class);
    }
}
