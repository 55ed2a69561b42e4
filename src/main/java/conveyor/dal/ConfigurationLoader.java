package conveyor.dal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;
import java.util.function.Function;

/**
 * Layered configuration lookup, first hit wins:
 * 1. System Properties
 * 2. Environment Variables (dots to underscores, upper case)
 * 3. External properties file: the path given to the constructor, else
 *    {@code <config.dir>/conveyor.properties} ({@code -Dconfig.dir} or {@code CONFIG_DIR}),
 *    else {@code config/conveyor.properties} in the working directory
 * 4. Classpath conveyor.properties (bundled defaults)
 *
 * @since 26/09/2025
 */
public class ConfigurationLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigurationLoader.class);
    public static final String CONFIG_FILE_NAME = "conveyor.properties";
    private static final String CONFIG_DIR_PROPERTY = "config.dir";
    private static final String CONFIG_DIR_ENV = "CONFIG_DIR";
    private static final String DEFAULT_CONFIG_DIR = "config";

    private final String configFile;
    private final boolean external;
    private volatile Properties properties;

    /**
     * Look the external file up in {@code config.dir} or {@code ./config}
     */
    public ConfigurationLoader() {
        this(null, true);
    }

    /**
     * Use an explicit external file on top of the bundled defaults
     */
    public ConfigurationLoader(String configFile) {
        this(configFile, true);
    }

    /**
     * Create a loader over in-memory properties only (no file lookup)
     */
    public ConfigurationLoader(Properties properties) {
        this.configFile = null;
        this.external = false;
        this.properties = new Properties();
        this.properties.putAll(properties);
    }

    private ConfigurationLoader(String configFile, boolean external) {
        this.configFile = configFile;
        this.external = external;
        this.properties = load();
    }

    private Properties load() {
        Properties defaults = new Properties();
        try (InputStream input = getClass().getClassLoader().getResourceAsStream(CONFIG_FILE_NAME)) {
            if (input != null) {
                defaults.load(input);
                logger.debug("Loaded bundled defaults from classpath '{}'", CONFIG_FILE_NAME);
            }
        } catch (IOException e) {
            logger.warn("⚠ Could not read bundled '{}': {}", CONFIG_FILE_NAME, e.getMessage());
        }

        Properties props = new Properties(defaults);
        Path file = externalFile();
        if (Files.isRegularFile(file)) {
            try (InputStream input = Files.newInputStream(file)) {
                props.load(input);
                logger.info("Loaded configuration from {}", file.toAbsolutePath());
            } catch (IOException e) {
                logger.warn("⚠ Could not read configuration '{}': {}", file.toAbsolutePath(), e.getMessage());
            }
        } else if (configFile != null) {
            logger.warn("⚠ Configuration file {} not found, using bundled defaults", file.toAbsolutePath());
        } else {
            logger.info("No external configuration at {}, using bundled defaults", file.toAbsolutePath());
        }
        return props;
    }

    private Path externalFile() {
        if (configFile != null) {
            return Paths.get(configFile);
        }
        String dir = System.getProperty(CONFIG_DIR_PROPERTY);
        if (dir == null) {
            dir = System.getenv(CONFIG_DIR_ENV);
        }
        return Paths.get(dir != null ? dir : DEFAULT_CONFIG_DIR, CONFIG_FILE_NAME).normalize();
    }

    /**
     * Get string property with priority: System Property > Env Var > Properties File > Default
     */
    public String getString(String key, String defaultValue) {
        String value = System.getProperty(key);
        if (value != null) {
            logger.debug("Property '{}' from system properties: {}", key, value);
            return value;
        }

        String envKey = key.replace('.', '_').toUpperCase();
        value = System.getenv(envKey);
        if (value != null) {
            logger.debug("Property '{}' from environment variable '{}': {}", key, envKey, value);
            return value;
        }

        value = properties.getProperty(key);
        if (value != null) {
            return value.trim();
        }
        logger.debug("Property '{}' not set, using default: {}", key, defaultValue);
        return defaultValue;
    }

    public int getInt(String key, int defaultValue) {
        return parse(key, defaultValue, Integer::parseInt, "integer");
    }

    public long getLong(String key, long defaultValue) {
        return parse(key, defaultValue, Long::parseLong, "long");
    }

    public double getDouble(String key, double defaultValue) {
        return parse(key, defaultValue, Double::parseDouble, "decimal");
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String value = getString(key, null);
        return value == null ? defaultValue : Boolean.parseBoolean(value.trim());
    }

    /**
     * Get comma separated list property (blank entries are dropped)
     */
    public List<String> getList(String key) {
        String value = getString(key, null);
        if (value == null || value.trim().isEmpty()) {
            return Collections.emptyList();
        }

        List<String> items = new ArrayList<>();
        for (String item : value.split(",")) {
            if (!item.trim().isEmpty()) {
                items.add(item.trim());
            }
        }
        return items;
    }

    /**
     * Get required string property
     * @throws ConfigurationException if the property is missing or blank
     */
    public String getRequiredString(String key) throws ConfigurationException {
        String value = getString(key, null);
        if (value == null || value.trim().isEmpty()) {
            throw new ConfigurationException("Required property '" + key + "' is not configured");
        }
        return value;
    }

    /**
     * Re-read the external file and the bundled defaults, in-memory loaders keep their values
     */
    public void reload() {
        if (!external) {
            logger.debug("In-memory configuration, nothing to reload");
            return;
        }
        properties = load();
        logger.info("Configuration reloaded");
    }

    // malformed numbers fall back to the default
    private <T> T parse(String key, T defaultValue, Function<String, T> parser, String type) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return parser.apply(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid {} value for property '{}': '{}', using default: {}", type, key, value, defaultValue);
            return defaultValue;
        }
    }
}
