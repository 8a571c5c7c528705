package im.arun.polytex.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Loads {@link PolytexConfig} from YAML and merges command-line overrides into it.
 */
public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);
    static final String DEFAULT_RESOURCE = "polytex.yaml";
    static final String API_KEY_ENV = "POLYGON_API_KEY";
    static final String API_SECRET_ENV = "POLYGON_API_SECRET";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final PolytexConfig defaultConfig;

    public ConfigLoader() {
        this(null);
    }

    public ConfigLoader(Path configPath) {
        this.defaultConfig = loadDefaultConfig(configPath);
    }

    private PolytexConfig loadDefaultConfig(Path configPath) {
        try {
            // An explicit file wins over the bundled defaults
            if (configPath != null) {
                if (Files.exists(configPath)) {
                    logger.info("Loading configuration from {}", configPath);
                    return yamlMapper.readValue(configPath.toFile(), PolytexConfig.class);
                }
                logger.warn("Config file {} not found, falling back to bundled defaults", configPath);
            }

            try (InputStream resourceStream = getClass().getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
                if (resourceStream != null) {
                    return yamlMapper.readValue(resourceStream, PolytexConfig.class);
                }
            }

            logger.warn("No {} found, using default configuration", DEFAULT_RESOURCE);
            return new PolytexConfig();
        } catch (IOException e) {
            logger.warn("Failed to load configuration, using defaults: {}", e.getMessage());
            return new PolytexConfig();
        }
    }

    public PolytexConfig load() {
        return load(Map.of());
    }

    public PolytexConfig load(Map<String, Object> userOptions) {
        PolytexConfig config = copyConfig(defaultConfig);

        if (userOptions != null) {
            userOptions.forEach((key, value) -> {
                if (value == null) {
                    return;
                }
                try {
                    switch (key) {
                        case "formula_marker":
                        case "formulaMarker":
                            config.setFormulaMarker(value.toString());
                            break;
                        case "language":
                        case "lang":
                            config.setLanguage(value.toString());
                            break;
                        case "commit_message":
                        case "commitMessage":
                            config.setCommitMessage(value.toString());
                            break;
                        case "connect_timeout_seconds":
                        case "connectTimeoutSeconds":
                            if (value instanceof Integer) config.setConnectTimeoutSeconds((Integer) value);
                            break;
                        case "read_timeout_seconds":
                        case "readTimeoutSeconds":
                            if (value instanceof Integer) config.setReadTimeoutSeconds((Integer) value);
                            break;
                        case "polygon_key":
                        case "polygonKey":
                            config.getPolygon().setKey(value.toString());
                            break;
                        case "polygon_secret":
                        case "polygonSecret":
                            config.getPolygon().setSecret(value.toString());
                            break;
                        case "polygon_base_url":
                        case "polygonBaseUrl":
                            config.getPolygon().setBaseUrl(value.toString());
                            break;
                        case "contest_title":
                        case "contestTitle":
                            config.getLabels().setContestTitle(value.toString());
                            break;
                        default:
                            logger.warn("Unknown configuration key: {}", key);
                    }
                } catch (Exception e) {
                    logger.error("Error setting config key {}: {}", key, e.getMessage());
                }
            });
        }

        applyEnvironmentCredentials(config, System.getenv());
        return config;
    }

    void applyEnvironmentCredentials(PolytexConfig config, Map<String, String> environment) {
        PolytexConfig.Polygon polygon = config.getPolygon();
        if (isBlank(polygon.getKey()) && !isBlank(environment.get(API_KEY_ENV))) {
            polygon.setKey(environment.get(API_KEY_ENV));
        }
        if (isBlank(polygon.getSecret()) && !isBlank(environment.get(API_SECRET_ENV))) {
            polygon.setSecret(environment.get(API_SECRET_ENV));
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private PolytexConfig copyConfig(PolytexConfig source) {
        PolytexConfig copy = new PolytexConfig();
        copy.setFormulaMarker(source.getFormulaMarker());
        copy.setLanguage(source.getLanguage());
        copy.setCommitMessage(source.getCommitMessage());
        copy.setConnectTimeoutSeconds(source.getConnectTimeoutSeconds());
        copy.setReadTimeoutSeconds(source.getReadTimeoutSeconds());

        PolytexConfig.Polygon polygon = new PolytexConfig.Polygon();
        polygon.setKey(source.getPolygon().getKey());
        polygon.setSecret(source.getPolygon().getSecret());
        polygon.setBaseUrl(source.getPolygon().getBaseUrl());
        copy.setPolygon(polygon);

        PolytexConfig.Labels labels = new PolytexConfig.Labels();
        PolytexConfig.Labels sourceLabels = source.getLabels();
        labels.setContestTitle(sourceLabels.getContestTitle());
        labels.setTimeLimit(sourceLabels.getTimeLimit());
        labels.setMemoryLimit(sourceLabels.getMemoryLimit());
        labels.setInputFile(sourceLabels.getInputFile());
        labels.setOutputFile(sourceLabels.getOutputFile());
        labels.setInput(sourceLabels.getInput());
        labels.setOutput(sourceLabels.getOutput());
        labels.setNotes(sourceLabels.getNotes());
        labels.setSamples(sourceLabels.getSamples());
        copy.setLabels(labels);
        return copy;
    }
}
