package io.github.jbellis.wikimark.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads {@link ConverterConfig} from YAML. Keys that are absent keep their default value.
 *
 * <pre>
 * siteBaseUrl: https://wiki.example.com
 * issueTrackerBaseUrl: https://issues.example.com/browse/
 * maxHeadingLevel: 3
 * calloutStyle: blockquote
 * </pre>
 */
public class ConfigLoader {
    private static final Logger logger = LogManager.getLogger(ConfigLoader.class);

    public static final String DEFAULT_RESOURCE = "wikimark.yaml";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    /**
     * Loads {@value #DEFAULT_RESOURCE} from the classpath, or the defaults when it is missing or unreadable.
     */
    public ConverterConfig load() {
        try (InputStream in = getClass().getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                logger.warn("No {} on the classpath, using default configuration", DEFAULT_RESOURCE);
                return ConverterConfig.defaults();
            }
            return apply(ConverterConfig.defaults(), yamlMapper.readTree(in));
        } catch (IOException e) {
            logger.warn("Failed to load {}, using defaults: {}", DEFAULT_RESOURCE, e.getMessage());
            return ConverterConfig.defaults();
        }
    }

    /**
     * Loads configuration from a file. Unlike {@link #load()}, a missing or unreadable file is an error.
     *
     * @throws IOException if the file cannot be read or is not valid YAML
     */
    public ConverterConfig load(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IOException("Configuration file not found: " + path);
        }
        logger.debug("Loading configuration from {}", path);
        return apply(ConverterConfig.defaults(), yamlMapper.readTree(path.toFile()));
    }

    /**
     * Parses configuration from YAML text.
     */
    public ConverterConfig parse(String yaml) throws IOException {
        return apply(ConverterConfig.defaults(), yamlMapper.readTree(yaml));
    }

    private ConverterConfig apply(ConverterConfig config, JsonNode root) {
        if (root == null || root.isMissingNode() || root.isNull()) {
            return config;
        }
        if (!root.isObject()) {
            throw new IllegalArgumentException("Configuration must be a mapping, got " + root.getNodeType());
        }

        var result = config;
        var fields = root.fields();
        while (fields.hasNext()) {
            var field = fields.next();
            var value = field.getValue();
            switch (field.getKey()) {
                case "siteBaseUrl", "site_base_url" -> result = result.withSiteBaseUrl(value.asText());
                case "issueTrackerBaseUrl", "issue_tracker_base_url" -> result = result.withIssueTrackerBaseUrl(value.asText());
                case "maxHeadingLevel", "max_heading_level" -> {
                    if (!value.canConvertToInt()) {
                        throw new IllegalArgumentException("maxHeadingLevel must be an integer, got " + value);
                    }
                    result = result.withMaxHeadingLevel(value.asInt());
                }
                case "calloutStyle", "callout_style" -> result = result.withCalloutStyle(CalloutStyle.parse(value.asText()));
                default -> logger.warn("Unknown configuration key: {}", field.getKey());
            }
        }
        return result;
    }
}
