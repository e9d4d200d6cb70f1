package com.github.errfix.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Loads {@link ErrFixConfiguration} from .errfix.yaml or returns the defaults.
 * <p>
 * Usage:
 * <pre>
 * ErrFixConfiguration config = ErrFixConfigurationLoader.load(Path.of("."));
 * </pre>
 */
public class ErrFixConfigurationLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ErrFixConfigurationLoader.class);

    public static final String CONFIG_FILE = ".errfix.yaml";

    private ErrFixConfigurationLoader() {
    }

    /**
     * Loads .errfix.yaml from the given directory. A missing file yields the defaults.
     *
     * @param directory the directory to look in, usually the working directory
     * @return the configuration
     * @throws ConfigurationException if the file exists but is invalid
     */
    public static ErrFixConfiguration load(Path directory) {
        Path yamlPath = directory.resolve(CONFIG_FILE);
        if (!Files.isRegularFile(yamlPath)) {
            LOG.debug("No {} found in {}, using defaults", CONFIG_FILE, directory.toAbsolutePath());
            return ErrFixConfiguration.defaults();
        }
        return loadFile(yamlPath);
    }

    /**
     * Loads an explicitly named configuration file, which must exist.
     *
     * @throws ConfigurationException if the file is missing or invalid
     */
    public static ErrFixConfiguration loadFile(Path yamlPath) {
        if (!Files.isRegularFile(yamlPath)) {
            throw new ConfigurationException("Configuration file not found: " + yamlPath);
        }
        String content;
        try {
            content = Files.readString(yamlPath);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read " + yamlPath + ": " + e.getMessage(), e);
        }
        return parse(content, yamlPath.toString());
    }

    /**
     * Parses the YAML content of a configuration file.
     */
    @SuppressWarnings("unchecked")
    static ErrFixConfiguration parse(String content, String source) {
        Object loaded;
        try {
            loaded = new Yaml().load(content);
        } catch (YAMLException e) {
            throw new ConfigurationException("Failed to parse " + source + ": " + e.getMessage(), e);
        }
        if (loaded == null) {
            return ErrFixConfiguration.defaults();
        }
        if (!(loaded instanceof Map)) {
            throw new ConfigurationException(source + ": expected a mapping at the top level");
        }
        Map<String, Object> root = (Map<String, Object>) loaded;

        int concurrency = parseConcurrency(root.get("concurrency"), source);
        List<String> exclude = extractStringList(root.get("exclude"), source);
        return new ErrFixConfiguration(concurrency, exclude);
    }

    private static int parseConcurrency(Object value, String source) {
        if (value == null) {
            return ErrFixConfiguration.defaults().getConcurrency();
        }
        if (!(value instanceof Integer)) {
            throw new ConfigurationException(source + ": concurrency must be a number, was '" + value + "'");
        }
        int concurrency = (Integer) value;
        if (concurrency < 1) {
            throw new ConfigurationException(source + ": concurrency must be at least 1, was " + concurrency);
        }
        return concurrency;
    }

    /**
     * Accepts a list of names or a single name.
     */
    @SuppressWarnings("unchecked")
    private static List<String> extractStringList(Object value, String source) {
        if (value == null) {
            return List.of();
        }
        if (value instanceof List) {
            List<String> result = new ArrayList<>();
            for (Object item : (List<Object>) value) {
                if (item != null) {
                    result.add(item.toString());
                }
            }
            return List.copyOf(result);
        }
        if (value instanceof String) {
            return List.of((String) value);
        }
        throw new ConfigurationException(source + ": exclude must be a list of directory names");
    }
}
