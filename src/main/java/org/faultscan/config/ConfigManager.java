package org.faultscan.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

/**
 * Loads {@link AppConfig} from {@code conf/config.yaml} when present, else from the bundled
 * classpath {@code config.yaml}. Also installs the console log format on first use.
 */
public class ConfigManager {
    private static final Logger APP_LOGGER = Logger.getLogger(ConfigManager.class.getName());

    public static final Path DEFAULT_CONFIG_PATH = Path.of("conf", "config.yaml");
    static final String CLASSPATH_CONFIG = "config.yaml";

    static AppConfig appConfig;

    static {
        System.setProperty("java.util.logging.SimpleFormatter.format", "[%1$tF %1$tT] [%4$-7s] %3$s - %5$s %6$s%n");
        ConsoleHandler handler = new ConsoleHandler();
        handler.setFormatter(new SimpleFormatter());
        handler.setLevel(Level.ALL);
        Logger rootLogger = Logger.getLogger("");
        for (java.util.logging.Handler h : rootLogger.getHandlers()) {
            if (h instanceof ConsoleHandler) rootLogger.removeHandler(h);
        }
        rootLogger.addHandler(handler);
        rootLogger.setLevel(Level.INFO);
    }

    private ConfigManager() {
    }

    public static synchronized AppConfig getConfig() throws IOException {
        if (appConfig == null) {
            appConfig = Files.isRegularFile(DEFAULT_CONFIG_PATH) ? load(DEFAULT_CONFIG_PATH) : loadBundled();
        }
        return appConfig;
    }

    public static AppConfig load(Path configPath) throws IOException {
        APP_LOGGER.info("Loading configuration from " + configPath.toAbsolutePath());
        try (InputStream in = Files.newInputStream(configPath)) {
            return read(in).validate(configPath.toString());
        }
    }

    static AppConfig loadBundled() throws IOException {
        try (InputStream in = ConfigManager.class.getClassLoader().getResourceAsStream(CLASSPATH_CONFIG)) {
            if (in == null) {
                APP_LOGGER.warning("No bundled " + CLASSPATH_CONFIG + " found, using defaults");
                return AppConfig.defaults();
            }
            APP_LOGGER.fine("Loading bundled configuration " + CLASSPATH_CONFIG);
            return read(in).validate("classpath:" + CLASSPATH_CONFIG);
        }
    }

    private static AppConfig read(InputStream in) throws IOException {
        ObjectMapper yamlObjectMapper = new ObjectMapper(new YAMLFactory());
        yamlObjectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        JsonNode root = yamlObjectMapper.readTree(in);
        if (root == null || root.isMissingNode() || root.isNull()) {
            return AppConfig.defaults();
        }
        return yamlObjectMapper.treeToValue(root, AppConfig.class);
    }
}
