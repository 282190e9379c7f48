package io.github.jbellis.gitstate.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Properties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Settings for gitstate, layered from lowest to highest precedence:
 *
 * <ol>
 *   <li>{@code gitstate.properties} on the classpath
 *   <li>{@code ~/.config/gitstate/gitstate.properties}
 *   <li>{@code -Dgitstate.<key>=<value>} system properties
 * </ol>
 */
public final class GitStateSettings {
    private static final Logger logger = LogManager.getLogger(GitStateSettings.class);

    public static final String WRAP_COLUMN_KEY = "commit.wrapColumn";
    public static final String HISTORY_MAX_LENGTH_KEY = "discardHistory.maxLength";
    public static final String HISTORY_CONFIG_KEY = "discardHistory.configKey";
    public static final String GIT_EXECUTABLE_KEY = "git.executable";
    public static final String NETWORK_TIMEOUT_KEY = "git.networkTimeoutSeconds";
    public static final String EXECUTOR_THREADS_KEY = "executor.threads";

    private static final String SYSTEM_PROPERTY_PREFIX = "gitstate.";
    private static final Path GLOBAL_PROPERTIES_PATH =
            Path.of(System.getProperty("user.home"), ".config", "gitstate", "gitstate.properties");

    @Nullable
    private static GitStateSettings defaultsCache = null; // protected by synchronized

    private final Properties props;

    GitStateSettings(Properties props) {
        this.props = props;
    }

    /** Loads the layered settings once per JVM. */
    public static synchronized GitStateSettings load() {
        if (defaultsCache != null) {
            return defaultsCache;
        }

        var props = new Properties();
        try (var in = GitStateSettings.class.getResourceAsStream("/gitstate.properties")) {
            if (in != null) {
                props.load(in);
            } else {
                logger.warn("gitstate.properties not found on classpath; using built-in defaults");
            }
        } catch (IOException e) {
            logger.warn("Unable to read bundled gitstate.properties: {}", e.getMessage());
        }

        if (Files.exists(GLOBAL_PROPERTIES_PATH)) {
            try (var reader = Files.newBufferedReader(GLOBAL_PROPERTIES_PATH)) {
                props.load(reader);
                logger.debug("Loaded settings overrides from {}", GLOBAL_PROPERTIES_PATH);
            } catch (IOException e) {
                logger.warn("Unable to read settings file {}: {}", GLOBAL_PROPERTIES_PATH, e.getMessage());
            }
        }

        for (var name : System.getProperties().stringPropertyNames()) {
            if (name.startsWith(SYSTEM_PROPERTY_PREFIX)) {
                props.setProperty(name.substring(SYSTEM_PROPERTY_PREFIX.length()), System.getProperty(name));
            }
        }

        defaultsCache = new GitStateSettings(props);
        return defaultsCache;
    }

    /** Returns a copy of these settings with {@code key} replaced; used by tests and embedders. */
    public GitStateSettings with(String key, String value) {
        var copy = (Properties) props.clone();
        copy.setProperty(key, value);
        return new GitStateSettings(copy);
    }

    public int wrapColumn() {
        return getInt(WRAP_COLUMN_KEY, 72);
    }

    public int discardHistoryMaxLength() {
        return getInt(HISTORY_MAX_LENGTH_KEY, 60);
    }

    public String discardHistoryConfigKey() {
        return props.getProperty(HISTORY_CONFIG_KEY, "gitstate.historySha");
    }

    public String gitExecutable() {
        return props.getProperty(GIT_EXECUTABLE_KEY, "git");
    }

    public Duration networkTimeout() {
        return Duration.ofSeconds(getInt(NETWORK_TIMEOUT_KEY, 30));
    }

    public int executorThreads() {
        return Math.max(1, getInt(EXECUTOR_THREADS_KEY, 4));
    }

    private int getInt(String key, int defaultValue) {
        var raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            logger.warn("Ignoring non-numeric value '{}' for setting {}", raw, key);
            return defaultValue;
        }
    }
}
