package com.transitbot.config;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

/**
 * Layered application settings.
 *
 * <p>Lookup order: values set through {@link #override(String, String)}, then
 * {@code config.properties} in the working directory, then {@code config.properties} on the
 * classpath, then the built-in defaults.
 */
public final class Config {
    private static final Logger LOG = LogManager.getLogger(Config.class);

    public static final String INPUT_DIR = "input.dir";
    public static final String OUTPUT_DIR = "output.dir";
    public static final String PLOT_DPI = "plot.dpi";
    public static final String FIT_SKIP = "fit.skip";
    public static final String FIT_FORCE = "fit.force";
    public static final String FIT_THREADS = "fit.threads";
    public static final String FIT_MAX_TTV_DAYS = "fit.max_ttv_days";
    public static final String TRANSITS_FILE = "output.transits_file";
    public static final String CURVES_FILE = "output.curves_file";
    public static final String FAILED_FILE = "output.failed_file";

    private static final Map<String, String> DEFAULTS = buildDefaults();

    private final Properties props = new Properties();
    private final Properties resourceProps = new Properties();
    private final Properties localProps = new Properties();
    private final Properties overrideProps = new Properties();
    private final Path workingDir;

    private Config(Path workingDir) {
        this.workingDir = workingDir;
    }

    public static Config load(Path workingDir) {
        Config config = new Config(workingDir);

        try (InputStream in = Config.class.getClassLoader().getResourceAsStream("config.properties")) {
            if (in != null) {
                config.resourceProps.load(in);
                config.props.putAll(config.resourceProps);
            }
        } catch (IOException e) {
            LOG.warn("Failed to read classpath config.properties, using defaults: {}", e.getMessage());
        }

        Path local = workingDir.resolve("config.properties");
        if (Files.exists(local)) {
            try (InputStream in = Files.newInputStream(local)) {
                config.localProps.load(in);
                config.props.putAll(config.localProps);
            } catch (IOException e) {
                LOG.warn("Failed to read {}: {}", local, e.getMessage());
            }
        }
        return config;
    }

    /**
     * Settings made only of the defaults plus the given values; used by tests.
     */
    public static Config of(Path workingDir, Map<String, String> values) {
        Config config = new Config(workingDir);
        values.forEach(config::override);
        return config;
    }

    /**
     * Sets a value that wins over every file-based layer. Blank values are ignored.
     */
    public Config override(String key, String value) {
        if (key == null || key.trim().isEmpty() || value == null || value.trim().isEmpty()) {
            return this;
        }
        overrideProps.setProperty(key.trim(), value.trim());
        props.setProperty(key.trim(), value.trim());
        return this;
    }

    public String getString(String key) {
        String raw = props.getProperty(key);
        if (raw != null) {
            String trimmed = raw.trim();
            if (!trimmed.isEmpty()) {
                return trimmed;
            }
        }
        return DEFAULTS.getOrDefault(key, "");
    }

    public boolean getBoolean(String key) {
        String value = getString(key);
        return "true".equalsIgnoreCase(value)
                || "1".equals(value)
                || "yes".equalsIgnoreCase(value)
                || "y".equalsIgnoreCase(value);
    }

    public int getInt(String key) {
        return getInt(key, parseInt(DEFAULTS.get(key), 0));
    }

    public int getInt(String key, int fallback) {
        return parseInt(getString(key), fallback);
    }

    public double getDouble(String key) {
        return getDouble(key, parseDouble(DEFAULTS.get(key), 0.0));
    }

    public double getDouble(String key, double fallback) {
        return parseDouble(getString(key), fallback);
    }

    /**
     * Resolves a path setting against the working directory; absolute values are kept as-is.
     */
    public Path getPath(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return workingDir;
        }
        return workingDir.resolve(value).normalize();
    }

    /**
     * Where the effective value of {@code key} comes from: override, local, resource or default.
     */
    public String sourceOf(String key) {
        if (nonBlank(overrideProps.getProperty(key))) {
            return "override";
        }
        if (nonBlank(localProps.getProperty(key))) {
            return "local";
        }
        if (nonBlank(resourceProps.getProperty(key))) {
            return "resource";
        }
        return "default";
    }

    public Map<String, String> defaults() {
        return DEFAULTS;
    }

    private static boolean nonBlank(String raw) {
        return raw != null && !raw.trim().isEmpty();
    }

    private static int parseInt(String value, int fallback) {
        if (value == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private static double parseDouble(String value, double fallback) {
        if (value == null) {
            return fallback;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private static Map<String, String> buildDefaults() {
        Map<String, String> defaults = new HashMap<>();
        defaults.put(INPUT_DIR, "data");
        defaults.put(OUTPUT_DIR, "plots");
        defaults.put(PLOT_DPI, "150");
        defaults.put(FIT_SKIP, "false");
        defaults.put(FIT_FORCE, "false");
        defaults.put(FIT_THREADS, "1");
        defaults.put(FIT_MAX_TTV_DAYS, "2.0");
        defaults.put(TRANSITS_FILE, "transits.csv");
        defaults.put(CURVES_FILE, "curves.csv");
        defaults.put(FAILED_FILE, "_failed_transits.json");
        return Collections.unmodifiableMap(defaults);
    }
}
