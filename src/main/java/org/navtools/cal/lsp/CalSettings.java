package org.navtools.cal.lsp;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Front-end settings.
 *
 * Values come from {@code cal-frontend.properties} on the classpath, then from {@code -Dcal.*}
 * system properties, which win:
 * - cal.parser.propertyValues: parse CalcFormula and TableRelation values (default true)
 * - cal.diagnostics.includeRecovery: report parse-error-recovery diagnostics (default true)
 * - cal.diagnostics.maxProblems: cap on diagnostics per document (default 1000)
 * - cal.diagnostics.source: diagnostic source label (default "cal")
 */
public record CalSettings(boolean parsePropertyValues, boolean includeRecoveryDiagnostics, int maxProblems,
        String diagnosticSource) {

    private static final Logger logger = LoggerFactory.getLogger(CalSettings.class);

    public static final String RESOURCE = "cal-frontend.properties";

    public static final String PROPERTY_VALUES = "cal.parser.propertyValues";
    public static final String INCLUDE_RECOVERY = "cal.diagnostics.includeRecovery";
    public static final String MAX_PROBLEMS = "cal.diagnostics.maxProblems";
    public static final String SOURCE = "cal.diagnostics.source";

    public CalSettings {
        if (maxProblems < 0) {
            throw new IllegalArgumentException("maxProblems must not be negative: " + maxProblems);
        }
        if (diagnosticSource == null || diagnosticSource.isBlank()) {
            diagnosticSource = "cal";
        }
    }

    public static CalSettings defaults() {
        return new CalSettings(true, true, 1000, "cal");
    }

    /**
     * Loads the classpath resource and applies system property overrides.
     */
    public static CalSettings load() {
        Properties properties = new Properties();
        try (InputStream in = CalSettings.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                properties.load(in);
            }
        } catch (IOException e) {
            logger.warn("Could not read {}, using defaults: {}", RESOURCE, e.getMessage());
        }
        for (String key : new String[] {PROPERTY_VALUES, INCLUDE_RECOVERY, MAX_PROBLEMS, SOURCE}) {
            String override = System.getProperty(key);
            if (override != null && !override.isBlank()) {
                properties.setProperty(key, override);
            }
        }
        return fromProperties(properties);
    }

    public static CalSettings fromProperties(Properties properties) {
        CalSettings defaults = defaults();
        return new CalSettings(
                bool(properties, PROPERTY_VALUES, defaults.parsePropertyValues()),
                bool(properties, INCLUDE_RECOVERY, defaults.includeRecoveryDiagnostics()),
                integer(properties, MAX_PROBLEMS, defaults.maxProblems()),
                properties.getProperty(SOURCE, defaults.diagnosticSource()).trim());
    }

    private static boolean bool(Properties properties, String key, boolean fallback) {
        String value = properties.getProperty(key);
        return value == null || value.isBlank() ? fallback : Boolean.parseBoolean(value.trim());
    }

    private static int integer(Properties properties, String key, int fallback) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Ignoring invalid value '{}' for {}", value, key);
            return fallback;
        }
    }
}
