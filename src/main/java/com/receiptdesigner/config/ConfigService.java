package com.receiptdesigner.config;

import com.receiptdesigner.logging.AppLogger;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Central entry point for resolving render configuration. Each key is taken from a system
 * property first, then from {@code receipt.properties} on the classpath, then from the built-in default.
 */
public final class ConfigService {
    public static final String CURRENCY_SYMBOL_KEY = "receipt.currencySymbol";
    public static final String TIMESTAMP_PATTERN_KEY = "receipt.timestampPattern";
    public static final String TIME_ZONE_KEY = "receipt.timeZone";
    static final String PROPERTIES_RESOURCE = "receipt.properties";

    private static final Logger LOGGER = AppLogger.get();
    private static final ConfigService INSTANCE = new ConfigService(loadFileProperties(PROPERTIES_RESOURCE));

    private final Properties fileProperties;

    ConfigService(Properties fileProperties) {
        this.fileProperties = fileProperties;
    }

    public static ConfigService getInstance() {
        return INSTANCE;
    }

    /**
     * Resolves the settings afresh on every call so system property changes are picked up.
     */
    public RenderSettings renderSettings() {
        String currency = lookup(CURRENCY_SYMBOL_KEY);
        if (currency == null) {
            currency = RenderSettings.DEFAULT_CURRENCY_SYMBOL;
        }
        String pattern = resolvePattern(lookup(TIMESTAMP_PATTERN_KEY));
        ZoneId zone = resolveZone(lookup(TIME_ZONE_KEY));
        return new RenderSettings(currency, pattern, zone, Clock.system(zone));
    }

    String lookup(String key) {
        String value = firstNonBlank(System.getProperty(key), fileProperties.getProperty(key));
        return value == null ? null : value.trim();
    }

    private static String resolvePattern(String raw) {
        if (raw == null) {
            return RenderSettings.DEFAULT_TIMESTAMP_PATTERN;
        }
        try {
            DateTimeFormatter.ofPattern(raw, Locale.ROOT);
            return raw;
        } catch (IllegalArgumentException ex) {
            LOGGER.warning("Ignoring invalid %s '%s': %s".formatted(TIMESTAMP_PATTERN_KEY, raw, ex.getMessage()));
            return RenderSettings.DEFAULT_TIMESTAMP_PATTERN;
        }
    }

    private static ZoneId resolveZone(String raw) {
        if (raw == null) {
            return ZoneId.systemDefault();
        }
        try {
            return ZoneId.of(raw);
        } catch (DateTimeException ex) {
            LOGGER.warning("Ignoring invalid %s '%s': %s".formatted(TIME_ZONE_KEY, raw, ex.getMessage()));
            return ZoneId.systemDefault();
        }
    }

    static Properties loadFileProperties(String resource) {
        Properties props = new Properties();
        try (InputStream stream = ConfigService.class.getClassLoader().getResourceAsStream(resource)) {
            if (stream != null) {
                props.load(stream);
            }
        } catch (IOException ex) {
            LOGGER.warning("Could not read " + resource + ", using defaults: " + ex.getMessage());
        }
        return props;
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }
}
