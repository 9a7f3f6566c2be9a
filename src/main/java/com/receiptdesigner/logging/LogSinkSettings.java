package com.receiptdesigner.logging;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * JDBC settings for {@link DatabaseLogHandler}, resolved from system properties, environment
 * variables and {@code logging-db.properties}, in that order.
 */
record LogSinkSettings(String url, String username, String password, int poolSize, String table) {

    static final String DEFAULT_TABLE = "render_logs";
    private static final int DEFAULT_POOL_SIZE = 2;

    boolean enabled() {
        return url != null && !url.isBlank();
    }

    static LogSinkSettings load() {
        Properties fileProps = loadFileProperties();
        String url = firstNonBlank(
            System.getProperty("logging.jdbc.url"),
            System.getenv("LOGGING_JDBC_URL"),
            fileProps.getProperty("jdbc.url")
        );
        String username = firstNonBlank(
            System.getProperty("logging.jdbc.user"),
            System.getenv("LOGGING_JDBC_USER"),
            fileProps.getProperty("jdbc.username")
        );
        String password = firstNonBlank(
            System.getProperty("logging.jdbc.pass"),
            System.getenv("LOGGING_JDBC_PASS"),
            fileProps.getProperty("jdbc.password")
        );
        int poolSize = parsePoolSize(firstNonBlank(
            System.getProperty("logging.jdbc.poolSize"),
            System.getenv("LOGGING_JDBC_POOL"),
            fileProps.getProperty("jdbc.poolSize")
        ));
        String table = firstNonBlank(
            System.getProperty("logging.jdbc.table"),
            fileProps.getProperty("jdbc.table")
        );
        return new LogSinkSettings(url, username, password, poolSize, table == null ? DEFAULT_TABLE : table);
    }

    private static Properties loadFileProperties() {
        Properties props = new Properties();
        try (InputStream stream = LogSinkSettings.class
            .getClassLoader()
            .getResourceAsStream("logging-db.properties")) {
            if (stream != null) {
                props.load(stream);
            }
        } catch (IOException ignored) {
            // a malformed file falls back to env/system props
        }
        return props;
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }

    private static int parsePoolSize(String raw) {
        try {
            return raw == null ? DEFAULT_POOL_SIZE : Math.max(1, Integer.parseInt(raw));
        } catch (NumberFormatException ex) {
            return DEFAULT_POOL_SIZE;
        }
    }
}
