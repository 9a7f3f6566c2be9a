package com.receiptdesigner.logging;

import java.util.logging.Formatter;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.StreamHandler;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Provides the shared logger for the interpreter. Console output goes to {@code System.err} so
 * command listings written to {@code System.out} stay clean.
 */
public final class AppLogger {
    public static final String LOGGER_NAME = "com.receiptdesigner.ReceiptInterpreter";

    private static final Logger LOGGER = createLogger();

    private AppLogger() {
    }

    public static Logger get() {
        return LOGGER;
    }

    private static Logger createLogger() {
        Logger logger = Logger.getLogger(LOGGER_NAME);
        logger.setUseParentHandlers(false);
        Formatter formatter = new Formatter() {
            @Override
            public String format(LogRecord record) {
                String line = "%s %s%n".formatted(record.getLevel().getName(), formatMessage(record));
                if (record.getThrown() != null) {
                    line += "    caused by " + record.getThrown() + System.lineSeparator();
                }
                return line;
            }
        };

        StreamHandler consoleHandler = new StreamHandler(System.err, formatter) {
            @Override
            public synchronized void publish(LogRecord record) {
                super.publish(record);
                flush();
            }
        };
        try {
            consoleHandler.setEncoding(UTF_8.name());
        } catch (Exception ignored) {
            // fall back to platform default when UTF-8 is unavailable
        }
        consoleHandler.setLevel(Level.ALL);
        logger.addHandler(consoleHandler);
        logger.setLevel(Level.INFO);

        LogSinkSettings sinkSettings = LogSinkSettings.load();
        if (!sinkSettings.enabled()) {
            logger.info("Central logging disabled: no JDBC configuration provided");
            return logger;
        }
        try {
            DatabaseLogHandler dbHandler = new DatabaseLogHandler(sinkSettings);
            dbHandler.setLevel(Level.INFO);
            logger.addHandler(dbHandler);
        } catch (RuntimeException ex) {
            logger.warning("Failed to initialize central logging: " + ex.getMessage());
        }
        return logger;
    }
}
