package com.receiptdesigner.logging;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.text.MessageFormat;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.logging.ErrorManager;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;

/**
 * Asynchronously copies JUL records into a central JDBC table so render failures from every
 * terminal end up in one place. When the queue is full the oldest record is dropped.
 */
public final class DatabaseLogHandler extends Handler {

    private static final int QUEUE_CAPACITY = 512;

    private final BlockingQueue<LogRecord> queue = new LinkedBlockingQueue<>(QUEUE_CAPACITY);
    private final HikariDataSource dataSource;
    private final String insertSql;
    private final String hostName;
    private final Thread worker;

    private volatile boolean running = true;

    /**
     * Uses the settings from system properties, environment or {@code logging-db.properties}.
     *
     * @throws IllegalStateException when no JDBC URL is configured
     */
    public DatabaseLogHandler() {
        this(LogSinkSettings.load());
    }

    DatabaseLogHandler(LogSinkSettings settings) {
        if (!settings.enabled()) {
            throw new IllegalStateException("Central logging disabled: no JDBC configuration provided");
        }
        this.insertSql = """
            INSERT INTO %s (logged_at, level, logger, message, thread_name, host, thrown_type, thrown_msg)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            """.formatted(settings.table());
        this.dataSource = createDataSource(settings);
        this.hostName = resolveHostName();
        this.worker = new Thread(this::drainLoop, "render-log-writer");
        this.worker.setDaemon(true);
        this.worker.start();
        setLevel(Level.ALL);
    }

    @Override
    public void publish(LogRecord record) {
        Objects.requireNonNull(record);
        if (!running || !isLoggable(record)) {
            return;
        }
        while (!queue.offer(record)) {
            queue.poll();
        }
    }

    @Override
    public void flush() {
        // records are persisted by the worker thread
    }

    @Override
    public void close() throws SecurityException {
        running = false;
        worker.interrupt();
        try {
            worker.join(TimeUnit.SECONDS.toMillis(2));
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
        }
        dataSource.close();
    }

    private void drainLoop() {
        while (running) {
            try {
                LogRecord record = queue.poll(500, TimeUnit.MILLISECONDS);
                if (record != null) {
                    write(record);
                }
            } catch (InterruptedException interrupted) {
                break;
            } catch (SQLException | RuntimeException ex) {
                reportError("Failed to persist log record", ex, ErrorManager.WRITE_FAILURE);
            }
        }

        // clear a pending interrupt from close() so the final writes can still borrow connections
        Thread.interrupted();
        LogRecord pending;
        while ((pending = queue.poll()) != null) {
            try {
                write(pending);
            } catch (SQLException | RuntimeException ex) {
                reportError("Failed to persist log record on shutdown", ex, ErrorManager.CLOSE_FAILURE);
            }
        }
    }

    private void write(LogRecord record) throws SQLException {
        try (Connection connection = dataSource.getConnection();
             PreparedStatement statement = connection.prepareStatement(insertSql)) {
            statement.setTimestamp(1, Timestamp.from(record.getInstant()));
            statement.setString(2, record.getLevel().getName());
            statement.setString(3, record.getLoggerName());
            statement.setString(4, renderMessage(record));
            statement.setString(5, "thread-" + record.getLongThreadID());
            statement.setString(6, hostName);
            Throwable thrown = record.getThrown();
            statement.setString(7, thrown == null ? null : thrown.getClass().getName());
            statement.setString(8, thrown == null ? null : thrown.getMessage());
            statement.executeUpdate();
        }
    }

    private static String renderMessage(LogRecord record) {
        String message = record.getMessage();
        if (message == null) {
            return "";
        }
        Object[] params = record.getParameters();
        if (params == null || params.length == 0) {
            return message;
        }
        try {
            return MessageFormat.format(message, params);
        } catch (IllegalArgumentException ex) {
            return message;
        }
    }

    private static String resolveHostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            return "unknown-host";
        }
    }

    private static HikariDataSource createDataSource(LogSinkSettings settings) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(settings.url());
        hikariConfig.setUsername(settings.username());
        hikariConfig.setPassword(settings.password());
        hikariConfig.setMaximumPoolSize(settings.poolSize());
        hikariConfig.setPoolName("RenderLogPool");
        hikariConfig.setAutoCommit(true);
        hikariConfig.setInitializationFailTimeout(-1);
        return new HikariDataSource(hikariConfig);
    }
}
