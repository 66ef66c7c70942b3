package cz.vut.fit.coloprobe.logging;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.FileAppender;
import org.jetbrains.annotations.NotNull;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Adds a log file to the Logback configuration at runtime. The file receives every event that passes
 * the root logger level.
 */
public final class LogFileConfigurator {
    private static final org.slf4j.Logger Logger = LoggerFactory.getLogger(LogFileConfigurator.class);

    public static final String APPENDER_NAME = "RUN_FILE";
    public static final String PATTERN = "%d{ISO8601} %msg%n";

    private LogFileConfigurator() {
    }

    /**
     * Starts appending log events to the given file. Missing parent directories are created.
     * Replaces the file appender attached by a previous call.
     *
     * @return False if the SLF4J backend is not Logback and the file could not be attached.
     * @throws IOException if the parent directories cannot be created.
     */
    public static boolean attachFileAppender(@NotNull Path file) throws IOException {
        var parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (!(factory instanceof LoggerContext context)) {
            Logger.warn("Log file requested but backend {} cannot be configured at runtime",
                    factory.getClass().getName());
            return false;
        }

        detachFileAppender();

        var encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern(PATTERN);
        encoder.setCharset(StandardCharsets.UTF_8);
        encoder.start();

        var appender = new FileAppender<ILoggingEvent>();
        appender.setContext(context);
        appender.setName(APPENDER_NAME);
        appender.setFile(file.toString());
        appender.setAppend(true);
        appender.setEncoder(encoder);
        appender.start();

        context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).addAppender(appender);
        Logger.debug("Logging to {}", file);
        return true;
    }

    /**
     * Stops and removes the file appender, if one is attached.
     */
    public static void detachFileAppender() {
        if (LoggerFactory.getILoggerFactory() instanceof LoggerContext context) {
            var root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
            var appender = root.getAppender(APPENDER_NAME);
            if (appender != null) {
                root.detachAppender(appender);
                appender.stop();
            }
        }
    }
}
