package io.vizspec.standalone.server;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.encoder.Encoder;
import io.vizspec.standalone.config.ConfigLoadException;
import io.vizspec.standalone.config.ServerConfig;
import org.slf4j.LoggerFactory;

/**
 * Applies the {@code logging} section of {@link ServerConfig} to Logback.
 *
 * <p>
 * {@code logging.level} governs the {@code io.vizspec} loggers, so {@code DEBUG} shows the
 * normalizer chain decisions. Jetty and Javalin keep their own quieter levels whatever the
 * service level is.
 */
public final class LogbackConfigurator {

    static final String APPENDER_NAME = "VIZSPEC_CONSOLE";
    static final String SERVICE_LOGGER = "io.vizspec";
    static final String TEXT_PATTERN = "%d{HH:mm:ss.SSS} [%thread] %-5level %logger{36} - %msg%n";

    /** Output encodings accepted for {@code logging.format}. */
    enum Format {
        JSON,
        TEXT
    }

    private LogbackConfigurator() {}

    /**
     * Replaces the console output and sets the service log level.
     *
     * @throws ConfigLoadException if the format or the level is not recognized
     */
    public static void configure(ServerConfig config) {
        Format format = format(config.loggingFormat());
        Level level = level(config.loggingLevel());

        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        root.detachAndStopAllAppenders();
        root.setLevel(Level.INFO);

        ConsoleAppender<ILoggingEvent> appender = new ConsoleAppender<>();
        appender.setContext(context);
        appender.setName(APPENDER_NAME);
        appender.setEncoder(encoder(format, context));
        appender.start();
        root.addAppender(appender);

        context.getLogger(SERVICE_LOGGER).setLevel(level);
        context.getLogger("org.eclipse.jetty").setLevel(Level.WARN);
        context.getLogger("io.javalin").setLevel(Level.INFO);
    }

    static Format format(String value) {
        if (value != null) {
            for (Format format : Format.values()) {
                if (format.name().equalsIgnoreCase(value.trim())) {
                    return format;
                }
            }
        }
        throw new ConfigLoadException("Invalid logging.format '" + value + "': expected 'json' or 'text'");
    }

    static Level level(String value) {
        // unknown names map to the given default
        Level level = value != null ? Level.toLevel(value.trim(), null) : null;
        if (level == null) {
            throw new ConfigLoadException("Invalid logging.level '" + value + "'");
        }
        return level;
    }

    private static Encoder<ILoggingEvent> encoder(Format format, LoggerContext context) {
        if (format == Format.JSON) {
            JsonEncoder json = new JsonEncoder();
            json.setContext(context);
            json.start();
            return json;
        }
        PatternLayoutEncoder pattern = new PatternLayoutEncoder();
        pattern.setContext(context);
        pattern.setPattern(TEXT_PATTERN);
        pattern.start();
        return pattern;
    }
}
