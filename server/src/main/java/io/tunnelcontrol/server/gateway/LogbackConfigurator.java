package io.tunnelcontrol.server.gateway;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.encoder.Encoder;
import io.tunnelcontrol.server.config.ServerConfig;
import java.util.List;
import org.slf4j.LoggerFactory;

/**
 * Applies the {@code logging.*} section of {@link ServerConfig} to Logback, replacing whatever
 * {@code logback.xml} set up.
 *
 * <p>
 * Three levels are set independently: the root, this application's {@code io.tunnelcontrol}
 * loggers, and the embedded HTTP server. Tunnel diagnostics can then run at DEBUG while Jetty stays
 * quiet.
 */
public final class LogbackConfigurator {

    static final String TEXT_PATTERN = "%d{HH:mm:ss.SSS} [%thread] %-5level %logger{36} - %msg%n";

    static final String APPENDER_NAME = "STDOUT";
    static final String APP_LOGGER = "io.tunnelcontrol";
    static final List<String> HTTP_LOGGERS = List.of("org.eclipse.jetty", "io.javalin");

    private LogbackConfigurator() {
        // utility class
    }

    public static void configure(ServerConfig config) {
        configure(config.loggingFormat(), config.loggingLevel(), config.effectiveAppLevel(), config.loggingHttpLevel());
    }

    /**
     * @param format    "json" for one JSON object per line, anything else for text
     * @param rootLevel level of every logger not named below; unknown values mean INFO
     * @param appLevel  level of {@code io.tunnelcontrol}; unknown values follow {@code rootLevel}
     * @param httpLevel level of Jetty and Javalin; unknown values mean WARN
     */
    public static void configure(String format, String rootLevel, String appLevel, String httpLevel) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);

        Level resolvedRoot = Level.toLevel(rootLevel, Level.INFO);
        root.setLevel(resolvedRoot);
        root.detachAndStopAllAppenders();

        ConsoleAppender<ILoggingEvent> appender = new ConsoleAppender<>();
        appender.setContext(context);
        appender.setName(APPENDER_NAME);
        appender.setEncoder(encoder(context, format));
        appender.start();
        root.addAppender(appender);

        context.getLogger(APP_LOGGER).setLevel(Level.toLevel(appLevel, resolvedRoot));
        Level resolvedHttp = Level.toLevel(httpLevel, Level.WARN);
        for (String name : HTTP_LOGGERS) {
            context.getLogger(name).setLevel(resolvedHttp);
        }
    }

    private static Encoder<ILoggingEvent> encoder(LoggerContext context, String format) {
        if ("json".equalsIgnoreCase(format)) {
            JsonEncoder json = new JsonEncoder();
            json.setContext(context);
            json.start();
            return json;
        }
        PatternLayoutEncoder text = new PatternLayoutEncoder();
        text.setContext(context);
        text.setPattern(TEXT_PATTERN);
        text.start();
        return text;
    }
}
