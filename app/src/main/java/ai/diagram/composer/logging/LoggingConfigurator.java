package ai.diagram.composer.logging;

import ai.diagram.composer.config.LogFormat;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.OutputStreamAppender;
import ch.qos.logback.core.encoder.Encoder;
import ch.qos.logback.core.encoder.LayoutWrappingEncoder;
import java.util.Iterator;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * Swaps the encoder of the root logger's stream appenders to match the requested {@link LogFormat}.
 */
public final class LoggingConfigurator {

    static final String TEXT_PATTERN = "%d{yyyy-MM-dd HH:mm:ss.SSS} %-5level [%thread] %logger{36} - %msg%n";

    private static final org.slf4j.Logger LOGGER = LoggerFactory.getLogger(LoggingConfigurator.class);

    private LoggingConfigurator() {
    }

    /**
     * @return number of appenders that were switched; zero when logback is not the bound backend
     */
    public static int configure(LogFormat format) {
        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (!(factory instanceof LoggerContext context)) {
            LOGGER.warn("Log format {} ignored: backend {} is not logback", format, factory.getClass().getName());
            return 0;
        }
        return configure(context, format);
    }

    static int configure(LoggerContext context, LogFormat format) {
        Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        int switched = 0;
        for (Iterator<Appender<ILoggingEvent>> iterator = root.iteratorForAppenders(); iterator.hasNext(); ) {
            Appender<ILoggingEvent> appender = iterator.next();
            if (appender instanceof OutputStreamAppender<ILoggingEvent> outputStreamAppender) {
                Encoder<ILoggingEvent> encoder = switch (format) {
                    case JSON -> jsonEncoder(context);
                    case TEXT -> textEncoder(context);
                };
                restartAppender(outputStreamAppender, encoder);
                switched++;
            }
        }
        return switched;
    }

    private static Encoder<ILoggingEvent> jsonEncoder(LoggerContext context) {
        JsonLineLayout layout = new JsonLineLayout();
        layout.setContext(context);
        layout.start();
        LayoutWrappingEncoder<ILoggingEvent> encoder = new LayoutWrappingEncoder<>();
        encoder.setContext(context);
        encoder.setLayout(layout);
        encoder.start();
        return encoder;
    }

    private static Encoder<ILoggingEvent> textEncoder(LoggerContext context) {
        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern(TEXT_PATTERN);
        encoder.start();
        return encoder;
    }

    private static void restartAppender(OutputStreamAppender<ILoggingEvent> appender, Encoder<ILoggingEvent> encoder) {
        boolean running = appender.isStarted();
        if (running) {
            appender.stop();
        }
        appender.setEncoder(encoder);
        if (running) {
            appender.start();
        }
    }
}
