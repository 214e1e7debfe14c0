package com.mimecast.pdbconf;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.config.LoggerConfig;
import org.apache.logging.log4j.core.config.Property;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Collects log events sent to the root logger while open.
 */
public class LogCapture extends AbstractAppender implements AutoCloseable {

    private final LoggerContext context;
    private final List<LogEvent> events = new CopyOnWriteArrayList<>();

    private LogCapture(LoggerContext context) {
        super("LogCapture", null, null, true, Property.EMPTY_ARRAY);
        this.context = context;
    }

    /**
     * Starts capturing.
     *
     * @return LogCapture instance.
     */
    public static LogCapture open() {
        LoggerContext context = (LoggerContext) LogManager.getContext(false);
        LogCapture capture = new LogCapture(context);
        capture.start();
        context.getConfiguration().getRootLogger().addAppender(capture, Level.ALL, null);
        context.updateLoggers();
        return capture;
    }

    @Override
    public void append(LogEvent event) {
        events.add(event.toImmutable());
    }

    /**
     * Gets formatted messages logged at warn level.
     *
     * @return List of messages.
     */
    public List<String> getWarnings() {
        return events.stream()
                .filter(event -> event.getLevel() == Level.WARN)
                .map(event -> event.getMessage().getFormattedMessage())
                .collect(Collectors.toList());
    }

    /**
     * Is there a warning containing the given text.
     *
     * @param text Text.
     * @return Boolean.
     */
    public boolean hasWarning(String text) {
        return getWarnings().stream().anyMatch(message -> message.contains(text));
    }

    @Override
    public void close() {
        LoggerConfig root = context.getConfiguration().getRootLogger();
        root.removeAppender(getName());
        context.updateLoggers();
        stop();
    }
}
