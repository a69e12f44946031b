package com.analyzer.report.reporter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes checker messages to an SLF4J logger, mapping checker levels onto SLF4J levels.
 */
public class Slf4jMessageSink implements MessageSink {

    public static final String CHECKER_LOGGER = "analyzer.checker";

    private final Logger logger;

    public Slf4jMessageSink() {
        this(LoggerFactory.getLogger(CHECKER_LOGGER));
    }

    public Slf4jMessageSink(Logger logger) {
        this.logger = logger;
    }

    @Override
    public void emit(Level level, String formattedMessage) {
        switch (level) {
            case SHOUT, SEVERE -> logger.error(formattedMessage);
            case WARNING -> logger.warn(formattedMessage);
            case INFO, CONFIG -> logger.info(formattedMessage);
            case FINE -> logger.debug(formattedMessage);
            case OFF -> {
                // never printed
            }
            default -> logger.trace(formattedMessage);
        }
    }
}
