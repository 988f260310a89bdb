package personal.users.common.logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * SLF4J 기반 LoggerAdapter 구현체
 */
public class Slf4jLoggerAdapter<T> implements LoggerAdapter<T> {

    private final Logger logger;

    public Slf4jLoggerAdapter(Class<T> type) {
        this.logger = LoggerFactory.getLogger(type);
    }

    @Override
    public void logInformation(String template, Object... args) {
        logger.info(template, args);
    }

    @Override
    public void logError(Throwable exception, String template, Object... args) {
        logger.atError()
                .setCause(exception)
                .log(template, args);
    }
}
