package ch.so.agi.gretlreclass.logging;

import java.util.logging.Logger;

/**
 * {@link ReclassLogger} backed by {@link java.util.logging.Logger}. The
 * semantic levels are translated according to {@link Level}.
 */
public class JulLogAdaptor implements ReclassLogger {

    private final Logger logger;

    JulLogAdaptor(Class<?> logSource, Level logLevel) {
        this.logger = Logger.getLogger(logSource.getName());
        this.logger.setLevel(logLevel.getInnerLevel());
    }

    @Override
    public void lifecycle(String msg) {
        logger.log(Level.LIFECYCLE.getInnerLevel(), msg);
    }

    @Override
    public void info(String msg) {
        logger.log(Level.INFO.getInnerLevel(), msg);
    }

    @Override
    public void warn(String msg) {
        logger.log(Level.WARN.getInnerLevel(), msg);
    }

    @Override
    public void debug(String msg) {
        logger.log(Level.DEBUG.getInnerLevel(), msg);
    }

    @Override
    public void error(String msg, Throwable thrown) {
        logger.log(Level.ERROR.getInnerLevel(), msg, thrown);
    }

    @Override
    public boolean isDebugEnabled() {
        return logger.isLoggable(Level.DEBUG.getInnerLevel());
    }

    Logger getInnerLogger() {
        return logger;
    }
}
