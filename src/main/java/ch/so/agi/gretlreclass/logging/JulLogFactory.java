package ch.so.agi.gretlreclass.logging;

/**
 * {@link LogFactory} creating {@link JulLogAdaptor} instances that all share
 * one configured {@link Level}.
 */
public class JulLogFactory implements LogFactory {

    private final Level globalLogLevel;

    JulLogFactory(Level globalLogLevel) {
        if (globalLogLevel == null) {
            throw new IllegalArgumentException("globalLogLevel must not be null");
        }
        this.globalLogLevel = globalLogLevel;
    }

    @Override
    public ReclassLogger getLogger(Class<?> logSource) {
        return new JulLogAdaptor(logSource, globalLogLevel);
    }

    Level getGlobalLogLevel() {
        return globalLogLevel;
    }
}
