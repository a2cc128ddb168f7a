package ch.so.agi.gretlreclass.logging;

/**
 * Central access point for logging. A {@link LogFactory} is selected lazily;
 * unless configured otherwise, {@code java.util.logging} at
 * {@link Level#LIFECYCLE} is used.
 */
public class LogEnvironment {

    private static LogFactory currentLogFactory = null;

    private LogEnvironment() {}

    /**
     * Replaces the global factory. Mostly intended for tests that want to
     * capture log output.
     *
     * @param factory the {@link LogFactory} to use from now on, {@code null}
     *                resets to lazy initialisation
     */
    public static synchronized void setLogFactory(LogFactory factory) {
        currentLogFactory = factory;
    }

    /**
     * Initialises the environment with {@code java.util.logging} at the given
     * level if no factory was set previously.
     *
     * @param logLevel desired minimum log level
     */
    public static synchronized void initStandalone(Level logLevel) {
        if (currentLogFactory == null) {
            setLogFactory(new JulLogFactory(logLevel));
        }
    }

    /**
     * Returns a logger for the given class.
     *
     * @param logSource the class requesting logging
     * @return a configured {@link ReclassLogger}
     * @throws IllegalArgumentException if {@code logSource} is {@code null}
     */
    public static synchronized ReclassLogger getLogger(Class<?> logSource) {
        if (logSource == null)
            throw new IllegalArgumentException("The logSource must not be null");

        if (currentLogFactory == null) {
            setLogFactory(new JulLogFactory(Level.LIFECYCLE));
        }
        return currentLogFactory.getLogger(logSource);
    }
}
