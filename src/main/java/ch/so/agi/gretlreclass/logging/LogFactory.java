package ch.so.agi.gretlreclass.logging;

/**
 * Supplies {@link ReclassLogger} instances. Implementations pick the backend
 * and decide how the semantic levels are mapped onto it.
 */
public interface LogFactory {
    /**
     * Creates a logger for the supplied class.
     *
     * @param logSource class that emits log events
     * @return configured logger implementation
     */
    public ReclassLogger getLogger(Class<?> logSource);
}
