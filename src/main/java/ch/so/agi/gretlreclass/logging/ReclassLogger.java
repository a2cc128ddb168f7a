package ch.so.agi.gretlreclass.logging;

/**
 * Logging contract used throughout the reclassification engine. It hides the
 * concrete backend (currently {@code java.util.logging}) behind a small set of
 * semantic levels:
 * <ul>
 *   <li>{@link #lifecycle(String)} &ndash; exactly one start and one finish
 *       message per step.</li>
 *   <li>{@link #info(String)} &ndash; progress information for the person
 *       running a reclassification.</li>
 *   <li>{@link #warn(String)} &ndash; recoverable oddities (e.g. a destination
 *       code without a class table entry, drawn black).</li>
 *   <li>{@link #debug(String)} &ndash; per block / per call diagnostics.</li>
 *   <li>{@link #error(String, Throwable)} &ndash; failure summaries including
 *       the underlying exception.</li>
 * </ul>
 */
public interface ReclassLogger {

    public void lifecycle(String msg);

    public void info(String msg);

    public void warn(String msg);

    public void debug(String msg);

    public void error(String msg, Throwable thrown);

    public boolean isDebugEnabled();
}
