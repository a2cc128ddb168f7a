package ch.so.agi.gretlreclass.remote;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

import ch.so.agi.gretlreclass.logging.LogEnvironment;
import ch.so.agi.gretlreclass.logging.ReclassLogger;
import ch.so.agi.gretlreclass.utils.BackendTimeoutException;
import ch.so.agi.gretlreclass.utils.BackendUnavailableException;
import ch.so.agi.gretlreclass.utils.ReclassifyException;
import ch.so.agi.gretlreclass.utils.Stage;

/**
 * Runs {@link RemoteCall}s and translates their failures into the engine's
 * exception taxonomy.
 */
public final class RemoteCalls {

    private static final ReclassLogger log = LogEnvironment.getLogger(RemoteCalls.class);

    private RemoteCalls() {}

    /**
     * @param assetId   the remote asset the call is about, used in error messages
     * @param stage     stage reported on failure
     * @param operation short name of the call for logging
     * @param timeout   timeout handed to the backend
     * @throws BackendTimeoutException     if the backend gave up after {@code timeout}
     * @throws BackendUnavailableException for transport or backend errors, unchecked ones included
     */
    public static <T> T call(String assetId, Stage stage, String operation, Duration timeout, RemoteCall<T> call) {
        long start = System.nanoTime();
        try {
            T result = call.call();
            log.debug(String.format("%s(%s) answered in %d ms", operation, assetId,
                    (System.nanoTime() - start) / 1_000_000));
            return result;
        } catch (TimeoutException e) {
            throw new BackendTimeoutException(assetId, stage,
                    operation + " did not answer within " + timeout.toSeconds() + " s", e);
        } catch (IOException e) {
            throw new BackendUnavailableException(assetId, stage, operation + " failed: " + e.getMessage(), e);
        } catch (ReclassifyException e) {
            throw e.withContext(assetId, stage);
        } catch (RuntimeException e) {
            throw new BackendUnavailableException(assetId, stage, operation + " failed: " + e, e);
        }
    }
}
