package ch.so.agi.gretlreclass.remote;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * One blocking round trip to the backend.
 */
@FunctionalInterface
public interface RemoteCall<T> {
    T call() throws IOException, TimeoutException;
}
