package io.vectorvault;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Retries a read-only call once after a pause when storage was unavailable. Never use it
 * around a mutating operation: those report one definitive outcome and are retried by the
 * caller, if at all.
 */
public final class ReadRetry {

    private static final Logger log = LoggerFactory.getLogger(ReadRetry.class);

    public static final Duration DEFAULT_BACKOFF = Duration.ofMillis(250);

    private ReadRetry() {
    }

    public static <T> T once(Supplier<T> read) {
        return once(read, DEFAULT_BACKOFF);
    }

    /**
     * Runs {@code read}; if it throws {@link StorageUnavailableException}, waits
     * {@code backoff} and runs it a second time. A second failure propagates.
     */
    public static <T> T once(Supplier<T> read, Duration backoff) {
        try {
            return read.get();
        } catch (StorageUnavailableException e) {
            log.warn("Read failed ({}); retrying once in {} ms", e.getMessage(), backoff.toMillis());
            try {
                Thread.sleep(backoff.toMillis());
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw e;
            }
            return read.get();
        }
    }
}
