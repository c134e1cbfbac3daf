package io.vectorvault;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ReadRetry.
 */
class ReadRetryTest {

    @Test
    void testSucceedsWithoutRetry() {
        AtomicInteger calls = new AtomicInteger();

        assertEquals("ok", ReadRetry.once(() -> {
            calls.incrementAndGet();
            return "ok";
        }, Duration.ZERO));
        assertEquals(1, calls.get());
    }

    @Test
    void testRetriesTransientFailureOnce() {
        AtomicInteger calls = new AtomicInteger();

        String value = ReadRetry.once(() -> {
            if (calls.incrementAndGet() == 1) {
                throw new StorageUnavailableException("busy", null);
            }
            return "ok";
        }, Duration.ZERO);

        assertEquals("ok", value);
        assertEquals(2, calls.get());
    }

    @Test
    void testSecondFailurePropagates() {
        AtomicInteger calls = new AtomicInteger();

        assertThrows(StorageUnavailableException.class, () -> ReadRetry.once(() -> {
            calls.incrementAndGet();
            throw new StorageUnavailableException("down", null);
        }, Duration.ZERO));
        assertEquals(2, calls.get());
    }

    @Test
    void testOtherFailuresAreNotRetried() {
        AtomicInteger calls = new AtomicInteger();

        assertThrows(NotFoundException.class, () -> ReadRetry.once(() -> {
            calls.incrementAndGet();
            throw new NotFoundException("Collection", "x");
        }, Duration.ZERO));
        assertEquals(1, calls.get());
    }
}
