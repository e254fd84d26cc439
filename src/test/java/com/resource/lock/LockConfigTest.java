package com.resource.lock;

import com.resource.lock.time.CancellationSignal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

import static org.junit.jupiter.api.Assertions.*;

class LockConfigTest {

    @Nested
    @DisplayName("LockConfig")
    class LockConfigTests {

        @Test
        @DisplayName("Should create default config")
        void testDefaults() {
            LockConfig config = LockConfig.defaults();
            assertEquals(Duration.ofSeconds(5), config.defaultTimeout());
            assertEquals(Duration.ofMillis(50), config.pollInterval());
        }

        @Test
        @DisplayName("Should allow a zero default timeout")
        void testZeroDefaultTimeout() {
            assertDoesNotThrow(() -> new LockConfig(Duration.ZERO, Duration.ofMillis(10)));
        }

        @Test
        @DisplayName("Should reject invalid default timeout")
        void testInvalidTimeout() {
            assertThrows(IllegalArgumentException.class,
                    () -> new LockConfig(Duration.ofMillis(-1), Duration.ofMillis(10)));
            assertThrows(IllegalArgumentException.class,
                    () -> new LockConfig(ChronoUnit.FOREVER.getDuration(), Duration.ofMillis(10)));
        }

        @Test
        @DisplayName("Should reject non-positive poll interval")
        void testInvalidPollInterval() {
            assertThrows(IllegalArgumentException.class,
                    () -> new LockConfig(Duration.ofSeconds(1), Duration.ZERO));
        }
    }

    @Nested
    @DisplayName("AcquireOptions")
    class AcquireOptionsTests {

        @Test
        @DisplayName("of() leaves timeout and signal unset")
        void testOf() {
            AcquireOptions options = AcquireOptions.of(Duration.ofSeconds(1));
            assertEquals(Duration.ofSeconds(1), options.ttl());
            assertNull(options.timeout());
            assertNull(options.signal());
        }

        @Test
        @DisplayName("with methods return modified copies")
        void testWithers() {
            CancellationSignal signal = new CancellationSignal();
            AcquireOptions base = AcquireOptions.of(Duration.ofSeconds(1));
            AcquireOptions options = base.withTimeout(Duration.ofMillis(250)).withSignal(signal);

            assertEquals(Duration.ofMillis(250), options.timeout());
            assertSame(signal, options.signal());
            assertNull(base.timeout());
        }

        @Test
        @DisplayName("Should require a ttl")
        void testRequiresTtl() {
            assertThrows(NullPointerException.class, () -> AcquireOptions.of(null));
        }
    }

    @Nested
    @DisplayName("Exceptions")
    class ExceptionTests {

        @Test
        @DisplayName("Should carry message")
        void testMessage() {
            LockAcquisitionException ex = new LockAcquisitionException("lock failed");
            assertEquals("lock failed", ex.getMessage());
        }

        @Test
        @DisplayName("Should carry cause")
        void testCause() {
            RuntimeException cause = new RuntimeException("root cause");
            LockBackendException ex = new LockBackendException("backend failed", cause);
            assertEquals(cause, ex.getCause());
        }
    }
}
