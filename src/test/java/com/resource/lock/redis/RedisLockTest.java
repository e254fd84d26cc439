package com.resource.lock.redis;

import com.resource.lock.Lease;
import com.resource.lock.LockConfig;
import com.resource.lock.LockDependencies;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import redis.clients.jedis.exceptions.JedisConnectionException;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("RedisLock Tests")
class RedisLockTest {

    private static final Duration TTL = Duration.ofSeconds(5);
    private static final String TOKEN = "token-1";

    @Mock
    private RedisClient client;

    private RedisLock lock;

    @BeforeEach
    void setUp() {
        lock = new RedisLock(client, new RedisLockConfig(LockConfig.defaults(), "app:test:locks"),
                LockDependencies.defaults(), () -> TOKEN);
    }

    private Lease acquired(String key) {
        when(client.setIfAbsent("app:test:locks:" + key, TOKEN, 5000L)).thenReturn(true);
        return lock.tryAcquire(key, TTL).orElseThrow();
    }

    @Nested
    @DisplayName("Acquisition")
    class AcquisitionTests {

        @Test
        @DisplayName("Claims with SET NX PX using the prefixed key and token")
        void claimsWithPrefixedKey() {
            Lease lease = acquired("orders:42");

            assertEquals("orders:42", lease.key());
            verify(client).setIfAbsent("app:test:locks:orders:42", TOKEN, 5000L);
        }

        @Test
        @DisplayName("Returns empty when the key is already set")
        void contended() {
            when(client.setIfAbsent(anyString(), anyString(), anyLong())).thenReturn(false);

            Optional<Lease> lease = lock.tryAcquire("k", TTL);

            assertTrue(lease.isEmpty());
        }

        @Test
        @DisplayName("Invalid TTL never reaches Redis")
        void invalidTtl() {
            assertThrows(IllegalArgumentException.class, () -> lock.tryAcquire("k", Duration.ZERO));
            verifyNoInteractions(client);
        }

        @Test
        @DisplayName("Client errors propagate")
        void clientErrorsPropagate() {
            when(client.setIfAbsent(anyString(), anyString(), anyLong()))
                    .thenThrow(new JedisConnectionException("connection refused"));

            assertThrows(JedisConnectionException.class, () -> lock.tryAcquire("k", TTL));
        }
    }

    @Nested
    @DisplayName("Release")
    class ReleaseTests {

        @Test
        @DisplayName("Runs the token-checked delete script once")
        void releaseRunsScriptOnce() {
            Lease lease = acquired("k");
            when(client.eval(eq(RedisLease.RELEASE_SCRIPT), anyList(), anyList())).thenReturn(1L);

            lease.release();
            lease.release();

            assertTrue(lease.isReleased());
            verify(client, times(1)).eval(RedisLease.RELEASE_SCRIPT, List.of("app:test:locks:k"), List.of(TOKEN));
        }

        @Test
        @DisplayName("A lock already reclaimed elsewhere is not an error")
        void releaseAfterReclaim() {
            Lease lease = acquired("k");
            when(client.eval(eq(RedisLease.RELEASE_SCRIPT), anyList(), anyList())).thenReturn(0L);

            assertDoesNotThrow(lease::release);
            assertTrue(lease.isReleased());
        }
    }

    @Nested
    @DisplayName("Extend")
    class ExtendTests {

        @Test
        @DisplayName("Returns true when the token still matches")
        void extendOwned() {
            Lease lease = acquired("k");
            when(client.eval(RedisLease.EXTEND_SCRIPT, List.of("app:test:locks:k"), List.of(TOKEN, "10000")))
                    .thenReturn(1L);

            assertTrue(lease.extend(Duration.ofSeconds(10)));
        }

        @Test
        @DisplayName("Returns false when ownership was lost")
        void extendLost() {
            Lease lease = acquired("k");
            when(client.eval(eq(RedisLease.EXTEND_SCRIPT), anyList(), anyList())).thenReturn(0L);

            assertFalse(lease.extend(Duration.ofSeconds(10)));
        }

        @Test
        @DisplayName("Returns false after release without calling Redis")
        void extendAfterRelease() {
            Lease lease = acquired("k");
            when(client.eval(eq(RedisLease.RELEASE_SCRIPT), anyList(), anyList())).thenReturn(1L);
            lease.release();

            assertFalse(lease.extend(Duration.ofSeconds(10)));
            verify(client, never()).eval(eq(RedisLease.EXTEND_SCRIPT), anyList(), anyList());
        }

        @Test
        @DisplayName("Rejects an invalid TTL without calling Redis")
        void extendInvalidTtl() {
            Lease lease = acquired("k");

            assertThrows(IllegalArgumentException.class, () -> lease.extend(Duration.ofMillis(-1)));
            verify(client, never()).eval(anyString(), anyList(), anyList());
        }
    }

    @Nested
    @DisplayName("RedisLockConfig")
    class ConfigTests {

        @Test
        @DisplayName("Appends a separator to the prefix when missing")
        void normalizesPrefix() {
            assertEquals("locks:", RedisLockConfig.withPrefix("locks").keyspacePrefix());
            assertEquals("locks:", RedisLockConfig.withPrefix("locks:").keyspacePrefix());
        }

        @Test
        @DisplayName("Rejects a blank prefix")
        void rejectsBlankPrefix() {
            assertThrows(IllegalArgumentException.class, () -> RedisLockConfig.withPrefix(" "));
            assertThrows(IllegalArgumentException.class, () -> RedisLockConfig.withPrefix(null));
        }

        @Test
        @DisplayName("formatKey prepends the prefix")
        void formatKey() {
            assertEquals("app:test:locks:jobs:nightly", lock.formatKey("jobs:nightly"));
        }
    }
}
