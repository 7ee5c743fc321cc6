package strata.core.service;

import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import strata.core.cache.LocalCacheBackend;
import strata.core.port.out.CacheStore;

@DisplayName("CacheInvalidator")
@ExtendWith(MockitoExtension.class)
class CacheInvalidatorTest {

    private static final Duration TTL = Duration.ofMinutes(1);

    @Mock
    private CacheStore cache;

    @Test
    @DisplayName("should delete entries matching every pattern")
    void shouldDeleteMatchingEntries() {
        try (var local = new LocalCacheBackend()) {
            final var coordinator = new CacheCoordinator(local);
            final var invalidator = new CacheInvalidator(coordinator);
            local.set("query:listing:all::", "[]", TTL);
            local.set("query:agent:all::", "[]", TTL);
            local.set("profile:42", "{}", TTL);

            invalidator.invalidate("query:listing:*", "query:agent:*").await().indefinitely();

            assertTrue(local.get("query:listing:all::").isEmpty());
            assertTrue(local.get("query:agent:all::").isEmpty());
            assertTrue(local.get("profile:42").isPresent());
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("should continue with remaining patterns after a failure")
        void shouldContinueAfterFailure() {
            when(cache.deletePattern("a:*")).thenReturn(Uni.createFrom().failure(new RuntimeException("boom")));
            when(cache.deletePattern("b:*")).thenReturn(Uni.createFrom().voidItem());
            final var invalidator = new CacheInvalidator(cache);

            invalidator.invalidate("a:*", "b:*").await().indefinitely();

            verify(cache).deletePattern("a:*");
            verify(cache).deletePattern("b:*");
        }

        @Test
        @DisplayName("should not fail when the cache throws")
        void shouldNotFailWhenCacheThrows() {
            when(cache.deletePattern("a:*")).thenThrow(new IllegalStateException("closed"));
            final var invalidator = new CacheInvalidator(cache);

            invalidator.invalidate("a:*").await().indefinitely();

            verify(cache).deletePattern("a:*");
        }
    }

    @Test
    @DisplayName("should invalidate in the background")
    void shouldInvalidateInBackground() {
        when(cache.deletePattern("query:listing:*")).thenReturn(Uni.createFrom().voidItem());
        final var invalidator = new CacheInvalidator(cache);

        invalidator.invalidateInBackground("query:listing:*");

        verify(cache, timeout(1000)).deletePattern("query:listing:*");
    }

    @Test
    @DisplayName("should complete without patterns")
    void shouldCompleteWithoutPatterns() {
        new CacheInvalidator(cache).invalidate().await().indefinitely();
    }
}
