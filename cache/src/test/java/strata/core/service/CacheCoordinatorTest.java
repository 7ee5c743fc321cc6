package strata.core.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.core.type.TypeReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import strata.core.cache.KeyPatternMatcher;
import strata.core.cache.LocalCacheBackend;
import strata.core.port.out.CacheMetrics;
import strata.testing.FakeRemoteCacheBackend;
import strata.testing.MutableClock;

@DisplayName("CacheCoordinator")
@ExtendWith(MockitoExtension.class)
class CacheCoordinatorTest {

    private static final Duration DEFAULT_TTL = Duration.ofMinutes(5);

    public record Listing(String id, String title, int price) {}

    @Mock
    private CacheMetrics metrics;

    private MutableClock clock;
    private FakeRemoteCacheBackend remote;
    private LocalCacheBackend local;
    private CacheCoordinator coordinator;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        remote = new FakeRemoteCacheBackend();
        local = new LocalCacheBackend(100, Duration.ofHours(1), clock, new KeyPatternMatcher(), null);
        coordinator = new CacheCoordinator(
                remote, local, new CacheSerializer(), new KeyPatternMatcher(), metrics, DEFAULT_TTL);
    }

    @AfterEach
    void tearDown() {
        local.close();
    }

    private <T> Optional<T> get(String key, Class<T> type) {
        return coordinator.get(key, type).await().indefinitely();
    }

    private void set(String key, Object value) {
        coordinator.set(key, value).await().indefinitely();
    }

    @Nested
    @DisplayName("Availability")
    class Availability {

        @Test
        @DisplayName("should choose the tier when the operation is subscribed")
        void shouldChooseTierAtSubscription() {
            final var write = coordinator.set("listing:1", new Listing("1", "Loft", 1200));

            remote.connect();
            write.await().indefinitely();

            assertTrue(remote.values().containsKey("listing:1"));
            assertTrue(local.get("listing:1").isEmpty());
        }

        @Test
        @DisplayName("should use the local tier until the remote connects")
        void shouldUseLocalUntilConnected() {
            set("listing:1", new Listing("1", "Loft", 1200));

            assertFalse(coordinator.isRemoteAvailable());
            assertTrue(remote.values().isEmpty());
            assertTrue(local.get("listing:1").isPresent());
        }

        @Test
        @DisplayName("should use the remote tier once connected")
        void shouldUseRemoteOnceConnected() {
            remote.connect();

            set("listing:1", new Listing("1", "Loft", 1200));

            assertTrue(coordinator.isRemoteAvailable());
            assertTrue(remote.values().containsKey("listing:1"));
            assertEquals(0, local.size());
            verify(metrics).recordRemoteAvailability(true);
        }

        @Test
        @DisplayName("should notice a remote that was connected before registration")
        void shouldNoticeAlreadyConnectedRemote() {
            final var connected = new FakeRemoteCacheBackend();
            connected.connect();

            final var other = new CacheCoordinator(
                    connected, local, new CacheSerializer(), new KeyPatternMatcher(), null, DEFAULT_TTL);

            assertTrue(other.isRemoteAvailable());
        }

        @Test
        @DisplayName("should switch to the local tier after an error event")
        void shouldSwitchToLocalAfterError() {
            remote.connect();
            remote.error(new IllegalStateException("connection reset"));

            set("listing:1", new Listing("1", "Loft", 1200));

            assertFalse(coordinator.isRemoteAvailable());
            assertTrue(local.get("listing:1").isPresent());
            verify(metrics).recordRemoteAvailability(false);
        }

        @Test
        @DisplayName("should switch to the local tier after an end event and back after reconnect")
        void shouldSwitchBackAfterReconnect() {
            remote.connect();
            remote.end();
            assertFalse(coordinator.isRemoteAvailable());

            remote.connect();

            assertTrue(coordinator.isRemoteAvailable());
        }

        @Test
        @DisplayName("should bypass the remote tier while it is not ready")
        void shouldBypassRemoteWhileNotReady() {
            remote.connect();
            remote.setReady(false);

            set("listing:1", new Listing("1", "Loft", 1200));

            assertEquals(0, remote.calls());
            assertTrue(local.get("listing:1").isPresent());
        }

        @Test
        @DisplayName("should report status of both tiers")
        void shouldReportStatus() {
            local.set("a", "1", DEFAULT_TTL);

            final var status = coordinator.status();

            assertFalse(status.remoteAvailable());
            assertEquals(1, status.localSize());
            assertEquals(100, status.localCapacity());
        }
    }

    @Nested
    @DisplayName("Fallback")
    class Fallback {

        @Test
        @DisplayName("should serve reads and writes from the local tier when remote calls fail")
        void shouldFallBackWhenRemoteFails() {
            remote.connect();
            remote.failWith(new RuntimeException("READONLY You can't write against a read only replica"));

            final var listing = new Listing("1", "Loft", 1200);
            set("listing:1", listing);

            assertEquals(Optional.of(listing), get("listing:1", Listing.class));
            verify(metrics).recordFallback("set");
            verify(metrics).recordFallback("get");
        }

        @Test
        @DisplayName("should answer exists and delete through the local tier when remote calls fail")
        void shouldFallBackForExistsAndDelete() {
            remote.connect();
            remote.failWith(new RuntimeException("timeout"));
            set("listing:1", new Listing("1", "Loft", 1200));

            assertTrue(coordinator.exists("listing:1").await().indefinitely());
            coordinator.delete("listing:1").await().indefinitely();
            assertFalse(coordinator.exists("listing:1").await().indefinitely());
        }

        @Test
        @DisplayName("should not copy local writes to the remote tier after recovery")
        void shouldNotReconcileAfterRecovery() {
            set("listing:1", new Listing("1", "Loft", 1200));

            remote.connect();

            assertTrue(get("listing:1", Listing.class).isEmpty());
            assertTrue(local.get("listing:1").isPresent());
        }

        @Test
        @DisplayName("should write to one tier only")
        void shouldWriteToOneTierOnly() {
            remote.connect();

            set("listing:1", new Listing("1", "Loft", 1200));

            assertEquals(1, remote.values().size());
            assertEquals(0, local.size());
        }
    }

    @Nested
    @DisplayName("Values")
    class Values {

        @Test
        @DisplayName("should round-trip typed values through the remote tier")
        void shouldRoundTripThroughRemote() {
            remote.connect();
            final var listing = new Listing("1", "Loft", 1200);

            set("listing:1", listing);

            assertEquals(Optional.of(listing), get("listing:1", Listing.class));
            verify(metrics).recordLookup(CacheMetrics.REMOTE, true);
        }

        @Test
        @DisplayName("should round-trip generic values")
        void shouldRoundTripGenericValues() {
            final var listings = List.of(new Listing("1", "Loft", 1200), new Listing("2", "Studio", 800));

            set("listings", listings);

            final var result = coordinator
                    .get("listings", new TypeReference<List<Listing>>() {})
                    .await()
                    .indefinitely();
            assertEquals(Optional.of(listings), result);
        }

        @Test
        @DisplayName("should apply the given TTL on the remote tier")
        void shouldApplyTtlOnRemote() {
            remote.connect();

            coordinator.set("a", "value", Duration.ofSeconds(30)).await().indefinitely();
            coordinator.set("b", "value").await().indefinitely();

            assertEquals(Optional.of(Duration.ofSeconds(30)), remote.ttlOf("a"));
            assertEquals(Optional.of(DEFAULT_TTL), remote.ttlOf("b"));
        }

        @Test
        @DisplayName("should expire values in the local tier")
        void shouldExpireValuesLocally() {
            coordinator.set("a", "value", Duration.ofSeconds(1)).await().indefinitely();

            clock.advance(Duration.ofSeconds(2));

            assertTrue(get("a", String.class).isEmpty());
            verify(metrics).recordLookup(CacheMetrics.LOCAL, false);
        }

        @Test
        @DisplayName("should treat an unreadable entry as a miss")
        void shouldTreatUnreadableEntryAsMiss() {
            local.set("listing:1", "{not json", DEFAULT_TTL);

            assertTrue(get("listing:1", Listing.class).isEmpty());
        }

        @Test
        @DisplayName("should skip null values")
        void shouldSkipNullValues() {
            set("nothing", null);

            assertEquals(0, local.size());
        }

        @Test
        @DisplayName("should reject non-positive TTLs")
        void shouldRejectNonPositiveTtl() {
            assertThrows(IllegalArgumentException.class, () -> coordinator.set("a", "v", Duration.ZERO));
            assertThrows(IllegalArgumentException.class, () -> coordinator.increment("a", Duration.ofSeconds(-1)));
        }
    }

    @Nested
    @DisplayName("deletePattern()")
    class DeletePattern {

        @Test
        @DisplayName("should delete matching keys on the remote tier")
        void shouldDeleteMatchingRemoteKeys() {
            remote.connect();
            set("query:listing:search:p:1:10", "a");
            set("query:listing:all::", "b");
            set("query:user:all::", "c");

            coordinator.deletePattern("query:listing:*").await().indefinitely();

            assertEquals(List.of("query:user:all::"), List.copyOf(remote.values().keySet()));
        }

        @Test
        @DisplayName("should delete matching keys on the local tier")
        void shouldDeleteMatchingLocalKeys() {
            set("query:listing:search:p:1:10", "a");
            set("query:user:all::", "c");

            coordinator.deletePattern("query:listing:*").await().indefinitely();

            assertTrue(local.get("query:listing:search:p:1:10").isEmpty());
            assertTrue(local.get("query:user:all::").isPresent());
        }

        @Test
        @DisplayName("should match remote keys containing glob metacharacters literally")
        void shouldMatchRemoteMetacharactersLiterally() {
            remote.connect();
            set("tag:[new]:1", "a");
            set("tag:n:1", "b");

            coordinator.deletePattern("tag:[new]:*").await().indefinitely();

            assertFalse(remote.values().containsKey("tag:[new]:1"));
            assertTrue(remote.values().containsKey("tag:n:1"));
        }
    }

    @Nested
    @DisplayName("increment()")
    class Increment {

        @Test
        @DisplayName("should set the TTL only on the first remote increment")
        void shouldSetTtlOnFirstIncrementOnly() {
            remote.connect();

            assertEquals(1L, coordinator.increment("hits", Duration.ofSeconds(60)).await().indefinitely());
            assertEquals(2L, coordinator.increment("hits", Duration.ofSeconds(60)).await().indefinitely());
            assertEquals(3L, coordinator.increment("hits", Duration.ofSeconds(60)).await().indefinitely());

            assertEquals(1, remote.expireCalls());
            assertEquals(Optional.of(Duration.ofSeconds(60)), remote.ttlOf("hits"));
        }

        @Test
        @DisplayName("should keep counting remotely when setting the expiry fails")
        void shouldKeepRemoteCountWhenExpireFails() {
            remote.connect();
            remote.failNextExpire(new RuntimeException("timeout"));

            assertEquals(1L, coordinator.increment("hits", Duration.ofSeconds(60)).await().indefinitely());
            assertEquals(Optional.empty(), remote.ttlOf("hits"));

            assertEquals(2L, coordinator.increment("hits", Duration.ofSeconds(60)).await().indefinitely());

            assertEquals("2", remote.values().get("hits"));
            assertEquals(Optional.of(Duration.ofSeconds(60)), remote.ttlOf("hits"));
            assertTrue(local.get("hits").isEmpty());
            verify(metrics, never()).recordFallback("increment");
        }

        @Test
        @DisplayName("should count locally when the remote tier fails")
        void shouldCountLocallyWhenRemoteFails() {
            remote.connect();
            remote.failWith(new RuntimeException("connection refused"));

            assertEquals(1L, coordinator.increment("hits").await().indefinitely());
            assertEquals(2L, coordinator.increment("hits").await().indefinitely());
            verify(metrics, times(2)).recordFallback("increment");
        }

        @Test
        @DisplayName("should return 0 when the local tier cannot increment")
        void shouldReturnZeroWhenLocalFails() {
            local.set("hits", "not-a-number", DEFAULT_TTL);

            assertEquals(0L, coordinator.increment("hits").await().indefinitely());
        }
    }

    @Nested
    @DisplayName("generateKey()")
    class GenerateKey {

        @Test
        @DisplayName("should join prefix and parts with colons")
        void shouldJoinWithColons() {
            assertEquals("user:42:profile", coordinator.generateKey("user", 42, "profile"));
        }

        @Test
        @DisplayName("should render null parts as empty segments")
        void shouldRenderNullPartsAsEmpty() {
            assertEquals("user::profile", coordinator.generateKey("user", null, "profile"));
        }

        @Test
        @DisplayName("should end with a separator without parts")
        void shouldEndWithSeparatorWithoutParts() {
            assertEquals("user:", coordinator.generateKey("user"));
        }
    }
}
