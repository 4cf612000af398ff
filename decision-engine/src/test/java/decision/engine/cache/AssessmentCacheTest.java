package decision.engine.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class AssessmentCacheTest {
    private final AtomicLong nanos = new AtomicLong();
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void shouldExpireEntriesAfterTheirOwnTtl() {
        AssessmentCache cache = new AssessmentCache(10, Duration.ofHours(1), nanos::get, null, mapper);
        cache.set("fraud", "short", "a", Duration.ofSeconds(10));
        cache.set("fraud", "long", "b", Duration.ofMinutes(10));

        nanos.addAndGet(TimeUnit.SECONDS.toNanos(11));

        assertEquals(Optional.empty(), cache.get("fraud", "short", String.class));
        assertEquals(Optional.of("b"), cache.get("fraud", "long", String.class));
    }

    @Test
    void shouldSeparateNamespaces() {
        AssessmentCache cache = new AssessmentCache(10, Duration.ofHours(1), nanos::get, null, mapper);
        cache.set("fraud", "k", "fraud-value", Duration.ofMinutes(1));
        cache.set("risk", "k", "risk-value", Duration.ofMinutes(1));

        cache.clearNamespace("fraud");

        assertTrue(cache.get("fraud", "k", String.class).isEmpty());
        assertEquals(Optional.of("risk-value"), cache.get("risk", "k", String.class));
    }

    @Test
    void shouldReadThroughSecondaryTier() {
        MapTier tier = new MapTier();
        AssessmentCache writer = new AssessmentCache(10, Duration.ofHours(1), nanos::get, tier, mapper);
        AssessmentCache reader = new AssessmentCache(10, Duration.ofHours(1), nanos::get, tier, mapper);

        writer.set("fraud", "abc", new Score("LOW", 0.12), Duration.ofMinutes(5));

        assertEquals("{\"level\":\"LOW\",\"value\":0.12}", tier.entries.get("fraud:abc"));
        assertEquals(Optional.of(new Score("LOW", 0.12)), reader.get("fraud", "abc", Score.class));
        assertEquals(1, reader.stats().memorySize());
        assertTrue(reader.stats().secondaryEnabled());
    }

    @Test
    void shouldKeepRemainingTtlWhenPromotingSecondaryHit() {
        MapTier tier = new MapTier();
        AssessmentCache reader = new AssessmentCache(10, Duration.ofHours(1), nanos::get, tier, mapper);
        tier.set("fraud:abc", "{\"level\":\"LOW\",\"value\":0.12}", Duration.ofSeconds(30));

        assertTrue(reader.get("fraud", "abc", Score.class).isPresent());
        tier.delete("fraud:abc");
        nanos.addAndGet(TimeUnit.SECONDS.toNanos(20));
        assertTrue(reader.get("fraud", "abc", Score.class).isPresent());

        nanos.addAndGet(TimeUnit.SECONDS.toNanos(11));
        assertTrue(reader.get("fraud", "abc", Score.class).isEmpty());
    }

    @Test
    void shouldBypassFailingSecondaryTier() {
        AssessmentCache cache = new AssessmentCache(10, Duration.ofHours(1), nanos::get, new BrokenTier(), mapper);

        cache.set("fraud", "k", "v", Duration.ofMinutes(1));
        cache.clearNamespace("risk");

        assertEquals(Optional.of("v"), cache.get("fraud", "k", String.class));
        assertEquals(Optional.empty(), cache.get("fraud", "other", String.class));
    }

    @Test
    void shouldReportHitsAndMisses() {
        AssessmentCache cache = new AssessmentCache(10, Duration.ofHours(1), nanos::get, null, mapper);
        cache.set("fraud", "k", "v", Duration.ofMinutes(1));

        cache.get("fraud", "k", String.class);
        cache.get("fraud", "missing", String.class);
        CacheStats stats = cache.stats();

        assertEquals(1, stats.hitCount());
        assertEquals(1, stats.missCount());
        assertEquals(1, stats.memorySize());
        assertEquals(10, stats.memoryMaxSize());
        assertFalse(stats.secondaryEnabled());
    }

    record Score(String level, double value) {}

    private static final class MapTier implements CacheTier {
        private final Map<String, String> entries = new ConcurrentHashMap<>();
        private final Map<String, Duration> ttls = new ConcurrentHashMap<>();

        @Override
        public Optional<String> get(String key) {
            return Optional.ofNullable(entries.get(key));
        }

        @Override
        public void set(String key, String json, Duration ttl) {
            entries.put(key, json);
            ttls.put(key, ttl);
        }

        @Override
        public Optional<Duration> remainingTtl(String key) {
            return Optional.ofNullable(ttls.get(key));
        }

        @Override
        public void delete(String key) {
            entries.remove(key);
            ttls.remove(key);
        }

        @Override
        public void deleteByPrefix(String prefix) {
            entries.keySet().removeIf(k -> k.startsWith(prefix));
            ttls.keySet().removeIf(k -> k.startsWith(prefix));
        }
    }

    private static final class BrokenTier implements CacheTier {
        @Override
        public Optional<String> get(String key) {
            throw new IllegalStateException("connection refused");
        }

        @Override
        public void set(String key, String json, Duration ttl) {
            throw new IllegalStateException("connection refused");
        }

        @Override
        public Optional<Duration> remainingTtl(String key) {
            throw new IllegalStateException("connection refused");
        }

        @Override
        public void delete(String key) {
            throw new IllegalStateException("connection refused");
        }

        @Override
        public void deleteByPrefix(String prefix) {
            throw new IllegalStateException("connection refused");
        }
    }
}
