package decision.engine.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * Namespaced two-tier cache: a bounded in-process Caffeine store with per-entry TTL, read first, and an
 * optional {@link CacheTier} behind it. Writes go to both tiers; last write wins. A secondary hit is
 * promoted with the time it has left there. A failing secondary tier is logged and bypassed.
 */
public class AssessmentCache {
    private static final Logger log = LoggerFactory.getLogger(AssessmentCache.class);

    private final Cache<String, CachedValue> memory;
    private final long maxSize;
    private final Duration defaultTtl;
    private final CacheTier secondary;
    private final ObjectMapper objectMapper;

    public AssessmentCache(long maxSize, Duration defaultTtl, Ticker ticker, CacheTier secondary, ObjectMapper objectMapper) {
        this.maxSize = maxSize;
        this.defaultTtl = defaultTtl;
        this.secondary = secondary;
        this.objectMapper = objectMapper;
        this.memory = Caffeine.newBuilder()
                .maximumSize(maxSize)
                .ticker(ticker)
                .expireAfter(new PerEntryExpiry())
                .recordStats()
                .build();
    }

    public Duration defaultTtl() {
        return defaultTtl;
    }

    public <T> Optional<T> get(String namespace, String key, Class<T> type) {
        String cacheKey = namespaced(namespace, key);
        CachedValue cached = memory.getIfPresent(cacheKey);
        if (cached != null && type.isInstance(cached.value())) {
            log.debug("event=cache_hit tier=memory key={}", cacheKey);
            return Optional.of(type.cast(cached.value()));
        }
        if (secondary == null) {
            return Optional.empty();
        }
        try {
            Optional<String> json = secondary.get(cacheKey);
            if (json.isPresent()) {
                T value = objectMapper.readValue(json.get(), type);
                Duration remaining = secondary.remainingTtl(cacheKey).orElse(defaultTtl);
                memory.put(cacheKey, new CachedValue(value, remaining));
                log.debug("event=cache_hit tier=secondary key={}", cacheKey);
                return Optional.of(value);
            }
        } catch (JsonProcessingException | RuntimeException e) {
            log.error("event=cache_get_failed tier=secondary key={} error={}", cacheKey, e.getMessage());
        }
        return Optional.empty();
    }

    public void set(String namespace, String key, Object value, Duration ttl) {
        String cacheKey = namespaced(namespace, key);
        memory.put(cacheKey, new CachedValue(value, ttl));
        if (secondary == null) {
            return;
        }
        try {
            secondary.set(cacheKey, objectMapper.writeValueAsString(value), ttl);
        } catch (JsonProcessingException | RuntimeException e) {
            log.error("event=cache_set_failed tier=secondary key={} error={}", cacheKey, e.getMessage());
        }
    }

    public void delete(String namespace, String key) {
        String cacheKey = namespaced(namespace, key);
        memory.invalidate(cacheKey);
        if (secondary != null) {
            try {
                secondary.delete(cacheKey);
            } catch (RuntimeException e) {
                log.error("event=cache_delete_failed tier=secondary key={} error={}", cacheKey, e.getMessage());
            }
        }
    }

    public void clearNamespace(String namespace) {
        String prefix = namespace + ":";
        memory.asMap().keySet().removeIf(k -> k.startsWith(prefix));
        if (secondary != null) {
            try {
                secondary.deleteByPrefix(prefix);
            } catch (RuntimeException e) {
                log.error("event=cache_clear_failed tier=secondary namespace={} error={}", namespace, e.getMessage());
            }
        }
        log.info("event=cache_namespace_cleared namespace={}", namespace);
    }

    public CacheStats stats() {
        memory.cleanUp();
        return new CacheStats(
                memory.estimatedSize(),
                maxSize,
                secondary != null,
                memory.stats().hitCount(),
                memory.stats().missCount()
        );
    }

    private static String namespaced(String namespace, String key) {
        return namespace + ":" + key;
    }

    private record CachedValue(Object value, Duration ttl) {}

    private static final class PerEntryExpiry implements Expiry<String, CachedValue> {
        @Override
        public long expireAfterCreate(String key, CachedValue value, long currentTime) {
            return value.ttl().toNanos();
        }

        @Override
        public long expireAfterUpdate(String key, CachedValue value, long currentTime, long currentDuration) {
            return value.ttl().toNanos();
        }

        @Override
        public long expireAfterRead(String key, CachedValue value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
