package decision.engine.cache;

public record CacheStats(
        long memorySize,
        long memoryMaxSize,
        boolean secondaryEnabled,
        long hitCount,
        long missCount
) {}
