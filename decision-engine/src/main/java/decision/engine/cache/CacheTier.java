package decision.engine.cache;

import java.time.Duration;
import java.util.Optional;

public interface CacheTier {
    Optional<String> get(String key);

    void set(String key, String json, Duration ttl);

    Optional<Duration> remainingTtl(String key);

    void delete(String key);

    void deleteByPrefix(String prefix);
}
