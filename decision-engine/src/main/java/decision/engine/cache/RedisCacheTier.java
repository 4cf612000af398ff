package decision.engine.cache;

import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;

public class RedisCacheTier implements CacheTier {
    private final StringRedisTemplate redisTemplate;

    public RedisCacheTier(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(redisTemplate.opsForValue().get(key));
    }

    @Override
    public void set(String key, String json, Duration ttl) {
        redisTemplate.opsForValue().set(key, json, ttl);
    }

    @Override
    public Optional<Duration> remainingTtl(String key) {
        Long millis = redisTemplate.getExpire(key, TimeUnit.MILLISECONDS);
        return millis == null || millis <= 0 ? Optional.empty() : Optional.of(Duration.ofMillis(millis));
    }

    @Override
    public void delete(String key) {
        redisTemplate.delete(key);
    }

    @Override
    public void deleteByPrefix(String prefix) {
        Set<String> keys = redisTemplate.keys(prefix + "*");
        if (keys != null && !keys.isEmpty()) {
            redisTemplate.delete(keys);
        }
    }
}
