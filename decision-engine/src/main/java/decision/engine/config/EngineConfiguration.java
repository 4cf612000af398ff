package decision.engine.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Ticker;
import decision.engine.cache.AssessmentCache;
import decision.engine.cache.CacheTier;
import decision.engine.cache.RedisCacheTier;
import decision.engine.risk.DecisionThresholds;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class EngineConfiguration {

    @Bean(name = "decisionExecutor", destroyMethod = "shutdownNow")
    public ExecutorService decisionExecutor(@Value("${decision.engine.executor.threads:8}") int threads) {
        AtomicInteger sequence = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, "decision-worker-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(Math.max(2, threads), factory);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public DecisionThresholds decisionThresholds(
            @Value("${decision.engine.risk.auto-approve-threshold:30}") double autoApprove,
            @Value("${decision.engine.risk.auto-reject-threshold:85}") double autoReject,
            @Value("${decision.engine.risk.review-min:70}") double reviewMin,
            @Value("${decision.engine.risk.review-max:85}") double reviewMax
    ) {
        return new DecisionThresholds(autoApprove, autoReject, reviewMin, reviewMax);
    }

    @Bean
    @ConditionalOnProperty(prefix = "decision.engine.cache.redis", name = "enabled", havingValue = "true")
    public CacheTier redisCacheTier(StringRedisTemplate redisTemplate) {
        return new RedisCacheTier(redisTemplate);
    }

    @Bean
    public AssessmentCache assessmentCache(
            ObjectProvider<CacheTier> secondary,
            ObjectMapper objectMapper,
            @Value("${decision.engine.cache.max-size:1000}") long maxSize,
            @Value("${decision.engine.cache.ttl-seconds:3600}") long ttlSeconds
    ) {
        return new AssessmentCache(
                maxSize,
                Duration.ofSeconds(ttlSeconds),
                Ticker.systemTicker(),
                secondary.getIfAvailable(),
                objectMapper
        );
    }
}
