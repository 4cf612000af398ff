package decision.engine.llm;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class GenerationService {
    private static final Logger log = LoggerFactory.getLogger(GenerationService.class);

    private final LlmClient llmClient;
    private final Retry retry;
    private final MeterRegistry meterRegistry;

    public GenerationService(
            LlmClient llmClient,
            MeterRegistry meterRegistry,
            @Value("${decision.engine.llm.retry.max-attempts:3}") int maxAttempts,
            @Value("${decision.engine.llm.retry.initial-backoff-ms:2000}") long initialBackoffMs,
            @Value("${decision.engine.llm.retry.multiplier:2.0}") double multiplier
    ) {
        this.llmClient = llmClient;
        this.meterRegistry = meterRegistry;
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(Math.max(1, Math.min(maxAttempts, 3)))
                .intervalFunction(IntervalFunction.ofExponentialBackoff(Math.max(1, initialBackoffMs), multiplier))
                .retryExceptions(GenerationException.class)
                .build();
        this.retry = Retry.of("generation", config);
        this.retry.getEventPublisher().onRetry(event -> log.warn(
                "event=generation_retry attempt={} wait_ms={} error={}",
                event.getNumberOfRetryAttempts(),
                event.getWaitInterval().toMillis(),
                event.getLastThrowable() == null ? "unknown" : event.getLastThrowable().getMessage()
        ));
    }

    public String generate(String prompt, double temperature, int maxTokens) {
        try {
            String text = Retry.decorateSupplier(retry, () -> llmClient.generate(prompt, temperature, maxTokens)).get();
            count("success");
            return text == null ? "" : text;
        } catch (GenerationException e) {
            count("exhausted");
            throw e;
        } catch (RuntimeException e) {
            count("error");
            throw new GenerationException("generation failed", e);
        }
    }

    private void count(String outcome) {
        Counter.builder("decision_engine_generation_total")
                .tag("outcome", outcome)
                .register(meterRegistry)
                .increment();
    }
}
