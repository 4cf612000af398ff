package decision.engine.fraud;

import decision.engine.cache.AssessmentCache;
import decision.engine.support.Outcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Fuses the signal detectors into one {@link FraudAssessment}.
 *
 * <p>Detectors run concurrently and are joined without cancelling each other; a failed or timed-out
 * detector is left out and the weights of the remaining detectors are renormalised, so
 * {@code fraudScore = sum(score * weight) / sum(weight)} over successful detectors only. Results are
 * cached by content fingerprint only when every detector contributed. This class never throws to its caller: if nothing can be computed it
 * returns a degraded assessment with {@link FraudRiskLevel#UNKNOWN}.
 */
@Component
public class FraudEnsemble {
    private static final Logger log = LoggerFactory.getLogger(FraudEnsemble.class);

    public static final String CACHE_NAMESPACE = "fraud";
    static final String SYSTEM_ERROR_INDICATOR = "System error in fraud detection";

    private final List<FraudSignalDetector> detectors;
    private final AssessmentCache cache;
    private final ExecutorService executor;
    private final Clock clock;
    private final MeterRegistry meterRegistry;
    private final double threshold;
    private final long detectorTimeoutMs;
    private final Duration ttl;

    public FraudEnsemble(
            List<FraudSignalDetector> detectors,
            AssessmentCache cache,
            @Qualifier("decisionExecutor") ExecutorService executor,
            Clock clock,
            MeterRegistry meterRegistry,
            @Value("${decision.engine.fraud.threshold:0.75}") double threshold,
            @Value("${decision.engine.fraud.detector-timeout-ms:5000}") long detectorTimeoutMs,
            @Value("${decision.engine.cache.ttl-seconds:3600}") long ttlSeconds
    ) {
        if (threshold < 0.0 || threshold > 1.0) {
            throw new IllegalStateException("fraud threshold must be within [0, 1]: " + threshold);
        }
        List<FraudSignalDetector> ordered = new ArrayList<>(detectors);
        ordered.sort(Comparator.comparing(FraudSignalDetector::method));
        this.detectors = List.copyOf(ordered);
        this.cache = cache;
        this.executor = executor;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
        this.threshold = threshold;
        this.detectorTimeoutMs = detectorTimeoutMs;
        this.ttl = Duration.ofSeconds(ttlSeconds);
    }

    public double threshold() {
        return threshold;
    }

    public FraudAssessment assess(String text) {
        return assess(text, Map.of());
    }

    public FraudAssessment assess(String text, Map<String, Object> metadata) {
        return assessAsync(text, metadata).join();
    }

    public List<FraudAssessment> assessAll(List<String> texts, List<Map<String, Object>> metadataList) {
        List<CompletableFuture<FraudAssessment>> pending = new ArrayList<>(texts.size());
        for (int i = 0; i < texts.size(); i++) {
            Map<String, Object> metadata = metadataList != null && i < metadataList.size()
                    ? metadataList.get(i)
                    : Map.of();
            pending.add(assessAsync(texts.get(i), metadata));
        }
        return pending.stream().map(CompletableFuture::join).toList();
    }

    public CompletableFuture<FraudAssessment> assessAsync(String text, Map<String, Object> metadata) {
        String safeText = text == null ? "" : text;
        Map<String, Object> safeMetadata = metadata == null ? Map.of() : metadata;

        String key;
        try {
            key = fingerprint(safeText, safeMetadata);
            Optional<FraudAssessment> cached = cache.get(CACHE_NAMESPACE, key, FraudAssessment.class);
            if (cached.isPresent()) {
                return CompletableFuture.completedFuture(cached.get());
            }
        } catch (RuntimeException e) {
            log.error("event=fraud_assessment_failed stage=cache error={}", e.getMessage(), e);
            return CompletableFuture.completedFuture(degraded(e.getMessage()));
        }

        List<CompletableFuture<Outcome<DetectionResult>>> running = new ArrayList<>(detectors.size());
        for (FraudSignalDetector detector : detectors) {
            running.add(detectAsync(detector, safeText, safeMetadata));
        }

        return CompletableFuture.allOf(running.toArray(new CompletableFuture[0]))
                .thenApply(ignored -> combine(key, running))
                .exceptionally(e -> {
                    Throwable cause = unwrap(e);
                    log.error("event=fraud_assessment_failed stage=aggregate error={}", cause.getMessage(), cause);
                    return degraded(cause.getMessage());
                });
    }

    private CompletableFuture<Outcome<DetectionResult>> detectAsync(
            FraudSignalDetector detector,
            String text,
            Map<String, Object> metadata
    ) {
        CompletableFuture<Outcome<DetectionResult>> outcome = new CompletableFuture<>();
        AtomicReference<Future<?>> task = new AtomicReference<>();
        try {
            task.set(executor.submit(() -> {
                // the deadline starts when the detector starts, not while it waits in the queue
                CompletableFuture.delayedExecutor(detectorTimeoutMs, TimeUnit.MILLISECONDS).execute(() -> {
                    if (outcome.complete(Outcome.failure(new TimeoutException(
                            detector.method().key() + " exceeded " + detectorTimeoutMs + "ms")))) {
                        Future<?> running = task.get();
                        if (running != null) {
                            running.cancel(true);
                        }
                    }
                });
                try {
                    outcome.complete(Outcome.success(detector.detect(text, metadata)));
                } catch (RuntimeException e) {
                    outcome.complete(Outcome.failure(e));
                } finally {
                    outcome.complete(Outcome.failure(
                            new IllegalStateException(detector.method().key() + " ended without a result")));
                }
            }));
        } catch (RejectedExecutionException e) {
            outcome.complete(Outcome.failure(e));
        }
        return outcome;
    }

    private FraudAssessment combine(String key, List<CompletableFuture<Outcome<DetectionResult>>> running) {
        Map<DetectionMethod, DetectionResult> succeeded = new LinkedHashMap<>();
        for (int i = 0; i < detectors.size(); i++) {
            DetectionMethod method = detectors.get(i).method();
            Outcome<DetectionResult> outcome = running.get(i).join();
            if (outcome.succeeded() && outcome.value() != null) {
                succeeded.put(method, outcome.value());
            } else {
                log.warn("event=fraud_detector_failed method={} error={}", method.key(), outcome.errorSummary());
                Counter.builder("decision_engine_detector_failures_total")
                        .tag("method", method.key())
                        .register(meterRegistry)
                        .increment();
            }
        }

        if (succeeded.isEmpty()) {
            return degraded("all detection methods failed");
        }

        FraudAssessment assessment = aggregate(succeeded);
        if (succeeded.size() == detectors.size()) {
            cache.set(CACHE_NAMESPACE, key, assessment, ttl);
        }
        return assessment;
    }

    private FraudAssessment aggregate(Map<DetectionMethod, DetectionResult> results) {
        double weighted = 0.0;
        double weightSum = 0.0;
        List<Double> scores = new ArrayList<>(results.size());
        Set<String> indicators = new LinkedHashSet<>();
        Map<String, Double> breakdown = new LinkedHashMap<>();

        for (Map.Entry<DetectionMethod, DetectionResult> entry : results.entrySet()) {
            double score = entry.getValue().score();
            weighted += score * entry.getKey().weight();
            weightSum += entry.getKey().weight();
            scores.add(score);
            indicators.addAll(entry.getValue().indicators());
            breakdown.put(entry.getKey().key(), score);
        }

        double rawScore = weighted / weightSum;
        FraudRiskLevel level = FraudRiskLevel.forScore(rawScore);
        return new FraudAssessment(
                round3(rawScore),
                rawScore > threshold,
                confidence(scores),
                new ArrayList<>(indicators),
                level,
                level.recommendation(),
                breakdown,
                clock.instant(),
                null
        );
    }

    // 1 - min(variance * 2, 0.5)
    static double confidence(List<Double> scores) {
        if (scores.size() < 2) {
            return 0.5;
        }
        double mean = scores.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double variance = scores.stream()
                .mapToDouble(s -> (s - mean) * (s - mean))
                .average()
                .orElse(0.0);
        return round3(1 - Math.min(variance * 2, 0.5));
    }

    private FraudAssessment degraded(String reason) {
        return new FraudAssessment(
                0.5,
                false,
                0.0,
                List.of(SYSTEM_ERROR_INDICATOR),
                FraudRiskLevel.UNKNOWN,
                FraudRiskLevel.UNKNOWN.recommendation(),
                Map.of(),
                clock.instant(),
                reason == null ? "unknown error" : reason
        );
    }

    static String fingerprint(String text, Map<String, Object> metadata) {
        String normalized = text.trim().replaceAll("\\s+", " ");
        String material = metadata.isEmpty() ? normalized : normalized + "|" + new TreeMap<>(metadata);
        try {
            MessageDigest digest = MessageDigest.getInstance("MD5");
            return HexFormat.of().formatHex(digest.digest(material.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 digest unavailable", e);
        }
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }

    static double round3(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }
}
