package decision.engine.fraud;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class FraudEnsembleTest {
    private final ExecutorService executor = Executors.newFixedThreadPool(4);

    @AfterEach
    void shutdown() {
        executor.shutdownNow();
    }

    @Test
    void shouldWeightDetectorScores() {
        FraudEnsemble ensemble = TestEnsembles.ensemble(List.of(
                StubDetector.fixed(DetectionMethod.PATTERN, 0.2),
                StubDetector.fixed(DetectionMethod.MODEL, 0.8),
                StubDetector.fixed(DetectionMethod.SENTIMENT, 0.4),
                StubDetector.fixed(DetectionMethod.STATISTICAL, 0.6)
        ), executor);

        FraudAssessment result = ensemble.assess("The car was damaged in the parking lot.");

        // 0.2*0.2 + 0.8*0.4 + 0.4*0.2 + 0.6*0.2
        assertEquals(0.56, result.fraudScore(), 1e-9);
        assertFalse(result.suspicious());
        assertEquals(FraudRiskLevel.MEDIUM, result.riskLevel());
        assertEquals(FraudRiskLevel.MEDIUM.recommendation(), result.recommendation());
        assertEquals(0.9, result.confidence(), 1e-9);
        assertEquals(List.of("pattern_based", "ml_based", "sentiment_based", "statistical"),
                List.copyOf(result.detectionMethods().keySet()));
        assertNull(result.error());
    }

    @Test
    void shouldRenormalizeWhenModelDetectorFails() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        FraudEnsemble ensemble = TestEnsembles.ensemble(List.of(
                StubDetector.fixed(DetectionMethod.PATTERN, 0.2),
                StubDetector.failing(DetectionMethod.MODEL),
                StubDetector.fixed(DetectionMethod.SENTIMENT, 0.4),
                StubDetector.fixed(DetectionMethod.STATISTICAL, 0.6)
        ), executor, registry, 1000);

        FraudAssessment result = ensemble.assess("Water leaked through the ceiling overnight.");

        assertEquals(0.4, result.fraudScore(), 1e-9);
        assertEquals(FraudRiskLevel.LOW, result.riskLevel());
        assertFalse(result.degraded());
        assertFalse(result.detectionMethods().containsKey("ml_based"));
        assertEquals(3, result.detectionMethods().size());
        assertEquals(1.0, registry.get("decision_engine_detector_failures_total")
                .tag("method", "ml_based").counter().count());
    }

    @Test
    void shouldDegradeWhenEveryDetectorFails() {
        FraudEnsemble ensemble = TestEnsembles.ensemble(List.of(
                StubDetector.failing(DetectionMethod.PATTERN),
                StubDetector.failing(DetectionMethod.MODEL),
                StubDetector.failing(DetectionMethod.SENTIMENT),
                StubDetector.failing(DetectionMethod.STATISTICAL)
        ), executor);

        FraudAssessment result = ensemble.assess("Anything at all");

        assertTrue(result.degraded());
        assertEquals(0.5, result.fraudScore());
        assertFalse(result.suspicious());
        assertEquals(FraudRiskLevel.UNKNOWN, result.riskLevel());
        assertTrue(result.indicators().contains(FraudEnsemble.SYSTEM_ERROR_INDICATOR));
        assertNotNull(result.error());
    }

    @Test
    void shouldFlagScoresAboveThreshold() {
        FraudAssessment result = TestEnsembles.uniform(0.9, executor).assess("Pay me now");

        assertTrue(result.suspicious());
        assertEquals(FraudRiskLevel.CRITICAL, result.riskLevel());
        assertEquals(1.0, result.confidence(), 1e-9);
    }

    @Test
    void shouldServeRepeatedTextFromCache() {
        StubDetector pattern = StubDetector.fixed(DetectionMethod.PATTERN, 0.3);
        FraudEnsemble ensemble = TestEnsembles.ensemble(List.of(
                pattern,
                StubDetector.fixed(DetectionMethod.MODEL, 0.3)
        ), executor);

        FraudAssessment first = ensemble.assess("Kitchen  fire   damaged the oven");
        FraudAssessment second = ensemble.assess("  Kitchen fire damaged the oven ");

        assertEquals(1, pattern.calls());
        assertEquals(first, second);
    }

    @Test
    void shouldKeepMetadataInFingerprint() {
        String text = "Stolen bicycle";
        assertNotEquals(
                FraudEnsemble.fingerprint(text, Map.of()),
                FraudEnsemble.fingerprint(text, Map.of("claim_amount", 900))
        );
        assertEquals(
                FraudEnsemble.fingerprint(text, Map.of("a", 1, "b", 2)),
                FraudEnsemble.fingerprint(text, Map.of("b", 2, "a", 1))
        );
    }

    @Test
    void shouldTreatSlowDetectorAsFailure() {
        CountDownLatch release = new CountDownLatch(1);
        FraudEnsemble ensemble = TestEnsembles.ensemble(List.of(
                StubDetector.fixed(DetectionMethod.PATTERN, 0.2),
                StubDetector.of(DetectionMethod.MODEL, () -> {
                    try {
                        release.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return new DetectionResult(1.0, List.of());
                })
        ), executor, new SimpleMeterRegistry(), 100);

        try {
            FraudAssessment result = ensemble.assess("Slow model narrative");

            assertEquals(0.2, result.fraudScore(), 1e-9);
            assertEquals(List.of("pattern_based"), List.copyOf(result.detectionMethods().keySet()));
        } finally {
            release.countDown();
        }
    }

    @Test
    void shouldNotCountQueueTimeAgainstDetectorTimeout() {
        ExecutorService single = Executors.newSingleThreadExecutor();
        try {
            FraudEnsemble ensemble = TestEnsembles.ensemble(List.of(
                    sleeping(DetectionMethod.PATTERN, 0.2),
                    sleeping(DetectionMethod.MODEL, 0.8),
                    sleeping(DetectionMethod.SENTIMENT, 0.4),
                    sleeping(DetectionMethod.STATISTICAL, 0.6)
            ), single, new SimpleMeterRegistry(), 150);

            FraudAssessment result = ensemble.assess("Hail dented the roof and bonnet");

            assertEquals(4, result.detectionMethods().size());
            assertEquals(0.56, result.fraudScore(), 1e-9);
        } finally {
            single.shutdownNow();
        }
    }

    @Test
    void shouldNotCachePartialAssessment() {
        AtomicInteger modelCalls = new AtomicInteger();
        StubDetector pattern = StubDetector.fixed(DetectionMethod.PATTERN, 0.2);
        FraudEnsemble ensemble = TestEnsembles.ensemble(List.of(
                pattern,
                StubDetector.of(DetectionMethod.MODEL, () -> {
                    if (modelCalls.incrementAndGet() == 1) {
                        throw new IllegalStateException("model warming up");
                    }
                    return new DetectionResult(0.8, List.of());
                })
        ), executor);

        FraudAssessment first = ensemble.assess("Burst pipe flooded the basement");
        FraudAssessment second = ensemble.assess("Burst pipe flooded the basement");

        assertEquals(1, first.detectionMethods().size());
        assertEquals(2, second.detectionMethods().size());
        assertEquals(2, pattern.calls());

        FraudAssessment third = ensemble.assess("Burst pipe flooded the basement");
        assertEquals(second, third);
        assertEquals(2, pattern.calls());
    }

    @Test
    void shouldAssessBatchInOrder() {
        FraudEnsemble ensemble = TestEnsembles.uniform(0.1, executor);

        List<FraudAssessment> results = ensemble.assessAll(
                List.of("first narrative", "second narrative", "third narrative"),
                null
        );

        assertEquals(3, results.size());
        results.forEach(r -> assertEquals(0.1, r.fraudScore(), 1e-9));
    }

    @Test
    void shouldRejectThresholdOutsideUnitInterval() {
        assertThrows(IllegalStateException.class, () -> new FraudEnsemble(
                StubDetector.uniform(0.1), TestEnsembles.cache(), executor, TestEnsembles.CLOCK,
                new SimpleMeterRegistry(), 1.5, 1000, 3600));
    }

    @Test
    void shouldComputeConfidenceFromVariance() {
        assertEquals(0.5, FraudEnsemble.confidence(List.of(0.9)));
        assertEquals(1.0, FraudEnsemble.confidence(List.of(0.4, 0.4, 0.4)));
        assertEquals(0.5, FraudEnsemble.confidence(List.of(0.0, 1.0)));
    }

    private static StubDetector sleeping(DetectionMethod method, double score) {
        return StubDetector.of(method, () -> {
            try {
                Thread.sleep(60);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return new DetectionResult(score, List.of());
        });
    }
}
