package decision.engine.fraud;

import decision.engine.classify.Classification;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SignalDetectorsTest {
    private static final String ORDINARY_NARRATIVE =
            "On Tuesday evening a branch from the neighbour's oak tree fell onto our garage roof during the storm "
                    + "and cracked several tiles, and we called a roofer the next morning to inspect it.";

    @Test
    void patternDetectorShouldAddIncrementPerMatch() {
        DetectionResult result = new PatternSignalDetector()
                .detect("This is fake and I need payment immediately for my claim", Map.of());

        assertEquals(0.4, result.score(), 1e-9);
        assertTrue(result.indicators().contains("Pattern match: document forgery language"));
        assertTrue(result.indicators().contains("Pattern match: urgent payment demand"));
        assertTrue(result.indicators().contains("Unusually brief description"));
    }

    @Test
    void patternDetectorShouldIgnoreOrdinaryNarrative() {
        DetectionResult result = new PatternSignalDetector().detect(ORDINARY_NARRATIVE, Map.of());

        assertEquals(0.0, result.score());
        assertTrue(result.indicators().isEmpty());
    }

    @Test
    void patternDetectorShouldCapAtOne() {
        String text = "fake forged claim urgent payment now! several claims and accidents, $50000 cash payment, "
                + "prior injury damage, witness lost!!! 1/1/20 2/2/20 3/3/20 4/4/20 5/5/20 6/6/20";

        DetectionResult result = new PatternSignalDetector().detect(text, Map.of());

        assertEquals(1.0, result.score());
    }

    @Test
    void modelDetectorShouldKeepFraudConfidence() {
        ModelSignalDetector detector = new ModelSignalDetector(text -> new Classification("FRAUD", 0.9));

        DetectionResult result = detector.detect(ORDINARY_NARRATIVE, Map.of());

        assertEquals(0.9, result.score(), 1e-9);
        assertEquals(1, result.indicators().size());
        assertTrue(result.indicators().get(0).contains("0.90"));
    }

    @Test
    void modelDetectorShouldInvertOtherLabels() {
        ModelSignalDetector detector = new ModelSignalDetector(text -> new Classification("LEGITIMATE", 0.8));

        DetectionResult result = detector.detect(ORDINARY_NARRATIVE, Map.of());

        assertEquals(0.2, result.score(), 1e-9);
        assertTrue(result.indicators().isEmpty());
    }

    @Test
    void sentimentDetectorShouldFlagOnlyExtremeTone() {
        assertEquals(0.3, new SentimentSignalDetector(text -> new Classification("NEGATIVE", 0.97))
                .detect("text", Map.of()).score());
        assertEquals(0.2, new SentimentSignalDetector(text -> new Classification("POSITIVE", 0.99))
                .detect("text", Map.of()).score());
        assertEquals(0.0, new SentimentSignalDetector(text -> new Classification("NEGATIVE", 0.9))
                .detect("text", Map.of()).score());
    }

    @Test
    void statisticalDetectorShouldFlagHighAmount() {
        StatisticalSignalDetector detector = new StatisticalSignalDetector();

        DetectionResult numeric = detector.detect(ORDINARY_NARRATIVE, Map.of(StatisticalSignalDetector.CLAIM_AMOUNT, 75_000));
        DetectionResult text = detector.detect(ORDINARY_NARRATIVE, Map.of(StatisticalSignalDetector.CLAIM_AMOUNT, "75000"));

        assertEquals(0.15, numeric.score(), 1e-9);
        assertEquals(numeric, text);
        assertTrue(numeric.indicators().contains("High claim amount"));
    }

    @Test
    void statisticalDetectorShouldFlagComplexLanguage() {
        DetectionResult result = new StatisticalSignalDetector()
                .detect("Notwithstanding extraordinarily circumstantial misrepresentations", Map.of());

        assertEquals(0.1, result.score(), 1e-9);
        assertEquals("Unusually complex language", result.indicators().get(0));
    }

    @Test
    void statisticalDetectorShouldRejectNonNumericAmount() {
        StatisticalSignalDetector detector = new StatisticalSignalDetector();

        assertThrows(IllegalArgumentException.class,
                () -> detector.detect("text", Map.of(StatisticalSignalDetector.CLAIM_AMOUNT, "a lot")));
    }

    @Test
    void riskLevelShouldFollowScoreBands() {
        assertEquals(FraudRiskLevel.CRITICAL, FraudRiskLevel.forScore(0.85));
        assertEquals(FraudRiskLevel.HIGH, FraudRiskLevel.forScore(0.75));
        assertEquals(FraudRiskLevel.MEDIUM, FraudRiskLevel.forScore(0.5));
        assertEquals(FraudRiskLevel.LOW, FraudRiskLevel.forScore(0.3));
        assertEquals(FraudRiskLevel.MINIMAL, FraudRiskLevel.forScore(0.29));
    }
}
