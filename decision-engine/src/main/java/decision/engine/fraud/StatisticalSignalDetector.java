package decision.engine.fraud;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Component
public class StatisticalSignalDetector implements FraudSignalDetector {
    public static final String CLAIM_AMOUNT = "claim_amount";

    private static final double COMPLEX_WORD_LENGTH = 10.0;
    private static final double COMPLEXITY_INCREMENT = 0.10;
    private static final double LARGE_CLAIM_AMOUNT = 50_000;
    private static final double LARGE_CLAIM_INCREMENT = 0.15;

    @Override
    public DetectionMethod method() {
        return DetectionMethod.STATISTICAL;
    }

    @Override
    public DetectionResult detect(String text, Map<String, Object> metadata) {
        double score = 0.0;
        List<String> indicators = new ArrayList<>();

        if (meanWordLength(text) > COMPLEX_WORD_LENGTH) {
            score += COMPLEXITY_INCREMENT;
            indicators.add("Unusually complex language");
        }

        if (claimAmount(metadata) > LARGE_CLAIM_AMOUNT) {
            score += LARGE_CLAIM_INCREMENT;
            indicators.add("High claim amount");
        }

        return new DetectionResult(Math.min(score, 1.0), indicators);
    }

    private static double meanWordLength(String text) {
        String[] words = Words.split(text);
        if (words.length == 0) {
            return 0.0;
        }
        long letters = 0;
        for (String word : words) {
            letters += word.length();
        }
        return (double) letters / words.length;
    }

    static double claimAmount(Map<String, Object> metadata) {
        if (metadata == null) {
            return 0.0;
        }
        Object raw = metadata.get(CLAIM_AMOUNT);
        if (raw instanceof Number) {
            return ((Number) raw).doubleValue();
        }
        String value = raw == null ? "" : raw.toString().trim();
        if (value.isEmpty()) {
            return 0.0;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("claim_amount is not numeric: " + value, e);
        }
    }
}
