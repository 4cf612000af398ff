package decision.engine.fraud;

import java.util.List;

public record DetectionResult(double score, List<String> indicators) {
    public DetectionResult {
        if (Double.isNaN(score)) {
            throw new IllegalArgumentException("score must be a number");
        }
        score = Math.max(0.0, Math.min(1.0, score));
        indicators = indicators == null ? List.of() : List.copyOf(indicators);
    }

    public static DetectionResult clean() {
        return new DetectionResult(0.0, List.of());
    }
}
