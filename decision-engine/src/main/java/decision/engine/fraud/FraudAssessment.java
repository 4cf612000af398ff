package decision.engine.fraud;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record FraudAssessment(
        double fraudScore,
        boolean suspicious,
        double confidence,
        List<String> indicators,
        FraudRiskLevel riskLevel,
        String recommendation,
        Map<String, Double> detectionMethods,
        Instant timestamp,
        String error
) {
    public FraudAssessment {
        indicators = indicators == null ? List.of() : List.copyOf(indicators);
        detectionMethods = detectionMethods == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(detectionMethods));
    }

    public boolean degraded() {
        return riskLevel == FraudRiskLevel.UNKNOWN;
    }
}
