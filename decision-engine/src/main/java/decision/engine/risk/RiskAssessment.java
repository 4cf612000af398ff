package decision.engine.risk;

import com.fasterxml.jackson.annotation.JsonInclude;
import decision.engine.fraud.FraudAssessment;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record RiskAssessment(
        double riskScore,
        UnderwritingDecision decision,
        double confidence,
        PremiumEstimate premium,
        String policyType,
        Double coverageAmount,
        Map<String, Double> riskBreakdown,
        List<String> riskFactors,
        List<String> recommendations,
        String detailedAssessment,
        ComplianceReport compliance,
        List<ScenarioOutcome> scenarioAnalysis,
        String reason,
        FraudAssessment fraudDetails,
        Instant timestamp
) {
    public RiskAssessment {
        if (riskScore < 0 || riskScore > 100) {
            throw new IllegalArgumentException("risk score must be within [0, 100]: " + riskScore);
        }
        riskBreakdown = riskBreakdown == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(riskBreakdown));
        riskFactors = riskFactors == null ? List.of() : List.copyOf(riskFactors);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
        detailedAssessment = detailedAssessment == null ? "" : detailedAssessment;
        scenarioAnalysis = scenarioAnalysis == null ? List.of() : List.copyOf(scenarioAnalysis);
    }
}
