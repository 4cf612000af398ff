package decision.engine.api.model;

import com.fasterxml.jackson.databind.JsonNode;

public record RiskAssessmentRequest(
        JsonNode applicantData,
        String policyType,
        Double coverageAmount,
        Boolean enableFraudCheck,
        Boolean enableExplainability
) {
    public boolean fraudCheck() {
        return enableFraudCheck == null || enableFraudCheck;
    }

    public boolean explainability() {
        return enableExplainability == null || enableExplainability;
    }
}
