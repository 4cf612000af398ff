package decision.engine.fraud;

public enum FraudRiskLevel {
    MINIMAL("APPROVE - No significant fraud indicators detected."),
    LOW("PROCEED - Low risk, but monitor for patterns."),
    MEDIUM("REVIEW - Some fraud indicators present. Recommend additional verification."),
    HIGH("FLAG - Suspicious activity detected. Mandatory manual review required."),
    CRITICAL("REJECT - High fraud probability. Escalate to fraud investigation unit."),
    UNKNOWN("Manual review required due to system error");

    private final String recommendation;

    FraudRiskLevel(String recommendation) {
        this.recommendation = recommendation;
    }

    public String recommendation() {
        return recommendation;
    }

    public static FraudRiskLevel forScore(double score) {
        if (score >= 0.85) {
            return CRITICAL;
        }
        if (score >= 0.75) {
            return HIGH;
        }
        if (score >= 0.50) {
            return MEDIUM;
        }
        if (score >= 0.30) {
            return LOW;
        }
        return MINIMAL;
    }
}
