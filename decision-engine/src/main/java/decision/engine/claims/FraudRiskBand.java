package decision.engine.claims;

public enum FraudRiskBand {
    LOW,
    MEDIUM,
    HIGH
}
