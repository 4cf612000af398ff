package decision.engine.claims;

public enum DecisionSource {
    FRAUD_PREFILTER,
    GROUNDED,
    PARSE_FALLBACK
}
