package decision.engine.risk;

public enum UnderwritingDecision {
    APPROVE,
    REJECT,
    MANUAL_REVIEW
}
