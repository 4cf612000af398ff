package decision.engine.claims;

public enum ClaimVerdict {
    APPROVED,
    PENDING_DOCUMENTS,
    UNDER_INVESTIGATION,
    REJECTED
}
