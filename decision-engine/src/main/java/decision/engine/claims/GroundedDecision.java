package decision.engine.claims;

import java.util.List;

public record GroundedDecision(
        ClaimVerdict verdict,
        boolean coverageApplicable,
        FraudRiskBand fraudRisk,
        double fraudScore,
        List<String> verified,
        List<String> unverified,
        List<String> missing,
        List<DocumentGuidance> guidance,
        List<String> missingDocuments,
        List<String> fraudSignals,
        String reason,
        String claimantMessage,
        List<String> requiredDocumentsChecklist,
        double estimatedCoverageAmount,
        List<String> policyReferences,
        List<String> nextSteps,
        String internalNotes
) {
    public GroundedDecision {
        verified = verified == null ? List.of() : List.copyOf(verified);
        unverified = unverified == null ? List.of() : List.copyOf(unverified);
        missing = missing == null ? List.of() : List.copyOf(missing);
        guidance = guidance == null ? List.of() : List.copyOf(guidance);
        missingDocuments = missingDocuments == null ? List.of() : List.copyOf(missingDocuments);
        fraudSignals = fraudSignals == null ? List.of() : List.copyOf(fraudSignals);
        reason = reason == null ? "" : reason;
        claimantMessage = claimantMessage == null ? "" : claimantMessage;
        requiredDocumentsChecklist = requiredDocumentsChecklist == null ? List.of() : List.copyOf(requiredDocumentsChecklist);
        policyReferences = policyReferences == null ? List.of() : List.copyOf(policyReferences);
        nextSteps = nextSteps == null ? List.of() : List.copyOf(nextSteps);
        internalNotes = internalNotes == null ? "" : internalNotes;
    }
}
