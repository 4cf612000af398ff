package decision.engine.claims;

import java.util.List;

public record ClaimAdjudication(
        ClaimVerdict verdict,
        boolean coverageApplicable,
        FraudRiskBand fraudRisk,
        double fraudScore,
        DocumentStatus documentStatus,
        List<String> missingDocuments,
        List<DocumentGuidance> documentGuidance,
        List<String> fraudSignals,
        String reason,
        String claimantMessage,
        List<String> requiredDocumentsChecklist,
        double estimatedCoverageAmount,
        List<String> policyReferences,
        List<String> nextSteps,
        String internalNotes,
        List<String> submittedDocuments,
        List<IncidentType> incidentTypes,
        DecisionSource decisionSource,
        boolean contextAvailable
) {
    public ClaimAdjudication {
        documentStatus = documentStatus == null ? DocumentStatus.empty() : documentStatus;
        missingDocuments = missingDocuments == null ? List.of() : List.copyOf(missingDocuments);
        documentGuidance = documentGuidance == null ? List.of() : List.copyOf(documentGuidance);
        fraudSignals = fraudSignals == null ? List.of() : List.copyOf(fraudSignals);
        requiredDocumentsChecklist = requiredDocumentsChecklist == null ? List.of() : List.copyOf(requiredDocumentsChecklist);
        policyReferences = policyReferences == null ? List.of() : List.copyOf(policyReferences);
        nextSteps = nextSteps == null ? List.of() : List.copyOf(nextSteps);
        submittedDocuments = submittedDocuments == null ? List.of() : List.copyOf(submittedDocuments);
        incidentTypes = incidentTypes == null ? List.of() : List.copyOf(incidentTypes);
        reason = reason == null ? "" : reason;
        claimantMessage = claimantMessage == null ? "" : claimantMessage;
        internalNotes = internalNotes == null ? "" : internalNotes;

        if (verdict == null || fraudRisk == null || decisionSource == null) {
            throw new IllegalStateException("verdict, fraud risk and decision source are required");
        }
        if (verdict == ClaimVerdict.APPROVED
                && (!missingDocuments.isEmpty() || !documentStatus.insufficient().isEmpty())) {
            throw new IllegalStateException("a claim with insufficient documents cannot be approved");
        }
        int partitioned = documentStatus.verified().size()
                + documentStatus.unverified().size()
                + documentStatus.missing().size();
        if (partitioned != requiredDocumentsChecklist.size()) {
            throw new IllegalStateException("document status must partition the required checklist");
        }
    }
}
