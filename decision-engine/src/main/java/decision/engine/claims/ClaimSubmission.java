package decision.engine.claims;

import java.util.List;

public record ClaimSubmission(
        String narrative,
        String incidentDate,
        String incidentLocation,
        Double claimAmount,
        String policyNumber,
        String claimantName,
        List<String> submittedDocuments
) {
    public ClaimSubmission {
        if (narrative == null || narrative.isBlank()) {
            throw new IllegalArgumentException("claim narrative must not be empty");
        }
        if (claimAmount != null && (claimAmount.isNaN() || claimAmount < 0)) {
            throw new IllegalArgumentException("claim amount must not be negative");
        }
        submittedDocuments = submittedDocuments == null
                ? List.of()
                : submittedDocuments.stream().filter(d -> d != null && !d.isBlank()).map(String::trim).toList();
    }
}
