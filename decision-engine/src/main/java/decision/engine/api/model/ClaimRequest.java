package decision.engine.api.model;

import decision.engine.claims.ClaimSubmission;

import java.util.List;

public record ClaimRequest(
        String claimDescription,
        String incidentDate,
        String incidentLocation,
        Double claimAmount,
        String policyNumber,
        String claimantName,
        List<String> submittedDocuments,
        String contactEmail,
        String contactPhone,
        String query
) {
    public String narrative() {
        if (claimDescription != null && !claimDescription.isBlank()) {
            return claimDescription;
        }
        return query;
    }

    public ClaimSubmission toSubmission() {
        if (narrative() == null || narrative().isBlank()) {
            throw new IllegalArgumentException("Either 'claim_description' or 'query' must be provided");
        }
        return new ClaimSubmission(
                narrative(),
                incidentDate,
                incidentLocation,
                claimAmount,
                policyNumber,
                claimantName,
                submittedDocuments
        );
    }
}
