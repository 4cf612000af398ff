package decision.engine.claims;

import java.time.Instant;
import java.util.List;

public record ClaimContext(
        Instant receivedAt,
        ClaimSubmission submission,
        List<IncidentType> incidentTypes,
        List<String> requiredDocuments,
        String amountBucket
) {
    public ClaimContext {
        incidentTypes = List.copyOf(incidentTypes);
        requiredDocuments = List.copyOf(requiredDocuments);
    }
}
