package decision.engine.retrieval;

import com.fasterxml.jackson.annotation.JsonInclude;
import decision.engine.fraud.FraudAssessment;

import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record IndexingResult(
        String source,
        boolean indexed,
        boolean flagged,
        int chunks,
        Map<String, Integer> labels,
        FraudAssessment fraudDetails
) {
    public IndexingResult {
        labels = labels == null ? Map.of() : Map.copyOf(labels);
    }
}
