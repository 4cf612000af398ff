package decision.engine.claims;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@Component
public class GroundedDecisionParser {
    private final ObjectMapper objectMapper;

    public GroundedDecisionParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public GroundedDecision parse(String raw) throws DecisionParseException {
        String text = stripFences(raw);
        if (text.isEmpty()) {
            throw new DecisionParseException("empty decision payload");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new DecisionParseException("malformed decision payload: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new DecisionParseException("decision payload is not a JSON object");
        }

        JsonNode verification = root.path("document_verification");
        return new GroundedDecision(
                verdict(root.path("verdict").asText("")),
                root.path("coverage_applicable").asBoolean(false),
                fraudRisk(root.path("fraud_risk").asText("")),
                clampScore(root.path("fraud_score").asDouble(0.0)),
                strings(verification.path("declared_and_verified")),
                strings(verification.path("declared_but_unverified")),
                strings(verification.path("missing")),
                guidance(root.path("document_guidance")),
                strings(root.path("missing_documents")),
                strings(root.path("fraud_signals_found")),
                root.path("reason").asText(""),
                root.path("claimant_message").asText(""),
                strings(root.path("required_documents_checklist")),
                Math.max(0.0, root.path("estimated_coverage_amount").asDouble(0.0)),
                strings(root.path("policy_references")),
                strings(root.path("next_steps")),
                root.path("internal_notes").asText("")
        );
    }

    static String stripFences(String raw) {
        if (raw == null) {
            return "";
        }
        String text = raw.strip();
        if (text.startsWith("```json")) {
            text = text.substring("```json".length());
        } else if (text.startsWith("```")) {
            text = text.substring(3);
        }
        if (text.endsWith("```")) {
            text = text.substring(0, text.length() - 3);
        }
        return text.strip();
    }

    private static ClaimVerdict verdict(String value) {
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (ClaimVerdict verdict : ClaimVerdict.values()) {
            if (verdict.name().equals(normalized)) {
                return verdict;
            }
        }
        return ClaimVerdict.UNDER_INVESTIGATION;
    }

    private static FraudRiskBand fraudRisk(String value) {
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (FraudRiskBand band : FraudRiskBand.values()) {
            if (band.name().equals(normalized)) {
                return band;
            }
        }
        return FraudRiskBand.MEDIUM;
    }

    private static double clampScore(double score) {
        if (Double.isNaN(score)) {
            return 0.0;
        }
        return Math.min(Math.max(score, 0.0), 1.0);
    }

    private static List<String> strings(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node.isArray()) {
            for (JsonNode item : node) {
                if (item.isValueNode() && !item.asText().isBlank()) {
                    values.add(item.asText().trim());
                }
            }
        } else if (node.isTextual() && !node.asText().isBlank()) {
            values.add(node.asText().trim());
        }
        return values;
    }

    private static List<DocumentGuidance> guidance(JsonNode node) {
        List<DocumentGuidance> values = new ArrayList<>();
        if (!node.isArray()) {
            return values;
        }
        for (JsonNode item : node) {
            String document = item.path("document").asText("").trim();
            if (document.isEmpty()) {
                continue;
            }
            values.add(new DocumentGuidance(
                    document,
                    item.path("status").asText("MISSING"),
                    item.path("how_to_obtain").asText(""),
                    item.path("issuing_entity").asText(""),
                    item.path("typical_turnaround").asText(""),
                    item.path("typical_cost").asText(""),
                    item.path("contact").asText("")
            ));
        }
        return values;
    }
}
