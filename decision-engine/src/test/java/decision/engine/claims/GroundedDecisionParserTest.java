package decision.engine.claims;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GroundedDecisionParserTest {
    private final GroundedDecisionParser parser = new GroundedDecisionParser(new ObjectMapper());

    @Test
    void shouldParseFencedDecision() throws Exception {
        GroundedDecision decision = parser.parse("""
                ```json
                {
                  "verdict": "pending_documents",
                  "coverage_applicable": true,
                  "fraud_risk": "low",
                  "fraud_score": 0.12,
                  "document_verification": {
                    "declared_and_verified": ["Police Report"],
                    "declared_but_unverified": ["Photos"],
                    "missing": ["Driver's Licence Copy", ""]
                  },
                  "document_guidance": [
                    {"document": "Photos", "status": "DECLARED_BUT_UNVERIFIED", "how_to_obtain": "Upload originals"},
                    {"document": "", "status": "MISSING"}
                  ],
                  "reason": "Awaiting documents.",
                  "estimated_coverage_amount": 3800.5,
                  "next_steps": "Upload the photos"
                }
                ```
                """);

        assertEquals(ClaimVerdict.PENDING_DOCUMENTS, decision.verdict());
        assertTrue(decision.coverageApplicable());
        assertEquals(FraudRiskBand.LOW, decision.fraudRisk());
        assertEquals(0.12, decision.fraudScore());
        assertEquals(List.of("Police Report"), decision.verified());
        assertEquals(List.of("Photos"), decision.unverified());
        assertEquals(List.of("Driver's Licence Copy"), decision.missing());
        assertEquals(1, decision.guidance().size());
        assertEquals("Upload originals", decision.guidance().get(0).howToObtain());
        assertEquals(3800.5, decision.estimatedCoverageAmount());
        assertEquals(List.of("Upload the photos"), decision.nextSteps());
        assertEquals("", decision.internalNotes());
    }

    @Test
    void shouldDefaultUnknownVerdictAndBand() throws Exception {
        GroundedDecision decision = parser.parse("{\"verdict\": \"MAYBE\", \"fraud_risk\": \"SEVERE\", \"fraud_score\": 4.2}");

        assertEquals(ClaimVerdict.UNDER_INVESTIGATION, decision.verdict());
        assertEquals(FraudRiskBand.MEDIUM, decision.fraudRisk());
        assertEquals(1.0, decision.fraudScore());
    }

    @Test
    void shouldRejectMalformedPayloads() {
        assertThrows(DecisionParseException.class, () -> parser.parse(""));
        assertThrows(DecisionParseException.class, () -> parser.parse(null));
        assertThrows(DecisionParseException.class, () -> parser.parse("```\n```"));
        assertThrows(DecisionParseException.class, () -> parser.parse("{\"verdict\": "));
        assertThrows(DecisionParseException.class, () -> parser.parse("[\"APPROVED\"]"));
    }

    @Test
    void shouldStripPlainFences() {
        assertEquals("{}", GroundedDecisionParser.stripFences("```\n{}\n```"));
        assertEquals("{}", GroundedDecisionParser.stripFences("  {}  "));
    }
}
