package decision.engine.claims;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

@Component
public class ClaimPromptBuilder {
    static final String NO_CONTEXT =
            "No policy document is available. Treat every coverage reference as UNVERIFIABLE.";
    private static final String NOT_PROVIDED = "NOT PROVIDED";

    private static final String TEMPLATE = """
            You are a senior insurance claims adjudicator. Protect the insurer from fraudulent, invalid
            and under-documented claims while treating legitimate claimants fairly.

            === POLICY CONTEXT ===
            %s

            === CLAIM ===
            Claimant name     : %s
            Policy number     : %s
            Incident date     : %s
            Incident location : %s
            Claim amount      : %s
            Declared documents:
            %s

            Narrative:
            %s

            === DOCUMENTS ===
            Declaring a document on the form is not proof that it exists. For every document in the
            mandatory checklist below decide exactly one status:
              VERIFIED_BY_NARRATIVE   the narrative gives details only that document would provide
                                      (report number, officer, repairer and amount, doctor, issuing authority)
              DECLARED_BUT_UNVERIFIED declared, but the narrative does not support it
              MISSING                 not declared at all

            Mandatory checklist (%s):
            %s

            === FRAUD SIGNALS ===
            Urgency language, vague narrative without verifiable specifics, suspiciously round or very high
            amounts, all evidence lost or unavailable, repeated recent claims, declared documents that the
            narrative does not support. Count them: 0-1 LOW, 2-3 MEDIUM, 4 or more HIGH.

            === VERDICT (first matching rule wins) ===
              A. fraud_risk is HIGH                                  -> UNDER_INVESTIGATION
              B. the incident is not covered by the policy           -> REJECTED
              C. any document MISSING or DECLARED_BUT_UNVERIFIED     -> PENDING_DOCUMENTS
              D. every document VERIFIED_BY_NARRATIVE, all checks ok -> APPROVED

            For every MISSING or DECLARED_BUT_UNVERIFIED document explain how to obtain it.

            Respond with ONLY this JSON object, no markdown and no extra text:
            {
              "verdict": "APPROVED | PENDING_DOCUMENTS | UNDER_INVESTIGATION | REJECTED",
              "coverage_applicable": true,
              "fraud_risk": "LOW | MEDIUM | HIGH",
              "fraud_score": 0.0,
              "document_verification": {
                "declared_and_verified": [],
                "declared_but_unverified": [],
                "missing": []
              },
              "document_guidance": [
                {"document": "", "status": "MISSING | DECLARED_BUT_UNVERIFIED", "how_to_obtain": "",
                 "issuing_entity": "", "typical_turnaround": "", "typical_cost": "", "contact": ""}
              ],
              "missing_documents": [],
              "fraud_signals_found": [],
              "reason": "",
              "claimant_message": "",
              "required_documents_checklist": [],
              "estimated_coverage_amount": 0.0,
              "policy_references": [],
              "next_steps": [],
              "internal_notes": ""
            }
            """;

    public String build(ClaimContext context, String policyContext) {
        ClaimSubmission claim = context.submission();
        return String.format(Locale.ROOT, TEMPLATE,
                policyContext == null || policyContext.isBlank() ? NO_CONTEXT : policyContext,
                orNotProvided(claim.claimantName()),
                orNotProvided(claim.policyNumber()),
                orNotProvided(claim.incidentDate()),
                orNotProvided(claim.incidentLocation()),
                claim.claimAmount() == null ? NOT_PROVIDED : String.format(Locale.US, "$%,.2f", claim.claimAmount()),
                bulletList(claim.submittedDocuments(), "NONE"),
                claim.narrative(),
                context.incidentTypes().stream().map(t -> t.name().toLowerCase(Locale.ROOT)).collect(Collectors.joining(", ")),
                bulletList(context.requiredDocuments(), "NONE"));
    }

    private static String orNotProvided(String value) {
        return value == null || value.isBlank() ? NOT_PROVIDED : value;
    }

    private static String bulletList(List<String> items, String empty) {
        if (items.isEmpty()) {
            return "  " + empty;
        }
        return items.stream().map(item -> "  - " + item).collect(Collectors.joining("\n"));
    }
}
