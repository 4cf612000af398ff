package decision.engine.audit;

import decision.engine.advice.PolicyAnswer;
import decision.engine.claims.ClaimAdjudication;
import decision.engine.claims.ClaimSubmission;
import decision.engine.fraud.FraudAssessment;
import decision.engine.retrieval.IndexingResult;
import decision.engine.risk.RiskAssessment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class DecisionAuditLogger {
    private static final Logger log = LoggerFactory.getLogger(DecisionAuditLogger.class);

    public void logClaim(String requestId, ClaimSubmission claim, ClaimAdjudication adjudication, long processingMs) {
        log.info(
                "event=claim_adjudicated request_id={} policy={} amount={} declared_docs={} incident_types={} verdict={} source={} fraud_risk={} fraud_score={} insufficient_docs={} context_available={} processing_ms={}",
                requestId,
                redact(claim.policyNumber()),
                claim.claimAmount(),
                claim.submittedDocuments().size(),
                adjudication.incidentTypes(),
                adjudication.verdict(),
                adjudication.decisionSource(),
                adjudication.fraudRisk(),
                adjudication.fraudScore(),
                adjudication.missingDocuments().size(),
                adjudication.contextAvailable(),
                processingMs
        );
    }

    public void logClaimFailure(String requestId, ClaimSubmission claim, String reason, long processingMs) {
        log.warn(
                "event=claim_adjudication_failed request_id={} policy={} reason={} processing_ms={}",
                requestId,
                redact(claim.policyNumber()),
                reason,
                processingMs
        );
    }

    public void logRisk(String requestId, RiskAssessment assessment, long processingMs) {
        log.info(
                "event=risk_assessed request_id={} policy_type={} coverage={} risk_score={} decision={} confidence={} fraud_flagged={} compliant={} processing_ms={}",
                requestId,
                assessment.policyType(),
                assessment.coverageAmount(),
                assessment.riskScore(),
                assessment.decision(),
                assessment.confidence(),
                assessment.fraudDetails() != null,
                assessment.compliance() == null ? null : assessment.compliance().compliant(),
                processingMs
        );
    }

    public void logFraudCheck(String requestId, FraudAssessment assessment, long processingMs) {
        log.info(
                "event=fraud_checked request_id={} fraud_score={} suspicious={} risk_level={} confidence={} methods={} processing_ms={}",
                requestId,
                assessment.fraudScore(),
                assessment.suspicious(),
                assessment.riskLevel(),
                assessment.confidence(),
                assessment.detectionMethods().keySet(),
                processingMs
        );
    }

    public void logPolicyIndexed(String requestId, IndexingResult result, long processingMs) {
        log.info(
                "event=policy_index request_id={} source={} indexed={} flagged={} chunks={} processing_ms={}",
                requestId,
                result.source(),
                result.indexed(),
                result.flagged(),
                result.chunks(),
                processingMs
        );
    }

    public void logPolicyQuestion(String requestId, PolicyAnswer answer, long processingMs) {
        log.info(
                "event=policy_question request_id={} context_available={} answer_chars={} processing_ms={}",
                requestId,
                answer.contextAvailable(),
                answer.answer().length(),
                processingMs
        );
    }

    public static String redact(String policyNumber) {
        if (policyNumber == null || policyNumber.isBlank()) {
            return "N/A";
        }
        String trimmed = policyNumber.trim();
        if (trimmed.length() <= 4) {
            return "****";
        }
        return "****" + trimmed.substring(trimmed.length() - 4);
    }
}
