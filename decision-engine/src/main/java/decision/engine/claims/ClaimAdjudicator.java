package decision.engine.claims;

import decision.engine.fraud.FraudAssessment;
import decision.engine.fraud.FraudEnsemble;
import decision.engine.fraud.StatisticalSignalDetector;
import decision.engine.llm.GenerationException;
import decision.engine.llm.GenerationService;
import decision.engine.policy.ClaimantMessagePolicy;
import decision.engine.retrieval.ContextRetriever;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Staged claim pipeline: fraud pre-filter, policy context retrieval, grounded decision, parse, overrides
 * and message enrichment.
 *
 * <p>A suspicious pre-filter ends the pipeline with an investigator hand-off. A malformed grounded
 * decision is replaced by a deterministic manual-review result. Only a generation failure after retries
 * escapes, as {@link AdjudicationException}.
 */
@Component
public class ClaimAdjudicator {
    private static final Logger log = LoggerFactory.getLogger(ClaimAdjudicator.class);

    static final double TEMPERATURE = 0.1;
    static final int MAX_TOKENS = 2000;

    static final List<String> INVESTIGATION_CHECKLIST = List.of(
            "Government-issued photo ID",
            "Original policy certificate",
            "Incident report / police report",
            "Two independent witness statements",
            "Photographs of damage / evidence",
            "Itemised cost estimate or receipts"
    );
    static final List<String> FALLBACK_CHECKLIST = List.of("Incident report", "Photo evidence", "Policy certificate");
    static final String FALLBACK_REASON = "Claim routed for manual review due to a processing anomaly.";

    private final FraudEnsemble fraudEnsemble;
    private final ContextRetriever contextRetriever;
    private final GenerationService generationService;
    private final GroundedDecisionParser parser;
    private final ClaimContextBuilder contextBuilder;
    private final ClaimPromptBuilder promptBuilder;
    private final ClaimantMessagePolicy messagePolicy;
    private final DocumentGuidanceCatalog guidanceCatalog;
    private final MeterRegistry meterRegistry;
    private final double fraudOverrideThreshold;
    private final int contextK;

    public ClaimAdjudicator(
            FraudEnsemble fraudEnsemble,
            ContextRetriever contextRetriever,
            GenerationService generationService,
            GroundedDecisionParser parser,
            ClaimContextBuilder contextBuilder,
            ClaimPromptBuilder promptBuilder,
            ClaimantMessagePolicy messagePolicy,
            DocumentGuidanceCatalog guidanceCatalog,
            MeterRegistry meterRegistry,
            @Value("${decision.engine.claims.fraud-override-threshold:0.65}") double fraudOverrideThreshold,
            @Value("${decision.engine.claims.context-k:5}") int contextK
    ) {
        if (fraudOverrideThreshold < 0.0 || fraudOverrideThreshold > 1.0) {
            throw new IllegalStateException("fraud override threshold must be within [0, 1]: " + fraudOverrideThreshold);
        }
        this.fraudEnsemble = fraudEnsemble;
        this.contextRetriever = contextRetriever;
        this.generationService = generationService;
        this.parser = parser;
        this.contextBuilder = contextBuilder;
        this.promptBuilder = promptBuilder;
        this.messagePolicy = messagePolicy;
        this.guidanceCatalog = guidanceCatalog;
        this.meterRegistry = meterRegistry;
        this.fraudOverrideThreshold = fraudOverrideThreshold;
        this.contextK = Math.max(1, contextK);
    }

    public ClaimAdjudication adjudicate(ClaimSubmission submission) {
        ClaimContext context = contextBuilder.build(submission);

        FraudAssessment prefilter = fraudEnsemble.assess(submission.narrative(), fraudMetadata(submission));
        if (prefilter.suspicious()) {
            log.warn("event=claim_prefilter_flagged fraud_score={} indicators={}",
                    prefilter.fraudScore(), prefilter.indicators().size());
            return investigatorHandoff(context, prefilter);
        }

        String policyContext = retrieveContext(submission.narrative());

        String raw;
        try {
            raw = generationService.generate(promptBuilder.build(context, policyContext), TEMPERATURE, MAX_TOKENS);
        } catch (GenerationException e) {
            throw new AdjudicationException("grounded decision unavailable", e);
        }

        GroundedDecision grounded;
        DecisionSource source;
        try {
            grounded = parser.parse(raw);
            source = DecisionSource.GROUNDED;
        } catch (DecisionParseException e) {
            log.warn("event=claim_parse_fallback error={} raw_prefix={}", e.getMessage(), prefix(raw));
            grounded = parseFallback(prefilter.fraudScore(), e.getMessage());
            source = DecisionSource.PARSE_FALLBACK;
        }

        return applyOverrides(context, grounded, source, prefilter, !policyContext.isBlank());
    }

    private ClaimAdjudication applyOverrides(
            ClaimContext context,
            GroundedDecision grounded,
            DecisionSource source,
            FraudAssessment prefilter,
            boolean contextAvailable
    ) {
        ClaimSubmission submission = context.submission();
        ClaimVerdict verdict = grounded.verdict();
        FraudRiskBand fraudRisk = grounded.fraudRisk();
        String internalNotes = grounded.internalNotes();
        double prefilterScore = prefilter.fraudScore();

        if (prefilterScore >= fraudOverrideThreshold && verdict == ClaimVerdict.APPROVED) {
            log.warn("event=claim_override rule=fraud_score from={} to={} fraud_score={}",
                    verdict, ClaimVerdict.UNDER_INVESTIGATION, prefilterScore);
            countOverride("fraud_score");
            verdict = ClaimVerdict.UNDER_INVESTIGATION;
            fraudRisk = FraudRiskBand.HIGH;
            internalNotes = String.format(Locale.ROOT, "Overridden by fraud ensemble (score %.3f). ", prefilterScore)
                    + internalNotes;
        }

        List<String> checklist = source == DecisionSource.PARSE_FALLBACK
                ? new ArrayList<>(FALLBACK_CHECKLIST)
                : checklist(context.requiredDocuments(), grounded);
        DocumentStatus status = DocumentStatus.partition(
                checklist,
                grounded.verified(),
                grounded.unverified(),
                grounded.missing(),
                submission.submittedDocuments());

        List<String> merged = new ArrayList<>(grounded.missingDocuments());
        merged.addAll(grounded.unverified());
        merged.addAll(grounded.missing());
        merged.addAll(status.insufficient());
        List<String> insufficient = DocumentStatus.distinct(merged);

        if (!insufficient.isEmpty() && verdict == ClaimVerdict.APPROVED) {
            log.info("event=claim_override rule=insufficient_documents from={} to={} documents={}",
                    verdict, ClaimVerdict.PENDING_DOCUMENTS, insufficient.size());
            countOverride("insufficient_documents");
            verdict = ClaimVerdict.PENDING_DOCUMENTS;
        }

        String message = messagePolicy.apply(verdict, grounded.claimantMessage(), grounded.reason(), insufficient);
        List<DocumentGuidance> guidance = verdict == ClaimVerdict.PENDING_DOCUMENTS
                ? guidanceCatalog.complete(grounded.guidance(), status)
                : grounded.guidance();

        return new ClaimAdjudication(
                verdict,
                grounded.coverageApplicable(),
                fraudRisk,
                round3(Math.max(prefilterScore, grounded.fraudScore())),
                status,
                insufficient,
                guidance,
                grounded.fraudSignals(),
                grounded.reason(),
                message,
                checklist,
                grounded.estimatedCoverageAmount(),
                grounded.policyReferences(),
                grounded.nextSteps(),
                internalNotes,
                submission.submittedDocuments(),
                context.incidentTypes(),
                source,
                contextAvailable
        );
    }

    private ClaimAdjudication investigatorHandoff(ClaimContext context, FraudAssessment prefilter) {
        ClaimSubmission submission = context.submission();
        DocumentStatus status = DocumentStatus.partition(
                INVESTIGATION_CHECKLIST, List.of(), List.of(), List.of(), submission.submittedDocuments());
        List<String> signals = prefilter.indicators().isEmpty()
                ? List.of("Multiple automated fraud signals detected")
                : prefilter.indicators();

        return new ClaimAdjudication(
                ClaimVerdict.UNDER_INVESTIGATION,
                false,
                FraudRiskBand.HIGH,
                round3(prefilter.fraudScore()),
                status,
                status.insufficient(),
                List.of(),
                signals,
                "Our automated fraud screening identified high-risk signals in this submission. In line with "
                        + "company policy and regulatory obligations the claim has been referred to a senior "
                        + "claims investigator for manual review.",
                "Dear Claimant,\n\n"
                        + "Thank you for submitting your claim. Some aspects of it need further review by our "
                        + "specialist claims team, and a dedicated investigator will contact you within 2-3 "
                        + "business days.\n\n"
                        + "You are welcome to re-submit with additional supporting documentation at any time.\n\n"
                        + "Warm regards,\nPolicyGenie Claims Department",
                INVESTIGATION_CHECKLIST,
                0.0,
                List.of(),
                List.of(
                        "A senior claims investigator will contact you within 2-3 business days.",
                        "Gather all supporting documents and keep them ready.",
                        "Do not repair or dispose of damaged items until the investigation is complete.",
                        "You may re-submit with additional evidence at any time."
                ),
                String.format(Locale.ROOT, "Fraud ensemble score %.3f. Signals: %s. Manual investigation required before any payment.",
                        prefilter.fraudScore(), prefilter.indicators()),
                submission.submittedDocuments(),
                context.incidentTypes(),
                DecisionSource.FRAUD_PREFILTER,
                false
        );
    }

    private static GroundedDecision parseFallback(double fraudScore, String error) {
        return new GroundedDecision(
                ClaimVerdict.UNDER_INVESTIGATION,
                false,
                FraudRiskBand.MEDIUM,
                fraudScore,
                List.of(),
                List.of(),
                List.of(),
                List.of(),
                List.of(),
                List.of("System could not fully evaluate the claim narrative"),
                FALLBACK_REASON,
                "Dear Claimant,\n\nYour claim is being reviewed by our team. We will contact you within 2-3 "
                        + "business days.\n\nWarm regards,\nPolicyGenie Claims Department",
                FALLBACK_CHECKLIST,
                0.0,
                List.of(),
                List.of("Await contact from a claims representative within 2-3 business days."),
                "Decision parse error: " + error
        );
    }

    private String retrieveContext(String narrative) {
        try {
            return contextRetriever.retrieve(narrative, contextK);
        } catch (RuntimeException e) {
            log.warn("event=claim_context_unavailable error={}", e.getMessage());
            return "";
        }
    }

    private static List<String> checklist(List<String> required, GroundedDecision grounded) {
        List<String> all = new ArrayList<>(required);
        all.addAll(grounded.verified());
        all.addAll(grounded.unverified());
        all.addAll(grounded.missing());
        return DocumentStatus.distinct(all);
    }

    private static Map<String, Object> fraudMetadata(ClaimSubmission submission) {
        return submission.claimAmount() == null
                ? Map.of()
                : Map.of(StatisticalSignalDetector.CLAIM_AMOUNT, submission.claimAmount());
    }

    private void countOverride(String rule) {
        Counter.builder("decision_engine_overrides_total")
                .tag("rule", rule)
                .register(meterRegistry)
                .increment();
    }

    private static String prefix(String raw) {
        if (raw == null) {
            return "";
        }
        return raw.length() <= 200 ? raw : raw.substring(0, 200);
    }

    static double round3(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }
}
