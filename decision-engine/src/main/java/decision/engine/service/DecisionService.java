package decision.engine.service;

import decision.engine.advice.PolicyAdvisor;
import decision.engine.advice.PolicyAnswer;
import decision.engine.api.model.ClaimRequest;
import decision.engine.api.model.DecisionResponse;
import decision.engine.api.model.FraudBatchRequest;
import decision.engine.api.model.FraudCheckRequest;
import decision.engine.api.model.PolicyIndexRequest;
import decision.engine.api.model.PolicyQuestionRequest;
import decision.engine.api.model.RiskAssessmentRequest;
import decision.engine.api.model.WhatIfRequest;
import decision.engine.audit.DecisionAuditLogger;
import decision.engine.cache.AssessmentCache;
import decision.engine.cache.CacheStats;
import decision.engine.claims.AdjudicationException;
import decision.engine.claims.ClaimAdjudication;
import decision.engine.claims.ClaimAdjudicator;
import decision.engine.claims.ClaimSubmission;
import decision.engine.fraud.FraudAssessment;
import decision.engine.fraud.FraudEnsemble;
import decision.engine.retrieval.IndexingResult;
import decision.engine.retrieval.PolicyDocumentIndexer;
import decision.engine.retrieval.TextExtractor;
import decision.engine.retrieval.UploadScreen;
import decision.engine.risk.RiskAggregator;
import decision.engine.risk.RiskAssessment;
import decision.engine.risk.WhatIfComparison;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

@Service
public class DecisionService {
    private static final int MIN_EXTRACTED_LENGTH = 50;

    private final ClaimAdjudicator claimAdjudicator;
    private final RiskAggregator riskAggregator;
    private final FraudEnsemble fraudEnsemble;
    private final PolicyDocumentIndexer policyIndexer;
    private final TextExtractor textExtractor;
    private final UploadScreen uploadScreen;
    private final PolicyAdvisor policyAdvisor;
    private final AssessmentCache cache;
    private final DecisionAuditLogger auditLogger;
    private final MeterRegistry meterRegistry;
    private final int maxBatchSize;

    public DecisionService(
            ClaimAdjudicator claimAdjudicator,
            RiskAggregator riskAggregator,
            FraudEnsemble fraudEnsemble,
            PolicyDocumentIndexer policyIndexer,
            TextExtractor textExtractor,
            UploadScreen uploadScreen,
            PolicyAdvisor policyAdvisor,
            AssessmentCache cache,
            DecisionAuditLogger auditLogger,
            MeterRegistry meterRegistry,
            @Value("${decision.engine.fraud.max-batch-size:100}") int maxBatchSize
    ) {
        this.claimAdjudicator = claimAdjudicator;
        this.riskAggregator = riskAggregator;
        this.fraudEnsemble = fraudEnsemble;
        this.policyIndexer = policyIndexer;
        this.textExtractor = textExtractor;
        this.uploadScreen = uploadScreen;
        this.policyAdvisor = policyAdvisor;
        this.cache = cache;
        this.auditLogger = auditLogger;
        this.meterRegistry = meterRegistry;
        this.maxBatchSize = maxBatchSize;
    }

    public DecisionResponse<ClaimAdjudication> submitClaim(String requestId, ClaimRequest request) {
        ClaimSubmission submission = request.toSubmission();
        long startNs = System.nanoTime();
        ClaimAdjudication adjudication;
        try {
            adjudication = claimAdjudicator.adjudicate(submission);
        } catch (AdjudicationException e) {
            long failedMs = elapsedMs(startNs);
            count("decision_engine_claims_total", "verdict", "ERROR");
            auditLogger.logClaimFailure(requestId, submission, e.getMessage(), failedMs);
            throw e;
        }
        long processingMs = elapsedMs(startNs);

        count("decision_engine_claims_total", "verdict", adjudication.verdict().name());
        record("decision_engine_claim_latency", processingMs);
        auditLogger.logClaim(requestId, submission, adjudication, processingMs);
        return new DecisionResponse<>(requestId, adjudication, processingMs);
    }

    public DecisionResponse<RiskAssessment> assessRisk(String requestId, RiskAssessmentRequest request) {
        long startNs = System.nanoTime();
        RiskAssessment assessment = riskAggregator.assess(
                request.applicantData(),
                request.policyType(),
                request.coverageAmount(),
                request.fraudCheck(),
                request.explainability()
        );
        long processingMs = elapsedMs(startNs);

        count("decision_engine_risk_total", "decision", assessment.decision().name());
        record("decision_engine_risk_latency", processingMs);
        auditLogger.logRisk(requestId, assessment, processingMs);
        return new DecisionResponse<>(requestId, assessment, processingMs);
    }

    public DecisionResponse<WhatIfComparison> whatIf(String requestId, WhatIfRequest request) {
        if (request.originalData() == null || request.modifiedData() == null) {
            throw new IllegalArgumentException("both original and modified applicant data are required");
        }
        long startNs = System.nanoTime();
        WhatIfComparison comparison = riskAggregator.whatIf(
                request.originalData(),
                request.modifiedData(),
                request.policyType(),
                request.coverageAmount()
        );
        long processingMs = elapsedMs(startNs);

        record("decision_engine_what_if_latency", processingMs);
        auditLogger.logRisk(requestId, comparison.modified(), processingMs);
        return new DecisionResponse<>(requestId, comparison, processingMs);
    }

    public DecisionResponse<FraudAssessment> checkFraud(String requestId, FraudCheckRequest request) {
        requireText(request);
        long startNs = System.nanoTime();
        FraudAssessment assessment = fraudEnsemble.assess(request.text(), request.safeMetadata());
        long processingMs = elapsedMs(startNs);

        count("decision_engine_fraud_checks_total", "risk_level", assessment.riskLevel().name());
        record("decision_engine_fraud_check_latency", processingMs);
        auditLogger.logFraudCheck(requestId, assessment, processingMs);
        return new DecisionResponse<>(requestId, assessment, processingMs);
    }

    public DecisionResponse<List<FraudAssessment>> checkFraudBatch(String requestId, FraudBatchRequest request) {
        List<FraudCheckRequest> items = request.safeItems();
        if (items.isEmpty()) {
            throw new IllegalArgumentException("batch must contain at least one item");
        }
        if (items.size() > maxBatchSize) {
            throw new IllegalArgumentException("batch exceeds the maximum of " + maxBatchSize + " items");
        }
        List<String> texts = new ArrayList<>(items.size());
        List<Map<String, Object>> metadata = new ArrayList<>(items.size());
        for (FraudCheckRequest item : items) {
            requireText(item);
            texts.add(item.text());
            metadata.add(item.safeMetadata());
        }

        long startNs = System.nanoTime();
        List<FraudAssessment> assessments = fraudEnsemble.assessAll(texts, metadata);
        long processingMs = elapsedMs(startNs);

        for (FraudAssessment assessment : assessments) {
            count("decision_engine_fraud_checks_total", "risk_level", assessment.riskLevel().name());
            auditLogger.logFraudCheck(requestId, assessment, processingMs);
        }
        record("decision_engine_fraud_check_latency", processingMs);
        return new DecisionResponse<>(requestId, assessments, processingMs);
    }

    public DecisionResponse<IndexingResult> indexPolicy(String requestId, PolicyIndexRequest request) {
        long startNs = System.nanoTime();
        IndexingResult result = policyIndexer.index(request.text(), request.source());
        long processingMs = elapsedMs(startNs);

        record("decision_engine_policy_index_latency", processingMs);
        auditLogger.logPolicyIndexed(requestId, result, processingMs);
        return new DecisionResponse<>(requestId, result, processingMs);
    }

    public DecisionResponse<IndexingResult> uploadPolicy(String requestId, String filename, byte[] content) {
        uploadScreen.check(filename, content);
        String text = textExtractor.extract(content);
        if (text == null || text.strip().length() < MIN_EXTRACTED_LENGTH) {
            throw new IllegalArgumentException("could not extract text from the document; it may be empty or not plain text");
        }
        return indexPolicy(requestId, new PolicyIndexRequest(text, filename));
    }

    public DecisionResponse<PolicyAnswer> askPolicy(String requestId, PolicyQuestionRequest request) {
        long startNs = System.nanoTime();
        PolicyAnswer answer = policyAdvisor.answer(request == null ? null : request.question());
        long processingMs = elapsedMs(startNs);

        count("decision_engine_policy_questions_total", "context", String.valueOf(answer.contextAvailable()));
        record("decision_engine_policy_question_latency", processingMs);
        auditLogger.logPolicyQuestion(requestId, answer, processingMs);
        return new DecisionResponse<>(requestId, answer, processingMs);
    }

    public CacheStats cacheStats() {
        return cache.stats();
    }

    public void clearFraudCache() {
        cache.clearNamespace(FraudEnsemble.CACHE_NAMESPACE);
    }

    private static void requireText(FraudCheckRequest request) {
        if (request == null || request.text() == null || request.text().isBlank()) {
            throw new IllegalArgumentException("text must not be empty");
        }
    }

    private void count(String name, String tag, String value) {
        Counter.builder(name)
                .tag(tag, value)
                .register(meterRegistry)
                .increment();
    }

    private void record(String name, long processingMs) {
        Timer.builder(name)
                .publishPercentileHistogram()
                .register(meterRegistry)
                .record(processingMs, TimeUnit.MILLISECONDS);
    }

    private static long elapsedMs(long startNs) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNs);
    }
}
