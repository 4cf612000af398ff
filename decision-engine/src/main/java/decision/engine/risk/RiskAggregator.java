package decision.engine.risk;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import decision.engine.fraud.FraudAssessment;
import decision.engine.fraud.FraudEnsemble;
import decision.engine.llm.GenerationException;
import decision.engine.llm.GenerationService;
import decision.engine.retrieval.ContextRetriever;
import decision.engine.support.Outcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Combines the base score, financial tone, external factors and an optional fraud screen into one
 * underwriting decision.
 *
 * <p>Sub-computations run concurrently and share one deadline. A failed component falls back to a
 * neutral value (base 50, adjustments 0, no fraud signal, empty context) instead of failing the
 * assessment. A suspicious fraud screen short-circuits to {@code REJECT} at score 100.
 */
@Component
public class RiskAggregator {
    private static final Logger log = LoggerFactory.getLogger(RiskAggregator.class);

    static final String DEFAULT_POLICY_TYPE = "life";
    static final String FRAUD_REJECT_REASON = "Application flagged for potential fraud";
    static final String DETAILED_ASSESSMENT_UNAVAILABLE = "Detailed assessment unavailable";
    static final double FRAUD_WEIGHT = 30;
    static final double FRAUD_CONTRIBUTION_FLOOR = 0.5;
    static final int CONTEXT_K = 3;
    static final int TARGET_CREDIT_SCORE = 750;

    private static final String DETAILED_ASSESSMENT_PROMPT = """
            You are an expert insurance underwriter. Provide a detailed risk assessment.

            APPLICANT DATA:
            %s

            RISK SCORE: %.2f/100

            POLICY CONTEXT:
            %s

            Provide:
            1. Overall risk assessment summary
            2. Key risk factors identified
            3. Mitigation strategies
            4. Pricing rationale
            5. Compliance considerations

            Be specific, professional, and data-driven. Format as clear sections.
            """;

    private final ApplicantProfileParser parser;
    private final BaseRiskScorer baseScorer;
    private final FinancialSentimentAnalyzer financialAnalyzer;
    private final ExternalFactorAssessor externalAssessor;
    private final FraudEnsemble fraudEnsemble;
    private final ContextRetriever contextRetriever;
    private final GenerationService generationService;
    private final PremiumCalculator premiumCalculator;
    private final ComplianceChecker complianceChecker;
    private final DecisionThresholds thresholds;
    private final ObjectMapper objectMapper;
    private final ExecutorService executor;
    private final Clock clock;
    private final long taskTimeoutMs;

    public RiskAggregator(
            ApplicantProfileParser parser,
            BaseRiskScorer baseScorer,
            FinancialSentimentAnalyzer financialAnalyzer,
            ExternalFactorAssessor externalAssessor,
            FraudEnsemble fraudEnsemble,
            ContextRetriever contextRetriever,
            GenerationService generationService,
            PremiumCalculator premiumCalculator,
            ComplianceChecker complianceChecker,
            DecisionThresholds thresholds,
            ObjectMapper objectMapper,
            @Qualifier("decisionExecutor") ExecutorService executor,
            Clock clock,
            @Value("${decision.engine.risk.task-timeout-ms:15000}") long taskTimeoutMs
    ) {
        this.parser = parser;
        this.baseScorer = baseScorer;
        this.financialAnalyzer = financialAnalyzer;
        this.externalAssessor = externalAssessor;
        this.fraudEnsemble = fraudEnsemble;
        this.contextRetriever = contextRetriever;
        this.generationService = generationService;
        this.premiumCalculator = premiumCalculator;
        this.complianceChecker = complianceChecker;
        this.thresholds = thresholds;
        this.objectMapper = objectMapper;
        this.executor = executor;
        this.clock = clock;
        this.taskTimeoutMs = taskTimeoutMs;
    }

    public RiskAssessment assess(
            JsonNode applicantData,
            String policyType,
            Double coverageAmount,
            boolean fraudCheck,
            boolean explainability
    ) {
        String type = normalizePolicyType(policyType);
        requirePositiveCoverage(coverageAmount);
        ApplicantProfile profile = parser.parse(applicantData);

        try {
            String fraudText = fraudCheck ? objectMapper.writeValueAsString(applicantData) : null;
            return evaluate(profile, fraudText, type, coverageAmount, explainability);
        } catch (JsonProcessingException | RuntimeException e) {
            log.error("event=risk_assessment_failed policy_type={} error={}", type, e.getMessage(), e);
            return degraded(type, coverageAmount);
        }
    }

    public WhatIfComparison whatIf(JsonNode original, JsonNode modified, String policyType, Double coverageAmount) {
        RiskAssessment before = assess(original, policyType, coverageAmount, false, false);
        RiskAssessment after = assess(modified, policyType, coverageAmount, false, false);
        return new WhatIfComparison(
                before,
                after,
                PremiumCalculator.round2(after.riskScore() - before.riskScore()),
                PremiumCalculator.round2(annual(after) - annual(before)),
                PremiumCalculator.round2(monthly(after) - monthly(before)),
                before.decision() != after.decision()
        );
    }

    private RiskAssessment evaluate(
            ApplicantProfile profile,
            String fraudText,
            String policyType,
            Double coverageAmount,
            boolean explainability
    ) {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(taskTimeoutMs);

        CompletableFuture<RiskScore> base = CompletableFuture.supplyAsync(() -> baseScorer.score(profile), executor);
        CompletableFuture<RiskScore> financial =
                CompletableFuture.supplyAsync(() -> financialAnalyzer.analyze(profile), executor);
        CompletableFuture<RiskScore> external =
                CompletableFuture.supplyAsync(() -> externalAssessor.assess(profile), executor);
        CompletableFuture<String> context = explainability
                ? CompletableFuture.supplyAsync(() -> contextRetriever.retrieve(guidelineQuery(policyType), CONTEXT_K), executor)
                : CompletableFuture.completedFuture("");
        CompletableFuture<FraudAssessment> fraud = fraudText == null
                ? null
                : fraudEnsemble.assessAsync(fraudText, profile.toMap());

        RiskScore baseScore = orDefault("base_risk", Outcome.awaitUntil(base, deadline), RiskScore.neutral(BaseRiskScorer.BASELINE));
        RiskScore financialScore = orDefault("financial_risk", Outcome.awaitUntil(financial, deadline), RiskScore.neutral(0));
        RiskScore externalScore = orDefault("external_factors", Outcome.awaitUntil(external, deadline), RiskScore.neutral(0));
        String policyContext = orDefault("policy_context", Outcome.awaitUntil(context, deadline), "");
        FraudAssessment fraudResult = fraud == null ? null : orDefault("fraud", Outcome.awaitUntil(fraud, deadline), null);

        if (fraudResult != null && fraudResult.suspicious()) {
            log.info("event=risk_fraud_reject policy_type={} fraud_score={}", policyType, fraudResult.fraudScore());
            return fraudRejection(profile, policyType, coverageAmount, fraudResult);
        }

        double fraudScore = fraudResult == null ? 0.0 : fraudResult.fraudScore();
        double fraudContribution = fraudScore > FRAUD_CONTRIBUTION_FLOOR ? fraudScore * FRAUD_WEIGHT : 0.0;
        double finalScore = BaseRiskScorer.clamp(
                baseScore.value() + financialScore.value() + externalScore.value() + fraudContribution);

        DecisionThresholds.Ruling ruling = thresholds.decide(finalScore);
        PremiumEstimate premium = premiumCalculator.calculate(
                finalScore,
                coverageAmount == null ? PremiumCalculator.DEFAULT_COVERAGE : coverageAmount,
                policyType);

        Map<String, Double> breakdown = new LinkedHashMap<>();
        breakdown.put("base_risk", baseScore.value());
        breakdown.put("financial_risk", financialScore.value());
        breakdown.put("external_factors", externalScore.value());
        breakdown.put("fraud_risk", fraudScore);

        List<String> factors = new ArrayList<>(baseScore.factors());
        factors.addAll(financialScore.factors());
        factors.addAll(externalScore.factors());

        String detailed = explainability ? detailedAssessment(profile, finalScore, policyContext) : "";
        List<ScenarioOutcome> scenarios = explainability
                ? scenarios(profile, policyType, coverageAmount, finalScore, premium)
                : List.of();

        return new RiskAssessment(
                PremiumCalculator.round2(finalScore),
                ruling.decision(),
                ruling.confidence(),
                premium,
                policyType,
                coverageAmount,
                breakdown,
                factors,
                recommendations(finalScore, profile),
                detailed,
                complianceChecker.check(profile, policyType),
                scenarios,
                null,
                null,
                clock.instant()
        );
    }

    private RiskAssessment fraudRejection(
            ApplicantProfile profile,
            String policyType,
            Double coverageAmount,
            FraudAssessment fraud
    ) {
        Map<String, Double> breakdown = new LinkedHashMap<>();
        breakdown.put("fraud_risk", fraud.fraudScore());
        return new RiskAssessment(
                100.0,
                UnderwritingDecision.REJECT,
                fraud.confidence(),
                null,
                policyType,
                coverageAmount,
                breakdown,
                fraud.indicators(),
                List.of("Escalate to fraud investigation unit"),
                "",
                complianceChecker.check(profile, policyType),
                List.of(),
                FRAUD_REJECT_REASON,
                fraud,
                clock.instant()
        );
    }

    private RiskAssessment degraded(String policyType, Double coverageAmount) {
        return new RiskAssessment(
                50.0,
                UnderwritingDecision.MANUAL_REVIEW,
                0.0,
                null,
                policyType,
                coverageAmount,
                Map.of(),
                List.of(),
                List.of("Requires manual underwriting review"),
                "",
                null,
                List.of(),
                "Automated assessment could not be completed",
                null,
                clock.instant()
        );
    }

    private String detailedAssessment(ApplicantProfile profile, double score, String policyContext) {
        try {
            String applicant = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(profile.toMap());
            String prompt = String.format(Locale.ROOT, DETAILED_ASSESSMENT_PROMPT, applicant, score, policyContext);
            return generationService.generate(prompt, 0.3, 1500);
        } catch (JsonProcessingException | GenerationException e) {
            log.warn("event=detailed_assessment_failed error={}", e.getMessage());
            return DETAILED_ASSESSMENT_UNAVAILABLE;
        }
    }

    private List<ScenarioOutcome> scenarios(
            ApplicantProfile profile,
            String policyType,
            Double coverageAmount,
            double score,
            PremiumEstimate premium
    ) {
        List<ScenarioOutcome> scenarios = new ArrayList<>(2);
        if (profile.smoking()) {
            RiskAssessment rerun = evaluate(profile.withSmoking(false), null, policyType, coverageAmount, false);
            scenarios.add(scenario("smoking_cessation", rerun, score, premium, "Up to 30% reduction"));
        }
        if (profile.creditScore() < TARGET_CREDIT_SCORE) {
            RiskAssessment rerun = evaluate(profile.withCreditScore(TARGET_CREDIT_SCORE), null, policyType, coverageAmount, false);
            scenarios.add(scenario("credit_improvement", rerun, score, premium,
                    "Target credit score 750; estimated 5-10% premium reduction"));
        }
        return scenarios;
    }

    private static ScenarioOutcome scenario(
            String name,
            RiskAssessment rerun,
            double score,
            PremiumEstimate premium,
            String note
    ) {
        return new ScenarioOutcome(
                name,
                PremiumCalculator.round2(rerun.riskScore() - score),
                PremiumCalculator.round2(annual(rerun) - premium.annual()),
                rerun.decision(),
                note
        );
    }

    static List<String> recommendations(double score, ApplicantProfile profile) {
        List<String> recommendations = new ArrayList<>();
        if (profile.smoking()) {
            recommendations.add("Smoking cessation program can reduce premium by up to 30%");
        }
        if (profile.creditScore() < 700) {
            recommendations.add("Improving credit score can qualify for better rates");
        }
        if (profile.claimsHistoryCount() > 2) {
            recommendations.add("Consider higher deductible to lower premium");
        }
        if (score > 70) {
            recommendations.add("Additional medical examination may improve risk assessment");
        }
        if (recommendations.isEmpty()) {
            recommendations.add("Maintain current health and financial status for continued favorable rates");
        }
        return recommendations;
    }

    private static <T> T orDefault(String component, Outcome<T> outcome, T fallback) {
        if (!outcome.succeeded()) {
            log.warn("event=risk_component_failed component={} error={}", component, outcome.errorSummary());
        }
        return outcome.orElse(fallback);
    }

    static String normalizePolicyType(String policyType) {
        return policyType == null || policyType.isBlank()
                ? DEFAULT_POLICY_TYPE
                : policyType.trim().toLowerCase(Locale.ROOT);
    }

    static String guidelineQuery(String policyType) {
        return "Underwriting guidelines for " + policyType + " insurance";
    }

    private static void requirePositiveCoverage(Double coverageAmount) {
        if (coverageAmount != null && (coverageAmount.isNaN() || coverageAmount <= 0)) {
            throw new IllegalArgumentException("coverage amount must be positive");
        }
    }

    private static double annual(RiskAssessment assessment) {
        return assessment.premium() == null ? 0.0 : assessment.premium().annual();
    }

    private static double monthly(RiskAssessment assessment) {
        return assessment.premium() == null ? 0.0 : assessment.premium().monthly();
    }
}
