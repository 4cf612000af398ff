package decision.engine.risk;

import decision.engine.classify.Classification;
import decision.engine.classify.TextClassifier;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

@Component
public class FinancialSentimentAnalyzer {
    private static final double NEGATIVE_WEIGHT = 10;
    private static final double POSITIVE_WEIGHT = 5;

    private final TextClassifier classifier;

    public FinancialSentimentAnalyzer(@Qualifier("financialClassifier") TextClassifier classifier) {
        this.classifier = classifier;
    }

    public RiskScore analyze(ApplicantProfile profile) {
        String summary = String.format(Locale.ROOT,
                "Credit Score: %d%nClaims History: %d claims%nCoverage Years: %d years%nPayment History: %s",
                profile.creditScore(),
                profile.claimsHistoryCount(),
                profile.coverageYears(),
                profile.paymentHistory());

        Classification tone = classifier.classify(summary);
        double adjustment;
        if (tone.hasLabel("negative")) {
            adjustment = tone.score() * NEGATIVE_WEIGHT;
        } else if (tone.hasLabel("positive")) {
            adjustment = -tone.score() * POSITIVE_WEIGHT;
        } else {
            adjustment = 0;
        }
        return new RiskScore(adjustment, List.of(String.format(Locale.ROOT,
                "Financial profile tone: %s (%.2f)", tone.label().toLowerCase(Locale.ROOT), tone.score())));
    }
}
