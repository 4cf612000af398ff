package decision.engine.risk;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

@Component
public class BaseRiskScorer {
    static final double BASELINE = 50.0;

    private static final int OPTIMAL_AGE_MIN = 25;
    private static final int OPTIMAL_AGE_MAX = 55;
    private static final double AGE_PENALTY_PER_YEAR = 0.3;
    private static final double MAX_AGE_PENALTY = 15;
    private static final Set<String> HIGH_RISK_OCCUPATIONS = Set.of("construction", "mining", "logging");
    private static final double OCCUPATION_PENALTY = 10;
    private static final double SMOKING_MULTIPLIER = 2.0;
    private static final double PENALTY_PER_CLAIM = 5;
    private static final double MAX_CLAIMS_PENALTY = 20;
    private static final int LOW_CREDIT = 600;
    private static final int EXCELLENT_CREDIT = 750;
    private static final double LOW_CREDIT_PENALTY = 15;
    private static final double EXCELLENT_CREDIT_BONUS = 5;

    public RiskScore score(ApplicantProfile profile) {
        double score = BASELINE;
        List<String> factors = new ArrayList<>();

        int age = profile.age();
        if (age > 0 && (age < OPTIMAL_AGE_MIN || age > OPTIMAL_AGE_MAX)) {
            double midpoint = (OPTIMAL_AGE_MIN + OPTIMAL_AGE_MAX) / 2.0;
            score += Math.min(Math.abs(age - midpoint) * AGE_PENALTY_PER_YEAR, MAX_AGE_PENALTY);
            factors.add("Age (" + age + ") outside optimal range");
        }

        if (HIGH_RISK_OCCUPATIONS.contains(profile.occupation())) {
            score += OCCUPATION_PENALTY;
            factors.add("High-risk occupation: " + profile.occupation());
        }

        if (profile.smoking()) {
            score *= SMOKING_MULTIPLIER;
            factors.add(String.format(Locale.ROOT, "Smoking status (risk multiplier: %.1fx)", SMOKING_MULTIPLIER));
        }

        int claims = profile.claimsHistoryCount();
        if (claims > 0) {
            score += Math.min(claims * PENALTY_PER_CLAIM, MAX_CLAIMS_PENALTY);
            factors.add(claims + " previous claims on record");
        }

        int credit = profile.creditScore();
        if (credit < LOW_CREDIT) {
            score += LOW_CREDIT_PENALTY;
            factors.add("Low credit score (" + credit + ")");
        } else if (credit > EXCELLENT_CREDIT) {
            score -= EXCELLENT_CREDIT_BONUS;
            factors.add("Excellent credit score (" + credit + ")");
        }

        return new RiskScore(clamp(score), factors);
    }

    static double clamp(double score) {
        return Math.min(Math.max(score, 0), 100);
    }
}
