package decision.engine.risk;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.Month;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

@Component
public class ExternalFactorAssessor {
    private static final List<String> HIGH_RISK_KEYWORDS = List.of("coastal", "flood", "seismic", "hurricane", "tornado");
    private static final double KEYWORD_PENALTY = 5;
    private static final Set<Month> HURRICANE_SEASON = EnumSet.of(Month.JUNE, Month.JULY, Month.AUGUST, Month.SEPTEMBER);
    private static final double SEASONAL_PENALTY = 3;

    private final Clock clock;

    public ExternalFactorAssessor(Clock clock) {
        this.clock = clock;
    }

    public RiskScore assess(ApplicantProfile profile) {
        String location = profile.location();
        double adjustment = 0;
        List<String> factors = new ArrayList<>();

        for (String keyword : HIGH_RISK_KEYWORDS) {
            if (location.contains(keyword)) {
                adjustment += KEYWORD_PENALTY;
                factors.add("High-risk location: " + keyword + " zone");
            }
        }

        Month month = LocalDate.now(clock).getMonth();
        if (HURRICANE_SEASON.contains(month) && (location.contains("coastal") || location.contains("florida"))) {
            adjustment += SEASONAL_PENALTY;
            factors.add("Hurricane season - coastal area");
        }

        return new RiskScore(adjustment, factors);
    }
}
