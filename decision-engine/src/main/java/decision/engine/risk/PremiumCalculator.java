package decision.engine.risk;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;

@Component
public class PremiumCalculator {
    public static final double DEFAULT_COVERAGE = 100_000;

    private static final Map<String, Double> BASE_RATES = Map.of(
            "life", 500.0,
            "health", 3000.0,
            "auto", 1200.0,
            "home", 800.0
    );
    private static final double FALLBACK_BASE_RATE = 1000.0;

    public PremiumEstimate calculate(double riskScore, double coverageAmount, String policyType) {
        double baseRate = baseRate(policyType);
        double riskMultiplier = 1 + (riskScore / 100);
        double annual = (coverageAmount / 100_000) * baseRate * riskMultiplier;
        return new PremiumEstimate(
                round2(annual),
                round2(annual / 12),
                baseRate,
                round2(riskMultiplier),
                "USD"
        );
    }

    public static double baseRate(String policyType) {
        return BASE_RATES.getOrDefault(policyType, FALLBACK_BASE_RATE);
    }

    static double round2(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
