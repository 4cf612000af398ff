package decision.engine.risk;

public record PremiumEstimate(
        double annual,
        double monthly,
        double baseRate,
        double riskMultiplier,
        String currency
) {}
