package decision.engine.risk;

public record ScenarioOutcome(
        String scenario,
        double riskScoreChange,
        double annualPremiumChange,
        UnderwritingDecision decision,
        String note
) {}
