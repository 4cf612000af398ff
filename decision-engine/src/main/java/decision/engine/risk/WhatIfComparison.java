package decision.engine.risk;

public record WhatIfComparison(
        RiskAssessment original,
        RiskAssessment modified,
        double riskScoreDelta,
        double annualPremiumDelta,
        double monthlyPremiumDelta,
        boolean decisionChanged
) {}
