package decision.engine.claims;

public record DocumentGuidance(
        String document,
        String status,
        String howToObtain,
        String issuingEntity,
        String typicalTurnaround,
        String typicalCost,
        String contact
) {}
