package decision.engine.risk;

import java.util.List;

public record RiskScore(double value, List<String> factors) {
    public RiskScore {
        factors = factors == null ? List.of() : List.copyOf(factors);
    }

    public static RiskScore neutral(double value) {
        return new RiskScore(value, List.of());
    }
}
